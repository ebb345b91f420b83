package edu.upf.taln.penman.core.model;

import edu.upf.taln.penman.core.ModelException;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class ModelReaderTest
{
	@Test
	public void testRead()
	{
		Model model = ModelReader.read("{\"topRole\": \":top\", \"roles\": {\":ARG[0-9]\": {\"type\": \"frame\"}}, " +
				"\"normalizations\": {\":mod-of\": \":domain\"}, " +
				"\"reifications\": [{\"role\": \":mod\", \"concept\": \"have-mod-91\", \"source\": \":ARG1\", \"target\": \":ARG2\"}]}");
		Assert.assertEquals(":top", model.getTopRole());
		Assert.assertEquals("top", model.getTopVariable());
		Assert.assertEquals(":instance", model.getConceptRole());
		Assert.assertEquals(Map.of(":ARG[0-9]", Map.of("type", "frame")), model.getRoles());
		Assert.assertEquals(Map.of(":mod-of", ":domain"), model.getNormalizations());
		Assert.assertEquals(List.of(new Reification(":mod", "have-mod-91", ":ARG1", ":ARG2")), model.getReifications());
		Assert.assertTrue(model.hasRole(":ARG3"));
		Assert.assertTrue(model.hasRole(":top"));
	}

	@Test
	public void testReadEmpty()
	{
		Assert.assertEquals(new Model(), ModelReader.read("{}"));
	}

	@Test(expected = ModelException.class)
	public void testReadInvalid()
	{
		ModelReader.read("{\"roles\": [");
	}

	@Test(expected = ModelException.class)
	public void testMissingResource()
	{
		ModelReader.readResource(ModelReaderTest.class, "/no-such-model.json");
	}
}
