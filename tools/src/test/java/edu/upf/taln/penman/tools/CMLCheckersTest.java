package edu.upf.taln.penman.tools;

import com.beust.jcommander.ParameterException;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.io.PenmanFormatter;
import org.junit.Assert;
import org.junit.Test;

public class CMLCheckersTest
{
	@Test
	public void testIndent()
	{
		Assert.assertNull(CMLCheckers.toIndent("flat"));
		Assert.assertEquals(Integer.valueOf(PenmanFormatter.ADAPTIVE_INDENT), CMLCheckers.toIndent("adaptive"));
		Assert.assertEquals(Integer.valueOf(4), CMLCheckers.toIndent("4"));

		CMLCheckers.IndentValidator validator = new CMLCheckers.IndentValidator();
		validator.validate("--indent", "0");
		validator.validate("--indent", "-1");
		validator.validate("--indent", "FLAT");
	}

	@Test(expected = ParameterException.class)
	public void testInvalidIndent()
	{
		new CMLCheckers.IndentValidator().validate("--indent", "-2");
	}

	@Test
	public void testRearrangement()
	{
		Assert.assertEquals(Options.Rearrangement.CANONICAL, new CMLCheckers.RearrangementConverter().convert("canonical"));
		new CMLCheckers.RearrangementValidator().validate("--rearrange", "random");
	}

	@Test(expected = ParameterException.class)
	public void testInvalidModel()
	{
		new CMLCheckers.ModelValidator().validate("-m", "no-such-model.json");
	}

	@Test
	public void testModels()
	{
		new CMLCheckers.ModelValidator().validate("-m", "AMR");
		Assert.assertTrue(Models.get("amr").hasRole(":ARG0"));
		Assert.assertFalse(Models.get("default").hasRole(":ARG0"));
		Assert.assertTrue(Models.get(null).hasRole(":instance"));
	}
}
