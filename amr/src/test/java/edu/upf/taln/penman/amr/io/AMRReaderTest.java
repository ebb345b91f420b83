package edu.upf.taln.penman.amr.io;

import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class AMRReaderTest
{
	private final static String BANK =
			"# AMR release; corpus: test\n" +
			"\n" +
			"# ::id test.1 ::date 2012-06-07\n" +
			"# ::snt The boy wants to go.\n" +
			"(w / want-01\n" +
			"   :ARG0 (b / boy)\n" +
			"   :ARG1 (g / go-02\n" +
			"            :ARG0 b))\n" +
			"\n" +
			"# ::id test.2\n" +
			"# ::snt Broken.\n" +
			"(b / break-01\n" +
			"   :ARG1 (x / thing\n" +
			"\n" +
			"(r / red-02\n" +
			"   :ARG1-of (_ / have-mod-91\n" +
			"               :ARG2 (c / car)))\n";

	@Test
	public void testRead()
	{
		List<Graph> graphs = new AMRReader().read(BANK);
		Assert.assertEquals(2, graphs.size());

		Graph g = graphs.get(0);
		Assert.assertEquals("test.1", g.getMetadata().get(AMRReader.ID_KEY));
		Assert.assertEquals("The boy wants to go.", g.getMetadata().get("snt"));
		Assert.assertEquals("w", g.getTop());
		Assert.assertTrue(g.getTriples().contains(new Triple("g", ":ARG0", "b")));

		Graph g2 = graphs.get(1);
		Assert.assertEquals("3", g2.getMetadata().get(AMRReader.ID_KEY));
		Assert.assertEquals(5, g2.getTriples().size());
	}

	@Test
	public void testReadDereified()
	{
		List<Graph> graphs = new AMRReader(true).read(BANK);
		Graph g = graphs.get(1);
		Assert.assertEquals(List.of(
				new Triple("r", ":instance", "red-02"),
				new Triple("r", ":mod", "c"),
				new Triple("c", ":instance", "car")), g.getTriples());
		Assert.assertEquals("3", g.getMetadata().get(AMRReader.ID_KEY));
	}

	@Test
	public void testReadEmpty()
	{
		Assert.assertTrue(new AMRReader().read("").isEmpty());
		Assert.assertTrue(new AMRReader().read("# only a comment\n").isEmpty());
	}
}
