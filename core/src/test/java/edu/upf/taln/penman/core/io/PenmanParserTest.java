package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.DecodeException;
import edu.upf.taln.penman.core.structures.Node;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.structures.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class PenmanParserTest
{
	private final PenmanParser parser = new PenmanParser();

	@Test
	public void testParse()
	{
		Tree t = parser.parse("(a / alpha :ARG0 (b / beta) :ARG1 \"str\" :mod~e.2 -~3)");
		Node expected = new Node("a")
				.add("/", "alpha")
				.add(":ARG0", new Node("b").add("/", "beta"))
				.add(":ARG1", "\"str\"")
				.add(":mod~e.2", "-~3");
		Assert.assertEquals(expected, t.getNode());
		Assert.assertTrue(t.getMetadata().isEmpty());
	}

	@Test
	public void testParseConceptAlignment()
	{
		Tree t1 = parser.parse("(a / alpha~1)");
		Tree t2 = parser.parse("(a / alpha ~1)");
		Assert.assertEquals(new Node("a").add("/", "alpha~1"), t1.getNode());
		Assert.assertEquals(t1, t2);
	}

	@Test
	public void testMetadata()
	{
		Tree t = parser.parse("# ::snt Hello world\n# ::id 1 ::date today \n# no metadata here\n(a / alpha)");
		Assert.assertEquals(Map.of("snt", "Hello world", "id", "1", "date", "today"), t.getMetadata());
		Assert.assertEquals(List.of("snt", "id", "date"), List.copyOf(t.getMetadata().keySet()));
	}

	@Test
	public void testMissingParts()
	{
		Assert.assertEquals(new Node(null), parser.parse("()").getNode());
		Assert.assertEquals(new Node("g").add("/", (String) null), parser.parse("(g / )").getNode());
		Assert.assertEquals(new Node("g").add("/", "go").add(":ARG0", (String) null).add(":ARG1", new Node("t").add("/", "there")),
				parser.parse("(g / go :ARG0 :ARG1 (t / there))").getNode());
	}

	@Test
	public void testInvalid()
	{
		for (String s : List.of("(", "(a", "(a /", "(a / alpha", "(a b)", "a / alpha"))
		{
			try
			{
				parser.parse(s);
				Assert.fail("No exception for " + s);
			}
			catch (DecodeException e)
			{
				Assert.assertNotNull(e.getMessage());
			}
		}
	}

	@Test
	public void testErrorPosition()
	{
		try
		{
			parser.parse("(a / alpha\n   b)");
			Assert.fail();
		}
		catch (DecodeException e)
		{
			Assert.assertEquals(2, e.getLineno());
			Assert.assertEquals(3, e.getOffset());
			Assert.assertEquals("   b)", e.getText());
			Assert.assertEquals("Expected: ROLE", e.getDescription());
		}
	}

	@Test
	public void testParseAll()
	{
		List<Tree> trees = parser.parseAll("# ::id 1\n(a / alpha)\n\n# ::id 2\n(b / beta)");
		Assert.assertEquals(2, trees.size());
		Assert.assertEquals("1", trees.get(0).getMetadata().get("id"));
		Assert.assertEquals(new Node("b").add("/", "beta"), trees.get(1).getNode());
		Assert.assertTrue(parser.parseAll("").isEmpty());
	}

	@Test
	public void testDeepNesting()
	{
		int n = 1000;
		StringBuilder s = new StringBuilder();
		for (int i = 1; i < n; ++i)
			s.append("(a").append(i).append(" / A :ARG0 ");
		s.append("(a").append(n).append(" / A)");
		for (int i = 1; i < n; ++i)
			s.append(")");
		Assert.assertEquals(n, parser.parse(s.toString()).nodes().size());
	}

	@Test
	public void testParseTriples()
	{
		Assert.assertEquals(List.of(new Triple("a", ":role", "b")), parser.parseTriples("role(a, b)"));

		List<Triple> expected = List.of(new Triple("a", ":instance", "alpha"), new Triple("a", ":ARG0", "b"));
		Assert.assertEquals(expected, parser.parseTriples("instance(a, alpha) ^ ARG0(a, b)"));
		Assert.assertEquals(expected, parser.parseTriples("instance(a,alpha)^ARG0(a,b)"));
		Assert.assertEquals(expected, parser.parseTriples("instance(a , alpha) ^\nARG0(a ,b)"));

		Assert.assertEquals(List.of(new Triple("a", ":instance", "1,000")), parser.parseTriples("instance(a, 1,000)"));
		Assert.assertEquals(List.of(new Triple("a", ":ARG", "\"a string\"")), parser.parseTriples("ARG(a, \"a string\")"));
		Assert.assertEquals(List.of(new Triple("a", ":ARG0", null)), parser.parseTriples("ARG0(a)"));
	}

	@Test(expected = DecodeException.class)
	public void testParseTriplesInvalid()
	{
		parser.parseTriples("instance(a b)");
	}
}
