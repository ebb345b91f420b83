package edu.upf.taln.penman.core;

import edu.upf.taln.penman.core.io.PenmanFormatter;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Tree;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public class PenmanTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final Model model = new Model();
	private final PenmanCodec codec = new PenmanCodec(model);

	private String process(String text, Options options)
	{
		return process(text, model, options);
	}

	private String process(String text, Model m, Options options)
	{
		Tree t = new PenmanCodec(m).parse(text);
		return Penman.process(t, m, options);
	}

	private static Options flat()
	{
		Options options = new Options();
		options.indent = null;
		return options;
	}

	@Test
	public void testProcessDefaults()
	{
		Assert.assertEquals("(a / alpha\n   :ARG0 (b / beta))", process("(a / alpha :ARG0 (b / beta))", new Options()));
		Assert.assertEquals("(a / alpha :ARG0 (b / beta))", process("(a / alpha\n   :ARG0 (b / beta))", flat()));
	}

	@Test
	public void testProcessTriples()
	{
		Options options = flat();
		options.triples = true;
		Assert.assertEquals("instance(a, alpha) ^ ARG0(a, b) ^ instance(b, beta)",
				process("(a / alpha :ARG0 (b / beta))", options));

		options.indent = 2;
		Assert.assertEquals("instance(a, alpha) ^\nARG0(a, b) ^\ninstance(b, beta)",
				process("(a / alpha :ARG0 (b / beta))", options));
	}

	@Test
	public void testProcessMakeVariables()
	{
		Options options = flat();
		options.make_variables = "{prefix}{j}";
		Assert.assertEquals("(a / alpha :ARG0 (b / beta :ARG1 a))", process("(x / alpha :ARG0 (y / beta :ARG1 x))", options));
	}

	@Test
	public void testProcessRearrange()
	{
		Options options = flat();
		options.rearrange = Options.Rearrangement.CANONICAL;
		Assert.assertEquals("(a / alpha :ARG0 d :ARG1 (b / beta) :ARG0-of (c / gamma))",
				process("(a / alpha :ARG1 (b / beta) :ARG0-of (c / gamma) :ARG0 d)", options));

		options = flat();
		options.attributes_first = true;
		Assert.assertEquals("(a / alpha :polarity - :ARG0 (b / beta))",
				process("(a / alpha :ARG0 (b / beta) :polarity -)", options));
	}

	@Test
	public void testProcessRandomOrderKeepsGraph()
	{
		String text = "(a / alpha :ARG0 (b / beta :ARG1 (g / gamma)) :ARG1 (d / delta) :mod 5 :polarity -)";
		Options options = flat();
		options.rearrange = Options.Rearrangement.RANDOM;
		for (int i = 0; i < 10; ++i)
			Assert.assertEquals(codec.decode(text), codec.decode(process(text, options)));
	}

	@Test
	public void testProcessCanonicalizeRoles()
	{
		Options options = flat();
		options.canonicalize_roles = true;
		Assert.assertEquals("(a / alpha :ARG0 (b / beta))", process("(a / alpha :ARG0-of-of (b / beta))", options));
	}

	@Test
	public void testProcessReifyAttributes()
	{
		Options options = flat();
		options.reify_attributes = true;
		Assert.assertEquals("(a / alpha :mod (_ / 5))", process("(a / alpha :mod 5)", options));
	}

	@Test
	public void testProcessEdges()
	{
		Model amr = Fixtures.miniAmr();
		Options options = flat();
		options.dereify_edges = true;
		Assert.assertEquals("(a / alpha :mod (b / beta))",
				process("(a / alpha :ARG1-of (_ / have-mod-91 :ARG2 (b / beta)))", amr, options));

		options = flat();
		options.reify_edges = true;
		Assert.assertEquals("(a / alpha :ARG1-of (_ / have-mod-91 :ARG2 (b / beta)))",
				process("(a / alpha :mod (b / beta))", amr, options));
	}

	@Test
	public void testLoadsDumps()
	{
		List<Graph> graphs = Penman.loads("(a / alpha)\n\n(b / beta :ARG0 a)", model);
		Assert.assertEquals(2, graphs.size());
		Assert.assertEquals("(a / alpha)\n\n(b / beta :ARG0 a)", Penman.dumps(graphs, model, null, false));
	}

	@Test
	public void testDumpLoad() throws IOException
	{
		List<Graph> graphs = Penman.loads("# ::id 1\n(a / alpha :ARG0 (b / beta))\n\n# ::id 2\n(g / gamma)", model);
		Path file = folder.getRoot().toPath().resolve("graphs.txt");
		Penman.dump(graphs, file, model, PenmanFormatter.ADAPTIVE_INDENT, false);

		List<Graph> loaded = Penman.load(file, model);
		Assert.assertEquals(graphs, loaded);
		Assert.assertEquals("2", loaded.get(1).getMetadata().get("id"));
	}

	@Test
	public void testOptionsCopy()
	{
		Options options = flat();
		options.reify_edges = true;
		Options copy = new Options(options);
		Assert.assertNull(copy.indent);
		Assert.assertTrue(copy.reify_edges);
		Assert.assertTrue(copy.toString().contains("indent = flat"));
	}
}
