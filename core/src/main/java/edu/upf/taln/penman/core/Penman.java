package edu.upf.taln.penman.core;

import com.google.common.base.Charsets;
import edu.upf.taln.penman.core.io.PenmanFormatter;
import edu.upf.taln.penman.core.layout.Layout;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.transform.Transformations;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry points for reading and writing PENMAN graphs.
 */
public final class Penman
{
	private final static Logger log = LogManager.getLogger();

	private Penman() {}

	public static Graph decode(String text)
	{
		return new PenmanCodec().decode(text);
	}

	public static Graph decode(String text, Model model)
	{
		return new PenmanCodec(model).decode(text);
	}

	public static String encode(Graph g)
	{
		return new PenmanCodec().encode(g);
	}

	public static String encode(Graph g, String top, Model model, Integer indent, boolean compact)
	{
		return new PenmanCodec(model).encode(g, top, indent, compact);
	}

	/**
	 * All graphs in a string.
	 */
	public static List<Graph> loads(String text, Model model)
	{
		return new PenmanCodec(model).decodeAll(text);
	}

	/**
	 * All graphs in a UTF-8 file.
	 */
	public static List<Graph> load(Path file, Model model) throws IOException
	{
		String text = FileUtils.readFileToString(file.toFile(), Charsets.UTF_8);
		List<Graph> graphs = loads(text, model);
		log.info("Loaded " + graphs.size() + " graphs from " + file);
		return graphs;
	}

	/**
	 * Serializes the graphs, separating them with blank lines.
	 */
	public static String dumps(List<Graph> graphs, Model model, Integer indent, boolean compact)
	{
		PenmanCodec codec = new PenmanCodec(model);
		return graphs.stream()
				.map(g -> codec.encode(g, null, indent, compact))
				.collect(Collectors.joining("\n\n"));
	}

	/**
	 * Writes the graphs to a UTF-8 file, one blank line after each.
	 */
	public static void dump(List<Graph> graphs, Path file, Model model, Integer indent, boolean compact) throws IOException
	{
		PenmanCodec codec = new PenmanCodec(model);
		StringBuilder text = new StringBuilder();
		for (Graph g : graphs)
			text.append(codec.encode(g, null, indent, compact)).append("\n\n");
		FileUtils.writeStringToFile(file.toFile(), text.toString(), Charsets.UTF_8);
		log.info("Wrote " + graphs.size() + " graphs to " + file);
	}

	/**
	 * Normalizes a tree as requested by the options and writes it back.
	 * <p>
	 * Roles are canonicalized on the tree and branches are shuffled before interpreting it as a graph, then the graph
	 * transformations are applied and the result is configured, renamed and sorted before it is formatted.
	 *
	 * @throws LayoutException if the transformed graph cannot be configured
	 */
	public static String process(Tree t, Model model, Options options)
	{
		if (options.canonicalize_roles)
			t = Transformations.canonicalizeRoles(t, model);
		if (options.rearrange == Options.Rearrangement.RANDOM)
			Layout.rearrange(t, model.randomOrder(), false);

		Graph g = Layout.interpret(t, model);
		if (options.dereify_edges)
			g = Transformations.dereifyEdges(g, model);
		if (options.reify_edges)
			g = Transformations.reifyEdges(g, model);
		if (options.reify_attributes)
			g = Transformations.reifyAttributes(g);
		if (options.indicate_branches)
			g = Transformations.indicateBranches(g, model);

		if (options.triples)
			return new PenmanFormatter().formatTriples(g.getTriples(), options.indent != null);

		Tree result = Layout.configure(g, null, model);
		if (options.make_variables != null)
			result.resetVariables(options.make_variables);
		if (options.rearrange == Options.Rearrangement.CANONICAL)
			Layout.rearrange(result, model.canonicalOrder(), options.attributes_first);
		else if (options.attributes_first)
			Layout.rearrange(result, null, true);

		return new PenmanFormatter().format(result, options.indent, options.compact);
	}
}
