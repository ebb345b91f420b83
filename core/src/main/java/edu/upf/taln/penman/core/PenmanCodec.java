package edu.upf.taln.penman.core;

import edu.upf.taln.penman.core.io.PenmanFormatter;
import edu.upf.taln.penman.core.io.PenmanParser;
import edu.upf.taln.penman.core.layout.Layout;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.structures.Triple;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Encoder and decoder of PENMAN graphs. The model determines how inverted roles are interpreted when decoding and how
 * edges are oriented when encoding.
 */
public class PenmanCodec
{
	private final Model model;
	private final PenmanParser parser = new PenmanParser();
	private final PenmanFormatter formatter = new PenmanFormatter();

	public PenmanCodec()
	{
		this(new Model());
	}

	public PenmanCodec(Model model)
	{
		this.model = model == null ? new Model() : model;
	}

	public Model getModel() { return model; }

	public Tree parse(String text)
	{
		return parser.parse(text);
	}

	public List<Tree> parseAll(String text)
	{
		return parser.parseAll(text);
	}

	public List<Triple> parseTriples(String text)
	{
		return parser.parseTriples(text);
	}

	/**
	 * @throws DecodeException if the text is not a well-formed PENMAN graph
	 */
	public Graph decode(String text)
	{
		return Layout.interpret(parse(text), model);
	}

	public List<Graph> decodeAll(String text)
	{
		return parseAll(text).stream()
				.map(t -> Layout.interpret(t, model))
				.collect(Collectors.toList());
	}

	public String encode(Graph g)
	{
		return encode(g, null, PenmanFormatter.ADAPTIVE_INDENT, false);
	}

	/**
	 * @param top     variable at the root of the serialization, or null for the top of the graph
	 * @param indent  see {@link PenmanFormatter#format(Tree, Integer, boolean)}
	 * @throws LayoutException if the graph cannot be configured as a tree from the given top
	 */
	public String encode(Graph g, String top, Integer indent, boolean compact)
	{
		Tree tree = Layout.configure(g, top, model);
		return format(tree, indent, compact);
	}

	public String format(Tree tree)
	{
		return format(tree, PenmanFormatter.ADAPTIVE_INDENT, false);
	}

	public String format(Tree tree, Integer indent, boolean compact)
	{
		return formatter.format(tree, indent, compact);
	}

	public String formatTriples(List<Triple> triples, boolean indent)
	{
		return formatter.formatTriples(triples, indent);
	}
}
