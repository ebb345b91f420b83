package edu.upf.taln.penman.core.layout;

import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Conversion between trees and graphs.
 * <p>
 * Interpretation turns a tree into a graph, recording in the epigraph where nodes start and end. Configuration turns a
 * graph into a tree, following those records when they are consistent with the graph and falling back to a
 * depth-first layout from the top otherwise.
 */
public final class Layout
{
	private final static Model default_model = new Model();

	private Layout() {}

	public static Graph interpret(Tree tree)
	{
		return interpret(tree, default_model);
	}

	/**
	 * Interprets a tree as a graph. Inverted edges are deinverted according to the model, except for attributes,
	 * which cannot be.
	 */
	public static Graph interpret(Tree tree, Model model)
	{
		return Interpreter.interpret(tree, model);
	}

	public static Tree configure(Graph g)
	{
		return configure(g, null, default_model);
	}

	/**
	 * Creates a tree from a graph.
	 *
	 * @param top   variable at the root of the tree, or null for the top of the graph
	 * @throws edu.upf.taln.penman.core.LayoutException if the top is not a variable or the graph cannot be fully
	 *                                                  configured (e.g. it is disconnected)
	 */
	public static Tree configure(Graph g, String top, Model model)
	{
		if (top == null)
			top = g.getTop();
		return new Configurator(g, top, model == null ? default_model : model).configure();
	}

	/**
	 * Configures a graph after removing its layout markers, keeping other markers such as alignments.
	 *
	 * @param key if not null, triples are first sorted (stably) by this ordering of their roles
	 */
	public static Tree reconfigure(Graph g, String top, Model model, Comparator<String> key)
	{
		EpidataMap epidata = new EpidataMap();
		g.getEpidata().forEach((triple, epis) -> epidata.put(triple, epis.stream()
				.filter(epi -> !(epi instanceof LayoutMarker))
				.collect(Collectors.toList())));
		List<Triple> triples = new ArrayList<>(g.getTriples());
		if (key != null)
			triples.sort(Comparator.comparing(Triple::getRole, key));
		Graph p = new Graph(triples, g.getTop(), epidata, g.getMetadata());
		return configure(p, top, model);
	}

	/**
	 * Sorts the branches of every node in place, keeping the concept branch first.
	 *
	 * @param key             ordering of roles, or null to keep the original order
	 * @param attributesFirst if true, branches to constants come before branches to variables
	 */
	public static void rearrange(Tree t, Comparator<String> key, boolean attributesFirst)
	{
		Set<String> variables = attributesFirst ?
				t.nodes().stream().map(Node::getVariable).collect(Collectors.toSet()) : Collections.emptySet();
		Comparator<Branch> order = Comparator.comparing(b -> b.isAtomic() ?
				variables.contains(b.getAtom()) : variables.contains(b.getNode().getVariable()));
		if (key != null)
			order = order.thenComparing(Branch::getRole, key);

		Deque<Node> stack = new ArrayDeque<>();
		stack.push(t.getNode());
		while (!stack.isEmpty())
		{
			Node node = stack.pop();
			List<Branch> branches = node.getBranches();
			int first = !branches.isEmpty() && branches.get(0).getRole().equals("/") ? 1 : 0;
			List<Branch> rest = branches.subList(first, branches.size());
			rest.stream().filter(b -> !b.isAtomic()).forEach(b -> stack.push(b.getNode()));
			rest.sort(order);
		}
	}

	/**
	 * Variable pushed by a triple, or null if it does not open a node context.
	 */
	public static String getPushedVariable(Graph g, Triple triple)
	{
		for (Epidatum epi : g.getEpidata().markers(triple))
		{
			if (epi instanceof Push)
				return ((Push) epi).getVariable();
		}
		return null;
	}

	/**
	 * True if the triple would be written as an inverted edge, judging from the epigraph. This is the case if its
	 * target is the node context in which it appears.
	 */
	public static boolean appearsInverted(Graph g, Triple triple)
	{
		Set<String> variables = g.variables();
		if (triple.getRole().equals(Graph.CONCEPT_ROLE) || !variables.contains(triple.getTarget()))
			return false;

		String pushed = getPushedVariable(g, triple);
		if (pushed != null)
			return pushed.equals(triple.getSource());

		List<String> contexts = nodeContexts(g);
		List<Triple> triples = g.getTriples();
		for (int i = 0; i < triples.size(); ++i)
		{
			String context = contexts.get(i);
			if (context == null)
				break; // node contexts can no longer be told
			if (triples.get(i).equals(triple))
				return triple.getTarget().equals(context);
		}
		return false;
	}

	/**
	 * The node context (the variable of the enclosing node) of each triple, following the layout markers. Once the
	 * markers become inconsistent with the graph the remaining contexts are null.
	 */
	public static List<String> nodeContexts(Graph g)
	{
		Set<String> variables = g.variables();
		Deque<String> stack = new ArrayDeque<>();
		if (g.getTop() != null)
			stack.push(g.getTop());
		List<String> contexts = new ArrayList<>(Collections.nCopies(g.getTriples().size(), null));

		outer:
		for (int i = 0; i < g.getTriples().size(); ++i)
		{
			Triple triple = g.getTriples().get(i);
			Set<String> eligible = new HashSet<>();
			eligible.add(triple.getSource());
			if (!triple.getRole().equals(Graph.CONCEPT_ROLE) && variables.contains(triple.getTarget()))
				eligible.add(triple.getTarget());

			if (stack.isEmpty() || !eligible.contains(stack.peek()))
				break;
			contexts.set(i, stack.peek());

			String pushed = getPushedVariable(g, triple);
			if (pushed != null)
				stack.push(pushed);

			for (Epidatum epi : g.getEpidata().markers(triple))
			{
				if (epi instanceof Pop)
				{
					if (stack.isEmpty())
						break outer; // more POPs than open contexts
					stack.pop();
				}
			}
		}
		return contexts;
	}
}
