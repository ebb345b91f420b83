package edu.upf.taln.penman.core.layout;

import edu.upf.taln.penman.core.LayoutException;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Turns a graph into a tree, following the layout markers of its epigraph where they are consistent with the graph.
 * <p>
 * The triples are put in a work list (consumed from its end) with standalone POP entries. Starting from the top, each
 * node consumes the triples it can place; a triple that cannot be placed ends the current node. When the whole stack
 * of open nodes has ended with triples left, the next triple whose source or target already has a site in the tree
 * is looked for, triples passed over on the way are kept aside, and configuration resumes from that variable.
 */
class Configurator
{
	private final Graph graph;
	private final String top;
	private final Model model;
	private List<Entry> data = new ArrayList<>();
	// variable -> null (no site yet), a frame with another variable (site where a reference can be expanded), or its own frame
	private final Map<String, Frame> nodemap = new HashMap<>();
	private final static Logger log = LogManager.getLogger();

	Configurator(Graph graph, String top, Model model)
	{
		this.graph = graph;
		this.top = top;
		this.model = model;
	}

	Tree configure()
	{
		Frame root = start();
		stripPops();

		List<Entry> skipped = new ArrayList<>();
		while (!data.isEmpty())
		{
			String variable = findNext(skipped);
			int count = data.size();
			if (variable == null || count == 0)
				throw new LayoutException("possibly disconnected graph");

			boolean surprising = configureNode(variable);
			if (data.size() == count && surprising)
				skipped.add(0, data.remove(data.size() - 1));
			else if (data.size() >= count)
				throw new LayoutException("unknown configuration error");
			else
			{
				skipped.addAll(data);
				data = skipped;
				skipped = new ArrayList<>();
			}
			stripPops();
		}
		if (!skipped.isEmpty())
			throw new LayoutException("incomplete configuration");

		Tree tree = new Tree(render(root), graph.getMetadata());
		log.debug("Configured: {}", tree);
		return tree;
	}

	private Frame start()
	{
		if (graph.getTriples().isEmpty())
			return new Frame(graph.getTop());

		graph.variables().forEach(v -> nodemap.put(v, null));
		if (top == null || !nodemap.containsKey(top))
			throw new LayoutException("top is not a variable: " + top);

		Frame root = new Frame(top);
		nodemap.put(top, root);
		preconfigure();
		Collections.reverse(data);
		configureNode(top);
		return root;
	}

	/**
	 * Fills the work list, orienting each triple according to its Push marker. Only the first Push for each variable
	 * is kept.
	 */
	private void preconfigure()
	{
		Set<String> pushed = new HashSet<>();
		for (Triple triple : graph.getTriples())
		{
			String variable = triple.getSource();
			String role = triple.getRole();
			String target = triple.getTarget();
			List<Epidatum> epis = new ArrayList<>();
			boolean push = false;
			int pops = 0;

			for (Epidatum epi : graph.getEpidata().markers(triple))
			{
				if (epi instanceof Push)
				{
					String pvar = ((Push) epi).getVariable();
					if (pushed.contains(pvar))
					{
						log.warn("Ignoring secondary node contexts for '" + pvar + "'");
						continue;
					}
					if ((!Objects.equals(pvar, variable) && !Objects.equals(pvar, target)) || role.equals(Graph.CONCEPT_ROLE))
					{
						log.warn("Node context '" + pvar + "' invalid for triple: " + triple);
						continue;
					}
					if (Objects.equals(pvar, variable))
						triple = model.invert(triple);
					pushed.add(pvar);
					push = true;
				}
				else if (epi instanceof Pop)
					++pops;
				else
					epis.add(epi);
			}

			data.add(new Entry(triple, push, epis));
			for (int i = 0; i < pops; ++i)
				data.add(Entry.POP);
		}
	}

	/**
	 * Adds to the node of a variable the triples at the end of the work list that belong to it, descending into new
	 * nodes as they are pushed. Ends when the node context is popped, the work list is exhausted or a triple cannot be
	 * placed.
	 *
	 * @return true if the configuration found something unexpected, such as a triple it could not place
	 */
	private boolean configureNode(String variable)
	{
		Deque<Context> stack = new ArrayDeque<>();
		stack.push(new Context(nodemap.get(variable)));

		while (true)
		{
			Context ctx = stack.peek();
			Frame node = ctx.node;
			boolean done = data.isEmpty();

			if (!done)
			{
				Entry datum = data.remove(data.size() - 1);
				if (datum == Entry.POP)
					done = true;
				else
				{
					Triple triple = datum.triple;
					String role;
					String target;
					boolean push = datum.push;
					if (Objects.equals(triple.getSource(), node.variable))
					{
						role = triple.getRole();
						target = triple.getTarget();
					}
					else if (Objects.equals(triple.getTarget(), node.variable) && !triple.getRole().equals(Graph.CONCEPT_ROLE))
					{
						Triple inverted = model.invert(triple);
						role = inverted.getRole();
						target = inverted.getTarget();
						push = false; // the preconfigured push may no longer be valid
						ctx.surprising = true;
					}
					else
					{
						data.add(datum); // cannot place triple
						ctx.surprising = true;
						role = null;
						target = null;
						done = true;
					}

					if (!done)
					{
						if (role.equals(Graph.CONCEPT_ROLE))
						{
							// prefer (a) over (a /) when the concept is missing
							if (target != null && !target.isEmpty())
								node.edges.add(0, new Edge("/", target, null, datum.epis));
						}
						else if (push)
						{
							Frame child = new Frame(target);
							nodemap.put(target, child);
							node.edges.add(new Edge(role, null, child, datum.epis));
							stack.push(new Context(child));
						}
						else
						{
							if (target != null && nodemap.containsKey(target) && nodemap.get(target) == null)
								nodemap.put(target, node); // site of a potential node context
							node.edges.add(new Edge(role, target, null, datum.epis));
						}
					}
				}
			}

			if (done)
			{
				stack.pop();
				if (stack.isEmpty())
					return ctx.surprising;
				Context parent = stack.peek();
				parent.surprising = parent.surprising && ctx.surprising;
			}
		}
	}

	/**
	 * Scans the work list from its end for a triple whose source or target has a site in the tree. Entries after that
	 * triple are moved to skipped.
	 *
	 * @return the variable to resume from, or null if none was found
	 */
	private String findNext(List<Entry> skipped)
	{
		String variable = null;
		int pivot = data.size();
		for (int i = data.size() - 1; i >= 0; --i)
		{
			Entry datum = data.get(i);
			pivot = i + 1;
			if (datum == Entry.POP)
				continue;
			String source = datum.triple.getSource();
			String target = datum.triple.getTarget();
			if (nodemap.containsKey(source) && getOrEstablishSite(source))
			{
				variable = source;
				break;
			}
			else if (target != null && nodemap.containsKey(target) && getOrEstablishSite(target))
			{
				variable = target;
				break;
			}
		}

		skipped.addAll(data.subList(pivot, data.size()));
		data = new ArrayList<>(data.subList(0, pivot));
		return variable;
	}

	/**
	 * True if the variable has a node in the tree, possibly creating it by expanding an atomic reference to the
	 * variable at its recorded site.
	 */
	private boolean getOrEstablishSite(String variable)
	{
		Frame site = nodemap.get(variable);
		if (site == null)
			return false;

		if (!variable.equals(site.variable))
		{
			Frame node = new Frame(variable);
			nodemap.put(variable, node);
			for (int i = 0; i < site.edges.size(); ++i)
			{
				Edge edge = site.edges.get(i);
				if (edge.node == null && variable.equals(edge.atom) && !edge.role.equals("/"))
				{
					site.edges.set(i, new Edge(edge.role, null, node, edge.epis));
					break;
				}
			}
		}
		return true;
	}

	private void stripPops()
	{
		while (!data.isEmpty() && data.get(data.size() - 1) == Entry.POP)
			data.remove(data.size() - 1);
	}

	/**
	 * Builds the tree, rendering role and target alignments as suffixes of roles and atomic targets.
	 */
	private static Node render(Frame root)
	{
		Node root_node = new Node(root.variable);
		Deque<Frame> frames = new ArrayDeque<>();
		Deque<Node> nodes = new ArrayDeque<>();
		frames.push(root);
		nodes.push(root_node);

		while (!frames.isEmpty())
		{
			Frame frame = frames.pop();
			Node node = nodes.pop();
			for (Edge edge : frame.edges)
			{
				StringBuilder role = new StringBuilder(edge.role);
				StringBuilder target = edge.node == null ? new StringBuilder(edge.atom == null ? "" : edge.atom) : null;
				for (Epidatum epi : edge.epis)
				{
					if (epi.getMode() == Epidatum.Mode.ROLE)
						role.append(epi);
					else if (epi.getMode() == Epidatum.Mode.TARGET && target != null)
						target.append(epi);
					else
						log.warn("Epigraphical marker ignored: " + epi);
				}

				if (edge.node != null)
				{
					Node child = new Node(edge.node.variable);
					node.add(role.toString(), child);
					frames.push(edge.node);
					nodes.push(child);
				}
				else
				{
					String atom = edge.atom == null && target.length() == 0 ? null : target.toString();
					node.add(role.toString(), atom);
				}
			}
		}
		return root_node;
	}

	/** Work list entry: a triple oriented for configuration, or the POP sentinel */
	private static class Entry
	{
		final static Entry POP = new Entry(null, false, Collections.emptyList());

		final Triple triple;
		final boolean push;
		final List<Epidatum> epis; // non-layout markers

		Entry(Triple triple, boolean push, List<Epidatum> epis)
		{
			this.triple = triple;
			this.push = push;
			this.epis = epis;
		}
	}

	/** A node under construction */
	private static class Frame
	{
		final String variable;
		final List<Edge> edges = new ArrayList<>();

		Frame(String variable)
		{
			this.variable = variable;
		}
	}

	/** A branch under construction, with an atomic target or a nested node */
	private static class Edge
	{
		final String role;
		final String atom;
		final Frame node;
		final List<Epidatum> epis;

		Edge(String role, String atom, Frame node, List<Epidatum> epis)
		{
			this.role = role;
			this.atom = atom;
			this.node = node;
			this.epis = epis;
		}
	}

	private static class Context
	{
		final Frame node;
		boolean surprising = false;

		Context(Frame node)
		{
			this.node = node;
		}
	}
}
