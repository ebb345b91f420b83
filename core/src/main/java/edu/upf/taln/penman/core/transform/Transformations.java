package edu.upf.taln.penman.core.transform;

import edu.upf.taln.penman.core.ModelException;
import edu.upf.taln.penman.core.layout.Layout;
import edu.upf.taln.penman.core.layout.Pop;
import edu.upf.taln.penman.core.layout.Push;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.*;
import edu.upf.taln.penman.core.surface.Alignment;
import edu.upf.taln.penman.core.surface.RoleAlignment;
import edu.upf.taln.penman.core.surface.Surface;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Tree and graph normalizations. Graph transformations return new graphs and move epigraphical markers along with
 * the triples they end up on, so that the result can be configured in the same layout as the input.
 */
public final class Transformations
{
	private final static Logger log = LogManager.getLogger();

	private Transformations() {}

	/**
	 * A copy of the tree with every role canonicalized by the model. Alignment suffixes of roles are kept.
	 */
	public static Tree canonicalizeRoles(Tree t, Model model)
	{
		Node root = new Node(t.getNode().getVariable());
		Deque<Node> originals = new ArrayDeque<>();
		Deque<Node> copies = new ArrayDeque<>();
		originals.push(t.getNode());
		copies.push(root);

		while (!originals.isEmpty())
		{
			Node original = originals.pop();
			Node copy = copies.pop();
			for (Branch branch : original.getBranches())
			{
				String raw_role = branch.getRole();
				String role = StringUtils.substringBefore(raw_role, "~");
				String alignment = raw_role.substring(role.length()); // with its tilde, if any
				String canonical = model.canonicalizeRole(role) + alignment;

				if (branch.isAtomic())
					copy.add(canonical, branch.getAtom());
				else
				{
					Node child = new Node(branch.getNode().getVariable());
					copy.add(canonical, child);
					originals.push(branch.getNode());
					copies.push(child);
				}
			}
		}

		Tree tree = new Tree(root, t.getMetadata());
		log.debug("Canonicalized roles: {}", tree);
		return tree;
	}

	/**
	 * Replaces reifiable edges with a node and two edges, e.g. (a :mod b) becomes (_ :ARG1 a), (_ :instance
	 * have-mod-91), (_ :ARG2 b) in AMR. Role alignments of the edge become alignments of the new concept.
	 */
	public static Graph reifyEdges(Graph g, Model model)
	{
		Set<String> variables = g.variables();
		EpidataMap new_epidata = new EpidataMap(g.getEpidata());
		List<Triple> new_triples = new ArrayList<>();

		for (Triple triple : g.getTriples())
		{
			if (!model.isRoleReifiable(triple.getRole()))
			{
				new_triples.add(triple);
				continue;
			}

			List<Triple> reified = model.reify(triple, variables);
			Triple in = reified.get(0);
			Triple node = reified.get(1);
			Triple out = reified.get(2);
			if (Layout.appearsInverted(g, triple))
			{
				Triple tmp = in;
				in = out;
				out = tmp;
			}
			new_triples.add(in);
			new_triples.add(node);
			new_triples.add(out);

			String variable = node.getSource();
			variables.add(variable);
			new_epidata.put(in, new ArrayList<>(List.of(new Push(variable))));
			List<Epidatum> old_epis = new_epidata.containsKey(triple) ? new_epidata.remove(triple) : new ArrayList<>();
			SplitMarkers markers = new SplitMarkers(old_epis);
			List<Epidatum> node_epis = markers.role_epis.stream()
					.filter(epi -> epi instanceof RoleAlignment)
					.map(epi -> new Alignment(((RoleAlignment) epi).getIndices(), ((RoleAlignment) epi).getPrefix()))
					.collect(Collectors.toList());
			List<Epidatum> out_epis = new ArrayList<>(markers.other_epis);
			if (markers.push != null)
				out_epis.add(markers.push);
			out_epis.addAll(markers.pops);
			new_epidata.put(node, node_epis);
			new_epidata.put(out, out_epis);
		}

		Graph result = new Graph(new_triples, g.getTop(), new_epidata, g.getMetadata());
		log.debug("Reified edges: {}", result);
		return result;
	}

	/**
	 * Collapses reified relations into single edges where the model allows it. A reified node is only collapsed if it
	 * is not the top, is not the target of any edge and has exactly two outgoing edges.
	 */
	public static Graph dereifyEdges(Graph g, Model model)
	{
		Map<String, Dereification> agenda = dereifyAgenda(g, model);
		EpidataMap new_epidata = new EpidataMap(g.getEpidata());
		List<Triple> new_triples = new ArrayList<>();

		for (Triple triple : g.getTriples())
		{
			Dereification d = agenda.get(triple.getSource());
			if (d == null)
			{
				new_triples.add(triple);
				continue;
			}
			if (triple.equals(d.first))
			{
				new_triples.add(d.dereified);
				new_epidata.put(d.dereified, d.epidata);
			}
			new_epidata.remove(triple);
		}

		Graph result = new Graph(new_triples, g.getTop(), new_epidata, g.getMetadata());
		log.debug("Dereified edges: {}", result);
		return result;
	}

	/**
	 * Replaces attributes with edges to new nodes whose concept is the attribute value, e.g. (a :mod 5) becomes
	 * (a :mod _), (_ :instance 5).
	 */
	public static Graph reifyAttributes(Graph g)
	{
		Set<String> variables = g.variables();
		EpidataMap new_epidata = new EpidataMap(g.getEpidata());
		List<Triple> new_triples = new ArrayList<>();
		int i = 2;

		for (Triple triple : g.getTriples())
		{
			if (triple.getRole().equals(Graph.CONCEPT_ROLE) || variables.contains(triple.getTarget()))
			{
				new_triples.add(triple);
				continue;
			}

			String variable = "_";
			while (variables.contains(variable))
				variable = "_" + i++;
			variables.add(variable);

			Triple role_triple = new Triple(triple.getSource(), triple.getRole(), variable);
			Triple node_triple = new Triple(variable, Graph.CONCEPT_ROLE, triple.getTarget());
			new_triples.add(role_triple);
			new_triples.add(node_triple);

			List<Epidatum> old_epis = new_epidata.containsKey(triple) ? new_epidata.remove(triple) : new ArrayList<>();
			SplitMarkers markers = new SplitMarkers(old_epis);
			List<Epidatum> role_epis = new ArrayList<>(markers.role_epis);
			role_epis.add(new Push(variable));
			List<Epidatum> node_epis = new ArrayList<>(markers.other_epis);
			node_epis.addAll(markers.pops);
			node_epis.add(Pop.POP);
			new_epidata.put(role_triple, role_epis);
			new_epidata.put(node_triple, node_epis);
		}

		Graph result = new Graph(new_triples, g.getTop(), new_epidata, g.getMetadata());
		log.debug("Reified attributes: {}", result);
		return result;
	}

	/**
	 * Adds a triple with the model's top role before each triple that opens a node context, so that the tree
	 * structure survives as part of the graph.
	 */
	public static Graph indicateBranches(Graph g, Model model)
	{
		List<Triple> new_triples = new ArrayList<>();
		for (Triple t : g.getTriples())
		{
			String pushed = Layout.getPushedVariable(g, t);
			if (pushed != null)
			{
				if (pushed.equals(t.getTarget()))
					new_triples.add(new Triple(t.getSource(), model.getTopRole(), t.getTarget()));
				else if (pushed.equals(t.getSource()))
					new_triples.add(new Triple(t.getTarget(), model.getTopRole(), t.getSource()));
			}
			new_triples.add(t);
		}

		Graph result = new Graph(new_triples, g.getTop(), g.getEpidata(), g.getMetadata());
		log.debug("Indicated branches: {}", result);
		return result;
	}

	private static Map<String, Dereification> dereifyAgenda(Graph g, Model model)
	{
		Map<Triple, Alignment> alignments = Surface.alignments(g);
		Map<String, Dereification> agenda = new HashMap<>();
		Set<String> fixed = new HashSet<>();
		fixed.add(g.getTop());
		Map<String, Triple> instances = new LinkedHashMap<>();
		Map<String, List<Triple>> others = new HashMap<>();

		for (Triple triple : g.getTriples())
		{
			if (triple.getRole().equals(Graph.CONCEPT_ROLE))
				instances.put(triple.getSource(), triple);
			else
			{
				fixed.add(triple.getTarget());
				others.computeIfAbsent(triple.getSource(), v -> new ArrayList<>()).add(triple);
			}
		}

		instances.forEach((variable, instance) -> {
			List<Triple> edges = others.getOrDefault(variable, Collections.emptyList());
			if (fixed.contains(variable) || edges.size() != 2 || !model.isConceptDereifiable(instance.getTarget()))
				return;

			Triple first = edges.get(0);
			Triple second = edges.get(1);
			if (variable.equals(Layout.getPushedVariable(g, second)))
			{
				Triple tmp = first;
				first = second;
				second = tmp;
			}

			try
			{
				Triple dereified = model.dereify(instance, first, second);
				List<Epidatum> epidata = new ArrayList<>();
				Alignment alignment = alignments.get(instance);
				if (alignment != null)
					epidata.add(new RoleAlignment(alignment.getIndices(), alignment.getPrefix()));
				g.getEpidata().markers(second).stream()
						.filter(epi -> !(epi instanceof RoleAlignment))
						.forEach(epidata::add);
				agenda.put(variable, new Dereification(first, dereified, epidata));
			}
			catch (ModelException e)
			{
				log.debug("Cannot dereify " + variable + ": " + e.getMessage());
			}
		});

		return agenda;
	}

	/** Markers of a triple split by kind */
	private static class SplitMarkers
	{
		Push push = null;
		final List<Pop> pops = new ArrayList<>();
		final List<Epidatum> role_epis = new ArrayList<>();
		final List<Epidatum> other_epis = new ArrayList<>();

		SplitMarkers(List<Epidatum> epis)
		{
			for (Epidatum epi : epis)
			{
				if (epi instanceof Push)
					push = (Push) epi;
				else if (epi instanceof Pop)
					pops.add((Pop) epi);
				else if (epi.getMode() == Epidatum.Mode.ROLE)
					role_epis.add(epi);
				else
					other_epis.add(epi);
			}
		}
	}

	private static class Dereification
	{
		final Triple first; // triple replaced by the dereified one
		final Triple dereified;
		final List<Epidatum> epidata;

		Dereification(Triple first, Triple dereified, List<Epidatum> epidata)
		{
			this.first = first;
			this.dereified = dereified;
			this.epidata = epidata;
		}
	}
}
