package edu.upf.taln.penman.core.layout;

import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.*;
import edu.upf.taln.penman.core.surface.Alignment;
import edu.upf.taln.penman.core.surface.RoleAlignment;
import edu.upf.taln.penman.core.utils.Constants;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a tree into a graph. Triples are produced in depth-first order; the tree structure is kept in the epigraph as
 * a Push marker on each triple that opens a nested node and a POP marker on the last triple inside it.
 */
class Interpreter
{
	private final Model model;
	private final Set<String> variables;
	private final List<Triple> triples = new ArrayList<>();
	private final List<List<Epidatum>> epidata = new ArrayList<>(); // parallel to triples
	private final static Logger log = LogManager.getLogger();

	private Interpreter(Tree tree, Model model)
	{
		this.model = model;
		this.variables = tree.nodes().stream().map(Node::getVariable).collect(Collectors.toSet());
	}

	static Graph interpret(Tree tree, Model model)
	{
		Interpreter interpreter = new Interpreter(tree, model);
		interpreter.run(tree.getNode());

		EpidataMap epimap = new EpidataMap();
		for (int i = 0; i < interpreter.triples.size(); ++i)
		{
			Triple triple = interpreter.triples.get(i);
			if (epimap.containsKey(triple))
				log.warn("Ignoring epigraph data for duplicate triple: " + triple);
			else
				epimap.put(triple, interpreter.epidata.get(i));
		}

		Graph g = new Graph(interpreter.triples, tree.getNode().getVariable(), epimap, tree.getMetadata());
		log.debug("Interpreted: {}", g);
		return g;
	}

	private void run(Node root)
	{
		Deque<Frame> stack = new ArrayDeque<>();
		enter(root, stack);

		while (!stack.isEmpty())
		{
			Frame current = stack.peek();
			if (!current.branches.hasNext())
			{
				stack.pop();
				if (!stack.isEmpty())
					epidata.get(epidata.size() - 1).add(Pop.POP); // closes the node that just ended
				continue;
			}

			Branch branch = current.branches.next();
			List<Epidatum> epis = new ArrayList<>();
			String role = processRole(branch.getRole(), epis);

			if (branch.isAtomic())
			{
				String target = processAtomic(branch.getAtom(), epis);
				Triple triple = new Triple(current.variable, role, target);
				if (model.isRoleInverted(role))
				{
					if (variables.contains(target))
						triple = model.invert(triple);
					else
						log.warn("Cannot deinvert attribute: " + triple);
				}
				emit(triple, epis);
			}
			else
			{
				Node child = branch.getNode();
				Triple triple = model.deinvert(new Triple(current.variable, role, child.getVariable()));
				epis.add(new Push(child.getVariable()));
				emit(triple, epis);
				enter(child, stack);
			}
		}
	}

	/**
	 * Nodes without a concept get a null instance triple before any of their other triples.
	 */
	private void enter(Node node, Deque<Frame> stack)
	{
		boolean has_concept = node.getBranches().stream()
				.map(b -> b.getRole().equals("/") ? Graph.CONCEPT_ROLE : StringUtils.substringBefore(b.getRole(), "~"))
				.anyMatch(Graph.CONCEPT_ROLE::equals);
		if (!has_concept)
			emit(new Triple(node.getVariable(), Graph.CONCEPT_ROLE, null), new ArrayList<>());
		stack.push(new Frame(node.getVariable(), node.getBranches().iterator()));
	}

	private void emit(Triple triple, List<Epidatum> epis)
	{
		triples.add(triple);
		epidata.add(epis);
	}

	private static String processRole(String role, List<Epidatum> epis)
	{
		if (role.equals("/"))
			return Graph.CONCEPT_ROLE;
		int i = role.indexOf('~');
		if (i >= 0)
		{
			epis.add(RoleAlignment.fromString(role.substring(i + 1)));
			return role.substring(0, i);
		}
		return role;
	}

	/**
	 * Splits an alignment suffix off an atomic target. A tilde inside a quoted string is not an alignment.
	 */
	private static String processAtomic(String target, List<Epidatum> epis)
	{
		if (Constants.isNull(target) || !target.contains("~"))
			return target;

		if (target.startsWith("\""))
		{
			int pivot = target.lastIndexOf('"') + 1;
			if (pivot < target.length())
			{
				epis.add(Alignment.fromString(target.substring(pivot)));
				return target.substring(0, pivot);
			}
			return target;
		}

		int i = target.indexOf('~');
		epis.add(Alignment.fromString(target.substring(i + 1)));
		return target.substring(0, i);
	}

	/** A node being interpreted and its remaining branches */
	private static class Frame
	{
		final String variable;
		final Iterator<Branch> branches;

		Frame(String variable, Iterator<Branch> branches)
		{
			this.variable = variable;
			this.branches = branches;
		}
	}
}
