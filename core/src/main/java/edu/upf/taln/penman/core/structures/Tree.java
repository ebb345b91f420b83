package edu.upf.taln.penman.core.structures;

import org.apache.commons.lang3.tuple.Pair;

import java.util.*;

/**
 * A tree structure, the surface form of a graph as written in PENMAN notation: a root node plus the metadata read
 * from comments.
 */
public class Tree
{
	public final static String DEFAULT_VARIABLE_FORMAT = "{prefix}{j}";

	private Node node;
	private final Map<String, String> metadata;

	public Tree(Node node)
	{
		this(node, null);
	}

	public Tree(Node node, Map<String, String> metadata)
	{
		this.node = Objects.requireNonNull(node);
		this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
	}

	public Node getNode() { return node; }
	public Map<String, String> getMetadata() { return metadata; }

	/**
	 * Nodes with a variable, in pre-order.
	 */
	public List<Node> nodes()
	{
		List<Node> nodes = new ArrayList<>();
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(node);
		while (!stack.isEmpty())
		{
			Node n = stack.pop();
			if (n.getVariable() != null)
				nodes.add(n);
			List<Branch> branches = n.getBranches();
			for (int i = branches.size() - 1; i >= 0; --i)
			{
				if (!branches.get(i).isAtomic())
					stack.push(branches.get(i).getNode());
			}
		}
		return nodes;
	}

	/**
	 * Depth-first list of (path, branch) pairs, where the path holds the indices of the branches leading to each one.
	 */
	public List<Pair<List<Integer>, Branch>> walk()
	{
		List<Pair<List<Integer>, Branch>> walk = new ArrayList<>();
		Deque<Pair<List<Integer>, Branch>> stack = new ArrayDeque<>();
		pushBranches(stack, node, Collections.emptyList());
		while (!stack.isEmpty())
		{
			Pair<List<Integer>, Branch> step = stack.pop();
			walk.add(step);
			Branch branch = step.getRight();
			if (!branch.isAtomic())
				pushBranches(stack, branch.getNode(), step.getLeft());
		}
		return walk;
	}

	private static void pushBranches(Deque<Pair<List<Integer>, Branch>> stack, Node n, List<Integer> path)
	{
		List<Branch> branches = n.getBranches();
		for (int i = branches.size() - 1; i >= 0; --i)
		{
			List<Integer> branch_path = new ArrayList<>(path);
			branch_path.add(i);
			stack.push(Pair.of(Collections.unmodifiableList(branch_path), branches.get(i)));
		}
	}

	public void resetVariables()
	{
		resetVariables(DEFAULT_VARIABLE_FORMAT);
	}

	/**
	 * Recreates the variables of the tree following a format with the placeholders {prefix} (first letter of the
	 * concept), {i} (0-based counter) and {j} (empty for the first use of a prefix, then 2, 3...).
	 * References to the old variables in atomic targets are updated accordingly.
	 */
	public void resetVariables(String format)
	{
		Map<String, String> varmap = new HashMap<>();
		Set<String> used = new HashSet<>();
		for (Node n : nodes())
		{
			if (varmap.containsKey(n.getVariable()))
				continue;

			String prefix = defaultVariablePrefix(n.getConcept());
			String new_var = null;
			for (int i = 0; new_var == null || used.contains(new_var); ++i)
			{
				new_var = format
						.replace("{prefix}", prefix)
						.replace("{i}", String.valueOf(i))
						.replace("{j}", i == 0 ? "" : String.valueOf(i + 1));
			}
			used.add(new_var);
			varmap.put(n.getVariable(), new_var);
		}

		Deque<Node> stack = new ArrayDeque<>();
		stack.push(node);
		while (!stack.isEmpty())
		{
			Node n = stack.pop();
			List<Branch> branches = n.getBranches();
			for (int i = 0; i < branches.size(); ++i)
			{
				Branch b = branches.get(i);
				if (!b.isAtomic())
					stack.push(b.getNode());
				else if (!b.getRole().equals("/") && varmap.containsKey(b.getAtom()))
					branches.set(i, new Branch(b.getRole(), varmap.get(b.getAtom())));
			}
			if (n.getVariable() != null)
				n.setVariable(varmap.get(n.getVariable()));
		}
	}

	/**
	 * Lower-cased first letter of a concept, or '_' if it has none.
	 */
	public static String defaultVariablePrefix(String concept)
	{
		if (concept != null)
		{
			for (char c : concept.toCharArray())
			{
				if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))
					return String.valueOf(Character.toLowerCase(c));
			}
		}
		return "_";
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Tree other = (Tree) o;
		return node.equals(other.node) && metadata.equals(other.metadata);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(node, metadata);
	}

	@Override
	public String toString()
	{
		return "Tree(" + node + ")";
	}
}
