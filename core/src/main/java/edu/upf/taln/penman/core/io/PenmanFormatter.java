package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.structures.Branch;
import edu.upf.taln.penman.core.structures.Node;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.structures.Triple;
import edu.upf.taln.penman.core.utils.Constants;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes trees as PENMAN text and triples as triple conjunctions.
 */
public class PenmanFormatter
{
	/** Indent nested branches to the column after the parent's variable */
	public final static int ADAPTIVE_INDENT = -1;

	/**
	 * @param indent  {@link #ADAPTIVE_INDENT}, a fixed number of columns per level, or null to write the tree on a
	 *                single line
	 * @param compact if true, attributes before the first nested node or reentrancy are kept on the first line
	 */
	public String format(Tree tree, Integer indent, boolean compact)
	{
		Set<String> vars = compact ?
				tree.nodes().stream().map(Node::getVariable).collect(Collectors.toSet()) : Collections.emptySet();
		List<String> parts = new ArrayList<>();
		tree.getMetadata().forEach((key, value) ->
				parts.add("# ::" + key + (value.isEmpty() ? "" : " " + value)));
		parts.add(formatNode(tree.getNode(), indent, vars));
		return String.join("\n", parts);
	}

	public String formatTriples(List<Triple> triples, boolean indent)
	{
		String delimiter = indent ? " ^\n" : " ^ ";
		return triples.stream()
				.map(t -> StringUtils.stripStart(t.getRole(), ":") + "(" + t.getSource() + ", " + t.getTarget() + ")")
				.collect(Collectors.joining(delimiter));
	}

	/**
	 * Writes nodes with an explicit stack of pending text and nested nodes, so deep trees do not exhaust the call stack.
	 */
	private static String formatNode(Node root, Integer indent, Set<String> vars)
	{
		StringBuilder builder = new StringBuilder();
		Deque<Object> stack = new ArrayDeque<>();
		stack.push(new PendingNode(root, 0));
		while (!stack.isEmpty())
		{
			Object item = stack.pop();
			if (item instanceof String)
				builder.append((String) item);
			else
			{
				List<Object> parts = expand((PendingNode) item, indent, vars);
				for (int i = parts.size() - 1; i >= 0; --i)
					stack.push(parts.get(i));
			}
		}
		return builder.toString();
	}

	/**
	 * Text of a node with its nested nodes left pending. Branches are separated by a newline and indentation, except
	 * in compact mode where the leading attributes share the first line.
	 */
	private static List<Object> expand(PendingNode pending, Integer indent, Set<String> vars)
	{
		Node node = pending.node;
		String variable = node.getVariable();
		if (variable == null || variable.isEmpty())
			return List.of("()");
		if (node.getBranches().isEmpty())
			return List.of("(" + variable + ")");

		int column = pending.column;
		String joiner;
		if (indent == null)
			joiner = " ";
		else
		{
			if (indent == ADAPTIVE_INDENT)
				column += variable.length() + 2; // '(' and a space
			else
				column += indent;
			joiner = "\n" + StringUtils.repeat(' ', column);
		}

		List<Object> parts = new ArrayList<>();
		parts.add("(" + variable + " ");
		boolean compact = !vars.isEmpty();
		for (int i = 0; i < node.getBranches().size(); ++i)
		{
			Branch branch = node.getBranches().get(i);
			if (compact && (!branch.isAtomic() || vars.contains(branch.getAtom())))
				compact = false;
			if (i > 0)
				parts.add(compact ? " " : joiner);

			String role = branch.getRole();
			if (!role.equals("/") && !role.startsWith(":"))
				role = ":" + role;

			if (!branch.isAtomic())
			{
				int child_column = indent != null && indent == ADAPTIVE_INDENT ? column + role.length() + 1 : column;
				parts.add(role + " ");
				parts.add(new PendingNode(branch.getNode(), child_column));
			}
			else if (Constants.isNull(branch.getAtom()))
				parts.add(role);
			else
				parts.add(role + " " + branch.getAtom());
		}
		parts.add(")");
		return parts;
	}

	private static class PendingNode
	{
		final Node node;
		final int column;

		PendingNode(Node node, int column)
		{
			this.node = node;
			this.column = column;
		}
	}
}
