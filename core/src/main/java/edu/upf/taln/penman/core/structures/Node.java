package edu.upf.taln.penman.core.structures;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * A tree node: a variable and an ordered, mutable list of branches. The variable is null only for the empty node
 * "()".
 */
public final class Node extends Target
{
	private String variable;
	private final List<Branch> branches;

	public Node(String variable)
	{
		this(variable, new ArrayList<>());
	}

	public Node(String variable, List<Branch> branches)
	{
		this.variable = variable;
		this.branches = new ArrayList<>(branches);
	}

	public String getVariable() { return variable; }
	public void setVariable(String variable) { this.variable = variable; }
	public List<Branch> getBranches() { return branches; }

	public Node add(String role, String atom)
	{
		branches.add(new Branch(role, atom));
		return this;
	}

	public Node add(String role, Target target)
	{
		branches.add(new Branch(role, target));
		return this;
	}

	/** Target of the first '/' branch, or null */
	public String getConcept()
	{
		return branches.stream()
				.filter(b -> b.getRole().equals("/") && b.isAtomic())
				.map(Branch::getAtom)
				.findFirst().orElse(null);
	}

	@Override
	public boolean isAtomic()
	{
		return false;
	}

	/*
	 * equals, hashCode and toString walk the tree with explicit stacks, so that arbitrarily deep trees can be compared
	 * and logged.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Deque<Node> left = new ArrayDeque<>();
		Deque<Node> right = new ArrayDeque<>();
		left.push(this);
		right.push((Node) o);
		while (!left.isEmpty())
		{
			Node a = left.pop();
			Node b = right.pop();
			if (!Objects.equals(a.variable, b.variable) || a.branches.size() != b.branches.size())
				return false;

			for (int i = 0; i < a.branches.size(); ++i)
			{
				Branch ba = a.branches.get(i);
				Branch bb = b.branches.get(i);
				if (!Objects.equals(ba.getRole(), bb.getRole()) || ba.isAtomic() != bb.isAtomic())
					return false;
				if (ba.isAtomic())
				{
					if (!Objects.equals(ba.getAtom(), bb.getAtom()))
						return false;
				}
				else if (ba.getNode() != bb.getNode())
				{
					left.push(ba.getNode());
					right.push(bb.getNode());
				}
			}
		}
		return true;
	}

	@Override
	public int hashCode()
	{
		int hash = 1;
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty())
		{
			Node node = stack.pop();
			hash = 31 * hash + Objects.hashCode(node.variable);
			hash = 31 * hash + node.branches.size();
			for (Branch b : node.branches)
			{
				hash = 31 * hash + Objects.hashCode(b.getRole());
				if (b.isAtomic())
					hash = 31 * hash + Objects.hashCode(b.getAtom());
				else
					stack.push(b.getNode());
			}
		}
		return hash;
	}

	@Override
	public String toString()
	{
		StringBuilder builder = new StringBuilder();
		Deque<Object> stack = new ArrayDeque<>(); // strings to append and nodes to expand
		stack.push(this);
		while (!stack.isEmpty())
		{
			Object item = stack.pop();
			if (item instanceof String)
			{
				builder.append((String) item);
				continue;
			}

			Node node = (Node) item;
			List<Object> parts = new ArrayList<>();
			parts.add("(" + node.variable + ", [");
			for (int i = 0; i < node.branches.size(); ++i)
			{
				Branch b = node.branches.get(i);
				parts.add((i > 0 ? ", " : "") + "(" + b.getRole() + ", ");
				parts.add(b.isAtomic() ? String.valueOf(b.getAtom()) : b.getNode());
				parts.add(")");
			}
			parts.add("])");
			for (int i = parts.size() - 1; i >= 0; --i)
				stack.push(parts.get(i));
		}
		return builder.toString();
	}
}
