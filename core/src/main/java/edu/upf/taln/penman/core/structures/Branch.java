package edu.upf.taln.penman.core.structures;

import java.util.Objects;

/**
 * A (role, target) pair in a tree node. The role is '/' for the concept branch and otherwise starts with ':', possibly
 * followed by an alignment suffix.
 */
public final class Branch
{
	private final String role;
	private final Target target;

	public Branch(String role, String atom)
	{
		this(role, new Atom(atom));
	}

	public Branch(String role, Target target)
	{
		this.role = role;
		this.target = Objects.requireNonNull(target);
	}

	public String getRole() { return role; }
	public Target getTarget() { return target; }
	public boolean isAtomic() { return target.isAtomic(); }

	/** Value of an atomic target, null if missing or if the target is a node */
	public String getAtom()
	{
		return target.isAtomic() ? ((Atom) target).getValue() : null;
	}

	/** Nested node, null if the target is atomic */
	public Node getNode()
	{
		return target.isAtomic() ? null : (Node) target;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Branch other = (Branch) o;
		return Objects.equals(role, other.role) && target.equals(other.target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(role, target);
	}

	@Override
	public String toString()
	{
		return "(" + role + ", " + target + ")";
	}
}
