package edu.upf.taln.penman.core.structures;

import java.io.Serializable;
import java.util.Objects;

/**
 * A relation (source, role, target). The source is a variable, the role starts with ':' and the target is either a
 * variable or a constant. A null target stands for a missing value.
 */
public final class Triple implements Serializable
{
	private final String source;
	private final String role;
	private final String target;
	private final static long serialVersionUID = 1L;

	public Triple(String source, String role, String target)
	{
		this.source = source;
		this.role = role;
		this.target = target;
	}

	public String getSource() { return source; }
	public String getRole() { return role; }
	public String getTarget() { return target; }

	public Triple withRole(String new_role)
	{
		return new Triple(source, new_role, target);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Triple other = (Triple) o;
		return Objects.equals(source, other.source) &&
				Objects.equals(role, other.role) &&
				Objects.equals(target, other.target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(source, role, target);
	}

	@Override
	public String toString()
	{
		return "(" + source + ", " + role + ", " + target + ")";
	}
}
