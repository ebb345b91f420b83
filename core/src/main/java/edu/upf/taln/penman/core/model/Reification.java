package edu.upf.taln.penman.core.model;

import java.util.Objects;

/**
 * A reification rule: an edge with this role can be replaced by a node with this concept, linked to the original
 * source and target through the source and target roles.
 */
public final class Reification
{
	private final String role;
	private final String concept;
	private final String source;
	private final String target;

	public Reification(String role, String concept, String source, String target)
	{
		this.role = role;
		this.concept = concept;
		this.source = source;
		this.target = target;
	}

	public String getRole() { return role; }
	public String getConcept() { return concept; }
	public String getSource() { return source; }
	public String getTarget() { return target; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Reification other = (Reification) o;
		return role.equals(other.role) && concept.equals(other.concept) &&
				source.equals(other.source) && target.equals(other.target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(role, concept, source, target);
	}

	@Override
	public String toString()
	{
		return role + " -> " + concept + " (" + source + ", " + target + ")";
	}
}
