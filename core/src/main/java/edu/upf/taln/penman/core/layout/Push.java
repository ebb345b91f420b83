package edu.upf.taln.penman.core.layout;

import java.util.Objects;

/**
 * Indicates that the triple it is attached to opens a new node context for a variable.
 */
public final class Push extends LayoutMarker
{
	private final String variable;

	public Push(String variable)
	{
		this.variable = variable;
	}

	public String getVariable() { return variable; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(variable, ((Push) o).variable);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(Push.class, variable);
	}

	@Override
	public String toString()
	{
		return "Push(" + variable + ")";
	}
}
