package edu.upf.taln.penman.core.structures;

import java.util.Objects;

/** Atomic branch target: a variable, a constant or a concept, as raw text. May be null if missing. */
public final class Atom extends Target
{
	private final String value;

	public Atom(String value)
	{
		this.value = value;
	}

	public String getValue() { return value; }

	@Override
	public boolean isAtomic()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(value, ((Atom) o).value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hashCode(value);
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
