package edu.upf.taln.penman.core.layout;

/**
 * Indicates that the node context is closed after the triple it is attached to. There is a single instance.
 */
public final class Pop extends LayoutMarker
{
	public final static Pop POP = new Pop();

	private Pop() {}

	@Override
	public String toString()
	{
		return "POP";
	}
}
