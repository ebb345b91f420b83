package edu.upf.taln.penman.core;

/** Raised when a tree cannot be interpreted as a graph or a graph cannot be configured as a tree. */
public class LayoutException extends PenmanException
{
	public LayoutException(String message)
	{
		super(message);
	}
}
