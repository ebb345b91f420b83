package edu.upf.taln.penman.core;

/** Raised on invalid graph operations, such as setting a top that is not a variable. */
public class GraphException extends PenmanException
{
	public GraphException(String message)
	{
		super(message);
	}
}
