package edu.upf.taln.penman.core;

/**
 * Base class of all errors raised while reading, interpreting, laying out or writing PENMAN graphs.
 */
public class PenmanException extends RuntimeException
{
	public PenmanException(String message)
	{
		super(message);
	}

	public PenmanException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
