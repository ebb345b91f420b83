package edu.upf.taln.penman.core;

/** Raised when surface alignment markers are malformed. */
public class SurfaceException extends PenmanException
{
	public SurfaceException(String message)
	{
		super(message);
	}
}
