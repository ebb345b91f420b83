package edu.upf.taln.penman.core;

/** Raised when a constant cannot be evaluated. */
public class ConstantException extends PenmanException
{
	public ConstantException(String message)
	{
		super(message);
	}
}
