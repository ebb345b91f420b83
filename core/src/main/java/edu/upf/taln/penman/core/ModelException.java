package edu.upf.taln.penman.core;

/** Raised when a triple or concept cannot be handled by a role model. */
public class ModelException extends PenmanException
{
	public ModelException(String message)
	{
		super(message);
	}
}
