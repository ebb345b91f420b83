package edu.upf.taln.penman.core.structures;

/**
 * Target of a branch in a tree: either an {@link Atom} or a nested {@link Node}.
 */
public abstract class Target
{
	public abstract boolean isAtomic();
}
