package edu.upf.taln.penman.core.model;

import edu.upf.taln.penman.core.structures.Triple;

/**
 * A model that takes every role at face value: triples are never deinverted during interpretation, so a graph keeps
 * the edge directions of the text it was read from.
 */
public class NoOpModel extends Model
{
	@Override
	public Triple deinvert(Triple triple)
	{
		return triple;
	}
}
