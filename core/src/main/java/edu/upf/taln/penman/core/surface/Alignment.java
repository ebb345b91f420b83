package edu.upf.taln.penman.core.surface;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/** Alignment of a branch target (or concept) to surface tokens */
public class Alignment extends AlignmentMarker
{
	public Alignment(List<Integer> indices, String prefix)
	{
		super(indices, prefix);
	}

	public static Alignment fromString(String s)
	{
		Pair<String, List<Integer>> parts = split(s);
		return new Alignment(parts.getRight(), parts.getLeft());
	}

	@Override
	public Mode getMode()
	{
		return Mode.TARGET;
	}
}
