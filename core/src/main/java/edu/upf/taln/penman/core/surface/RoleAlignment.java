package edu.upf.taln.penman.core.surface;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/** Alignment of a branch role to surface tokens */
public class RoleAlignment extends AlignmentMarker
{
	public RoleAlignment(List<Integer> indices, String prefix)
	{
		super(indices, prefix);
	}

	public static RoleAlignment fromString(String s)
	{
		Pair<String, List<Integer>> parts = split(s);
		return new RoleAlignment(parts.getRight(), parts.getLeft());
	}

	@Override
	public Mode getMode()
	{
		return Mode.ROLE;
	}
}
