package edu.upf.taln.penman.core.surface;

import edu.upf.taln.penman.core.structures.Epidatum;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Access to the surface alignments stored in the epigraph of a graph.
 */
public final class Surface
{
	private Surface() {}

	/** Concept and attribute alignments, by triple */
	public static Map<Triple, Alignment> alignments(Graph g)
	{
		return collect(g, Alignment.class);
	}

	public static Map<Triple, RoleAlignment> roleAlignments(Graph g)
	{
		return collect(g, RoleAlignment.class);
	}

	private static <T extends AlignmentMarker> Map<Triple, T> collect(Graph g, Class<T> type)
	{
		Map<Triple, T> alignments = new LinkedHashMap<>();
		for (Map.Entry<Triple, List<Epidatum>> e : g.getEpidata().entrySet())
		{
			for (Epidatum epi : e.getValue())
			{
				if (type.isInstance(epi))
					alignments.put(e.getKey(), type.cast(epi));
			}
		}
		return alignments;
	}
}
