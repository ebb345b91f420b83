package edu.upf.taln.penman.core.structures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered mapping of triples to their epigraphical markers. Triples are keyed by value, so identical triples
 * share a single entry.
 */
public class EpidataMap extends LinkedHashMap<Triple, List<Epidatum>>
{
	private final static long serialVersionUID = 1L;

	public EpidataMap() {}

	/** Deep copy: marker lists are copied, markers themselves are immutable and shared. */
	public EpidataMap(Map<Triple, List<Epidatum>> other)
	{
		other.forEach((t, epis) -> put(t, new ArrayList<>(epis)));
	}

	/** Markers of a triple, or an empty unmodifiable list if it has none. */
	public List<Epidatum> markers(Triple triple)
	{
		List<Epidatum> epis = get(triple);
		return epis == null ? Collections.emptyList() : epis;
	}
}
