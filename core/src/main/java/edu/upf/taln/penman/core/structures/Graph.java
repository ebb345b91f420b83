package edu.upf.taln.penman.core.structures;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import edu.upf.taln.penman.core.GraphException;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A pure graph: a sequence of triples plus an optional explicit top, the epigraphical markers attached to triples and
 * the metadata read from comments. Layout information lives only in the epigraph.
 */
public class Graph
{
	public final static String CONCEPT_ROLE = ":instance";
	private final static AtomicInteger counter = new AtomicInteger();

	private final int id = counter.incrementAndGet(); // for debugging only
	private final List<Triple> triples;
	private String top; // explicit top, may be null
	private final EpidataMap epidata;
	private final Map<String, String> metadata;

	public Graph()
	{
		this(Collections.emptyList(), null, null, null);
	}

	public Graph(List<Triple> triples)
	{
		this(triples, null, null, null);
	}

	public Graph(List<Triple> triples, String top)
	{
		this(triples, top, null, null);
	}

	/**
	 * @param top      explicit top variable, or null to use the source of the first triple
	 * @param epidata  markers of the triples, may be null
	 * @param metadata comment metadata, may be null
	 */
	public Graph(List<Triple> triples, String top, Map<Triple, List<Epidatum>> epidata, Map<String, String> metadata)
	{
		this.triples = triples.stream()
				.map(t -> new Triple(t.getSource(), ensureColon(t.getRole()), t.getTarget()))
				.collect(Collectors.toUnmodifiableList());
		this.top = top;
		this.epidata = epidata == null ? new EpidataMap() : new EpidataMap(epidata);
		this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
	}

	public int getId() { return id; }
	public List<Triple> getTriples() { return triples; }
	public EpidataMap getEpidata() { return epidata; }
	public Map<String, String> getMetadata() { return metadata; }

	/**
	 * The explicit top if set, otherwise the source of the first triple, or null for an empty graph.
	 */
	public String getTop()
	{
		if (top != null)
			return top;
		if (!triples.isEmpty())
			return triples.get(0).getSource();
		return null;
	}

	/** Sets the top, which must be one of the variables of the graph (or null to make it implicit). */
	public void setTop(String top)
	{
		if (top != null && !variables().contains(top))
			throw new GraphException("top must be a valid node: " + top);
		this.top = top;
	}

	/**
	 * Variables are the sources of all triples plus the explicit top, in order of appearance.
	 */
	public Set<String> variables()
	{
		Set<String> variables = triples.stream()
				.map(Triple::getSource)
				.filter(Objects::nonNull)
				.collect(Collectors.toCollection(LinkedHashSet::new));
		if (top != null)
			variables.add(top);
		return variables;
	}

	public List<Triple> instances()
	{
		return instances(null, null);
	}

	/** Concept triples, optionally filtered by source and concept. */
	public List<Triple> instances(String source, String target)
	{
		return filter(triples.stream()
				.filter(t -> t.getRole().equals(CONCEPT_ROLE))
				.collect(Collectors.toList()), source, null, target);
	}

	public List<Triple> edges()
	{
		return edges(null, null, null);
	}

	/** Non-concept triples whose target is a variable. Null arguments match anything. */
	public List<Triple> edges(String source, String role, String target)
	{
		Set<String> variables = variables();
		return filter(triples.stream()
				.filter(t -> !t.getRole().equals(CONCEPT_ROLE) && variables.contains(t.getTarget()))
				.collect(Collectors.toList()), source, role, target);
	}

	public List<Triple> attributes()
	{
		return attributes(null, null, null);
	}

	/** Non-concept triples whose target is a constant. Null arguments match anything. */
	public List<Triple> attributes(String source, String role, String target)
	{
		Set<String> variables = variables();
		return filter(triples.stream()
				.filter(t -> !t.getRole().equals(CONCEPT_ROLE) && !variables.contains(t.getTarget()))
				.collect(Collectors.toList()), source, role, target);
	}

	/**
	 * Variables with more than one incoming edge, mapped to the number of extra entrancies. The top counts as having
	 * one implicit entrancy.
	 */
	public Map<String, Integer> reentrancies()
	{
		Multiset<String> entrancies = LinkedHashMultiset.create();
		String t = getTop();
		if (t != null)
			entrancies.add(t);
		edges().forEach(e -> entrancies.add(e.getTarget()));

		Map<String, Integer> reentrancies = new LinkedHashMap<>();
		entrancies.entrySet().stream()
				.filter(e -> e.getCount() >= 2)
				.forEach(e -> reentrancies.put(e.getElement(), e.getCount() - 1));
		return reentrancies;
	}

	/**
	 * A new graph with the triples of this graph followed by the triples of other not already present. Markers of
	 * the added triples are taken from other.
	 */
	public Graph union(Graph other)
	{
		Set<Triple> present = new HashSet<>(triples);
		List<Triple> merged = new ArrayList<>(triples);
		EpidataMap merged_epidata = new EpidataMap(epidata);
		for (Triple t : other.triples)
		{
			if (present.add(t))
			{
				merged.add(t);
				if (other.epidata.containsKey(t))
					merged_epidata.put(t, new ArrayList<>(other.epidata.get(t)));
			}
		}
		return new Graph(merged, top, merged_epidata, metadata);
	}

	/**
	 * A new graph without the triples of other. The explicit top is dropped if it no longer heads any triple.
	 */
	public Graph difference(Graph other)
	{
		Set<Triple> removed = new HashSet<>(other.triples);
		List<Triple> remaining = triples.stream()
				.filter(t -> !removed.contains(t))
				.collect(Collectors.toList());
		EpidataMap remaining_epidata = new EpidataMap(epidata);
		removed.forEach(remaining_epidata::remove);
		String new_top = remaining.stream().anyMatch(t -> Objects.equals(t.getSource(), top)) ? top : null;
		return new Graph(remaining, new_top, remaining_epidata, metadata);
	}

	private static List<Triple> filter(List<Triple> triples, String source, String role, String target)
	{
		if (source == null && role == null && target == null)
			return triples;
		return triples.stream()
				.filter(t -> source == null || source.equals(t.getSource()))
				.filter(t -> role == null || role.equals(t.getRole()))
				.filter(t -> target == null || target.equals(t.getTarget()))
				.collect(Collectors.toList());
	}

	private static String ensureColon(String role)
	{
		if (role == null)
			return ":";
		return role.startsWith(":") ? role : ":" + role;
	}

	/**
	 * Graphs are equal if they have the same top and the same set of triples.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Graph other = (Graph) o;
		return Objects.equals(getTop(), other.getTop()) &&
				triples.size() == other.triples.size() &&
				new HashSet<>(triples).equals(new HashSet<>(other.triples));
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getTop(), new HashSet<>(triples));
	}

	@Override
	public String toString()
	{
		return "Graph #" + id + " (top=" + getTop() + ") " + triples;
	}
}
