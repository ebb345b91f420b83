package edu.upf.taln.penman.core.model;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.penman.core.ModelException;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DefaultUndirectedGraph;

import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A semantic model: the inventory of valid roles, role normalizations and reifications. Role names in the inventory
 * are regular expressions (e.g. ":op[0-9]+"). The default model has an empty inventory, so every role ending in "-of"
 * is taken to be inverted.
 */
public class Model
{
	private final static String INVERSE_SUFFIX = "-of";
	private final static Pattern ALPHANUMERIC_ROLE = Pattern.compile("(.*\\D)(\\d+)$");

	private final String topVariable;
	private final String topRole;
	private final String conceptRole;
	private final Map<String, Object> roles;
	private final Map<String, String> normalizations;
	private final List<Reification> reification_specs;
	private final Map<String, List<Reification>> reifications = new HashMap<>(); // role -> reifications
	private final Map<String, List<Reification>> dereifications = new HashMap<>(); // concept -> reifications
	private final Pattern role_re;

	public Model()
	{
		this(null, null, null, null, null, null);
	}

	/**
	 * Null arguments take default values: "top", ":TOP", ":instance" and empty tables.
	 */
	public Model(String topVariable, String topRole, String conceptRole, Map<String, Object> roles,
	             Map<String, String> normalizations, List<Reification> reifications)
	{
		this.topVariable = topVariable != null ? topVariable : "top";
		this.topRole = topRole != null ? topRole : ":TOP";
		this.conceptRole = conceptRole != null ? conceptRole : Graph.CONCEPT_ROLE;
		this.roles = roles != null ? new LinkedHashMap<>(roles) : new LinkedHashMap<>();
		this.normalizations = normalizations != null ? new LinkedHashMap<>(normalizations) : new LinkedHashMap<>();
		this.reification_specs = reifications != null ? ImmutableList.copyOf(reifications) : ImmutableList.of();

		for (Reification r : reification_specs)
		{
			this.reifications.computeIfAbsent(r.getRole(), k -> new ArrayList<>()).add(r);
			this.dereifications.computeIfAbsent(r.getConcept(), k -> new ArrayList<>()).add(r);
		}

		String alternatives = Stream.concat(this.roles.keySet().stream(), Stream.of(this.topRole, this.conceptRole))
				.collect(Collectors.joining("|"));
		this.role_re = Pattern.compile("^(" + alternatives + ")$");
	}

	public static Model fromDefinition(ModelDefinition d)
	{
		List<Reification> reifications = d.reifications == null ? null : d.reifications.stream()
				.map(r -> new Reification(r.role, r.concept, r.source, r.target))
				.collect(Collectors.toList());
		return new Model(d.topVariable, d.topRole, d.conceptRole, d.roles, d.normalizations, reifications);
	}

	public String getTopVariable() { return topVariable; }
	public String getTopRole() { return topRole; }
	public String getConceptRole() { return conceptRole; }
	public Map<String, Object> getRoles() { return Collections.unmodifiableMap(roles); }
	public Map<String, String> getNormalizations() { return Collections.unmodifiableMap(normalizations); }
	public List<Reification> getReifications() { return reification_specs; }

	/**
	 * True if the role, or its non-inverted form, is in the inventory.
	 */
	public boolean hasRole(String role)
	{
		return hasRoleExact(role) ||
				(role.endsWith(INVERSE_SUFFIX) && hasRoleExact(role.substring(0, role.length() - INVERSE_SUFFIX.length())));
	}

	private boolean hasRoleExact(String role)
	{
		return role_re.matcher(role).matches();
	}

	/** A role is inverted if it ends in "-of" and is not itself in the inventory (e.g. ":consist-of") */
	public boolean isRoleInverted(String role)
	{
		return !hasRoleExact(role) && role.endsWith(INVERSE_SUFFIX);
	}

	public String invertRole(String role)
	{
		if (!hasRoleExact(role) && role.endsWith(INVERSE_SUFFIX))
			return role.substring(0, role.length() - INVERSE_SUFFIX.length());
		return role + INVERSE_SUFFIX;
	}

	/**
	 * Swaps source and target and inverts the role. Not checked for constant targets.
	 */
	public Triple invert(Triple triple)
	{
		return new Triple(triple.getTarget(), invertRole(triple.getRole()), triple.getSource());
	}

	/**
	 * Inverts the triple only if its role is inverted.
	 */
	public Triple deinvert(Triple triple)
	{
		if (isRoleInverted(triple.getRole()))
			return invert(triple);
		return triple;
	}

	/**
	 * Adds a missing ':', collapses double inversions (":ARG0-of-of" -> ":ARG0") and applies normalizations.
	 */
	public String canonicalizeRole(String role)
	{
		if (!role.equals("/") && !role.startsWith(":"))
			role = ":" + role;
		role = canonicalizeInversion(role);
		return normalizations.getOrDefault(role, role);
	}

	private String canonicalizeInversion(String role)
	{
		if (!hasRoleExact(role))
		{
			while (true)
			{
				String prev = role;
				role = invertRole(invertRole(role));
				if (prev.equals(role))
					break;
			}
		}
		return role;
	}

	public Triple canonicalize(Triple triple)
	{
		return triple.withRole(canonicalizeRole(triple.getRole()));
	}

	public boolean isRoleReifiable(String role)
	{
		return reifications.containsKey(role);
	}

	/**
	 * Reifies an edge into three triples: (x, sourceRole, source), (x, :instance, concept), (x, targetRole, target).
	 * The new variable x is "_", or "_2", "_3"... if already taken.
	 *
	 * @param variables variables already in use, may be null
	 * @throws ModelException if the role cannot be reified
	 */
	public List<Triple> reify(Triple triple, Set<String> variables)
	{
		List<Reification> specs = reifications.get(triple.getRole());
		if (specs == null)
			throw new ModelException("'" + triple.getRole() + "' cannot be reified");
		Reification spec = specs.get(0);

		String variable = "_";
		if (variables != null)
		{
			int i = 2;
			while (variables.contains(variable))
				variable = "_" + i++;
		}

		return ImmutableList.of(
				new Triple(variable, spec.getSource(), triple.getSource()),
				new Triple(variable, Graph.CONCEPT_ROLE, spec.getConcept()),
				new Triple(variable, spec.getTarget(), triple.getTarget()));
	}

	public boolean isConceptDereifiable(String concept)
	{
		return dereifications.containsKey(concept);
	}

	/**
	 * Collapses a reified relation back into a single edge. The two role triples may come in either order.
	 *
	 * @throws IllegalArgumentException if the first triple is not an instance or the triples do not share a source
	 * @throws ModelException if the concept or role combination cannot be dereified
	 */
	public Triple dereify(Triple instance, Triple first, Triple second)
	{
		if (!instance.getRole().equals(Graph.CONCEPT_ROLE))
			throw new IllegalArgumentException("first argument is not an instance triple: " + instance);
		if (!Objects.equals(instance.getSource(), first.getSource()) || !Objects.equals(instance.getSource(), second.getSource()))
			throw new IllegalArgumentException("triples do not share the same source");

		String concept = instance.getTarget();
		List<Reification> specs = dereifications.get(concept);
		if (specs == null)
			throw new ModelException(concept + " cannot be dereified");

		for (Reification spec : specs)
		{
			if (spec.getSource().equals(first.getRole()) && spec.getTarget().equals(second.getRole()))
				return new Triple(first.getTarget(), spec.getRole(), second.getTarget());
			else if (spec.getTarget().equals(first.getRole()) && spec.getSource().equals(second.getRole()))
				return new Triple(second.getTarget(), spec.getRole(), first.getTarget());
		}

		throw new ModelException(first.getRole() + " and " + second.getRole() + " are not valid roles to dereify " + concept);
	}

	/** Keeps roles in their original order (relies on stable sorting) */
	public Comparator<String> originalOrder()
	{
		return (r1, r2) -> 0;
	}

	/** Sorts by role name and then by numeric suffix, so that ":op2" comes before ":op10" */
	public Comparator<String> alphanumericOrder()
	{
		Function<String, String> name = r -> {
			Matcher m = ALPHANUMERIC_ROLE.matcher(r);
			return m.matches() ? m.group(1) : r;
		};
		Function<String, Long> number = r -> {
			Matcher m = ALPHANUMERIC_ROLE.matcher(r);
			if (!m.matches())
				return 0L;
			try
			{
				return Long.parseLong(m.group(2));
			}
			catch (NumberFormatException e)
			{
				return Long.MAX_VALUE;
			}
		};
		return Comparator.comparing(name).thenComparing(number);
	}

	/** Non-inverted roles first, then alphanumeric order */
	public Comparator<String> canonicalOrder()
	{
		Comparator<String> inverted = Comparator.comparing(this::isRoleInverted);
		return inverted.thenComparing(alphanumericOrder());
	}

	/** Random but consistent order: each distinct role gets a random key on first use */
	public Comparator<String> randomOrder()
	{
		Random random = new Random();
		Map<String, Double> keys = new HashMap<>();
		return Comparator.comparing(r -> keys.computeIfAbsent(r, k -> random.nextDouble()));
	}

	/**
	 * Checks a graph against the model: roles must be in the inventory, the top must be a variable with triples and
	 * every variable must be reachable from the top, ignoring edge direction.
	 *
	 * @return errors by triple, with graph-level errors under the null key; empty if the graph is valid
	 */
	public Map<Triple, List<String>> errors(Graph graph)
	{
		Map<Triple, List<String>> errors = new LinkedHashMap<>();
		if (graph.getTriples().isEmpty())
		{
			errors.put(null, new ArrayList<>(List.of("graph is empty")));
			return errors;
		}

		Map<String, List<Triple>> by_variable = new LinkedHashMap<>();
		for (Triple triple : graph.getTriples())
		{
			if (!hasRole(triple.getRole()))
				errors.computeIfAbsent(triple, t -> new ArrayList<>()).add("invalid role");
			by_variable.computeIfAbsent(triple.getSource(), v -> new ArrayList<>()).add(triple);
		}

		String top = graph.getTop();
		if (top == null)
			errors.computeIfAbsent(null, t -> new ArrayList<>()).add("top is not set");
		else if (!by_variable.containsKey(top))
			errors.computeIfAbsent(null, t -> new ArrayList<>()).add("top is not a variable in the graph");

		DefaultUndirectedGraph<String, DefaultEdge> g = new DefaultUndirectedGraph<>(DefaultEdge.class);
		by_variable.keySet().forEach(g::addVertex);
		graph.getTriples().stream()
				.filter(t -> by_variable.containsKey(t.getTarget()))
				.forEach(t -> g.addEdge(t.getSource(), t.getTarget()));
		Set<String> reachable = top != null && g.containsVertex(top) ?
				new ConnectivityInspector<>(g).connectedSetOf(top) : Collections.emptySet();

		by_variable.forEach((variable, triples) -> {
			if (!reachable.contains(variable))
				triples.forEach(t -> errors.computeIfAbsent(t, k -> new ArrayList<>()).add("unreachable"));
		});

		return errors;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Model other = (Model) o;
		return topVariable.equals(other.topVariable) &&
				topRole.equals(other.topRole) &&
				conceptRole.equals(other.conceptRole) &&
				roles.equals(other.roles) &&
				normalizations.equals(other.normalizations) &&
				reification_specs.equals(other.reification_specs);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(topVariable, topRole, conceptRole, roles, normalizations, reification_specs);
	}
}
