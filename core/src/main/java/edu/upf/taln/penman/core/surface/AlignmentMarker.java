package edu.upf.taln.penman.core.surface;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.penman.core.SurfaceException;
import edu.upf.taln.penman.core.structures.Epidatum;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Marker linking part of a branch to token indices of a surface string, written as "~e.1,2" where "e." is an
 * optional prefix.
 */
public abstract class AlignmentMarker extends Epidatum
{
	private final List<Integer> indices;
	private final String prefix; // may be null

	protected AlignmentMarker(List<Integer> indices, String prefix)
	{
		this.indices = ImmutableList.copyOf(indices);
		this.prefix = prefix;
	}

	public List<Integer> getIndices() { return indices; }
	public String getPrefix() { return prefix; }

	/**
	 * Splits marker text such as "~e.1,2" into its prefix (possibly null) and indices.
	 */
	protected static Pair<String, List<Integer>> split(String s)
	{
		String text = StringUtils.stripStart(s, "~");
		if (text.isEmpty())
			throw new SurfaceException("invalid alignment marker: " + s);

		String prefix = null;
		if (Character.isLetter(text.charAt(0)))
		{
			int i = text.length() > 1 && text.charAt(1) == '.' ? 2 : 1;
			prefix = text.substring(0, i);
			text = text.substring(i);
		}

		try
		{
			List<Integer> indices = Arrays.stream(text.split(","))
					.map(String::trim)
					.map(Integer::parseInt)
					.collect(Collectors.toList());
			return Pair.of(prefix, indices);
		}
		catch (NumberFormatException e)
		{
			throw new SurfaceException("invalid alignments: " + s);
		}
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AlignmentMarker other = (AlignmentMarker) o;
		return Objects.equals(prefix, other.prefix) && indices.equals(other.indices);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), prefix, indices);
	}

	@Override
	public String toString()
	{
		return "~" + (prefix == null ? "" : prefix) + indices.stream().map(String::valueOf).collect(Collectors.joining(","));
	}
}
