package edu.upf.taln.penman.core.surface;

import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.SurfaceException;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class SurfaceTest
{
	private final PenmanCodec codec = new PenmanCodec();

	@Test
	public void testFromString()
	{
		Alignment a = Alignment.fromString("~1");
		Assert.assertEquals(List.of(1), a.getIndices());
		Assert.assertNull(a.getPrefix());
		Assert.assertEquals("~1", a.toString());

		RoleAlignment r = RoleAlignment.fromString("e.2,3");
		Assert.assertEquals(List.of(2, 3), r.getIndices());
		Assert.assertEquals("e.", r.getPrefix());
		Assert.assertEquals("~e.2,3", r.toString());

		Assert.assertEquals("~e4", Alignment.fromString("~e4").toString());
		Assert.assertNotEquals(Alignment.fromString("~1"), RoleAlignment.fromString("~1"));
	}

	@Test(expected = SurfaceException.class)
	public void testEmptyMarker()
	{
		Alignment.fromString("~");
	}

	@Test(expected = SurfaceException.class)
	public void testInvalidIndices()
	{
		Alignment.fromString("~e.x");
	}

	@Test
	public void testAlignments()
	{
		Graph g = codec.decode("(a / alpha~1)");
		Assert.assertEquals(Map.of(new Triple("a", ":instance", "alpha"), new Alignment(List.of(1), null)),
				Surface.alignments(g));
		Assert.assertTrue(Surface.roleAlignments(g).isEmpty());
	}

	@Test
	public void testRoleAlignments()
	{
		Graph g = codec.decode("(a :ARG~e.1,2 b)");
		Assert.assertEquals(List.of(new Triple("a", ":instance", null), new Triple("a", ":ARG", "b")), g.getTriples());
		Assert.assertTrue(Surface.alignments(g).isEmpty());
		Assert.assertEquals(Map.of(new Triple("a", ":ARG", "b"), new RoleAlignment(List.of(1, 2), "e.")),
				Surface.roleAlignments(g));
	}

	@Test
	public void testTildeInStrings()
	{
		Graph g = codec.decode("(a :ARG1 \"str~ing\" :ARG2 \"str~ing\"~1)");
		Assert.assertEquals(List.of(
				new Triple("a", ":instance", null),
				new Triple("a", ":ARG1", "\"str~ing\""),
				new Triple("a", ":ARG2", "\"str~ing\"")), g.getTriples());
		Assert.assertEquals(Map.of(new Triple("a", ":ARG2", "\"str~ing\""), new Alignment(List.of(1), null)),
				Surface.alignments(g));
	}
}
