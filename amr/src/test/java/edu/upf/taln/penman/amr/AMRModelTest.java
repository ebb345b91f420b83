package edu.upf.taln.penman.amr;

import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Triple;
import edu.upf.taln.penman.core.transform.Transformations;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class AMRModelTest
{
	private final Model amr = AMRModel.get();
	private final PenmanCodec codec = new PenmanCodec(amr);

	@Test
	public void testRoles()
	{
		Assert.assertSame(amr, AMRModel.get());
		Assert.assertTrue(amr.hasRole(":ARG0"));
		Assert.assertTrue(amr.hasRole(":ARG9-of"));
		Assert.assertFalse(amr.hasRole(":ARG10"));
		Assert.assertTrue(amr.hasRole(":op12"));
		Assert.assertTrue(amr.hasRole(":snt2"));
		Assert.assertTrue(amr.hasRole(":year2"));
		Assert.assertTrue(amr.hasRole(":prep-on-behalf-of"));
		Assert.assertFalse(amr.hasRole(":foo"));

		Assert.assertTrue(amr.isRoleInverted(":mod-of"));
		Assert.assertFalse(amr.isRoleInverted(":consist-of"));
		Assert.assertFalse(amr.isRoleInverted(":prep-on-behalf-of"));
		Assert.assertEquals(":consist-of-of", amr.invertRole(":consist-of"));
	}

	@Test
	public void testCanonicalizeRole()
	{
		Assert.assertEquals(":ARG1", amr.canonicalizeRole(":ARG1-of-of"));
		Assert.assertEquals(":domain", amr.canonicalizeRole(":mod-of"));
		Assert.assertEquals(":mod", amr.canonicalizeRole(":domain-of"));
		Assert.assertEquals(":consist-of", amr.canonicalizeRole("consist-of"));
	}

	@Test
	public void testReify()
	{
		Assert.assertEquals(List.of(
				new Triple("_", ":ARG1", "a"),
				new Triple("_", ":instance", "have-polarity-91"),
				new Triple("_", ":ARG2", "-")),
				amr.reify(new Triple("a", ":polarity", "-"), null));
		Assert.assertEquals(List.of(
				new Triple("_", ":ARG1", "c"),
				new Triple("_", ":instance", "own-01"),
				new Triple("_", ":ARG0", "b")),
				amr.reify(new Triple("c", ":poss", "b"), null));
		Assert.assertFalse(amr.isRoleReifiable(":ARG0"));
		Assert.assertTrue(amr.isConceptDereifiable("have-03"));
	}

	@Test
	public void testCanonicalizeRolesInTree()
	{
		Assert.assertEquals("(a / alpha :domain~1 (b / beta))",
				codec.format(Transformations.canonicalizeRoles(codec.parse("(a / alpha :mod-of~1 (b / beta))"), amr), null, false));
	}

	@Test
	public void testReifyEdges()
	{
		Graph g = Transformations.reifyEdges(codec.decode("(a / alpha :mod-of (b / beta :polarity -))"), amr);
		Assert.assertEquals(
				"(a / alpha :ARG2-of (_ / have-mod-91 :ARG1 (b / beta :ARG1-of (_2 / have-polarity-91 :ARG2 -))))",
				codec.encode(g, null, null, false));

		g = Transformations.reifyEdges(codec.decode("(a / alpha :mod-of~1 (b / beta~2 :polarity -))"), amr);
		Assert.assertEquals(
				"(a / alpha :ARG2-of (_ / have-mod-91~1 :ARG1 (b / beta~2 :ARG1-of (_2 / have-polarity-91 :ARG2 -))))",
				codec.encode(g, null, null, false));
	}

	@Test
	public void testDereifyEdges()
	{
		Graph g = codec.decode("(a / alpha\n" +
				"   :ARG1-of (b / beta\n" +
				"               :ARG0 p)\n" +
				"   :ARG1-of (g / gamma\n" +
				"               :ARG1-of (_ / own-01\n" +
				"                           :ARG0 (p / pi))))");
		g = Transformations.dereifyEdges(g, amr);
		Assert.assertEquals("(a / alpha :ARG1-of (b / beta :ARG0 p) :ARG1-of (g / gamma :poss (p / pi)))",
				codec.encode(g, null, null, false));
	}

	@Test
	public void testErrors()
	{
		Assert.assertTrue(amr.errors(codec.decode("(a / alpha :ARG0 (b / beta) :mod-of (g / gamma))")).isEmpty());
		Assert.assertEquals(1, amr.errors(codec.decode("(a / alpha :foo (b / beta))")).size());
	}
}
