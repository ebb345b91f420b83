package edu.upf.taln.penman.core;

import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.model.ModelReader;
import edu.upf.taln.penman.core.structures.Triple;

import java.util.List;

/** Graphs and models shared by tests */
public final class Fixtures
{
	public final static String X1 = "(e2 / _try_v_1\n" +
			"    :ARG1 (x1 / named\n" +
			"              :CARG \"Abrams\"\n" +
			"              :RSTR-of (_1 / proper_q))\n" +
			"    :ARG2 (e3 / _sleep_v_1\n" +
			"              :ARG1 x1))";

	public final static List<Triple> X1_TRIPLES = List.of(
			new Triple("e2", ":instance", "_try_v_1"),
			new Triple("e2", ":ARG1", "x1"),
			new Triple("x1", ":instance", "named"),
			new Triple("x1", ":CARG", "\"Abrams\""),
			new Triple("_1", ":RSTR", "x1"),
			new Triple("_1", ":instance", "proper_q"),
			new Triple("e2", ":ARG2", "e3"),
			new Triple("e3", ":instance", "_sleep_v_1"),
			new Triple("e3", ":ARG1", "x1"));

	private Fixtures() {}

	/** A small AMR-like model with a handful of roles, two normalizations and two reifications */
	public static Model miniAmr()
	{
		return ModelReader.readResource(Fixtures.class, "/mini-amr.json");
	}
}
