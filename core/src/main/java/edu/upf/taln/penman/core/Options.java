package edu.upf.taln.penman.core;

import edu.upf.taln.penman.core.io.PenmanFormatter;

public class Options
{
	public enum Rearrangement {NONE, CANONICAL, RANDOM}

	public Integer indent = PenmanFormatter.ADAPTIVE_INDENT; // columns per nesting level, -1 for adaptive indentation, null to write graphs on one line
	public boolean compact = false; // keep attributes preceding the first nested node on the first line
	public boolean triples = false; // write triple conjunctions instead of trees
	public boolean canonicalize_roles = false; // normalize roles, e.g. :ARG0-of-of -> :ARG0
	public boolean reify_edges = false; // replace reifiable edges with nodes, e.g. :mod -> have-mod-91
	public boolean dereify_edges = false; // collapse reified nodes into edges where possible
	public boolean reify_attributes = false; // make a node out of each attribute value
	public boolean indicate_branches = false; // add a triple with the top role for each nested node
	public String make_variables = null; // template used to rename variables, e.g. "{prefix}{j}". null keeps variables
	public Rearrangement rearrange = Rearrangement.NONE; // order of branches in the written tree
	public boolean attributes_first = false; // place attributes before edges to other nodes

	public Options() {}

	public Options(Options o)
	{
		this.indent = o.indent;
		this.compact = o.compact;
		this.triples = o.triples;
		this.canonicalize_roles = o.canonicalize_roles;
		this.reify_edges = o.reify_edges;
		this.dereify_edges = o.dereify_edges;
		this.reify_attributes = o.reify_attributes;
		this.indicate_branches = o.indicate_branches;
		this.make_variables = o.make_variables;
		this.rearrange = o.rearrange;
		this.attributes_first = o.attributes_first;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\tindent = " + (indent == null ? "flat" : indent == PenmanFormatter.ADAPTIVE_INDENT ? "adaptive" : indent) +
				"\n\tcompact = " + compact +
				"\n\ttriples = " + triples +
				"\n\tcanonicalize_roles = " + canonicalize_roles +
				"\n\treify_edges = " + reify_edges +
				"\n\tdereify_edges = " + dereify_edges +
				"\n\treify_attributes = " + reify_attributes +
				"\n\tindicate_branches = " + indicate_branches +
				"\n\tmake_variables = " + make_variables +
				"\n\trearrange = " + rearrange +
				"\n\tattributes_first = " + attributes_first;
	}
}
