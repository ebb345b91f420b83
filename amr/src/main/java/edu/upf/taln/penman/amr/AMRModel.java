package edu.upf.taln.penman.amr;

import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.model.ModelReader;

/**
 * Role inventory, normalizations and reifications of Abstract Meaning Representation.
 */
public final class AMRModel
{
	private final static String RESOURCE = "/amr.json";
	private static Model model = null;

	private AMRModel() {}

	public static synchronized Model get()
	{
		if (model == null)
			model = ModelReader.readResource(AMRModel.class, RESOURCE);
		return model;
	}
}
