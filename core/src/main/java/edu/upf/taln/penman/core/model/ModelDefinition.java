package edu.upf.taln.penman.core.model;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a model, as read from JSON. Missing fields take the defaults of {@link Model}.
 */
public class ModelDefinition
{
	public String topVariable;
	public String topRole;
	public String conceptRole;
	public Map<String, Object> roles; // role pattern -> role data (e.g. {"type": "frame"})
	public Map<String, String> normalizations;
	public List<ReificationDefinition> reifications;

	public static class ReificationDefinition
	{
		public String role;
		public String concept;
		public String source;
		public String target;
	}
}
