package edu.upf.taln.penman.tools;

import edu.upf.taln.penman.amr.AMRModel;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.model.ModelReader;
import edu.upf.taln.penman.core.model.NoOpModel;

import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/** Models selectable by name from the command line */
public final class Models
{
	public final static List<String> PREDEFINED = List.of("default", "amr", "noop");

	private Models() {}

	public static boolean isPredefined(String name)
	{
		return name != null && PREDEFINED.contains(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * @param name one of the predefined model names, or the path to a JSON model definition
	 * @throws edu.upf.taln.penman.core.ModelException if the definition cannot be read
	 */
	public static Model get(String name)
	{
		if (name == null)
			return new Model();
		switch (name.toLowerCase(Locale.ROOT))
		{
			case "default":
				return new Model();
			case "amr":
				return AMRModel.get();
			case "noop":
				return new NoOpModel();
			default:
				return ModelReader.read(Paths.get(name));
		}
	}
}
