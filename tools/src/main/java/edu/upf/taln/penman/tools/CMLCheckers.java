package edu.upf.taln.penman.tools;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Enums;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.io.PenmanFormatter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class CMLCheckers
{
	public final static String FLAT = "flat";
	public final static String ADAPTIVE = "adaptive";

	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class IndentValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				Integer indent = toIndent(value);
				if (indent != null && indent < PenmanFormatter.ADAPTIVE_INDENT)
					throw new ParameterException("Invalid indentation " + name + " = " + value);
			}
			catch (NumberFormatException e)
			{
				throw new ParameterException("Indentation must be '" + FLAT + "', '" + ADAPTIVE + "' or a number: " + name + " = " + value);
			}
		}
	}

	public static class ModelValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (Models.isPredefined(value))
				return;
			Path path = Paths.get(value);
			if (!Files.isRegularFile(path) || !value.toLowerCase(Locale.ROOT).endsWith(".json"))
				throw new ParameterException("Model must be one of " + Models.PREDEFINED + " or a JSON file: " + name + " = " + value);
		}
	}

	public static class RearrangementConverter implements IStringConverter<Options.Rearrangement>
	{
		@Override
		public Options.Rearrangement convert(String value)
		{
			return Options.Rearrangement.valueOf(value.toUpperCase(Locale.ROOT));
		}
	}

	public static class RearrangementValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!Enums.getIfPresent(Options.Rearrangement.class, value.toUpperCase(Locale.ROOT)).isPresent())
				throw new ParameterException("Invalid rearrangement " + name + " = " + value);
		}
	}

	/**
	 * "flat" writes graphs on a single line, "adaptive" aligns branches with their parent's role and a number gives
	 * a fixed indentation.
	 */
	static Integer toIndent(String value)
	{
		if (value == null || value.equalsIgnoreCase(FLAT))
			return null;
		if (value.equalsIgnoreCase(ADAPTIVE))
			return PenmanFormatter.ADAPTIVE_INDENT;
		return Integer.parseInt(value.trim());
	}
}
