package edu.upf.taln.penman.core.model;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import edu.upf.taln.penman.core.ModelException;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Reads models from their JSON definition.
 */
public class ModelReader
{
	private final static Logger log = LogManager.getLogger();

	public static Model read(String json)
	{
		try
		{
			ModelDefinition d = new Gson().fromJson(json, ModelDefinition.class);
			if (d == null)
				throw new ModelException("Empty model definition");
			return Model.fromDefinition(d);
		}
		catch (JsonParseException e)
		{
			throw new ModelException("Cannot parse model definition: " + e.getMessage());
		}
	}

	public static Model read(Path file)
	{
		try
		{
			log.info("Reading model from " + file);
			return read(FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8));
		}
		catch (IOException e)
		{
			throw new ModelException("Cannot read model file " + file + ": " + e);
		}
	}

	/**
	 * Reads a model definition from the classpath of the given class.
	 */
	public static Model readResource(Class<?> owner, String resource)
	{
		InputStream is = owner.getResourceAsStream(resource);
		if (is == null)
			throw new ModelException("Cannot find model resource " + resource);

		try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8))
		{
			ModelDefinition d = new Gson().fromJson(reader, ModelDefinition.class);
			return Model.fromDefinition(d);
		}
		catch (IOException | JsonParseException e)
		{
			throw new ModelException("Cannot read model resource " + resource + ": " + e);
		}
	}
}
