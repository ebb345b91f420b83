package edu.upf.taln.penman.tools;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Defaults for the command line tools, read from penman.properties in the classpath.
 */
public class PenmanProperties
{
	public final static String RESOURCE = "penman.properties";
	private String model = "default";
	private Integer indent = CMLCheckers.toIndent(CMLCheckers.ADAPTIVE);
	private boolean compact = false;

	private final static Logger log = LogManager.getLogger();

	public PenmanProperties()
	{
		this(RESOURCE);
	}

	public PenmanProperties(String resource)
	{
		Properties prop = new Properties();
		try (InputStream input = PenmanProperties.class.getClassLoader().getResourceAsStream(resource))
		{
			if (input == null)
			{
				log.warn("Unable to find " + resource + ", using defaults");
				return;
			}
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + resource + ": " + e);
			return;
		}

		model = prop.getProperty("penman.model", model).trim();
		try
		{
			indent = CMLCheckers.toIndent(prop.getProperty("penman.indent", CMLCheckers.ADAPTIVE));
		}
		catch (NumberFormatException e)
		{
			log.error("Invalid value for penman.indent: " + prop.getProperty("penman.indent"));
		}
		compact = Boolean.parseBoolean(prop.getProperty("penman.compact", "false").trim());
	}

	public String getModel() { return model; }
	public Integer getIndent() { return indent; }
	public boolean isCompact() { return compact; }
}
