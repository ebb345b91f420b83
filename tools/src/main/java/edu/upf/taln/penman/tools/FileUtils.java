package edu.upf.taln.penman.tools;

import com.google.common.base.Charsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

public class FileUtils
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * @return the contents of the file, or null if it cannot be read
	 */
	public static String readTextFile(Path file)
	{
		try
		{
			return org.apache.commons.io.FileUtils.readFileToString(file.toFile(), Charsets.UTF_8);
		}
		catch (IOException e)
		{
			log.error("Cannot read file " + file + ": " + e);
			return null;
		}
	}

	/**
	 * @return true if the text was written
	 */
	public static boolean writeTextToFile(Path file, String text)
	{
		try
		{
			org.apache.commons.io.FileUtils.writeStringToFile(file.toFile(), text, Charsets.UTF_8);
			return true;
		}
		catch (IOException e)
		{
			log.error("Cannot write to file " + file + ": " + e);
			return false;
		}
	}
}
