package edu.upf.taln.penman.core.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import edu.upf.taln.penman.core.ConstantException;

import java.util.regex.Pattern;

/**
 * Interpretation of the constants found as atomic targets: symbols such as "-", quoted strings and numbers.
 */
public final class Constants
{
	public enum Type {SYMBOL, STRING, INTEGER, FLOAT, NULL}

	private final static Pattern INTEGER = Pattern.compile("-?(?:0|[1-9][0-9]*)");
	private final static Pattern FLOAT = Pattern.compile("-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");
	private final static Gson gson = new GsonBuilder().disableHtmlEscaping().create();

	private Constants() {}

	public static Type type(String constant)
	{
		Object value = evaluate(constant);
		if (value == null)
			return Type.NULL;
		if (value instanceof String)
			return constant.startsWith("\"") && constant.endsWith("\"") ? Type.STRING : Type.SYMBOL;
		if (value instanceof Long)
			return Type.INTEGER;
		return Type.FLOAT;
	}

	/** True for a missing or empty constant, as left by a role without a target */
	public static boolean isNull(String constant)
	{
		return constant == null || constant.isEmpty();
	}

	/**
	 * Value of a constant: null for a missing or empty constant, an unquoted String for strings, a Long or Double for
	 * numbers and the text itself for symbols.
	 *
	 * @throws ConstantException if the constant has only one surrounding quote
	 */
	public static Object evaluate(String constant)
	{
		if (isNull(constant))
			return null;
		if (constant.startsWith("\"") != constant.endsWith("\"") || constant.equals("\""))
			throw new ConstantException("Unbalanced quotes: " + constant);

		if (constant.startsWith("\""))
		{
			try
			{
				return gson.fromJson(constant, String.class);
			}
			catch (JsonParseException e)
			{
				return constant;
			}
		}
		if (INTEGER.matcher(constant).matches())
		{
			try
			{
				return Long.parseLong(constant);
			}
			catch (NumberFormatException e)
			{
				return Double.parseDouble(constant);
			}
		}
		if (FLOAT.matcher(constant).matches())
			return Double.parseDouble(constant);
		return constant;
	}

	/**
	 * The constant as a quoted string, escaping quotes and backslashes. Null becomes the empty string.
	 */
	public static String quote(Object constant)
	{
		if (constant == null)
			return "\"\"";
		return gson.toJson(String.valueOf(constant));
	}
}
