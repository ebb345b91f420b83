package edu.upf.taln.penman.core;

import org.apache.commons.lang3.StringUtils;

/**
 * Raised when PENMAN or triple text cannot be parsed. Carries the position of the offending token.
 */
public class DecodeException extends PenmanException
{
	private final String description;
	private final String filename;
	private final int lineno; // 1-based, 0 if unknown
	private final int offset; // 0-based column
	private final String text; // full text of the offending line

	public DecodeException(String description)
	{
		this(description, null, 0, 0, null);
	}

	public DecodeException(String description, String filename, int lineno, int offset, String text)
	{
		super(describe(description, filename, lineno, offset, text));
		this.description = description;
		this.filename = filename;
		this.lineno = lineno;
		this.offset = offset;
		this.text = text;
	}

	public String getDescription() { return description; }
	public String getFilename() { return filename; }
	public int getLineno() { return lineno; }
	public int getOffset() { return offset; }
	public String getText() { return text; }

	private static String describe(String description, String filename, int lineno, int offset, String text)
	{
		StringBuilder b = new StringBuilder();
		if (filename != null || lineno > 0)
		{
			b.append("  File \"").append(filename == null ? "<string>" : filename).append("\"");
			if (lineno > 0)
				b.append(", line ").append(lineno);
			b.append("\n");
		}
		if (text != null)
		{
			b.append("    ").append(text).append("\n");
			b.append("    ").append(StringUtils.repeat(' ', offset)).append("^\n");
		}
		b.append(description);
		return b.toString();
	}
}
