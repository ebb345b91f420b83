package edu.upf.taln.penman.core.io;

/**
 * Token types of PENMAN and triple-conjunction text, with the regular expression matching each one.
 */
public enum TokenType
{
	COMMENT("#.*$"),
	STRING("\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\""),
	ALIGNMENT("~(?:[a-z]\\.?)?[0-9]+(?:,[0-9]+)*"),
	ROLE(":[^ \\t\\r\\n\\x0B\\f()/:~]*"),
	SYMBOL("[^ \\t\\r\\n\\x0B\\f()/:~]+"),
	LPAREN("\\("),
	RPAREN("\\)"),
	SLASH("/"),
	UNEXPECTED("[^ \\t\\r\\n\\x0B\\f]");

	private final String pattern;

	TokenType(String pattern)
	{
		this.pattern = pattern;
	}

	public String getPattern() { return pattern; }
}
