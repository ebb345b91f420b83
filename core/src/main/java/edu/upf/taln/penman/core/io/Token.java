package edu.upf.taln.penman.core.io;

/** A lexed token and its position */
public final class Token
{
	private final TokenType type;
	private final String text;
	private final int lineno; // 1-based
	private final int offset; // 0-based
	private final String line;

	public Token(TokenType type, String text, int lineno, int offset, String line)
	{
		this.type = type;
		this.text = text;
		this.lineno = lineno;
		this.offset = offset;
		this.line = line;
	}

	public TokenType getType() { return type; }
	public String getText() { return text; }
	public int getLineno() { return lineno; }
	public int getOffset() { return offset; }
	public String getLine() { return line; }

	@Override
	public String toString()
	{
		return type + "(" + text + ")@" + lineno + ":" + offset;
	}
}
