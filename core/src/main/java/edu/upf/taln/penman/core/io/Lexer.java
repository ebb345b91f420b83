package edu.upf.taln.penman.core.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits PENMAN or triple-conjunction text into tokens, line by line. Whitespace is skipped; any other character not
 * covered by a token type is an UNEXPECTED token.
 */
public class Lexer
{
	private final List<TokenType> types;
	private final Pattern pattern;
	private final static Pattern LINE_BREAK = Pattern.compile("\\r\\n|[\\n\\x0B\\f\\r\\u0085\\u2028\\u2029]");
	private final static Logger log = LogManager.getLogger();

	/** Tokens of PENMAN notation, in order of priority */
	public final static Lexer PENMAN = new Lexer(TokenType.COMMENT, TokenType.STRING, TokenType.LPAREN,
			TokenType.RPAREN, TokenType.SLASH, TokenType.ROLE, TokenType.SYMBOL, TokenType.ALIGNMENT, TokenType.UNEXPECTED);
	/** Tokens of triple conjunctions such as "instance(a, alpha) ^ ARG0(a, b)" */
	public final static Lexer TRIPLES = new Lexer(TokenType.COMMENT, TokenType.STRING, TokenType.LPAREN,
			TokenType.RPAREN, TokenType.SYMBOL, TokenType.UNEXPECTED);

	public Lexer(TokenType... types)
	{
		this.types = Arrays.asList(types);
		this.pattern = Pattern.compile(this.types.stream()
				.map(t -> "(?<" + t.name() + ">" + t.getPattern() + ")")
				.collect(Collectors.joining("|")));
	}

	public TokenIterator lex(String text)
	{
		return lex(Arrays.asList(LINE_BREAK.split(text, -1)));
	}

	public TokenIterator lex(Iterable<String> lines)
	{
		List<Token> tokens = new ArrayList<>();
		int lineno = 1;
		for (String line : lines)
		{
			Matcher m = pattern.matcher(line);
			while (m.find())
			{
				TokenType type = null;
				for (TokenType t : types)
				{
					if (m.group(t.name()) != null)
					{
						type = t;
						break;
					}
				}
				if (type == null)
					throw new IllegalStateException("Lexer pattern generated a match without a named group: " + pattern);
				tokens.add(new Token(type, m.group(), lineno, m.start(), line));
			}
			++lineno;
		}
		log.trace("Lexed " + tokens.size() + " tokens");
		return new TokenIterator(tokens.iterator());
	}
}
