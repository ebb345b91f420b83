package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.DecodeException;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Iterator over tokens with one token of lookahead. Errors are reported as {@link DecodeException} positioned at the
 * offending token, or just past the last consumed token if there is none.
 */
public class TokenIterator implements Iterator<Token>
{
	private final Iterator<Token> tokens;
	private Token next;
	private Token last = null;

	public TokenIterator(Iterator<Token> tokens)
	{
		this.tokens = tokens;
		this.next = tokens.hasNext() ? tokens.next() : null;
	}

	@Override
	public boolean hasNext()
	{
		return next != null;
	}

	/** Next token without consuming it */
	public Token peek()
	{
		if (next == null)
			throw error("Unexpected end of input");
		return next;
	}

	@Override
	public Token next()
	{
		if (next == null)
			throw new NoSuchElementException("Unexpected end of input");
		last = next;
		next = tokens.hasNext() ? tokens.next() : null;
		return last;
	}

	/**
	 * Consumes the next token, which must be of one of the given types.
	 */
	public Token expect(TokenType... choices)
	{
		if (next == null)
			throw error("Unexpected end of input");
		Token token = next();
		if (!Arrays.asList(choices).contains(token.getType()))
			throw error("Expected: " + Arrays.stream(choices).map(TokenType::name).collect(Collectors.joining(", ")), token);
		return token;
	}

	/**
	 * Consumes the next token only if it is of one of the given types.
	 * @return the token, or null if it was not consumed
	 */
	public Token accept(TokenType... choices)
	{
		if (next != null && Arrays.asList(choices).contains(next.getType()))
			return next();
		return null;
	}

	public boolean nextIs(TokenType... choices)
	{
		return next != null && Arrays.asList(choices).contains(next.getType());
	}

	public DecodeException error(String message)
	{
		return error(message, null);
	}

	public DecodeException error(String message, Token token)
	{
		if (token != null)
			return new DecodeException(message, null, token.getLineno(), token.getOffset(), token.getLine());
		if (last != null)
			return new DecodeException(message, null, last.getLineno(), last.getOffset() + last.getText().length(), last.getLine());
		return new DecodeException(message, null, 0, 0, null);
	}
}
