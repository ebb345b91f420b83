package edu.upf.taln.penman.core.io;

import edu.upf.taln.penman.core.structures.Branch;
import edu.upf.taln.penman.core.structures.Node;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.structures.Triple;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Parses PENMAN text into trees, and triple conjunctions into lists of triples. Alignment markers are kept as suffixes
 * of the text of roles, concepts and atomic targets.
 *
 * <pre>
 * Start    := Node
 * Node     := '(' Variable? ('/' Concept?)? Edge* ')'
 * Edge     := Role Alignment? (Constant Alignment? | Node)?
 * </pre>
 */
public class PenmanParser
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * Parses a single PENMAN graph, with its leading metadata comments.
	 */
	public Tree parse(String text)
	{
		return parse(Lexer.PENMAN.lex(text));
	}

	/**
	 * Parses any number of consecutive graphs.
	 */
	public List<Tree> parseAll(String text)
	{
		TokenIterator tokens = Lexer.PENMAN.lex(text);
		List<Tree> trees = new ArrayList<>();
		while (tokens.nextIs(TokenType.COMMENT, TokenType.LPAREN))
			trees.add(parse(tokens));
		return trees;
	}

	Tree parse(TokenIterator tokens)
	{
		Map<String, String> metadata = parseComments(tokens);
		Node node = parseNode(tokens);
		Tree tree = new Tree(node, metadata);
		log.debug("Parsed: {}", tree);
		return tree;
	}

	/**
	 * Reads "::key value" pairs from comment lines. A line may hold several pairs.
	 */
	private static Map<String, String> parseComments(TokenIterator tokens)
	{
		Map<String, String> metadata = new LinkedHashMap<>();
		while (tokens.peek().getType() == TokenType.COMMENT)
		{
			String comment = tokens.next().getText();
			List<Pair<String, String>> pairs = new ArrayList<>();
			int i;
			while ((i = comment.lastIndexOf("::")) >= 0)
			{
				String meta = comment.substring(i + 2);
				comment = comment.substring(0, i);
				String key = StringUtils.substringBefore(meta, " ");
				String value = meta.contains(" ") ? StringUtils.stripEnd(StringUtils.substringAfter(meta, " "), null) : "";
				pairs.add(Pair.of(key, value));
			}
			Collections.reverse(pairs);
			pairs.forEach(p -> metadata.put(p.getKey(), p.getValue()));
		}
		return metadata;
	}

	/**
	 * Nodes are parsed with an explicit stack of open nodes, so nesting depth is not limited by the call stack.
	 */
	private static Node parseNode(TokenIterator tokens)
	{
		Deque<Node> open = new ArrayDeque<>();
		Node root = openNode(tokens);
		open.push(root);

		while (!open.isEmpty())
		{
			Node current = open.peek();
			if (tokens.peek().getType() == TokenType.RPAREN)
			{
				tokens.next();
				open.pop();
				continue;
			}

			Token role_token = tokens.expect(TokenType.ROLE);
			String role = role_token.getText() + alignment(tokens);

			Token next = tokens.peek();
			switch (next.getType())
			{
				case SYMBOL:
				case STRING:
					String target = tokens.next().getText() + alignment(tokens);
					current.add(role, target);
					break;
				case LPAREN:
					Node child = openNode(tokens);
					current.add(role, child);
					open.push(child);
					break;
				case ROLE:
				case RPAREN:
					log.warn("Missing target: " + role_token.getLine());
					current.add(role, (String) null);
					break;
				default:
					throw tokens.error("Expected: SYMBOL, STRING, LPAREN", next);
			}
		}

		return root;
	}

	/**
	 * Reads the opening parenthesis, the variable and the concept of a node.
	 */
	private static Node openNode(TokenIterator tokens)
	{
		Token lparen = tokens.expect(TokenType.LPAREN);
		if (tokens.peek().getType() == TokenType.RPAREN)
		{
			log.warn("Missing variable: " + lparen.getLine());
			return new Node(null);
		}

		Node node = new Node(tokens.expect(TokenType.SYMBOL).getText());
		Token slash = tokens.accept(TokenType.SLASH);
		if (slash != null)
		{
			String concept = null;
			if (tokens.nextIs(TokenType.SYMBOL, TokenType.STRING))
				concept = tokens.next().getText() + alignment(tokens);
			else
				log.warn("Missing concept: " + slash.getLine());
			node.add("/", concept);
		}
		return node;
	}

	private static String alignment(TokenIterator tokens)
	{
		Token alignment = tokens.accept(TokenType.ALIGNMENT);
		return alignment == null ? "" : alignment.getText();
	}

	/**
	 * Parses a conjunction of triples such as "instance(a, alpha) ^ ARG0(a, b)". Roles get a leading ':'.
	 */
	public List<Triple> parseTriples(String text)
	{
		TokenIterator tokens = Lexer.TRIPLES.lex(text);
		List<Triple> triples = new ArrayList<>();
		boolean strip_caret = false;
		while (true)
		{
			String role = tokens.expect(TokenType.SYMBOL).getText();
			if (strip_caret && role.startsWith("^"))
				role = role.substring(1);
			if (!role.startsWith(":"))
				role = ":" + role;
			tokens.expect(TokenType.LPAREN);
			Token symbol = tokens.expect(TokenType.SYMBOL);
			Pair<String, String> args = parseArguments(symbol, tokens);
			tokens.expect(TokenType.RPAREN);

			if (args.getRight() == null)
				log.warn("Triple without a target: " + symbol.getLine());
			triples.add(new Triple(args.getLeft(), role, args.getRight()));

			if (!tokens.hasNext())
				break;
			Token next = tokens.peek();
			if (next.getType() != TokenType.SYMBOL || !next.getText().startsWith("^"))
				break;
			else if (next.getText().equals("^"))
			{
				strip_caret = false;
				tokens.next();
			}
			else
				strip_caret = true;
		}
		return triples;
	}

	/**
	 * Source and target of a triple. Commas are not separate tokens, so "a,b", "a, b", "a ,b" and "a , b" all have to
	 * be told apart here.
	 */
	private static Pair<String, String> parseArguments(Token symbol, TokenIterator tokens)
	{
		String text = symbol.getText();
		int comma = text.indexOf(',');
		String source = comma < 0 ? text : text.substring(0, comma);
		String rest = comma < 0 ? "" : text.substring(comma + 1);
		String target = null;

		if (!rest.isEmpty())
			target = rest;
		else if (comma >= 0)
		{
			Token next = tokens.accept(TokenType.SYMBOL, TokenType.STRING);
			if (next != null)
				target = next.getText();
		}
		else
		{
			Token next = tokens.accept(TokenType.SYMBOL);
			if (next == null)
				return Pair.of(source, null);
			if (next.getText().equals(","))
			{
				next = tokens.accept(TokenType.SYMBOL, TokenType.STRING);
				if (next != null)
					target = next.getText();
			}
			else if (next.getText().startsWith(","))
				target = next.getText().substring(1);
			else
				throw tokens.error("Expected: ','", next);
		}
		return Pair.of(source, target);
	}
}
