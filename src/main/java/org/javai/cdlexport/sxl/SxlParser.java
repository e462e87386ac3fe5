package org.javai.cdlexport.sxl;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the raw {@link SxlNode} tree from tokens. Only the bracket structure is
 * checked here: every list must be non-empty and headed by a name or an operator.
 * What the head means is left to {@link ExpressionReader}.
 */
public class SxlParser {

	private final List<SxlToken> tokens;
	private int index;

	public SxlParser(List<SxlToken> tokens) {
		this.tokens = tokens != null ? tokens : List.of();
	}

	/**
	 * @return the top-level nodes, empty for blank input
	 * @throws SxlParseException on unbalanced brackets or a list without a head
	 */
	public List<SxlNode> parse() {
		List<SxlNode> nodes = new ArrayList<>();
		for (SxlToken token = next(); token != null; token = next()) {
			if (token.type() == SxlToken.TokenType.RPAREN) {
				throw new SxlParseException("Stray ')' at offset " + token.position());
			}
			nodes.add(node(token));
		}
		return nodes;
	}

	private SxlNode node(SxlToken token) {
		return switch (token.type()) {
			case LPAREN -> list(token.position());
			case STRING -> SxlNode.string(token.value());
			case NUMBER -> SxlNode.number(token.value());
			default -> SxlNode.atom(token.value());
		};
	}

	private SxlNode list(int opened) {
		SxlToken head = next();
		if (head == null) {
			throw unclosed(opened);
		}
		if (head.type() == SxlToken.TokenType.RPAREN) {
			throw new SxlParseException("Empty list '()' at offset " + opened);
		}
		if (head.type() != SxlToken.TokenType.IDENTIFIER && head.type() != SxlToken.TokenType.OPERATOR) {
			throw new SxlParseException("List at offset " + opened
					+ " must start with a name or an operator, found " + head.type());
		}
		List<SxlNode> args = new ArrayList<>();
		for (SxlToken token = next(); ; token = next()) {
			if (token == null) {
				throw unclosed(opened);
			}
			if (token.type() == SxlToken.TokenType.RPAREN) {
				return SxlNode.list(head.value(), args);
			}
			args.add(node(token));
		}
	}

	/**
	 * Next meaningful token, or {@code null} at the end. Commas separate nothing and are dropped.
	 */
	private SxlToken next() {
		while (index < tokens.size()) {
			SxlToken token = tokens.get(index++);
			if (token.type() == SxlToken.TokenType.EOF) {
				index = tokens.size();
				return null;
			}
			if (token.type() != SxlToken.TokenType.COMMA) {
				return token;
			}
		}
		return null;
	}

	private static SxlParseException unclosed(int opened) {
		return new SxlParseException("Unclosed '(' opened at offset " + opened);
	}
}
