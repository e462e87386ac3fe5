package org.javai.cdlexport.sxl;

import java.util.Collections;
import java.util.List;

/**
 * Represents a node in the parsed s-expression AST.
 *
 * A node is one of:
 * - an atom: a bare identifier or operator symbol
 * - a list: a parenthesized head symbol with arguments
 * - a number or string literal
 */
public record SxlNode(Kind kind, String symbol, List<SxlNode> args, String literalValue) {

	public enum Kind {
		ATOM,
		LIST,
		NUMBER,
		STRING
	}

	public static SxlNode list(String symbol, List<SxlNode> args) {
		return new SxlNode(Kind.LIST, symbol, List.copyOf(args), null);
	}

	public static SxlNode atom(String symbol) {
		return new SxlNode(Kind.ATOM, symbol, Collections.emptyList(), null);
	}

	public static SxlNode number(String value) {
		return new SxlNode(Kind.NUMBER, null, Collections.emptyList(), value);
	}

	public static SxlNode string(String value) {
		return new SxlNode(Kind.STRING, null, Collections.emptyList(), value);
	}

	public boolean isLiteral() {
		return kind == Kind.NUMBER || kind == Kind.STRING;
	}
}
