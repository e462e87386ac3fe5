package org.javai.cdlexport.sxl;

/**
 * One lexical unit of a binding expression.
 *
 * @param type what kind of unit this is
 * @param value the source text, unescaped for strings, empty for EOF
 * @param position offset of the first character in the expression text
 */
public record SxlToken(TokenType type, String value, int position) {

	public enum TokenType {
		/** Parameter, function or keyword name, possibly dotted. */
		IDENTIFIER,
		/** Run of operator characters such as {@code <=} or {@code *}. */
		OPERATOR,
		STRING,
		NUMBER,
		LPAREN,
		RPAREN,
		COMMA,
		EOF
	}

	@Override
	public String toString() {
		return value.isEmpty() ? type.name() : type.name() + "[" + value + "]@" + position;
	}
}
