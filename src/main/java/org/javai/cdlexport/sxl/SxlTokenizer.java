package org.javai.cdlexport.sxl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a binding expression into tokens. A {@code ;} starts a comment that runs to
 * the end of the line; a {@code -} directly followed by a digit starts a negative
 * number, otherwise it is the subtraction operator.
 */
public class SxlTokenizer {

	private static final String OPERATOR_CHARS = "+-*/^<>=";
	private static final char NONE = '\0';

	private final String text;
	private int cursor;

	public SxlTokenizer(String input) {
		this.text = input != null ? input : "";
	}

	/**
	 * @return the tokens of the whole input, terminated by an EOF token
	 * @throws SxlParseException on a character outside the notation or a malformed literal
	 */
	public List<SxlToken> tokenize() {
		List<SxlToken> tokens = new ArrayList<>();
		for (skipBlank(); cursor < text.length(); skipBlank()) {
			tokens.add(token());
		}
		tokens.add(new SxlToken(SxlToken.TokenType.EOF, "", cursor));
		return tokens;
	}

	private SxlToken token() {
		int start = cursor;
		char c = charAt(0);
		if (c == '(' || c == ')' || c == ',') {
			cursor++;
			SxlToken.TokenType type = c == '(' ? SxlToken.TokenType.LPAREN
					: c == ')' ? SxlToken.TokenType.RPAREN : SxlToken.TokenType.COMMA;
			return new SxlToken(type, String.valueOf(c), start);
		}
		if (c == '\'') {
			return quoted();
		}
		if (isDigit(c) || (c == '-' && isDigit(charAt(1)))) {
			return number();
		}
		if (Character.isLetter(c) || c == '_') {
			return name();
		}
		if (OPERATOR_CHARS.indexOf(c) >= 0) {
			cursor = endOf(cursor, ch -> OPERATOR_CHARS.indexOf(ch) >= 0);
			return new SxlToken(SxlToken.TokenType.OPERATOR, text.substring(start, cursor), start);
		}
		throw new SxlParseException("Character '" + c + "' at offset " + start + " is not part of the expression notation");
	}

	private SxlToken quoted() {
		int start = cursor++;
		StringBuilder value = new StringBuilder();
		while (cursor < text.length() && text.charAt(cursor) != '\'') {
			char c = text.charAt(cursor++);
			if (c != '\\' || cursor == text.length()) {
				value.append(c);
				continue;
			}
			char escaped = text.charAt(cursor++);
			switch (escaped) {
				case 'n' -> value.append('\n');
				case 't' -> value.append('\t');
				case 'r' -> value.append('\r');
				default -> value.append(escaped);
			}
		}
		if (cursor == text.length()) {
			throw new SxlParseException("Unterminated string literal opened at offset " + start);
		}
		cursor++;
		return new SxlToken(SxlToken.TokenType.STRING, value.toString(), start);
	}

	private SxlToken number() {
		int start = cursor;
		if (charAt(0) == '-') {
			cursor++;
		}
		cursor = endOf(cursor, SxlTokenizer::isDigit);
		if (charAt(0) == '.' && isDigit(charAt(1))) {
			cursor = endOf(cursor + 1, SxlTokenizer::isDigit);
		}
		if (charAt(0) == 'e' || charAt(0) == 'E') {
			int digits = charAt(1) == '+' || charAt(1) == '-' ? 2 : 1;
			if (isDigit(charAt(digits))) {
				cursor = endOf(cursor + digits, SxlTokenizer::isDigit);
			}
		}
		return new SxlToken(SxlToken.TokenType.NUMBER, text.substring(start, cursor), start);
	}

	private SxlToken name() {
		int start = cursor;
		cursor = endOf(cursor, ch -> Character.isLetterOrDigit(ch) || ch == '_' || ch == '.');
		String name = text.substring(start, cursor);
		if (name.endsWith(".") || name.contains("..")) {
			throw new SxlParseException("Malformed dotted name '" + name + "' at offset " + start);
		}
		return new SxlToken(SxlToken.TokenType.IDENTIFIER, name, start);
	}

	private void skipBlank() {
		while (cursor < text.length()) {
			char c = text.charAt(cursor);
			if (c == ';') {
				int newline = text.indexOf('\n', cursor);
				cursor = newline < 0 ? text.length() : newline + 1;
			} else if (Character.isWhitespace(c)) {
				cursor++;
			} else {
				return;
			}
		}
	}

	private int endOf(int from, CharTest test) {
		int end = from;
		while (end < text.length() && test.matches(text.charAt(end))) {
			end++;
		}
		return end;
	}

	private char charAt(int ahead) {
		int index = cursor + ahead;
		return index < text.length() ? text.charAt(index) : NONE;
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	@FunctionalInterface
	private interface CharTest {
		boolean matches(char c);
	}
}
