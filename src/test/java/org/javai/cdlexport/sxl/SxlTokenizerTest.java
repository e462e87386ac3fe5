package org.javai.cdlexport.sxl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.Test;

class SxlTokenizerTest {

	private static List<SxlToken.TokenType> types(String input) {
		return new SxlTokenizer(input).tokenize().stream().map(SxlToken::type).toList();
	}

	@Test
	void tokenizesOperatorsNumbersAndDottedNames() {
		List<SxlToken> tokens = new SxlTokenizer("(<= ahu.ctl.k -1.5e-3)").tokenize();

		assertThat(tokens).extracting(SxlToken::value)
				.containsExactly("(", "<=", "ahu.ctl.k", "-1.5e-3", ")", "");
		assertThat(tokens.get(3).type()).isEqualTo(SxlToken.TokenType.NUMBER);
	}

	@Test
	void minusFollowedBySpaceIsAnOperator() {
		assertThat(types("(- a 1)")).containsExactly(
				SxlToken.TokenType.LPAREN,
				SxlToken.TokenType.OPERATOR,
				SxlToken.TokenType.IDENTIFIER,
				SxlToken.TokenType.NUMBER,
				SxlToken.TokenType.RPAREN,
				SxlToken.TokenType.EOF);
	}

	@Test
	void skipsCommentsToEndOfLine() {
		List<SxlToken> tokens = new SxlTokenizer("; nominal flow\n(* 2 k) ; doubled").tokenize();

		assertThat(tokens).extracting(SxlToken::value).containsExactly("(", "*", "2", "k", ")", "");
	}

	@Test
	void unescapesQuotedStrings() {
		SxlToken token = new SxlTokenizer("'it\\'s\\n'").tokenize().get(0);

		assertThat(token.type()).isEqualTo(SxlToken.TokenType.STRING);
		assertThat(token.value()).isEqualTo("it's\n");
	}

	@Test
	void rejectsMalformedInput() {
		assertThatThrownBy(() -> new SxlTokenizer("'open").tokenize())
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("Unterminated");
		assertThatThrownBy(() -> new SxlTokenizer("ahu..k").tokenize())
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("Malformed dotted name");
		assertThatThrownBy(() -> new SxlTokenizer("#").tokenize())
				.isInstanceOf(SxlParseException.class);
	}
}
