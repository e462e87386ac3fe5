package org.javai.cdlexport.sxl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.Test;

class SxlParserTest {

	private static List<SxlNode> parse(String input) {
		return new SxlParser(new SxlTokenizer(input).tokenize()).parse();
	}

	@Test
	void parsesNestedLists() {
		List<SxlNode> nodes = parse("(if (> a 0) 'pos' 'neg')");

		assertThat(nodes).hasSize(1);
		SxlNode conditional = nodes.get(0);
		assertThat(conditional.symbol()).isEqualTo("if");
		assertThat(conditional.args()).hasSize(3);
		assertThat(conditional.args().get(0).symbol()).isEqualTo(">");
		assertThat(conditional.args().get(1).kind()).isEqualTo(SxlNode.Kind.STRING);
		assertThat(conditional.args().get(1).literalValue()).isEqualTo("pos");
	}

	@Test
	void emptyInputGivesNoNodes() {
		assertThat(parse("  ; only a comment")).isEmpty();
	}

	@Test
	void commasAreOptionalSeparators() {
		assertThat(parse("(max 1, 2, 3)").get(0).args()).hasSize(3);
	}

	@Test
	void rejectsUnbalancedParentheses() {
		assertThatThrownBy(() -> parse("(+ 1 2"))
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("Unclosed '('");
		assertThatThrownBy(() -> parse("1)"))
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("Stray ')'");
		assertThatThrownBy(() -> parse("()"))
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("Empty list");
	}

	@Test
	void headMustBeASymbol() {
		assertThatThrownBy(() -> parse("(1 2)"))
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("must start with a name or an operator");
	}
}
