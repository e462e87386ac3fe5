package org.javai.cdlexport.sxl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.javai.cdlexport.expr.BinaryOperator;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.expr.UnaryOperator;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.value.BooleanValue;
import org.javai.cdlexport.value.EnumValue;
import org.javai.cdlexport.value.NumberValue;
import org.javai.cdlexport.value.StringValue;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpressionReaderTest {

	@Nested
	class Leaves {

		@Test
		void literals() {
			assertThat(ExpressionReader.read("1.2")).isEqualTo(ExpressionNode.literal(NumberValue.of(6, 5)));
			assertThat(ExpressionReader.read("true")).isEqualTo(ExpressionNode.literal(BooleanValue.TRUE));
			assertThat(ExpressionReader.read("'AHU-1'")).isEqualTo(ExpressionNode.literal(new StringValue("AHU-1")));
			assertThat(ExpressionReader.read("(enum SecOut SingleDamper)"))
					.isEqualTo(ExpressionNode.literal(new EnumValue("SecOut", "SingleDamper")));
		}

		@Test
		void references() {
			assertThat(ExpressionReader.read("dat.TOutMin"))
					.isEqualTo(new ExpressionNode.VariableRef(ModelPath.of("dat.TOutMin"), InnerOuter.NONE));
			assertThat(ExpressionReader.read("(outer weaDat.TDryBul)"))
					.isEqualTo(new ExpressionNode.VariableRef(ModelPath.of("weaDat.TDryBul"), InnerOuter.OUTER));
			assertThat(ExpressionReader.read("(inner sim)"))
					.isEqualTo(new ExpressionNode.VariableRef(ModelPath.of("sim"), InnerOuter.INNER));
		}
	}

	@Nested
	class Operators {

		@Test
		void variadicAdditionFoldsLeft() {
			ExpressionNode node = ExpressionReader.read("(+ a b c)");

			assertThat(node).isEqualTo(new ExpressionNode.BinaryOp(BinaryOperator.ADD,
					new ExpressionNode.BinaryOp(BinaryOperator.ADD, ExpressionNode.ref("a"), ExpressionNode.ref("b")),
					ExpressionNode.ref("c")));
		}

		@Test
		void minusWithOneArgumentNegates() {
			assertThat(ExpressionReader.read("(- k)"))
					.isEqualTo(new ExpressionNode.UnaryOp(UnaryOperator.NEGATE, ExpressionNode.ref("k")));
		}

		@Test
		void relationalOperatorsAreBinary() {
			ExpressionNode node = ExpressionReader.read("(<> typ (enum Damper None))");

			assertThat(node).isInstanceOf(ExpressionNode.BinaryOp.class);
			assertThat(((ExpressionNode.BinaryOp) node).operator()).isEqualTo(BinaryOperator.NOT_EQUAL);
			assertThatThrownBy(() -> ExpressionReader.read("(< a b c)"))
					.isInstanceOf(SxlParseException.class)
					.hasMessageContaining("expects 2");
		}
	}

	@Nested
	class Forms {

		@Test
		void conditionalWithElseIf() {
			ExpressionNode node = ExpressionReader.read("(if c1 1 c2 2 3)");

			assertThat(node).isInstanceOf(ExpressionNode.Conditional.class);
			ExpressionNode.Conditional conditional = (ExpressionNode.Conditional) node;
			assertThat(conditional.branches()).hasSize(2);
			assertThat(conditional.otherwise()).isEqualTo(ExpressionNode.literal(NumberValue.of(3)));
		}

		@Test
		void conditionalNeedsElse() {
			assertThatThrownBy(() -> ExpressionReader.read("(if c1 1)"))
					.isInstanceOf(SxlParseException.class)
					.hasMessageContaining("else");
		}

		@Test
		void forLoopOverRange() {
			ExpressionNode node = ExpressionReader.read("(for i (range 1 nZon) (* i 2))");

			assertThat(node).isInstanceOf(ExpressionNode.ForLoop.class);
			ExpressionNode.ForLoop loop = (ExpressionNode.ForLoop) node;
			assertThat(loop.index()).isEqualTo("i");
			assertThat(loop.range()).isInstanceOf(ExpressionNode.Range.class);
			assertThat(((ExpressionNode.Range) loop.range()).step()).isNull();
		}

		@Test
		void unknownHeadIsAFunctionCall() {
			ExpressionNode node = ExpressionReader.read("(max 1 k)");

			assertThat(node).isEqualTo(new ExpressionNode.FunctionCall("max",
					List.of(ExpressionNode.literal(NumberValue.of(1)), ExpressionNode.ref("k"))));
		}

		@Test
		void opaqueKeepsSourceText() {
			assertThat(ExpressionReader.read("(opaque 'Modelica.Math.Matrices.inv(A)')"))
					.isEqualTo(new ExpressionNode.Opaque("Modelica.Math.Matrices.inv(A)"));
		}
	}

	@Test
	void readsExactlyOneExpression() {
		assertThatThrownBy(() -> ExpressionReader.read("1 2"))
				.isInstanceOf(SxlParseException.class)
				.hasMessageContaining("exactly one");
	}

	@Test
	void printerWritesTheNotationBack() {
		String text = "(if (== typSecOut (enum SecOut SingleDamper)) (enum MinOADes CommonDamper) (* -2 (outer k)))";

		assertThat(ExpressionPrinter.print(ExpressionReader.read(text))).isEqualTo(text);
	}
}
