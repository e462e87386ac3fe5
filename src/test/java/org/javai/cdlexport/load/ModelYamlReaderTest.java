package org.javai.cdlexport.load;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.model.Endpoint;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceKind;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.model.ParameterBinding;
import org.javai.cdlexport.value.NumberValue;
import org.junit.jupiter.api.Test;

class ModelYamlReaderTest {

	private final ModelYamlReader reader = new ModelYamlReader();

	@Test
	void readsTheAirHandlerFixture() {
		InstanceTree tree = InstanceTree.of(reader.readResource("models/ahu.yaml"));

		assertThat(tree.instances()).extracting(i -> i.path().toString()).containsExactly(
				"ahu", "ahu.dat", "ahu.ctl", "ahu.ctl.conTSup", "ahu.custom", "ahu.fanSup", "ahu.TAirSup", "ahu.bus");
		assertThat(tree.find(ModelPath.of("ahu.dat")).orElseThrow().kind()).isEqualTo(InstanceKind.RECORD);
		assertThat(tree.find(ModelPath.of("ahu.bus")).orElseThrow().kind()).isEqualTo(InstanceKind.EXPANDABLE_CONNECTOR);
		assertThat(tree.find(ModelPath.of("ahu.custom")).orElseThrow().annotations())
				.containsExactly("__ctrlFlow(enable=true)");
		assertThat(tree.connections()).hasSize(6);
	}

	@Test
	void modifiersAreScopedToTheEnclosingInstance() {
		Instance ctl = InstanceTree.of(reader.readResource("models/ahu.yaml"))
				.find(ModelPath.of("ahu.ctl")).orElseThrow();

		ParameterBinding declaration = ctl.binding("k").orElseThrow();
		ParameterBinding modifier = ctl.binding("VOutMin_flow").orElseThrow();

		assertThat(declaration.scope()).isEqualTo(ModelPath.of("ahu.ctl"));
		assertThat(modifier.scope()).isEqualTo(ModelPath.of("ahu"));
		assertThat(modifier.expression()).isInstanceOf(ExpressionNode.BinaryOp.class);
	}

	@Test
	void modifierReplacesTheDeclarationDefault() {
		Instance root = reader.readString("""
				name: top
				class: Top
				children:
				  - name: pid
				    class: Buildings.Controls.OBC.CDL.Reals.PID
				    bindings:
				      k: 1
				      Ti: 60
				    modifiers:
				      k: 2
				""");

		Instance pid = root.child("pid").orElseThrow();
		assertThat(pid.bindings()).extracting(ParameterBinding::name).containsExactly("k", "Ti");
		assertThat(pid.binding("k").orElseThrow().expression())
				.isEqualTo(new ExpressionNode.Literal(NumberValue.of(2)));
		assertThat(pid.binding("k").orElseThrow().scope()).isEqualTo(ModelPath.of("top"));
	}

	@Test
	void connectionEndpointsAreRelativeToTheDeclaringInstance() {
		Instance root = reader.readString("""
				name: top
				class: Top
				children:
				  - name: sub
				    class: Sub
				    children:
				      - name: a
				        class: A
				    connections:
				      - from: {instance: a, port: y}
				        to: {port: u}
				        annotated: true
				""");

		assertThat(root.child("sub").orElseThrow().connections()).singleElement().satisfies(c -> {
			assertThat(c.from()).isEqualTo(Endpoint.of("top.sub.a", "y"));
			assertThat(c.to()).isEqualTo(Endpoint.of("top.sub", "u"));
			assertThat(c.annotated()).isTrue();
		});
	}

	@Test
	void innerOuterPrefixes() {
		Instance building = reader.readResource("models/building.yaml");

		assertThat(building.child("weaDat").orElseThrow().prefix()).isEqualTo(InnerOuter.INNER);
		assertThat(building.child("ahu").orElseThrow().child("datAll").orElseThrow().prefix())
				.isEqualTo(InnerOuter.OUTER);
	}

	@Test
	void rootCannotCarryModifiers() {
		assertThatThrownBy(() -> reader.readString("""
				name: top
				class: Top
				modifiers:
				  k: 1
				"""))
				.isInstanceOf(ModelFormatException.class)
				.hasMessageContaining("cannot carry modifiers");
	}

	@Test
	void malformedExpressionNamesTheBinding() {
		assertThatThrownBy(() -> reader.readString("""
				name: top
				class: Top
				bindings:
				  k: (+ 1
				"""))
				.isInstanceOf(ModelFormatException.class)
				.hasMessageContaining("top.k");
	}

	@Test
	void unknownKindIsRejected() {
		assertThatThrownBy(() -> reader.readString("""
				name: top
				class: Top
				kind: package
				"""))
				.isInstanceOf(ModelFormatException.class)
				.hasMessageContaining("package");
	}

	@Test
	void missingClassIsRejected() {
		assertThatThrownBy(() -> reader.readString("name: top"))
				.isInstanceOf(ModelFormatException.class)
				.hasMessageContaining("'class'");
	}

	@Test
	void missingResource() {
		assertThatThrownBy(() -> reader.readResource("models/none.yaml"))
				.isInstanceOf(ModelFormatException.class)
				.hasMessageContaining("models/none.yaml");
	}
}
