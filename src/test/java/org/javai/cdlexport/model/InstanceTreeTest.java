package org.javai.cdlexport.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.value.NumberValue;
import org.junit.jupiter.api.Test;

class InstanceTreeTest {

	private static Instance ahu() {
		return Instance.builder("ahu", "Buildings.Templates.AirHandlersFans.VAVMultiZone")
				.parameter("nZon", ExpressionNode.literal(NumberValue.of(3)))
				.child(Instance.builder("ctl", "Buildings.Controls.OBC.ASHRAE.G36.AHUs.MultiZone.VAV.Controller")
						.modifier("nZon", ExpressionNode.ref("nZon"))
						.child(Instance.builder("conTSup", "Buildings.Controls.OBC.CDL.Reals.PID")))
				.child(Instance.builder("fanSup", "Buildings.Templates.Components.Fans.SingleVariable"))
				.connect(Endpoint.of("ahu.ctl", "y"), Endpoint.of("ahu.fanSup", "y"), false)
				.build();
	}

	@Test
	void indexesInstancesInPreOrder() {
		InstanceTree tree = InstanceTree.of(ahu());

		assertThat(tree.instances()).extracting(i -> i.path().toString())
				.containsExactly("ahu", "ahu.ctl", "ahu.ctl.conTSup", "ahu.fanSup");
		assertThat(tree.size()).isEqualTo(4);
	}

	@Test
	void findsParents() {
		InstanceTree tree = InstanceTree.of(ahu());
		Instance pid = tree.find(ModelPath.of("ahu.ctl.conTSup")).orElseThrow();

		assertThat(tree.parentOf(pid)).map(Instance::path).contains(ModelPath.of("ahu.ctl"));
		assertThat(tree.parentOf(tree.root())).isEmpty();
	}

	@Test
	void builderGivesModifiersTheEnclosingScope() {
		Instance ctl = ahu().child("ctl").orElseThrow();
		ParameterBinding nZon = ctl.binding("nZon").orElseThrow();

		assertThat(nZon.owner()).isEqualTo(ModelPath.of("ahu.ctl"));
		assertThat(nZon.scope()).isEqualTo(ModelPath.of("ahu"));
		assertThat(ahu().binding("nZon").orElseThrow().scope()).isEqualTo(ModelPath.of("ahu"));
	}

	@Test
	void collectsConnectionsFromAllLevels() {
		assertThat(InstanceTree.of(ahu()).connections()).hasSize(1);
	}

	@Test
	void rejectsChildWithForeignPath() {
		Instance stray = new Instance(ModelPath.of("boiler.ctl"), "X", null, null, null, null, null, null);
		Instance root = new Instance(ModelPath.of("ahu"), "Y", null, null, null, null, List.of(stray), null);

		assertThatThrownBy(() -> InstanceTree.of(root))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("boiler.ctl");
	}

	@Test
	void rootCannotCarryModifiers() {
		assertThatThrownBy(() -> Instance.builder("ahu", "X").modifier("k", ExpressionNode.ref("k")).build())
				.isInstanceOf(IllegalStateException.class);
	}
}
