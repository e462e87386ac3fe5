package org.javai.cdlexport.classify;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceTree;
import org.javai.cdlexport.model.ModelPath;
import org.junit.jupiter.api.Test;

class InstanceClassifierTest {

	private final InstanceClassifier classifier = new InstanceClassifier(ExportSettings.defaults());

	@Test
	void libraryNamespaceQualifies() {
		Instance pid = Instance.builder("conTSup", "Buildings.Controls.OBC.CDL.Reals.PID").build();

		assertThat(classifier.classify(pid)).isEqualTo(Classification.QUALIFIED);
	}

	@Test
	void markerAnnotationQualifies() {
		Instance custom = Instance.builder("custom", "MyLib.Controls.SupplyReset")
				.annotation("Placement(transformation(extent={{-10,-10},{10,10}}))")
				.annotation("__ctrlFlow(enable=true)")
				.build();

		assertThat(classifier.classify(custom)).isEqualTo(Classification.QUALIFIED);
	}

	@Test
	void equipmentDoesNotQualify() {
		Instance fan = Instance.builder("fanSup", "Buildings.Templates.Components.Fans.SingleVariable")
				.annotation("Placement(transformation(extent={{-10,-10},{10,10}}))")
				.build();

		assertThat(classifier.classify(fan)).isEqualTo(Classification.NOT_QUALIFIED);
	}

	@Test
	void prefixMustMatchFromTheStart() {
		Instance lookalike = Instance.builder("x", "MyLib.Buildings.Controls.OBC.Copy").build();

		assertThat(classifier.classify(lookalike)).isEqualTo(Classification.NOT_QUALIFIED);
	}

	@Test
	void configuredPrefixesReplaceTheDefault() {
		InstanceClassifier project = new InstanceClassifier(ExportSettings.builder()
				.qualifyingPrefix("MyProject.Controls.")
				.build());

		assertThat(project.classify(Instance.builder("seq", "MyProject.Controls.Economizer").build()))
				.isEqualTo(Classification.QUALIFIED);
		assertThat(project.classify(Instance.builder("pid", "Buildings.Controls.OBC.CDL.Reals.PID").build()))
				.isEqualTo(Classification.NOT_QUALIFIED);
	}

	@Test
	void treeClassificationKeepsNestedQualifiedInstancesUnderTheirRoot() {
		Instance root = Instance.builder("ahu", "Buildings.Templates.AirHandlersFans.VAVMultiZone")
				.child(Instance.builder("ctl", "Buildings.Controls.OBC.ASHRAE.G36.AHUs.MultiZone.VAV.Controller")
						.child(Instance.builder("conTSup", "Buildings.Controls.OBC.CDL.Reals.PID")))
				.child(Instance.builder("fanSup", "Buildings.Templates.Components.Fans.SingleVariable")
						.child(Instance.builder("sta", "Buildings.Controls.OBC.CDL.Logical.Sources.Constant")))
				.build();

		ClassificationResult result = classifier.classifyTree(InstanceTree.of(root));

		assertThat(result.isQualified(ModelPath.of("ahu"))).isFalse();
		assertThat(result.qualified()).extracting(i -> i.path().toString())
				.containsExactly("ahu.ctl", "ahu.ctl.conTSup", "ahu.fanSup.sta");
		assertThat(result.qualifiedRoots()).extracting(i -> i.path().toString())
				.containsExactly("ahu.ctl", "ahu.fanSup.sta");
		assertThat(result.nearestQualifiedAncestor(ModelPath.of("ahu.ctl.conTSup"))).isEqualTo(ModelPath.of("ahu.ctl"));
		assertThat(result.classificationOf(ModelPath.of("elsewhere"))).isEqualTo(Classification.NOT_QUALIFIED);
	}
}
