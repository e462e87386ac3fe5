package org.javai.cdlexport.export;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.cdlexport.config.ExportGrouping;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.sxl.ExpressionReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExportModelTest {

	private static final String PID = "Buildings.Controls.OBC.CDL.Reals.PID";
	private static final String LIMITER = "Buildings.Controls.OBC.CDL.Reals.Limiter";

	private ExportModel model;

	@BeforeEach
	void assemble() {
		Instance plant = Instance.builder("plant", "MyProject.Plant")
				.child(Instance.builder("conChi", PID).parameter("k", ExpressionReader.read("1")))
				.child(Instance.builder("conBoi", PID).parameter("k", ExpressionReader.read("1")))
				.child(Instance.builder("conPum", PID).parameter("k", ExpressionReader.read("2")))
				.child(Instance.builder("lim", LIMITER).parameter("uMax", ExpressionReader.read("10")))
				.build();
		model = ExportPipeline.assemble(plant, ExportSettings.defaults());
	}

	@Test
	void equalValuesShareOneParameterSet() {
		assertThat(model.parameterSets()).hasSize(3);
		assertThat(model.sequences().get(0).parameterSetId()).isEqualTo(model.sequences().get(1).parameterSetId());
		assertThat(model.sequences().get(2).parameterSetId()).isNotEqualTo(model.sequences().get(0).parameterSetId());
	}

	@Test
	void perSequenceGroupsByClass() {
		List<ExportDocument> documents = model.documents(ExportGrouping.PER_SEQUENCE);

		assertThat(documents).extracting(ExportDocument::name).containsExactly(PID, LIMITER);
		assertThat(documents.get(0).sequences()).hasSize(3);
		assertThat(documents.get(0).parameterSets()).hasSize(2);
	}

	@Test
	void perParameterSetSplitsDistinctValues() {
		List<ExportDocument> documents = model.documents(ExportGrouping.PER_PARAMETER_SET);

		assertThat(documents).hasSize(3);
		assertThat(documents.get(0).name()).startsWith(PID + "@ps-");
		assertThat(documents.get(0).sequences()).extracting(s -> s.root().path().toString())
				.containsExactly("plant.conChi", "plant.conBoi");
		assertThat(documents).allSatisfy(d -> assertThat(d.parameterSets()).hasSize(1));
	}

	@Test
	void findLooksInsideSequencesOnly() {
		assertThat(model.find(ModelPath.of("plant.conPum"))).isPresent();
		assertThat(model.find(ModelPath.of("plant"))).isEmpty();
		assertThat(model.find(ModelPath.of("plant.conPum.missing"))).isEmpty();
	}
}
