package org.javai.cdlexport;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.Level;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.export.ExportAbortedException;
import org.javai.cdlexport.load.ModelYamlReader;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.testsupport.LogCapture;
import org.junit.jupiter.api.Test;

class ExportBatchTest {

	private final ModelYamlReader reader = new ModelYamlReader();
	private final ExportBatch batch = new ExportBatch(new ControlSequenceExporter(ExportSettings.defaults()));

	private final Instance ahu = reader.readResource("models/ahu.yaml");
	private final Instance building = reader.readResource("models/building.yaml");
	private final Instance lab = reader.readString("""
			name: lab
			class: MyProject.Lab
			children:
			  - name: conFumHoo
			    class: Buildings.Controls.OBC.CDL.Reals.PID
			    bindings:
			      k: kMissing
			""");

	@Test
	void failedProjectDoesNotStopTheBatch() {
		try (LogCapture log = LogCapture.of(ExportBatch.class, Level.INFO)) {
			BatchResult result = batch.exportAll(List.of(ahu, lab, building));

			assertThat(result.completed()).extracting(m -> m.sourceRoot().toString()).containsExactly("ahu", "building");
			assertThat(result.failures()).containsOnlyKeys(ModelPath.of("lab"));
			assertThat(result.failures().get(ModelPath.of("lab"))).isInstanceOf(ExportAbortedException.class);
			assertThat(result.successful()).isFalse();
			assertThat(result.cancelled()).isFalse();
			assertThat(log.messages(Level.WARN)).singleElement().asString().startsWith("Export of lab failed");
			assertThat(log.messages(Level.INFO)).contains("Batch finished: 2 exported, 1 failed, 0 skipped");
		}
	}

	@Test
	void cancellationSkipsTheRemainingProjects() {
		AtomicInteger checks = new AtomicInteger();

		BatchResult result = batch.exportAll(List.of(ahu, building, lab), () -> checks.incrementAndGet() > 1);

		assertThat(result.completed()).hasSize(1);
		assertThat(result.skipped()).containsExactly(ModelPath.of("building"), ModelPath.of("lab"));
		assertThat(result.cancelled()).isTrue();
		assertThat(checks).hasValue(2);
	}

	@Test
	void cleanBatchIsSuccessful() {
		BatchResult result = batch.exportAll(List.of(ahu, building));

		assertThat(result.successful()).isTrue();
		assertThat(result.completed()).hasSize(2);
	}
}
