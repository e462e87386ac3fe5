package org.javai.cdlexport.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ExportSettingsLoaderTest {

	private final ExportSettingsLoader loader = new ExportSettingsLoader();

	@Test
	void bundledDefaultsMatchBuiltInDefaults() {
		assertThat(loader.loadDefault()).isEqualTo(ExportSettings.defaults());
	}

	@Test
	void loadsProjectSettingsFromFile() throws Exception {
		Path path = Path.of(getClass().getClassLoader().getResource("settings/project-records.yaml").toURI());

		ExportSettings settings = loader.load(path);

		assertThat(settings.qualifyingPrefixes()).containsExactly("Buildings.Controls.OBC.", "MyProject.Controls.");
		assertThat(settings.grouping()).isEqualTo(ExportGrouping.PER_PARAMETER_SET);
		assertThat(settings.allowConditionalBindings()).isFalse();
		assertThat(settings.parallelism()).isEqualTo(4);
		assertThat(settings.recordClassNamePolicy()).isEqualTo(RecordClassNamePolicy.PROJECT_SPECIFIC);
		assertThat(settings.projectRecordPackage()).isEqualTo("MyProject.Data");
	}

	@Test
	void missingKeysKeepDefaults() {
		ExportSettings settings = loader.loadString("""
				export:
				  parallelism: 2
				""");

		assertThat(settings.parallelism()).isEqualTo(2);
		assertThat(settings.markerPrefix()).isEqualTo(ExportSettings.DEFAULT_MARKER_PREFIX);
		assertThat(settings.qualifyingPrefixes()).containsExactly(ExportSettings.DEFAULT_QUALIFYING_PREFIX);
	}

	@Test
	void singlePrefixMayBeAScalar() {
		ExportSettings settings = loader.loadString("""
				export:
				  qualifying_prefixes: MyProject.Controls.
				""");

		assertThat(settings.qualifyingPrefixes()).containsExactly("MyProject.Controls.");
	}

	@Test
	void emptyDocumentGivesDefaults() {
		assertThat(loader.loadString("")).isEqualTo(ExportSettings.defaults());
	}

	@Test
	void unknownGroupingIsRejected() {
		assertThatThrownBy(() -> loader.loadString("""
				export:
				  grouping: per_building
				"""))
				.isInstanceOf(InvalidSettingsException.class)
				.hasMessageContaining("grouping");
	}

	@Test
	void nonNumericParallelismIsRejected() {
		assertThatThrownBy(() -> loader.loadString("""
				export:
				  parallelism: many
				"""))
				.isInstanceOf(InvalidSettingsException.class)
				.hasMessageContaining("parallelism");
	}

	@Test
	void constraintViolationsSurfaceAsInvalidSettings() {
		assertThatThrownBy(() -> loader.loadString("""
				export:
				  records:
				    class_name_policy: project-specific
				"""))
				.isInstanceOf(InvalidSettingsException.class)
				.hasMessageContaining("projectRecordPackage");
	}

	@Test
	void malformedYamlIsWrapped() {
		assertThatThrownBy(() -> loader.loadString("export: [unclosed"))
				.isInstanceOf(InvalidSettingsException.class);
	}
}
