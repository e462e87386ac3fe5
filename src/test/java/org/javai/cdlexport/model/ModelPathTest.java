package org.javai.cdlexport.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

class ModelPathTest {

	@Test
	void parsesDottedPath() {
		ModelPath path = ModelPath.of("ahu.ctl.kPro");

		assertThat(path.segments()).containsExactly("ahu", "ctl", "kPro");
		assertThat(path.head()).isEqualTo("ahu");
		assertThat(path.name()).isEqualTo("kPro");
		assertThat(path.depth()).isEqualTo(3);
		assertThat(path).hasToString("ahu.ctl.kPro");
	}

	@Test
	void parentAndTailStopAtSingleSegment() {
		ModelPath path = ModelPath.of("ahu.ctl");

		assertThat(path.parent()).isEqualTo(ModelPath.root("ahu"));
		assertThat(path.tail()).isEqualTo(ModelPath.root("ctl"));
		assertThat(ModelPath.root("ahu").parent()).isNull();
		assertThat(ModelPath.root("ahu").tail()).isNull();
	}

	@Test
	void relativeToAncestor() {
		ModelPath path = ModelPath.of("ahu.ctl.conTSup");

		assertThat(path.relativeTo(ModelPath.of("ahu"))).isEqualTo(ModelPath.of("ctl.conTSup"));
		assertThat(path.relativeTo(path)).isNull();
		assertThatThrownBy(() -> path.relativeTo(ModelPath.of("boiler")))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void startsWithComparesWholeSegments() {
		assertThat(ModelPath.of("ahu.ctl").startsWith(ModelPath.of("ahu"))).isTrue();
		assertThat(ModelPath.of("ahu2.ctl").startsWith(ModelPath.of("ahu"))).isFalse();
	}

	@Test
	void rejectsEmptySegments() {
		assertThatThrownBy(() -> ModelPath.of("ahu..ctl")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> ModelPath.of(" ")).isInstanceOf(IllegalArgumentException.class);
	}
}
