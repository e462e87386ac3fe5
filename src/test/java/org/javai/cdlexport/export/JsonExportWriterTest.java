package org.javai.cdlexport.export;

import static org.assertj.core.api.Assertions.assertThat;
import java.io.StringWriter;
import java.math.BigDecimal;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.cdlexport.config.ExportSettings;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.sxl.ExpressionReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonExportWriterTest {

	private final JsonExportWriter writer = new JsonExportWriter();
	private final ObjectMapper reader = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

	private ExportModel model;

	@BeforeEach
	void assemble() {
		model = ExportPipeline.assemble("models/ahu.yaml", ExportSettings.defaults());
	}

	@Test
	void independentRunsProduceIdenticalOutput() {
		String first = writer.write(model);
		String second = new JsonExportWriter().write(ExportPipeline.assemble("models/ahu.yaml", ExportSettings.defaults()));

		assertThat(second).isEqualTo(first);
	}

	@Test
	void writerTargetMatchesStringOutput() {
		StringWriter out = new StringWriter();

		writer.write(model, out);

		assertThat(out.toString()).isEqualTo(writer.write(model));
	}

	@Test
	void objectKeysAreSorted() {
		String json = writer.write(model);

		assertThat(json.indexOf("\"boundaryPorts\"")).isLessThan(json.indexOf("\"connections\""));
		assertThat(json.indexOf("\"connections\"")).isLessThan(json.indexOf("\"parameterSets\""));
		assertThat(json.indexOf("\"records\"")).isLessThan(json.indexOf("\"sequences\""));
		assertThat(json.indexOf("\"sequences\"")).isLessThan(json.indexOf("\"sourceRoot\""));
	}

	@Test
	void valuesAreTaggedByKind() throws Exception {
		JsonNode root = reader.readTree(writer.write(model));
		JsonNode ctl = root.get("sequences").get(0).get("instance");

		assertThat(ctl.get("path").asText()).isEqualTo("ahu.ctl");
		assertThat(parameter(ctl, "have_frePro").get("value").booleanValue()).isTrue();
		assertThat(parameter(ctl, "VOutMin_flow").get("value").decimalValue())
				.isEqualByComparingTo(new BigDecimal("3333.333333333333"));
		assertThat(parameter(ctl, "VOutMin_flow").get("declared").asText()).isEqualTo("(/ mAirSup_flow_nominal 1.2)");
		assertThat(parameter(ctl, "nZon").get("value").isIntegralNumber()).isTrue();
		assertThat(parameter(ctl, "minOADes").get("value").get("enum").asText()).isEqualTo("MinOADes.CommonDamper");
		JsonNode record = parameter(ctl, "TOutMin").get("value");
		assertThat(record.get("record").asText()).isEqualTo("ahu.dat");
		assertThat(record.get("field").asText()).isEqualTo("TOutMin");
	}

	@Test
	void nonTerminatingFractionsCarryTheirExactForm() throws Exception {
		JsonNode root = reader.readTree(writer.write(model));
		JsonNode ctl = root.get("sequences").get(0).get("instance");

		assertThat(parameter(ctl, "VOutMin_flow").get("exact").asText()).isEqualTo("10000/3");
		assertThat(parameter(ctl, "nZon").has("exact")).isFalse();
		assertThat(parameter(ctl, "k").has("exact")).isFalse();
		assertThat(root.get("parameterSets").get(0).get("exact").get("VOutMin_flow").asText()).isEqualTo("10000/3");
	}

	@Test
	void arraysWithRoundedElementsAreRepeatedExactly() throws Exception {
		Instance root = Instance.builder("plant", "MyProject.Plant")
				.child(Instance.builder("pid", "Buildings.Controls.OBC.CDL.Reals.PID")
						.parameter("w", ExpressionReader.read("(array 0.5 (/ 1 3) 2)"))
						.parameter("v", ExpressionReader.read("(array 0.5 0.25)")))
				.build();

		JsonNode pid = reader.readTree(writer.write(ExportPipeline.assemble(root, ExportSettings.defaults())))
				.get("sequences").get(0).get("instance");

		JsonNode exact = parameter(pid, "w").get("exact");
		assertThat(exact.get(0).decimalValue()).isEqualByComparingTo(new BigDecimal("0.5"));
		assertThat(exact.get(1).asText()).isEqualTo("1/3");
		assertThat(exact.get(2).isIntegralNumber()).isTrue();
		assertThat(parameter(pid, "v").has("exact")).isFalse();
	}

	@Test
	void boundaryPortsCarryTheirPeers() throws Exception {
		JsonNode ports = reader.readTree(writer.write(model)).get("boundaryPorts");

		assertThat(ports).hasSize(2);
		JsonNode signal = ports.get(1);
		assertThat(signal.get("name").asText()).isEqualTo("TAirSup");
		assertThat(signal.get("viaExpandable").booleanValue()).isTrue();
		assertThat(signal.get("peers").get(0).asText()).isEqualTo("ahu.TAirSup.y");
	}

	private static JsonNode parameter(JsonNode instance, String name) {
		for (JsonNode parameter : instance.get("parameters")) {
			if (parameter.get("name").asText().equals(name)) {
				return parameter;
			}
		}
		throw new AssertionError("no parameter " + name);
	}
}
