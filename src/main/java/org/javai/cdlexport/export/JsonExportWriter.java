package org.javai.cdlexport.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.cdlexport.connect.BoundaryPort;
import org.javai.cdlexport.model.Connection;
import org.javai.cdlexport.model.Endpoint;
import org.javai.cdlexport.sxl.ExpressionPrinter;
import org.javai.cdlexport.value.ArrayValue;
import org.javai.cdlexport.value.BooleanValue;
import org.javai.cdlexport.value.EnumValue;
import org.javai.cdlexport.value.NumberValue;
import org.javai.cdlexport.value.ParameterValue;
import org.javai.cdlexport.value.RecordFieldReference;
import org.javai.cdlexport.value.StringValue;
import org.javai.cdlexport.value.Value;

/**
 * Writes an {@link ExportModel} as indented JSON with sorted object keys.
 * <p>
 * The output depends only on the model's content, so two runs over the same input
 * produce identical bytes. Numbers are written as decimals (integers exactly,
 * non-terminating fractions to 16 significant digits with the exact fraction alongside
 * under {@code exact}); enumeration tags and record references are written as tagged
 * objects so they cannot be mistaken for strings.
 */
public class JsonExportWriter {

	private final ObjectMapper mapper;

	public JsonExportWriter() {
		this.mapper = new ObjectMapper()
				.enable(SerializationFeature.INDENT_OUTPUT)
				.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
	}

	public String write(ExportModel model) {
		try {
			return mapper.writeValueAsString(sorted(toTree(model)));
		} catch (JsonProcessingException e) {
			throw new ExportWriteException("Failed to serialize export of " + model.sourceRoot(), e);
		}
	}

	public void write(ExportModel model, Writer out) {
		try {
			mapper.writeValue(out, sorted(toTree(model)));
		} catch (IOException e) {
			throw new ExportWriteException("Failed to write export of " + model.sourceRoot(), e);
		}
	}

	public JsonNode toTree(ExportModel model) {
		ObjectNode root = mapper.createObjectNode();
		root.put("sourceRoot", model.sourceRoot().toString());
		ArrayNode sequences = root.putArray("sequences");
		for (ExportedSequence sequence : model.sequences()) {
			ObjectNode node = sequences.addObject();
			node.put("parameterSet", sequence.parameterSetId());
			node.set("instance", instance(sequence.root()));
		}
		ArrayNode connections = root.putArray("connections");
		for (Connection connection : model.connections()) {
			ObjectNode node = connections.addObject();
			node.put("from", connection.from().toString());
			node.put("to", connection.to().toString());
			node.put("annotated", connection.annotated());
		}
		ArrayNode ports = root.putArray("boundaryPorts");
		for (BoundaryPort port : model.boundaryPorts()) {
			ObjectNode node = ports.addObject();
			node.put("name", port.name());
			node.put("qualified", port.qualifiedEndpoint().toString());
			node.put("external", port.externalEndpoint().toString());
			node.put("viaExpandable", port.viaExpandable());
			ArrayNode peers = node.putArray("peers");
			for (Endpoint peer : port.peers()) {
				peers.add(peer.toString());
			}
		}
		ArrayNode records = root.putArray("records");
		for (ExportedRecord record : model.records()) {
			ObjectNode node = records.addObject();
			node.put("path", record.path().toString());
			node.put("class", record.className());
			node.put("originalClass", record.originalClassPath());
		}
		ArrayNode sets = root.putArray("parameterSets");
		for (ParameterSet set : model.parameterSets()) {
			ObjectNode node = sets.addObject();
			node.put("id", set.id());
			node.put("sequenceClass", set.sequenceClass());
			ObjectNode values = node.putObject("values");
			ObjectNode exact = mapper.createObjectNode();
			set.values().forEach((name, value) -> {
				values.set(name, value(value));
				JsonNode fraction = exact(value);
				if (fraction != null) {
					exact.set(name, fraction);
				}
			});
			if (exact.size() > 0) {
				node.set("exact", exact);
			}
		}
		return root;
	}

	private ObjectNode instance(ExportedInstance instance) {
		ObjectNode node = mapper.createObjectNode();
		node.put("path", instance.path().toString());
		node.put("class", instance.classPath());
		ArrayNode annotations = node.putArray("annotations");
		instance.annotations().forEach(annotations::add);
		ArrayNode parameters = node.putArray("parameters");
		for (ExportedParameter parameter : instance.parameters()) {
			ObjectNode p = parameters.addObject();
			p.put("name", parameter.name());
			p.put("declared", ExpressionPrinter.print(parameter.declared()));
			p.set("value", value(parameter.value()));
			JsonNode exact = exact(parameter.value());
			if (exact != null) {
				p.set("exact", exact);
			}
		}
		ArrayNode children = node.putArray("children");
		for (ExportedInstance child : instance.children()) {
			children.add(instance(child));
		}
		return node;
	}

	private JsonNode value(ParameterValue value) {
		if (value instanceof BooleanValue b) {
			return mapper.getNodeFactory().booleanNode(b.value());
		}
		if (value instanceof NumberValue n) {
			return n.isInteger()
					? mapper.getNodeFactory().numberNode(n.numerator())
					: mapper.getNodeFactory().numberNode(n.toBigDecimal());
		}
		if (value instanceof StringValue s) {
			return mapper.getNodeFactory().textNode(s.value());
		}
		if (value instanceof EnumValue e) {
			ObjectNode node = mapper.createObjectNode();
			node.put("enum", e.render());
			return node;
		}
		if (value instanceof ArrayValue a) {
			ArrayNode node = mapper.createArrayNode();
			a.elements().forEach(element -> node.add(value(element)));
			return node;
		}
		RecordFieldReference reference = (RecordFieldReference) value;
		ObjectNode node = mapper.createObjectNode();
		node.put("record", reference.record().toString());
		node.put("field", reference.field());
		return node;
	}

	/**
	 * Exact form of a value whose JSON number is rounded: non-terminating rationals become
	 * {@code "n/d"} text, arrays holding one are repeated with those elements replaced.
	 * Returns {@code null} when {@link #value} is already exact.
	 */
	private JsonNode exact(ParameterValue value) {
		if (value instanceof NumberValue n) {
			return n.hasTerminatingDecimal() ? null : mapper.getNodeFactory().textNode(n.toFraction());
		}
		if (value instanceof ArrayValue a) {
			boolean rounded = false;
			ArrayNode node = mapper.createArrayNode();
			for (Value element : a.elements()) {
				JsonNode exact = exact(element);
				rounded |= exact != null;
				node.add(exact != null ? exact : value(element));
			}
			return rounded ? node : null;
		}
		return null;
	}

	/**
	 * Copies object nodes with their fields in key order; ORDER_MAP_ENTRIES_BY_KEYS
	 * applies to maps only, not to tree nodes.
	 */
	private JsonNode sorted(JsonNode node) {
		if (node.isObject()) {
			ObjectNode copy = mapper.createObjectNode();
			List<String> names = new ArrayList<>();
			node.fieldNames().forEachRemaining(names::add);
			Collections.sort(names);
			for (String name : names) {
				copy.set(name, sorted(node.get(name)));
			}
			return copy;
		}
		if (node.isArray()) {
			ArrayNode copy = mapper.createArrayNode();
			node.forEach(element -> copy.add(sorted(element)));
			return copy;
		}
		return node;
	}
}
