package org.javai.cdlexport.load;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.javai.cdlexport.expr.ExpressionNode;
import org.javai.cdlexport.model.Connection;
import org.javai.cdlexport.model.Endpoint;
import org.javai.cdlexport.model.InnerOuter;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.InstanceKind;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.model.ParameterBinding;
import org.javai.cdlexport.sxl.ExpressionReader;
import org.javai.cdlexport.sxl.SxlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a flattened instance tree from YAML.
 * <pre>
 * name: ahu
 * class: Buildings.Templates.AirHandlersFans.VAVMultiZone
 * bindings:                 # declarations, written in the instance itself
 *   nZon: 3
 *   VOut_flow: (/ 4000 1.2)
 * children:
 *   - name: ctl
 *     class: Buildings.Controls.OBC.ASHRAE.G36.AHUs.MultiZone.VAV.Controller
 *     prefix: outer         # inner | outer | inner outer
 *     kind: block           # block | record | connector | expandable
 *     annotations: [__ctrlFlow(enable=true)]
 *     modifiers:            # modifications, written in the enclosing instance
 *       VOutMin_flow: VOut_flow
 * connections:
 *   - from: {instance: ctl, port: yFan}
 *     to: {instance: bus, port: yFan, expandable: true}
 *     annotated: false
 * </pre>
 * Binding values are expressions in the notation of {@link ExpressionReader}; plain
 * YAML numbers and booleans are accepted as literals. Connection endpoints name
 * instances relative to the instance declaring the connection; an omitted or
 * empty instance denotes the declaring instance itself.
 */
public class ModelYamlReader {

	private static final Logger logger = LoggerFactory.getLogger(ModelYamlReader.class);

	private final Yaml yaml = new Yaml();

	public Instance read(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return read(reader);
		} catch (ModelFormatException e) {
			throw e;
		} catch (Exception e) {
			throw new ModelFormatException("Failed to read model from path: " + path, e);
		}
	}

	public Instance read(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new ModelFormatException("Failed to parse model YAML: " + e.getMessage(), e);
		}
	}

	public Instance read(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException e) {
			throw new ModelFormatException("Failed to parse model YAML: " + e.getMessage(), e);
		}
	}

	public Instance readString(String content) {
		try {
			return build(yaml.load(content));
		} catch (YAMLException e) {
			throw new ModelFormatException("Failed to parse model YAML: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads a model from a classpath resource.
	 */
	public Instance readResource(String resource) {
		InputStream stream = ModelYamlReader.class.getClassLoader().getResourceAsStream(resource);
		if (stream == null) {
			throw new ModelFormatException("Model resource not found: " + resource);
		}
		try (stream) {
			return read(stream);
		} catch (IOException e) {
			throw new ModelFormatException("Failed to close model resource: " + resource, e);
		}
	}

	private Instance build(Object document) {
		if (!(document instanceof Map<?, ?> root)) {
			throw new ModelFormatException("Model document must be a mapping");
		}
		Instance instance = instance(root, null);
		logger.debug("Read model {} ({})", instance.path(), instance.classPath());
		return instance;
	}

	private Instance instance(Map<?, ?> node, ModelPath parent) {
		String name = requiredString(node, "name", parent);
		ModelPath path = parent != null ? parent.child(name) : ModelPath.root(name);
		String classPath = requiredString(node, "class", path);
		InstanceKind kind = kind(node.get("kind"), path);
		InnerOuter prefix = prefix(node.get("prefix"), path);

		List<String> annotations = new ArrayList<>();
		for (Object annotation : list(node.get("annotations"), "annotations", path)) {
			annotations.add(String.valueOf(annotation));
		}

		// a modifier replaces the declaration default of the same parameter
		Map<String, ParameterBinding> bindings = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map(node.get("bindings"), "bindings", path).entrySet()) {
			String parameter = String.valueOf(entry.getKey());
			bindings.put(parameter, new ParameterBinding(path, parameter, expression(entry.getValue(), path, parameter), path));
		}
		Map<?, ?> modifiers = map(node.get("modifiers"), "modifiers", path);
		if (!modifiers.isEmpty() && parent == null) {
			throw new ModelFormatException("Root instance " + path + " cannot carry modifiers");
		}
		for (Map.Entry<?, ?> entry : modifiers.entrySet()) {
			String parameter = String.valueOf(entry.getKey());
			bindings.put(parameter, new ParameterBinding(path, parameter, expression(entry.getValue(), path, parameter), parent));
		}

		List<Instance> children = new ArrayList<>();
		for (Object child : list(node.get("children"), "children", path)) {
			if (!(child instanceof Map<?, ?> childNode)) {
				throw new ModelFormatException("Children of " + path + " must be mappings");
			}
			children.add(instance(childNode, path));
		}

		List<Connection> connections = new ArrayList<>();
		for (Object connection : list(node.get("connections"), "connections", path)) {
			if (!(connection instanceof Map<?, ?> connectionNode)) {
				throw new ModelFormatException("Connections of " + path + " must be mappings");
			}
			connections.add(new Connection(
					endpoint(connectionNode.get("from"), path, "from"),
					endpoint(connectionNode.get("to"), path, "to"),
					Boolean.TRUE.equals(connectionNode.get("annotated"))));
		}
		return new Instance(path, classPath, kind, prefix, annotations, List.copyOf(bindings.values()), children,
				connections);
	}

	private static ExpressionNode expression(Object raw, ModelPath path, String parameter) {
		if (raw == null) {
			throw new ModelFormatException("Binding " + path + "." + parameter + " has no value");
		}
		try {
			return ExpressionReader.read(String.valueOf(raw));
		} catch (SxlParseException e) {
			throw new ModelFormatException("Invalid expression for " + path + "." + parameter + ": " + e.getMessage(), e);
		}
	}

	private static Endpoint endpoint(Object raw, ModelPath declaring, String side) {
		if (!(raw instanceof Map<?, ?> node)) {
			throw new ModelFormatException("Connection '" + side + "' in " + declaring + " must be a mapping");
		}
		Object port = node.get("port");
		if (port == null) {
			throw new ModelFormatException("Connection '" + side + "' in " + declaring + " has no port");
		}
		Object instance = node.get("instance");
		ModelPath owner = declaring;
		if (instance != null && !String.valueOf(instance).isBlank()) {
			for (String segment : String.valueOf(instance).split("\\.")) {
				owner = owner.child(segment);
			}
		}
		return new Endpoint(owner, String.valueOf(port), Boolean.TRUE.equals(node.get("expandable")));
	}

	private static InstanceKind kind(Object raw, ModelPath path) {
		if (raw == null) {
			return InstanceKind.BLOCK;
		}
		return switch (String.valueOf(raw).trim().toLowerCase(Locale.ROOT)) {
			case "block" -> InstanceKind.BLOCK;
			case "record" -> InstanceKind.RECORD;
			case "connector" -> InstanceKind.CONNECTOR;
			case "expandable" -> InstanceKind.EXPANDABLE_CONNECTOR;
			default -> throw new ModelFormatException("Unknown kind '" + raw + "' for " + path);
		};
	}

	private static InnerOuter prefix(Object raw, ModelPath path) {
		try {
			return InnerOuter.parse(raw != null ? String.valueOf(raw) : null);
		} catch (IllegalArgumentException e) {
			throw new ModelFormatException("Invalid prefix for " + path + ": " + e.getMessage(), e);
		}
	}

	private static String requiredString(Map<?, ?> node, String key, ModelPath context) {
		Object value = node.get(key);
		if (value == null || String.valueOf(value).isBlank()) {
			throw new ModelFormatException("Missing '" + key + "'" + (context != null ? " in " + context : ""));
		}
		return String.valueOf(value);
	}

	private static List<?> list(Object raw, String key, ModelPath path) {
		if (raw == null) {
			return List.of();
		}
		if (!(raw instanceof List<?> list)) {
			throw new ModelFormatException("'" + key + "' of " + path + " must be a list");
		}
		return list;
	}

	private static Map<?, ?> map(Object raw, String key, ModelPath path) {
		if (raw == null) {
			return Map.of();
		}
		if (!(raw instanceof Map<?, ?> map)) {
			throw new ModelFormatException("'" + key + "' of " + path + " must be a mapping");
		}
		return map;
	}
}
