package io.patchbay.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.patchbay.core.model.DelegationMode;
import io.patchbay.core.template.ParameterSpec;
import io.patchbay.core.template.ToolSpec;
import io.patchbay.core.template.ToolSpecException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Reads and writes {@link ToolSpec} documents as JSON.
///
/// ### Format
/// {@snippet lang=json :
/// {
///   "name": "set_tempo",
///   "description": "Set the session tempo",
///   "mode": { "type": "delegated", "target": "transport", "method": "set_tempo" },
///   "parameters": [
///     { "name": "bpm", "type": "number", "description": "Tempo in beats per minute (60-200)" },
///     { "name": "name", "type": "string", "description": "Track name", "default": null }
///   ]
/// }
/// }
///
/// Every spec names its `"mode"` and lists its `"parameters"`, even when the list is empty. A
/// parameter is optional when it carries `"optional": true` or a `"default"` field.
///
/// Structural problems (missing name, description, mode, parameters, parameter type) are
/// collected and reported together in one {@link ToolSpecException}. Semantic checks are left to
/// the generator.
///
/// @implNote Thread-safe. Stateless; the mapper is created per call.
/// @see PatchbayJacksonModule for the `mode` format
public final class ToolSpecReader {

    private ToolSpecReader() {}

    /// Reads a single spec.
    ///
    /// @param json JSON object text, not null
    /// @return parsed spec, never null
    /// @throws ToolSpecException if the JSON is malformed or a required field is missing
    public static ToolSpec read(String json) throws ToolSpecException {
        JsonNode root = parse(json);
        if (!root.isObject()) {
            throw new ToolSpecException(List.of("expected a JSON object"));
        }
        return toSpec(root, "");
    }

    /// Reads a single spec from a file.
    ///
    /// @throws IOException if the file cannot be read
    /// @throws ToolSpecException if the content is not a valid spec
    public static ToolSpec read(Path file) throws IOException, ToolSpecException {
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    /// Reads a JSON array of specs, or a single spec object as a one-element list.
    ///
    /// @param json JSON text, not null
    /// @return specs in document order, never null
    /// @throws ToolSpecException listing the problems of every element
    public static List<ToolSpec> readAll(String json) throws ToolSpecException {
        JsonNode root = parse(json);
        if (root.isObject()) {
            return List.of(toSpec(root, ""));
        }
        if (!root.isArray()) {
            throw new ToolSpecException(List.of("expected a JSON object or array"));
        }
        List<ToolSpec> specs = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                problems.add("[" + i + "]: expected a JSON object");
                continue;
            }
            try {
                specs.add(toSpec(element, "[" + i + "]: "));
            } catch (ToolSpecException e) {
                problems.addAll(e.getProblems());
            }
        }
        if (!problems.isEmpty()) {
            throw new ToolSpecException(problems);
        }
        return List.copyOf(specs);
    }

    /// Reads a file holding either one spec or an array of specs.
    public static List<ToolSpec> readAll(Path file) throws IOException, ToolSpecException {
        return readAll(Files.readString(file, StandardCharsets.UTF_8));
    }

    /// Writes a spec as pretty-printed JSON in the format accepted by {@link #read(String)}.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String write(ToolSpec spec) {
        ObjectMapper mapper = createMapper();
        ObjectNode root = mapper.createObjectNode();
        root.put("name", spec.name());
        root.put("description", spec.description());
        root.set("mode", mapper.valueToTree(spec.mode()));
        ArrayNode parameters = root.putArray("parameters");
        for (ParameterSpec parameter : spec.parameters()) {
            ObjectNode node = parameters.addObject();
            node.put("name", parameter.name());
            node.put("type", parameter.type());
            node.put("description", parameter.description());
            if (parameter.optional()) {
                node.put("optional", true);
                node.set("default", mapper.valueToTree(parameter.defaultValue()));
            }
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize tool spec: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for spec and report documents.
    ///
    /// Registers:
    /// - `PatchbayJacksonModule` for `DelegationMode`
    /// - `JavaTimeModule` for `Duration` fields in reports
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PatchbayJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static JsonNode parse(String json) throws ToolSpecException {
        try {
            JsonNode root = createMapper().readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new ToolSpecException(List.of("empty document"));
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ToolSpecException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ToolSpec toSpec(JsonNode node, String prefix) throws ToolSpecException {
        List<String> problems = new ArrayList<>();
        String name = text(node, "name");
        if (name == null) {
            problems.add(prefix + "missing \"name\"");
        }
        String where = prefix + (name != null ? name + ": " : "");
        String description = text(node, "description");
        if (description == null) {
            problems.add(where + "missing \"description\"");
        }

        DelegationMode mode = null;
        JsonNode modeNode = node.get("mode");
        if (modeNode == null || modeNode.isNull()) {
            problems.add(where + "missing \"mode\"");
        } else {
            try {
                mode = createMapper().treeToValue(modeNode, DelegationMode.class);
            } catch (JsonProcessingException e) {
                problems.add(where + "invalid \"mode\": " + e.getOriginalMessage());
            }
        }

        List<ParameterSpec> parameters = new ArrayList<>();
        JsonNode params = node.get("parameters");
        if (params == null || params.isNull()) {
            problems.add(where + "missing \"parameters\"");
        } else {
            if (!params.isArray()) {
                problems.add(where + "\"parameters\" must be an array");
            } else {
                for (int i = 0; i < params.size(); i++) {
                    ParameterSpec parameter = toParameter(params.get(i), where + "parameter " + i, problems);
                    if (parameter != null) {
                        parameters.add(parameter);
                    }
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new ToolSpecException(problems);
        }
        ToolSpec.Builder builder = ToolSpec.builder(name).description(description).mode(mode);
        parameters.forEach(builder::parameter);
        return builder.build();
    }

    private static ParameterSpec toParameter(JsonNode node, String where, List<String> problems) {
        if (node == null || !node.isObject()) {
            problems.add(where + ": expected a JSON object");
            return null;
        }
        String name = text(node, "name");
        String type = text(node, "type");
        if (name == null) {
            problems.add(where + ": missing \"name\"");
        }
        if (type == null) {
            problems.add(where + (name != null ? " (" + name + ")" : "") + ": missing \"type\"");
        }
        if (name == null || type == null) {
            return null;
        }

        JsonNode defaultNode = node.get("default");
        Object defaultValue = null;
        if (defaultNode != null && !defaultNode.isNull()) {
            if (!defaultNode.isValueNode()) {
                problems.add(where + " (" + name + "): \"default\" must be a scalar");
                return null;
            }
            defaultValue = scalar(defaultNode);
        }
        JsonNode optionalNode = node.get("optional");
        boolean optional =
                optionalNode != null && optionalNode.isBoolean()
                        ? optionalNode.booleanValue()
                        : defaultNode != null;
        String description = text(node, "description");
        return new ParameterSpec(name, type, description, optional, defaultValue);
    }

    private static Object scalar(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
