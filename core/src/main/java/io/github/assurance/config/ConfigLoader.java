package io.github.assurance.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON config loader for detectors and monitors.
 *
 * <p>Fields missing from a signal entry fall back to {@code defaults}, which fall
 * back to the {@link AssuranceConfig} constants. Unknown fields are rejected.</p>
 *
 * <pre>{@code
 * {
 *   "module": "qos_controller",
 *   "defaults": { "windowSize": 8, "maxCheckpoints": 4, "quorum": 0.5 },
 *   "signals": {
 *     "ipc": { "fractionThreshold": 0.4 },
 *     "cpi": { "windowSize": 16, "maxCheckpoints": 5 }
 *   }
 * }
 * }</pre>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * MonitorConfig config = ConfigLoader.fromResource("assurance.json");
 * AssuranceConfig single = ConfigLoader.detectorFromJson("{\"quorum\": 0.5}");
 * String json = ConfigLoader.toJsonPretty(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> MONITOR_FIELDS = Set.of("module", "defaults", "signals");
    private static final Set<String> DETECTOR_FIELDS = Set.of(
        "windowSize", "maxCheckpoints", "fractionThreshold", "severityFraction", "nearFraction", "quorum");

    private ConfigLoader() {
    }

    // ============ Load ============

    /**
     * Load a monitor config from a JSON string.
     */
    public static MonitorConfig fromJson(String json) {
        JsonNode root = readTree(json);
        requireObject(root, "root");
        checkFields(root, MONITOR_FIELDS, "root");

        String module = root.hasNonNull("module") ? root.get("module").asText() : null;

        AssuranceConfig defaults = AssuranceConfig.defaults();
        if (root.hasNonNull("defaults")) {
            defaults = toDetectorConfig(root.get("defaults"), defaults, "defaults");
        }

        Map<String, AssuranceConfig> signals = new LinkedHashMap<>();
        if (root.hasNonNull("signals")) {
            JsonNode signalsNode = root.get("signals");
            requireObject(signalsNode, "signals");
            Iterator<Map.Entry<String, JsonNode>> it = signalsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String path = "signals." + entry.getKey();
                signals.put(entry.getKey(), toDetectorConfig(entry.getValue(), defaults, path));
            }
        }

        return new MonitorConfig(module, defaults, signals);
    }

    /**
     * Load a single detector config, e.g. {@code {"windowSize": 16, "quorum": 0.7}}.
     */
    public static AssuranceConfig detectorFromJson(String json) {
        return toDetectorConfig(readTree(json), AssuranceConfig.defaults(), "root");
    }

    public static MonitorConfig fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    public static MonitorConfig fromFile(String path) throws IOException {
        return fromFile(Path.of(path));
    }

    public static MonitorConfig fromStream(InputStream stream) throws IOException {
        return fromJson(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Load from a classpath resource.
     */
    public static MonitorConfig fromResource(String resourcePath) throws IOException {
        try (InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return fromStream(stream);
        }
    }

    // ============ Write ============

    public static String toJson(MonitorConfig config) {
        try {
            return MAPPER.writeValueAsString(toNode(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize monitor config", e);
        }
    }

    public static String toJsonPretty(MonitorConfig config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize monitor config", e);
        }
    }

    // ============ Mapping ============

    private static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Config JSON is empty");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static AssuranceConfig toDetectorConfig(JsonNode node, AssuranceConfig base, String path) {
        requireObject(node, path);
        checkFields(node, DETECTOR_FIELDS, path);
        AssuranceConfig.Builder builder = AssuranceConfig.builder()
            .windowSize(intField(node, "windowSize", base.windowSize(), path))
            .maxCheckpoints(intField(node, "maxCheckpoints", base.maxCheckpoints(), path))
            .fractionThreshold(doubleField(node, "fractionThreshold", base.fractionThreshold(), path))
            .severityFraction(doubleField(node, "severityFraction", base.severityFraction(), path))
            .nearFraction(doubleField(node, "nearFraction", base.nearFraction(), path))
            .quorum(doubleField(node, "quorum", base.quorum(), path));
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
        }
    }

    private static int intField(JsonNode node, String field, int fallback, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(path + "." + field + " must be an integer, got " + value);
        }
        return value.intValue();
    }

    private static double doubleField(JsonNode node, String field, double fallback, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException(path + "." + field + " must be a number, got " + value);
        }
        return value.doubleValue();
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException(path + " must be a JSON object");
        }
    }

    private static void checkFields(JsonNode node, Set<String> allowed, String path) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new IllegalArgumentException("Unknown field '" + name + "' in " + path);
            }
        }
    }

    private static ObjectNode toNode(MonitorConfig config) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("module", config.module());
        root.set("defaults", toNode(config.defaults()));
        ObjectNode signals = root.putObject("signals");
        config.signals().forEach((name, detector) -> signals.set(name, toNode(detector)));
        return root;
    }

    private static ObjectNode toNode(AssuranceConfig config) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("windowSize", config.windowSize());
        node.put("maxCheckpoints", config.maxCheckpoints());
        node.put("fractionThreshold", config.fractionThreshold());
        node.put("severityFraction", config.severityFraction());
        node.put("nearFraction", config.nearFraction());
        node.put("quorum", config.quorum());
        return node;
    }
}
