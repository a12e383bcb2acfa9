package marcbp.tabular.ingest.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import marcbp.tabular.ingest.IngestionErrorCode;
import marcbp.tabular.ingest.IngestionException;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the JSON shape of missing-value strategies.
 *
 * <p>A strategy is either a wire name such as {@code "median"} or an object
 * {@code {"type":"constant","value":<string|number>}}. A column strategy map is a JSON object keyed by
 * column name.
 */
public final class StrategySpecParser {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private StrategySpecParser() {
    }

    public static MissingValueStrategy parseStrategy(String json) {
        return parseStrategy(readTree(json));
    }

    public static MissingValueStrategy parseStrategy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw invalid("Strategy must not be null");
        }
        if (node.isTextual()) {
            return MissingValueStrategy.fromName(node.textValue());
        }
        if (!(node instanceof ObjectNode objectNode)) {
            throw invalid("Strategy must be a string or an object: " + node);
        }
        JsonNode type = objectNode.get("type");
        if (type == null || !type.isTextual()) {
            throw invalid("Strategy object requires a textual type: " + node);
        }
        MissingValueStrategy.Kind kind = MissingValueStrategy.Kind.fromWireName(type.textValue());
        if (kind != MissingValueStrategy.Kind.CONSTANT) {
            return MissingValueStrategy.of(kind);
        }
        JsonNode value = objectNode.get("value");
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw invalid("Constant strategy requires a string or number value: " + node);
        }
        return MissingValueStrategy.constant(value.asText());
    }

    public static Map<String, MissingValueStrategy> parseColumnStrategies(String json) {
        JsonNode root = readTree(json);
        if (!(root instanceof ObjectNode objectNode)) {
            throw invalid("Column strategies must be a JSON object");
        }
        Map<String, MissingValueStrategy> strategies = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = objectNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            strategies.put(field.getKey(), parseStrategy(field.getValue()));
        }
        return Collections.unmodifiableMap(strategies);
    }

    public static String toJson(Map<String, MissingValueStrategy> strategies) {
        try {
            return OBJECT_MAPPER.writeValueAsString(strategies);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize column strategies", e);
        }
    }

    private static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw invalid("Strategy specification is empty");
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        }
        catch (JsonProcessingException e) {
            throw new IngestionException(IngestionErrorCode.INVALID_STRATEGY, "Invalid strategy JSON: " + json, e);
        }
    }

    private static IngestionException invalid(String message) {
        return new IngestionException(IngestionErrorCode.INVALID_STRATEGY, message);
    }
}
