package marcbp.tabular.ingest.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import marcbp.tabular.ingest.IngestionErrorCode;
import marcbp.tabular.ingest.IngestionException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StrategySpecParserTest {

    @Test
    void parsesNamedStrategies() {
        assertEquals(MissingValueStrategy.MEAN, StrategySpecParser.parseStrategy("\"mean\""));
        assertEquals(MissingValueStrategy.DROP_ROW, StrategySpecParser.parseStrategy("\" Drop-Row \""));
        assertEquals(MissingValueStrategy.LEAVE_AS_IS, StrategySpecParser.parseStrategy("{\"type\":\"leave-as-is\"}"));
    }

    @Test
    void parsesConstantWithTextOrNumber() {
        assertEquals(MissingValueStrategy.constant("unknown"),
                StrategySpecParser.parseStrategy("{\"type\":\"constant\",\"value\":\"unknown\"}"));
        assertEquals(MissingValueStrategy.constant("-1"),
                StrategySpecParser.parseStrategy("{\"type\":\"constant\",\"value\":-1}"));
    }

    @Test
    void parsesColumnStrategyMapInOrder() {
        Map<String, MissingValueStrategy> strategies = StrategySpecParser.parseColumnStrategies(
                "{\"b\":\"median\",\"a\":{\"type\":\"constant\",\"value\":\"x\"},\"c\":\"mode\"}");

        assertEquals(List.of("b", "a", "c"), List.copyOf(strategies.keySet()));
        assertEquals(MissingValueStrategy.MEDIAN, strategies.get("b"));
        assertEquals(MissingValueStrategy.constant("x"), strategies.get("a"));
        assertEquals(MissingValueStrategy.MODE, strategies.get("c"));
    }

    @Test
    void writesWireShape() {
        Map<String, MissingValueStrategy> strategies = new LinkedHashMap<>();
        strategies.put("a", MissingValueStrategy.ZERO);
        strategies.put("b", MissingValueStrategy.constant("n/a"));

        String json = StrategySpecParser.toJson(strategies);

        assertEquals("{\"a\":\"zero\",\"b\":{\"type\":\"constant\",\"value\":\"n/a\"}}", json);
        assertEquals(strategies, StrategySpecParser.parseColumnStrategies(json));
    }

    @Test
    void jacksonReadsStrategiesThroughCreator() throws Exception {
        MissingValueStrategy strategy = new ObjectMapper().readValue("\"median\"", MissingValueStrategy.class);

        assertEquals(MissingValueStrategy.MEDIAN, strategy);
    }

    @Test
    void rejectsMalformedSpecifications() {
        assertInvalid("\"average\"");
        assertInvalid("\"constant\"");
        assertInvalid("{\"type\":\"constant\"}");
        assertInvalid("{\"type\":\"constant\",\"value\":[1]}");
        assertInvalid("{\"value\":1}");
        assertInvalid("42");
        assertInvalid("{not json");
        assertInvalid("");
        assertEquals(IngestionErrorCode.INVALID_STRATEGY,
                assertThrows(IngestionException.class, () -> StrategySpecParser.parseColumnStrategies("[]")).getErrorCode());
    }

    private static void assertInvalid(String json) {
        IngestionException exception = assertThrows(IngestionException.class, () -> StrategySpecParser.parseStrategy(json));
        assertEquals(IngestionErrorCode.INVALID_STRATEGY, exception.getErrorCode());
    }
}
