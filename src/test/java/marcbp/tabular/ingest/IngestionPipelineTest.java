package marcbp.tabular.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import marcbp.tabular.ingest.config.DatasetLimits;
import marcbp.tabular.ingest.config.IngestionConfig;
import marcbp.tabular.ingest.config.IngestionSettings;
import marcbp.tabular.ingest.config.LimitViolation;
import marcbp.tabular.ingest.dataset.Dataset;
import marcbp.tabular.ingest.dataset.TargetType;
import marcbp.tabular.ingest.policy.MissingValueStrategy;
import marcbp.tabular.ingest.preview.PreviewResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionPipelineTest {

    private final IngestionPipeline pipeline = new IngestionPipeline(IngestionSettings.defaults());

    @Test
    void zeroStrategyFillsMissingCells() {
        FinalizeResult result = pipeline.finalizeDataset("a,b\n1,\n2,3\n",
                IngestionConfig.defaults().withTargetColumn("a").withGlobalStrategy(MissingValueStrategy.ZERO));

        Dataset dataset = result.getDataset().orElseThrow();
        assertEquals(List.of(Map.of("a", 1.0, "b", 0.0), Map.of("a", 2.0, "b", 3.0)), dataset.rows());
        assertEquals(0, dataset.imputationSummary().droppedRowCount());
        assertEquals("a", dataset.target());
        assertEquals(List.of("b"), dataset.features());
    }

    @Test
    void dropRowStrategyRemovesIncompleteRows() {
        FinalizeResult result = pipeline.finalizeDataset("a,b\n1,\n2,3\n",
                IngestionConfig.defaults().withTargetColumn("a").withGlobalStrategy(MissingValueStrategy.DROP_ROW));

        Dataset dataset = result.getDataset().orElseThrow();
        assertEquals(List.of(Map.of("a", 2.0, "b", 3.0)), dataset.rows());
        assertEquals(1, dataset.imputationSummary().droppedRowCount());
        assertTrue(dataset.imputationSummary().globalDrop());
        assertTrue(dataset.imputationSummary().targetDrop());
    }

    @Test
    void targetCellsAreNeverImputed() {
        FinalizeResult result = pipeline.finalizeDataset("a,b\n1,\n2,3\n",
                IngestionConfig.defaults().withGlobalStrategy(MissingValueStrategy.ZERO));

        Dataset dataset = result.getDataset().orElseThrow();
        assertEquals("b", dataset.target());
        assertEquals(List.of(Map.of("a", 1.0, "b", ""), Map.of("a", 2.0, "b", 3.0)), dataset.rows());
    }

    @Test
    void binaryTargetIsClassification() {
        StringBuilder text = new StringBuilder("f,label\n");
        for (int i = 0; i < 10; i++) {
            text.append(i).append(',').append((i + 1) % 2).append('\n');
        }

        Dataset dataset = pipeline.finalizeDataset(text.toString(), IngestionConfig.defaults()).getDataset().orElseThrow();

        assertEquals(TargetType.CLASSIFICATION, dataset.targetType());
        assertEquals(2, dataset.numClasses());
        assertEquals(10, dataset.numSamples());
    }

    @Test
    void structuralErrorsAreReturned() {
        assertError(IngestionErrorCode.EMPTY_INPUT, pipeline.finalizeDataset("", IngestionConfig.defaults()));
        assertError(IngestionErrorCode.NO_DATA_ROWS, pipeline.finalizeDataset("a,b\n", IngestionConfig.defaults()));
        assertError(IngestionErrorCode.HEADER_ROW_OUT_OF_RANGE,
                pipeline.finalizeDataset("a,b\n1,2\n", IngestionConfig.defaults().withHeaderRow(2)));
        assertError(IngestionErrorCode.UNKNOWN_COLUMN,
                pipeline.finalizeDataset("a,b\n1,2\n", IngestionConfig.defaults().withTargetColumn("c")));
        assertError(IngestionErrorCode.PARSE_ERROR,
                pipeline.finalizeDataset("a,b\n\"1,2\n", IngestionConfig.defaults()));
    }

    @Test
    void finalizeIsRefusedWhenLimitsAreExceeded() {
        IngestionSettings settings = new IngestionSettings(
                new DatasetLimits(1024, 10, 2), 50, Optional.of(','), StandardCharsets.UTF_8);
        IngestionPipeline strict = new IngestionPipeline(settings);

        FinalizeResult result = strict.finalizeDataset("a,b\n1,2\n3,4\n", IngestionConfig.defaults());

        assertError(IngestionErrorCode.LIMIT_EXCEEDED, result);
        assertEquals(List.of(LimitViolation.Limit.MAX_ROWS),
                result.getLimitErrors().stream().map(LimitViolation::limit).toList());
    }

    @Test
    void previewSplitsText() {
        PreviewResult preview = pipeline.preview("a;b\n1;NA\n", IngestionConfig.defaults());

        assertTrue(preview.isSuccess());
        assertEquals(List.of("a", "b"), preview.getColumns());
        assertEquals(1, preview.getStats().get("b").placeholderMissing());
    }

    @Test
    void previewReportsParseErrors() {
        PreviewResult preview = pipeline.preview("a,b\n\"open\n", IngestionConfig.defaults());

        assertFalse(preview.isSuccess());
        assertEquals(IngestionErrorCode.PARSE_ERROR, preview.getError().orElseThrow().code());
    }

    @Test
    void previewJsonIsByteIdenticalAcrossRuns() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        String text = "id,x,y\n1,?,a\n2,3.5,b\n3,,a\n";
        IngestionConfig config = IngestionConfig.defaults();

        assertArrayEquals(
                objectMapper.writeValueAsBytes(pipeline.preview(text, config)),
                objectMapper.writeValueAsBytes(pipeline.preview(text, config)));
    }

    @Test
    void finalizeResultSerializesDataset() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        FinalizeResult result = pipeline.finalizeDataset("x,y\n1,2.5\n2,3.5\n3,\n", IngestionConfig.defaults());

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

        assertTrue(json.get("success").asBoolean());
        assertEquals("regression", json.get("dataset").get("targetType").asText());
        assertEquals(3, json.get("dataset").get("numSamples").asInt());
        assertFalse(json.get("dataset").has("numClasses"));
        assertEquals("", json.get("dataset").get("rows").get(2).get("y").asText());
        assertFalse(json.get("dataset").get("imputationSummary").get("dropApplied").asBoolean());
    }

    private static void assertError(IngestionErrorCode expected, FinalizeResult result) {
        assertFalse(result.isSuccess());
        assertEquals(expected, result.getError().orElseThrow().code());
    }
}
