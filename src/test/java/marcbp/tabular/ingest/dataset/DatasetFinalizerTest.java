package marcbp.tabular.ingest.dataset;

import marcbp.tabular.ingest.config.IngestionConfig;
import marcbp.tabular.ingest.impute.ImputationEngine;
import marcbp.tabular.ingest.impute.ImputationResult;
import marcbp.tabular.ingest.policy.ImputationPolicy;
import marcbp.tabular.ingest.policy.MissingValueStrategy;
import marcbp.tabular.ingest.policy.PolicyResolver;
import marcbp.tabular.ingest.structure.Column;
import marcbp.tabular.ingest.structure.ColumnSelection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetFinalizerTest {

    @Test
    void binaryLabelsAreClassification() {
        List<Object> labels = List.of(1.0, 0.0, 1.0, 0.0, 1.0, 0.0, 1.0, 0.0, 1.0, 0.0);

        assertEquals(TargetType.CLASSIFICATION, DatasetFinalizer.inferTargetType(labels));
    }

    @Test
    void manyDistinctDecimalsAreRegression() {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            values.add(i + 0.5);
        }

        assertEquals(TargetType.REGRESSION, DatasetFinalizer.inferTargetType(values));
    }

    @Test
    void fewDistinctValuesAmongManySamplesAreClassification() {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            values.add((double) (i % 3 + 1));
        }

        assertEquals(TargetType.CLASSIFICATION, DatasetFinalizer.inferTargetType(values));
        assertEquals(TargetType.REGRESSION, DatasetFinalizer.inferTargetType(List.of(1.0, 2.0, 3.0, 1.0)));
    }

    @Test
    void textLabelsAreClassificationAndNoLabelsRegression() {
        assertEquals(TargetType.CLASSIFICATION, DatasetFinalizer.inferTargetType(List.of(1.0, "cat")));
        assertEquals(TargetType.REGRESSION, DatasetFinalizer.inferTargetType(List.of()));
    }

    @Test
    void typesNumericTextAsDouble() {
        assertEquals(3.0, DatasetFinalizer.typeCell("3"));
        assertEquals(-0.5, DatasetFinalizer.typeCell(" -0.5 "));
        assertEquals("red", DatasetFinalizer.typeCell("red"));
        assertEquals("", DatasetFinalizer.typeCell(""));
        assertEquals(2.0, DatasetFinalizer.typeCell(2.0));
    }

    @Test
    void buildsDatasetWithSummary() {
        ColumnSelection selection = new ColumnSelection(new Column("label", 1), List.of(new Column("x", 0)));
        List<List<String>> rows = List.of(
                List.of("1", "cat"),
                List.of("", "dog"),
                List.of("3", ""),
                List.of("4", "cat"));
        ImputationPolicy policy = PolicyResolver.resolve(
                List.of("x"), Optional.of("label"), Optional.empty(), Map.of("x", MissingValueStrategy.DROP_ROW), true);
        ImputationResult result = ImputationEngine.impute(rows, selection, policy);
        IngestionConfig config = IngestionConfig.defaults().withSkipRows(2).withHeaderRow(1);

        Dataset dataset = DatasetFinalizer.finalizeDataset(result, selection, policy, config);

        assertEquals(List.of(Map.of("x", 1.0, "label", "cat"), Map.of("x", 4.0, "label", "cat")), dataset.rows());
        assertEquals(List.of("x"), dataset.features());
        assertEquals("label", dataset.target());
        assertEquals(TargetType.CLASSIFICATION, dataset.targetType());
        assertEquals(1, dataset.numClasses());
        assertEquals(2, dataset.numSamples());
        assertEquals(1, dataset.numFeatures());
        assertEquals(2, dataset.skipRows());
        assertEquals(1, dataset.headerRow());

        ImputationSummary summary = dataset.imputationSummary();
        assertEquals(4, summary.originalRowCount());
        assertEquals(2, summary.droppedRowCount());
        assertTrue(summary.dropApplied());
        assertEquals(List.of("x"), summary.dropColumns());
        assertFalse(summary.globalDrop());
        assertTrue(summary.targetDrop());
    }

    @Test
    void regressionDatasetHasNoClassCount() {
        ColumnSelection selection = new ColumnSelection(new Column("y", 1), List.of(new Column("x", 0)));
        List<List<String>> rows = List.of(List.of("1", "1.5"), List.of("2", "2.5"), List.of("3", "7"));
        ImputationPolicy policy = PolicyResolver.resolve(List.of("x"), Optional.of("y"), Optional.empty(), Map.of(), true);

        Dataset dataset = DatasetFinalizer.finalizeDataset(
                ImputationEngine.impute(rows, selection, policy), selection, policy, IngestionConfig.defaults());

        assertEquals(TargetType.REGRESSION, dataset.targetType());
        assertNull(dataset.numClasses());
        assertFalse(dataset.imputationSummary().dropApplied());
    }

    @Test
    void classLabelsAreCountedByText() {
        ColumnSelection selection = new ColumnSelection(new Column("y", 1), List.of(new Column("x", 0)));
        List<List<String>> rows = List.of(
                List.of("1", "1"),
                List.of("2", "01"),
                List.of("3", "1.0"),
                List.of("4", "0"));
        ImputationPolicy policy = PolicyResolver.resolve(List.of("x"), Optional.of("y"), Optional.empty(), Map.of(), true);

        Dataset dataset = DatasetFinalizer.finalizeDataset(
                ImputationEngine.impute(rows, selection, policy), selection, policy, IngestionConfig.defaults());

        assertEquals(TargetType.CLASSIFICATION, dataset.targetType());
        assertEquals(4, dataset.numClasses());
        assertEquals(Map.of("x", 2.0, "y", "01"), dataset.rows().get(1));
    }
}
