package marcbp.tabular.ingest.dataset;

import io.airlift.log.Logger;
import marcbp.tabular.ingest.config.IngestionConfig;
import marcbp.tabular.ingest.impute.ImputationResult;
import marcbp.tabular.ingest.policy.ImputationPolicy;
import marcbp.tabular.ingest.structure.ColumnSelection;
import marcbp.tabular.ingest.util.NumericValues;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Types imputed cells and packages them into a {@link Dataset}.
 *
 * <p>Class labels of a classification target are kept as text; every other numeric cell becomes a
 * {@link Double}.
 */
public final class DatasetFinalizer {
    private static final Logger LOG = Logger.get(DatasetFinalizer.class);

    static final int MAX_CLASSIFICATION_UNIQUE = 10;
    static final double MAX_CLASSIFICATION_UNIQUE_RATIO = 0.1;

    private DatasetFinalizer() {}

    public static Dataset finalizeDataset(ImputationResult result,
                                          ColumnSelection selection,
                                          ImputationPolicy policy,
                                          IngestionConfig config) {
        requireNonNull(result, "result is null");
        requireNonNull(selection, "selection is null");
        requireNonNull(policy, "policy is null");
        requireNonNull(config, "config is null");

        String target = selection.target().name();
        List<Object> targetValues = new ArrayList<>(result.rows().size());
        for (Map<String, Object> row : result.rows()) {
            Object value = row.get(target);
            if (!isMissing(value)) {
                targetValues.add(value);
            }
        }
        TargetType targetType = inferTargetType(targetValues);
        boolean classification = targetType == TargetType.CLASSIFICATION;
        // class labels keep their text so that "1" and "1.0" stay distinct
        Integer numClasses = classification ? new HashSet<>(targetValues).size() : null;

        List<Map<String, Object>> rows = new ArrayList<>(result.rows().size());
        for (Map<String, Object> row : result.rows()) {
            Map<String, Object> typed = new LinkedHashMap<>();
            row.forEach((column, value) ->
                    typed.put(column, classification && column.equals(target) ? value : typeCell(value)));
            rows.add(typed);
        }

        Dataset dataset = new Dataset(
                rows,
                selection.featureNames(),
                target,
                targetType,
                numClasses,
                config.skipRows(),
                config.headerRow(),
                ImputationSummary.of(result, policy));
        LOG.info("Finalized dataset: %s samples, %s features, target %s (%s)",
                dataset.numSamples(), dataset.numFeatures(), target, targetType.wireName());
        return dataset;
    }

    /**
     * Non-empty text that parses as a number becomes a {@link Double}; anything else is kept.
     */
    public static Object typeCell(Object value) {
        if (value instanceof String text && !text.isEmpty()) {
            OptionalDouble number = NumericValues.parse(text);
            if (number.isPresent()) {
                return number.getAsDouble();
            }
        }
        return value;
    }

    /**
     * Classification when any label is non-numeric, when every label is 0 or 1, or when there are few
     * distinct numeric labels relative to the sample count; regression otherwise.
     */
    public static TargetType inferTargetType(List<?> values) {
        if (values.isEmpty()) {
            return TargetType.REGRESSION;
        }
        Set<Double> distinct = new HashSet<>();
        boolean binary = true;
        for (Object value : values) {
            OptionalDouble number = NumericValues.parseCell(value);
            if (number.isEmpty()) {
                return TargetType.CLASSIFICATION;
            }
            double label = number.getAsDouble();
            binary &= label == 0.0 || label == 1.0;
            distinct.add(label);
        }
        if (binary) {
            return TargetType.CLASSIFICATION;
        }
        int unique = distinct.size();
        if (unique <= MAX_CLASSIFICATION_UNIQUE && unique < MAX_CLASSIFICATION_UNIQUE_RATIO * values.size()) {
            return TargetType.CLASSIFICATION;
        }
        return TargetType.REGRESSION;
    }

    private static boolean isMissing(Object value) {
        return value == null || "".equals(value);
    }
}
