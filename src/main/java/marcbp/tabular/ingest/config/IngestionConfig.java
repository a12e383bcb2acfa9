package marcbp.tabular.ingest.config;

import marcbp.tabular.ingest.policy.MissingValueStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Per-session structural and remediation settings chosen by the operator.
 *
 * <p>An empty {@code featureColumns} list means "every column except the target"; an absent target means
 * "the last column". The target is never kept among the features.
 */
public record IngestionConfig(
        int skipRows,
        int headerRow,
        Optional<String> targetColumn,
        List<String> featureColumns,
        int previewLimit,
        Optional<MissingValueStrategy> globalStrategy,
        Map<String, MissingValueStrategy> columnStrategies,
        boolean inferTargetDropFromFeatures) {

    public IngestionConfig {
        if (skipRows < 0) {
            throw new IllegalArgumentException("skipRows must be >= 0");
        }
        if (headerRow < 0) {
            throw new IllegalArgumentException("headerRow must be >= 0");
        }
        if (previewLimit <= 0) {
            throw new IllegalArgumentException("previewLimit must be positive");
        }
        targetColumn = requireNonNull(targetColumn, "targetColumn is null");
        globalStrategy = requireNonNull(globalStrategy, "globalStrategy is null");
        globalStrategy.ifPresent(strategy -> {
            if (strategy.kind() == MissingValueStrategy.Kind.CONSTANT) {
                throw new IllegalArgumentException("Global strategy cannot be a constant");
            }
        });

        List<String> features = new ArrayList<>(requireNonNull(featureColumns, "featureColumns is null"));
        targetColumn.ifPresent(target -> features.removeIf(target::equals));
        featureColumns = List.copyOf(features);
        columnStrategies = Collections.unmodifiableMap(
                new LinkedHashMap<>(requireNonNull(columnStrategies, "columnStrategies is null")));
    }

    public static IngestionConfig defaults() {
        return defaults(IngestionSettings.DEFAULT_PREVIEW_LIMIT);
    }

    public static IngestionConfig defaults(IngestionSettings settings) {
        return defaults(settings.previewLimit());
    }

    private static IngestionConfig defaults(int previewLimit) {
        return new IngestionConfig(0, 0, Optional.empty(), List.of(), previewLimit, Optional.empty(), Map.of(), true);
    }

    public IngestionConfig withSkipRows(int skipRows) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withHeaderRow(int headerRow) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withTargetColumn(String targetColumn) {
        return new IngestionConfig(skipRows, headerRow, Optional.ofNullable(targetColumn), featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withFeatureColumns(List<String> featureColumns) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withPreviewLimit(int previewLimit) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withGlobalStrategy(MissingValueStrategy globalStrategy) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, Optional.ofNullable(globalStrategy), columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withColumnStrategies(Map<String, MissingValueStrategy> columnStrategies) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    public IngestionConfig withColumnStrategy(String column, MissingValueStrategy strategy) {
        requireNonNull(column, "column is null");
        Map<String, MissingValueStrategy> strategies = new LinkedHashMap<>(columnStrategies);
        if (strategy == null) {
            strategies.remove(column);
        }
        else {
            strategies.put(column, strategy);
        }
        return withColumnStrategies(strategies);
    }

    public IngestionConfig withInferTargetDropFromFeatures(boolean inferTargetDropFromFeatures) {
        return new IngestionConfig(skipRows, headerRow, targetColumn, featureColumns, previewLimit, globalStrategy, columnStrategies, inferTargetDropFromFeatures);
    }

    /**
     * Absolute index of the header row within the raw rows.
     */
    public int headerAbsoluteIndex() {
        return skipRows + headerRow;
    }

    /**
     * Whether {@code other} differs in a setting that changes the preview layout.
     */
    public boolean structurallyDiffers(IngestionConfig other) {
        return skipRows != other.skipRows || headerRow != other.headerRow || previewLimit != other.previewLimit;
    }
}
