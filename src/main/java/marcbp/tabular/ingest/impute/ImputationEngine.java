package marcbp.tabular.ingest.impute;

import io.airlift.log.Logger;
import marcbp.tabular.ingest.policy.ImputationPolicy;
import marcbp.tabular.ingest.policy.MissingValueStrategy;
import marcbp.tabular.ingest.profile.PlaceholderTokens;
import marcbp.tabular.ingest.structure.Column;
import marcbp.tabular.ingest.structure.ColumnSelection;
import marcbp.tabular.ingest.util.NumericValues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static java.util.Objects.requireNonNull;

/**
 * Turns raw data rows into imputed records following a resolved {@link ImputationPolicy}.
 *
 * <p>The pass runs in four steps: placeholder normalization, replacement computation over every row,
 * a single row-drop filter, then replacement of the remaining missing feature cells. The target column is
 * only ever filtered, never imputed. No cell value makes this class throw.
 */
public final class ImputationEngine {
    private static final Logger LOG = Logger.get(ImputationEngine.class);

    static final String MISSING = "";
    static final Double ZERO = 0.0;

    private ImputationEngine() {}

    public static ImputationResult impute(List<List<String>> dataRows, ColumnSelection selection, ImputationPolicy policy) {
        requireNonNull(dataRows, "dataRows is null");
        requireNonNull(selection, "selection is null");
        requireNonNull(policy, "policy is null");

        List<Column> columns = orderedColumns(selection);
        List<Map<String, Object>> rows = normalize(dataRows, columns);
        int originalRowCount = rows.size();

        Map<String, Object> replacements = new LinkedHashMap<>();
        for (String feature : selection.featureNames()) {
            MissingValueStrategy strategy = policy.strategyFor(feature);
            if (strategy.imputes()) {
                Object replacement = computeReplacement(strategy, columnValues(rows, feature));
                replacements.put(feature, replacement);
                LOG.debug("Column %s: %s replacement is %s", feature, strategy, replacement);
            }
        }

        List<Map<String, Object>> kept = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (!shouldDrop(row, selection, policy)) {
                kept.add(applyReplacements(row, replacements));
            }
        }
        if (kept.size() < originalRowCount) {
            LOG.info("Dropped %s of %s rows (drop columns %s, global drop %s, target drop %s)",
                    originalRowCount - kept.size(), originalRowCount, policy.dropColumns(), policy.globalDrop(), policy.targetDrop());
        }
        return new ImputationResult(kept, originalRowCount, replacements);
    }

    /**
     * Replacement for one column, computed over its normalized values (missing cells are {@code ""}).
     */
    public static Object computeReplacement(MissingValueStrategy strategy, List<String> values) {
        switch (strategy.kind()) {
            case ZERO:
                return ZERO;
            case CONSTANT:
                return strategy.constantValue();
            case MEAN:
            case MEDIAN:
            case MODE:
                break;
            default:
                throw new IllegalArgumentException("Strategy does not impute: " + strategy);
        }

        List<String> present = new ArrayList<>(values.size());
        for (String value : values) {
            if (!isMissing(value)) {
                present.add(value);
            }
        }
        if (present.isEmpty()) {
            return ZERO;
        }
        if (strategy.kind() == MissingValueStrategy.Kind.MODE) {
            return mode(present);
        }

        double[] numbers = present.stream()
                .map(NumericValues::parse)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
        if (numbers.length == 0) {
            return ZERO;
        }
        return strategy.kind() == MissingValueStrategy.Kind.MEAN ? mean(numbers) : median(numbers);
    }

    static double mean(double[] numbers) {
        double sum = 0;
        for (double number : numbers) {
            sum += number;
        }
        if (Double.isFinite(sum)) {
            return sum / numbers.length;
        }
        // the sum overflowed; average the scaled values instead
        double mean = 0;
        for (double number : numbers) {
            mean += number / numbers.length;
        }
        return mean;
    }

    static double median(double[] numbers) {
        double[] sorted = numbers.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        double sum = sorted[mid - 1] + sorted[mid];
        return Double.isFinite(sum) ? sum / 2 : sorted[mid - 1] / 2 + sorted[mid] / 2;
    }

    /**
     * Most frequent value by exact string identity; the earliest value wins a tie.
     */
    static String mode(List<String> values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    static boolean isMissing(Object value) {
        return value == null || MISSING.equals(value);
    }

    private static List<Column> orderedColumns(ColumnSelection selection) {
        List<Column> columns = new ArrayList<>(selection.features());
        columns.add(selection.target());
        columns.sort((left, right) -> Integer.compare(left.index(), right.index()));
        return columns;
    }

    private static List<Map<String, Object>> normalize(List<List<String>> dataRows, List<Column> columns) {
        List<Map<String, Object>> rows = new ArrayList<>(dataRows.size());
        for (List<String> raw : dataRows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Column column : columns) {
                row.put(column.name(), PlaceholderTokens.normalize(column.cell(raw)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static List<String> columnValues(List<Map<String, Object>> rows, String column) {
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add((String) row.get(column));
        }
        return values;
    }

    private static boolean shouldDrop(Map<String, Object> row, ColumnSelection selection, ImputationPolicy policy) {
        List<String> governed = policy.globalDrop() ? selection.featureNames() : policy.dropColumns();
        for (String column : governed) {
            if (isMissing(row.get(column))) {
                return true;
            }
        }
        return policy.targetDrop() && isMissing(row.get(selection.target().name()));
    }

    private static Map<String, Object> applyReplacements(Map<String, Object> row, Map<String, Object> replacements) {
        Map<String, Object> imputed = new LinkedHashMap<>(row);
        for (Map.Entry<String, Object> replacement : replacements.entrySet()) {
            if (isMissing(imputed.get(replacement.getKey()))) {
                imputed.put(replacement.getKey(), replacement.getValue());
            }
        }
        return Collections.unmodifiableMap(imputed);
    }
}
