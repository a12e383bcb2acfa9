package marcbp.tabular.ingest.profile;

import marcbp.tabular.ingest.structure.Column;
import marcbp.tabular.ingest.util.NumericValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies preview cells and aggregates per-column statistics over the data region of a row window.
 */
public final class ColumnProfiler {
    static final int MAX_EXAMPLE_PLACEHOLDERS = 5;

    private ColumnProfiler() {}

    /**
     * One classification per column for every row of the window, header and skipped rows included.
     */
    public static List<List<CellClass>> classifyRows(List<Column> columns, List<List<String>> windowRows) {
        List<List<CellClass>> flags = new ArrayList<>(windowRows.size());
        for (List<String> row : windowRows) {
            List<CellClass> rowFlags = new ArrayList<>(columns.size());
            for (Column column : columns) {
                rowFlags.add(PlaceholderTokens.classify(column.cell(row)));
            }
            flags.add(List.copyOf(rowFlags));
        }
        return List.copyOf(flags);
    }

    /**
     * Statistics keyed by column name in header order.
     *
     * @param windowRows raw rows starting at absolute index 0
     * @param dataStartIndex absolute index of the first data row; earlier rows are ignored
     */
    public static Map<String, ColumnStats> profile(List<Column> columns, List<List<String>> windowRows, int dataStartIndex) {
        List<List<String>> dataRows = dataStartIndex >= windowRows.size()
                ? List.of()
                : windowRows.subList(dataStartIndex, windowRows.size());
        Map<String, ColumnStats> stats = new LinkedHashMap<>();
        for (Column column : columns) {
            List<String> values = new ArrayList<>(dataRows.size());
            for (List<String> row : dataRows) {
                values.add(column.cell(row));
            }
            stats.put(column.name(), profileColumn(values));
        }
        return Collections.unmodifiableMap(stats);
    }

    public static ColumnStats profileColumn(List<String> values) {
        int missing = 0;
        int placeholders = 0;
        int valid = 0;
        int numeric = 0;
        List<String> examples = new ArrayList<>();
        Set<String> distinct = new HashSet<>();

        for (String value : values) {
            CellClass cellClass = PlaceholderTokens.classify(value);
            if (cellClass == CellClass.MISSING) {
                missing++;
                continue;
            }
            String trimmed = value.trim();
            distinct.add(trimmed);
            if (cellClass == CellClass.PLACEHOLDER) {
                placeholders++;
                String token = trimmed.toLowerCase(Locale.ROOT);
                if (examples.size() < MAX_EXAMPLE_PLACEHOLDERS && !examples.contains(token)) {
                    examples.add(token);
                }
                continue;
            }
            valid++;
            if (NumericValues.isNumeric(trimmed)) {
                numeric++;
            }
        }

        int nonMissing = valid + placeholders;
        Double numericFraction = nonMissing == 0 ? null : (double) numeric / nonMissing;
        return new ColumnStats(missing, placeholders, examples, inferType(valid, numeric), distinct.size(), numericFraction);
    }

    private static InferredType inferType(int validCount, int numericCount) {
        if (validCount == 0) {
            return InferredType.EMPTY;
        }
        if (numericCount == validCount) {
            return InferredType.NUMERIC;
        }
        if (numericCount == 0) {
            return InferredType.CATEGORICAL;
        }
        return InferredType.MIXED;
    }
}
