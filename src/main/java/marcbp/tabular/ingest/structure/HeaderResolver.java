package marcbp.tabular.ingest.structure;

import marcbp.tabular.ingest.IngestionErrorCode;
import marcbp.tabular.ingest.IngestionException;
import marcbp.tabular.ingest.config.IngestionConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Locates the header row within raw rows and derives unique column names from it.
 */
public final class HeaderResolver {
    static final String EMPTY_HEADER_NAME = "col";

    private HeaderResolver() {}

    public static ResolvedHeader resolve(List<List<String>> rows, int skipRows, int headerRow) {
        requireNonNull(rows, "rows is null");
        if (rows.isEmpty()) {
            throw new IngestionException(IngestionErrorCode.EMPTY_INPUT, "No rows found");
        }
        if (skipRows >= rows.size()) {
            throw new IngestionException(IngestionErrorCode.SKIP_ROWS_OUT_OF_RANGE,
                    "skipRows " + skipRows + " exceeds total number of rows " + rows.size());
        }
        int headerAbsoluteIndex = skipRows + headerRow;
        if (headerAbsoluteIndex >= rows.size()) {
            throw new IngestionException(IngestionErrorCode.HEADER_ROW_OUT_OF_RANGE,
                    "headerRow " + headerRow + " is out of range after skipping " + skipRows + " rows");
        }
        List<String> names = uniqueColumnNames(rows.get(headerAbsoluteIndex));
        List<Column> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            columns.add(new Column(names.get(i), i));
        }
        return new ResolvedHeader(columns, headerAbsoluteIndex, headerAbsoluteIndex + 1);
    }

    public static ResolvedHeader resolve(List<List<String>> rows, IngestionConfig config) {
        return resolve(rows, config.skipRows(), config.headerRow());
    }

    /**
     * Trims header cells, names blank ones {@value #EMPTY_HEADER_NAME} and suffixes the k-th repeat of a
     * name with {@code _k}. A suffixed name that is already taken moves on to the next free suffix.
     */
    public static List<String> uniqueColumnNames(List<String> headerCells) {
        Map<String, Integer> seen = new HashMap<>();
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>(headerCells.size());
        for (String cell : headerCells) {
            String trimmed = cell == null ? "" : cell.trim();
            String base = trimmed.isEmpty() ? EMPTY_HEADER_NAME : trimmed;
            int count = seen.getOrDefault(base, 0);
            String name = count == 0 ? base : base + "_" + count;
            while (used.contains(name)) {
                count++;
                name = base + "_" + count;
            }
            seen.put(base, count + 1);
            used.add(name);
            names.add(name);
        }
        return List.copyOf(names);
    }

    /**
     * Rows after the header; a view over {@code rows}.
     */
    public static List<List<String>> dataRows(List<List<String>> rows, ResolvedHeader header) {
        return rows.subList(Math.min(header.dataStartIndex(), rows.size()), rows.size());
    }

    /**
     * Applies the target and feature defaults of {@code config} to the resolved columns.
     */
    public static ColumnSelection selectColumns(ResolvedHeader header, IngestionConfig config) {
        if (header.columns().isEmpty()) {
            throw new IngestionException(IngestionErrorCode.EMPTY_INPUT, "Header row has no columns");
        }
        Column target = config.targetColumn()
                .map(name -> requireColumn(header, name))
                .orElseGet(() -> header.columns().get(header.columns().size() - 1));

        List<Column> features = new ArrayList<>();
        if (config.featureColumns().isEmpty()) {
            for (Column column : header.columns()) {
                if (!column.equals(target)) {
                    features.add(column);
                }
            }
        }
        else {
            for (String name : config.featureColumns()) {
                Column column = requireColumn(header, name);
                if (!column.equals(target) && !features.contains(column)) {
                    features.add(column);
                }
            }
        }
        return new ColumnSelection(target, features);
    }

    private static Column requireColumn(ResolvedHeader header, String name) {
        return header.column(name)
                .orElseThrow(() -> new IngestionException(IngestionErrorCode.UNKNOWN_COLUMN,
                        "Unknown column: " + name + " (available: " + header.columnNames() + ")"));
    }
}
