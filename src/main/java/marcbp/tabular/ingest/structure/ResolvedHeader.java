package marcbp.tabular.ingest.structure;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Header layout derived from the raw rows: the columns and where the data region starts.
 */
public record ResolvedHeader(List<Column> columns, int headerAbsoluteIndex, int dataStartIndex) {
    public ResolvedHeader {
        columns = List.copyOf(requireNonNull(columns, "columns is null"));
        if (dataStartIndex != headerAbsoluteIndex + 1) {
            throw new IllegalArgumentException("Data must start right after the header row");
        }
    }

    public List<String> columnNames() {
        return columns.stream()
                .map(Column::name)
                .toList();
    }

    public Optional<Column> column(String name) {
        return columns.stream()
                .filter(column -> column.name().equals(name))
                .findFirst();
    }
}
