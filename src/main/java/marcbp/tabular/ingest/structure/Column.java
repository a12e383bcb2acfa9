package marcbp.tabular.ingest.structure;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A resolved header column: its deduplicated display name and its position within raw rows.
 */
public record Column(@JsonProperty("name") String name, @JsonProperty("index") int index) {
    public Column {
        name = requireNonNull(name, "name is null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    /**
     * Cell for this column in {@code row}; rows shorter than the header read as empty.
     */
    public String cell(List<String> row) {
        if (row == null || index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value == null ? "" : value;
    }
}
