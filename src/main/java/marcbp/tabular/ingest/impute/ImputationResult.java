package marcbp.tabular.ingest.impute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Rows surviving the drop pass with replacements applied, plus the replacement chosen per imputed column.
 */
public record ImputationResult(
        List<Map<String, Object>> rows,
        int originalRowCount,
        Map<String, Object> replacements) {

    public ImputationResult {
        rows = List.copyOf(requireNonNull(rows, "rows is null"));
        replacements = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(replacements, "replacements is null")));
        if (rows.size() > originalRowCount) {
            throw new IllegalArgumentException("Imputation cannot add rows");
        }
    }

    public int droppedRowCount() {
        return originalRowCount - rows.size();
    }
}
