package marcbp.tabular.ingest.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import marcbp.tabular.ingest.impute.ImputationResult;
import marcbp.tabular.ingest.policy.ImputationPolicy;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * How many rows the drop pass removed and which settings caused it.
 */
public record ImputationSummary(
        @JsonProperty("originalRowCount") int originalRowCount,
        @JsonProperty("droppedRowCount") int droppedRowCount,
        @JsonProperty("dropApplied") boolean dropApplied,
        @JsonProperty("dropColumns") List<String> dropColumns,
        @JsonProperty("globalDrop") boolean globalDrop,
        @JsonProperty("targetDrop") boolean targetDrop) {

    public ImputationSummary {
        dropColumns = List.copyOf(requireNonNull(dropColumns, "dropColumns is null"));
        if (droppedRowCount < 0 || droppedRowCount > originalRowCount) {
            throw new IllegalArgumentException("droppedRowCount out of range: " + droppedRowCount);
        }
    }

    public static ImputationSummary of(ImputationResult result, ImputationPolicy policy) {
        return new ImputationSummary(
                result.originalRowCount(),
                result.droppedRowCount(),
                policy.dropApplied(),
                policy.dropColumns(),
                policy.globalDrop(),
                policy.targetDrop());
    }
}
