package marcbp.tabular.ingest.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Preview-window statistics for one column. Informational only; the finalize path never reads them.
 *
 * @param numericFraction numeric valid cells over non-missing cells (placeholders included in the base);
 *                        {@code null} when the column has no non-missing cell
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnStats(
        @JsonProperty("missing") int missing,
        @JsonProperty("placeholderMissing") int placeholderMissing,
        @JsonProperty("examplePlaceholders") List<String> examplePlaceholders,
        @JsonProperty("inferredType") InferredType inferredType,
        @JsonProperty("unique") int unique,
        @JsonProperty("numericFraction") Double numericFraction) {

    public ColumnStats {
        examplePlaceholders = List.copyOf(requireNonNull(examplePlaceholders, "examplePlaceholders is null"));
        inferredType = requireNonNull(inferredType, "inferredType is null");
    }
}
