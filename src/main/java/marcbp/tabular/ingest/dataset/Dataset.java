package marcbp.tabular.ingest.dataset;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Finalized, immutable dataset handed to model training.
 *
 * <p>Cell values are either {@link Double} or {@link String}. {@code numClasses} is only present for
 * classification targets.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rows", "features", "target", "targetType", "numSamples", "numFeatures", "numClasses",
        "skipRows", "headerRow", "imputationSummary"})
public record Dataset(
        @JsonProperty("rows") List<Map<String, Object>> rows,
        @JsonProperty("features") List<String> features,
        @JsonProperty("target") String target,
        @JsonProperty("targetType") TargetType targetType,
        @JsonProperty("numClasses") Integer numClasses,
        @JsonProperty("skipRows") int skipRows,
        @JsonProperty("headerRow") int headerRow,
        @JsonProperty("imputationSummary") ImputationSummary imputationSummary) {

    public Dataset {
        requireNonNull(rows, "rows is null");
        rows = rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
        features = List.copyOf(requireNonNull(features, "features is null"));
        requireNonNull(target, "target is null");
        requireNonNull(targetType, "targetType is null");
        requireNonNull(imputationSummary, "imputationSummary is null");
        if (features.contains(target)) {
            throw new IllegalArgumentException("Target column is also a feature: " + target);
        }
        if ((targetType == TargetType.CLASSIFICATION) != (numClasses != null)) {
            throw new IllegalArgumentException("numClasses must be set exactly for classification targets");
        }
    }

    @JsonProperty("numSamples")
    public int numSamples() {
        return rows.size();
    }

    @JsonProperty("numFeatures")
    public int numFeatures() {
        return features.size();
    }

    @JsonIgnore
    public boolean isClassification() {
        return targetType == TargetType.CLASSIFICATION;
    }
}
