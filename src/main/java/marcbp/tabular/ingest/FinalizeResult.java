package marcbp.tabular.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import marcbp.tabular.ingest.config.LimitViolation;
import marcbp.tabular.ingest.dataset.Dataset;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a finalize request: either a dataset or the error that prevented it.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"success", "error", "limitErrors", "dataset"})
public final class FinalizeResult {
    private final Dataset dataset;
    private final IngestionError error;
    private final List<LimitViolation> limitErrors;

    private FinalizeResult(Dataset dataset, IngestionError error, List<LimitViolation> limitErrors) {
        this.dataset = dataset;
        this.error = error;
        this.limitErrors = limitErrors;
    }

    public static FinalizeResult success(Dataset dataset) {
        return new FinalizeResult(requireNonNull(dataset, "dataset is null"), null, List.of());
    }

    public static FinalizeResult failure(IngestionError error) {
        return failure(error, List.of());
    }

    public static FinalizeResult failure(IngestionError error, List<LimitViolation> limitErrors) {
        return new FinalizeResult(
                null,
                requireNonNull(error, "error is null"),
                List.copyOf(requireNonNull(limitErrors, "limitErrors is null")));
    }

    @JsonProperty
    public boolean isSuccess() {
        return dataset != null;
    }

    @JsonIgnore
    public Optional<Dataset> getDataset() {
        return Optional.ofNullable(dataset);
    }

    @JsonIgnore
    public Optional<IngestionError> getError() {
        return Optional.ofNullable(error);
    }

    @JsonProperty
    public List<LimitViolation> getLimitErrors() {
        return limitErrors;
    }

    @JsonProperty("dataset")
    private Dataset datasetOrNull() {
        return dataset;
    }

    @JsonProperty("error")
    private IngestionError errorOrNull() {
        return error;
    }

    @Override
    public String toString() {
        if (dataset != null) {
            return "FinalizeResult{samples=" + dataset.numSamples() + ", target=" + dataset.target() + '}';
        }
        return "FinalizeResult{error=" + error + ", limitErrors=" + limitErrors + '}';
    }
}
