package marcbp.tabular.ingest.preview;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import marcbp.tabular.ingest.IngestionError;
import marcbp.tabular.ingest.config.LimitViolation;
import marcbp.tabular.ingest.profile.CellClass;
import marcbp.tabular.ingest.profile.ColumnStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Structural preview handed to interactive display code.
 *
 * <p>A failed preview carries only the error. A successful one may still carry limit violations, in which
 * case the data can be inspected but not finalized.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"success", "error", "rawRowCount", "headerAbsoluteIndex", "dataStartIndex", "columns",
        "previewRecords", "stats", "cellFlags", "limitErrors"})
public final class PreviewResult {
    private final boolean success;
    private final IngestionError error;
    private final Integer rawRowCount;
    private final Integer headerAbsoluteIndex;
    private final Integer dataStartIndex;
    private final List<String> columns;
    private final List<Map<String, String>> previewRecords;
    private final Map<String, ColumnStats> stats;
    private final List<List<CellClass>> cellFlags;
    private final List<LimitViolation> limitErrors;

    private PreviewResult(boolean success,
                          IngestionError error,
                          Integer rawRowCount,
                          Integer headerAbsoluteIndex,
                          Integer dataStartIndex,
                          List<String> columns,
                          List<Map<String, String>> previewRecords,
                          Map<String, ColumnStats> stats,
                          List<List<CellClass>> cellFlags,
                          List<LimitViolation> limitErrors) {
        this.success = success;
        this.error = error;
        this.rawRowCount = rawRowCount;
        this.headerAbsoluteIndex = headerAbsoluteIndex;
        this.dataStartIndex = dataStartIndex;
        this.columns = columns;
        this.previewRecords = previewRecords;
        this.stats = stats;
        this.cellFlags = cellFlags;
        this.limitErrors = limitErrors;
    }

    public static PreviewResult success(int rawRowCount,
                                        int headerAbsoluteIndex,
                                        int dataStartIndex,
                                        List<String> columns,
                                        List<Map<String, String>> previewRecords,
                                        Map<String, ColumnStats> stats,
                                        List<List<CellClass>> cellFlags,
                                        List<LimitViolation> limitErrors) {
        return new PreviewResult(
                true,
                null,
                rawRowCount,
                headerAbsoluteIndex,
                dataStartIndex,
                List.copyOf(requireNonNull(columns, "columns is null")),
                List.copyOf(requireNonNull(previewRecords, "previewRecords is null")),
                Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(stats, "stats is null"))),
                List.copyOf(requireNonNull(cellFlags, "cellFlags is null")),
                requireNonNull(limitErrors, "limitErrors is null").isEmpty() ? null : List.copyOf(limitErrors));
    }

    public static PreviewResult failure(IngestionError error) {
        return new PreviewResult(false, requireNonNull(error, "error is null"), null, null, null, null, null, null, null, null);
    }

    @JsonProperty
    public boolean isSuccess() {
        return success;
    }

    @JsonIgnore
    public Optional<IngestionError> getError() {
        return Optional.ofNullable(error);
    }

    @JsonProperty("error")
    private IngestionError errorOrNull() {
        return error;
    }

    @JsonProperty
    public Integer getRawRowCount() {
        return rawRowCount;
    }

    @JsonProperty
    public Integer getHeaderAbsoluteIndex() {
        return headerAbsoluteIndex;
    }

    @JsonProperty
    public Integer getDataStartIndex() {
        return dataStartIndex;
    }

    @JsonProperty
    public List<String> getColumns() {
        return columns == null ? List.of() : columns;
    }

    @JsonProperty
    public List<Map<String, String>> getPreviewRecords() {
        return previewRecords == null ? List.of() : previewRecords;
    }

    @JsonProperty
    public Map<String, ColumnStats> getStats() {
        return stats == null ? Map.of() : stats;
    }

    @JsonProperty
    public List<List<CellClass>> getCellFlags() {
        return cellFlags == null ? List.of() : cellFlags;
    }

    @JsonProperty
    public List<LimitViolation> getLimitErrors() {
        return limitErrors == null ? List.of() : limitErrors;
    }

    public boolean hasLimitErrors() {
        return limitErrors != null && !limitErrors.isEmpty();
    }

    @Override
    public String toString() {
        if (!success) {
            return "PreviewResult{error=" + error + '}';
        }
        return "PreviewResult{" +
                "rawRowCount=" + rawRowCount +
                ", headerAbsoluteIndex=" + headerAbsoluteIndex +
                ", dataStartIndex=" + dataStartIndex +
                ", columns=" + columns +
                ", previewRows=" + previewRecords.size() +
                ", limitErrors=" + getLimitErrors() +
                '}';
    }
}
