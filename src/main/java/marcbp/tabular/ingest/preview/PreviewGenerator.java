package marcbp.tabular.ingest.preview;

import io.airlift.log.Logger;
import marcbp.tabular.ingest.IngestionException;
import marcbp.tabular.ingest.config.DatasetLimits;
import marcbp.tabular.ingest.config.IngestionConfig;
import marcbp.tabular.ingest.config.LimitViolation;
import marcbp.tabular.ingest.profile.CellClass;
import marcbp.tabular.ingest.profile.ColumnProfiler;
import marcbp.tabular.ingest.profile.ColumnStats;
import marcbp.tabular.ingest.structure.Column;
import marcbp.tabular.ingest.structure.HeaderResolver;
import marcbp.tabular.ingest.structure.ResolvedHeader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link PreviewResult} over already-split rows.
 *
 * <p>The window is the first {@code previewLimit} raw rows, skipped and header rows included; statistics
 * only cover the data rows inside it. Limits are checked against the full row set.
 */
public final class PreviewGenerator {
    private static final Logger LOG = Logger.get(PreviewGenerator.class);

    private final DatasetLimits limits;

    public PreviewGenerator(DatasetLimits limits) {
        this.limits = requireNonNull(limits, "limits is null");
    }

    public PreviewResult generate(List<List<String>> rows, long byteSize, IngestionConfig config) {
        requireNonNull(rows, "rows is null");
        requireNonNull(config, "config is null");
        ResolvedHeader header;
        try {
            header = HeaderResolver.resolve(rows, config);
        }
        catch (IngestionException e) {
            LOG.info("Preview failed: %s", e.getMessage());
            return PreviewResult.failure(e.toError());
        }

        int rawColumnCount = rows.get(header.headerAbsoluteIndex()).size();
        List<LimitViolation> limitErrors = limits.check(rows.size(), rawColumnCount, byteSize);
        if (!limitErrors.isEmpty()) {
            LOG.warn("Input exceeds dataset limits: %s", limitErrors);
        }

        List<Column> columns = header.columns();
        List<List<String>> window = rows.subList(0, Math.min(config.previewLimit(), rows.size()));
        List<Map<String, String>> previewRecords = new ArrayList<>(window.size());
        for (List<String> row : window) {
            Map<String, String> record = new LinkedHashMap<>();
            for (Column column : columns) {
                record.put(column.name(), column.cell(row));
            }
            previewRecords.add(Collections.unmodifiableMap(record));
        }
        List<List<CellClass>> cellFlags = ColumnProfiler.classifyRows(columns, window);
        Map<String, ColumnStats> stats = ColumnProfiler.profile(columns, window, header.dataStartIndex());

        LOG.debug("Preview of %s rows over %s columns (data starts at %s)", window.size(), columns.size(), header.dataStartIndex());
        return PreviewResult.success(
                rows.size(),
                header.headerAbsoluteIndex(),
                header.dataStartIndex(),
                header.columnNames(),
                previewRecords,
                stats,
                cellFlags,
                limitErrors);
    }
}
