package marcbp.tabular.ingest;

import io.airlift.log.Logger;
import marcbp.tabular.ingest.config.IngestionConfig;
import marcbp.tabular.ingest.config.IngestionSettings;
import marcbp.tabular.ingest.config.LimitViolation;
import marcbp.tabular.ingest.csv.CsvRowSplitter;
import marcbp.tabular.ingest.csv.RowSplitter;
import marcbp.tabular.ingest.dataset.Dataset;
import marcbp.tabular.ingest.dataset.DatasetFinalizer;
import marcbp.tabular.ingest.impute.ImputationEngine;
import marcbp.tabular.ingest.impute.ImputationResult;
import marcbp.tabular.ingest.policy.ImputationPolicy;
import marcbp.tabular.ingest.policy.PolicyResolver;
import marcbp.tabular.ingest.preview.PreviewGenerator;
import marcbp.tabular.ingest.preview.PreviewResult;
import marcbp.tabular.ingest.structure.ColumnSelection;
import marcbp.tabular.ingest.structure.HeaderResolver;
import marcbp.tabular.ingest.structure.ResolvedHeader;
import marcbp.tabular.ingest.util.CharsetUtils;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Entry point wiring the splitter, preview and finalize stages together.
 *
 * <p>Structural, limit and parse failures come back inside {@link PreviewResult} and {@link FinalizeResult}
 * instead of being thrown.
 */
public final class IngestionPipeline {
    private static final Logger LOG = Logger.get(IngestionPipeline.class);

    private final RowSplitter splitter;
    private final IngestionSettings settings;
    private final PreviewGenerator previewGenerator;

    public IngestionPipeline() {
        this(IngestionSettings.load());
    }

    public IngestionPipeline(IngestionSettings settings) {
        this(new CsvRowSplitter(settings.delimiter()), settings);
    }

    public IngestionPipeline(RowSplitter splitter, IngestionSettings settings) {
        this.splitter = requireNonNull(splitter, "splitter is null");
        this.settings = requireNonNull(settings, "settings is null");
        this.previewGenerator = new PreviewGenerator(settings.limits());
    }

    public IngestionSettings getSettings() {
        return settings;
    }

    /**
     * Splits the whole document; parse failures are thrown.
     */
    public List<List<String>> split(String text) {
        return splitter.split(requireNonNull(text, "text is null"));
    }

    public long byteSize(String text) {
        return CharsetUtils.byteLength(text, settings.encoding());
    }

    public PreviewResult preview(String text, IngestionConfig config) {
        requireNonNull(text, "text is null");
        List<List<String>> rows;
        try {
            rows = split(text);
        }
        catch (IngestionException e) {
            return PreviewResult.failure(e.toError());
        }
        return preview(rows, byteSize(text), config);
    }

    public PreviewResult preview(List<List<String>> rows, long byteSize, IngestionConfig config) {
        PreviewResult result = previewGenerator.generate(rows, byteSize, config);
        if (result.isSuccess()) {
            LOG.info("Generated preview: %s", result);
        }
        return result;
    }

    /**
     * Re-splits {@code text} in full and runs policy resolution, imputation and finalization over every row.
     */
    public FinalizeResult finalizeDataset(String text, IngestionConfig config) {
        requireNonNull(text, "text is null");
        requireNonNull(config, "config is null");
        try {
            List<List<String>> rows = split(text);
            ResolvedHeader header = HeaderResolver.resolve(rows, config);

            int rawColumnCount = rows.get(header.headerAbsoluteIndex()).size();
            List<LimitViolation> violations = settings.limits().check(rows.size(), rawColumnCount, byteSize(text));
            if (!violations.isEmpty()) {
                LOG.warn("Refusing to finalize: %s", violations);
                String message = violations.stream().map(LimitViolation::message).collect(Collectors.joining("; "));
                return FinalizeResult.failure(new IngestionError(IngestionErrorCode.LIMIT_EXCEEDED, message), violations);
            }

            List<List<String>> dataRows = HeaderResolver.dataRows(rows, header);
            if (dataRows.isEmpty()) {
                throw new IngestionException(IngestionErrorCode.NO_DATA_ROWS,
                        "No data rows after header row " + header.headerAbsoluteIndex());
            }
            ColumnSelection selection = HeaderResolver.selectColumns(header, config);
            ImputationPolicy policy = PolicyResolver.resolve(
                    selection.featureNames(), Optional.of(selection.target().name()), config);
            ImputationResult imputed = ImputationEngine.impute(dataRows, selection, policy);
            Dataset dataset = DatasetFinalizer.finalizeDataset(imputed, selection, policy, config);
            return FinalizeResult.success(dataset);
        }
        catch (IngestionException e) {
            LOG.warn("Finalize failed (%s): %s", e.getErrorCode(), e.getMessage());
            return FinalizeResult.failure(e.toError());
        }
    }
}
