package marcbp.tabular.ingest;

import io.airlift.log.Logger;
import marcbp.tabular.ingest.config.IngestionConfig;
import marcbp.tabular.ingest.dataset.Dataset;
import marcbp.tabular.ingest.policy.MissingValueStrategy;
import marcbp.tabular.ingest.preview.PreviewResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Operator workflow over one uploaded document: load, adjust the configuration, preview, finalize.
 *
 * <p>Not thread-safe.
 */
public final class IngestionSession {
    private static final Logger LOG = Logger.get(IngestionSession.class);

    private final IngestionPipeline pipeline;

    private IngestionConfig config;
    private String rawText;
    private List<List<String>> rows;
    private long byteSize;
    private PreviewResult preview;
    private IngestionError error;
    private Dataset dataset;
    private boolean columnsInitialized;

    public IngestionSession(IngestionPipeline pipeline) {
        this.pipeline = requireNonNull(pipeline, "pipeline is null");
        this.config = IngestionConfig.defaults(pipeline.getSettings());
    }

    public void loadRawText(String text) {
        requireNonNull(text, "text is null");
        rawText = text;
        dataset = null;
        byteSize = pipeline.byteSize(text);
        try {
            rows = pipeline.split(text);
            error = null;
        }
        catch (IngestionException e) {
            rows = null;
            error = e.toError();
            preview = PreviewResult.failure(error);
            return;
        }
        refreshPreview();
    }

    public void updateConfig(IngestionConfig newConfig) {
        requireNonNull(newConfig, "newConfig is null");
        boolean structural = config.structurallyDiffers(newConfig);
        config = newConfig;
        if (structural) {
            refreshPreview();
        }
    }

    public void setTarget(String column) {
        config = config.withTargetColumn(column);
    }

    /**
     * Adds or removes {@code column} from the features; the target column is left untouched.
     */
    public void toggleFeature(String column) {
        requireNonNull(column, "column is null");
        if (config.targetColumn().filter(column::equals).isPresent()) {
            return;
        }
        List<String> features = new ArrayList<>(config.featureColumns());
        if (!features.remove(column)) {
            features.add(column);
        }
        config = config.withFeatureColumns(features);
    }

    public void setGlobalStrategy(MissingValueStrategy strategy) {
        config = config.withGlobalStrategy(strategy);
    }

    /**
     * Overrides the strategy for one column; {@code null} removes the override.
     */
    public void setColumnStrategy(String column, MissingValueStrategy strategy) {
        config = config.withColumnStrategy(column, strategy);
    }

    public void setColumnConstant(String column, String value) {
        config = config.withColumnStrategy(column, MissingValueStrategy.constant(value));
    }

    public Optional<PreviewResult> preview() {
        return Optional.ofNullable(preview);
    }

    public FinalizeResult finalizeDataset() {
        if (rawText == null) {
            return fail(FinalizeResult.failure(
                    new IngestionError(IngestionErrorCode.NO_INPUT_LOADED, "No input loaded")));
        }
        if (preview != null && preview.hasLimitErrors()) {
            LOG.warn("Refusing to finalize while limits are exceeded: %s", preview.getLimitErrors());
            return fail(FinalizeResult.failure(
                    new IngestionError(IngestionErrorCode.LIMIT_EXCEEDED, "Dataset exceeds configured limits"),
                    preview.getLimitErrors()));
        }
        FinalizeResult result = pipeline.finalizeDataset(rawText, config);
        if (result.isSuccess()) {
            dataset = result.getDataset().orElseThrow();
            error = null;
            return result;
        }
        return fail(result);
    }

    public void reset() {
        config = IngestionConfig.defaults(pipeline.getSettings());
        rawText = null;
        rows = null;
        byteSize = 0;
        preview = null;
        error = null;
        dataset = null;
        columnsInitialized = false;
    }

    public IngestionConfig getConfig() {
        return config;
    }

    public Optional<String> getRawText() {
        return Optional.ofNullable(rawText);
    }

    public Optional<IngestionError> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Dataset> getDataset() {
        return Optional.ofNullable(dataset);
    }

    private FinalizeResult fail(FinalizeResult result) {
        error = result.getError().orElse(null);
        return result;
    }

    private void refreshPreview() {
        if (rows == null) {
            return;
        }
        preview = pipeline.preview(rows, byteSize, config);
        error = preview.getError().orElse(null);
        if (preview.isSuccess() && !columnsInitialized && !preview.getColumns().isEmpty()) {
            initializeColumns(preview.getColumns());
        }
    }

    private void initializeColumns(List<String> columns) {
        String target = config.targetColumn().orElse(columns.get(columns.size() - 1));
        IngestionConfig initialized = config.withTargetColumn(target);
        if (initialized.featureColumns().isEmpty()) {
            List<String> features = new ArrayList<>(columns);
            features.remove(target);
            initialized = initialized.withFeatureColumns(features);
        }
        config = initialized;
        columnsInitialized = true;
        LOG.debug("Default target %s, features %s", target, config.featureColumns());
    }
}
