package marcbp.tabular.ingest.config;

import io.airlift.log.Logger;
import marcbp.tabular.ingest.util.CharsetUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * Deployment-level settings shared by every ingestion session.
 */
public record IngestionSettings(
        DatasetLimits limits,
        int previewLimit,
        Optional<Character> delimiter,
        Charset encoding) {
    private static final Logger LOG = Logger.get(IngestionSettings.class);

    public static final String RESOURCE_NAME = "ingestion.properties";

    public static final String MAX_FILE_BYTES_KEY = "ingest.limits.max-file-bytes";
    public static final String MAX_COLUMNS_KEY = "ingest.limits.max-columns";
    public static final String MAX_ROWS_KEY = "ingest.limits.max-rows";
    public static final String PREVIEW_LIMIT_KEY = "ingest.preview-limit";
    public static final String DELIMITER_KEY = "ingest.delimiter";
    public static final String ENCODING_KEY = "ingest.encoding";

    public static final int DEFAULT_PREVIEW_LIMIT = 50;

    public IngestionSettings {
        limits = requireNonNull(limits, "limits is null");
        delimiter = requireNonNull(delimiter, "delimiter is null");
        encoding = requireNonNull(encoding, "encoding is null");
        if (previewLimit <= 0) {
            throw new IllegalArgumentException("previewLimit must be positive");
        }
    }

    public static IngestionSettings from(Map<String, String> config) {
        requireNonNull(config, "config is null");
        DatasetLimits limits = new DatasetLimits(
                optionalValue(config.get(MAX_FILE_BYTES_KEY)).map(value -> parseLong(MAX_FILE_BYTES_KEY, value))
                        .orElse(DatasetLimits.DEFAULT_MAX_FILE_BYTES),
                optionalValue(config.get(MAX_COLUMNS_KEY)).map(value -> parseInt(MAX_COLUMNS_KEY, value))
                        .orElse(DatasetLimits.DEFAULT_MAX_COLUMNS),
                optionalValue(config.get(MAX_ROWS_KEY)).map(value -> parseInt(MAX_ROWS_KEY, value))
                        .orElse(DatasetLimits.DEFAULT_MAX_ROWS));
        int previewLimit = optionalValue(config.get(PREVIEW_LIMIT_KEY)).map(value -> parseInt(PREVIEW_LIMIT_KEY, value))
                .orElse(DEFAULT_PREVIEW_LIMIT);
        Optional<Character> delimiter = delimiterValue(config.get(DELIMITER_KEY));
        Charset encoding = CharsetUtils.resolve(config.get(ENCODING_KEY));
        return new IngestionSettings(limits, previewLimit, delimiter, encoding);
    }

    public static IngestionSettings defaults() {
        return new IngestionSettings(DatasetLimits.defaults(), DEFAULT_PREVIEW_LIMIT, Optional.empty(), StandardCharsets.UTF_8);
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath, falling back to defaults when it is absent.
     */
    public static IngestionSettings load() {
        try (InputStream input = IngestionSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (input == null) {
                LOG.info("No %s on classpath; using default ingestion settings", RESOURCE_NAME);
                return defaults();
            }
            return load(input);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    public static IngestionSettings load(InputStream input) throws IOException {
        Properties properties = new Properties();
        properties.load(input);
        Map<String, String> config = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            config.put(name, properties.getProperty(name));
        }
        IngestionSettings settings = from(config);
        LOG.info("Loaded ingestion settings: %s", settings);
        return settings;
    }

    private static Optional<Character> delimiterValue(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        // a lone tab or space would be lost to trimming
        if (value.length() == 1) {
            return Optional.of(value.charAt(0));
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (trimmed.equals("\\t")) {
            return Optional.of('\t');
        }
        if (trimmed.length() != 1) {
            throw new IllegalArgumentException(DELIMITER_KEY + " must be a single character: " + value);
        }
        return Optional.of(trimmed.charAt(0));
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static Optional<String> optionalValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }
}
