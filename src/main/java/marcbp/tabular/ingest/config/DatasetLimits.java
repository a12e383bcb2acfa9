package marcbp.tabular.ingest.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Upper bounds a dataset must respect before it can be finalized.
 */
public record DatasetLimits(long maxFileBytes, int maxColumns, int maxRows) {
    public static final long DEFAULT_MAX_FILE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_COLUMNS = 500;
    public static final int DEFAULT_MAX_ROWS = 500_000;

    public DatasetLimits {
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive");
        }
        if (maxColumns <= 0) {
            throw new IllegalArgumentException("maxColumns must be positive");
        }
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
    }

    public static DatasetLimits defaults() {
        return new DatasetLimits(DEFAULT_MAX_FILE_BYTES, DEFAULT_MAX_COLUMNS, DEFAULT_MAX_ROWS);
    }

    /**
     * Returns every exceeded limit, in row, column, byte order; empty when the input fits.
     */
    public List<LimitViolation> check(int rowCount, int columnCount, long byteSize) {
        List<LimitViolation> violations = new ArrayList<>();
        if (rowCount > maxRows) {
            violations.add(new LimitViolation(
                    LimitViolation.Limit.MAX_ROWS,
                    String.format(Locale.ROOT, "Row count %,d exceeds maximum %,d", rowCount, maxRows)));
        }
        if (columnCount > maxColumns) {
            violations.add(new LimitViolation(
                    LimitViolation.Limit.MAX_COLUMNS,
                    String.format(Locale.ROOT, "Column count %d exceeds maximum %d", columnCount, maxColumns)));
        }
        if (byteSize > maxFileBytes) {
            violations.add(new LimitViolation(
                    LimitViolation.Limit.MAX_FILE_BYTES,
                    String.format(Locale.ROOT, "File size %.2fMB exceeds limit %.0fMB",
                            byteSize / 1024.0 / 1024.0, maxFileBytes / 1024.0 / 1024.0)));
        }
        return List.copyOf(violations);
    }
}
