package marcbp.tabular.ingest.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetLimitsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        DatasetLimits limits = DatasetLimits.defaults();
        assertEquals(10L * 1024 * 1024, limits.maxFileBytes());
        assertEquals(500, limits.maxColumns());
        assertEquals(500_000, limits.maxRows());
    }

    @Test
    void inputWithinLimitsHasNoViolations() {
        DatasetLimits limits = new DatasetLimits(100, 3, 10);
        assertTrue(limits.check(10, 3, 100).isEmpty());
    }

    @Test
    void reportsEveryExceededLimit() {
        DatasetLimits limits = new DatasetLimits(1024 * 1024, 2, 5);

        List<LimitViolation> violations = limits.check(6, 3, 2L * 1024 * 1024);

        assertEquals(3, violations.size());
        assertEquals(LimitViolation.Limit.MAX_ROWS, violations.get(0).limit());
        assertEquals("Row count 6 exceeds maximum 5", violations.get(0).message());
        assertEquals(LimitViolation.Limit.MAX_COLUMNS, violations.get(1).limit());
        assertEquals("Column count 3 exceeds maximum 2", violations.get(1).message());
        assertEquals(LimitViolation.Limit.MAX_FILE_BYTES, violations.get(2).limit());
        assertEquals("File size 2.00MB exceeds limit 1MB", violations.get(2).message());
    }

    @Test
    void limitsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new DatasetLimits(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new DatasetLimits(1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new DatasetLimits(1, 1, -1));
    }
}
