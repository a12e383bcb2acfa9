package marcbp.tabular.ingest.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Objects.requireNonNull;

/**
 * A dataset-size limit that the input exceeds.
 */
public record LimitViolation(@JsonProperty("limit") Limit limit, @JsonProperty("message") String message) {
    public LimitViolation {
        limit = requireNonNull(limit, "limit is null");
        message = requireNonNull(message, "message is null");
    }

    public enum Limit {
        MAX_FILE_BYTES("maxFileBytes"),
        MAX_COLUMNS("maxColumns"),
        MAX_ROWS("maxRows");

        private final String key;

        Limit(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }
    }
}
