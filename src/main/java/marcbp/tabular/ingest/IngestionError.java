package marcbp.tabular.ingest;

import static java.util.Objects.requireNonNull;

public record IngestionError(IngestionErrorCode code, String message) {
    public IngestionError {
        code = requireNonNull(code, "code is null");
        message = requireNonNull(message, "message is null");
    }
}
