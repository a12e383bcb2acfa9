package marcbp.tabular.ingest;

import static java.util.Objects.requireNonNull;

/**
 * Raised by the pipeline internals; converted to an {@link IngestionError} at the facade boundary.
 */
public class IngestionException extends RuntimeException {
    private final IngestionErrorCode errorCode;

    public IngestionException(IngestionErrorCode errorCode, String message) {
        super(message);
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
    }

    public IngestionException(IngestionErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
    }

    public IngestionErrorCode getErrorCode() {
        return errorCode;
    }

    public IngestionError toError() {
        return new IngestionError(errorCode, getMessage());
    }
}
