package marcbp.tabular.ingest;

/**
 * Error codes reported by the ingestion pipeline.
 */
public enum IngestionErrorCode {
    EMPTY_INPUT(ErrorType.STRUCTURAL),
    SKIP_ROWS_OUT_OF_RANGE(ErrorType.STRUCTURAL),
    HEADER_ROW_OUT_OF_RANGE(ErrorType.STRUCTURAL),
    NO_DATA_ROWS(ErrorType.STRUCTURAL),
    UNKNOWN_COLUMN(ErrorType.STRUCTURAL),
    LIMIT_EXCEEDED(ErrorType.LIMIT),
    PARSE_ERROR(ErrorType.PARSE),
    INVALID_STRATEGY(ErrorType.USER_ERROR),
    NO_INPUT_LOADED(ErrorType.USER_ERROR);

    private final ErrorType type;

    IngestionErrorCode(ErrorType type) {
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }

    public enum ErrorType {
        STRUCTURAL,
        LIMIT,
        PARSE,
        USER_ERROR
    }
}
