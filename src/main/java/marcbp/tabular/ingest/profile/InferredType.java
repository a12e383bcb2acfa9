package marcbp.tabular.ingest.profile;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InferredType {
    NUMERIC,
    CATEGORICAL,
    MIXED,
    EMPTY;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
