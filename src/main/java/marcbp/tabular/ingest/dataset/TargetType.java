package marcbp.tabular.ingest.dataset;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TargetType {
    CLASSIFICATION,
    REGRESSION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
