package marcbp.tabular.ingest.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import marcbp.tabular.ingest.IngestionErrorCode;
import marcbp.tabular.ingest.IngestionException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Remediation applied to missing cells of one column.
 *
 * <p>{@link Kind#CONSTANT} carries the literal to substitute; every other kind carries no value.
 * The JSON form is the kind's wire name, or {@code {"type":"constant","value":...}} for constants.
 */
public record MissingValueStrategy(Kind kind, String constantValue) {
    public static final MissingValueStrategy LEAVE_AS_IS = new MissingValueStrategy(Kind.LEAVE_AS_IS, null);
    public static final MissingValueStrategy DROP_ROW = new MissingValueStrategy(Kind.DROP_ROW, null);
    public static final MissingValueStrategy ZERO = new MissingValueStrategy(Kind.ZERO, null);
    public static final MissingValueStrategy MEAN = new MissingValueStrategy(Kind.MEAN, null);
    public static final MissingValueStrategy MEDIAN = new MissingValueStrategy(Kind.MEDIAN, null);
    public static final MissingValueStrategy MODE = new MissingValueStrategy(Kind.MODE, null);

    public MissingValueStrategy {
        kind = requireNonNull(kind, "kind is null");
        if (kind == Kind.CONSTANT) {
            requireNonNull(constantValue, "constantValue is null");
        }
        else if (constantValue != null) {
            throw new IllegalArgumentException("Only constant strategies carry a value: " + kind.wireName());
        }
    }

    public static MissingValueStrategy constant(String value) {
        return new MissingValueStrategy(Kind.CONSTANT, value);
    }

    public static MissingValueStrategy of(Kind kind) {
        return switch (requireNonNull(kind, "kind is null")) {
            case LEAVE_AS_IS -> LEAVE_AS_IS;
            case DROP_ROW -> DROP_ROW;
            case ZERO -> ZERO;
            case MEAN -> MEAN;
            case MEDIAN -> MEDIAN;
            case MODE -> MODE;
            case CONSTANT -> throw new IllegalArgumentException("Constant strategy requires a value");
        };
    }

    public static MissingValueStrategy fromName(String name) {
        Kind kind = Kind.fromWireName(name);
        if (kind == Kind.CONSTANT) {
            throw new IngestionException(IngestionErrorCode.INVALID_STRATEGY, "Constant strategy requires a value");
        }
        return of(kind);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MissingValueStrategy fromJson(JsonNode node) {
        return StrategySpecParser.parseStrategy(node);
    }

    public boolean isDropRow() {
        return kind == Kind.DROP_ROW;
    }

    /**
     * Whether missing cells governed by this strategy receive a replacement value.
     */
    public boolean imputes() {
        return kind != Kind.LEAVE_AS_IS && kind != Kind.DROP_ROW;
    }

    @JsonValue
    public Object toJson() {
        if (kind != Kind.CONSTANT) {
            return kind.wireName();
        }
        Map<String, String> json = new LinkedHashMap<>();
        json.put("type", kind.wireName());
        json.put("value", constantValue);
        return json;
    }

    @Override
    public String toString() {
        return kind == Kind.CONSTANT ? "constant(" + constantValue + ")" : kind.wireName();
    }

    public enum Kind {
        LEAVE_AS_IS("leave-as-is"),
        DROP_ROW("drop-row"),
        ZERO("zero"),
        MEAN("mean"),
        MEDIAN("median"),
        MODE("mode"),
        CONSTANT("constant");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Kind fromWireName(String name) {
            if (name != null) {
                String normalized = name.trim().toLowerCase(Locale.ROOT);
                for (Kind kind : values()) {
                    if (kind.wireName.equals(normalized)) {
                        return kind;
                    }
                }
            }
            throw new IngestionException(IngestionErrorCode.INVALID_STRATEGY, "Unknown missing-value strategy: " + name);
        }
    }
}
