package marcbp.tabular.ingest.profile;

import java.util.Locale;
import java.util.Set;

/**
 * Cell classification shared by the preview and finalize paths.
 *
 * <p>Placeholder tokens are non-empty strings that stand for a missing value. Matching trims the cell
 * and ignores case.
 */
public final class PlaceholderTokens {
    public static final Set<String> TOKENS = Set.of(
            "na",
            "n/a",
            "null",
            "none",
            "nil",
            "nan",
            "?",
            "-",
            "missing",
            "unknown",
            ".");

    private PlaceholderTokens() {}

    public static CellClass classify(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return CellClass.MISSING;
        }
        if (TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return CellClass.PLACEHOLDER;
        }
        return CellClass.VALID;
    }

    public static boolean isPlaceholder(String value) {
        return classify(value) == CellClass.PLACEHOLDER;
    }

    /**
     * True for empty cells and placeholder tokens alike.
     */
    public static boolean isMissingOrPlaceholder(String value) {
        return classify(value) != CellClass.VALID;
    }

    /**
     * Rewrites empty and placeholder cells to the empty string; valid cells are returned unchanged.
     */
    public static String normalize(String value) {
        return isMissingOrPlaceholder(value) ? "" : value;
    }
}
