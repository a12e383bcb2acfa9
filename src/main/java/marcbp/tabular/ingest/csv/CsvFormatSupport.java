package marcbp.tabular.ingest.csv;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;

import java.util.List;

/**
 * CSV-specific utilities shared by the row splitter.
 */
public final class CsvFormatSupport {
    public static final char DEFAULT_DELIMITER = ',';
    static final List<Character> CANDIDATE_DELIMITERS = List.of(',', ';', '\t', '|');

    private CsvFormatSupport() {}

    public static CSVParser buildParser(char delimiter) {
        return new CSVParserBuilder()
                .withSeparator(delimiter)
                .withQuoteChar(ICSVParser.DEFAULT_QUOTE_CHARACTER)
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .build();
    }

    /**
     * Picks the candidate delimiter occurring most often, outside quotes, in the first non-blank line.
     * Ties go to the earlier candidate; text without any candidate falls back to a comma.
     */
    public static char detectDelimiter(String text) {
        String line = firstNonBlankLine(text);
        if (line == null) {
            return DEFAULT_DELIMITER;
        }
        char best = DEFAULT_DELIMITER;
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = countOutsideQuotes(line, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static String firstNonBlankLine(String text) {
        if (text == null) {
            return null;
        }
        for (String line : text.split("\\R", -1)) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return null;
    }

    private static int countOutsideQuotes(String line, char candidate) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            }
            else if (c == candidate && !quoted) {
                count++;
            }
        }
        return count;
    }
}
