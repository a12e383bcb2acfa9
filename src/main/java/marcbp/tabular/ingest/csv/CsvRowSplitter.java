package marcbp.tabular.ingest.csv;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import io.airlift.log.Logger;
import marcbp.tabular.ingest.IngestionErrorCode;
import marcbp.tabular.ingest.IngestionException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * opencsv-backed {@link RowSplitter} that always reads the whole document.
 *
 * <p>Quoted fields may contain the delimiter and line breaks. Blank lines are skipped. When no delimiter
 * is configured it is detected from the first line.
 */
public final class CsvRowSplitter implements RowSplitter {
    private static final Logger LOG = Logger.get(CsvRowSplitter.class);

    private final Optional<Character> delimiter;

    public CsvRowSplitter() {
        this(Optional.empty());
    }

    public CsvRowSplitter(char delimiter) {
        this(Optional.of(delimiter));
    }

    public CsvRowSplitter(Optional<Character> delimiter) {
        this.delimiter = requireNonNull(delimiter, "delimiter is null");
    }

    @Override
    public List<List<String>> split(String text) {
        requireNonNull(text, "text is null");
        char separator = delimiter.orElseGet(() -> CsvFormatSupport.detectDelimiter(text));
        LOG.debug("Splitting %s chars with delimiter '%s'", text.length(), separator);

        List<List<String>> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(CsvFormatSupport.buildParser(separator))
                .build()) {
            String[] cells;
            while ((cells = reader.readNext()) != null) {
                if (isBlankLine(cells)) {
                    continue;
                }
                rows.add(toRow(cells));
            }
        }
        catch (IOException | CsvValidationException e) {
            LOG.error(e, "Failed to split delimited text after %s rows", rows.size());
            throw new IngestionException(IngestionErrorCode.PARSE_ERROR,
                    "CSV parsing error after row " + rows.size() + ": " + e.getMessage(), e);
        }
        return List.copyOf(rows);
    }

    private static List<String> toRow(String[] cells) {
        List<String> row = new ArrayList<>(cells.length);
        for (String cell : cells) {
            row.add(cell == null ? "" : cell);
        }
        return List.copyOf(row);
    }

    private static boolean isBlankLine(String[] cells) {
        return cells.length == 0 || (cells.length == 1 && (cells[0] == null || cells[0].isEmpty()));
    }
}
