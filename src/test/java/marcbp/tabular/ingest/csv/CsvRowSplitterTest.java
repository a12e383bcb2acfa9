package marcbp.tabular.ingest.csv;

import marcbp.tabular.ingest.IngestionErrorCode;
import marcbp.tabular.ingest.IngestionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvRowSplitterTest {

    @Test
    void splitsQuotedFieldsWithEmbeddedDelimitersAndNewlines() {
        String text = "name,comment\n\"Smith, J\",\"line one\nline two\"\nDoe,plain\n";

        List<List<String>> rows = new CsvRowSplitter(',').split(text);

        assertEquals(List.of(
                List.of("name", "comment"),
                List.of("Smith, J", "line one\nline two"),
                List.of("Doe", "plain")), rows);
    }

    @Test
    void backslashesAreLiteral() {
        List<List<String>> rows = new CsvRowSplitter(',').split("path,x\nC:\\data,\"a\\,b\"\n");

        assertEquals(List.of(List.of("path", "x"), List.of("C:\\data", "a\\,b")), rows);
    }

    @Test
    void skipsBlankLinesButKeepsEmptyCells() {
        List<List<String>> rows = new CsvRowSplitter(',').split("a,b\n\n1,\n\n,2\n");

        assertEquals(List.of(List.of("a", "b"), List.of("1", ""), List.of("", "2")), rows);
    }

    @Test
    void detectsDelimiterWhenNotConfigured() {
        List<List<String>> rows = new CsvRowSplitter().split("a;b\n1;2");

        assertEquals(List.of(List.of("a", "b"), List.of("1", "2")), rows);
    }

    @Test
    void configuredDelimiterWins() {
        List<List<String>> rows = new CsvRowSplitter(',').split("a;b,c\n");

        assertEquals(List.of(List.of("a;b", "c")), rows);
    }

    @Test
    void emptyTextYieldsNoRows() {
        assertTrue(new CsvRowSplitter().split("").isEmpty());
    }

    @Test
    void unterminatedQuoteIsParseError() {
        IngestionException exception = assertThrows(
                IngestionException.class,
                () -> new CsvRowSplitter(',').split("a,b\n\"open,1\n"));

        assertEquals(IngestionErrorCode.PARSE_ERROR, exception.getErrorCode());
    }
}
