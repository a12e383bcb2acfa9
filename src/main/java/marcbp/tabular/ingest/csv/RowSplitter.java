package marcbp.tabular.ingest.csv;

import java.util.List;

/**
 * Splits raw delimited text into rows of string cells.
 *
 * <p>Implementations keep row order and never merge or drop rows because of embedded delimiters or
 * quotes. Malformed input is reported as an {@link marcbp.tabular.ingest.IngestionException} with code
 * {@link marcbp.tabular.ingest.IngestionErrorCode#PARSE_ERROR}.
 */
public interface RowSplitter {
    List<List<String>> split(String text);
}
