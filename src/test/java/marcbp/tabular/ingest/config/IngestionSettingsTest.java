package marcbp.tabular.ingest.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IngestionSettingsTest {

    @Test
    void emptyMapYieldsDefaults() {
        assertEquals(IngestionSettings.defaults(), IngestionSettings.from(Map.of()));
    }

    @Test
    void readsTrimmedValues() {
        IngestionSettings settings = IngestionSettings.from(Map.of(
                IngestionSettings.MAX_FILE_BYTES_KEY, " 2048 ",
                IngestionSettings.MAX_COLUMNS_KEY, "12",
                IngestionSettings.MAX_ROWS_KEY, "100",
                IngestionSettings.PREVIEW_LIMIT_KEY, "20",
                IngestionSettings.DELIMITER_KEY, " ; ",
                IngestionSettings.ENCODING_KEY, " ISO-8859-1 "));

        assertEquals(new DatasetLimits(2048, 12, 100), settings.limits());
        assertEquals(20, settings.previewLimit());
        assertEquals(Optional.of(';'), settings.delimiter());
        assertEquals(StandardCharsets.ISO_8859_1, settings.encoding());
    }

    @Test
    void tabDelimiterCanBeWrittenEscapedOrLiteral() {
        assertEquals(Optional.of('\t'), IngestionSettings.from(Map.of(IngestionSettings.DELIMITER_KEY, "\\t")).delimiter());
        assertEquals(Optional.of('\t'), IngestionSettings.from(Map.of(IngestionSettings.DELIMITER_KEY, "\t")).delimiter());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> IngestionSettings.from(Map.of(IngestionSettings.MAX_ROWS_KEY, "many")));
        assertThrows(IllegalArgumentException.class,
                () -> IngestionSettings.from(Map.of(IngestionSettings.DELIMITER_KEY, "::")));
        assertThrows(IllegalArgumentException.class,
                () -> IngestionSettings.from(Map.of(IngestionSettings.PREVIEW_LIMIT_KEY, "0")));
    }

    @Test
    void loadsPropertiesStream() throws IOException {
        String properties = "ingest.limits.max-rows=10\ningest.delimiter=\n";

        IngestionSettings settings = IngestionSettings.load(
                new ByteArrayInputStream(properties.getBytes(StandardCharsets.UTF_8)));

        assertEquals(10, settings.limits().maxRows());
        assertEquals(Optional.empty(), settings.delimiter());
    }

    @Test
    void loadsBundledResource() {
        IngestionSettings settings = IngestionSettings.load();

        assertEquals(DatasetLimits.defaults(), settings.limits());
        assertEquals(IngestionSettings.DEFAULT_PREVIEW_LIMIT, settings.previewLimit());
    }
}
