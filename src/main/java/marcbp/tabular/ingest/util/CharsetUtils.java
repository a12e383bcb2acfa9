package marcbp.tabular.ingest.util;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Shared helpers for resolving the configured text encoding.
 */
public final class CharsetUtils {
    private CharsetUtils() {}

    public static Charset resolve(String charsetName) {
        if (charsetName == null) {
            return StandardCharsets.UTF_8;
        }
        String name = charsetName.trim();
        if (name.isEmpty()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported encoding: " + charsetName, e);
        }
    }

    public static long byteLength(String text, Charset charset) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.getBytes(charset).length;
    }
}
