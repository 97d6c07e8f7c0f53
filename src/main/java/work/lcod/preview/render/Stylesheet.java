package work.lcod.preview.render;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The fixed stylesheet that gives rendered widgets their classic Tk look.
 */
public final class Stylesheet {
    private static final String RESOURCE = "preview.css";
    private static final String DEFAULT = load();

    private Stylesheet() {}

    public static String defaultStylesheet() {
        return DEFAULT;
    }

    private static String load() {
        try (InputStream in = Stylesheet.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Stylesheet resource missing (" + RESOURCE + ")");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read stylesheet resource " + RESOURCE, ex);
        }
    }
}
