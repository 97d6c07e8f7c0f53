package work.lcod.preview.api;

import java.util.Locale;

/**
 * What a preview run emits.
 */
public enum OutputFormat {
    /** Standalone HTML document with error and optional debug panels. */
    HTML,
    /** Full result as JSON. */
    JSON,
    /** Full result as YAML. */
    YAML,
    /** Bare markup fragment, no stylesheet. */
    MARKUP;

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return HTML;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value + " (html|json|yaml|markup)");
        }
    }
}
