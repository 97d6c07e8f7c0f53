package work.lcod.preview.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tk module constants whose value is their lowercase name ({@code tk.LEFT == "left"}).
 * Matching is literal: the last dotted segment of a name, nothing is imported or evaluated.
 */
public final class TkConstants {
    private static final Set<String> KNOWN = Set.of(
        "TOP", "BOTTOM", "LEFT", "RIGHT",
        "X", "Y", "BOTH", "NONE",
        "N", "S", "E", "W", "NE", "NW", "SE", "SW", "NS", "EW", "NSEW", "CENTER",
        "RAISED", "SUNKEN", "FLAT", "RIDGE", "GROOVE", "SOLID",
        "HORIZONTAL", "VERTICAL", "WORD", "CHAR", "END", "INSERT",
        "NORMAL", "DISABLED", "ACTIVE", "HIDDEN"
    );

    private TkConstants() {}

    public static Optional<String> resolve(String source) {
        if (source == null || source.isBlank()) {
            return Optional.empty();
        }
        String trimmed = source.trim();
        int dot = trimmed.lastIndexOf('.');
        String name = dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
        if (!KNOWN.contains(name)) {
            return Optional.empty();
        }
        return Optional.of(name.toLowerCase(Locale.ROOT));
    }
}
