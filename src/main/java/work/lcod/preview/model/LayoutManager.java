package work.lcod.preview.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Geometry managers a widget can be handed to.
 */
public enum LayoutManager {
    PACK,
    GRID,
    PLACE;

    public String methodName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LayoutManager> fromMethod(String method) {
        if (method == null) {
            return Optional.empty();
        }
        return switch (method) {
            case "pack" -> Optional.of(PACK);
            case "grid" -> Optional.of(GRID);
            case "place" -> Optional.of(PLACE);
            default -> Optional.empty();
        };
    }
}
