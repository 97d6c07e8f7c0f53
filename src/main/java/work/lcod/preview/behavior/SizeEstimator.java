package work.lcod.preview.behavior;

import java.util.OptionalInt;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.WidgetKind;
import work.lcod.preview.model.WidgetNode;

/**
 * Pixel size heuristics for widgets whose source gives no explicit size.
 */
public final class SizeEstimator {
    static final int CHAR_WIDTH = 8;
    static final int MIN_TEXT_WIDTH = 50;
    static final int TEXT_LINE_HEIGHT = 25;
    static final int FALLBACK_WIDTH = 100;
    static final int FALLBACK_HEIGHT = 25;
    static final int EMPTY_WINDOW_WIDTH = 200;
    static final int EMPTY_WINDOW_HEIGHT = 100;
    static final int WINDOW_PAD_X = 40;
    static final int WINDOW_PAD_Y = 60;
    static final int MIN_WINDOW_WIDTH = 200;
    static final int MIN_WINDOW_HEIGHT = 150;

    private SizeEstimator() {}

    public record Size(int width, int height) {
        @Override
        public String toString() {
            return width + "x" + height;
        }
    }

    /** Text a label or button shows; buttons without text read "Button". */
    public static String displayText(WidgetNode widget) {
        return widget.properties().text("text")
            .orElse(widget.kind() == WidgetKind.BUTTON ? "Button" : "");
    }

    /**
     * Kind default width, or empty for kinds without one.
     */
    public static OptionalInt defaultWidth(WidgetNode widget) {
        return switch (widget.kind()) {
            case LABEL, BUTTON -> OptionalInt.of(Math.max(displayText(widget).length() * CHAR_WIDTH, MIN_TEXT_WIDTH));
            case ENTRY -> OptionalInt.of(200);
            case TEXT -> OptionalInt.of(300);
            case LISTBOX -> OptionalInt.of(150);
            default -> OptionalInt.empty();
        };
    }

    public static OptionalInt defaultHeight(WidgetNode widget) {
        return switch (widget.kind()) {
            case LABEL, BUTTON, ENTRY -> OptionalInt.of(TEXT_LINE_HEIGHT);
            case TEXT -> OptionalInt.of(200);
            case LISTBOX -> OptionalInt.of(80);
            default -> OptionalInt.empty();
        };
    }

    public static int width(WidgetNode widget) {
        if (widget.properties().isSet("width")) {
            return widget.properties().integer("width").orElse(0);
        }
        return defaultWidth(widget).orElse(FALLBACK_WIDTH);
    }

    public static int height(WidgetNode widget) {
        if (widget.properties().isSet("height")) {
            return widget.properties().integer("height").orElse(0);
        }
        return defaultHeight(widget).orElse(FALLBACK_HEIGHT);
    }

    /**
     * Size of a window from its immediate children. Vertically packed children stack their heights,
     * horizontally packed ones their widths; anything else only widens the running maximum.
     */
    public static Size estimateWindow(WidgetNode window) {
        if (!window.hasChildren()) {
            return new Size(EMPTY_WINDOW_WIDTH, EMPTY_WINDOW_HEIGHT);
        }
        int width = 0;
        int height = 0;
        for (var child : window.children()) {
            int childWidth = width(child);
            int childHeight = height(child);
            if (child.layoutManager().orElse(null) == LayoutManager.PACK) {
                String side = child.layoutOptions().keyword("side").orElse("top");
                if (side.equals("left") || side.equals("right")) {
                    width += childWidth;
                    height = Math.max(height, childHeight);
                } else {
                    height += childHeight;
                    width = Math.max(width, childWidth);
                }
            } else {
                width = Math.max(width, childWidth);
                height = Math.max(height, childHeight);
            }
        }
        return new Size(
            Math.max(width + WINDOW_PAD_X, MIN_WINDOW_WIDTH),
            Math.max(height + WINDOW_PAD_Y, MIN_WINDOW_HEIGHT)
        );
    }
}
