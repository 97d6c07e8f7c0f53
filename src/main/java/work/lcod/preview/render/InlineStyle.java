package work.lcod.preview.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.PropertyBag;
import work.lcod.preview.model.PropertyValue;
import work.lcod.preview.model.TkConstants;
import work.lcod.preview.model.WidgetNode;

/**
 * Translates layout options and visual properties of a leaf widget into an inline CSS declaration list.
 */
final class InlineStyle {
    static final int CHAR_WIDTH_PX = 8;
    static final int LINE_HEIGHT_PX = 16;
    private static final Pattern STICKY_LETTERS = Pattern.compile("^[nsewNSEW]*$");
    private static final Pattern SYMBOL_SEPARATORS = Pattern.compile("[^\\w.]+");

    private final List<String> declarations = new ArrayList<>();

    private InlineStyle() {}

    static String of(WidgetNode widget) {
        var style = new InlineStyle();
        var manager = widget.layoutManager().orElse(null);
        if (manager == LayoutManager.PACK) {
            style.padding(widget.layoutOptions());
        } else if (manager == LayoutManager.GRID) {
            style.gridPlacement(widget.layoutOptions());
            style.padding(widget.layoutOptions());
            style.stickiness(widget.layoutOptions());
        }
        style.colors(widget.properties());
        style.size(widget.properties());
        return String.join("; ", style.declarations);
    }

    private void padding(PropertyBag options) {
        sides(options, "padx", "margin-left", "margin-right");
        sides(options, "pady", "margin-top", "margin-bottom");
        sides(options, "ipadx", "padding-left", "padding-right");
        sides(options, "ipady", "padding-top", "padding-bottom");
    }

    private void sides(PropertyBag options, String key, String first, String second) {
        if (!options.has(key)) {
            return;
        }
        var values = options.integers(key).orElse(List.of(0));
        int start = values.get(0);
        int end = values.size() > 1 ? values.get(1) : start;
        add(first, start + "px");
        add(second, end + "px");
    }

    private void gridPlacement(PropertyBag options) {
        int row = Math.max(0, options.integer("row").orElse(0));
        int column = Math.max(0, options.integer("column").orElse(0));
        int rowSpan = Math.max(1, options.integer("rowspan").orElse(1));
        int columnSpan = Math.max(1, options.integer("columnspan").orElse(1));
        add("grid-row", (row + 1) + " / span " + rowSpan);
        add("grid-column", (column + 1) + " / span " + columnSpan);
    }

    private void stickiness(PropertyBag options) {
        var alignment = Alignment.fromSticky(options.get("sticky").orElse(null));
        add("justify-self", alignment.horizontal());
        add("align-self", alignment.vertical());
    }

    private void colors(PropertyBag properties) {
        first(properties, "bg", "background").ifPresent(color -> add("background-color", color));
        first(properties, "fg", "foreground").ifPresent(color -> add("color", color));
    }

    private void size(PropertyBag properties) {
        int width = properties.integer("width").orElse(0);
        if (width > 0) {
            add("width", (width * CHAR_WIDTH_PX) + "px");
        }
        int height = properties.integer("height").orElse(0);
        if (height > 0) {
            add("height", (height * LINE_HEIGHT_PX) + "px");
        }
    }

    private static Optional<String> first(PropertyBag properties, String shortKey, String longKey) {
        var value = properties.text(shortKey);
        return value.isPresent() ? value : properties.text(longKey);
    }

    private void add(String property, String value) {
        declarations.add(property + ": " + value);
    }

    /**
     * Per-axis placement of a grid child inside its cell. Both opposite edges stretch, a single edge aligns
     * to it, no edge aligns to the start (top-left).
     */
    record Alignment(String horizontal, String vertical) {
        static Alignment fromSticky(PropertyValue sticky) {
            String edges = edges(sticky);
            return new Alignment(
                axis(edges.indexOf('w') >= 0, edges.indexOf('e') >= 0),
                axis(edges.indexOf('n') >= 0, edges.indexOf('s') >= 0)
            );
        }

        private static String axis(boolean startEdge, boolean endEdge) {
            if (startEdge && endEdge) {
                return "stretch";
            }
            if (endEdge) {
                return "end";
            }
            return "start";
        }

        // "nsew", tk.N+tk.S, (E, W) and NSEW all reduce to a set of edge letters
        private static String edges(PropertyValue sticky) {
            if (sticky instanceof PropertyValue.Text text) {
                return STICKY_LETTERS.matcher(text.value()).matches() ? text.value().toLowerCase(Locale.ROOT) : "";
            }
            if (sticky instanceof PropertyValue.Symbol symbol) {
                var letters = new StringBuilder();
                for (String token : SYMBOL_SEPARATORS.split(symbol.source())) {
                    TkConstants.resolve(token)
                        .filter(keyword -> STICKY_LETTERS.matcher(keyword).matches())
                        .ifPresent(letters::append);
                }
                return letters.toString();
            }
            return "";
        }
    }
}
