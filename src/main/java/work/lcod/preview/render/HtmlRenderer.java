package work.lcod.preview.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import work.lcod.preview.behavior.BehaviorEngine;
import work.lcod.preview.behavior.SizeEstimator;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.WidgetNode;

/**
 * Turns a widget forest into an HTML fragment styled by {@link Stylesheet}.
 *
 * <p>Behaviour rules run first; their warnings are reported alongside conversion errors. Only windows,
 * labels and buttons have a visual form so far: other kinds (and everything beneath them) produce no
 * markup. A fault during conversion never escapes: the caller gets an error fragment and one error entry.
 */
public final class HtmlRenderer {
    private static final String WARNING_PREFIX = "Behavior warning: ";
    private static final Comparator<WidgetNode> GRID_ORDER = Comparator
        .comparingInt((WidgetNode child) -> gridIndex(child, "row"))
        .thenComparingInt(child -> gridIndex(child, "column"));

    private final BehaviorEngine behaviorEngine;

    public HtmlRenderer() {
        this(new BehaviorEngine());
    }

    public HtmlRenderer(BehaviorEngine behaviorEngine) {
        this.behaviorEngine = behaviorEngine;
    }

    public ConversionResult convert(List<WidgetNode> forest) {
        var errors = new ArrayList<String>();
        try {
            var behavior = behaviorEngine.applyBehaviors(forest);
            behavior.warnings().forEach(warning -> errors.add(WARNING_PREFIX + warning));

            var context = new RenderContext();
            String markup = renderForest(behavior.modifiedForest(), context);
            return new ConversionResult(
                markup,
                Stylesheet.defaultStylesheet(),
                !errors.isEmpty(),
                errors,
                behavior.appliedRules(),
                behavior.modifiedForest()
            );
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            errors.add("Conversion error: " + message);
            return new ConversionResult(
                "<div class=\"tkinter-error\">Conversion failed: " + Html.escape(message) + "</div>",
                Stylesheet.defaultStylesheet(),
                true,
                errors,
                List.of(),
                List.of()
            );
        }
    }

    private String renderForest(List<WidgetNode> forest, RenderContext context) {
        if (forest.isEmpty()) {
            return "<div class=\"tkinter-empty\">No Tkinter widgets found</div>";
        }
        var html = new StringBuilder();
        for (var widget : forest) {
            renderWidget(widget, context, html);
        }
        return html.toString();
    }

    private void renderWidget(WidgetNode widget, RenderContext context, StringBuilder html) {
        switch (widget.kind()) {
            case TK, TOPLEVEL -> renderWindow(widget, context.nextId(), context, html);
            case LABEL -> renderLeaf(widget, context.nextId(), "div", "tk-label", html);
            case BUTTON -> renderLeaf(widget, context.nextId(), "button", "tk-button", html);
            default -> {
                // parsed and laid out, not drawn yet
            }
        }
    }

    private void renderWindow(WidgetNode window, String id, RenderContext context, StringBuilder html) {
        String title = window.properties().text("title").orElse("Tk");
        html.append("<div id=\"").append(id).append("\" class=\"tk-window\"");
        appendSourceAttributes(window, html);
        html.append('>');
        html.append("<div class=\"tk-titlebar\">");
        html.append("<div class=\"tk-titlebar-title\">").append(Html.escape(title)).append("</div>");
        html.append("<div class=\"tk-titlebar-buttons\">");
        html.append("<div class=\"tk-titlebar-button\">−</div>");
        html.append("<div class=\"tk-titlebar-button\">□</div>");
        html.append("<div class=\"tk-titlebar-button\">×</div>");
        html.append("</div></div>");

        List<WidgetNode> children = window.children();
        boolean grid = children.stream().anyMatch(child -> child.layoutManager().orElse(null) == LayoutManager.GRID);
        var contentStyle = new ArrayList<String>();
        if (grid) {
            children = new ArrayList<>(children);
            children.sort(GRID_ORDER);
            contentStyle.add("grid-template-columns: repeat(" + Math.max(1, window.hints().gridColumns()) + ", auto)");
            contentStyle.add("grid-template-rows: repeat(" + Math.max(1, window.hints().gridRows()) + ", auto)");
        }
        if (!window.hints().estimatedSize()) {
            int width = window.properties().integer("width").orElse(0);
            int height = window.properties().integer("height").orElse(0);
            if (width > 0) {
                contentStyle.add("min-width: " + width + "px");
            }
            if (height > 0) {
                contentStyle.add("min-height: " + height + "px");
            }
        }
        html.append("<div class=\"").append(grid ? "tk-content tk-grid" : "tk-content").append('"');
        appendStyle(String.join("; ", contentStyle), html);
        html.append('>');
        for (var child : children) {
            renderWidget(child, context, html);
        }
        html.append("</div></div>");
    }

    private void renderLeaf(WidgetNode widget, String id, String tag, String cssClass, StringBuilder html) {
        html.append('<').append(tag).append(" id=\"").append(id).append("\" class=\"").append(cssClass).append('"');
        appendSourceAttributes(widget, html);
        appendStyle(InlineStyle.of(widget), html);
        html.append('>');
        html.append(Html.escape(SizeEstimator.displayText(widget)));
        html.append("</").append(tag).append('>');
    }

    private static void appendSourceAttributes(WidgetNode widget, StringBuilder html) {
        widget.name().ifPresent(name -> html.append(" data-widget-name=\"").append(Html.escape(name)).append('"'));
        if (widget.sourceLine() > 0) {
            html.append(" data-line=\"").append(widget.sourceLine()).append('"');
        }
    }

    private static void appendStyle(String style, StringBuilder html) {
        if (!style.isEmpty()) {
            html.append(" style=\"").append(Html.escape(style)).append('"');
        }
    }

    private static int gridIndex(WidgetNode child, String key) {
        if (child.layoutManager().orElse(null) != LayoutManager.GRID) {
            return Integer.MAX_VALUE;
        }
        return child.layoutOptions().integer(key).orElse(0);
    }
}
