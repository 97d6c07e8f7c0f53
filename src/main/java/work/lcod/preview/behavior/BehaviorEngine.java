package work.lcod.preview.behavior;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.PropertyBag;
import work.lcod.preview.model.PropertyValue;
import work.lcod.preview.model.WidgetKind;
import work.lcod.preview.model.WidgetNode;

/**
 * Emulates what Tk's geometry managers and widget classes would do at runtime: default sizes, titles,
 * borders, implicit packing and option normalisation. Works on a deep copy; the input forest is never
 * touched.
 *
 * <p>Rules run as separate passes over the whole forest in a fixed order. Values already present are never
 * overwritten, so applying the engine to its own output changes nothing.
 */
public final class BehaviorEngine {
    private static final Set<String> PACK_SIDES = Set.of("top", "bottom", "left", "right");
    private static final Set<String> PACK_FILLS = Set.of("none", "x", "y", "both");
    private static final int LABEL_FRAME_BORDER = 2;
    private static final int FRAME_PADDING = 5;

    public BehaviorResult applyBehaviors(List<WidgetNode> forest) {
        var copy = WidgetNode.deepCopy(forest == null ? List.of() : forest);
        var pass = new Pass();

        walk(copy, pass::applyWindowDefaults);
        walk(copy, pass::applyContainerDefaults);
        walk(copy, pass::applyLayoutRules);
        walk(copy, pass::applySizing);
        walk(copy, pass::applyDefaultStyle);
        walk(copy, pass::checkSiblings);

        return new BehaviorResult(copy, pass.rules, pass.warnings);
    }

    private static void walk(List<WidgetNode> widgets, Consumer<WidgetNode> rule) {
        for (var widget : widgets) {
            rule.accept(widget);
            walk(widget.children(), rule);
        }
    }

    /** Rule and warning sink for one {@link #applyBehaviors} call. */
    private static final class Pass {
        private final List<String> rules = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        void applyWindowDefaults(WidgetNode widget) {
            if (!widget.kind().isWindow()) {
                return;
            }
            var props = widget.properties();
            if (!props.isSet("width") && !props.isSet("height")) {
                var size = SizeEstimator.estimateWindow(widget);
                props.put("width", PropertyValue.integer(size.width()));
                props.put("height", PropertyValue.integer(size.height()));
                widget.hints().markEstimatedSize();
                rules.add("Applied estimated size " + size + " to " + widget.describe());
            }
            if (!props.isSet("title")) {
                props.put("title", PropertyValue.text(widget.kind().sourceName()));
                rules.add("Applied default window title to " + widget.describe());
            }
            widget.hints().markRootWindow();
        }

        void applyContainerDefaults(WidgetNode widget) {
            if (!widget.kind().isFrame()) {
                return;
            }
            var props = widget.properties();
            if (!props.isSet("width") && !props.isSet("height") && !widget.hints().autoSize()) {
                widget.hints().markAutoSize();
                rules.add("Applied auto-sizing to " + widget.describe());
            }
            if (widget.kind() == WidgetKind.LABEL_FRAME && !props.isSet("relief")) {
                props.put("relief", PropertyValue.text("groove"));
                if (!props.isSet("borderwidth")) {
                    props.put("borderwidth", props.isSet("bd")
                        ? props.get("bd").orElseThrow()
                        : PropertyValue.integer(LABEL_FRAME_BORDER));
                }
                rules.add("Applied default LabelFrame relief to " + widget.describe());
            }
            if (widget.hasChildren() && !props.isSet("padx") && !props.isSet("pady")
                && widget.hints().defaultPadding() == null) {
                widget.hints().defaultPadding(FRAME_PADDING);
                rules.add("Applied default frame padding to " + widget.describe());
            }
        }

        void applyLayoutRules(WidgetNode parent) {
            if (!parent.hasChildren()) {
                return;
            }
            boolean anyExplicit = parent.children().stream().anyMatch(child -> child.layoutManager().isPresent());
            if (!anyExplicit) {
                for (var child : parent.children()) {
                    var options = child.layoutOptions();
                    options.putIfAbsent("side", PropertyValue.text("top"));
                    child.applyLayout(LayoutManager.PACK, options);
                }
                rules.add("Inferred pack layout manager for children of " + parent.describe());
            }
            for (var child : parent.children()) {
                var manager = child.layoutManager().orElse(null);
                if (manager == null) {
                    continue;
                }
                switch (manager) {
                    case PACK -> normalizePack(child);
                    case GRID -> normalizeGrid(child, parent);
                    case PLACE -> normalizePlace(child);
                    default -> throw new IllegalStateException("Unhandled layout manager " + manager);
                }
            }
        }

        private void normalizePack(WidgetNode widget) {
            var options = widget.layoutOptions();
            if (!options.isSet("side")) {
                options.put("side", PropertyValue.text("top"));
                rules.add("Applied default pack side (top) to " + widget.describe());
            } else {
                String side = options.keyword("side").orElse("");
                if (!PACK_SIDES.contains(side)) {
                    warnings.add("Invalid pack side: " + display(options, "side"));
                    options.put("side", PropertyValue.text("top"));
                }
            }
            if (options.isSet("fill")) {
                String fill = options.keyword("fill").orElse("");
                if (!PACK_FILLS.contains(fill)) {
                    warnings.add("Invalid pack fill: " + display(options, "fill"));
                    options.put("fill", PropertyValue.text("none"));
                }
            }
        }

        private void normalizeGrid(WidgetNode widget, WidgetNode parent) {
            var options = widget.layoutOptions();
            if (!options.isSet("row")) {
                options.put("row", PropertyValue.integer(0));
                rules.add("Applied default grid row (0) to " + widget.describe());
            }
            if (!options.isSet("column")) {
                options.put("column", PropertyValue.integer(0));
                rules.add("Applied default grid column (0) to " + widget.describe());
            }
            int row = Math.max(0, options.integer("row").orElse(0));
            int column = Math.max(0, options.integer("column").orElse(0));
            int rowSpan = Math.max(1, options.integer("rowspan").orElse(1));
            int columnSpan = Math.max(1, options.integer("columnspan").orElse(1));
            parent.hints().extendGrid(row + rowSpan, column + columnSpan);
        }

        private void normalizePlace(WidgetNode widget) {
            var options = widget.layoutOptions();
            if (!options.isSet("x")) {
                options.put("x", PropertyValue.integer(0));
                rules.add("Applied default place x (0) to " + widget.describe());
            }
            if (!options.isSet("y")) {
                options.put("y", PropertyValue.integer(0));
                rules.add("Applied default place y (0) to " + widget.describe());
            }
            widget.hints().markPositioned();
        }

        void applySizing(WidgetNode widget) {
            var props = widget.properties();
            if (!props.isSet("width")) {
                SizeEstimator.defaultWidth(widget).ifPresent(width -> {
                    widget.hints().calculatedWidth(width);
                    rules.add("Calculated width " + width + " for " + widget.describe());
                });
            }
            if (!props.isSet("height")) {
                SizeEstimator.defaultHeight(widget).ifPresent(height -> {
                    widget.hints().calculatedHeight(height);
                    rules.add("Applied default height " + height + " for " + widget.describe());
                });
            }
        }

        void applyDefaultStyle(WidgetNode widget) {
            var props = widget.properties();
            WidgetDefaults.forKind(widget.kind()).forEach((key, value) -> {
                if (props.putIfAbsent(key, value)) {
                    rules.add("Applied default " + key + " for " + widget.describe());
                }
            });
        }

        void checkSiblings(WidgetNode parent) {
            if (!parent.hasChildren()) {
                return;
            }
            long unmanaged = parent.children().stream().filter(child -> child.layoutManager().isEmpty()).count();
            if (unmanaged > 0) {
                warnings.add(unmanaged + " children of " + parent.kind().sourceName() + " have no layout manager");
            }
            var managers = new LinkedHashSet<LayoutManager>();
            parent.children().forEach(child -> child.layoutManager().ifPresent(managers::add));
            if (managers.size() > 1) {
                warnings.add(parent.kind().sourceName() + " has children with mixed layout managers: "
                    + managers.stream().map(LayoutManager::methodName).collect(Collectors.joining(", ")));
            }
        }

        private static String display(PropertyBag options, String key) {
            return options.get(key).map(PropertyValue::display).orElse("");
        }
    }
}
