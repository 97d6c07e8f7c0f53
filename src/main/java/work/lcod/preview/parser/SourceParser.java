package work.lcod.preview.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.PropertyValue;
import work.lcod.preview.model.WidgetKind;
import work.lcod.preview.model.WidgetNode;

/**
 * Line-oriented extraction of a Tkinter widget forest from Python source.
 *
 * <p>The parser never evaluates anything and never joins lines: each non-blank, non-comment line is
 * matched against a handful of statement shapes and silently skipped when none applies. Names are plain
 * strings; the last widget assigned to a name is the one later statements refer to. Parent references
 * are resolved once every line has been read, against the final name bindings; a reference that would
 * close a cycle leaves the widget as a root. A layout or config call naming a widget that has not been
 * constructed yet is dropped.
 */
public final class SourceParser {
    private static final Pattern ASSIGNED_CALL =
        Pattern.compile("^([A-Za-z_][\\w.]*)\\s*=\\s*(?:([A-Za-z_]\\w*)\\.)?([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern BARE_CALL =
        Pattern.compile("^(?:([A-Za-z_]\\w*)\\.)?([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern METHOD_CALL =
        Pattern.compile("^([A-Za-z_][\\w.]*)\\.([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CHAINED_LAYOUT =
        Pattern.compile("^\\s*\\.(pack|grid|place)\\s*\\(");
    private static final Pattern SUBSCRIPT =
        Pattern.compile("^([A-Za-z_][\\w.]*)\\s*\\[\\s*(['\"])(\\w+)\\2\\s*\\]\\s*=\\s*(.+)$");
    private static final Pattern GEOMETRY =
        Pattern.compile("^(?:(\\d+)x(\\d+))?(?:([+-]-?\\d+)([+-]-?\\d+))?$");

    public static final int DEFAULT_WIDGET_LIMIT = 10_000;

    private final int widgetLimit;

    public SourceParser() {
        this(DEFAULT_WIDGET_LIMIT);
    }

    /**
     * @param widgetLimit constructions accepted per source; the parse stops with an error past it
     */
    public SourceParser(int widgetLimit) {
        if (widgetLimit < 1) {
            throw new IllegalArgumentException("widgetLimit must be positive");
        }
        this.widgetLimit = widgetLimit;
    }

    public ParseResult parse(String sourceText) {
        if (sourceText == null || sourceText.isEmpty()) {
            return ParseResult.empty();
        }
        String[] lines = sourceText.split("\n", -1);
        var imports = new ArrayList<String>();
        var widgets = new ArrayList<WidgetNode>();
        var errors = new ArrayList<String>();
        var names = new HashMap<String, WidgetNode>();
        try {
            imports.addAll(extractImports(lines));
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i].trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                classify(line, i + 1, widgets, names);
            }
        } catch (RuntimeException ex) {
            errors.add("Parsing error: " + describe(ex));
        }
        // widgets built before a fault are still assembled
        var roots = buildHierarchy(widgets, names);
        return new ParseResult(roots, imports, !errors.isEmpty(), errors);
    }

    /**
     * True when the text contains a tkinter import in any of its usual spellings.
     */
    public static boolean hasRelevantImport(String sourceText) {
        if (sourceText == null) {
            return false;
        }
        for (String raw : sourceText.split("\n")) {
            String line = raw.trim();
            if (line.contains("import tkinter") || line.contains("import Tkinter")
                || line.contains("from tkinter") || line.contains("from Tkinter")) {
                return true;
            }
        }
        return false;
    }

    private List<String> extractImports(String[] lines) {
        var imports = new ArrayList<String>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.contains("tkinter") || line.contains("Tkinter")) {
                imports.add(line);
            }
        }
        return imports;
    }

    private void classify(
        String line,
        int lineNumber,
        List<WidgetNode> widgets,
        Map<String, WidgetNode> names
    ) {
        var created = parseConstruction(line, lineNumber);
        if (created != null) {
            if (widgets.size() >= widgetLimit) {
                throw new IllegalStateException("Widget limit of " + widgetLimit + " exceeded at line " + lineNumber);
            }
            widgets.add(created);
            created.name().ifPresent(name -> names.put(name, created));
            return;
        }
        if (parseMethodCall(line, names)) {
            return;
        }
        parseSubscriptAssignment(line, names);
    }

    private WidgetNode parseConstruction(String line, int lineNumber) {
        Matcher assigned = ASSIGNED_CALL.matcher(line);
        if (assigned.find()) {
            var node = buildWidget(line, assigned.group(1), assigned.group(3), assigned.end() - 1, lineNumber);
            if (node != null) {
                return node;
            }
        }
        Matcher bare = BARE_CALL.matcher(line);
        if (bare.find()) {
            return buildWidget(line, null, bare.group(2), bare.end() - 1, lineNumber);
        }
        return null;
    }

    private WidgetNode buildWidget(String line, String name, String kindName, int openParen, int lineNumber) {
        var kind = WidgetKind.fromSourceName(kindName);
        if (kind.isEmpty()) {
            return null;
        }
        int close = ArgumentList.findClosingParen(line, openParen);
        if (close < 0) {
            return null;
        }
        var args = ArgumentList.parse(line.substring(openParen + 1, close));
        var node = new WidgetNode(kind.get(), name, args.parent().orElse(null), args.keywords(), lineNumber);
        applyChainedLayout(line.substring(close + 1), node);
        return node;
    }

    // tk.Label(frame, text="Name:").grid(row=0, column=0)
    private void applyChainedLayout(String rest, WidgetNode node) {
        Matcher chained = CHAINED_LAYOUT.matcher(rest);
        if (!chained.find()) {
            return;
        }
        int close = ArgumentList.findClosingParen(rest, chained.end() - 1);
        if (close < 0) {
            return;
        }
        var manager = LayoutManager.fromMethod(chained.group(1)).orElseThrow();
        node.applyLayout(manager, ArgumentList.parseKeywords(rest.substring(chained.end(), close)));
    }

    private boolean parseMethodCall(String line, Map<String, WidgetNode> names) {
        Matcher call = METHOD_CALL.matcher(line);
        if (!call.find()) {
            return false;
        }
        int open = call.end() - 1;
        int close = ArgumentList.findClosingParen(line, open);
        if (close < 0) {
            return false;
        }
        var widget = names.get(call.group(1));
        if (widget == null) {
            return false;
        }
        String method = call.group(2);
        String args = line.substring(open + 1, close);

        var manager = LayoutManager.fromMethod(method);
        if (manager.isPresent()) {
            widget.applyLayout(manager.get(), ArgumentList.parseKeywords(args));
            return true;
        }
        switch (method) {
            case "config", "configure" -> {
                widget.properties().merge(ArgumentList.parseKeywords(args));
                return true;
            }
            case "title" -> {
                var parsed = ArgumentList.parse(args);
                if (parsed.positional().isEmpty()) {
                    return false;
                }
                widget.properties().put("title", ArgumentList.parseLiteral(parsed.positional().get(0)));
                return true;
            }
            case "geometry" -> {
                return applyGeometry(widget, ArgumentList.parse(args));
            }
            default -> {
                return false;
            }
        }
    }

    private boolean applyGeometry(WidgetNode widget, ArgumentList args) {
        if (args.positional().isEmpty()) {
            return false;
        }
        var size = ArgumentList.parseLiteral(args.positional().get(0));
        if (!(size instanceof PropertyValue.Text text) || text.value().isBlank()) {
            return false;
        }
        Matcher geometry = GEOMETRY.matcher(text.value().trim());
        if (!geometry.matches()) {
            return false;
        }
        var values = new LinkedHashMap<String, PropertyValue>();
        try {
            if (geometry.group(1) != null) {
                values.put("width", PropertyValue.integer(Integer.parseInt(geometry.group(1))));
                values.put("height", PropertyValue.integer(Integer.parseInt(geometry.group(2))));
            }
            if (geometry.group(3) != null) {
                values.put("x", PropertyValue.integer(parseOffset(geometry.group(3))));
                values.put("y", PropertyValue.integer(parseOffset(geometry.group(4))));
            }
        } catch (NumberFormatException ex) {
            // more digits than a screen coordinate can hold: not a geometry Tk would accept
            return false;
        }
        values.forEach(widget.properties()::put);
        return true;
    }

    private static int parseOffset(String raw) {
        // "+-5" is a legal Tk offset meaning -5
        String digits = raw.substring(1);
        int value = Integer.parseInt(digits);
        return raw.charAt(0) == '-' ? -value : value;
    }

    private boolean parseSubscriptAssignment(String line, Map<String, WidgetNode> names) {
        Matcher subscript = SUBSCRIPT.matcher(line);
        if (!subscript.matches()) {
            return false;
        }
        var widget = names.get(subscript.group(1));
        if (widget == null) {
            return false;
        }
        widget.properties().put(subscript.group(3), ArgumentList.parseLiteral(subscript.group(4)));
        return true;
    }

    /**
     * Attaches each widget to the widget its parent name is bound to at the end of the source (the last
     * assignment wins). A widget whose parent is unknown, is itself, or already sits beneath it stays a root.
     */
    private List<WidgetNode> buildHierarchy(List<WidgetNode> widgets, Map<String, WidgetNode> names) {
        var roots = new ArrayList<WidgetNode>();
        var attachedTo = new IdentityHashMap<WidgetNode, WidgetNode>();
        for (var widget : widgets) {
            var parent = widget.parentRef().map(names::get).orElse(null);
            if (parent == null || isWithin(parent, widget, attachedTo)) {
                roots.add(widget);
                continue;
            }
            parent.addChild(widget);
            attachedTo.put(widget, parent);
        }
        return roots;
    }

    private static boolean isWithin(WidgetNode node, WidgetNode ancestor, Map<WidgetNode, WidgetNode> attachedTo) {
        for (var current = node; current != null; current = attachedTo.get(current)) {
            if (current == ancestor) {
                return true;
            }
        }
        return false;
    }

    private static String describe(RuntimeException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
