package work.lcod.preview.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One widget reconstructed from source. Nodes form a tree: children are owned by exactly one parent.
 */
public final class WidgetNode {
    private final WidgetKind kind;
    private final String name;
    private final String parentRef;
    private final int sourceLine;
    private final PropertyBag properties;
    private final List<WidgetNode> children = new ArrayList<>();
    private LayoutManager layoutManager;
    private PropertyBag layoutOptions = new PropertyBag();
    private LayoutHints hints = new LayoutHints();

    public WidgetNode(WidgetKind kind, String name, String parentRef, PropertyBag properties, int sourceLine) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.parentRef = parentRef;
        this.properties = properties == null ? new PropertyBag() : properties;
        this.sourceLine = sourceLine;
    }

    public WidgetKind kind() {
        return kind;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> parentRef() {
        return Optional.ofNullable(parentRef);
    }

    /** 1-based line of the constructor statement, 0 when unknown. */
    public int sourceLine() {
        return sourceLine;
    }

    public PropertyBag properties() {
        return properties;
    }

    public List<WidgetNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public void addChild(WidgetNode child) {
        Objects.requireNonNull(child, "child");
        if (child == this) {
            throw new IllegalArgumentException("A widget cannot contain itself");
        }
        children.add(child);
    }

    public Optional<LayoutManager> layoutManager() {
        return Optional.ofNullable(layoutManager);
    }

    public PropertyBag layoutOptions() {
        return layoutOptions;
    }

    /**
     * Hands the widget to a geometry manager. A later call replaces the earlier manager and its options.
     */
    public void applyLayout(LayoutManager manager, PropertyBag options) {
        this.layoutManager = Objects.requireNonNull(manager, "manager");
        this.layoutOptions = options == null ? new PropertyBag() : options;
    }

    public LayoutHints hints() {
        return hints;
    }

    /** Kind plus name, for diagnostics: {@code Label 'status'}. */
    public String describe() {
        return name == null ? kind.sourceName() : kind.sourceName() + " '" + name + "'";
    }

    public WidgetNode deepCopy() {
        var copy = new WidgetNode(kind, name, parentRef, properties.copy(), sourceLine);
        copy.layoutManager = layoutManager;
        copy.layoutOptions = layoutOptions.copy();
        copy.hints = hints.copy();
        for (var child : children) {
            copy.children.add(child.deepCopy());
        }
        return copy;
    }

    public static List<WidgetNode> deepCopy(List<WidgetNode> forest) {
        var copy = new ArrayList<WidgetNode>(forest.size());
        for (var node : forest) {
            copy.add(node.deepCopy());
        }
        return copy;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("type", kind.sourceName());
        if (name != null) {
            map.put("name", name);
        }
        if (parentRef != null) {
            map.put("parent", parentRef);
        }
        map.put("properties", properties.toPlainMap());
        if (layoutManager != null) {
            map.put("layoutManager", layoutManager.methodName());
            map.put("layoutOptions", layoutOptions.toPlainMap());
        }
        if (!hints.isEmpty()) {
            map.put("hints", hints.toSerializableMap());
        }
        if (sourceLine > 0) {
            map.put("line", sourceLine);
        }
        var serializedChildren = new ArrayList<Map<String, Object>>();
        for (var child : children) {
            serializedChildren.add(child.toSerializableMap());
        }
        map.put("children", serializedChildren);
        return map;
    }

    public static List<Map<String, Object>> toSerializableList(List<WidgetNode> forest) {
        var list = new ArrayList<Map<String, Object>>();
        for (var node : forest) {
            list.add(node.toSerializableMap());
        }
        return list;
    }

    @Override
    public String toString() {
        return describe() + children;
    }
}
