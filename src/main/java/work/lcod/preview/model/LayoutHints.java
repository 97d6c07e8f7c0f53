package work.lcod.preview.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Geometry facts derived by the behaviour rules. Kept apart from source properties so a property bag
 * only ever holds what the program wrote (or a kind default standing in for it).
 */
public final class LayoutHints {
    private boolean rootWindow;
    private boolean estimatedSize;
    private boolean autoSize;
    private Integer defaultPadding;
    private boolean gridContainer;
    private int gridRows;
    private int gridColumns;
    private boolean positioned;
    private Integer calculatedWidth;
    private Integer calculatedHeight;

    public boolean rootWindow() {
        return rootWindow;
    }

    public void markRootWindow() {
        this.rootWindow = true;
    }

    /** Window size came from the child-based estimate rather than the source. */
    public boolean estimatedSize() {
        return estimatedSize;
    }

    public void markEstimatedSize() {
        this.estimatedSize = true;
    }

    public boolean autoSize() {
        return autoSize;
    }

    public void markAutoSize() {
        this.autoSize = true;
    }

    public Integer defaultPadding() {
        return defaultPadding;
    }

    public void defaultPadding(int padding) {
        this.defaultPadding = padding;
    }

    public boolean gridContainer() {
        return gridContainer;
    }

    public int gridRows() {
        return gridRows;
    }

    public int gridColumns() {
        return gridColumns;
    }

    /**
     * Marks the owner as a grid container (starting at one cell) and grows its extents to cover
     * {@code rowEnd} x {@code columnEnd}. Extents never shrink.
     */
    public void extendGrid(int rowEnd, int columnEnd) {
        if (!gridContainer) {
            gridContainer = true;
            gridRows = 1;
            gridColumns = 1;
        }
        gridRows = Math.max(gridRows, rowEnd);
        gridColumns = Math.max(gridColumns, columnEnd);
    }

    public boolean positioned() {
        return positioned;
    }

    public void markPositioned() {
        this.positioned = true;
    }

    public Integer calculatedWidth() {
        return calculatedWidth;
    }

    public void calculatedWidth(int width) {
        this.calculatedWidth = width;
    }

    public Integer calculatedHeight() {
        return calculatedHeight;
    }

    public void calculatedHeight(int height) {
        this.calculatedHeight = height;
    }

    public LayoutHints copy() {
        var copy = new LayoutHints();
        copy.rootWindow = rootWindow;
        copy.estimatedSize = estimatedSize;
        copy.autoSize = autoSize;
        copy.defaultPadding = defaultPadding;
        copy.gridContainer = gridContainer;
        copy.gridRows = gridRows;
        copy.gridColumns = gridColumns;
        copy.positioned = positioned;
        copy.calculatedWidth = calculatedWidth;
        copy.calculatedHeight = calculatedHeight;
        return copy;
    }

    public boolean isEmpty() {
        return toSerializableMap().isEmpty();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        if (rootWindow) {
            map.put("rootWindow", true);
        }
        if (estimatedSize) {
            map.put("estimatedSize", true);
        }
        if (autoSize) {
            map.put("autoSize", true);
        }
        if (defaultPadding != null) {
            map.put("defaultPadding", defaultPadding);
        }
        if (gridContainer) {
            map.put("gridRows", gridRows);
            map.put("gridColumns", gridColumns);
        }
        if (positioned) {
            map.put("positioned", true);
        }
        if (calculatedWidth != null) {
            map.put("calculatedWidth", calculatedWidth);
        }
        if (calculatedHeight != null) {
            map.put("calculatedHeight", calculatedHeight);
        }
        return map;
    }
}
