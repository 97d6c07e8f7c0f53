package work.lcod.preview.behavior;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.preview.model.PropertyValue;
import work.lcod.preview.model.WidgetKind;

/**
 * Default relief, border width and background per widget kind, as the classic Tk theme draws them.
 */
final class WidgetDefaults {
    private static final Map<WidgetKind, Map<String, PropertyValue>> TABLE = new EnumMap<>(WidgetKind.class);

    static {
        TABLE.put(WidgetKind.BUTTON, style("raised", 1, "#f0f0f0"));
        TABLE.put(WidgetKind.ENTRY, style("sunken", 1, "white"));
        TABLE.put(WidgetKind.TEXT, style("sunken", 1, "white"));
        TABLE.put(WidgetKind.LABEL, style("flat", null, "#f0f0f0"));
        TABLE.put(WidgetKind.FRAME, style("flat", 0, "#f0f0f0"));
        TABLE.put(WidgetKind.LABEL_FRAME, style("groove", 2, "#f0f0f0"));
        TABLE.put(WidgetKind.LISTBOX, style("sunken", 1, "white"));
        TABLE.put(WidgetKind.CANVAS, style("sunken", 1, "white"));
    }

    private WidgetDefaults() {}

    static Map<String, PropertyValue> forKind(WidgetKind kind) {
        return TABLE.getOrDefault(kind, Map.of());
    }

    private static Map<String, PropertyValue> style(String relief, Integer borderWidth, String background) {
        var defaults = new LinkedHashMap<String, PropertyValue>();
        defaults.put("relief", PropertyValue.text(relief));
        if (borderWidth != null) {
            defaults.put("borderwidth", PropertyValue.integer(borderWidth));
        }
        defaults.put("background", PropertyValue.text(background));
        return Collections.unmodifiableMap(defaults);
    }
}
