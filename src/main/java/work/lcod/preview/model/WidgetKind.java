package work.lcod.preview.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of widget classes recognised in source. Kinds without a renderer are still parsed and laid out.
 */
public enum WidgetKind {
    TK("Tk"),
    TOPLEVEL("Toplevel"),
    FRAME("Frame"),
    LABEL_FRAME("LabelFrame"),
    LABEL("Label"),
    BUTTON("Button"),
    ENTRY("Entry"),
    TEXT("Text"),
    LISTBOX("Listbox"),
    CHECKBUTTON("Checkbutton"),
    RADIOBUTTON("Radiobutton"),
    SCALE("Scale"),
    SPINBOX("Spinbox"),
    CANVAS("Canvas"),
    MENU("Menu"),
    MENUBUTTON("Menubutton"),
    OPTION_MENU("OptionMenu"),
    SCROLLBAR("Scrollbar"),
    PANED_WINDOW("PanedWindow"),
    NOTEBOOK("Notebook"),
    PROGRESSBAR("Progressbar"),
    COMBOBOX("Combobox"),
    TREEVIEW("Treeview"),
    SEPARATOR("Separator");

    private static final Map<String, WidgetKind> BY_SOURCE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(WidgetKind::sourceName, Function.identity()));

    private final String sourceName;

    WidgetKind(String sourceName) {
        this.sourceName = sourceName;
    }

    /** Class name as written in source, e.g. {@code LabelFrame}. */
    public String sourceName() {
        return sourceName;
    }

    public boolean isWindow() {
        return this == TK || this == TOPLEVEL;
    }

    public boolean isFrame() {
        return this == FRAME || this == LABEL_FRAME;
    }

    /** Exact, case-sensitive lookup; {@code label} is not a widget class. */
    public static Optional<WidgetKind> fromSourceName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SOURCE_NAME.get(name));
    }
}
