package work.lcod.preview.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.WidgetKind;

class SourceParserTest {
    private final SourceParser parser = new SourceParser();

    @Test
    void nestsLabelUnderWindow() {
        var result = parser.parse(String.join("\n",
            "import tkinter as tk",
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"Hi\")",
            "label.pack()"
        ));

        assertFalse(result.hasErrors());
        assertEquals(1, result.widgets().size());
        var root = result.widgets().get(0);
        assertEquals(WidgetKind.TK, root.kind());
        assertEquals(1, root.children().size());
        var label = root.children().get(0);
        assertEquals(WidgetKind.LABEL, label.kind());
        assertEquals(Optional.of("Hi"), label.properties().text("text"));
        assertEquals(Optional.of(LayoutManager.PACK), label.layoutManager());
        assertEquals(3, label.sourceLine());
    }

    @Test
    void recordsGridOptions() {
        var result = parser.parse(String.join("\n",
            "from tkinter import *",
            "root = Tk()",
            "btn = Button(root, text=\"OK\")",
            "btn.grid(row=1, column=2)"
        ));

        var button = result.widgets().get(0).children().get(0);
        assertEquals(Optional.of(LayoutManager.GRID), button.layoutManager());
        assertEquals(OptionalInt.of(1), button.layoutOptions().integer("row"));
        assertEquals(OptionalInt.of(2), button.layoutOptions().integer("column"));
    }

    @Test
    void skipsMalformedLines() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "broken = tk.Label(root, text=\"never closed\"",
            "ok = tk.Label(root, text=\"fine\")",
            "ok.pack(side="
        ));

        assertFalse(result.hasErrors());
        var root = result.widgets().get(0);
        assertEquals(1, root.children().size());
        assertEquals(Optional.of("ok"), root.children().get(0).name());
        assertTrue(root.children().get(0).layoutManager().isEmpty());
    }

    @Test
    void appliesChainedLayoutToUnnamedWidget() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "tk.Label(root, text=\"Name:\").grid(row=0, column=0, sticky=\"w\")"
        ));

        var label = result.widgets().get(0).children().get(0);
        assertTrue(label.name().isEmpty());
        assertEquals(Optional.of(LayoutManager.GRID), label.layoutManager());
        assertEquals(Optional.of("w"), label.layoutOptions().text("sticky"));
    }

    @Test
    void readsTitleAndGeometry() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "root.title(\"Settings\")",
            "root.geometry(\"400x300+10+20\")"
        ));

        var props = result.widgets().get(0).properties();
        assertEquals(Optional.of("Settings"), props.text("title"));
        assertEquals(OptionalInt.of(400), props.integer("width"));
        assertEquals(OptionalInt.of(300), props.integer("height"));
        assertEquals(OptionalInt.of(10), props.integer("x"));
        assertEquals(OptionalInt.of(20), props.integer("y"));
    }

    @Test
    void followsAttributeNames() {
        var result = parser.parse(String.join("\n",
            "class App:",
            "    def __init__(self):",
            "        self.root = tk.Tk()",
            "        self.label = ttk.Label(self.root, text=\"x\")",
            "        self.label.pack(side=tk.LEFT)"
        ));

        var label = result.widgets().get(0).children().get(0);
        assertEquals(Optional.of("self.label"), label.name());
        assertEquals(Optional.of("left"), label.layoutOptions().keyword("side"));
    }

    @Test
    void dropsLayoutCallBeforeConstruction() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "label.pack()",
            "label = tk.Label(root, text=\"late\")"
        ));

        var label = result.widgets().get(0).children().get(0);
        assertTrue(label.layoutManager().isEmpty());
    }

    @Test
    void mergesConfigureAndSubscriptAssignments() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"a\")",
            "label.config(fg=\"red\", text=\"b\")",
            "label[\"bg\"] = \"blue\""
        ));

        var props = result.widgets().get(0).children().get(0).properties();
        assertEquals(Optional.of("b"), props.text("text"));
        assertEquals(Optional.of("red"), props.text("fg"));
        assertEquals(Optional.of("blue"), props.text("bg"));
    }

    @Test
    void parentNamesBindToTheLastAssignment() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "frame = tk.Frame(root)",
            "tk.Label(frame, text=\"one\")",
            "frame = tk.Frame(root)",
            "tk.Label(frame, text=\"two\")"
        ));

        var frames = result.widgets().get(0).children();
        assertEquals(2, frames.size());
        assertTrue(frames.get(0).children().isEmpty());
        assertEquals(2, frames.get(1).children().size());
        assertEquals(Optional.of("one"), frames.get(1).children().get(0).properties().text("text"));
    }

    @Test
    void childMayPrecedeItsParent() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "lbl = tk.Label(frame, text=\"x\")",
            "frame = tk.Frame(root)"
        ));

        assertEquals(1, result.widgets().size());
        var frame = result.widgets().get(0).children().get(0);
        assertEquals(Optional.of("frame"), frame.name());
        assertEquals(Optional.of("lbl"), frame.children().get(0).name());
    }

    @Test
    void cyclicParentsLeaveARoot() {
        var result = parser.parse(String.join("\n",
            "a = tk.Frame(b)",
            "b = tk.Frame(a)",
            "solo = tk.Frame(solo)"
        ));

        assertFalse(result.hasErrors());
        assertEquals(2, result.widgets().size());
        var b = result.widgets().get(0);
        assertEquals(Optional.of("b"), b.name());
        assertEquals(Optional.of("a"), b.children().get(0).name());
        assertTrue(b.children().get(0).children().isEmpty());
        assertEquals(Optional.of("solo"), result.widgets().get(1).name());
        assertTrue(result.widgets().get(1).children().isEmpty());
    }

    @Test
    void oversizedGeometryIsSkipped() {
        var result = parser.parse(String.join("\n",
            "root = tk.Tk()",
            "root.geometry(\"99999999999999999999x10\")",
            "root.geometry(\"300x200+99999999999+0\")",
            "lbl = tk.Label(root, text=\"after\")"
        ));

        assertFalse(result.hasErrors());
        var root = result.widgets().get(0);
        assertFalse(root.properties().has("width"));
        assertFalse(root.properties().has("x"));
        assertEquals(1, root.children().size());
        assertEquals(Optional.of("after"), root.children().get(0).properties().text("text"));
    }

    @Test
    void faultKeepsWidgetsBuiltSoFar() {
        var limited = new SourceParser(2);
        var result = limited.parse(String.join("\n",
            "root = tk.Tk()",
            "first = tk.Label(root, text=\"1\")",
            "second = tk.Label(root, text=\"2\")",
            "third = tk.Label(root, text=\"3\")"
        ));

        assertTrue(result.hasErrors());
        assertEquals(List.of("Parsing error: Widget limit of 2 exceeded at line 3"), result.errors());
        assertEquals(1, result.widgets().size());
        assertEquals(1, result.widgets().get(0).children().size());
        assertEquals(Optional.of("first"), result.widgets().get(0).children().get(0).name());
    }

    @Test
    void unknownParentMakesARoot() {
        var result = parser.parse("label = tk.Label(missing, text=\"orphan\")");
        assertEquals(1, result.widgets().size());
        assertEquals(Optional.of("missing"), result.widgets().get(0).parentRef());
    }

    @Test
    void ignoresNonWidgetCallsAndComments() {
        var result = parser.parse(String.join("\n",
            "# label = tk.Label(root)",
            "value = compute(1, 2)",
            "print(\"hello\")"
        ));
        assertTrue(result.widgets().isEmpty());
        assertFalse(result.hasErrors());
    }

    @Test
    void collectsImportLines() throws Exception {
        String source = Files.readString(Path.of("src", "test", "resources", "samples", "simple.py"));
        var result = parser.parse(source);
        assertEquals(List.of("import tkinter as tk"), result.imports());
        assertTrue(SourceParser.hasRelevantImport(source));
        assertFalse(SourceParser.hasRelevantImport("import sys"));
    }

    @Test
    void emptyInputGivesEmptyResult() {
        var result = parser.parse("");
        assertTrue(result.widgets().isEmpty());
        assertTrue(result.imports().isEmpty());
        assertFalse(result.hasErrors());
    }
}
