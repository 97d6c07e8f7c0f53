package work.lcod.preview.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import work.lcod.preview.model.LayoutManager;
import work.lcod.preview.model.WidgetNode;
import work.lcod.preview.parser.SourceParser;

class BehaviorEngineTest {
    private final BehaviorEngine engine = new BehaviorEngine();

    private static List<WidgetNode> parse(String... lines) {
        return new SourceParser().parse(String.join("\n", lines)).widgets();
    }

    @Test
    void defaultsPackSideToTop() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"Hi\")",
            "label.pack()"
        ));

        var label = result.modifiedForest().get(0).children().get(0);
        assertEquals(Optional.of("top"), label.layoutOptions().keyword("side"));
        assertTrue(result.appliedRules().contains("Applied default pack side (top) to Label 'label'"));
    }

    @Test
    void gridExtentsCoverEveryCell() {
        var result = engine.applyBehaviors(parse(
            "root = Tk()",
            "btn = Button(root, text=\"OK\")",
            "btn.grid(row=1, column=2)",
            "wide = Label(root, text=\"wide\")",
            "wide.grid(row=0, column=0, columnspan=4)"
        ));

        var hints = result.modifiedForest().get(0).hints();
        assertTrue(hints.gridContainer());
        assertEquals(2, hints.gridRows());
        assertEquals(4, hints.gridColumns());
    }

    @Test
    void explicitSizesSurvive() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "root.geometry(\"640x480\")",
            "label = tk.Label(root, text=\"Hello\", width=20)",
            "label.pack()"
        ));

        var root = result.modifiedForest().get(0);
        assertEquals(OptionalInt.of(640), root.properties().integer("width"));
        assertEquals(OptionalInt.of(480), root.properties().integer("height"));
        assertFalse(root.hints().estimatedSize());
        var label = root.children().get(0);
        assertEquals(OptionalInt.of(20), label.properties().integer("width"));
        assertNull(label.hints().calculatedWidth());
        assertEquals(25, label.hints().calculatedHeight());
    }

    @Test
    void estimatesWindowFromPackedChildren() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "text = tk.Text(root)",
            "text.pack()",
            "entry = tk.Entry(root)",
            "entry.pack()"
        ));

        var root = result.modifiedForest().get(0);
        assertEquals(OptionalInt.of(340), root.properties().integer("width"));
        assertEquals(OptionalInt.of(285), root.properties().integer("height"));
        assertTrue(root.hints().estimatedSize());
        assertEquals(Optional.of("Tk"), root.properties().text("title"));
        assertTrue(result.appliedRules().contains("Applied estimated size 340x285 to Tk 'root'"));
    }

    @Test
    void emptyWindowGetsMinimalSize() {
        var result = engine.applyBehaviors(parse("top = tk.Toplevel()"));

        var window = result.modifiedForest().get(0);
        assertEquals(OptionalInt.of(200), window.properties().integer("width"));
        assertEquals(OptionalInt.of(100), window.properties().integer("height"));
        assertEquals(Optional.of("Toplevel"), window.properties().text("title"));
    }

    @Test
    void infersPackWhenNoChildIsManaged() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "tk.Label(root, text=\"a\")",
            "tk.Label(root, text=\"b\")"
        ));

        for (var child : result.modifiedForest().get(0).children()) {
            assertEquals(Optional.of(LayoutManager.PACK), child.layoutManager());
            assertEquals(Optional.of("top"), child.layoutOptions().keyword("side"));
        }
        assertTrue(result.appliedRules().contains("Inferred pack layout manager for children of Tk 'root'"));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void replacesInvalidPackOptions() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"x\")",
            "label.pack(side=\"middle\", fill=\"sideways\")"
        ));

        var options = result.modifiedForest().get(0).children().get(0).layoutOptions();
        assertEquals(Optional.of("top"), options.keyword("side"));
        assertEquals(Optional.of("none"), options.keyword("fill"));
        assertEquals(List.of("Invalid pack side: middle", "Invalid pack fill: sideways"), result.warnings());
    }

    @Test
    void acceptsConstantPackOptions() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"x\")",
            "label.pack(side=tk.RIGHT, fill=tk.BOTH)"
        ));

        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void warnsAboutUnmanagedAndMixedSiblings() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "a = tk.Label(root, text=\"a\")",
            "a.pack()",
            "b = tk.Label(root, text=\"b\")",
            "b.grid(row=0, column=0)",
            "c = tk.Label(root, text=\"c\")"
        ));

        assertTrue(result.warnings().contains("1 children of Tk have no layout manager"));
        assertTrue(result.warnings().contains("Tk has children with mixed layout managers: pack, grid"));
    }

    @Test
    void placeDefaultsToOrigin() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"x\")",
            "label.place(x=15)"
        ));

        var label = result.modifiedForest().get(0).children().get(0);
        assertEquals(OptionalInt.of(15), label.layoutOptions().integer("x"));
        assertEquals(OptionalInt.of(0), label.layoutOptions().integer("y"));
        assertTrue(label.hints().positioned());
    }

    @Test
    void labelFrameGetsGrooveBorder() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "plain = tk.LabelFrame(root, text=\"Plain\")",
            "thick = tk.LabelFrame(root, text=\"Thick\", bd=4)"
        ));

        var frames = result.modifiedForest().get(0).children();
        assertEquals(Optional.of("groove"), frames.get(0).properties().text("relief"));
        assertEquals(OptionalInt.of(2), frames.get(0).properties().integer("borderwidth"));
        assertEquals(OptionalInt.of(4), frames.get(1).properties().integer("borderwidth"));
        assertTrue(frames.get(0).hints().autoSize());
    }

    @Test
    void framesWithChildrenGetDefaultPadding() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "frame = tk.Frame(root)",
            "frame.pack()",
            "tk.Label(frame, text=\"inside\").pack()"
        ));

        var frame = result.modifiedForest().get(0).children().get(0);
        assertEquals(5, frame.hints().defaultPadding());
    }

    @Test
    void appliesDefaultStyleWithoutOverriding() {
        var result = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "button = tk.Button(root, relief=\"flat\")",
            "button.pack()"
        ));

        var props = result.modifiedForest().get(0).children().get(0).properties();
        assertEquals(Optional.of("flat"), props.text("relief"));
        assertEquals(OptionalInt.of(1), props.integer("borderwidth"));
        assertEquals(Optional.of("#f0f0f0"), props.text("background"));
    }

    @Test
    void leavesInputUntouched() {
        var forest = parse(
            "root = tk.Tk()",
            "label = tk.Label(root, text=\"Hi\")"
        );
        var before = WidgetNode.toSerializableList(forest);

        engine.applyBehaviors(forest);

        assertEquals(before, WidgetNode.toSerializableList(forest));
        assertTrue(forest.get(0).children().get(0).layoutManager().isEmpty());
    }

    @Test
    void secondApplicationChangesNothing() {
        var first = engine.applyBehaviors(parse(
            "root = tk.Tk()",
            "frame = tk.LabelFrame(root, text=\"Group\")",
            "frame.grid(row=0, column=0)",
            "ok = tk.Button(frame, text=\"OK\")",
            "ok.pack(side=\"bottom\")",
            "tk.Entry(root).grid(row=1, column=0)"
        ));
        var second = engine.applyBehaviors(first.modifiedForest());

        assertEquals(
            WidgetNode.toSerializableList(first.modifiedForest()),
            WidgetNode.toSerializableList(second.modifiedForest())
        );
    }

    @Test
    void emptyForestYieldsEmptyResult() {
        var result = engine.applyBehaviors(List.of());
        assertTrue(result.modifiedForest().isEmpty());
        assertTrue(result.appliedRules().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }
}
