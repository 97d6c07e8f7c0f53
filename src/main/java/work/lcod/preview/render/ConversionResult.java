package work.lcod.preview.render;

import java.util.List;
import work.lcod.preview.model.WidgetNode;

/**
 * Markup and stylesheet produced from a widget forest, plus every diagnostic gathered on the way.
 * {@code annotatedForest} and {@code appliedRules} expose the behaviour pass for debugging; both are empty
 * when conversion failed.
 */
public record ConversionResult(
    String markup,
    String stylesheet,
    boolean hasErrors,
    List<String> errors,
    List<String> appliedRules,
    List<WidgetNode> annotatedForest
) {
    public ConversionResult {
        errors = List.copyOf(errors);
        appliedRules = List.copyOf(appliedRules);
        annotatedForest = List.copyOf(annotatedForest);
    }
}
