package work.lcod.preview.behavior;

import java.util.List;
import work.lcod.preview.model.WidgetNode;

/**
 * Annotated copy of a widget forest together with the rules that fired and the problems found.
 */
public record BehaviorResult(List<WidgetNode> modifiedForest, List<String> appliedRules, List<String> warnings) {
    public BehaviorResult {
        modifiedForest = List.copyOf(modifiedForest);
        appliedRules = List.copyOf(appliedRules);
        warnings = List.copyOf(warnings);
    }
}
