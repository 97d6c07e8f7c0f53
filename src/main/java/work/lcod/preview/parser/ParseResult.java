package work.lcod.preview.parser;

import java.util.List;
import work.lcod.preview.model.WidgetNode;

/**
 * Outcome of {@link SourceParser#parse(String)}: root widgets in encounter order plus the import lines seen.
 */
public record ParseResult(List<WidgetNode> widgets, List<String> imports, boolean hasErrors, List<String> errors) {
    public ParseResult {
        widgets = List.copyOf(widgets);
        imports = List.copyOf(imports);
        errors = List.copyOf(errors);
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of(), false, List.of());
    }
}
