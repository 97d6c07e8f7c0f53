package work.lcod.preview.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.preview.model.WidgetNode;
import work.lcod.preview.parser.SourceParser;
import work.lcod.preview.render.HtmlRenderer;

/**
 * Public entry point for embedding the preview pipeline: source text in, markup and diagnostics out.
 */
public final class PreviewRunner {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final SourceParser parser;
    private final HtmlRenderer renderer;

    public PreviewRunner() {
        this(new SourceParser(), new HtmlRenderer());
    }

    public PreviewRunner(SourceParser parser, HtmlRenderer renderer) {
        this.parser = parser;
        this.renderer = renderer;
    }

    public PreviewResult run(PreviewConfiguration configuration) {
        var started = Instant.now();
        var source = configuration.source();
        try {
            String text = source.read();
            var parsed = parser.parse(text);
            var converted = renderer.convert(parsed.widgets());
            var errors = PreviewDocument.collectErrors(parsed, converted);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("source", source.display());
            metadata.put("hasTkinterImport", SourceParser.hasRelevantImport(text));
            metadata.put("imports", parsed.imports());
            metadata.put("widgets", WidgetNode.toSerializableList(parsed.widgets()));
            metadata.put("appliedRules", converted.appliedRules());
            metadata.put("errors", errors);
            metadata.put("markup", converted.markup());
            if (configuration.format() != OutputFormat.MARKUP) {
                metadata.put("stylesheet", converted.stylesheet());
            }
            if (configuration.format() == OutputFormat.HTML) {
                metadata.put(
                    "document",
                    PreviewDocument.render(configuration.documentTitle(), parsed, converted, configuration.debug())
                );
            }
            metadata.put("settings", configuration.settings().toSerializableMap());
            metadata.put("logLevel", configuration.logLevel().name());
            return errors.isEmpty()
                ? PreviewResult.success(metadata, started)
                : PreviewResult.degraded(metadata, started);
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("source", source.display());
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            errorMeta.put("error", "Unable to preview " + source.display() + ": " + message);
            if (Boolean.getBoolean("tkpreview.debug")) {
                ex.printStackTrace();
            }
            return PreviewResult.failure(message, errorMeta, started);
        }
    }

    public PreviewResult runToJson(PreviewConfiguration configuration) {
        var result = run(configuration);
        try {
            var json = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap());
            return result.withSerializedPayload(json);
        } catch (JsonProcessingException ex) {
            return PreviewResult.failure("Unable to serialize result payload: " + ex.getMessage(), Map.of(), result.startedAt());
        }
    }
}
