package work.lcod.preview.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import work.lcod.preview.model.WidgetNode;
import work.lcod.preview.parser.ParseResult;
import work.lcod.preview.render.ConversionResult;
import work.lcod.preview.render.Html;

/**
 * Assembles a standalone HTML page around a conversion: page chrome, error panel, rendered widgets and an
 * optional debug section.
 */
public final class PreviewDocument {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final String CHROME_RESOURCE = "document.css";
    private static final String CHROME = loadChrome();

    private PreviewDocument() {}

    public static String render(String title, ParseResult parsed, ConversionResult converted, boolean debug) {
        var out = new StringBuilder();
        out.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("<head>\n")
            .append("<meta charset=\"UTF-8\">\n")
            .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
            .append("<title>").append(Html.escape(title)).append("</title>\n")
            .append("<style>\n").append(CHROME).append('\n').append(converted.stylesheet()).append("</style>\n")
            .append("</head>\n")
            .append("<body>\n")
            .append("<div class=\"preview-container\">\n")
            .append("<div class=\"content\">\n");
        appendErrors(out, parsed, converted);
        out.append(converted.markup()).append('\n');
        if (debug) {
            appendDebug(out, parsed);
        }
        out.append("</div>\n</div>\n</body>\n</html>\n");
        return out.toString();
    }

    /** Parse errors first, then conversion errors. */
    public static List<String> collectErrors(ParseResult parsed, ConversionResult converted) {
        var errors = new ArrayList<String>(parsed.errors());
        errors.addAll(converted.errors());
        return errors;
    }

    private static void appendErrors(StringBuilder out, ParseResult parsed, ConversionResult converted) {
        if (!parsed.hasErrors() && !converted.hasErrors()) {
            return;
        }
        out.append("<div class=\"error-panel\">\n<h3>Errors found:</h3>\n<ul>\n");
        for (String error : collectErrors(parsed, converted)) {
            out.append("<li>").append(Html.escape(error)).append("</li>\n");
        }
        out.append("</ul>\n</div>\n");
    }

    private static void appendDebug(StringBuilder out, ParseResult parsed) {
        out.append("<div class=\"debug-panel\">\n<h3>Debug Information</h3>\n")
            .append("<div class=\"debug-section\">\n<h4>Imports found:</h4>\n<ul>\n");
        for (String line : parsed.imports()) {
            out.append("<li>").append(Html.escape(line)).append("</li>\n");
        }
        out.append("</ul>\n</div>\n")
            .append("<div class=\"debug-section\">\n<h4>Widgets found:</h4>\n<pre>")
            .append(Html.escape(toJson(parsed.widgets())))
            .append("</pre>\n</div>\n</div>\n");
    }

    private static String toJson(List<WidgetNode> widgets) {
        try {
            return JSON_WRITER.writeValueAsString(WidgetNode.toSerializableList(widgets));
        } catch (JsonProcessingException ex) {
            return "Unable to serialize widgets: " + ex.getOriginalMessage();
        }
    }

    private static String loadChrome() {
        try (InputStream in = PreviewDocument.class.getResourceAsStream(CHROME_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Document stylesheet missing (" + CHROME_RESOURCE + ")");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + CHROME_RESOURCE, ex);
        }
    }
}
