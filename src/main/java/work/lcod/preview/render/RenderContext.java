package work.lcod.preview.render;

/**
 * State of a single {@link HtmlRenderer#convert} call. Element ids restart at 1 for every conversion.
 */
final class RenderContext {
    private static final String ID_PREFIX = "tkinter-widget-";

    private int counter;

    String nextId() {
        counter++;
        return ID_PREFIX + counter;
    }
}
