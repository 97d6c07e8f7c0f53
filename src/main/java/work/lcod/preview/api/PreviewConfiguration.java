package work.lcod.preview.api;

import java.util.Objects;

/**
 * Immutable configuration for a single {@link PreviewRunner} run.
 */
public record PreviewConfiguration(
    PreviewSource source,
    OutputFormat format,
    boolean debug,
    String documentTitle,
    LogLevel logLevel,
    PreviewSettings settings
) {
    public static final String DEFAULT_TITLE = "Tkinter Preview";

    public PreviewConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(documentTitle, "documentTitle");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(settings, "settings");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PreviewSource source;
        private OutputFormat format = OutputFormat.HTML;
        private boolean debug;
        private String documentTitle = DEFAULT_TITLE;
        private LogLevel logLevel = LogLevel.WARN;
        private PreviewSettings settings = PreviewSettings.defaults();

        public Builder source(PreviewSource source) {
            this.source = source;
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder documentTitle(String documentTitle) {
            this.documentTitle = documentTitle;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        /**
         * Applies a settings file; values set on the builder afterwards still win.
         */
        public Builder settings(PreviewSettings settings) {
            this.settings = settings;
            settings.format().ifPresent(value -> this.format = value);
            settings.debug().ifPresent(value -> this.debug = value);
            settings.title().ifPresent(value -> this.documentTitle = value);
            return this;
        }

        public PreviewConfiguration build() {
            return new PreviewConfiguration(source, format, debug, documentTitle, logLevel, settings);
        }
    }
}
