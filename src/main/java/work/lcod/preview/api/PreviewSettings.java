package work.lcod.preview.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.preview.shared.DurationParser;

/**
 * Project settings from {@code tk-preview.toml}.
 *
 * <pre>
 * [preview]
 * format = "html"
 * debug = false
 * title = "Tkinter Preview"
 *
 * [refresh]
 * auto = true
 * delay = "500ms"
 * </pre>
 *
 * The {@code [refresh]} values belong to whatever re-runs the preview on edits; the pipeline only carries
 * them through.
 */
public record PreviewSettings(
    Optional<OutputFormat> format,
    Optional<Boolean> debug,
    Optional<String> title,
    boolean autoRefresh,
    Duration refreshDelay
) {
    public static final String FILE_NAME = "tk-preview.toml";
    public static final Duration DEFAULT_REFRESH_DELAY = Duration.ofMillis(500);

    public PreviewSettings {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(debug, "debug");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(refreshDelay, "refreshDelay");
        if (refreshDelay.isNegative()) {
            throw new IllegalArgumentException("refresh delay must not be negative");
        }
    }

    public static PreviewSettings defaults() {
        return new PreviewSettings(Optional.empty(), Optional.empty(), Optional.empty(), true, DEFAULT_REFRESH_DELAY);
    }

    /**
     * Settings file next to {@code sourceFile}, if any.
     */
    public static Optional<Path> locate(Path sourceFile) {
        if (sourceFile == null) {
            return Optional.empty();
        }
        Path parent = sourceFile.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return Optional.empty();
        }
        Path candidate = parent.resolve(FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static PreviewSettings load(Path path) throws IOException {
        return parse(Files.readString(path), path.toString());
    }

    public static PreviewSettings parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid settings " + origin + ": " + result.errors().get(0));
        }
        var preview = Optional.ofNullable(result.getTable("preview"));
        var refresh = Optional.ofNullable(result.getTable("refresh"));

        var format = preview.map(table -> table.getString("format")).map(OutputFormat::from);
        var debug = preview.map(table -> table.getBoolean("debug"));
        var title = preview.map(table -> table.getString("title")).filter(value -> !value.isBlank());
        boolean auto = refresh.map(table -> table.getBoolean("auto")).orElse(true);
        Duration delay = refresh.flatMap(PreviewSettings::readDelay).orElse(DEFAULT_REFRESH_DELAY);
        return new PreviewSettings(format, debug, title, auto, delay);
    }

    private static Optional<Duration> readDelay(TomlTable refresh) {
        Object raw = refresh.get("delay");
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Long millis) {
            return Optional.of(Duration.ofMillis(millis));
        }
        return DurationParser.parse(String.valueOf(raw));
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        format.ifPresent(value -> map.put("format", value.name().toLowerCase()));
        debug.ifPresent(value -> map.put("debug", value));
        title.ifPresent(value -> map.put("title", value));
        map.put("autoRefresh", autoRefresh);
        map.put("refreshDelay", DurationParser.format(refreshDelay));
        return map;
    }
}
