package work.lcod.preview.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Python source to preview: a file on disk or text handed over by an editor buffer.
 */
public record PreviewSource(Optional<Path> localPath, Optional<String> inlineText, String displayName) {
    public PreviewSource {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(inlineText, "inlineText");
        Objects.requireNonNull(displayName, "displayName");
        if (localPath.isEmpty() && inlineText.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or inlineText must be present.");
        }
    }

    public static PreviewSource forFile(Path path) {
        var normalized = path.toAbsolutePath().normalize();
        var fileName = normalized.getFileName();
        return new PreviewSource(Optional.of(normalized), Optional.empty(), fileName == null ? normalized.toString() : fileName.toString());
    }

    public static PreviewSource forText(String displayName, String text) {
        return new PreviewSource(Optional.empty(), Optional.of(text == null ? "" : text), displayName == null ? "<buffer>" : displayName);
    }

    public String read() throws IOException {
        if (inlineText.isPresent()) {
            return inlineText.get();
        }
        return Files.readString(localPath.orElseThrow(), StandardCharsets.UTF_8);
    }

    public String display() {
        return localPath.map(Path::toString).orElse(displayName);
    }
}
