package work.lcod.preview.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PreviewSettingsTest {
    @Test
    void defaultsRefreshAfterHalfASecond() {
        var settings = PreviewSettings.defaults();
        assertTrue(settings.autoRefresh());
        assertEquals(Duration.ofMillis(500), settings.refreshDelay());
        assertTrue(settings.format().isEmpty());
    }

    @Test
    void loadsFileNextToSource() throws Exception {
        var source = Path.of("src", "test", "resources", "samples", "configured", "app.py");
        var located = PreviewSettings.locate(source);
        assertTrue(located.isPresent());

        var settings = PreviewSettings.load(located.get());
        assertEquals(Optional.of(OutputFormat.MARKUP), settings.format());
        assertEquals(Optional.of("Configured Preview"), settings.title());
        assertTrue(settings.debug().isEmpty());
        assertFalse(settings.autoRefresh());
        assertEquals(Duration.ofSeconds(2), settings.refreshDelay());
        assertEquals("2s", settings.toSerializableMap().get("refreshDelay"));
    }

    @Test
    void integerDelayIsMilliseconds() {
        var settings = PreviewSettings.parse("[refresh]\ndelay = 250\n", "inline");
        assertEquals(Duration.ofMillis(250), settings.refreshDelay());
        assertTrue(settings.autoRefresh());
    }

    @Test
    void missingFileIsNotLocated(@TempDir Path dir) throws Exception {
        var source = dir.resolve("app.py");
        Files.writeString(source, "import tkinter\n");
        assertTrue(PreviewSettings.locate(source).isEmpty());
    }

    @Test
    void rejectsInvalidToml() {
        var ex = assertThrows(IllegalArgumentException.class, () -> PreviewSettings.parse("[preview\n", "broken.toml"));
        assertTrue(ex.getMessage().startsWith("Invalid settings broken.toml"));
    }

    @Test
    void rejectsUnknownFormat() {
        assertThrows(IllegalArgumentException.class, () -> PreviewSettings.parse("[preview]\nformat = \"pdf\"\n", "x"));
    }

    @Test
    void configurationBuilderAppliesSettingsThenOverrides() {
        var settings = PreviewSettings.parse("[preview]\nformat = \"json\"\ndebug = true\ntitle = \"From file\"\n", "x");
        var configuration = PreviewConfiguration.builder()
            .source(PreviewSource.forText("buffer.py", ""))
            .settings(settings)
            .documentTitle("From flag")
            .build();

        assertEquals(OutputFormat.JSON, configuration.format());
        assertTrue(configuration.debug());
        assertEquals("From flag", configuration.documentTitle());
        assertEquals(LogLevel.WARN, configuration.logLevel());
    }
}
