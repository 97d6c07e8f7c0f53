package work.lcod.preview.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.preview.api.LogLevel;
import work.lcod.preview.api.OutputFormat;
import work.lcod.preview.api.PreviewConfiguration;
import work.lcod.preview.api.PreviewResult;
import work.lcod.preview.api.PreviewRunner;
import work.lcod.preview.api.PreviewSettings;
import work.lcod.preview.api.PreviewSource;
import work.lcod.preview.parser.SourceParser;

@CommandLine.Command(
    name = "tk-preview",
    description = "Render a static HTML preview of the Tkinter widgets declared in Python sources.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PreviewCommand implements Callable<Integer> {
    static final int EXIT_NO_TKINTER = 3;
    private static final String LOG_LEVEL_ENV = "TK_PREVIEW_LOG_LEVEL";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--source"},
        required = true,
        description = "Python source file(s) to preview.",
        arity = "1..*"
    )
    private List<String> sources = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (html|json|yaml|markup, default: html).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Write the output to PATH instead of stdout (single source only).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(names = "--debug", description = "Append the debug section (imports, widget tree).")
    private boolean debug;

    @CommandLine.Option(
        names = "--title",
        description = "Page title of the HTML document (default: Tkinter Preview).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String title;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "Settings file (default: tk-preview.toml next to each source).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--check",
        description = "Only report whether each source imports tkinter (exit 3 when one does not)."
    )
    private boolean check;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold on stderr (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private LogLevel logLevel = LogLevel.WARN;

    @Override
    public Integer call() throws Exception {
        if (sources == null || sources.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one --source value is required.");
        }
        if (sources.size() > 1 && output != null && !output.isBlank()) {
            throw new CommandLine.ParameterException(
                spec.commandLine(),
                "When using multiple --source values, --output is not supported."
            );
        }

        logLevel = resolveLogLevel();
        OutputFormat format = parseFormat();
        List<Path> paths = new ArrayList<>();
        for (String raw : sources) {
            paths.add(resolveSource(raw));
        }

        return check ? checkImports(paths) : render(paths, format);
    }

    private int checkImports(List<Path> paths) throws IOException {
        int exitCode = 0;
        for (Path path : paths) {
            boolean found = SourceParser.hasRelevantImport(Files.readString(path, StandardCharsets.UTF_8));
            out().println(path + ": " + (found ? "tkinter import found" : "no tkinter import"));
            if (!found) {
                exitCode = EXIT_NO_TKINTER;
            }
        }
        return exitCode;
    }

    private int render(List<Path> paths, OutputFormat format) throws IOException {
        var runner = new PreviewRunner();
        int exitCode = 0;
        for (Path path : paths) {
            var settings = loadSettings(path);
            var builder = PreviewConfiguration.builder()
                .source(PreviewSource.forFile(path))
                .logLevel(logLevel)
                .settings(settings);
            if (format != null) {
                builder.format(format);
            }
            if (debug) {
                builder.debug(true);
            }
            if (title != null && !title.isBlank()) {
                builder.documentTitle(title);
            }
            var configuration = builder.build();

            log(LogLevel.DEBUG, "Previewing %s as %s", path, configuration.format().name().toLowerCase());
            PreviewResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            report(path, result);
            emit(configuration.format(), result);
        }
        return exitCode;
    }

    private void report(Path path, PreviewResult result) {
        if (result.status() == PreviewResult.Status.FAILURE) {
            log(LogLevel.ERROR, "%s", result.metadata().get("error"));
            return;
        }
        if (Boolean.FALSE.equals(result.metadata().get("hasTkinterImport"))) {
            log(LogLevel.WARN, "%s does not import tkinter; rendering anyway", path);
        }
        for (String error : result.errors()) {
            log(LogLevel.WARN, "%s: %s", path.getFileName(), error);
        }
        log(LogLevel.INFO, "%s: %s", path.getFileName(), result.status().name().toLowerCase());
    }

    private void emit(OutputFormat format, PreviewResult result) throws IOException {
        String text = switch (format) {
            case JSON -> result.toPrettyJson();
            case YAML -> result.toYaml();
            case HTML -> result.status() == PreviewResult.Status.FAILURE ? "" : result.document();
            case MARKUP -> result.status() == PreviewResult.Status.FAILURE ? "" : result.markup();
        };
        if (text.isEmpty()) {
            return;
        }
        if (output != null && !output.isBlank()) {
            Path target = Paths.get(output).toAbsolutePath().normalize();
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8);
            log(LogLevel.INFO, "Wrote %s", target);
            return;
        }
        out().println(text);
    }

    private PreviewSettings loadSettings(Path source) throws IOException {
        if (config != null && !config.isBlank()) {
            Path path = Paths.get(config).toAbsolutePath().normalize();
            if (!Files.isRegularFile(path)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Settings file not found: " + path);
            }
            return PreviewSettings.load(path);
        }
        var located = PreviewSettings.locate(source);
        if (located.isPresent()) {
            log(LogLevel.DEBUG, "Using settings %s", located.get());
            return PreviewSettings.load(located.get());
        }
        return PreviewSettings.defaults();
    }

    private Path resolveSource(String value) {
        Path path = Paths.get(value).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Source file not found: " + path);
        }
        return path;
    }

    private OutputFormat parseFormat() {
        if (formatRaw == null || formatRaw.isBlank()) {
            return null;
        }
        try {
            return OutputFormat.from(formatRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        if (candidate == null || candidate.isBlank()) {
            candidate = "warn";
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private void log(LogLevel level, String format, Object... args) {
        if (logLevel.allows(level)) {
            err().printf("[" + level.name().toLowerCase() + "] " + format + "%n", args);
        }
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
