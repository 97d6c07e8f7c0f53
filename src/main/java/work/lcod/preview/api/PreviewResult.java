package work.lcod.preview.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link PreviewRunner} run (usable by the CLI and embedding editors).
 */
public record PreviewResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(new YAMLFactory()).writer();

    public PreviewResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static PreviewResult success(Map<String, Object> metadata, Instant startedAt) {
        return new PreviewResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static PreviewResult degraded(Map<String, Object> metadata, Instant startedAt) {
        return new PreviewResult(Status.DEGRADED, metadata, startedAt, Instant.now());
    }

    public static PreviewResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new PreviewResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public PreviewResult withSerializedPayload(String payload) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("payload", payload);
        return new PreviewResult(status, meta, startedAt, finishedAt);
    }

    public String markup() {
        return stringEntry("markup");
    }

    public String document() {
        return stringEntry("document");
    }

    @SuppressWarnings("unchecked")
    public List<String> errors() {
        Object raw = metadata.get("errors");
        return raw instanceof List<?> list ? (List<String>) list : List.of();
    }

    private String stringEntry(String key) {
        Object raw = metadata.get(key);
        return raw == null ? "" : raw.toString();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public String toYaml() {
        try {
            return YAML_WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "status: error\nmessage: \"" + ex.getMessage() + "\"\n";
        }
    }

    public enum Status {
        /** Rendered without diagnostics. */
        SUCCESS(0),
        /** Rendered, but the parse or conversion reported errors. */
        DEGRADED(0),
        /** Nothing rendered (unreadable source). */
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
