package work.lcod.preview.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the short durations used in settings files: {@code 250ms}, {@code 2s}, {@code 1m}, {@code 1h}.
 * A bare number is milliseconds.
 */
public final class DurationParser {
    private static final Pattern DURATION = Pattern.compile("^(\\d+)\\s*(ms|s|m|h)?$");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = DURATION.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw + " (expected e.g. 500ms, 2s, 1m)");
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        return Optional.of(switch (unit) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofMillis(amount);
        });
    }

    /** Inverse of {@link #parse} for whole units, e.g. {@code 500ms} or {@code 2s}. */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis != 0 && millis % 3_600_000L == 0) {
            return (millis / 3_600_000L) + "h";
        }
        if (millis != 0 && millis % 60_000L == 0) {
            return (millis / 60_000L) + "m";
        }
        if (millis != 0 && millis % 1_000L == 0) {
            return (millis / 1_000L) + "s";
        }
        return millis + "ms";
    }
}
