package work.lcod.preview.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Insertion-ordered property map with typed accessors. Shared by widget properties and layout options.
 */
public final class PropertyBag {
    private final Map<String, PropertyValue> values = new LinkedHashMap<>();

    public PropertyBag() {}

    public PropertyBag(Map<String, PropertyValue> initial) {
        if (initial != null) {
            values.putAll(initial);
        }
    }

    public Optional<PropertyValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /**
     * Present with a value other than {@code None}.
     */
    public boolean isSet(String key) {
        var value = values.get(key);
        return value != null && !(value instanceof PropertyValue.Null);
    }

    public PropertyBag put(String key, PropertyValue value) {
        values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public boolean putIfAbsent(String key, PropertyValue value) {
        if (values.containsKey(key)) {
            return false;
        }
        put(key, value);
        return true;
    }

    /** Copies every entry of {@code other}, overwriting existing keys in place. */
    public PropertyBag merge(PropertyBag other) {
        if (other != null) {
            values.putAll(other.values);
        }
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public PropertyBag copy() {
        return new PropertyBag(values);
    }

    /**
     * Text shown for the value (string literal contents or symbol source); empty when absent or None.
     */
    public Optional<String> text(String key) {
        if (!isSet(key)) {
            return Optional.empty();
        }
        return Optional.of(values.get(key).display());
    }

    /**
     * Integer reading of the value: decimals are truncated, strings contribute their leading digits
     * ({@code "10px"} reads as 10). Empty when nothing numeric can be read or the value does not fit an int.
     */
    public OptionalInt integer(String key) {
        var value = values.get(key);
        if (value instanceof PropertyValue.Int number) {
            return toInt(number.value());
        }
        if (value instanceof PropertyValue.Decimal number) {
            return Double.isFinite(number.value()) ? toInt((long) number.value()) : OptionalInt.empty();
        }
        if (value instanceof PropertyValue.Text text) {
            return leadingInteger(text.value());
        }
        if (value instanceof PropertyValue.Symbol symbol) {
            return leadingInteger(symbol.source());
        }
        return OptionalInt.empty();
    }

    /**
     * Integers of a scalar or of a two-sided tuple such as {@code (10, 20)}; empty when any item is not numeric.
     */
    public Optional<List<Integer>> integers(String key) {
        var value = values.get(key);
        if (value instanceof PropertyValue.Int || value instanceof PropertyValue.Decimal) {
            var single = integer(key);
            return single.isPresent() ? Optional.of(List.of(single.getAsInt())) : Optional.empty();
        }
        if (!(value instanceof PropertyValue.Text) && !(value instanceof PropertyValue.Symbol)) {
            return Optional.empty();
        }
        String raw = value.display().trim();
        if (raw.length() >= 2 && (raw.startsWith("(") && raw.endsWith(")") || raw.startsWith("[") && raw.endsWith("]"))) {
            raw = raw.substring(1, raw.length() - 1);
        }
        var result = new ArrayList<Integer>();
        for (String item : raw.split(",")) {
            if (item.isBlank()) {
                continue;
            }
            var parsed = leadingInteger(item);
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            result.add(parsed.getAsInt());
        }
        return result.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(result));
    }

    /**
     * Lowercase keyword for option values such as {@code side} or {@code fill}. String literals are taken
     * as written; symbols are resolved through {@link TkConstants}.
     */
    public Optional<String> keyword(String key) {
        var value = values.get(key);
        if (value instanceof PropertyValue.Text text) {
            return Optional.of(text.value());
        }
        if (value instanceof PropertyValue.Symbol symbol) {
            return Optional.of(TkConstants.resolve(symbol.source()).orElse(symbol.source()));
        }
        if (value == null || value instanceof PropertyValue.Null) {
            return Optional.empty();
        }
        return Optional.of(value.display());
    }

    public Map<String, Object> toPlainMap() {
        var plain = new LinkedHashMap<String, Object>();
        values.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    // out-of-range values read as absent rather than wrapping
    private static OptionalInt toInt(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) value);
    }

    static OptionalInt leadingInteger(String raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        String trimmed = raw.trim();
        int end = 0;
        if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(trimmed.substring(0, end)));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PropertyBag bag && values.equals(bag.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
