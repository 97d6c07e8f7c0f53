package work.lcod.preview.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.preview.model.PropertyBag;
import work.lcod.preview.model.PropertyValue;

/**
 * Splits call arguments and types their literals. Works on a single line of text: quotes do not nest
 * and no escape sequences are interpreted.
 */
public final class ArgumentList {
    private static final Pattern KEYWORD = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)(.*)$", Pattern.DOTALL);
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d*\\.\\d+$");

    private final Optional<String> parent;
    private final List<String> positional;
    private final PropertyBag keywords;

    private ArgumentList(Optional<String> parent, List<String> positional, PropertyBag keywords) {
        this.parent = parent;
        this.positional = positional;
        this.keywords = keywords;
    }

    /** First positional argument, read as the name of the parent widget. */
    public Optional<String> parent() {
        return parent;
    }

    public List<String> positional() {
        return positional;
    }

    public PropertyBag keywords() {
        return keywords;
    }

    public static ArgumentList parse(String argsText) {
        var positional = new ArrayList<String>();
        var keywords = new PropertyBag();
        if (argsText != null && !argsText.isBlank()) {
            for (String raw : split(argsText)) {
                String arg = raw.trim();
                if (arg.isEmpty()) {
                    continue;
                }
                var keyword = KEYWORD.matcher(arg);
                if (keyword.matches()) {
                    keywords.put(keyword.group(1), parseLiteral(keyword.group(2)));
                } else {
                    positional.add(arg);
                }
            }
        }
        Optional<String> parent = positional.isEmpty() ? Optional.empty() : Optional.of(positional.get(0));
        return new ArgumentList(parent, List.copyOf(positional), keywords);
    }

    /** Keyword arguments only; positional arguments are dropped. */
    public static PropertyBag parseKeywords(String argsText) {
        return parse(argsText).keywords();
    }

    /**
     * Splits on commas that sit outside quotes and outside any bracket pair.
     */
    public static List<String> split(String argsText) {
        var args = new ArrayList<String>();
        var current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < argsText.length(); i++) {
            char c = argsText.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                args.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) {
            args.add(current.toString());
        }
        return args;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1 when the call does not close on
     * this line.
     */
    public static int findClosingParen(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '(') {
            return -1;
        }
        char quote = 0;
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static PropertyValue parseLiteral(String raw) {
        String value = raw == null ? "" : raw.trim();
        switch (value) {
            case "True":
                return PropertyValue.bool(true);
            case "False":
                return PropertyValue.bool(false);
            case "None":
                return PropertyValue.none();
            default:
                break;
        }
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return PropertyValue.text(value.substring(1, value.length() - 1));
            }
        }
        if (INTEGER.matcher(value).matches()) {
            try {
                return PropertyValue.integer(Long.parseLong(value));
            } catch (NumberFormatException ex) {
                return PropertyValue.decimal(Double.parseDouble(value));
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return PropertyValue.decimal(Double.parseDouble(value));
        }
        return PropertyValue.symbol(value);
    }
}
