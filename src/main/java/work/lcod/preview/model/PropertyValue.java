package work.lcod.preview.model;

import java.util.Objects;

/**
 * Typed value of a widget property or layout option, fixed when the source literal is read.
 */
public sealed interface PropertyValue
    permits PropertyValue.Text, PropertyValue.Int, PropertyValue.Decimal, PropertyValue.Bool, PropertyValue.Null, PropertyValue.Symbol {

    /** Plain Java value for serialization ({@code String}, {@code Long}, {@code Double}, {@code Boolean} or null). */
    Object toPlain();

    /** Text as a user would read it; symbols keep their source spelling. */
    String display();

    static PropertyValue text(String value) {
        return new Text(value);
    }

    static PropertyValue integer(long value) {
        return new Int(value);
    }

    static PropertyValue decimal(double value) {
        return new Decimal(value);
    }

    static PropertyValue bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static PropertyValue none() {
        return Null.INSTANCE;
    }

    static PropertyValue symbol(String source) {
        return new Symbol(source);
    }

    record Text(String value) implements PropertyValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String display() {
            return value;
        }
    }

    /** Integer literal, kept exactly as written. */
    record Int(long value) implements PropertyValue {
        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String display() {
            return Long.toString(value);
        }
    }

    record Decimal(double value) implements PropertyValue {
        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String display() {
            return Double.toString(value);
        }
    }

    record Bool(boolean value) implements PropertyValue {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String display() {
            return value ? "True" : "False";
        }
    }

    final class Null implements PropertyValue {
        static final Null INSTANCE = new Null();

        private Null() {}

        @Override
        public Object toPlain() {
            return null;
        }

        @Override
        public String display() {
            return "None";
        }

        @Override
        public String toString() {
            return "Null";
        }
    }

    /** Anything that is not a literal: names, attribute access, calls, tuples. */
    record Symbol(String source) implements PropertyValue {
        public Symbol {
            Objects.requireNonNull(source, "source");
        }

        @Override
        public Object toPlain() {
            return source;
        }

        @Override
        public String display() {
            return source;
        }
    }
}
