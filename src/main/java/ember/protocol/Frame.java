package ember.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One decoded unit of the wire protocol.
 *
 * <p>The set of variants is closed: the constructor is private and every
 * variant is a nested final class. Callers dispatch with a {@code switch} on
 * {@link #type()} and then cast, or use the typed accessors of the variant.
 */
public abstract class Frame {

    public enum Type {
        SIMPLE_STRING('+'),
        ERROR('-'),
        INTEGER(':'),
        BOOLEAN('#'),
        DOUBLE(','),
        BULK_STRING('$'),
        NULL('_'),
        ARRAY('*');

        private final byte tag;

        Type(char tag) {
            this.tag = (byte) tag;
        }

        public byte tag() {
            return tag;
        }

        public static Type fromTag(byte tag) {
            for (Type t : values()) {
                if (t.tag == tag) return t;
            }
            return null;
        }
    }

    private Frame() {
    }

    public abstract Type type();

    // --- FACTORIES ---

    public static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    public static Error error(String text) {
        return new Error(text);
    }

    /** Like {@link #error} but folds line breaks, for messages taken from exceptions. */
    public static Error errorFrom(String message) {
        return new Error(message.replace('\r', ' ').replace('\n', ' '));
    }

    public static Integer integer(long value) {
        return new Integer(value);
    }

    public static Boolean bool(boolean value) {
        return value ? Boolean.TRUE : Boolean.FALSE;
    }

    public static Double dbl(double value) {
        return new Double(value);
    }

    public static BulkString bulk(byte[] data) {
        return new BulkString(data);
    }

    public static BulkString bulk(String text) {
        return new BulkString(text.getBytes(StandardCharsets.UTF_8));
    }

    public static Null nil() {
        return Null.INSTANCE;
    }

    public static Array array(List<Frame> elements) {
        return new Array(elements);
    }

    public static Array array(Frame... elements) {
        return new Array(Arrays.asList(elements));
    }

    /** Request shape used by clients: an array of bulk strings. */
    public static Array command(String... parts) {
        List<Frame> elements = new ArrayList<>(parts.length);
        for (String part : parts) elements.add(bulk(part));
        return new Array(elements);
    }

    private static String requireLine(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("line frames cannot contain CR or LF");
        }
        // Unpaired surrogates would be replaced on the wire
        if (!StandardCharsets.UTF_8.newEncoder().canEncode(text)) {
            throw new IllegalArgumentException("line frames must be valid UTF-16 text");
        }
        return text;
    }

    // --- VARIANTS ---

    public static final class SimpleString extends Frame {
        private final String text;

        private SimpleString(String text) {
            this.text = requireLine(text);
        }

        public String text() {
            return text;
        }

        @Override
        public Type type() {
            return Type.SIMPLE_STRING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleString && ((SimpleString) o).text.equals(text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Type.SIMPLE_STRING, text);
        }

        @Override
        public String toString() {
            return "SimpleString(" + text + ")";
        }
    }

    public static final class Error extends Frame {
        private final String message;

        private Error(String message) {
            this.message = requireLine(message);
        }

        public String message() {
            return message;
        }

        @Override
        public Type type() {
            return Type.ERROR;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Error && ((Error) o).message.equals(message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Type.ERROR, message);
        }

        @Override
        public String toString() {
            return "Error(" + message + ")";
        }
    }

    public static final class Integer extends Frame {
        private final long value;

        private Integer(long value) {
            this.value = value;
        }

        public long value() {
            return value;
        }

        @Override
        public Type type() {
            return Type.INTEGER;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Integer && ((Integer) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return "Integer(" + value + ")";
        }
    }

    public static final class Boolean extends Frame {
        static final Boolean TRUE = new Boolean(true);
        static final Boolean FALSE = new Boolean(false);

        private final boolean value;

        private Boolean(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Type type() {
            return Type.BOOLEAN;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Boolean && ((Boolean) o).value == value;
        }

        @Override
        public int hashCode() {
            return java.lang.Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return "Boolean(" + value + ")";
        }
    }

    public static final class Double extends Frame {
        private final double value;

        private Double(double value) {
            this.value = value;
        }

        public double value() {
            return value;
        }

        @Override
        public Type type() {
            return Type.DOUBLE;
        }

        // NaN equals NaN, -0.0 differs from 0.0
        @Override
        public boolean equals(Object o) {
            return o instanceof Double && java.lang.Double.compare(((Double) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return java.lang.Double.hashCode(value);
        }

        @Override
        public String toString() {
            return "Double(" + value + ")";
        }
    }

    public static final class BulkString extends Frame {
        private final byte[] data;

        private BulkString(byte[] data) {
            this.data = Objects.requireNonNull(data, "data").clone();
        }

        /** Returns a copy of the payload. */
        public byte[] data() {
            return data.clone();
        }

        public int length() {
            return data.length;
        }

        public String text() {
            return new String(data, StandardCharsets.UTF_8);
        }

        byte[] rawData() {
            return data;
        }

        @Override
        public Type type() {
            return Type.BULK_STRING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BulkString && Arrays.equals(((BulkString) o).data, data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "BulkString(" + text() + ")";
        }
    }

    public static final class Null extends Frame {
        static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public Type type() {
            return Type.NULL;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Null;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "Null";
        }
    }

    public static final class Array extends Frame {
        private final List<Frame> elements;

        private Array(List<Frame> elements) {
            Objects.requireNonNull(elements, "elements");
            for (Frame f : elements) Objects.requireNonNull(f, "array element");
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public List<Frame> elements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Array && ((Array) o).elements.equals(elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "Array" + elements;
        }
    }
}
