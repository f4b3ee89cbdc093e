package minikv.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A decoded RESP element: simple string, bulk string or array of elements.
 */
public abstract class RespValue {

    public enum Type {
        SIMPLE_STRING,
        BULK_STRING,
        ARRAY
    }

    private RespValue() { }

    public abstract Type getType();

    /** True for the two string-typed variants. */
    public boolean isText() {
        return getType() != Type.ARRAY;
    }

    public static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    public static BulkString bulkString(String text) {
        return new BulkString(text);
    }

    public static Array array(List<RespValue> elements) {
        return new Array(elements);
    }

    public static Array array(RespValue... elements) {
        List<RespValue> list = new ArrayList<>(elements.length);
        Collections.addAll(list, elements);
        return new Array(list);
    }

    /** Common base of the two string variants. */
    public abstract static class Text extends RespValue {
        private final String text;

        Text(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        public String getText() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return text.equals(((Text) o).text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getType(), text);
        }
    }

    public static final class SimpleString extends Text {
        SimpleString(String text) {
            super(text);
        }

        @Override
        public Type getType() {
            return Type.SIMPLE_STRING;
        }

        @Override
        public String toString() {
            return "SimpleString(" + getText() + ")";
        }
    }

    public static final class BulkString extends Text {
        BulkString(String text) {
            super(text);
        }

        @Override
        public Type getType() {
            return Type.BULK_STRING;
        }

        @Override
        public String toString() {
            return "BulkString(" + getText() + ")";
        }
    }

    public static final class Array extends RespValue {
        private final List<RespValue> elements;

        Array(List<RespValue> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public Type getType() {
            return Type.ARRAY;
        }

        public List<RespValue> getElements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        public RespValue get(int index) {
            return elements.get(index);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            return elements.equals(((Array) o).elements);
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
