package io.shakemyleg.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.shakemyleg.core.error.IdentifierPathException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A runtime value: boolean, number, string or list of values.
 *
 * <p>
 * Implementations are a sealed hierarchy: all kinds are known at compile time
 * and every operator site handles each of them. There is no implicit coercion
 * between kinds except {@link #asBool()}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public sealed interface Value {

    /** Absolute tolerance used when comparing numbers for equality. */
    double EPSILON = 1e-5;

    /**
     * Boolean coercion used by branch conditions and {@code && ||}.
     *
     * <ul>
     * <li>{@link Bool}: as-is</li>
     * <li>{@link Num}: true iff non-zero</li>
     * <li>{@link Str}, {@link ListValue}: true iff non-empty</li>
     * </ul>
     */
    boolean asBool();

    /** Short kind name used in error messages. */
    String kind();

    /** Converts this value into a Jackson tree node. */
    JsonNode toJson();

    /**
     * Value equality: same-kind values compare by content (numbers within
     * {@link #EPSILON}, lists element-wise); values of different kinds are never
     * equal.
     */
    default boolean valueEquals(Value other) {
        return false;
    }

    static Bool of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Num of(double value) {
        return new Num(value);
    }

    static Str of(String value) {
        return new Str(value);
    }

    /**
     * Reads a value out of a Jackson tree node.
     *
     * @param node the node to convert
     * @param path identifier text used in the error message
     * @throws IdentifierPathException if the node is an object, {@code null} or
     *                                 missing, which name containers rather than
     *                                 values
     */
    static Value fromJson(JsonNode node, String path) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IdentifierPathException("\"" + path + "\" is null, which is not a value.");
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        if (node.isNumber()) {
            return of(node.doubleValue());
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                items.add(fromJson(node.get(i), path + "[" + i + "]"));
            }
            return new ListValue(items);
        }
        throw new IdentifierPathException("\"" + path + "\" refers to an object, not a value.");
    }

    // ── Implementations ──

    /** Boolean value. */
    record Bool(boolean value) implements Value {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public boolean asBool() {
            return value;
        }

        @Override
        public String kind() {
            return "bool";
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.booleanNode(value);
        }

        @Override
        public boolean valueEquals(Value other) {
            return other instanceof Bool b && b.value == value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /** Double-precision number. */
    record Num(double value) implements Value {

        @Override
        public boolean asBool() {
            return value != 0.0;
        }

        @Override
        public String kind() {
            return "number";
        }

        /**
         * Integral values that fit in a {@code long} are written as integer nodes
         * so hosts can read them back into integer fields. Infinities and NaN stay
         * double nodes; Jackson's default writer renders them as the strings
         * {@code "Infinity"}, {@code "-Infinity"} and {@code "NaN"}.
         */
        @Override
        public JsonNode toJson() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 0x1p63) {
                long asLong = (long) value;
                if (asLong == (int) asLong) {
                    return JsonNodeFactory.instance.numberNode((int) asLong);
                }
                return JsonNodeFactory.instance.numberNode(asLong);
            }
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public boolean valueEquals(Value other) {
            return other instanceof Num n && Math.abs(n.value - value) < EPSILON;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /** String value. */
    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean asBool() {
            return !value.isEmpty();
        }

        @Override
        public String kind() {
            return "string";
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }

        @Override
        public boolean valueEquals(Value other) {
            return other instanceof Str s && s.value.equals(value);
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * Immutable list of values. {@link #append(Value)} produces a new list and
     * leaves this one untouched.
     */
    record ListValue(List<Value> items) implements Value {
        public ListValue {
            Objects.requireNonNull(items, "items must not be null");
            items = List.copyOf(items);
        }

        @Override
        public boolean asBool() {
            return !items.isEmpty();
        }

        @Override
        public String kind() {
            return "list";
        }

        @Override
        public JsonNode toJson() {
            ArrayNode array = JsonNodeFactory.instance.arrayNode(items.size());
            for (Value item : items) {
                array.add(item.toJson());
            }
            return array;
        }

        @Override
        public boolean valueEquals(Value other) {
            if (!(other instanceof ListValue list) || list.items.size() != items.size()) {
                return false;
            }
            for (int i = 0; i < items.size(); i++) {
                if (!items.get(i).valueEquals(list.items.get(i))) {
                    return false;
                }
            }
            return true;
        }

        /** Returns a new list with {@code value} added at the end. */
        public ListValue append(Value value) {
            List<Value> copy = new ArrayList<>(items.size() + 1);
            copy.addAll(items);
            copy.add(value);
            return new ListValue(copy);
        }

        /** Returns {@code true} if any element is value-equal to {@code value}. */
        public boolean contains(Value value) {
            for (Value item : items) {
                if (item.valueEquals(value)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }
}
