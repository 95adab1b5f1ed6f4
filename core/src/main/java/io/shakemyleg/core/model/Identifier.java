package io.shakemyleg.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shakemyleg.core.error.IdentifierNameException;
import io.shakemyleg.core.error.IdentifierPathException;
import io.shakemyleg.core.error.InputsWriteException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A dotted path into one of the three stores, e.g. {@code globals.motor.speed}.
 * The leading store keyword is held separately in {@link #store()}; {@link #path()}
 * holds the remaining segments and is never empty.
 *
 * <p>
 * Reads require every segment to exist and every intermediate node to be an
 * object. Writes create missing intermediate objects on the way.
 *
 * @param store the store the path starts from
 * @param path  the segments after the store keyword
 */
public record Identifier(Store store, List<String> path) {

    /** Shape of every path segment after the store keyword. */
    public static final Pattern SEGMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Identifier {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("identifier path must have at least one segment after the store");
        }
        path = List.copyOf(path);
    }

    /**
     * Parses identifier text such as {@code outputs.a.b}.
     *
     * @return the identifier, or {@code null} if the text does not name a store
     *         followed by one or more segments matching {@link #SEGMENT}
     */
    public static Identifier parse(String text) {
        String[] segments = text.split("\\.", -1);
        if (segments.length < 2) {
            return null;
        }
        Store store = Store.fromKeyword(segments[0]);
        if (store == null) {
            return null;
        }
        for (int i = 1; i < segments.length; i++) {
            if (!SEGMENT.matcher(segments[i]).matches()) {
                return null;
            }
        }
        return new Identifier(store, List.of(segments).subList(1, segments.length));
    }

    /**
     * Reads the value at this path.
     *
     * @throws IdentifierNameException if a segment is missing or an intermediate
     *                                 node is not an object
     * @throws IdentifierPathException if the path ends on an object or
     *                                 {@code null}
     */
    public Value get(Stores stores) {
        JsonNode node = stores.root(store);
        for (String segment : path) {
            if (node == null || !node.isObject()) {
                throw new IdentifierNameException(toString());
            }
            node = node.get(segment);
        }
        if (node == null) {
            throw new IdentifierNameException(toString());
        }
        return Value.fromJson(node, toString());
    }

    /**
     * Writes {@code value} at this path, creating missing intermediate objects.
     *
     * @throws InputsWriteException    if this identifier addresses
     *                                 {@code inputs}
     * @throws IdentifierPathException if an intermediate segment already holds a
     *                                 non-object value
     */
    public void set(Stores stores, Value value) {
        if (store == Store.INPUTS) {
            throw new InputsWriteException(toString());
        }
        ObjectNode node = (ObjectNode) stores.root(store);
        for (int i = 0; i < path.size() - 1; i++) {
            String segment = path.get(i);
            JsonNode child = node.get(segment);
            if (child == null) {
                node = node.putObject(segment);
            } else if (child.isObject()) {
                node = (ObjectNode) child;
            } else {
                throw new IdentifierPathException("Cannot write \"" + this + "\": \"" + segment
                        + "\" already holds a non-object value.");
            }
        }
        node.set(path.get(path.size() - 1), value.toJson());
    }

    @Override
    public String toString() {
        return store.keyword() + "." + String.join(".", path);
    }
}
