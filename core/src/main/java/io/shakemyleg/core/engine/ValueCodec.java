package io.shakemyleg.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shakemyleg.core.error.ValueCodecException;
import java.util.Objects;

/**
 * Converts host values to and from the {@link ObjectNode} trees that back the
 * three stores.
 *
 * <p>
 * Host values may be records, POJOs, {@code Map}s or {@link JsonNode}s; anything
 * that does not map to a JSON object is rejected. Thread-safe.
 */
public final class ValueCodec {

    private final ObjectMapper mapper;

    public ValueCodec() {
        this(new ObjectMapper());
    }

    public ValueCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Encodes a host value as an object tree. {@code null} encodes as an empty
     * object. A {@link JsonNode} argument is returned as-is when it already is an
     * object.
     *
     * @param value the host value
     * @param role  which store the value is destined for, used in error messages
     * @throws ValueCodecException if the value cannot be converted or is not an
     *                             object
     */
    public ObjectNode encode(Object value, String role) {
        if (value == null) {
            return mapper.createObjectNode();
        }
        JsonNode tree;
        if (value instanceof JsonNode node) {
            tree = node;
        } else {
            try {
                tree = mapper.valueToTree(value);
            } catch (IllegalArgumentException e) {
                throw new ValueCodecException(
                        "Cannot encode " + role + " of type " + value.getClass().getName() + ": " + e.getMessage(), e);
            }
        }
        if (tree instanceof ObjectNode object) {
            return object;
        }
        throw new ValueCodecException(
                "Expected " + role + " to encode as a JSON object, got " + tree.getNodeType().name().toLowerCase());
    }

    /**
     * Decodes an object tree into the host type.
     *
     * @throws ValueCodecException if the tree does not fit {@code type}
     */
    public <T> T decode(ObjectNode tree, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isInstance(tree)) {
            return type.cast(tree);
        }
        try {
            return mapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValueCodecException("Cannot decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
