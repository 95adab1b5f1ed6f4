package io.shakemyleg.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * The three value trees one cycle evaluates against. Inputs are never written;
 * outputs and globals are mutated in place by assignments.
 *
 * @param inputs  read-only host input
 * @param outputs this cycle's outputs
 * @param globals the machine's persistent globals
 */
public record Stores(JsonNode inputs, ObjectNode outputs, ObjectNode globals) {

    public Stores {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(outputs, "outputs must not be null");
        Objects.requireNonNull(globals, "globals must not be null");
    }

    /** Returns the root node of {@code store}. */
    public JsonNode root(Store store) {
        return switch (store) {
            case INPUTS -> inputs;
            case OUTPUTS -> outputs;
            case GLOBALS -> globals;
        };
    }
}
