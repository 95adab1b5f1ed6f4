package io.shakemyleg.standalone.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shakemyleg.core.engine.StateMachine;
import io.shakemyleg.core.error.SmlRuntimeException;
import io.shakemyleg.core.error.ValueCodecException;
import io.shakemyleg.standalone.config.CycleMode;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a machine over a stream of JSON lines: one input object per line, one
 * cycle per input, one compact JSON output line per cycle. Blank lines are
 * skipped. Reading stops at end of input or when the machine ends.
 *
 * <p>
 * A runtime error either aborts the run (fail-fast) or is written in place of
 * the output as {@code {"error": "...", "state": "..."}} before the next line
 * is read. A line that is not valid JSON is treated as a runtime error of the
 * current state.
 *
 * <p>
 * Non-finite numbers such as the result of {@code 1 / 0} are written as the
 * JSON strings {@code "Infinity"}, {@code "-Infinity"} and {@code "NaN"}. Read
 * back as input they are strings, not numbers.
 */
public final class ScriptRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

    private final StateMachine machine;
    private final CycleMode mode;
    private final boolean failFast;
    private final ObjectMapper mapper;

    public ScriptRunner(StateMachine machine, CycleMode mode, boolean failFast) {
        this(machine, mode, failFast, new ObjectMapper());
    }

    public ScriptRunner(StateMachine machine, CycleMode mode, boolean failFast, ObjectMapper mapper) {
        this.machine = Objects.requireNonNull(machine, "machine must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.failFast = failFast;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /** Outcome of a run. */
    public record Summary(int cycles, int errors, boolean ended) {}

    /**
     * Runs until the input is exhausted or the machine ends.
     *
     * @throws SmlRuntimeException in fail-fast mode, the first runtime error
     * @throws IOException         if reading input or writing output fails
     */
    public Summary run(BufferedReader in, PrintWriter out) throws IOException {
        int cycles = 0;
        int errors = 0;
        int lineNo = 0;
        String line;
        while (!machine.isEnded() && (line = in.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            cycles++;
            String state = machine.currentState().orElse(null);
            try {
                Optional<ObjectNode> outputs = cycle(parse(line, lineNo));
                if (outputs.isPresent()) {
                    out.println(mapper.writeValueAsString(outputs.get()));
                }
            } catch (SmlRuntimeException e) {
                errors++;
                LOG.warn("cycle.error: line={}, state={}, error={}", lineNo, state, e.getMessage());
                if (failFast) {
                    out.flush();
                    throw e;
                }
                out.println(errorLine(e, state));
            }
            out.flush();
            if (out.checkError()) {
                throw new IOException("Failed to write output");
            }
        }

        Summary summary = new Summary(cycles, errors, machine.isEnded());
        LOG.info(
                "run.complete: cycles={}, errors={}, ended={}, final_state={}",
                summary.cycles(),
                summary.errors(),
                summary.ended(),
                machine.currentState().orElse("<ended>"));
        return summary;
    }

    private Optional<ObjectNode> cycle(JsonNode input) {
        return mode == CycleMode.ADVANCE ? machine.advance(input) : machine.run(input);
    }

    private JsonNode parse(String line, int lineNo) {
        try {
            return mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ValueCodecException(
                    "Malformed JSON on input line " + lineNo + ": " + e.getOriginalMessage(), e);
        }
    }

    private String errorLine(SmlRuntimeException e, String state) throws JsonProcessingException {
        ObjectNode error = mapper.createObjectNode();
        error.put("error", e.getMessage());
        String failedState = e.stateName() != null ? e.stateName() : state;
        if (failedState == null) {
            error.putNull("state");
        } else {
            error.put("state", failedState);
        }
        return mapper.writeValueAsString(error);
    }
}
