package io.shakemyleg.core.spec;

import io.shakemyleg.core.engine.CompileOptions;
import io.shakemyleg.core.engine.StateMachine;
import io.shakemyleg.core.engine.StateRegistry;
import io.shakemyleg.core.engine.TransitionCheck;
import io.shakemyleg.core.error.ScriptLoadException;
import io.shakemyleg.core.error.SmlSyntaxError;
import io.shakemyleg.core.model.Expression;
import io.shakemyleg.core.model.State;
import io.shakemyleg.core.model.StateBranch;
import io.shakemyleg.core.model.StateOp;
import io.shakemyleg.core.model.Value;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles shakemyleg source text into a {@link StateMachine}.
 *
 * <p>
 * The outer grammar is indentation-structured:
 *
 * <pre>
 * default head:
 *   outputs.count = globals.count
 *
 * state idle:
 *   head:
 *     outputs.state = "idle"
 *   when inputs.go:
 *     changeto running
 *   otherwise:
 *     stay
 * </pre>
 *
 * <p>
 * A single forward pass over the lines drives a stack of parse states
 * ({@code TOP_LEVEL}, {@code STATE}, {@code STATE_HEAD}, {@code STATE_BRANCH},
 * {@code DEFAULT_HEAD}). The indent unit is taken from the first line seen
 * inside a {@code state} or {@code default head} block; branch bodies and state
 * heads sit two units deep. A line that does not reach the current depth
 * closes the open block and is processed again one level up. Comment lines
 * ({@code #}) and blank lines are ignored everywhere.
 *
 * <p>
 * Thread-safe: every {@link #compile} call uses its own scratch state.
 */
public final class BlockCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(BlockCompiler.class);

    private static final String STATE_PREFIX = "state ";
    private static final String DEFAULT_HEAD = "default head:";
    private static final String WHEN_PREFIX = "when ";
    private static final String CHANGETO = "changeto";

    private final CompileOptions options;

    /** Creates a compiler with {@link CompileOptions#defaults()}. */
    public BlockCompiler() {
        this(CompileOptions.defaults());
    }

    public BlockCompiler(CompileOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Reads and compiles a script file (UTF-8).
     *
     * @throws ScriptLoadException if the file cannot be read
     * @throws SmlSyntaxError      if the source is malformed
     */
    public StateMachine compile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptLoadException("Failed to read script: " + path, e, path.toString());
        }
        return compile(source);
    }

    /**
     * Compiles source text. The first {@code state} block in the text becomes the
     * machine's initial state.
     *
     * @throws SmlSyntaxError if the source is malformed; no machine is produced
     */
    public StateMachine compile(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Pass pass = new Pass(source.split("\\r?\\n", -1));
        pass.run();

        if (pass.states.isEmpty()) {
            throw new SmlSyntaxError("No states defined.", 0);
        }
        if (options.transitionCheck() == TransitionCheck.STRICT) {
            for (PendingTransition pending : pass.transitions) {
                if (!pass.states.containsKey(pending.target())) {
                    throw new SmlSyntaxError(
                            String.format(
                                    "Transition to undefined state '%s' on line %d.", pending.target(), pending.line()),
                            pending.line(),
                            pending.column());
                }
            }
        }

        StateRegistry registry = new StateRegistry(pass.states);
        String initial = pass.states.keySet().iterator().next();
        LOG.debug(
                "Compiled machine: states={}, initial_state={}, default_head_exprs={}",
                registry.size(),
                initial,
                pass.defaultHead.size());
        return new StateMachine(registry, pass.defaultHead, initial, options);
    }

    /** What the line scanner is currently inside. */
    private enum CompileState {
        TOP_LEVEL,
        STATE,
        STATE_HEAD,
        STATE_BRANCH,
        DEFAULT_HEAD
    }

    /** A {@code changeto} target awaiting the undefined-state check. */
    private record PendingTransition(String target, int line, int column) {}

    private static final class StateBuilder {
        final String name;
        final List<Expression> head = new ArrayList<>();
        final List<BranchBuilder> branches = new ArrayList<>();
        boolean hasDefault;
        boolean hasAlways;
        boolean hasOtherwise;

        StateBuilder(String name) {
            this.name = name;
        }

        State build() {
            List<StateBranch> built = new ArrayList<>(branches.size());
            Integer defaultIndex = null;
            for (int i = 0; i < branches.size(); i++) {
                BranchBuilder branch = branches.get(i);
                built.add(new StateBranch(branch.condition, branch.body, branch.transition, branch.isDefault));
                if (branch.isDefault) {
                    defaultIndex = i;
                }
            }
            if (hasDefault && defaultIndex == null) {
                throw new IllegalStateException("state '" + name + "' flagged a default branch that was never recorded");
            }
            return new State(name, head, built, defaultIndex);
        }
    }

    private static final class BranchBuilder {
        final Expression condition;
        final List<Expression> body = new ArrayList<>();
        StateOp transition = StateOp.STAY;
        boolean isDefault;

        BranchBuilder(Expression condition) {
            this.condition = condition;
        }
    }

    /** One compilation: the line cursor plus everything collected so far. */
    private static final class Pass {

        private final String[] lines;
        private final Deque<CompileState> stack = new ArrayDeque<>();
        final Map<String, State> states = new LinkedHashMap<>();
        final List<Expression> defaultHead = new ArrayList<>();
        final List<PendingTransition> transitions = new ArrayList<>();

        private StateBuilder openState;
        private BranchBuilder openBranch;
        private String indent;
        private String indent2;

        Pass(String[] lines) {
            this.lines = lines;
            stack.push(CompileState.TOP_LEVEL);
        }

        void run() {
            int i = 0;
            while (i < lines.length) {
                String line = lines[i].stripTrailing();
                int lineNo = i + 1;
                String content = line.strip();
                if (content.isEmpty() || content.startsWith("#")) {
                    i++;
                    continue;
                }

                CompileState current = stack.peek();
                if (indent == null && (current == CompileState.STATE || current == CompileState.DEFAULT_HEAD)) {
                    String leading = line.substring(0, line.length() - line.stripLeading().length());
                    if (!leading.isEmpty()) {
                        indent = leading;
                        indent2 = leading + leading;
                    }
                }

                boolean consumed =
                        switch (current) {
                            case TOP_LEVEL -> topLevel(line, lineNo);
                            case STATE -> state(line, lineNo);
                            case STATE_HEAD -> stateHead(line, lineNo);
                            case STATE_BRANCH -> stateBranch(line, lineNo);
                            case DEFAULT_HEAD -> defaultHead(line, lineNo);
                        };
                if (consumed) {
                    i++;
                }
            }

            closeBranch();
            closeState();
        }

        private boolean topLevel(String line, int lineNo) {
            if (line.startsWith(STATE_PREFIX)) {
                String rest = line.substring(STATE_PREFIX.length());
                if (!rest.endsWith(":")) {
                    throw new SmlSyntaxError(
                            String.format("State definition without trailing colon on line %d.", lineNo), lineNo);
                }
                String name = rest.substring(0, rest.length() - 1).strip();
                if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
                    throw new SmlSyntaxError(
                            String.format("State definition with no valid name on line %d.", lineNo), lineNo);
                }
                if (states.containsKey(name)) {
                    throw new SmlSyntaxError(String.format("Duplicate state '%s' on line %d.", name, lineNo), lineNo);
                }
                openState = new StateBuilder(name);
                stack.push(CompileState.STATE);
            } else if (line.equals(DEFAULT_HEAD)) {
                stack.push(CompileState.DEFAULT_HEAD);
            } else {
                throw new SmlSyntaxError(String.format("Unexpected value '%s' on line %d.", line, lineNo), lineNo);
            }
            return true;
        }

        private boolean state(String line, int lineNo) {
            if (indent == null || !line.startsWith(indent)) {
                closeState();
                stack.pop();
                return false;
            }
            if (line.startsWith(indent2)) {
                throw new SmlSyntaxError(String.format("Unexpected indent on line %d.", lineNo), lineNo);
            }

            int offset = leadingWidth(line);
            String item = line.substring(offset);
            if (item.equals("head:")) {
                stack.push(CompileState.STATE_HEAD);
            } else if (item.startsWith(WHEN_PREFIX)) {
                rejectAfterTerminalBranch(lineNo);
                if (!item.endsWith(":")) {
                    throw new SmlSyntaxError(String.format("Missing colon on line %d: %s", lineNo, item), lineNo);
                }
                String expr = item.substring(WHEN_PREFIX.length(), item.length() - 1);
                Expression condition =
                        ExpressionCompiler.compile(expr, lineNo, offset + WHEN_PREFIX.length());
                openBranch(condition);
            } else if (item.equals("always:")) {
                rejectAfterTerminalBranch(lineNo);
                if (!openState.branches.isEmpty()) {
                    throw new SmlSyntaxError(
                            String.format(
                                    "Always defined after another branch on line %d. Always must be the only branch.",
                                    lineNo),
                            lineNo);
                }
                openState.hasAlways = true;
                openBranch(new Expression.Literal(Value.of(true)));
            } else if (item.equals("otherwise:")) {
                rejectAfterTerminalBranch(lineNo);
                if (openState.branches.isEmpty()) {
                    throw new SmlSyntaxError(
                            String.format(
                                    "Otherwise defined alone on line %d. Otherwise must come after at least one other"
                                            + " branch.",
                                    lineNo),
                            lineNo);
                }
                openState.hasOtherwise = true;
                openBranch(new Expression.Literal(Value.of(true)));
            } else {
                throw new SmlSyntaxError(
                        String.format(
                                "Expected ['head:', 'when <expr>:', 'always:', 'otherwise:'] in state '%s' on line"
                                        + " %d: %s",
                                openState.name, lineNo, item),
                        lineNo);
            }
            return true;
        }

        private boolean stateHead(String line, int lineNo) {
            if (!line.startsWith(indent2)) {
                stack.pop();
                return false;
            }
            openState.head.add(expressionLine(line, lineNo));
            return true;
        }

        private boolean defaultHead(String line, int lineNo) {
            if (indent == null || !line.startsWith(indent)) {
                stack.pop();
                return false;
            }
            defaultHead.add(expressionLine(line, lineNo));
            return true;
        }

        private boolean stateBranch(String line, int lineNo) {
            if (!line.startsWith(indent2)) {
                closeBranch();
                stack.pop();
                return false;
            }

            int offset = leadingWidth(line);
            String item = line.substring(offset);
            if (item.equals(CHANGETO) || item.startsWith(CHANGETO + " ")) {
                String target = item.substring(CHANGETO.length()).strip();
                if (target.isEmpty()) {
                    throw new SmlSyntaxError(
                            String.format("changeto without a target state on line %d.", lineNo), lineNo);
                }
                openBranch.transition = StateOp.changeTo(target);
                transitions.add(new PendingTransition(target, lineNo, offset + CHANGETO.length() + 2));
            } else if (item.equals("end")) {
                openBranch.transition = StateOp.END;
            } else if (item.equals("stay")) {
                openBranch.transition = StateOp.STAY;
            } else if (item.equals("default")) {
                if (openState.hasDefault) {
                    throw new SmlSyntaxError(
                            String.format(
                                    "Multiple branches marked as default in state %s. On line %d.",
                                    openState.name, lineNo),
                            lineNo);
                }
                openBranch.isDefault = true;
                openState.hasDefault = true;
            } else {
                openBranch.body.add(ExpressionCompiler.compile(item, lineNo, offset));
            }
            return true;
        }

        private Expression expressionLine(String line, int lineNo) {
            int offset = leadingWidth(line);
            return ExpressionCompiler.compile(line.substring(offset), lineNo, offset);
        }

        private void rejectAfterTerminalBranch(int lineNo) {
            if (openState.hasAlways || openState.hasOtherwise) {
                throw new SmlSyntaxError(
                        String.format("Branch defined after always or otherwise on line %d.", lineNo), lineNo);
            }
        }

        private void openBranch(Expression condition) {
            openBranch = new BranchBuilder(condition);
            stack.push(CompileState.STATE_BRANCH);
        }

        private void closeBranch() {
            if (openBranch != null) {
                openState.branches.add(openBranch);
                openBranch = null;
            }
        }

        private void closeState() {
            if (openState != null) {
                states.put(openState.name, openState.build());
                openState = null;
            }
        }

        private static int leadingWidth(String line) {
            return line.length() - line.stripLeading().length();
        }
    }
}
