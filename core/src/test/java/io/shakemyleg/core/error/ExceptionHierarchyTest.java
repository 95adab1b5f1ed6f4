package io.shakemyleg.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: two abstract tiers under one abstract root. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void smlExceptionIsAbstractAndRoot() {
        assertThat(SmlException.class).isAbstract();
        assertThat(SmlException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void compileAndRuntimeTiersAreAbstract() {
        assertThat(SmlCompileException.class).isAbstract();
        assertThat(SmlCompileException.class.getSuperclass()).isEqualTo(SmlException.class);
        assertThat(SmlRuntimeException.class).isAbstract();
        assertThat(SmlRuntimeException.class.getSuperclass()).isEqualTo(SmlException.class);
    }

    // --- Compile-time exceptions ---

    @Test
    void syntaxErrorCarriesPosition() {
        var ex = new SmlSyntaxError("Unbalanced parens on line 3, col 7.", 3, 7);

        assertThat(ex).isInstanceOf(SmlCompileException.class);
        assertThat(ex.phase()).isEqualTo(SmlException.Phase.COMPILE);
        assertThat(ex.line()).isEqualTo(3);
        assertThat(ex.column()).isEqualTo(7);
        assertThat(ex.detail()).isEqualTo("Syntax error: Unbalanced parens on line 3, col 7.");
    }

    @Test
    void syntaxErrorWithoutColumn() {
        var ex = new SmlSyntaxError("No states defined.", 0);

        assertThat(ex.line()).isZero();
        assertThat(ex.column()).isZero();
    }

    @Test
    void scriptLoadExceptionKeepsCauseAndSource() {
        var cause = new IOException("no such file");
        var ex = new ScriptLoadException("Failed to read script", cause, "/tmp/a.sml");

        assertThat(ex).isInstanceOf(SmlCompileException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.source()).isEqualTo("/tmp/a.sml");
    }

    // --- Runtime exceptions ---

    @Test
    void runtimeExceptionsArePhaseRuntime() {
        SmlRuntimeException[] all = {
            new BadOperationException("x"),
            new IdentifierNameException("inputs.a"),
            new IdentifierPathException("x"),
            new InputsWriteException("inputs.a"),
            new NonexistentStateException("Z"),
            new NoDefaultBranchException("A"),
            new ValueCodecException("x")
        };

        for (SmlRuntimeException ex : all) {
            assertThat(ex.phase()).isEqualTo(SmlException.Phase.RUNTIME);
        }
    }

    @Test
    void firstAttachedStateWins() {
        var ex = new BadOperationException("x");

        ex.inState("inner").inState("outer");

        assertThat(ex.stateName()).isEqualTo("inner");
    }

    @Test
    void noDefaultBranchKnowsItsState() {
        assertThat(new NoDefaultBranchException("idle").stateName()).isEqualTo("idle");
    }

    @Test
    void nonexistentStateNamesTarget() {
        var ex = new NonexistentStateException("ghost");

        assertThat(ex.targetState()).isEqualTo("ghost");
        assertThat(ex.getMessage()).isEqualTo("Nonexistent state ghost");
    }

    @Test
    void identifierPathMessageIsPrefixed() {
        assertThat(new IdentifierPathException("bad").getMessage()).isEqualTo("Identifier error. bad");
    }
}
