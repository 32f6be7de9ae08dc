package org.ifjc.compiler.diagnostics;

/**
 * Error taxonomy of the semantic analysis stage.
 * <p>
 * Each kind carries the exit status the compiler reports for it.
 */
public enum SemanticErrorKind {

    /** Missing or malformed {@code main}, undefined identifier or function, read of a setter-only property. */
    DEFINITION(3),

    /** Duplicate signature or accessor in one class, local redeclared in one block. */
    REDEFINITION(4),

    /** Arity mismatch, or a builtin argument of the wrong kind. */
    ARGUMENT_COUNT(5),

    /** Illegal operand combination, malformed {@code is} right-hand side. */
    EXPRESSION_TYPE(6),

    /** {@code break} or {@code continue} outside a loop. */
    FLOW_CONTROL(10),

    /** Compiler fault: scope underflow, scope depth exceeded, symbol table exhausted. */
    INTERNAL(99);

    private final int exitCode;

    SemanticErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
