package org.ifjc.compiler.diagnostics;

/**
 * Thrown when semantic analysis rejects a program.
 * <p>
 * Analysis is fail-fast: the first violation aborts both passes and propagates
 * unchanged to the caller of {@link org.ifjc.compiler.frontend.semantics.SemanticAnalyzer#analyze}.
 * This is a RuntimeException because no caller inside the analyzer can recover from it.
 */
public class SemanticException extends RuntimeException {

    private final SemanticErrorKind kind;

    /**
     * Creates a SemanticException of the given kind.
     *
     * @param kind    The error category, which also determines the exit status
     * @param message Description of the violation
     */
    public SemanticException(SemanticErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SemanticErrorKind kind() {
        return kind;
    }

    public int exitCode() {
        return kind.exitCode();
    }

    public static SemanticException definition(String message) {
        return new SemanticException(SemanticErrorKind.DEFINITION, message);
    }

    public static SemanticException redefinition(String message) {
        return new SemanticException(SemanticErrorKind.REDEFINITION, message);
    }

    public static SemanticException argumentCount(String message) {
        return new SemanticException(SemanticErrorKind.ARGUMENT_COUNT, message);
    }

    public static SemanticException expressionType(String message) {
        return new SemanticException(SemanticErrorKind.EXPRESSION_TYPE, message);
    }

    public static SemanticException flowControl(String message) {
        return new SemanticException(SemanticErrorKind.FLOW_CONTROL, message);
    }

    public static SemanticException internal(String message) {
        return new SemanticException(SemanticErrorKind.INTERNAL, message);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
