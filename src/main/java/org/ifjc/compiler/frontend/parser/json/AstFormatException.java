package org.ifjc.compiler.frontend.parser.json;

/**
 * Thrown when an AST document is not valid JSON or does not have the expected shape.
 */
public class AstFormatException extends RuntimeException {

    /**
     * @param message Description of the malformed part, including its JSON path.
     */
    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
