package org.ifjc.compiler.frontend.semantics;

/**
 * The seven type tags tracked by semantic analysis.
 */
public enum DataType {
    NULL,
    INT,
    DOUBLE,
    STRING,
    BOOL,
    VOID,
    UNKNOWN
}
