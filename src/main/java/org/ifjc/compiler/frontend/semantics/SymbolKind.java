package org.ifjc.compiler.frontend.semantics;

/**
 * What a symbol names.
 */
public enum SymbolKind {
    VARIABLE,
    CONSTANT,
    FUNCTION,
    PARAMETER,
    GLOBAL,
    GETTER,
    SETTER
}
