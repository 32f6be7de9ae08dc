package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.frontend.parser.ast.AstNode;

/**
 * One lexical block's locals together with its scope label.
 * <p>
 * Frames are created once by the declaration pass and cached per owning node, so the
 * resolution pass sees exactly the tables the declaration pass built.
 */
public final class ScopeFrame {

    private final String path;
    private final AstNode owner;
    private final SymbolTable symbols;

    ScopeFrame(String path, AstNode owner, int capacity) {
        this.path = path;
        this.owner = owner;
        this.symbols = new SymbolTable(capacity);
    }

    /**
     * @return The hierarchical label, e.g. {@code "1.2.3"}.
     */
    public String path() {
        return path;
    }

    /**
     * @return The block, function or accessor that opened this frame.
     */
    public AstNode owner() {
        return owner;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /**
     * @return The label without separators, e.g. {@code "123"} for {@code "1.2.3"}.
     */
    public String flattenedPath() {
        return path.replace(".", "");
    }

    /**
     * Synthesizes the code generator's name for an identifier declared in this frame.
     * @param identifier The declared identifier.
     * @return {@code <identifier>_<flattened path>}.
     */
    public String codegenName(String identifier) {
        return identifier + "_" + flattenedPath();
    }

    @Override
    public String toString() {
        return "ScopeFrame[" + path + ", " + symbols.size() + " symbols]";
    }
}
