package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Base interface of every node in the abstract syntax tree handed to semantic analysis.
 * <p>
 * Nodes are immutable records. Analysis results (scopes, codegen names, resolved symbols)
 * are attached through identity-keyed side tables, never by mutating the tree.
 */
public interface AstNode {

    /**
     * Returns the statement-level children visited by the generic tree walk.
     * Expressions are not part of this list; the handler of the owning statement visits them.
     *
     * @return The child nodes in document order, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
