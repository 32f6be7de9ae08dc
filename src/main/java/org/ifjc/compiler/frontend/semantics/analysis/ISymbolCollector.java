package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Interface for pass-1 handlers.
 * Each collector declares what one kind of statement introduces (scopes, locals, parameters)
 * and runs the checks that need no type information.
 */
public interface ISymbolCollector {
    /**
     * Collects symbols from a single AST node before its children are visited.
     * @param node The node to collect symbols from.
     * @param context The state of the running analysis.
     */
    void collect(AstNode node, SemanticContext context);

    /**
     * Called after all children of the node have been visited during symbol collection.
     * Override to perform post-traversal actions such as leaving a scope.
     * @param node The node whose children have been visited.
     * @param context The state of the running analysis.
     */
    default void collectAfterChildren(AstNode node, SemanticContext context) {}
}
