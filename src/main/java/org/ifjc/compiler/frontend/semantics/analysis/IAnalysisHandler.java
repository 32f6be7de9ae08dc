package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Interface for pass-2 handlers.
 * Each handler resolves the names one kind of statement uses, infers the types of its
 * expressions and annotates the tree.
 */
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node before its children are traversed.
     * @param node The node to analyze.
     * @param context The state of the running analysis.
     */
    void analyze(AstNode node, SemanticContext context);

    /**
     * Called after all children of the node have been analyzed.
     * Override to perform post-traversal actions such as leaving a scope.
     * @param node The node whose children have been analyzed.
     * @param context The state of the running analysis.
     */
    default void afterChildren(AstNode node, SemanticContext context) {}
}
