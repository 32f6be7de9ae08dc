package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Opens a new frame for a block during pass 1 and records it for the resolution pass.
 */
public class BlockSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SemanticContext context) {
        context.scopes().enter(node);
    }

    @Override
    public void collectAfterChildren(AstNode node, SemanticContext context) {
        context.scopes().leave();
    }
}
