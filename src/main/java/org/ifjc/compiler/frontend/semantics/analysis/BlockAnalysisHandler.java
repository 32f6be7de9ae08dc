package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Re-enters the frame pass 1 recorded for a block.
 */
public class BlockAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SemanticContext context) {
        context.scopes().reenter(node);
    }

    @Override
    public void afterChildren(AstNode node, SemanticContext context) {
        context.scopes().leave();
    }
}
