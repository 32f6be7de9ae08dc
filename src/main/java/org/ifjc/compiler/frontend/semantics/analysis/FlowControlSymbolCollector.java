package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.BreakNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Rejects {@code break} and {@code continue} outside of a loop.
 */
public class FlowControlSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SemanticContext context) {
        if (context.loopDepth() == 0) {
            String keyword = node instanceof BreakNode ? "break" : "continue";
            throw SemanticException.flowControl("'" + keyword + "' outside of a loop.");
        }
    }
}
