package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.WhileNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the loop condition and counts loop nesting for {@link FlowControlSymbolCollector}.
 */
public class LoopSymbolCollector implements ISymbolCollector {

    private static final Logger log = LoggerFactory.getLogger(LoopSymbolCollector.class);

    private final LiteralExpressionChecker checker;

    public LoopSymbolCollector(LiteralExpressionChecker checker) {
        this.checker = checker;
    }

    @Override
    public void collect(AstNode node, SemanticContext context) {
        checker.check(((WhileNode) node).condition());
        context.enterLoop();
        log.debug("loop enter (depth={})", context.loopDepth());
    }

    @Override
    public void collectAfterChildren(AstNode node, SemanticContext context) {
        context.leaveLoop();
        log.debug("loop leave (depth={})", context.loopDepth());
    }
}
