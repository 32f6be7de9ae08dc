package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.ifjc.compiler.frontend.parser.ast.IfNode;
import org.ifjc.compiler.frontend.parser.ast.ReturnNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Runs the pass-1 expression checks for statements that only carry an expression:
 * {@code if} conditions, expression statements and {@code return} values.
 */
public class ExpressionSymbolCollector implements ISymbolCollector {

    private final LiteralExpressionChecker checker;

    public ExpressionSymbolCollector(LiteralExpressionChecker checker) {
        this.checker = checker;
    }

    @Override
    public void collect(AstNode node, SemanticContext context) {
        if (node instanceof IfNode ifNode) {
            checker.check(ifNode.condition());
        } else if (node instanceof ExpressionStatementNode statement) {
            checker.check(statement.expression());
        } else if (node instanceof ReturnNode returnNode) {
            checker.check(returnNode.value());
        }
    }
}
