package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.ifjc.compiler.frontend.parser.ast.IfNode;
import org.ifjc.compiler.frontend.parser.ast.ReturnNode;
import org.ifjc.compiler.frontend.parser.ast.WhileNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Types the expression carried by a statement: a condition, an expression statement or a return value.
 */
public class ExpressionAnalysisHandler implements IAnalysisHandler {

    private final ExpressionTyper typer;

    public ExpressionAnalysisHandler(ExpressionTyper typer) {
        this.typer = typer;
    }

    @Override
    public void analyze(AstNode node, SemanticContext context) {
        if (node instanceof IfNode ifNode) {
            typer.type(ifNode.condition(), context);
        } else if (node instanceof WhileNode whileNode) {
            typer.type(whileNode.condition(), context);
        } else if (node instanceof ExpressionStatementNode statement) {
            typer.type(statement.expression(), context);
        } else if (node instanceof ReturnNode returnNode && returnNode.value() != null) {
            typer.type(returnNode.value(), context);
        }
    }
}
