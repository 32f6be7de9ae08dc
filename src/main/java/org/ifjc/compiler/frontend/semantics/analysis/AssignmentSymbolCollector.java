package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AssignmentNode;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Checks the target of an assignment, then the assigned expression.
 * <p>
 * A target is legal if it is a local or parameter of an enclosing frame, a property with a
 * setter, or a global-naming-convention name. Global names are recorded here.
 */
public class AssignmentSymbolCollector implements ISymbolCollector {

    private final LiteralExpressionChecker checker;

    public AssignmentSymbolCollector(LiteralExpressionChecker checker) {
        this.checker = checker;
    }

    @Override
    public void collect(AstNode node, SemanticContext context) {
        AssignmentNode assignment = (AssignmentNode) node;
        String name = assignment.name();
        if (context.scopes().lookup(name).isEmpty() && !context.registry().hasSetter(name)) {
            if (!context.globals().isGlobalName(name)) {
                throw SemanticException.definition("Assignment to undefined variable '" + name + "'.");
            }
            context.globals().record(name);
        }
        checker.check(assignment.value());
    }
}
