package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.FunctionNode;
import org.ifjc.compiler.frontend.parser.ast.ParameterNode;
import org.ifjc.compiler.frontend.parser.ast.SetterNode;
import org.ifjc.compiler.frontend.semantics.ScopeFrame;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.ifjc.compiler.frontend.semantics.Symbol;

import java.util.List;

/**
 * Re-enters the frame of a function, getter or setter and names its parameters for the code generator.
 */
public class CallableAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SemanticContext context) {
        ScopeFrame frame = context.scopes().reenter(node);
        for (ParameterNode parameter : parametersOf(node)) {
            Symbol symbol = frame.symbols().get(parameter.name()).orElseThrow(() ->
                    SemanticException.internal("Parameter '" + parameter.name() + "' was not declared."));
            String codegenName = frame.codegenName(parameter.name());
            symbol.setCodegenName(codegenName);
            context.annotateCodegenName(parameter, codegenName);
            context.annotateSymbol(parameter, symbol);
        }
    }

    @Override
    public void afterChildren(AstNode node, SemanticContext context) {
        context.scopes().leave();
    }

    private static List<ParameterNode> parametersOf(AstNode node) {
        if (node instanceof FunctionNode function) {
            return function.parameters();
        }
        if (node instanceof SetterNode setter) {
            return List.of(setter.parameter());
        }
        return List.of();
    }
}
