package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.FunctionNode;
import org.ifjc.compiler.frontend.parser.ast.ParameterNode;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;
import org.ifjc.compiler.frontend.semantics.ScopeStack;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.ifjc.compiler.frontend.semantics.Symbol;
import org.ifjc.compiler.frontend.semantics.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects function symbols during pass 1: records the function in the enclosing frame,
 * enters one frame for parameters and body, and declares the formal parameters.
 */
public class FunctionSymbolCollector implements ISymbolCollector {

    private static final Logger log = LoggerFactory.getLogger(FunctionSymbolCollector.class);

    @Override
    public void collect(AstNode node, SemanticContext context) {
        FunctionNode function = (FunctionNode) node;
        ScopeStack scopes = context.scopes();

        scopes.requireCurrent().symbols()
                .insert(FunctionRegistry.signatureKey(function.name(), function.arity()),
                        new Symbol(function.name(), SymbolKind.FUNCTION, true))
                .withArity(function.arity())
                .withScopePath(scopes.currentPath())
                .withDeclaration(function);

        scopes.enter(node);
        for (ParameterNode parameter : function.parameters()) {
            if (!scopes.declareLocal(parameter.name(), SymbolKind.PARAMETER, true)) {
                throw SemanticException.redefinition("Parameter '" + parameter.name()
                        + "' is declared twice in function '" + function.name() + "'.");
            }
            scopes.lookupInCurrent(parameter.name()).ifPresent(p -> p.withDeclaration(parameter));
        }
        log.debug("function {}/{} scope {}", function.name(), function.arity(), scopes.currentPath());
    }

    @Override
    public void collectAfterChildren(AstNode node, SemanticContext context) {
        context.scopes().leave();
    }
}
