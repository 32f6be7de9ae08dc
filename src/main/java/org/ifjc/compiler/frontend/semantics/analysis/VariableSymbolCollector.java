package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.VarDeclarationNode;
import org.ifjc.compiler.frontend.semantics.ScopeStack;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares a local variable in the current block. The type stays unknown until assignments are typed.
 */
public class VariableSymbolCollector implements ISymbolCollector {

    private static final Logger log = LoggerFactory.getLogger(VariableSymbolCollector.class);

    @Override
    public void collect(AstNode node, SemanticContext context) {
        VarDeclarationNode declaration = (VarDeclarationNode) node;
        ScopeStack scopes = context.scopes();
        if (!scopes.declareLocal(declaration.name(), true)) {
            throw SemanticException.redefinition("Variable '" + declaration.name()
                    + "' is already declared in this block.");
        }
        scopes.lookupInCurrent(declaration.name()).ifPresent(s -> s.withDeclaration(declaration));
        log.debug("declare {} in {}", declaration.name(), scopes.currentPath());
    }
}
