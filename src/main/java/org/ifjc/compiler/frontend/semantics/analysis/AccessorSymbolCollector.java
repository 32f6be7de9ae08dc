package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.GetterNode;
import org.ifjc.compiler.frontend.parser.ast.ParameterNode;
import org.ifjc.compiler.frontend.parser.ast.SetterNode;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;
import org.ifjc.compiler.frontend.semantics.ScopeStack;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.ifjc.compiler.frontend.semantics.Symbol;
import org.ifjc.compiler.frontend.semantics.SymbolKind;

/**
 * Pass-1 collector for getters and setters. Works like {@link FunctionSymbolCollector}; a getter's
 * frame is empty on entry, a setter's frame holds its single parameter.
 */
public class AccessorSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SemanticContext context) {
        ScopeStack scopes = context.scopes();
        if (node instanceof GetterNode getter) {
            scopes.requireCurrent().symbols()
                    .insert(FunctionRegistry.getterKey(getter.name()), new Symbol(getter.name(), SymbolKind.GETTER, true))
                    .withScopePath(scopes.currentPath())
                    .withDeclaration(getter);
            scopes.enter(node);
        } else if (node instanceof SetterNode setter) {
            scopes.requireCurrent().symbols()
                    .insert(FunctionRegistry.setterKey(setter.name()), new Symbol(setter.name(), SymbolKind.SETTER, true))
                    .withArity(1)
                    .withScopePath(scopes.currentPath())
                    .withDeclaration(setter);
            scopes.enter(node);
            ParameterNode parameter = setter.parameter();
            scopes.declareLocal(parameter.name(), SymbolKind.PARAMETER, true);
            scopes.lookupInCurrent(parameter.name()).ifPresent(p -> p.withDeclaration(parameter));
        }
    }

    @Override
    public void collectAfterChildren(AstNode node, SemanticContext context) {
        context.scopes().leave();
    }
}
