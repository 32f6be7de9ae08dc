package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.VarDeclarationNode;
import org.ifjc.compiler.frontend.semantics.ScopeFrame;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.ifjc.compiler.frontend.semantics.Symbol;

/**
 * Makes a local resolvable from its declaration onwards and synthesizes its codegen name.
 */
public class VariableAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SemanticContext context) {
        VarDeclarationNode declaration = (VarDeclarationNode) node;
        ScopeFrame frame = context.scopes().requireCurrent();
        Symbol symbol = frame.symbols().get(declaration.name()).orElseThrow(() ->
                SemanticException.internal("Variable '" + declaration.name() + "' missing from scope " + frame.path() + "."));
        symbol.setDefined(true);
        String codegenName = frame.codegenName(declaration.name());
        symbol.setCodegenName(codegenName);
        context.annotateCodegenName(declaration, codegenName);
        context.annotateSymbol(declaration, symbol);
    }
}
