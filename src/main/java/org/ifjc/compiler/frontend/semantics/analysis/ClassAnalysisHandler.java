package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.ClassNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Tracks the class whose root block is being analyzed.
 */
public class ClassAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SemanticContext context) {
        context.setCurrentClass(((ClassNode) node).name());
    }

    @Override
    public void afterChildren(AstNode node, SemanticContext context) {
        context.setCurrentClass(null);
    }
}
