package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.ClassNode;
import org.ifjc.compiler.frontend.semantics.SemanticContext;

/**
 * Tracks the class whose root block is being walked.
 */
public class ClassSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SemanticContext context) {
        context.setCurrentClass(((ClassNode) node).name());
    }

    @Override
    public void collectAfterChildren(AstNode node, SemanticContext context) {
        context.setCurrentClass(null);
    }
}
