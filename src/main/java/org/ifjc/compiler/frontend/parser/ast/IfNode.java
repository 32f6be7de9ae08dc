package org.ifjc.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional statement.
 *
 * @param condition  The condition expression.
 * @param thenBranch The block executed when the condition holds.
 * @param elseBranch The alternative block, or null when absent.
 */
public record IfNode(Expression condition, BlockNode thenBranch, BlockNode elseBranch) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(2);
        if (thenBranch != null) children.add(thenBranch);
        if (elseBranch != null) children.add(elseBranch);
        return children;
    }
}
