package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Loop statement.
 *
 * @param condition The loop condition.
 * @param body      The loop body.
 */
public record WhileNode(Expression condition, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body != null ? List.of(body) : List.of();
    }
}
