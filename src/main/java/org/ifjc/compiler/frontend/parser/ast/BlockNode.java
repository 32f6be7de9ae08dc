package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A lexical block. Every block opens its own scope frame, except the body of a
 * function or accessor, which shares the frame holding the parameters.
 *
 * @param statements The statements of the block in document order.
 */
public record BlockNode(List<AstNode> statements) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
