package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A class with its root block. Function, getter and setter declarations live in the root block
 * (possibly inside nested blocks).
 *
 * @param name The class name, used as the owning scope of its callables.
 * @param body The root block of the class.
 */
public record ClassNode(String name, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body != null ? List.of(body) : List.of();
    }
}
