package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Property getter ({@code static name { ... }}).
 *
 * @param name The property name.
 * @param body The getter body, sharing the accessor frame.
 */
public record GetterNode(String name, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body != null ? body.statements() : List.of();
    }
}
