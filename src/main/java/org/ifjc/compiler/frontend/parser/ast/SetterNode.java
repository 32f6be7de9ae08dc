package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Property setter ({@code static name = (param) { ... }}).
 *
 * @param name      The property name.
 * @param parameter The single setter parameter.
 * @param body      The setter body, sharing the frame that holds the parameter.
 */
public record SetterNode(String name, ParameterNode parameter, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body != null ? body.statements() : List.of();
    }
}
