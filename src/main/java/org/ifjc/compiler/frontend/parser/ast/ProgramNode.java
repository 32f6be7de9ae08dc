package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Root of a parsed program: the list of classes in source order.
 *
 * @param classes The classes of the program.
 */
public record ProgramNode(List<ClassNode> classes) implements AstNode {

    public ProgramNode {
        classes = List.copyOf(classes);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(classes);
    }
}
