package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Function declaration. Functions overload by arity.
 * <p>
 * The children are the top-level statements of the body: the body shares the frame
 * that holds the parameters, so the body block itself is not a separate child.
 *
 * @param name       The function name.
 * @param parameters The formal parameters in declaration order.
 * @param body       The function body.
 */
public record FunctionNode(String name, List<ParameterNode> parameters, BlockNode body) implements AstNode {

    public FunctionNode {
        parameters = List.copyOf(parameters);
    }

    public int arity() {
        return parameters.size();
    }

    @Override
    public List<AstNode> getChildren() {
        return body != null ? body.statements() : List.of();
    }
}
