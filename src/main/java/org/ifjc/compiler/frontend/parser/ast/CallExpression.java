package org.ifjc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Call of a user function or a builtin. Builtins are written fully qualified ({@code Ifj.write}).
 *
 * @param name      The callee name.
 * @param arguments The argument expressions in order.
 */
public record CallExpression(String name, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    public int arity() {
        return arguments.size();
    }
}
