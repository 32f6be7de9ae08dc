package org.ifjc.compiler.builtins;

import org.ifjc.compiler.frontend.semantics.DataType;

import java.util.List;

/**
 * One row of the builtin table.
 *
 * @param qualifiedName Name as written in source, e.g. {@code Ifj.substring}.
 * @param parameters    Coarse kind of each parameter in order; its size is the arity.
 * @param returnType    Statically known result tag, {@code UNKNOWN} if it depends on input.
 */
public record BuiltinFunction(String qualifiedName, List<ParamKind> parameters, DataType returnType) {

    public BuiltinFunction {
        parameters = List.copyOf(parameters);
    }

    public int arity() {
        return parameters.size();
    }
}
