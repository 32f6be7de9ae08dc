package org.ifjc.compiler.builtins;

import org.ifjc.compiler.frontend.semantics.FunctionRegistry;

import java.util.List;
import java.util.Optional;

/**
 * Source of builtin function metadata consumed by semantic analysis.
 */
public interface BuiltinProvider {

    /**
     * Registers every builtin enabled by {@code options} in the registry.
     *
     * @param registry The registry to populate.
     * @param options  The enabled language extensions.
     */
    void install(FunctionRegistry registry, BuiltinOptions options);

    /**
     * @param name A callee name as written in source.
     * @return true if {@code name} lies in the builtin namespace, whether or not a row or extension backs it.
     */
    boolean isBuiltinQualifiedName(String name);

    /**
     * @param name A builtin's qualified name.
     * @return The parameter kinds in order, or empty if {@code name} is not a builtin.
     */
    Optional<List<ParamKind>> parameterSpec(String name);
}
