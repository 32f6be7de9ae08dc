package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.builtins.BuiltinProvider;
import org.ifjc.compiler.builtins.ParamKind;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.CallExpression;
import org.ifjc.compiler.frontend.semantics.DataType;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;
import org.ifjc.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Checks a call against the registered signatures.
 * <p>
 * The declaration pass is lenient: only an exact match or a known name at another arity can be
 * decided before every signature has been seen, and only literal arguments are checked. The
 * resolution pass is strict and checks arguments whose types have been inferred.
 */
public class CallValidator {

    private static final Logger log = LoggerFactory.getLogger(CallValidator.class);

    private final FunctionRegistry registry;
    private final BuiltinProvider builtins;

    public CallValidator(FunctionRegistry registry, BuiltinProvider builtins) {
        this.registry = registry;
        this.builtins = builtins;
    }

    /**
     * Pass-1 check. An unknown name is left to the resolution pass.
     *
     * @throws SemanticException of kind ARGUMENT_COUNT on a wrong arity or a literal argument of the wrong kind.
     */
    public void checkDeclared(CallExpression call) {
        String name = call.name();
        if (builtins.isBuiltinQualifiedName(name)) {
            requireBuiltinSignature(call);
            List<ParamKind> kinds = builtins.parameterSpec(name).orElse(List.of());
            for (int i = 0; i < call.arity() && i < kinds.size(); i++) {
                Optional<LiteralKind> literal = LiteralKind.of(call.arguments().get(i));
                if (literal.isPresent() && !acceptsLiteral(kinds.get(i), literal.get())) {
                    throw argumentKindMismatch(call, i, kinds.get(i));
                }
            }
            log.debug("call {}/{}: builtin ok", name, call.arity());
            return;
        }
        if (registry.hasSignature(name, call.arity())) {
            log.debug("call {}/{}: exact match", name, call.arity());
            return;
        }
        if (registry.hasOverload(name)) {
            throw SemanticException.argumentCount("Function '" + name + "' has no overload with "
                    + call.arity() + " argument(s).");
        }
        log.debug("call {}/{}: unknown, deferred", name, call.arity());
    }

    /**
     * Pass-2 check.
     *
     * @param call          The call.
     * @param argumentTypes Inferred type of each argument, in order.
     * @return The matched signature.
     * @throws SemanticException of kind ARGUMENT_COUNT on a wrong arity or an argument of the wrong kind,
     *                           of kind DEFINITION if no function of that name exists.
     */
    public Symbol checkResolved(CallExpression call, List<DataType> argumentTypes) {
        String name = call.name();
        if (builtins.isBuiltinQualifiedName(name)) {
            Symbol signature = requireBuiltinSignature(call);
            List<ParamKind> kinds = builtins.parameterSpec(name).orElse(List.of());
            for (int i = 0; i < argumentTypes.size() && i < kinds.size(); i++) {
                if (!kinds.get(i).accepts(argumentTypes.get(i))) {
                    throw argumentKindMismatch(call, i, kinds.get(i));
                }
            }
            return signature;
        }
        Optional<Symbol> signature = registry.signature(name, call.arity());
        if (signature.isPresent()) {
            return signature.get();
        }
        if (registry.hasOverload(name)) {
            throw SemanticException.argumentCount("Function '" + name + "' has no overload with "
                    + call.arity() + " argument(s).");
        }
        throw SemanticException.definition("Undefined function '" + name + "'.");
    }

    private Symbol requireBuiltinSignature(CallExpression call) {
        return registry.signature(call.name(), call.arity()).orElseThrow(() ->
                SemanticException.argumentCount("Builtin '" + call.name() + "' does not take "
                        + call.arity() + " argument(s)."));
    }

    private static boolean acceptsLiteral(ParamKind kind, LiteralKind literal) {
        return switch (kind) {
            case STRING -> literal != LiteralKind.NUMERIC;
            case NUMBER -> literal != LiteralKind.STRING;
            case ANY -> true;
        };
    }

    private static SemanticException argumentKindMismatch(CallExpression call, int index, ParamKind expected) {
        return SemanticException.argumentCount("Argument " + (index + 1) + " of '" + call.name()
                + "' must be " + expected.name().toLowerCase() + ".");
    }

    /**
     * @return true if {@code call} names a builtin.
     */
    public boolean isBuiltin(CallExpression call) {
        return builtins.isBuiltinQualifiedName(call.name());
    }

    /**
     * @return The name the code generator uses for the callee.
     */
    public String codegenName(CallExpression call) {
        return isBuiltin(call) ? call.name() : call.name() + "$" + call.arity();
    }
}
