package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.BinaryExpression;
import org.ifjc.compiler.frontend.parser.ast.BinaryOperator;
import org.ifjc.compiler.frontend.parser.ast.CallExpression;
import org.ifjc.compiler.frontend.parser.ast.DoubleLiteral;
import org.ifjc.compiler.frontend.parser.ast.Expression;
import org.ifjc.compiler.frontend.parser.ast.IdentifierExpression;
import org.ifjc.compiler.frontend.parser.ast.IntLiteral;
import org.ifjc.compiler.frontend.parser.ast.NullLiteral;
import org.ifjc.compiler.frontend.parser.ast.StringLiteral;
import org.ifjc.compiler.frontend.parser.ast.TernaryExpression;
import org.ifjc.compiler.frontend.parser.ast.TypeNameExpression;
import org.ifjc.compiler.frontend.parser.ast.UnaryExpression;
import org.ifjc.compiler.frontend.semantics.DataType;
import org.ifjc.compiler.frontend.semantics.GlobalRegistry;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.ifjc.compiler.frontend.semantics.Symbol;
import org.ifjc.compiler.frontend.semantics.TypeUnification;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pass-2 bottom-up type inference. Resolves every identifier and call it meets and records the
 * inferred tag of every sub-expression in the context.
 */
public class ExpressionTyper {

    /** Names accepted on the right of {@code is}. */
    static final Set<String> TYPE_NAMES = Set.of("Num", "String", "Null");

    private final CallValidator calls;

    public ExpressionTyper(CallValidator calls) {
        this.calls = calls;
    }

    /**
     * Infers the type of {@code expression}.
     *
     * @param expression The expression to type.
     * @param context    The running analysis; its scope stack must be in resolution mode.
     * @return The inferred tag.
     * @throws SemanticException on an undefined name, a bad call or an illegal operand combination.
     */
    public DataType type(Expression expression, SemanticContext context) {
        DataType type = infer(expression, context);
        context.annotateType(expression, type);
        return type;
    }

    private DataType infer(Expression expression, SemanticContext context) {
        if (expression instanceof IntLiteral) {
            return DataType.INT;
        }
        if (expression instanceof DoubleLiteral) {
            return DataType.DOUBLE;
        }
        if (expression instanceof StringLiteral) {
            return DataType.STRING;
        }
        if (expression instanceof NullLiteral) {
            return DataType.NULL;
        }
        if (expression instanceof IdentifierExpression identifier) {
            return resolveIdentifier(identifier, context);
        }
        if (expression instanceof TypeNameExpression typeName) {
            throw SemanticException.expressionType("Type name '" + typeName.name() + "' cannot be used as a value.");
        }
        if (expression instanceof CallExpression call) {
            return typeCall(call, context);
        }
        if (expression instanceof UnaryExpression unary) {
            type(unary.operand(), context);
            return DataType.BOOL;
        }
        if (expression instanceof BinaryExpression binary) {
            return typeBinary(binary, context);
        }
        if (expression instanceof TernaryExpression ternary) {
            type(ternary.condition(), context);
            type(ternary.thenValue(), context);
            type(ternary.elseValue(), context);
            return DataType.UNKNOWN;
        }
        throw SemanticException.internal("Unhandled expression " + expression.getClass().getSimpleName() + ".");
    }

    /**
     * Resolves a read of {@code identifier}: a local or parameter first, then a property getter,
     * then a global-naming-convention name.
     *
     * @throws SemanticException of kind DEFINITION if the name is undefined or names a setter-only property.
     */
    public DataType resolveIdentifier(IdentifierExpression identifier, SemanticContext context) {
        String name = identifier.name();
        Optional<Symbol> local = context.scopes().lookupDefined(name);
        if (local.isPresent()) {
            Symbol symbol = local.get();
            context.annotateSymbol(identifier, symbol);
            if (symbol.codegenName() != null) {
                context.annotateCodegenName(identifier, symbol.codegenName());
            }
            return symbol.type();
        }
        Optional<Symbol> getter = context.registry().getter(name);
        if (getter.isPresent()) {
            context.annotateSymbol(identifier, getter.get());
            return getter.get().type();
        }
        if (context.registry().hasSetter(name)) {
            throw SemanticException.definition("Property '" + name + "' has a setter but no getter.");
        }
        GlobalRegistry globals = context.globals();
        if (globals.isGlobalName(name)) {
            globals.record(name);
            context.annotateCodegenName(identifier, name);
            return globals.typeOf(name);
        }
        throw SemanticException.definition("Undefined identifier '" + name + "'.");
    }

    private DataType typeCall(CallExpression call, SemanticContext context) {
        List<DataType> argumentTypes = new ArrayList<>(call.arity());
        for (Expression argument : call.arguments()) {
            argumentTypes.add(type(argument, context));
        }
        Symbol signature = calls.checkResolved(call, argumentTypes);
        context.annotateSymbol(call, signature);
        context.annotateCodegenName(call, calls.codegenName(call));
        return signature.type();
    }

    private DataType typeBinary(BinaryExpression binary, SemanticContext context) {
        if (binary.operator() == BinaryOperator.IS) {
            type(binary.left(), context);
            String typeName = typeTestName(binary.right());
            if (typeName == null || !TYPE_NAMES.contains(typeName)) {
                throw SemanticException.expressionType("Right side of 'is' must be one of " + TYPE_NAMES + ".");
            }
            context.annotateType(binary.right(), DataType.UNKNOWN);
            return DataType.BOOL;
        }
        DataType left = type(binary.left(), context);
        DataType right = type(binary.right(), context);
        return TypeUnification.combine(binary.operator(), left, right).orElseThrow(() ->
                SemanticException.expressionType("Operator '" + binary.operator().symbol()
                        + "' cannot be applied to " + left + " and " + right + "."));
    }

    private static String typeTestName(Expression expression) {
        if (expression instanceof TypeNameExpression typeName) {
            return typeName.name();
        }
        if (expression instanceof IdentifierExpression identifier) {
            return identifier.name();
        }
        return null;
    }
}
