package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Annotations produced by a successful analysis run, keyed by node identity.
 * The global identifiers and their learned types are copies; the caller owns them.
 */
public final class AnalysisResult {

    /**
     * One declared symbol as listed by {@link #symbolListing()}.
     *
     * @param scope Scope path, or {@code "global"} for builtins.
     * @param name  Identifier or callable name.
     * @param kind  Symbol kind.
     * @param arity Parameter count of callables, 0 otherwise.
     * @param type  Type tag at the end of analysis.
     * @param codegenName Name used by the code generator, or null if none was assigned.
     */
    public record SymbolRow(String scope, String name, SymbolKind kind, int arity, DataType type, String codegenName) {
    }

    private static final Comparator<String> SCOPE_ORDER = AnalysisResult::compareScopes;

    private final Map<AstNode, String> codegenNames;
    private final Map<AstNode, Symbol> resolvedSymbols;
    private final Map<Expression, DataType> expressionTypes;
    private final Map<AstNode, ScopeFrame> scopeMap;
    private final FunctionRegistry registry;
    private final List<String> globalIdentifiers;
    private final Map<String, DataType> globalTypes;

    AnalysisResult(SemanticContext context) {
        this.codegenNames = Collections.unmodifiableMap(new IdentityHashMap<>(context.codegenNames()));
        this.resolvedSymbols = Collections.unmodifiableMap(new IdentityHashMap<>(context.resolvedSymbols()));
        this.expressionTypes = Collections.unmodifiableMap(new IdentityHashMap<>(context.expressionTypes()));
        this.scopeMap = Collections.unmodifiableMap(new IdentityHashMap<>(context.scopeMap()));
        this.registry = context.registry();
        this.globalIdentifiers = context.globals().copyIdentifiers();
        this.globalTypes = context.globals().copyLearnedTypes();
    }

    /**
     * @return The codegen name attached to a declaration, parameter, assignment, identifier or call.
     */
    public Optional<String> codegenName(AstNode node) {
        return Optional.ofNullable(codegenNames.get(node));
    }

    /**
     * @return The symbol a reference, assignment, declaration or call resolved to.
     */
    public Optional<Symbol> symbolOf(AstNode node) {
        return Optional.ofNullable(resolvedSymbols.get(node));
    }

    /**
     * @return The inferred type of an expression visited by the resolution pass.
     */
    public Optional<DataType> typeOf(Expression expression) {
        return Optional.ofNullable(expressionTypes.get(expression));
    }

    /**
     * @return The frame opened by a block, function, getter or setter.
     */
    public Optional<ScopeFrame> scopeOf(AstNode node) {
        return Optional.ofNullable(scopeMap.get(node));
    }

    public FunctionRegistry registry() {
        return registry;
    }

    /**
     * @return The global-naming-convention identifiers in first-seen order.
     */
    public List<String> globalIdentifiers() {
        return globalIdentifiers;
    }

    public Map<String, DataType> globalTypes() {
        return globalTypes;
    }

    /**
     * Lists every symbol of every frame plus the installed builtins, sorted by scope then name.
     */
    public List<SymbolRow> symbolListing() {
        List<SymbolRow> rows = new ArrayList<>();
        registry.forEachCallable((key, symbol) -> {
            if (FunctionRegistry.BUILTIN_SCOPE.equals(symbol.scopePath())) {
                rows.add(new SymbolRow(ScopeIdStack.GLOBAL, symbol.name(), symbol.kind(), symbol.arity(),
                        symbol.type(), symbol.name()));
            }
        });
        for (ScopeFrame frame : scopeMap.values()) {
            frame.symbols().forEach((key, symbol) ->
                    rows.add(new SymbolRow(frame.path(), symbol.name(), symbol.kind(), symbol.arity(),
                            symbol.type(), symbol.codegenName())));
        }
        rows.sort(Comparator.comparing(SymbolRow::scope, SCOPE_ORDER)
                .thenComparing(SymbolRow::name)
                .thenComparingInt(SymbolRow::arity));
        return rows;
    }

    /**
     * Orders {@code "global"} first, then paths by their numeric segments ({@code 1.2} before {@code 1.10}).
     */
    static int compareScopes(String a, String b) {
        if (a.equals(b)) return 0;
        if (ScopeIdStack.GLOBAL.equals(a)) return -1;
        if (ScopeIdStack.GLOBAL.equals(b)) return 1;
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            int cmp = Integer.compare(Integer.parseInt(left[i]), Integer.parseInt(right[i]));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(left.length, right.length);
    }
}
