package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.builtins.BuiltinProvider;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.Expression;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Mutable state shared by the collectors and handlers of one analysis run.
 * <p>
 * The context owns the function registry and the identity-keyed side tables that annotate the
 * tree. Each pass gets its own {@link ScopeStack}; the frames it opens outlive it in the scope map.
 */
public class SemanticContext {

    private final SemanticOptions options;
    private final BuiltinProvider builtins;
    private final FunctionRegistry registry;
    private final GlobalRegistry globals;

    private final Map<AstNode, ScopeFrame> scopeMap = new IdentityHashMap<>();
    private final Map<AstNode, String> codegenNames = new IdentityHashMap<>();
    private final Map<AstNode, Symbol> resolvedSymbols = new IdentityHashMap<>();
    private final Map<Expression, DataType> expressionTypes = new IdentityHashMap<>();

    private ScopeStack scopes;
    private String currentClass;
    private int loopDepth;

    public SemanticContext(SemanticOptions options, BuiltinProvider builtins, GlobalRegistry globals) {
        this.options = options;
        this.builtins = builtins;
        this.globals = globals;
        this.registry = new FunctionRegistry(options.registryCapacity());
    }

    // === Passes ===

    /**
     * Starts the declaration pass with a fresh stack that opens new frames.
     */
    public ScopeStack beginDeclarationPass() {
        scopes = ScopeStack.forDeclaration(options.maxScopeDepth(), options.frameCapacity(), scopeMap);
        loopDepth = 0;
        currentClass = null;
        return scopes;
    }

    /**
     * Starts the resolution pass with a fresh stack that re-enters the recorded frames.
     */
    public ScopeStack beginResolutionPass() {
        scopes = ScopeStack.forResolution(scopeMap);
        loopDepth = 0;
        currentClass = null;
        return scopes;
    }

    /**
     * Pops whatever the current pass left open.
     */
    public void endPass() {
        if (scopes != null) {
            scopes.dispose();
        }
    }

    public ScopeStack scopes() {
        if (scopes == null) {
            throw SemanticException.internal("No analysis pass is running.");
        }
        return scopes;
    }

    // === Class and loop tracking ===

    public String currentClass() {
        return currentClass;
    }

    public void setCurrentClass(String currentClass) {
        this.currentClass = currentClass;
    }

    public void enterLoop() {
        loopDepth++;
    }

    public void leaveLoop() {
        if (loopDepth == 0) {
            throw SemanticException.internal("Loop nesting underflow.");
        }
        loopDepth--;
    }

    public int loopDepth() {
        return loopDepth;
    }

    // === Annotations ===

    public void annotateCodegenName(AstNode node, String name) {
        codegenNames.put(node, name);
    }

    public void annotateSymbol(AstNode node, Symbol symbol) {
        resolvedSymbols.put(node, symbol);
    }

    public void annotateType(Expression expression, DataType type) {
        expressionTypes.put(expression, type);
    }

    // === Accessors ===

    public SemanticOptions options() {
        return options;
    }

    public BuiltinProvider builtins() {
        return builtins;
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public GlobalRegistry globals() {
        return globals;
    }

    public Map<AstNode, ScopeFrame> scopeMap() {
        return scopeMap;
    }

    Map<AstNode, String> codegenNames() {
        return codegenNames;
    }

    Map<AstNode, Symbol> resolvedSymbols() {
        return resolvedSymbols;
    }

    Map<Expression, DataType> expressionTypes() {
        return expressionTypes;
    }
}
