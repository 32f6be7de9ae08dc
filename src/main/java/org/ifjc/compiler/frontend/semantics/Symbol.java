package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.frontend.parser.ast.AstNode;

/**
 * Metadata recorded for one name in a {@link SymbolTable}.
 * <p>
 * The type tag and the {@code defined} flag change while the passes run; everything else is
 * fixed once the declaring pass has filled it in. The declaring node is a non-owning
 * reference: the tree's owner controls its lifetime.
 */
public final class Symbol {

    private final String name;
    private final SymbolKind kind;
    private DataType type = DataType.UNKNOWN;
    private boolean defined;
    private boolean global;
    private int arity;
    private String scopePath;
    private AstNode declaration;
    private String codegenName;

    public Symbol(String name, SymbolKind kind, boolean defined) {
        this.name = name;
        this.kind = kind;
        this.defined = defined;
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    public DataType type() {
        return type;
    }

    public Symbol withType(DataType type) {
        this.type = type;
        return this;
    }

    /**
     * Folds an assigned value's type into this symbol's type.
     *
     * @see TypeUnification#learn(DataType, DataType)
     */
    public void learn(DataType assigned) {
        this.type = TypeUnification.learn(this.type, assigned);
    }

    public boolean defined() {
        return defined;
    }

    public void setDefined(boolean defined) {
        this.defined = defined;
    }

    public boolean global() {
        return global;
    }

    public Symbol withGlobal(boolean global) {
        this.global = global;
        return this;
    }

    public int arity() {
        return arity;
    }

    public Symbol withArity(int arity) {
        this.arity = arity;
        return this;
    }

    /**
     * Owning scope: a scope path ({@code "1.2"}) for locals, a class name for registry entries,
     * {@code "global"} for builtins.
     */
    public String scopePath() {
        return scopePath;
    }

    public Symbol withScopePath(String scopePath) {
        this.scopePath = scopePath;
        return this;
    }

    public AstNode declaration() {
        return declaration;
    }

    public Symbol withDeclaration(AstNode declaration) {
        this.declaration = declaration;
        return this;
    }

    public String codegenName() {
        return codegenName;
    }

    public void setCodegenName(String codegenName) {
        this.codegenName = codegenName;
    }

    @Override
    public String toString() {
        return "Symbol[" + name + ", " + kind + ", " + type + (arity > 0 ? ", arity=" + arity : "")
                + (scopePath != null ? ", scope=" + scopePath : "") + "]";
    }
}
