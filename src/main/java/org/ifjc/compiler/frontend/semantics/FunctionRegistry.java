package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Signatures of every callable: builtins, user functions (overloaded by arity), getters and setters.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code name#arity} - a function signature, shared by all classes declaring it</li>
 *   <li>{@code get:name} / {@code set:name} - a property accessor</li>
 *   <li>{@code @name} - sentinel marking that some user overload of {@code name} exists</li>
 *   <li>{@code Class::key} - ownership record enforcing per-class uniqueness</li>
 * </ul>
 * A signature may appear in several classes, but only once per class.
 */
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    /** Owning scope recorded for builtins. */
    public static final String BUILTIN_SCOPE = ScopeIdStack.GLOBAL;

    private final SymbolTable table;

    /**
     * @param capacity Slot count of the underlying table.
     */
    public FunctionRegistry(int capacity) {
        this.table = new SymbolTable(capacity);
    }

    // === Keys ===

    public static String signatureKey(String name, int arity) {
        return name + "#" + arity;
    }

    public static String getterKey(String name) {
        return "get:" + name;
    }

    public static String setterKey(String name) {
        return "set:" + name;
    }

    public static String sentinelKey(String name) {
        return "@" + name;
    }

    private static String ownershipKey(String owningClass, String key) {
        return owningClass + "::" + key;
    }

    // === Registration ===

    /**
     * Registers a builtin signature. Registering the same builtin twice is a no-op.
     *
     * @param qualifiedName Fully-qualified name, e.g. {@code Ifj.write}.
     * @param arity         Parameter count.
     * @param returnType    Statically known return tag, or {@code UNKNOWN}.
     */
    public void registerBuiltin(String qualifiedName, int arity, DataType returnType) {
        String key = signatureKey(qualifiedName, arity);
        if (table.contains(key)) {
            return;
        }
        Symbol symbol = new Symbol(qualifiedName, SymbolKind.FUNCTION, true)
                .withArity(arity)
                .withGlobal(true)
                .withScopePath(BUILTIN_SCOPE)
                .withType(returnType);
        table.insert(key, symbol);
    }

    /**
     * Registers a user function signature owned by {@code owningClass}.
     *
     * @throws SemanticException of kind REDEFINITION if the class already declares {@code name/arity}.
     */
    public Symbol registerFunction(String name, int arity, String owningClass, AstNode declaration) {
        String key = signatureKey(name, arity);
        claim(owningClass, key, "Function '" + name + "' with " + arity + " parameter(s) is already defined in class '" + owningClass + "'.");
        Symbol symbol = table.insert(key, new Symbol(name, SymbolKind.FUNCTION, false)
                .withArity(arity)
                .withGlobal(true)
                .withScopePath(owningClass)
                .withDeclaration(declaration));
        table.insert(sentinelKey(name), new Symbol(name, SymbolKind.FUNCTION, false).withScopePath(owningClass));
        log.debug("insert function signature: {} (class-scope={})", key, owningClass);
        return symbol;
    }

    /**
     * Registers a getter for property {@code name} owned by {@code owningClass}.
     *
     * @throws SemanticException of kind REDEFINITION if the class already declares that getter.
     */
    public Symbol registerGetter(String name, String owningClass, AstNode declaration) {
        return registerAccessor(getterKey(name), name, SymbolKind.GETTER, 0, owningClass, declaration);
    }

    /**
     * Registers a setter for property {@code name} owned by {@code owningClass}.
     *
     * @throws SemanticException of kind REDEFINITION if the class already declares that setter.
     */
    public Symbol registerSetter(String name, String owningClass, AstNode declaration) {
        return registerAccessor(setterKey(name), name, SymbolKind.SETTER, 1, owningClass, declaration);
    }

    private Symbol registerAccessor(String key, String name, SymbolKind kind, int arity,
                                    String owningClass, AstNode declaration) {
        String what = kind == SymbolKind.GETTER ? "getter" : "setter";
        claim(owningClass, key, "Duplicate " + what + " for '" + name + "' in class '" + owningClass + "'.");
        log.debug("insert {} for '{}' as {} (class-scope={})", what, name, key, owningClass);
        return table.insert(key, new Symbol(name, kind, false)
                .withArity(arity)
                .withGlobal(true)
                .withScopePath(owningClass)
                .withDeclaration(declaration));
    }

    private void claim(String owningClass, String key, String message) {
        String ownership = ownershipKey(owningClass, key);
        if (table.contains(ownership)) {
            throw SemanticException.redefinition(message);
        }
        table.insert(ownership, SymbolKind.FUNCTION, true).withScopePath(owningClass);
    }

    // === Queries ===

    public boolean hasSignature(String name, int arity) {
        return table.contains(signatureKey(name, arity));
    }

    public Optional<Symbol> signature(String name, int arity) {
        return table.get(signatureKey(name, arity));
    }

    /**
     * @return true if some user overload of {@code name} exists, at any arity.
     */
    public boolean hasOverload(String name) {
        return table.contains(sentinelKey(name));
    }

    public boolean hasGetter(String name) {
        return table.contains(getterKey(name));
    }

    public boolean hasSetter(String name) {
        return table.contains(setterKey(name));
    }

    public Optional<Symbol> getter(String name) {
        return table.get(getterKey(name));
    }

    public Optional<Symbol> setter(String name) {
        return table.get(setterKey(name));
    }

    /**
     * @return The recorded return tag of {@code name/arity}, {@code UNKNOWN} if none is recorded.
     */
    public DataType returnType(String name, int arity) {
        return signature(name, arity).map(Symbol::type).orElse(DataType.UNKNOWN);
    }

    /**
     * Visits the callable entries (signatures and accessors); sentinels and ownership records are skipped.
     */
    public void forEachCallable(BiConsumer<String, Symbol> action) {
        table.forEach((key, symbol) -> {
            if (!key.startsWith("@") && !key.contains("::")) {
                action.accept(key, symbol);
            }
        });
    }

    public int size() {
        return table.size();
    }
}
