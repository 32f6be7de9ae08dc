package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.diagnostics.SemanticException;

import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Fixed-capacity, open-addressed hash map from a string key to a {@link Symbol}.
 * <p>
 * Collisions are resolved by linear probing with wraparound. The table never resizes and
 * has no removal: it is sized generously up front, and running out of slots is a compiler
 * fault reported as an internal error.
 */
public final class SymbolTable {

    /**
     * A stored key together with its symbol.
     *
     * @param key    The key the symbol was inserted under.
     * @param symbol The stored symbol.
     */
    public record Entry(String key, Symbol symbol) {
    }

    private final String[] keys;
    private final Symbol[] symbols;
    private int size;

    /**
     * Creates an empty table.
     * @param capacity Number of slots; fixed for the lifetime of the table.
     */
    public SymbolTable(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Symbol table capacity must be positive: " + capacity);
        }
        this.keys = new String[capacity];
        this.symbols = new Symbol[capacity];
    }

    // === Lookup ===

    /**
     * Finds the entry stored under {@code key}.
     * @param key The key to look up.
     * @return The entry, or empty if the key was never inserted.
     */
    public Optional<Entry> find(String key) {
        int index = indexOf(key);
        return index < 0 ? Optional.empty() : Optional.of(new Entry(keys[index], symbols[index]));
    }

    /**
     * Returns the symbol stored under {@code key}.
     * @param key The key to look up.
     * @return The symbol, or empty if absent.
     */
    public Optional<Symbol> get(String key) {
        int index = indexOf(key);
        return index < 0 ? Optional.empty() : Optional.of(symbols[index]);
    }

    public boolean contains(String key) {
        return indexOf(key) >= 0;
    }

    // === Insertion ===

    /**
     * Inserts a fresh symbol named {@code key}. Idempotent: if the key exists, nothing changes.
     *
     * @param key     The key, also used as the symbol name.
     * @param kind    The symbol kind.
     * @param defined Initial value of the symbol's defined flag.
     * @return The symbol now stored under the key (the existing one if the key was taken).
     */
    public Symbol insert(String key, SymbolKind kind, boolean defined) {
        return insert(key, new Symbol(key, kind, defined));
    }

    /**
     * Stores {@code symbol} under {@code key} unless the key is already present.
     *
     * @param key    The key.
     * @param symbol The symbol to store.
     * @return The symbol now stored under the key (the existing one if the key was taken).
     * @throws SemanticException of kind INTERNAL if every slot is occupied.
     */
    public Symbol insert(String key, Symbol symbol) {
        int existing = indexOf(key);
        if (existing >= 0) {
            return symbols[existing];
        }
        if (size == keys.length) {
            throw SemanticException.internal("Symbol table full (" + keys.length + " slots), cannot insert '" + key + "'.");
        }
        int index = slot(key);
        while (keys[index] != null) {
            index = (index + 1) % keys.length;
        }
        keys[index] = key;
        symbols[index] = symbol;
        size++;
        return symbol;
    }

    // === Iteration ===

    /**
     * Visits every stored entry in slot order.
     * @param action Receives each key with its symbol.
     */
    public void forEach(BiConsumer<String, Symbol> action) {
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] != null) {
                action.accept(keys[i], symbols[i]);
            }
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return keys.length;
    }

    // === Hashing ===

    /**
     * djb2 string hash, treated as unsigned.
     */
    static long hash(String key) {
        long hash = 5381;
        for (int i = 0; i < key.length(); i++) {
            hash = ((hash << 5) + hash + key.charAt(i)) & 0xFFFFFFFFL;
        }
        return hash;
    }

    private int slot(String key) {
        return (int) (hash(key) % keys.length);
    }

    private int indexOf(String key) {
        if (key == null) {
            return -1;
        }
        int start = slot(key);
        int index = start;
        do {
            String stored = keys[index];
            // No removal, so an empty slot ends the probe chain.
            if (stored == null) {
                return -1;
            }
            if (stored.equals(key)) {
                return index;
            }
            index = (index + 1) % keys.length;
        } while (index != start);
        return -1;
    }
}
