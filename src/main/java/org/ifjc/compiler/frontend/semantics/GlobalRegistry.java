package org.ifjc.compiler.frontend.semantics;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifiers that follow the global naming convention (a reserved prefix, {@code __} by default).
 * <p>
 * These names bypass lexical scoping: assigning one declares it. The registry keeps the
 * deduplicated list of names in first-seen order and a learned type per name. It outlives a
 * single analysis run so the code generator can read it afterwards; callers reset it before
 * each run and copy its contents out.
 */
public final class GlobalRegistry {

    private final String prefix;
    private final Set<String> identifiers = new LinkedHashSet<>();
    private final Map<String, DataType> learnedTypes = new LinkedHashMap<>();

    public GlobalRegistry(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Forgets every recorded name and type.
     */
    public void reset() {
        identifiers.clear();
        learnedTypes.clear();
    }

    public boolean isGlobalName(String name) {
        return name != null && name.length() > prefix.length() && name.startsWith(prefix);
    }

    /**
     * Records {@code name} if it has not been seen yet.
     */
    public void record(String name) {
        identifiers.add(name);
    }

    /**
     * Folds an assigned value's type into the learned type of {@code name}.
     *
     * @see TypeUnification#learn(DataType, DataType)
     */
    public void learn(String name, DataType assigned) {
        DataType current = learnedTypes.getOrDefault(name, DataType.UNKNOWN);
        learnedTypes.put(name, TypeUnification.learn(current, assigned));
    }

    public DataType typeOf(String name) {
        return learnedTypes.getOrDefault(name, DataType.UNKNOWN);
    }

    public boolean contains(String name) {
        return identifiers.contains(name);
    }

    /**
     * @return A copy of the recorded names in first-seen order; the caller owns it.
     */
    public List<String> copyIdentifiers() {
        return List.copyOf(identifiers);
    }

    /**
     * @return A copy of the learned types.
     */
    public Map<String, DataType> copyLearnedTypes() {
        return new LinkedHashMap<>(learnedTypes);
    }

    public String prefix() {
        return prefix;
    }
}
