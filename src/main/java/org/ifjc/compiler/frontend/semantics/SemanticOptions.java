package org.ifjc.compiler.frontend.semantics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.ifjc.compiler.builtins.BuiltinOptions;

/**
 * Typed view of the {@code ifjc} configuration subtree.
 *
 * @param maxScopeDepth    Maximum block nesting depth; exceeding it is an internal error.
 * @param frameCapacity    Slot count of each scope frame's symbol table.
 * @param registryCapacity Slot count of the function registry.
 * @param globalPrefix     Prefix marking global-naming-convention identifiers.
 * @param builtins         Enabled builtin extensions.
 */
public record SemanticOptions(int maxScopeDepth,
                              int frameCapacity,
                              int registryCapacity,
                              String globalPrefix,
                              BuiltinOptions builtins) {

    public SemanticOptions {
        if (maxScopeDepth < 1) {
            throw new IllegalArgumentException("max-scope-depth must be positive: " + maxScopeDepth);
        }
        if (frameCapacity < 1 || registryCapacity < 1) {
            throw new IllegalArgumentException("Symbol table capacities must be positive.");
        }
        if (globalPrefix == null || globalPrefix.isEmpty()) {
            throw new IllegalArgumentException("global-prefix must not be empty.");
        }
    }

    /**
     * Reads the options from a configuration that contains the {@code ifjc} block.
     *
     * @param config The resolved root configuration.
     * @return The typed options.
     */
    public static SemanticOptions fromConfig(Config config) {
        Config semantics = config.getConfig("ifjc.semantics");
        return new SemanticOptions(
                semantics.getInt("max-scope-depth"),
                semantics.getInt("frame-capacity"),
                semantics.getInt("registry-capacity"),
                semantics.getString("global-prefix"),
                BuiltinOptions.fromConfig(config.getConfig("ifjc.builtins")));
    }

    /**
     * @return The options of the bundled {@code reference.conf}.
     */
    public static SemanticOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
