package org.ifjc.compiler.builtins;

import com.typesafe.config.Config;

/**
 * Language extensions that add builtins to the default table.
 *
 * @param boolThen  Enables {@code Ifj.read_bool} (BOOLTHEN extension).
 * @param statiCan  Enables {@code Ifj.is_int} (STATICAN extension).
 */
public record BuiltinOptions(boolean boolThen, boolean statiCan) {

    /**
     * Reads the {@code ext-boolthen} and {@code ext-statican} flags from a {@code ifjc.builtins} subtree.
     *
     * @param config The builtins configuration block.
     * @return The typed options.
     */
    public static BuiltinOptions fromConfig(Config config) {
        return new BuiltinOptions(config.getBoolean("ext-boolthen"), config.getBoolean("ext-statican"));
    }

    /**
     * @return Options with every extension disabled.
     */
    public static BuiltinOptions none() {
        return new BuiltinOptions(false, false);
    }
}
