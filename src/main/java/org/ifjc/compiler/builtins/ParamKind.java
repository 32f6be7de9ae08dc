package org.ifjc.compiler.builtins;

import org.ifjc.compiler.frontend.semantics.DataType;
import org.ifjc.compiler.frontend.semantics.TypeUnification;

/**
 * Coarse kind a builtin expects for one parameter.
 */
public enum ParamKind {
    ANY,
    STRING,
    NUMBER;

    /**
     * Checks an argument whose type tag has been inferred.
     * Tags that are not statically known are always accepted.
     *
     * @param type The inferred argument type.
     * @return false only if the argument is known to have the wrong kind.
     */
    public boolean accepts(DataType type) {
        if (this == ANY || !TypeUnification.isKnown(type)) {
            return true;
        }
        return this == STRING ? type == DataType.STRING : TypeUnification.isNumeric(type);
    }
}
