package org.ifjc.compiler.builtins;

import org.ifjc.compiler.frontend.semantics.DataType;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.ifjc.compiler.builtins.ParamKind.ANY;
import static org.ifjc.compiler.builtins.ParamKind.NUMBER;
import static org.ifjc.compiler.builtins.ParamKind.STRING;

/**
 * The standard {@code Ifj.*} builtin table.
 */
public class IfjBuiltins implements BuiltinProvider {

    private static final Logger log = LoggerFactory.getLogger(IfjBuiltins.class);

    public static final String PREFIX = "Ifj.";

    private static final List<BuiltinFunction> CORE = List.of(
            new BuiltinFunction(PREFIX + "read_str", List.of(), DataType.UNKNOWN),
            new BuiltinFunction(PREFIX + "read_num", List.of(), DataType.UNKNOWN),
            new BuiltinFunction(PREFIX + "write", List.of(ANY), DataType.VOID),
            new BuiltinFunction(PREFIX + "floor", List.of(NUMBER), DataType.INT),
            new BuiltinFunction(PREFIX + "str", List.of(ANY), DataType.STRING),
            new BuiltinFunction(PREFIX + "length", List.of(STRING), DataType.INT),
            new BuiltinFunction(PREFIX + "substring", List.of(STRING, NUMBER, NUMBER), DataType.UNKNOWN),
            new BuiltinFunction(PREFIX + "strcmp", List.of(STRING, STRING), DataType.INT),
            new BuiltinFunction(PREFIX + "ord", List.of(STRING, NUMBER), DataType.INT),
            new BuiltinFunction(PREFIX + "chr", List.of(NUMBER), DataType.STRING));

    private static final BuiltinFunction READ_BOOL =
            new BuiltinFunction(PREFIX + "read_bool", List.of(), DataType.UNKNOWN);
    private static final BuiltinFunction IS_INT =
            new BuiltinFunction(PREFIX + "is_int", List.of(ANY), DataType.BOOL);

    private final Map<String, BuiltinFunction> byName = new LinkedHashMap<>();

    public IfjBuiltins() {
        CORE.forEach(b -> byName.put(b.qualifiedName(), b));
        byName.put(READ_BOOL.qualifiedName(), READ_BOOL);
        byName.put(IS_INT.qualifiedName(), IS_INT);
    }

    @Override
    public void install(FunctionRegistry registry, BuiltinOptions options) {
        for (BuiltinFunction builtin : enabled(options)) {
            registry.registerBuiltin(builtin.qualifiedName(), builtin.arity(), builtin.returnType());
        }
        log.debug("installed builtins (boolthen={}, statican={})", options.boolThen(), options.statiCan());
    }

    /**
     * @return The rows enabled by {@code options}, core rows first.
     */
    public List<BuiltinFunction> enabled(BuiltinOptions options) {
        List<BuiltinFunction> rows = new ArrayList<>(CORE);
        if (options.boolThen()) rows.add(READ_BOOL);
        if (options.statiCan()) rows.add(IS_INT);
        return rows;
    }

    @Override
    public boolean isBuiltinQualifiedName(String name) {
        return name != null && name.startsWith(PREFIX);
    }

    @Override
    public Optional<List<ParamKind>> parameterSpec(String name) {
        return Optional.ofNullable(byName.get(name)).map(BuiltinFunction::parameters);
    }
}
