package com.formula.function;

import com.formula.analysis.ResultType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.formula.function.FunctionDefinition.VARIADIC;

/**
 * Static registry of the functions a formula may call.
 * Adding a function means adding one {@link #register} line here.
 */
public final class FunctionRegistry {

    private static final Map<String, FunctionDefinition> DEFINITIONS;

    static {
        Map<String, FunctionDefinition> defs = new TreeMap<>();
        register(defs, "abs", 1, 1, ReturnTypeRule.fixed(ResultType.NUMBER), BuiltinFunctions::abs);
        register(defs, "min", 1, VARIADIC, ReturnTypeRule.fixed(ResultType.NUMBER), BuiltinFunctions::min);
        register(defs, "max", 1, VARIADIC, ReturnTypeRule.fixed(ResultType.NUMBER), BuiltinFunctions::max);
        register(defs, "round", 1, 2, ReturnTypeRule.fixed(ResultType.NUMBER), BuiltinFunctions::round);
        register(defs, "sum", 0, VARIADIC, ReturnTypeRule.fixed(ResultType.NUMBER), BuiltinFunctions::sum);
        register(defs, "pow", 2, 2, ReturnTypeRule.fixed(ResultType.NUMBER), BuiltinFunctions::pow);
        register(defs, "concat", 0, VARIADIC, ReturnTypeRule.fixed(ResultType.TEXT), BuiltinFunctions::concat);
        register(defs, "upper", 1, 1, ReturnTypeRule.fixed(ResultType.TEXT), BuiltinFunctions::upper);
        register(defs, "lower", 1, 1, ReturnTypeRule.fixed(ResultType.TEXT), BuiltinFunctions::lower);
        register(defs, "if_else", 3, 3, (name, types, warnings) ->
                commonType(name, types.subList(1, types.size()), warnings), BuiltinFunctions::ifElse);
        register(defs, "coalesce", 1, VARIADIC, FunctionRegistry::commonType, BuiltinFunctions::coalesce);
        register(defs, "is_empty", 1, 1, ReturnTypeRule.fixed(ResultType.BOOLEAN), BuiltinFunctions::isEmpty);
        DEFINITIONS = Collections.unmodifiableMap(defs);
    }

    private FunctionRegistry() {
    }

    public static Optional<FunctionDefinition> find(String name) {
        return Optional.ofNullable(DEFINITIONS.get(name));
    }

    public static boolean isBuiltin(String name) {
        return DEFINITIONS.containsKey(name);
    }

    /**
     * Sorted names of all built-in functions.
     */
    public static Set<String> names() {
        return DEFINITIONS.keySet();
    }

    /**
     * Comma-separated allow-list, as shown in "Unknown function" errors.
     */
    public static String allowedNamesText() {
        return String.join(", ", DEFINITIONS.keySet());
    }

    private static void register(Map<String, FunctionDefinition> defs, String name, int minArity, int maxArity,
                                 ReturnTypeRule returnType, FormulaFunction implementation) {
        defs.put(name, new FunctionDefinition(name, minArity, maxArity, returnType, implementation));
    }

    /**
     * The single known type shared by the given values, UNKNOWN when they disagree.
     * UNKNOWN inputs (null literals, untyped fields) do not take part in the agreement.
     */
    private static ResultType commonType(String name, List<ResultType> types, List<String> warnings) {
        Set<ResultType> known = EnumSet.noneOf(ResultType.class);
        for (ResultType type : types) {
            if (type != ResultType.UNKNOWN) {
                known.add(type);
            }
        }
        if (known.size() == 1) {
            return known.iterator().next();
        }
        if (known.size() > 1) {
            warnings.add("Function '" + name + "' has arguments of mixed types " + known
                    + ", result type is UNKNOWN");
        }
        return ResultType.UNKNOWN;
    }
}
