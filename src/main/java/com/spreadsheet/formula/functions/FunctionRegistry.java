package com.spreadsheet.formula.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Function name -> definition. Names are case-insensitive.
 * Safe to share between workbooks and to extend while they are in use.
 */
public class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * A registry holding every built-in function.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        MathFunctions.registerAll(registry);
        LogicalFunctions.registerAll(registry);
        LookupFunctions.registerAll(registry);
        TextFunctions.registerAll(registry);
        DateFunctions.registerAll(registry);
        ConditionalFunctions.registerAll(registry);
        InfoFunctions.registerAll(registry);
        return registry;
    }

    public void register(FunctionDefinition definition) {
        FunctionDefinition previous = functions.put(definition.getName(), definition);
        if (previous != null) {
            LOG.info("Function {} replaced", definition.getName());
        }
    }

    /**
     * Extension point for hosts and macros. Volatility has to be stated: a volatile
     * function is recomputed on every recalculation pass.
     */
    public void register(String name, Arity arity, boolean isVolatile, FormulaFunction implementation) {
        register(FunctionDefinition.builder(name)
                .arity(arity)
                .volatileResult(isVolatile)
                .implementation(implementation)
                .build());
    }

    public Optional<FunctionDefinition> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean isVolatile(String name) {
        return lookup(name).map(FunctionDefinition::isVolatile).orElse(false);
    }

    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }
}
