package com.wflint.availability;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Special functions and the locations where each of them may be called.
 * <p>
 * This is the inverse view of a {@link ContextAvailabilityTable}. It is derived
 * from the table's function sets, so a function lists location {@code k} exactly
 * when {@code resolve(k)} lists the function.
 */
public final class SpecialFunctionRegistry {

    private final Map<String, Set<String>> keysByFunction;

    public SpecialFunctionRegistry(ContextAvailabilityTable table) {
        Map<String, SortedSet<String>> inverse = new TreeMap<>();
        table.entries().forEach((key, availability) -> {
            for (String function : availability.specialFunctions()) {
                inverse.computeIfAbsent(function, f -> new TreeSet<>()).add(key);
            }
        });

        Map<String, Set<String>> frozen = new TreeMap<>();
        inverse.forEach((function, keys) -> frozen.put(function, Collections.unmodifiableSortedSet(keys)));
        this.keysByFunction = Collections.unmodifiableMap(frozen);
    }

    /**
     * Registry over {@link ContextAvailabilityTable#defaultTable()}.
     */
    public static SpecialFunctionRegistry defaultRegistry() {
        return DefaultRegistryHolder.REGISTRY;
    }

    /**
     * Locations where a special function may be called.
     *
     * @param functionName Lower-case function name, e.g. {@code hashfiles}
     * @return Location keys, empty if the function is not a special function
     */
    public Set<String> keysFor(String functionName) {
        if (functionName == null) {
            return Set.of();
        }
        return keysByFunction.getOrDefault(functionName, Set.of());
    }

    public boolean isRegistered(String functionName) {
        return functionName != null && keysByFunction.containsKey(functionName);
    }

    /**
     * All special function names in sorted order.
     */
    public Set<String> functionNames() {
        return keysByFunction.keySet();
    }

    /**
     * Diagnostic fragment naming where a function may be called,
     * e.g. {@code only valid at "jobs.<job_id>.if", "jobs.<job_id>.steps.if"}.
     */
    public String describeAllowedKeys(String functionName) {
        Set<String> keys = keysFor(functionName);
        if (keys.isEmpty()) {
            return "not a special function";
        }
        StringBuilder sb = new StringBuilder("only valid at ");
        boolean first = true;
        for (String key : keys) {
            if (!first) {
                sb.append(", ");
            }
            sb.append('"').append(key).append('"');
            first = false;
        }
        return sb.toString();
    }

    private static final class DefaultRegistryHolder {
        private static final SpecialFunctionRegistry REGISTRY =
                new SpecialFunctionRegistry(ContextAvailabilityTable.defaultTable());
    }
}
