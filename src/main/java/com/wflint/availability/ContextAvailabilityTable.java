package com.wflint.availability;

import com.wflint.exception.ConfigurationException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Which contexts and special functions may be referenced at each workflow location.
 * <p>
 * The table is immutable once constructed and may be shared between threads
 * without synchronization. Lookups never fail: an unknown location resolves to
 * {@link Availability#NONE}, while every known location has at least one context.
 */
public final class ContextAvailabilityTable {

    /**
     * Shape of every context and special function name.
     */
    public static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    /**
     * Location of the bundled availability data.
     */
    public static final String DEFAULT_PATH = "classpath:context-availability.yaml";

    private final Map<String, Availability> entries;

    /**
     * @param entries Availability per location key
     * @throws ConfigurationException if a location has no context or a name is malformed
     */
    public ContextAvailabilityTable(Map<String, Availability> entries) {
        Map<String, Availability> copy = new TreeMap<>();
        entries.forEach((key, availability) -> {
            validate(key, availability);
            copy.put(key, availability);
        });
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * The table bundled with the library, loaded on first use.
     */
    public static ContextAvailabilityTable defaultTable() {
        return DefaultTableHolder.TABLE;
    }

    /**
     * Resolve the contexts and special functions usable at a location.
     *
     * @param key Location key, e.g. {@code jobs.<job_id>.steps.if}
     * @return Availability at the location, {@link Availability#NONE} if the key is unknown
     */
    public Availability resolve(String key) {
        if (key == null) {
            return Availability.NONE;
        }
        return entries.getOrDefault(key, Availability.NONE);
    }

    public boolean isKnown(String key) {
        return key != null && entries.containsKey(key);
    }

    /**
     * All known location keys in sorted order.
     */
    public Set<String> keys() {
        return entries.keySet();
    }

    Map<String, Availability> entries() {
        return entries;
    }

    private static void validate(String key, Availability availability) {
        if (key == null || key.isBlank()) {
            throw new ConfigurationException("Location key must not be blank");
        }
        if (availability == null || availability.contexts().isEmpty()) {
            throw new ConfigurationException("No context is available at '" + key + "'");
        }
        for (String context : availability.contexts()) {
            checkName(key, "context", context);
        }
        for (String function : availability.specialFunctions()) {
            checkName(key, "special function", function);
        }
    }

    private static void checkName(String key, String kind, String name) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new ConfigurationException("Invalid " + kind + " name '" + name + "' at '" + key
                    + "', names must match " + NAME_PATTERN.pattern());
        }
    }

    @Override
    public String toString() {
        return "ContextAvailabilityTable" + entries;
    }

    private static final class DefaultTableHolder {
        private static final ContextAvailabilityTable TABLE = AvailabilityLoader.load(DEFAULT_PATH);
    }
}
