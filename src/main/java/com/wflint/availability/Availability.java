package com.wflint.availability;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Contexts and special functions usable at one workflow location.
 *
 * @param contexts         Context names, e.g. {@code github}, {@code matrix}
 * @param specialFunctions Special function names in lower case, e.g. {@code always}, {@code hashfiles}
 */
public record Availability(Set<String> contexts, Set<String> specialFunctions) {

    /**
     * Result for a location that is not known.
     */
    public static final Availability NONE = new Availability(Set.of(), Set.of());

    public Availability {
        contexts = sorted(contexts);
        specialFunctions = sorted(specialFunctions);
    }

    public boolean hasContext(String name) {
        return name != null && contexts.contains(name);
    }

    public boolean hasSpecialFunction(String name) {
        return name != null && specialFunctions.contains(name);
    }

    private static Set<String> sorted(Collection<String> names) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(names));
    }
}
