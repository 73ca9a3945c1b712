package com.wflint.availability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpecialFunctionRegistry.
 */
class SpecialFunctionRegistryTest {

    private final ContextAvailabilityTable table = ContextAvailabilityTable.defaultTable();
    private final SpecialFunctionRegistry registry = SpecialFunctionRegistry.defaultRegistry();

    @Test
    @DisplayName("Should register functions with valid names and locations")
    void shouldRegisterFunctions() {
        assertFalse(registry.functionNames().isEmpty());

        for (String function : registry.functionNames()) {
            assertTrue(ContextAvailabilityTable.NAME_PATTERN.matcher(function).matches(), function);
            Set<String> keys = registry.keysFor(function);
            assertFalse(keys.isEmpty(), "no location for " + function);
            for (String key : keys) {
                assertTrue(table.resolve(key).hasSpecialFunction(function),
                        function + " is not available at " + key);
            }
        }
    }

    @Test
    @DisplayName("Should agree with the table in both directions")
    void shouldAgreeWithTable() {
        for (String key : table.keys()) {
            for (String function : table.resolve(key).specialFunctions()) {
                assertTrue(registry.keysFor(function).contains(key));
            }
        }
    }

    @Test
    @DisplayName("Should list the bundled special functions")
    void shouldListBundledFunctions() {
        assertEquals(Set.of("always", "cancelled", "failure", "hashfiles", "success"), registry.functionNames());
        assertEquals(Set.of(WorkflowKeys.JOB_IF, WorkflowKeys.STEP_IF), registry.keysFor("always"));
        assertEquals(8, registry.keysFor("hashfiles").size());
        assertTrue(registry.keysFor("hashfiles").contains(WorkflowKeys.STEP_RUN));
    }

    @Test
    @DisplayName("Should return empty locations for unknown functions")
    void shouldReturnEmptyForUnknownFunction() {
        assertTrue(registry.keysFor("no-such-function").isEmpty());
        assertTrue(registry.keysFor(null).isEmpty());
        assertFalse(registry.isRegistered("contains"));
        assertFalse(registry.isRegistered(null));
    }

    @Test
    @DisplayName("Should describe where a function may be called")
    void shouldDescribeAllowedKeys() {
        assertEquals("only valid at \"jobs.<job_id>.if\", \"jobs.<job_id>.steps.if\"",
                registry.describeAllowedKeys("success"));
        assertEquals("not a special function", registry.describeAllowedKeys("format"));
    }

    @Test
    @DisplayName("Should be derived from the given table")
    void shouldDeriveFromTable() {
        ContextAvailabilityTable custom = new ContextAvailabilityTable(Map.of(
                "a", new Availability(Set.of("github"), Set.of("always")),
                "b", new Availability(Set.of("github"), Set.of("always", "success")),
                "c", new Availability(Set.of("github"), Set.of())));

        SpecialFunctionRegistry derived = new SpecialFunctionRegistry(custom);

        assertEquals(Set.of("always", "success"), derived.functionNames());
        assertEquals(Set.of("a", "b"), derived.keysFor("always"));
        assertEquals(Set.of("b"), derived.keysFor("success"));
        assertThrows(UnsupportedOperationException.class, () -> derived.keysFor("always").add("c"));
    }
}
