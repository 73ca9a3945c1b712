package com.wflint.availability;

import com.wflint.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContextAvailabilityTable.
 */
class ContextAvailabilityTableTest {

    private final ContextAvailabilityTable table = ContextAvailabilityTable.defaultTable();
    private final SpecialFunctionRegistry registry = SpecialFunctionRegistry.defaultRegistry();

    static List<String> workflowKeys() {
        return WorkflowKeys.ALL;
    }

    @ParameterizedTest(name = "{0}")
    @DisplayName("Should resolve contexts for every workflow key")
    @MethodSource("workflowKeys")
    void shouldResolveEveryKey(String key) {
        Availability availability = table.resolve(key);

        assertNotNull(availability);
        assertFalse(availability.contexts().isEmpty(), "no context is available for " + key);
        for (String context : availability.contexts()) {
            assertTrue(ContextAvailabilityTable.NAME_PATTERN.matcher(context).matches(), context);
        }
        for (String function : availability.specialFunctions()) {
            assertTrue(ContextAvailabilityTable.NAME_PATTERN.matcher(function).matches(), function);
            assertTrue(registry.isRegistered(function), function + " is not registered");
            assertTrue(registry.keysFor(function).contains(key),
                    key + " is not in locations of " + function + ": " + registry.keysFor(function));
        }
    }

    @Test
    @DisplayName("Should know exactly the workflow keys")
    void shouldKnowExactlyWorkflowKeys() {
        assertEquals(Set.copyOf(WorkflowKeys.ALL), table.keys());
        assertTrue(table.isKnown(WorkflowKeys.STEP_IF));
        assertFalse(table.isKnown("unknown.workflow.key"));
        assertFalse(table.isKnown(null));
    }

    @Test
    @DisplayName("Should return empty sets for unknown keys")
    void shouldReturnEmptyForUnknownKey() {
        Availability availability = table.resolve("unknown.workflow.key");

        assertTrue(availability.contexts().isEmpty());
        assertTrue(availability.specialFunctions().isEmpty());
        assertSame(Availability.NONE, table.resolve(null));
    }

    @Test
    @DisplayName("Should resolve status functions at job and step conditions")
    void shouldResolveStatusFunctions() {
        Availability jobIf = table.resolve(WorkflowKeys.JOB_IF);
        Availability stepIf = table.resolve(WorkflowKeys.STEP_IF);

        assertEquals(Set.of("always", "cancelled", "failure", "success"), jobIf.specialFunctions());
        assertEquals(Set.of("always", "cancelled", "failure", "hashfiles", "success"), stepIf.specialFunctions());
        assertTrue(jobIf.hasContext("needs"));
        assertFalse(jobIf.hasContext("matrix"));
        assertTrue(stepIf.hasContext("steps"));
        assertFalse(stepIf.hasContext("secrets"));
        assertFalse(stepIf.hasContext(null));
    }

    @Test
    @DisplayName("Should not offer special functions at workflow level")
    void shouldNotOfferFunctionsAtWorkflowLevel() {
        Availability env = table.resolve(WorkflowKeys.ENV);

        assertEquals(Set.of("github", "inputs", "secrets", "vars"), env.contexts());
        assertTrue(env.specialFunctions().isEmpty());
        assertFalse(env.hasSpecialFunction("hashfiles"));
    }

    @Test
    @DisplayName("Should return immutable sorted sets")
    void shouldReturnImmutableSets() {
        Availability availability = table.resolve(WorkflowKeys.JOB_OUTPUTS);

        assertThrows(UnsupportedOperationException.class, () -> availability.contexts().add("foo"));
        assertThrows(UnsupportedOperationException.class, () -> availability.specialFunctions().clear());
        assertThrows(UnsupportedOperationException.class, () -> table.keys().remove(WorkflowKeys.ENV));
        assertEquals("env", availability.contexts().iterator().next());
    }

    @Test
    @DisplayName("Should load the default table only once")
    void shouldShareDefaultTable() {
        assertSame(ContextAvailabilityTable.defaultTable(), ContextAvailabilityTable.defaultTable());
    }

    @Test
    @DisplayName("Should serve concurrent readers")
    void shouldServeConcurrentReaders() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> {
                    int total = 0;
                    for (String key : WorkflowKeys.ALL) {
                        total += table.resolve(key).contexts().size();
                    }
                    return total;
                }));
            }

            int expected = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<Integer> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should reject a location without contexts")
    void shouldRejectLocationWithoutContexts() {
        Map<String, Availability> entries = Map.of("run-name", new Availability(Set.of(), Set.of()));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new ContextAvailabilityTable(entries));
        assertTrue(e.getMessage().contains("run-name"));
    }

    @Test
    @DisplayName("Should reject malformed names")
    void shouldRejectMalformedNames() {
        assertThrows(ConfigurationException.class, () -> new ContextAvailabilityTable(
                Map.of("run-name", new Availability(Set.of("GitHub"), Set.of()))));
        assertThrows(ConfigurationException.class, () -> new ContextAvailabilityTable(
                Map.of("run-name", new Availability(Set.of("github"), Set.of("hashFiles")))));
        assertThrows(ConfigurationException.class, () -> new ContextAvailabilityTable(
                Map.of(" ", new Availability(Set.of("github"), Set.of()))));
    }
}
