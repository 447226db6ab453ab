package com.benefits.operator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class OperatorRegistryTest {

    @Test
    @DisplayName("Standard registry knows the base operators and var")
    void standardOperators() {
        OperatorRegistry registry = OperatorRegistry.standard();

        for (String name : new String[]{"==", "===", "!=", "!==", ">", ">=", "<", "<=", "!", "!!", "and", "or",
                "if", "?:", "+", "-", "*", "/", "%", "min", "max", "cat", "substr", "in", "merge",
                "map", "filter", "reduce", "all", "some", "none", "missing", "missing_some", "log"}) {
            assertTrue(registry.contains(name), name);
        }
        assertTrue(registry.contains("var"));
        assertFalse(registry.find("var").isPresent());
    }

    @Test
    @DisplayName("Registering replaces an existing operator")
    void registerReplaces() {
        OperatorRegistry registry = OperatorRegistry.standard();
        int before = registry.size();

        registry.register("+", (EagerOperator) args -> "replaced");

        assertEquals(before, registry.size());
        assertEquals("replaced", ((EagerOperator) registry.find("+").orElseThrow()).applyValues(java.util.List.of()));
    }

    @Test
    @DisplayName("var, blank names and null operators are rejected")
    void invalidRegistrations() {
        OperatorRegistry registry = new OperatorRegistry();

        assertThrows(IllegalArgumentException.class, () -> registry.register("var", (EagerOperator) args -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", (EagerOperator) args -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register("x", null));
    }

    @Test
    @DisplayName("Benefit operators register and unregister as a group")
    void benefitOperators() {
        OperatorRegistry registry = OperatorRegistry.standard();
        BenefitOperators.register(registry, Clock.systemUTC());

        BenefitOperators.NAMES.forEach(name -> assertTrue(registry.contains(name), name));

        BenefitOperators.unregister(registry);

        BenefitOperators.NAMES.forEach(name -> assertFalse(registry.contains(name), name));
        assertFalse(registry.unregister("between"));
    }

    @Test
    @DisplayName("Separate registries do not share registrations")
    void registriesAreIndependent() {
        OperatorRegistry first = OperatorRegistry.standard();
        OperatorRegistry second = OperatorRegistry.standard();

        first.register("double", (EagerOperator) args -> 2 * Values.toNumber(args.get(0)));

        assertTrue(first.contains("double"));
        assertFalse(second.contains("double"));
    }
}
