package com.benefits.operator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table of operators available to a {@link com.benefits.expression.RuleInterpreter}.
 * <p>
 * Each interpreter owns its registry. Registration is meant to happen at startup;
 * the table is not safe for concurrent mutation.
 */
public class OperatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperatorRegistry.class);

    /**
     * Reserved for variable references, handled by the interpreter itself.
     */
    public static final String VAR = "var";

    private final Map<String, Operator> operators = new LinkedHashMap<>();

    /**
     * Create an empty registry.
     */
    public OperatorRegistry() {
    }

    /**
     * Create a registry holding the base operators.
     */
    public static OperatorRegistry standard() {
        OperatorRegistry registry = new OperatorRegistry();
        StandardOperators.registerAll(registry);
        return registry;
    }

    /**
     * Register an operator. Registering a name again replaces the previous operator.
     *
     * @throws IllegalArgumentException if the name is blank or reserved
     */
    public OperatorRegistry register(String name, Operator operator) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operator name must not be blank");
        }
        if (VAR.equals(name)) {
            throw new IllegalArgumentException("Operator name 'var' is reserved");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Operator must not be null: " + name);
        }
        Operator previous = operators.put(name, operator);
        if (previous != null && previous != operator) {
            log.debug("Replaced operator: {}", name);
        }
        return this;
    }

    /**
     * Remove an operator.
     *
     * @return true if it was registered
     */
    public boolean unregister(String name) {
        return operators.remove(name) != null;
    }

    public Optional<Operator> find(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    public boolean contains(String name) {
        return VAR.equals(name) || operators.containsKey(name);
    }

    /**
     * Registered operator names in registration order (excluding {@code var}).
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(operators.keySet());
    }

    public int size() {
        return operators.size();
    }
}
