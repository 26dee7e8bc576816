package com.sentrius.expr;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Name bindings available while evaluating an expression.
 * Instances are immutable; use {@link #mergedOver(EvaluationContext)} to layer
 * overrides on top of a base context.
 */
public class EvaluationContext {
    private static final EvaluationContext EMPTY = new Builder().build();

    private final Map<String, Object> variables;
    private final Map<String, ExpressionFunction> functions;

    private EvaluationContext(Map<String, Object> variables, Map<String, ExpressionFunction> functions) {
        this.variables = Collections.unmodifiableMap(new HashMap<>(variables));
        this.functions = Collections.unmodifiableMap(new HashMap<>(functions));
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check if a variable is bound. A variable bound to null is still bound.
     * @param name The variable name
     * @return true if the name is bound
     */
    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Object getVariable(String name) {
        return variables.get(name);
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    public ExpressionFunction getFunction(String name) {
        return functions.get(name);
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Map<String, ExpressionFunction> getFunctions() {
        return functions;
    }

    /**
     * Layer this context over a base context.
     * Names bound here win; every other binding of the base is kept.
     *
     * @param base The context to override
     * @return A new context, neither input is modified
     */
    public EvaluationContext mergedOver(EvaluationContext base) {
        Map<String, Object> mergedVariables = new HashMap<>(base.variables);
        mergedVariables.putAll(variables);
        Map<String, ExpressionFunction> mergedFunctions = new HashMap<>(base.functions);
        mergedFunctions.putAll(functions);
        return new EvaluationContext(mergedVariables, mergedFunctions);
    }

    @Override
    public String toString() {
        return "EvaluationContext{variables=" + variables.keySet() + ", functions=" + functions.keySet() + "}";
    }

    /**
     * Builder for EvaluationContext.
     */
    public static class Builder {
        private final Map<String, Object> variables = new HashMap<>();
        private final Map<String, ExpressionFunction> functions = new HashMap<>();

        /**
         * Bind a variable.
         * @param name The variable name
         * @param value A Number, Boolean or null; numbers are stored as Double
         * @return this builder
         */
        public Builder variable(String name, Object value) {
            if (name == null) {
                throw new IllegalArgumentException("Variable name cannot be null");
            }
            if (value != null && !(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("Variable '" + name + "' must be numeric or boolean, got "
                    + value.getClass().getSimpleName());
            }
            variables.put(name, value instanceof Number ? ((Number) value).doubleValue() : value);
            return this;
        }

        public Builder variables(Map<String, ?> values) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                variable(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder function(String name, ExpressionFunction function) {
            if (name == null || function == null) {
                throw new IllegalArgumentException("Function name and implementation cannot be null");
            }
            functions.put(name, function);
            return this;
        }

        public Builder functions(Map<String, ? extends ExpressionFunction> values) {
            for (Map.Entry<String, ? extends ExpressionFunction> entry : values.entrySet()) {
                function(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(variables, functions);
        }
    }
}
