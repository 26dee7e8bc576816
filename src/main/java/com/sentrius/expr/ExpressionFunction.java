package com.sentrius.expr;

import java.util.List;

/**
 * A callable bound to a name in an {@link EvaluationContext}.
 * Every function receives its already evaluated arguments in call order and
 * validates its own arity.
 */
@FunctionalInterface
public interface ExpressionFunction {

    /**
     * @param args The evaluated arguments; values are Double, Boolean or null
     * @return The function result
     * @throws IllegalArgumentException if the arguments are not acceptable
     */
    Object apply(List<Object> args);
}
