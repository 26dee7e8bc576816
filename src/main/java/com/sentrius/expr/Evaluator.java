package com.sentrius.expr;

import com.sentrius.expr.model.BinaryOperationNode;
import com.sentrius.expr.model.EvaluationResult;
import com.sentrius.expr.model.FunctionCallNode;
import com.sentrius.expr.model.Node;
import com.sentrius.expr.model.NumberNode;
import com.sentrius.expr.model.UnaryOperationNode;
import com.sentrius.expr.model.VariableNode;
import com.sentrius.expr.profiles.MathProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates expression trees against an {@link EvaluationContext}.
 * Supports arithmetic, comparison and logical operators plus function calls.
 * The walk stops at the first failing node and that failure becomes the
 * single error of the result; nothing is thrown to the caller.
 */
public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final EvaluationContext context;

    /**
     * Create an evaluator over the built-in constants and functions.
     */
    public Evaluator() {
        this(EvaluationContext.empty());
    }

    /**
     * Create an evaluator whose bindings override the built-ins name by name.
     * @param customContext The overrides; null means none
     */
    public Evaluator(EvaluationContext customContext) {
        EvaluationContext overrides = customContext != null ? customContext : EvaluationContext.empty();
        this.context = overrides.mergedOver(MathProfile.defaultContext());
    }

    /**
     * The merged context this evaluator resolves names against.
     */
    public EvaluationContext getContext() {
        return context;
    }

    /**
     * Evaluate an AST.
     * @param node The root node
     * @return The value, or the first error encountered
     */
    public EvaluationResult evaluate(Node node) {
        if (node == null) {
            return EvaluationResult.failure("Invalid expression");
        }
        try {
            return EvaluationResult.success(evaluateNode(node));
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.debug("Evaluation of {} failed: {}", node, e.getMessage());
            return EvaluationResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected failure evaluating {}", node, e);
            return EvaluationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (StackOverflowError e) {
            log.warn("Expression nested too deeply to evaluate");
            return EvaluationResult.failure("Expression is nested too deeply");
        }
    }

    private Object evaluateNode(Node node) {
        if (node instanceof NumberNode) {
            return evaluateNumber((NumberNode) node);
        } else if (node instanceof BinaryOperationNode) {
            return evaluateBinary((BinaryOperationNode) node);
        } else if (node instanceof UnaryOperationNode) {
            return evaluateUnary((UnaryOperationNode) node);
        } else if (node instanceof FunctionCallNode) {
            return evaluateFunctionCall((FunctionCallNode) node);
        } else if (node instanceof VariableNode) {
            return evaluateVariable((VariableNode) node);
        }
        throw new IllegalArgumentException("Unknown node type: " + node.getClass().getSimpleName());
    }

    private static Double evaluateNumber(NumberNode node) {
        String text = node.getValue();
        if (text == null || !isNumericLiteral(text)) {
            throw new IllegalArgumentException("Invalid number: " + text);
        }
        return Double.parseDouble(text);
    }

    private Object evaluateBinary(BinaryOperationNode node) {
        // Both sides are evaluated first, && and || included.
        Object left = evaluateNode(node.getLeft());
        Object right = evaluateNode(node.getRight());
        String op = node.getOperator();

        switch (op) {
            case "+":
            case "-":
            case "*":
            case "/":
            case "%":
            case "^":
                return evaluateArithmetic(toDouble(left), toDouble(right), op);
            case "==":
                return compareEquals(left, right);
            case "!=":
                return !compareEquals(left, right);
            case "<":
            case ">":
            case "<=":
            case ">=":
                return evaluateRelational(left, right, op);
            case "&&":
                return toBoolean(left) && toBoolean(right);
            case "||":
                return toBoolean(left) || toBoolean(right);
            default:
                throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
    }

    private static Double evaluateArithmetic(double left, double right, String op) {
        switch (op) {
            case "+":
                return left + right;
            case "-":
                return left - right;
            case "*":
                return left * right;
            case "/":
                if (right == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                return left / right;
            case "%":
                if (right == 0) {
                    throw new ArithmeticException("Modulo by zero");
                }
                return left % right;
            case "^":
                return Math.pow(left, right);
            default:
                throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
    }

    private Object evaluateUnary(UnaryOperationNode node) {
        Object operand = evaluateNode(node.getOperand());
        switch (node.getOperator()) {
            case "+":
                return toDouble(operand);
            case "-":
                return -toDouble(operand);
            case "!":
                return !toBoolean(operand);
            default:
                throw new IllegalArgumentException("Unknown unary operator: " + node.getOperator());
        }
    }

    private Object evaluateFunctionCall(FunctionCallNode node) {
        ExpressionFunction function = context.getFunction(node.getName());
        if (function == null) {
            throw new IllegalArgumentException("Unknown function: " + node.getName());
        }

        List<Object> args = new ArrayList<>(node.getArguments().size());
        for (Node argument : node.getArguments()) {
            args.add(evaluateNode(argument));
        }

        Object result = function.apply(args);
        if (result == null || result instanceof Boolean) {
            return result;
        }
        if (result instanceof Number) {
            return ((Number) result).doubleValue();
        }
        throw new IllegalArgumentException("Function '" + node.getName() + "' returned unsupported value of type "
            + result.getClass().getSimpleName());
    }

    private Object evaluateVariable(VariableNode node) {
        if (!context.hasVariable(node.getName())) {
            throw new IllegalArgumentException("Unknown variable: " + node.getName());
        }
        return context.getVariable(node.getName());
    }

    private static boolean evaluateRelational(Object left, Object right, String op) {
        if (!(left instanceof Number && right instanceof Number)) {
            throw new IllegalArgumentException("Cannot compare non-numeric values with " + op);
        }
        double l = ((Number) left).doubleValue();
        double r = ((Number) right).doubleValue();

        switch (op) {
            case "<":
                return l < r;
            case ">":
                return l > r;
            case "<=":
                return l <= r;
            case ">=":
                return l >= r;
            default:
                throw new IllegalArgumentException("Unknown binary operator: " + op);
        }
    }

    private static boolean compareEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return left.equals(right);
    }

    private static double toDouble(Object obj) {
        if (obj instanceof Number) {
            return ((Number) obj).doubleValue();
        }
        throw new IllegalArgumentException("Expected a number but got " + (obj instanceof Boolean ? "boolean" : "null"));
    }

    /**
     * Zero, NaN, false and null are falsy; every other value is truthy.
     */
    static boolean toBoolean(Object obj) {
        if (obj instanceof Boolean) {
            return (Boolean) obj;
        }
        if (obj instanceof Number) {
            double d = ((Number) obj).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        return obj != null;
    }

    private static boolean isNumericLiteral(String text) {
        int length = text.length();
        if (length == 0) {
            return false;
        }
        int pos = 0;
        int digits = 0;
        while (pos < length && Tokenizer.isDigit(text.charAt(pos))) {
            pos++;
            digits++;
        }
        if (pos < length && text.charAt(pos) == '.') {
            pos++;
            while (pos < length && Tokenizer.isDigit(text.charAt(pos))) {
                pos++;
                digits++;
            }
        }
        if (digits == 0) {
            return false;
        }
        if (pos < length && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            pos++;
            if (pos < length && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            int exponentDigits = 0;
            while (pos < length && Tokenizer.isDigit(text.charAt(pos))) {
                pos++;
                exponentDigits++;
            }
            if (exponentDigits == 0) {
                return false;
            }
        }
        return pos == length;
    }
}
