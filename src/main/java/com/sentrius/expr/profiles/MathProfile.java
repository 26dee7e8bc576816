package com.sentrius.expr.profiles;

import com.sentrius.expr.EvaluationContext;
import com.sentrius.expr.ExpressionFunction;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Pre-built context with the standard mathematical constants and functions.
 */
public class MathProfile {

    private static final List<String> CONSTANTS = List.of("pi", "e");

    private static final List<String> FUNCTIONS = List.of(
        "sin", "cos", "tan", "asin", "acos", "atan",
        "sinh", "cosh", "tanh",
        "log", "ln", "log2", "exp",
        "sqrt", "abs", "floor", "ceil", "round",
        "gcd", "lcm", "factorial", "isPrime"
    );

    private static final EvaluationContext DEFAULT_CONTEXT = createContext();

    /**
     * Shared immutable instance of {@link #createContext()}.
     */
    public static EvaluationContext defaultContext() {
        return DEFAULT_CONTEXT;
    }

    /**
     * Return a context pre-populated with the built-in constants and functions.
     */
    public static EvaluationContext createContext() {
        return EvaluationContext.builder()
            .variable("pi", Math.PI)
            .variable("e", Math.E)

            .function("sin", unary("sin", Math::sin))
            .function("cos", unary("cos", Math::cos))
            .function("tan", unary("tan", Math::tan))
            .function("asin", unary("asin", Math::asin))
            .function("acos", unary("acos", Math::acos))
            .function("atan", unary("atan", Math::atan))

            .function("sinh", unary("sinh", Math::sinh))
            .function("cosh", unary("cosh", Math::cosh))
            .function("tanh", unary("tanh", Math::tanh))

            .function("log", unary("log", Math::log10))
            .function("ln", unary("ln", Math::log))
            .function("log2", unary("log2", x -> Math.log(x) / Math.log(2)))
            .function("exp", unary("exp", Math::exp))

            .function("sqrt", unary("sqrt", Math::sqrt))
            .function("abs", unary("abs", Math::abs))
            .function("floor", unary("floor", Math::floor))
            .function("ceil", unary("ceil", Math::ceil))
            .function("round", unary("round", MathProfile::roundHalfUp))

            .function("gcd", args -> {
                checkArity("gcd", args, 2);
                return gcd(number("gcd", args.get(0)), number("gcd", args.get(1)));
            })
            .function("lcm", args -> {
                checkArity("lcm", args, 2);
                return lcm(number("lcm", args.get(0)), number("lcm", args.get(1)));
            })
            .function("factorial", args -> {
                checkArity("factorial", args, 1);
                return factorial(number("factorial", args.get(0)));
            })
            .function("isPrime", args -> {
                checkArity("isPrime", args, 1);
                return isPrime(number("isPrime", args.get(0)));
            })
            .build();
    }

    public static List<String> getConstants() {
        return CONSTANTS;
    }

    public static List<String> getFunctionNames() {
        return FUNCTIONS;
    }

    /**
     * Greatest common divisor by the Euclidean algorithm, on absolute values.
     */
    public static double gcd(double a, double b) {
        double x = Math.abs(a);
        double y = Math.abs(b);
        while (y > 0) {
            double temp = y;
            y = x % y;
            x = temp;
        }
        return x;
    }

    public static double lcm(double a, double b) {
        double divisor = gcd(a, b);
        if (divisor == 0) {
            return 0;
        }
        return Math.abs(a * b) / divisor;
    }

    public static double factorial(double n) {
        if (n < 0 || !isInteger(n)) {
            throw new IllegalArgumentException("Factorial is only defined for non-negative integers");
        }
        double result = 1;
        for (long i = 2; i <= n && !Double.isInfinite(result); i++) {
            result *= i;
        }
        return result;
    }

    /**
     * Trial division up to the square root, testing only 6k +/- 1 candidates.
     */
    public static boolean isPrime(double n) {
        if (n <= 1 || !isInteger(n)) {
            return false;
        }
        if (n <= 3) {
            return true;
        }
        if (n % 2 == 0 || n % 3 == 0) {
            return false;
        }
        double limit = Math.sqrt(n);
        for (double i = 5; i <= limit; i += 6) {
            if (n % i == 0 || n % (i + 2) == 0) {
                return false;
            }
        }
        return true;
    }

    private static double roundHalfUp(double x) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            return x;
        }
        return Math.floor(x + 0.5);
    }

    private static boolean isInteger(double n) {
        return !Double.isInfinite(n) && n == Math.rint(n);
    }

    private static ExpressionFunction unary(String name, DoubleUnaryOperator operator) {
        return args -> {
            checkArity(name, args, 1);
            return operator.applyAsDouble(number(name, args.get(0)));
        };
    }

    private static void checkArity(String name, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw new IllegalArgumentException("Function '" + name + "' expects " + expected
                + (expected == 1 ? " argument" : " arguments") + " but got " + args.size());
        }
    }

    private static double number(String name, Object arg) {
        if (arg instanceof Number) {
            return ((Number) arg).doubleValue();
        }
        String type = arg == null ? "null" : arg instanceof Boolean ? "boolean" : arg.getClass().getSimpleName();
        throw new IllegalArgumentException(name + ": Expected a number but got " + type);
    }
}
