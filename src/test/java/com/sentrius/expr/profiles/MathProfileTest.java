package com.sentrius.expr.profiles;

import com.sentrius.expr.EvaluationContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MathProfileTest {

    private final EvaluationContext context = MathProfile.createContext();

    private Object call(String name, Object... args) {
        return context.getFunction(name).apply(List.of(args));
    }

    @Test
    void testContextContainsEachFunction() {
        for (String name : MathProfile.getFunctionNames()) {
            assertTrue(context.hasFunction(name), "Missing function: " + name);
        }
        assertEquals(MathProfile.getFunctionNames().size(), context.getFunctions().size());
    }

    @Test
    void testContextContainsConstants() {
        assertEquals(Math.PI, context.getVariable("pi"));
        assertEquals(Math.E, context.getVariable("e"));
        assertEquals(MathProfile.getConstants().size(), context.getVariables().size());
    }

    @Test
    void testDefaultContextIsShared() {
        assertSame(MathProfile.defaultContext(), MathProfile.defaultContext());
        assertNotSame(MathProfile.createContext(), MathProfile.createContext());
    }

    static Stream<Arguments> unaryFunctions() {
        return Stream.of(
            Arguments.of("sin", 0.0, 0.0),
            Arguments.of("cos", 0.0, 1.0),
            Arguments.of("tan", 0.0, 0.0),
            Arguments.of("asin", 1.0, Math.PI / 2),
            Arguments.of("acos", 1.0, 0.0),
            Arguments.of("atan", 1.0, Math.PI / 4),
            Arguments.of("sinh", 0.0, 0.0),
            Arguments.of("cosh", 0.0, 1.0),
            Arguments.of("tanh", 0.0, 0.0),
            Arguments.of("log", 100.0, 2.0),
            Arguments.of("ln", 1.0, 0.0),
            Arguments.of("log2", 1024.0, 10.0),
            Arguments.of("exp", 0.0, 1.0),
            Arguments.of("sqrt", 9.0, 3.0),
            Arguments.of("abs", -4.5, 4.5),
            Arguments.of("floor", -1.5, -2.0),
            Arguments.of("ceil", -1.5, -1.0),
            Arguments.of("round", 2.5, 3.0),
            Arguments.of("round", -2.5, -2.0),
            Arguments.of("round", 2.4, 2.0)
        );
    }

    @ParameterizedTest
    @MethodSource("unaryFunctions")
    void testUnaryFunction(String name, double input, double expected) {
        assertEquals(expected, (Double) call(name, input), 1e-9);
    }

    @Test
    void testGcdUsesAbsoluteValues() {
        assertEquals(6.0, MathProfile.gcd(-12, 18));
        assertEquals(5.0, MathProfile.gcd(0, 5));
        assertEquals(0.0, MathProfile.gcd(0, 0));
    }

    @Test
    void testLcm() {
        assertEquals(12.0, MathProfile.lcm(4, -6));
        assertEquals(0.0, MathProfile.lcm(0, 0));
        assertEquals(0.0, MathProfile.lcm(0, 7));
    }

    @Test
    void testFactorial() {
        assertEquals(1.0, MathProfile.factorial(0));
        assertEquals(1.0, MathProfile.factorial(1));
        assertEquals(3628800.0, MathProfile.factorial(10));
        assertTrue(Double.isInfinite(MathProfile.factorial(1_000_000)));
    }

    @Test
    void testFactorialRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> MathProfile.factorial(-3));
        assertThrows(IllegalArgumentException.class, () -> MathProfile.factorial(1.5));
        assertThrows(IllegalArgumentException.class, () -> MathProfile.factorial(Double.POSITIVE_INFINITY));
    }

    @Test
    void testIsPrime() {
        assertFalse(MathProfile.isPrime(1));
        assertTrue(MathProfile.isPrime(2));
        assertTrue(MathProfile.isPrime(3));
        assertFalse(MathProfile.isPrime(4));
        assertFalse(MathProfile.isPrime(25));
        assertFalse(MathProfile.isPrime(49));
        assertTrue(MathProfile.isPrime(7919));
        assertFalse(MathProfile.isPrime(7.5));
        assertFalse(MathProfile.isPrime(-7));
    }

    @Test
    void testArityIsChecked() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> call("gcd", 1.0));
        assertEquals("Function 'gcd' expects 2 arguments but got 1", e.getMessage());
    }

    @Test
    void testNonNumericArgumentIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> call("sqrt", true));
        assertEquals("sqrt: Expected a number but got boolean", e.getMessage());
    }
}
