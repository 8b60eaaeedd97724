/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.operations;

import java.math.BigInteger;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongBinaryOperator;

import io.github.graydavid.lazycache.core.Operation;
import io.github.graydavid.naryfunctions.NAryFunction;

/**
 * The infix arithmetic operations: "+", "-", "*", and "/". Each operation takes exactly two arguments, which may be
 * numbers or double arrays:
 * <ul>
 * <li>Two integral numbers (Byte, Short, Integer, or Long) produce a Long. Overflow throws ArithmeticException rather
 * than wrapping, and division floors (as per {@link Math#floorDiv(long, long)}), throwing ArithmeticException for a
 * zero divisor.
 * <li>Two integral numbers at least one of which is a BigInteger produce an exact BigInteger, with the same flooring
 * division.
 * <li>Any other pair of numbers produces a Double.
 * <li>Two double arrays produce a new double array, element by element. The arrays must have the same length.
 * <li>A double array and a number produce a new double array, applying the number to each element.
 * </ul>
 * Unsupported operands throw IllegalArgumentException. Arguments are never modified.
 */
public class ArithmeticOperations {
    private ArithmeticOperations() {}

    public static final Operation ADD = Operation.infix("+",
            binary("+", Math::addExact, BigInteger::add, (a, b) -> a + b));
    public static final Operation SUBTRACT = Operation.infix("-",
            binary("-", Math::subtractExact, BigInteger::subtract, (a, b) -> a - b));
    public static final Operation MULTIPLY = Operation.infix("*",
            binary("*", Math::multiplyExact, BigInteger::multiply, (a, b) -> a * b));
    public static final Operation DIVIDE = Operation.infix("/",
            binary("/", ArithmeticOperations::floorDivExact, ArithmeticOperations::floorDiv, (a, b) -> a / b));

    private static NAryFunction<Object, Object> binary(String name, LongBinaryOperator longOperator,
            BinaryOperator<BigInteger> bigOperator, DoubleBinaryOperator doubleOperator) {
        return arguments -> {
            requireTwoArguments(name, arguments);
            return combine(name, arguments.get(0), arguments.get(1), longOperator, bigOperator, doubleOperator);
        };
    }

    // Math.floorDiv wraps for the one quotient that doesn't fit in a long
    private static long floorDivExact(long dividend, long divisor) {
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            throw new ArithmeticException("long overflow");
        }
        return Math.floorDiv(dividend, divisor);
    }

    private static BigInteger floorDiv(BigInteger dividend, BigInteger divisor) {
        BigInteger[] quotientAndRemainder = dividend.divideAndRemainder(divisor);
        BigInteger quotient = quotientAndRemainder[0];
        boolean needsFlooring = quotientAndRemainder[1].signum() != 0
                && quotientAndRemainder[1].signum() != divisor.signum();
        return needsFlooring ? quotient.subtract(BigInteger.ONE) : quotient;
    }

    private static void requireTwoArguments(String name, List<?> arguments) {
        if (arguments.size() != 2) {
            throw new IllegalArgumentException(
                    "Operation '" + name + "' takes exactly 2 arguments but was given " + arguments.size());
        }
    }

    private static Object combine(String name, Object left, Object right, LongBinaryOperator longOperator,
            BinaryOperator<BigInteger> bigOperator, DoubleBinaryOperator doubleOperator) {
        if (left instanceof double[] && right instanceof double[]) {
            return combineArrays(name, (double[]) left, (double[]) right, doubleOperator);
        }
        if (left instanceof double[] && right instanceof Number) {
            double scalar = ((Number) right).doubleValue();
            return mapArray((double[]) left, element -> doubleOperator.applyAsDouble(element, scalar));
        }
        if (left instanceof Number && right instanceof double[]) {
            double scalar = ((Number) left).doubleValue();
            return mapArray((double[]) right, element -> doubleOperator.applyAsDouble(scalar, element));
        }
        if ((left instanceof BigInteger || right instanceof BigInteger) && isIntegralOrBig(left)
                && isIntegralOrBig(right)) {
            return bigOperator.apply(toBigInteger(left), toBigInteger(right));
        }
        if (isIntegral(left) && isIntegral(right)) {
            return longOperator.applyAsLong(((Number) left).longValue(), ((Number) right).longValue());
        }
        if (left instanceof Number && right instanceof Number) {
            return doubleOperator.applyAsDouble(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        throw new IllegalArgumentException(String.format("Unsupported operands for '%s': %s and %s", name,
                describeClass(left), describeClass(right)));
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long;
    }

    private static boolean isIntegralOrBig(Object value) {
        return isIntegral(value) || value instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Object value) {
        return (value instanceof BigInteger) ? (BigInteger) value : BigInteger.valueOf(((Number) value).longValue());
    }

    private static String describeClass(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static double[] combineArrays(String name, double[] left, double[] right,
            DoubleBinaryOperator doubleOperator) {
        if (left.length != right.length) {
            String message = String.format("Shape mismatch for '%s': (%d,) and (%d,)", name, left.length,
                    right.length);
            throw new IllegalArgumentException(message);
        }
        double[] result = new double[left.length];
        for (int i = 0; i < left.length; ++i) {
            result[i] = doubleOperator.applyAsDouble(left[i], right[i]);
        }
        return result;
    }

    private static double[] mapArray(double[] array, DoubleUnaryOperator operator) {
        double[] result = new double[array.length];
        for (int i = 0; i < array.length; ++i) {
            result[i] = operator.applyAsDouble(array[i]);
        }
        return result;
    }
}
