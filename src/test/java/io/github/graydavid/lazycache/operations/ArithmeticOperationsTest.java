package io.github.graydavid.lazycache.operations;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.graydavid.lazycache.core.Operation;
import io.github.graydavid.lazycache.core.Operation.Notation;

public class ArithmeticOperationsTest {

    private static Object apply(Operation operation, Object left, Object right) {
        return operation.getFunction().apply(List.of(left, right));
    }

    @Test
    public void operationsAreInfixWithSymbolNames() {
        assertThat(ArithmeticOperations.ADD.getName(), is("+"));
        assertThat(ArithmeticOperations.SUBTRACT.getName(), is("-"));
        assertThat(ArithmeticOperations.MULTIPLY.getName(), is("*"));
        assertThat(ArithmeticOperations.DIVIDE.getName(), is("/"));
        assertThat(ArithmeticOperations.ADD.getNotation(), is(Notation.INFIX));
    }

    @Test
    public void integralOperandsProduceLongs() {
        assertThat(apply(ArithmeticOperations.ADD, 2, 3), is(5L));
        assertThat(apply(ArithmeticOperations.SUBTRACT, 2, 3L), is(-1L));
        assertThat(apply(ArithmeticOperations.MULTIPLY, (short) 4, (byte) 3), is(12L));
        assertThat(apply(ArithmeticOperations.DIVIDE, 7, 2), is(3L));
    }

    @Test
    public void integralDivisionFloors() {
        assertThat(apply(ArithmeticOperations.DIVIDE, -7, 2), is(-4L));
        assertThat(apply(ArithmeticOperations.DIVIDE, 7, -2), is(-4L));
    }

    @Test
    public void integralDivisionByZeroThrowsException() {
        assertThrows(ArithmeticException.class, () -> apply(ArithmeticOperations.DIVIDE, 1, 0));
    }

    @Test
    public void integralOverflowThrowsException() {
        assertThrows(ArithmeticException.class, () -> apply(ArithmeticOperations.ADD, Long.MAX_VALUE, 1));
        assertThrows(ArithmeticException.class, () -> apply(ArithmeticOperations.MULTIPLY, Long.MAX_VALUE, 2));
    }

    @Test
    public void integralDivisionOverflowThrowsException() {
        assertThrows(ArithmeticException.class, () -> apply(ArithmeticOperations.DIVIDE, Long.MIN_VALUE, -1));
        assertThat(apply(ArithmeticOperations.DIVIDE, Long.MIN_VALUE, 1), is(Long.MIN_VALUE));
    }

    @Test
    public void bigIntegerOperandsProduceExactBigIntegers() {
        BigInteger big = BigInteger.TWO.pow(70);

        assertThat(apply(ArithmeticOperations.ADD, big, 1), is(big.add(BigInteger.ONE)));
        assertThat(apply(ArithmeticOperations.SUBTRACT, 1L, big), is(BigInteger.ONE.subtract(big)));
        assertThat(apply(ArithmeticOperations.MULTIPLY, big, (short) 3), is(big.multiply(BigInteger.valueOf(3))));
        assertThat(apply(ArithmeticOperations.ADD, BigInteger.ONE, BigInteger.TWO), is(BigInteger.valueOf(3)));
    }

    @Test
    public void bigIntegerDivisionFloors() {
        assertThat(apply(ArithmeticOperations.DIVIDE, BigInteger.valueOf(7), 2), is(BigInteger.valueOf(3)));
        assertThat(apply(ArithmeticOperations.DIVIDE, BigInteger.valueOf(-7), 2), is(BigInteger.valueOf(-4)));
        assertThat(apply(ArithmeticOperations.DIVIDE, 7, BigInteger.valueOf(-2)), is(BigInteger.valueOf(-4)));
        assertThat(apply(ArithmeticOperations.DIVIDE, BigInteger.valueOf(-7), -2), is(BigInteger.valueOf(3)));
        assertThat(apply(ArithmeticOperations.DIVIDE, BigInteger.valueOf(-8), 2), is(BigInteger.valueOf(-4)));
        assertThrows(ArithmeticException.class, () -> apply(ArithmeticOperations.DIVIDE, BigInteger.TEN, 0));
    }

    @Test
    public void bigIntegerWithFloatingOperandProducesDouble() {
        assertThat(apply(ArithmeticOperations.ADD, BigInteger.ONE, 0.5), is(1.5));
    }

    @Test
    public void mixedOrFloatingOperandsProduceDoubles() {
        assertThat(apply(ArithmeticOperations.ADD, 1.5, 1), is(2.5));
        assertThat(apply(ArithmeticOperations.DIVIDE, 1, 2.0), is(0.5));
        assertThat(apply(ArithmeticOperations.MULTIPLY, 1.5f, 2.0f), is(3.0));
        assertThat(apply(ArithmeticOperations.DIVIDE, 1.0, 0), is(Double.POSITIVE_INFINITY));
    }

    @Test
    public void arraysCombineElementByElement() {
        double[] left = {1, 2, 3};
        double[] right = {4, 5, 6};

        assertArrayEquals(new double[] {5, 7, 9}, (double[]) apply(ArithmeticOperations.ADD, left, right));
        assertArrayEquals(new double[] {-3, -3, -3}, (double[]) apply(ArithmeticOperations.SUBTRACT, left, right));
        assertArrayEquals(new double[] {4, 10, 18}, (double[]) apply(ArithmeticOperations.MULTIPLY, left, right));
        assertArrayEquals(new double[] {0.25, 0.4, 0.5}, (double[]) apply(ArithmeticOperations.DIVIDE, left, right));
    }

    @Test
    public void numbersBroadcastOverArraysOnEitherSide() {
        double[] array = {1, 2, 4};

        assertArrayEquals(new double[] {4, 2, 1}, (double[]) apply(ArithmeticOperations.DIVIDE, 4, array));
        assertArrayEquals(new double[] {0.25, 0.5, 1}, (double[]) apply(ArithmeticOperations.DIVIDE, array, 4));
        assertArrayEquals(new double[] {0, -1, -3}, (double[]) apply(ArithmeticOperations.SUBTRACT, 1L, array));
    }

    @Test
    public void argumentsAreNeverModified() {
        double[] left = {1, 2};
        double[] right = {3, 4};

        Object result = apply(ArithmeticOperations.ADD, left, right);

        assertArrayEquals(new double[] {1, 2}, left);
        assertArrayEquals(new double[] {3, 4}, right);
        assertThat(result, not(sameInstance(left)));
        assertThat(apply(ArithmeticOperations.MULTIPLY, left, 1), not(sameInstance(left)));
    }

    @Test
    public void arraysOfDifferentLengthsThrowException() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> apply(ArithmeticOperations.ADD, new double[] {1, 2}, new double[] {1, 2, 3}));

        assertThat(thrown.getMessage(), is("Shape mismatch for '+': (2,) and (3,)"));
    }

    @Test
    public void unsupportedOperandsThrowException() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> apply(ArithmeticOperations.MULTIPLY, "text", 2));

        assertThat(thrown.getMessage(), is("Unsupported operands for '*': String and Integer"));
        assertThrows(IllegalArgumentException.class, () -> apply(ArithmeticOperations.ADD, new long[] {1}, 2));
    }

    @Test
    public void wrongArgumentCountsThrowException() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> ArithmeticOperations.ADD.getFunction().apply(List.of(1, 2, 3)));

        assertThat(thrown.getMessage(), containsString("takes exactly 2 arguments but was given 3"));
    }
}
