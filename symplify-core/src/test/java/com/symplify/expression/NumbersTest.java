package com.symplify.expression;

import static com.symplify.expression.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NumbersTest {

  @Test
  void testValueOf() {
    assertEquals(OptionalDouble.of(3), Numbers.valueOf(constant(3)));
    assertEquals(OptionalDouble.of(0.5), Numbers.valueOf(div(ONE, TWO)));
    assertEquals(OptionalDouble.empty(), Numbers.valueOf(div(ONE, ZERO)));
    assertEquals(OptionalDouble.empty(), Numbers.valueOf(symbol("x")));
    assertTrue(Numbers.is(div(TWO, constant(4)), 0.5));
  }

  @Test
  void testToExpression() {
    assertEquals(constant(3), Numbers.toExpression(3));
    assertEquals(div(ONE, TWO), Numbers.toExpression(0.5));
    assertEquals(div(constant(-2), constant(3)), Numbers.toExpression(-2.0 / 3));
    assertEquals(constant(Math.PI), Numbers.toExpression(Math.PI));
  }

  @ParameterizedTest
  @CsvSource({
    "4, 0.5, 2",
    "8, 0.3333333333333333, 2",
    "2, 10, 1024",
    "-2, 3, -8",
    "27, 0.6666666666666666, 9",
  })
  void testExactPow(double base, double exponent, double expected) {
    assertEquals(OptionalDouble.of(expected), Numbers.exactPow(base, exponent));
  }

  @ParameterizedTest
  @CsvSource({
    "2, 0.5",
    "2, -1",
    "-8, 0.3333333333333333",
    "10, 400",
  })
  void testInexactPow(double base, double exponent) {
    assertEquals(OptionalDouble.empty(), Numbers.exactPow(base, exponent));
  }

  @Test
  void testExactRoots() {
    assertEquals(OptionalDouble.of(4), Numbers.exactSqrt(16));
    assertEquals(OptionalDouble.empty(), Numbers.exactSqrt(15));
    assertEquals(OptionalDouble.empty(), Numbers.exactSqrt(-4));
    assertEquals(OptionalDouble.of(-3), Numbers.exactCbrt(-27));
    assertEquals(OptionalDouble.empty(), Numbers.exactCbrt(9));
  }

  @Test
  void testIntegers() {
    assertEquals(6, Numbers.gcd(12, -18));
    assertEquals(5, Numbers.gcd(0, 5));
    assertTrue(Numbers.isEvenInteger(-4));
    assertTrue(Numbers.isOddInteger(3));
    assertFalse(Numbers.isInteger(Double.NaN));
    assertFalse(Numbers.isInteger(2.5));
  }

  @Test
  void testRational() {
    assertArrayEquals(new long[]{3, 8}, Numbers.rational(0.375));
    assertNull(Numbers.rational(Math.sqrt(2)));
  }
}
