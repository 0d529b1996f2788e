package com.symplify.expression;

import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;

import java.util.OptionalDouble;

/**
 * Numeric helpers for constant folding.
 * <p>
 * A "numeric" expression is either a {@link Expression.Constant} or a rational constant: a {@link Expression.Div} of
 * two constants with a non-zero denominator.
 */
public final class Numbers {

  /** Largest denominator {@link #toExpression(double)} will use when rebuilding a rational constant. */
  public static final int MAX_DENOMINATOR = 1000;
  /** Largest magnitude that constant folding will produce, beyond this integers stop being exact. */
  public static final double MAX_EXACT = 9.007199254740992E15;
  private static final double EPSILON = 1e-12;

  private Numbers() {}

  public static boolean isInteger(double value) {
    return Double.isFinite(value) && value == Math.rint(value);
  }

  public static boolean isEvenInteger(double value) {
    return isInteger(value) && Math.abs(value) <= MAX_EXACT && ((long) value) % 2 == 0;
  }

  public static boolean isOddInteger(double value) {
    return isInteger(value) && Math.abs(value) <= MAX_EXACT && ((long) value) % 2 != 0;
  }

  /** Returns true if {@code a} and {@code b} are equal up to a small relative tolerance. */
  public static boolean approxEquals(double a, double b) {
    return a == b || Math.abs(a - b) <= EPSILON * Math.max(1, Math.max(Math.abs(a), Math.abs(b)));
  }

  public static long gcd(long a, long b) {
    a = Math.abs(a);
    b = Math.abs(b);
    while (b != 0) {
      long t = a % b;
      a = b;
      b = t;
    }
    return a;
  }

  /** Returns the numeric value of a constant or rational constant, or empty for anything else. */
  public static OptionalDouble valueOf(Expression expression) {
    if (expression instanceof Expression.Constant c) {
      return OptionalDouble.of(c.value());
    } else if (expression instanceof Expression.Div d &&
      d.numerator() instanceof Expression.Constant n &&
      d.denominator() instanceof Expression.Constant m &&
      m.value() != 0) {
      return OptionalDouble.of(n.value() / m.value());
    }
    return OptionalDouble.empty();
  }

  public static boolean isNumeric(Expression expression) {
    return valueOf(expression).isPresent();
  }

  /** Returns true if {@code expression} is numeric and equal to {@code value}. */
  public static boolean is(Expression expression, double value) {
    OptionalDouble v = valueOf(expression);
    return v.isPresent() && v.getAsDouble() == value;
  }

  /** Returns true if {@code expression} is a numeric integer. */
  public static boolean isInteger(Expression expression) {
    OptionalDouble v = valueOf(expression);
    return v.isPresent() && isInteger(v.getAsDouble());
  }

  /** Returns true if {@code expression} is a numeric even integer. */
  public static boolean isEvenInteger(Expression expression) {
    OptionalDouble v = valueOf(expression);
    return v.isPresent() && isEvenInteger(v.getAsDouble());
  }

  /**
   * Returns {@code {numerator, denominator}} with the smallest denominator up to {@link #MAX_DENOMINATOR} that
   * reproduces {@code value}, or null if there is none.
   */
  public static long[] rational(double value) {
    if (!Double.isFinite(value) || Math.abs(value) > MAX_EXACT) {
      return null;
    }
    for (long d = 1; d <= MAX_DENOMINATOR; d++) {
      long n = Math.round(value * d);
      if (approxEquals((double) n / d, value)) {
        return new long[]{n, d};
      }
    }
    return null;
  }

  /**
   * Returns the simplest expression for a folded numeric value: an integer constant, a rational constant in lowest
   * terms with a positive denominator, or a plain decimal constant.
   */
  public static Expression toExpression(double value) {
    if (isInteger(value)) {
      return constant(value);
    }
    long[] rational = rational(value);
    if (rational != null) {
      return rational[1] == 1 ? constant(rational[0]) : div(constant(rational[0]), constant(rational[1]));
    }
    return constant(value);
  }

  /** Returns the exact integer square root of {@code value} or empty if it is not a perfect square. */
  public static OptionalDouble exactSqrt(double value) {
    if (!isInteger(value) || value < 0 || value > MAX_EXACT) {
      return OptionalDouble.empty();
    }
    double root = Math.rint(Math.sqrt(value));
    return root * root == value ? OptionalDouble.of(root) : OptionalDouble.empty();
  }

  /** Returns the exact integer cube root of {@code value} or empty if it is not a perfect cube. */
  public static OptionalDouble exactCbrt(double value) {
    if (!isInteger(value) || Math.abs(value) > MAX_EXACT) {
      return OptionalDouble.empty();
    }
    double root = Math.rint(Math.cbrt(value));
    return root * root * root == value ? OptionalDouble.of(root) : OptionalDouble.empty();
  }

  /**
   * Returns {@code base ^ exponent} when it is exactly representable, or empty. Integer exponents must produce a
   * finite result below {@link #MAX_EXACT}, and fractional exponents must produce an integer that raised back to the
   * denominator of the exponent reproduces the base.
   */
  public static OptionalDouble exactPow(double base, double exponent) {
    if (isInteger(exponent)) {
      double result = Math.pow(base, exponent);
      return Double.isFinite(result) && Math.abs(result) <= MAX_EXACT && (exponent >= 0 || isInteger(result)) ?
        OptionalDouble.of(result) : OptionalDouble.empty();
    }
    long[] rational = rational(exponent);
    if (rational == null || base < 0 || !isInteger(base)) {
      return OptionalDouble.empty();
    }
    double result = Math.rint(Math.pow(base, exponent));
    if (result == 0 && base != 0) {
      return OptionalDouble.empty();
    }
    // verify result^d == base^n exactly
    double lhs = Math.pow(result, rational[1]);
    double rhs = Math.pow(base, rational[0]);
    return Double.isFinite(lhs) && lhs <= MAX_EXACT && lhs == rhs ? OptionalDouble.of(result) :
      OptionalDouble.empty();
  }
}
