package com.symplify.expression;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.product;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Helpers to take terms of a sum apart into a numeric coefficient and a symbolic remainder and put them back together
 * in canonical shape.
 */
public final class Terms {

  private Terms() {}

  /** A term {@code coefficient * rest} where {@code rest} has no numeric factor ({@link Expression#ONE} if none). */
  public record Split(double coefficient, Expression rest) {

    public boolean isNumeric() {
      return ONE.equals(rest);
    }
  }

  /** A factor {@code base ^ exponent}, with exponent {@link Expression#ONE} for anything that is not a power. */
  public record Power(Expression base, Expression exponent) {}

  /**
   * Splits {@code expression} into its numeric coefficient and the rest.
   * <ul>
   * <li>{@code 3} and {@code 1/2} are entirely numeric</li>
   * <li>{@code 2*x*y} splits into {@code 2} and {@code x*y}</li>
   * <li>{@code x/4} splits into {@code 1/4} and {@code x}</li>
   * <li>{@code 3/x} splits into {@code 3} and {@code 1/x}</li>
   * <li>{@code 6*x/(4*y)} splits into {@code 3/2} and {@code x/y}</li>
   * </ul>
   */
  public static Split split(Expression expression) {
    OptionalDouble value = Numbers.valueOf(expression);
    if (value.isPresent()) {
      return new Split(value.getAsDouble(), ONE);
    }
    if (expression instanceof Expression.Product p) {
      double coefficient = 1;
      List<Expression> rest = new ArrayList<>(p.factors().size());
      for (Expression factor : p.factors()) {
        OptionalDouble factorValue = Numbers.valueOf(factor);
        if (factorValue.isPresent()) {
          coefficient *= factorValue.getAsDouble();
        } else {
          rest.add(factor);
        }
      }
      return rest.size() == p.factors().size() ? new Split(1, p) : new Split(coefficient, product(rest));
    }
    if (expression instanceof Expression.Div d) {
      Split numerator = split(d.numerator());
      Split denominator = split(d.denominator());
      if (denominator.coefficient != 0 && (numerator.coefficient != 1 || denominator.coefficient != 1)) {
        Expression rest = denominator.isNumeric() ? numerator.rest : div(numerator.rest, denominator.rest);
        return new Split(numerator.coefficient / denominator.coefficient, rest);
      }
    }
    return new Split(1, expression);
  }

  /** Returns the numeric coefficient of {@code expression}. */
  public static double coefficient(Expression expression) {
    return split(expression).coefficient;
  }

  /**
   * Builds {@code coefficient * rest} in canonical shape: integer and decimal coefficients become a leading product
   * factor, rational coefficients put the denominator into a quotient.
   */
  public static Expression withCoefficient(double coefficient, Expression rest) {
    Split inner = split(rest);
    if (inner.coefficient != 1) {
      coefficient *= inner.coefficient;
      rest = inner.rest;
    }
    if (inner.isNumeric()) {
      return Numbers.toExpression(coefficient);
    } else if (coefficient == 0) {
      return Expression.ZERO;
    } else if (coefficient == 1) {
      return rest;
    } else if (Numbers.isInteger(coefficient)) {
      return scale(coefficient, rest);
    }
    long[] rational = Numbers.rational(coefficient);
    if (rational == null) {
      return scale(coefficient, rest);
    }
    Expression denominator = constant(rational[1]);
    if (rest instanceof Expression.Div d) {
      return div(withCoefficient(rational[0], d.numerator()), product(denominator, d.denominator()));
    }
    return div(withCoefficient(rational[0], rest), denominator);
  }

  private static Expression scale(double coefficient, Expression rest) {
    if (rest instanceof Expression.Div d) {
      return div(withCoefficient(coefficient, d.numerator()), d.denominator());
    }
    return product(constant(coefficient), rest);
  }

  /** Returns {@code -expression}, folding it into the numeric coefficient. */
  public static Expression negate(Expression expression) {
    Split split = split(expression);
    return withCoefficient(-split.coefficient, split.rest);
  }

  /** Returns true if the numeric coefficient of {@code expression} is negative. */
  public static boolean isNegative(Expression expression) {
    return split(expression).coefficient < 0;
  }

  /** Returns {@code a * b}, merging numeric coefficients and dropping factors of one. */
  public static Expression multiply(Expression a, Expression b) {
    Split sa = split(a);
    Split sb = split(b);
    Expression rest;
    if (sa.isNumeric()) {
      rest = sb.rest;
    } else if (sb.isNumeric()) {
      rest = sa.rest;
    } else {
      rest = product(sa.rest, sb.rest);
    }
    return withCoefficient(sa.coefficient * sb.coefficient, rest);
  }

  /** Returns {@code factor * expression}. */
  public static Expression scaleBy(double factor, Expression expression) {
    Split split = split(expression);
    return withCoefficient(factor * split.coefficient, split.rest);
  }

  public static Power power(Expression expression) {
    return expression instanceof Expression.Pow p ? new Power(p.base(), p.exponent()) : new Power(expression, ONE);
  }

  /** Returns the factors of a product, or a singleton list for anything else. */
  public static List<Expression> factors(Expression expression) {
    return expression instanceof Expression.Product p ? p.factors() : List.of(expression);
  }

  /** Returns the terms of a sum, or a singleton list for anything else. */
  public static List<Expression> terms(Expression expression) {
    return expression instanceof Expression.Sum s ? s.terms() : List.of(expression);
  }
}
