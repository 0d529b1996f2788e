package com.symplify.rules;

import static com.symplify.expression.Expression.call;
import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.product;
import static com.symplify.expression.KnownFunctions.ABS;
import static com.symplify.expression.KnownFunctions.CBRT;
import static com.symplify.expression.KnownFunctions.SQRT;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.DoubleFunction;
import javax.annotation.Nullable;

/** Rules for {@code sqrt} and {@code cbrt} and their relation to fractional powers. */
final class RootRules {

  private static final double MAX_EXTRACTED = 1e12;

  private RootRules() {}

  /** {@code sqrt(9/4) -> 3/2}. */
  static final Rule SQRT_NUMERIC = rule("sqrt_numeric", 95, RuleCategory.ROOT).call(SQRT)
    .apply((f, ctx) -> exactRoot(f.arg(), Numbers::exactSqrt));

  static final Rule CBRT_NUMERIC = rule("cbrt_numeric", 95, RuleCategory.ROOT).call(CBRT)
    .apply((f, ctx) -> exactRoot(f.arg(), Numbers::exactCbrt));

  /** {@code sqrt(x^2) -> x}, which is wrong for negative {@code x}. */
  static final Rule SQRT_SQUARE = rule("sqrt_square", 90, RuleCategory.ROOT).altersDomain().call(SQRT)
    .apply((f, ctx) -> rootOfPower(f.arg(), 2, true));

  /** {@code cbrt(x^3) -> x}. */
  static final Rule CBRT_CUBE = rule("cbrt_cube", 90, RuleCategory.ROOT).call(CBRT)
    .apply((f, ctx) -> rootOfPower(f.arg(), 3, false));

  /** {@code x^(1/2) -> sqrt(x)}. */
  static final Rule POWER_TO_SQRT = rule("power_to_sqrt", 90, RuleCategory.ROOT)
    .pow((pow, ctx) -> Numbers.is(pow.exponent(), 0.5) ? call(SQRT, pow.base()) : null);

  /** {@code x^(1/3) -> cbrt(x)}, reading a power of one third as the real cube root. */
  static final Rule POWER_TO_CBRT = rule("power_to_cbrt", 90, RuleCategory.ROOT).pow((pow, ctx) -> {
    OptionalDouble exponent = Numbers.valueOf(pow.exponent());
    return exponent.isPresent() && Numbers.approxEquals(exponent.getAsDouble(), 1.0 / 3) ? call(CBRT, pow.base()) :
      null;
  });

  /** {@code sqrt(x)^2 -> x}, which extends the domain to negative {@code x}. */
  static final Rule SQRT_SQUARED = rule("sqrt_squared", 90, RuleCategory.ROOT).altersDomain().pow((pow, ctx) -> {
    Expression arg = Patterns.argOf(pow.base(), SQRT);
    return arg == null ? null : rootOfPower(Expression.pow(arg, pow.exponent()), 2, true);
  });

  /** {@code cbrt(x)^3 -> x}. */
  static final Rule CBRT_CUBED = rule("cbrt_cubed", 90, RuleCategory.ROOT).pow((pow, ctx) -> {
    Expression arg = Patterns.argOf(pow.base(), CBRT);
    return arg == null ? null : rootOfPower(Expression.pow(arg, pow.exponent()), 3, false);
  });

  /**
   * {@code sqrt(x^2) -> |x|} and {@code sqrt(x^6) -> |x|^3}. Even powers also come out of a product when the factors
   * left under the root are non-negative, so {@code sqrt(3*x^2) -> |x|*sqrt(3)}.
   */
  static final Rule SQRT_EVEN_POWER = rule("sqrt_even_power", 85, RuleCategory.ROOT).call(SQRT).apply((f, ctx) -> {
    if (f.arg() instanceof Expression.Pow p) {
      return absOfEvenPower(p);
    }
    if (!(f.arg() instanceof Expression.Product product)) {
      return null;
    }
    List<Expression> outside = new ArrayList<>();
    List<Expression> inside = new ArrayList<>();
    for (Expression factor : product.factors()) {
      Expression extracted = factor instanceof Expression.Pow p ? absOfEvenPower(p) : null;
      if (extracted != null) {
        outside.add(extracted);
      } else {
        inside.add(factor);
      }
    }
    if (outside.isEmpty() || !inside.stream().allMatch(Domains::isNonNegative)) {
      return null;
    }
    if (!inside.isEmpty()) {
      outside.add(call(SQRT, product(inside)));
    }
    return product(outside);
  });

  /** {@code sqrt(a) * sqrt(b) -> sqrt(a*b)}, which extends the domain to where both are negative. */
  static final Rule SQRT_PRODUCT = rule("sqrt_product", 85, RuleCategory.ROOT).altersDomain()
    .product((product, ctx) -> {
      List<Expression> rest = new ArrayList<>();
      List<Expression> args = new ArrayList<>();
      for (Expression factor : product.factors()) {
        Expression arg = Patterns.argOf(factor, SQRT);
        if (arg != null) {
          args.add(arg);
        } else {
          rest.add(factor);
        }
      }
      if (args.size() < 2) {
        return null;
      }
      rest.add(call(SQRT, product(args)));
      return product(rest);
    });

  /** {@code sqrt(a) / sqrt(b) -> sqrt(a/b)}, which extends the domain to where both are negative. */
  static final Rule SQRT_QUOTIENT = rule("sqrt_quotient", 85, RuleCategory.ROOT).altersDomain().div((div, ctx) -> {
    Expression a = Patterns.argOf(div.numerator(), SQRT);
    Expression b = Patterns.argOf(div.denominator(), SQRT);
    return a == null || b == null ? null : call(SQRT, div(a, b));
  });

  /** {@code sqrt(12*x) -> 2*sqrt(3*x)}, pulling the largest square out of an integer coefficient. */
  static final Rule SQRT_EXTRACT_SQUARE = rule("sqrt_extract_square", 60, RuleCategory.ROOT).call(SQRT)
    .apply((f, ctx) -> {
      Terms.Split split = Terms.split(f.arg());
      double coefficient = split.coefficient();
      if (!Numbers.isInteger(coefficient) || coefficient < 4 || coefficient > MAX_EXTRACTED) {
        return null;
      }
      long c = (long) coefficient;
      for (long k = (long) Math.sqrt(c); k >= 2; k--) {
        if (c % (k * k) == 0) {
          return Terms.withCoefficient(k, call(SQRT, Terms.withCoefficient(c / (k * k), split.rest())));
        }
      }
      return null;
    });

  /** Returns {@code |base|^(e/2)} when {@code pow} is {@code base^e} with {@code e} a positive even integer. */
  @Nullable
  private static Expression absOfEvenPower(Expression.Pow pow) {
    OptionalDouble exponent = Numbers.valueOf(pow.exponent());
    if (exponent.isEmpty() || !Numbers.isEvenInteger(exponent.getAsDouble()) || exponent.getAsDouble() <= 0) {
      return null;
    }
    return Patterns.raise(call(ABS, pow.base()), exponent.getAsDouble() / 2);
  }

  @Nullable
  private static Expression exactRoot(Expression arg, DoubleFunction<OptionalDouble> root) {
    OptionalDouble value = Numbers.valueOf(arg);
    if (value.isEmpty()) {
      return null;
    }
    OptionalDouble whole = root.apply(value.getAsDouble());
    if (whole.isPresent()) {
      return constant(whole.getAsDouble());
    }
    long[] rational = Numbers.rational(value.getAsDouble());
    if (rational == null || rational[1] == 1) {
      return null;
    }
    OptionalDouble numerator = root.apply(rational[0]);
    OptionalDouble denominator = root.apply(rational[1]);
    return numerator.isPresent() && denominator.isPresent() ?
      Numbers.toExpression(numerator.getAsDouble() / denominator.getAsDouble()) : null;
  }

  /** Returns {@code base^(e/n)} when {@code expression} is {@code base^e} with {@code e} a multiple of {@code n}. */
  @Nullable
  private static Expression rootOfPower(Expression expression, int n, boolean positiveOnly) {
    OptionalDouble exponent = Patterns.numericExponent(expression);
    if (exponent.isEmpty() || !Numbers.isInteger(exponent.getAsDouble()) || exponent.getAsDouble() % n != 0 ||
      exponent.getAsDouble() == 0 || (positiveOnly && exponent.getAsDouble() < 0)) {
      return null;
    }
    return Patterns.raise(((Expression.Pow) expression).base(), exponent.getAsDouble() / n);
  }

  static List<Rule> all() {
    return List.of(
      SQRT_NUMERIC,
      CBRT_NUMERIC,
      SQRT_SQUARE,
      CBRT_CUBE,
      POWER_TO_SQRT,
      POWER_TO_CBRT,
      SQRT_SQUARED,
      CBRT_CUBED,
      SQRT_EVEN_POWER,
      SQRT_PRODUCT,
      SQRT_QUOTIENT,
      SQRT_EXTRACT_SQUARE
    );
  }
}
