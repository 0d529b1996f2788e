package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.pow;
import static com.symplify.expression.Expression.product;
import static com.symplify.expression.Expression.sum;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.KnownFunctions;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/** Rules for products and powers: negation, merging quotients, collecting and distributing exponents. */
final class PowerRules {

  private PowerRules() {}

  /** {@code -(a + b) -> -a - b}. */
  static final Rule DISTRIBUTE_NEGATION = rule("distribute_negation", 90, RuleCategory.ALGEBRAIC)
    .product((product, ctx) -> {
      List<Expression> factors = product.factors();
      if (factors.size() == 2 && Numbers.is(factors.get(0), -1) && factors.get(1) instanceof Expression.Sum sum) {
        return sum(sum.terms().stream().map(Terms::negate).toList());
      }
      return null;
    });

  /** {@code a * (b/c) -> (a*b)/c}. */
  static final Rule MUL_DIV_COMBINATION = rule("mul_div_combination", 85, RuleCategory.ALGEBRAIC)
    .product((product, ctx) -> {
      List<Expression> numerators = new ArrayList<>();
      List<Expression> denominators = new ArrayList<>();
      for (Expression factor : product.factors()) {
        if (factor instanceof Expression.Div d && !Numbers.isNumeric(d)) {
          numerators.add(d.numerator());
          denominators.add(d.denominator());
        } else {
          numerators.add(factor);
        }
      }
      return denominators.isEmpty() ? null : div(product(numerators), product(denominators));
    });

  /** {@code x^2 * x^3 -> x^5} when the exponents are integers of the same sign. */
  static final Rule POWER_COLLECTION = rule("power_collection", 80, RuleCategory.ALGEBRAIC)
    .product((product, ctx) -> collectPowers(product, false));

  /** {@code x^a * x^b -> x^(a+b)} for any exponents, which can cancel a factor that was undefined at zero. */
  static final Rule POWER_COLLECTION_GENERAL = rule("power_collection_general", 79, RuleCategory.ALGEBRAIC)
    .altersDomain()
    .product((product, ctx) -> collectPowers(product, true));

  /** {@code x^-n -> 1/x^n}. */
  static final Rule NEGATIVE_EXPONENT_TO_FRACTION = rule("negative_exponent_to_fraction", 90,
    RuleCategory.ALGEBRAIC).pow((pow, ctx) -> {
      if (Numbers.isNumeric(pow.base()) || !Terms.isNegative(pow.exponent())) {
        return null;
      }
      Expression exponent = Terms.negate(pow.exponent());
      return div(ONE, Numbers.is(exponent, 1) ? pow.base() : pow(pow.base(), exponent));
    });

  /**
   * {@code (x^2)^3 -> x^6} for an integer outer exponent, unless a fractional inner exponent would multiply out to an
   * integer and define the result for negative {@code x}.
   */
  static final Rule POWER_POWER = rule("power_power", 85, RuleCategory.ALGEBRAIC).pow((pow, ctx) -> {
    OptionalDouble outer = Numbers.valueOf(pow.exponent());
    OptionalDouble inner = Patterns.numericExponent(pow.base());
    if (outer.isEmpty() || inner.isEmpty() || !Numbers.isInteger(outer.getAsDouble())) {
      return null;
    }
    double exponent = outer.getAsDouble() * inner.getAsDouble();
    if (!Numbers.isInteger(inner.getAsDouble()) && Numbers.isInteger(exponent)) {
      return null;
    }
    return pow(((Expression.Pow) pow.base()).base(), Numbers.toExpression(exponent));
  });

  /** {@code (x^a)^b -> x^(a*b)} for any exponents. */
  static final Rule POWER_POWER_GENERAL = rule("power_power_general", 84, RuleCategory.ALGEBRAIC).altersDomain()
    .pow((pow, ctx) -> pow.base() instanceof Expression.Pow inner ?
      pow(inner.base(), Terms.multiply(inner.exponent(), pow.exponent())) : null);

  /** {@code |x|^2 -> x^2} for even integer exponents. */
  static final Rule ABS_POW_EVEN = rule("abs_pow_even", 85, RuleCategory.ALGEBRAIC).pow((pow, ctx) -> {
    Expression arg = Patterns.argOf(pow.base(), KnownFunctions.ABS);
    return arg != null && Numbers.isEvenInteger(pow.exponent()) ? pow(arg, pow.exponent()) : null;
  });

  /** {@code (2*x)^3 -> 8*x^3}, pulling the numeric coefficient out of a power of a product. */
  static final Rule POWER_PRODUCT = rule("power_product", 40, RuleCategory.ALGEBRAIC).pow((pow, ctx) -> {
    OptionalDouble exponent = Numbers.valueOf(pow.exponent());
    if (!(pow.base() instanceof Expression.Product) || exponent.isEmpty()) {
      return null;
    }
    Terms.Split base = Terms.split(pow.base());
    double n = exponent.getAsDouble();
    if (base.coefficient() == 1 || base.isNumeric() || (!Numbers.isInteger(n) && base.coefficient() <= 0)) {
      return null;
    }
    OptionalDouble coefficient = Numbers.exactPow(base.coefficient(), n);
    return coefficient.isEmpty() ? null :
      Terms.withCoefficient(coefficient.getAsDouble(), pow(base.rest(), pow.exponent()));
  });

  /** {@code (a/b)^n -> a^n / b^n} for integer {@code n}. */
  static final Rule POWER_DIV = rule("power_div", 40, RuleCategory.ALGEBRAIC).pow((pow, ctx) -> {
    if (pow.base() instanceof Expression.Div d && Numbers.isInteger(pow.exponent())) {
      return div(pow(d.numerator(), pow.exponent()), pow(d.denominator(), pow.exponent()));
    }
    return null;
  });

  private static Expression collectPowers(Expression.Product product, boolean anyExponent) {
    Map<Expression, List<Expression>> exponents = new LinkedHashMap<>();
    List<Expression> result = new ArrayList<>();
    for (Expression factor : product.factors()) {
      if (Numbers.isNumeric(factor)) {
        result.add(factor);
      } else {
        Terms.Power power = Terms.power(factor);
        exponents.computeIfAbsent(power.base(), base -> new ArrayList<>()).add(power.exponent());
      }
    }
    boolean changed = false;
    for (var entry : exponents.entrySet()) {
      Expression base = entry.getKey();
      List<Expression> group = entry.getValue();
      if (group.size() > 1 && (anyExponent || sameSignIntegers(group))) {
        Expression total = total(group);
        result.add(Numbers.is(total, 1) ? base : pow(base, total));
        changed = true;
      } else {
        for (Expression exponent : group) {
          result.add(ONE.equals(exponent) ? base : pow(base, exponent));
        }
      }
    }
    return changed ? product(result) : null;
  }

  private static boolean sameSignIntegers(List<Expression> exponents) {
    int positive = 0;
    int negative = 0;
    for (Expression exponent : exponents) {
      OptionalDouble value = Numbers.valueOf(exponent);
      if (value.isEmpty() || !Numbers.isInteger(value.getAsDouble())) {
        return false;
      } else if (value.getAsDouble() > 0) {
        positive++;
      } else if (value.getAsDouble() < 0) {
        negative++;
      }
    }
    return positive == exponents.size() || negative == exponents.size();
  }

  private static Expression total(List<Expression> exponents) {
    double total = 0;
    for (Expression exponent : exponents) {
      OptionalDouble value = Numbers.valueOf(exponent);
      if (value.isEmpty()) {
        return sum(exponents);
      }
      total += value.getAsDouble();
    }
    return Numbers.toExpression(total);
  }

  static List<Rule> all() {
    return List.of(
      DISTRIBUTE_NEGATION,
      MUL_DIV_COMBINATION,
      POWER_COLLECTION,
      POWER_COLLECTION_GENERAL,
      NEGATIVE_EXPONENT_TO_FRACTION,
      POWER_POWER,
      POWER_POWER_GENERAL,
      ABS_POW_EVEN,
      POWER_PRODUCT,
      POWER_DIV
    );
  }
}
