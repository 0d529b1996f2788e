package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.ZERO;
import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** Constant folding and the identities of 0 and 1. */
final class NumericRules {

  private NumericRules() {}

  /** {@code 0 * f -> 0}, only when {@code f} is defined everywhere unless the domain may change. */
  static final Rule PRODUCT_ZERO = rule("product_zero", 105, RuleCategory.NUMERIC).product((product, ctx) -> {
    List<Expression> rest = new ArrayList<>();
    boolean hasZero = false;
    for (Expression factor : product.factors()) {
      if (Numbers.is(factor, 0)) {
        hasZero = true;
      } else if (!Numbers.isNumeric(factor)) {
        rest.add(factor);
      }
    }
    if (!hasZero) {
      return null;
    }
    return !ctx.domainSafe() || rest.stream().allMatch(Domains::isTotal) ? ZERO : null;
  });

  static final Rule SUM_FOLD_CONSTANTS = rule("sum_fold_constants", 100, RuleCategory.NUMERIC).sum((sum, ctx) -> {
    double total = 0;
    int numeric = 0;
    boolean hasZero = false;
    List<Expression> rest = new ArrayList<>();
    for (Expression term : sum.terms()) {
      OptionalDouble value = Numbers.valueOf(term);
      if (value.isPresent()) {
        numeric++;
        total += value.getAsDouble();
        hasZero |= value.getAsDouble() == 0;
      } else {
        rest.add(term);
      }
    }
    if (numeric < 2 && !hasZero) {
      return null;
    }
    if (total != 0 && Double.isFinite(total)) {
      rest.add(Numbers.toExpression(total));
    } else if (!Double.isFinite(total)) {
      return null;
    }
    return Expression.sum(rest);
  });

  static final Rule PRODUCT_FOLD_CONSTANTS = rule("product_fold_constants", 100, RuleCategory.NUMERIC)
    .product((product, ctx) -> {
      double coefficient = 1;
      int numeric = 0;
      boolean foldable = false;
      List<Expression> rest = new ArrayList<>();
      for (Expression factor : product.factors()) {
        OptionalDouble value = Numbers.valueOf(factor);
        if (value.isPresent()) {
          numeric++;
          coefficient *= value.getAsDouble();
          // a factor of 1 can be dropped and a rational factor belongs in a quotient
          foldable |= value.getAsDouble() == 1 || !(factor instanceof Expression.Constant);
        } else {
          rest.add(factor);
        }
      }
      if ((numeric < 2 && !foldable) || !Double.isFinite(coefficient)) {
        return null;
      }
      if (coefficient == 0) {
        // product_zero decides whether the remaining factors may be dropped
        return numeric > 1 ? Expression.product(prepend(ZERO, rest)) : null;
      }
      return Terms.withCoefficient(coefficient, Expression.product(rest));
    });

  static final Rule DIV_FOLD_CONSTANTS = rule("div_fold_constants", 100, RuleCategory.NUMERIC).div((div, ctx) -> {
    if (!(div.numerator() instanceof Expression.Constant n) || !(div.denominator() instanceof Expression.Constant d) ||
      d.value() == 0) {
      return null;
    }
    double a = n.value();
    double b = d.value();
    if (Numbers.isInteger(a) && Numbers.isInteger(b) && Math.abs(a) <= Numbers.MAX_EXACT &&
      Math.abs(b) <= Numbers.MAX_EXACT) {
      long num = (long) a;
      long den = (long) b;
      long gcd = Numbers.gcd(num, den);
      if (den < 0) {
        gcd = -gcd;
      }
      num /= gcd;
      den /= gcd;
      Expression result = den == 1 ? constant(num) : div(constant(num), constant(den));
      return result.equals(div) ? null : result;
    }
    double quotient = a / b;
    if (!Double.isFinite(quotient)) {
      return null;
    }
    Expression result = Numbers.toExpression(quotient);
    return result.equals(div) ? null : result;
  });

  /** {@code 2^10 -> 1024} and {@code 4^(-1/2) -> 1/2}, only when the result is exact. */
  static final Rule POW_FOLD_CONSTANTS = rule("pow_fold_constants", 100, RuleCategory.NUMERIC).pow((pow, ctx) -> {
    OptionalDouble exponent = Numbers.valueOf(pow.exponent());
    if (!(pow.base() instanceof Expression.Constant base) || exponent.isEmpty()) {
      return null;
    }
    double b = base.value();
    double e = exponent.getAsDouble();
    if (e < 0) {
      if (b == 0) {
        return null;
      }
      OptionalDouble positive = Numbers.exactPow(b, -e);
      return positive.isPresent() ? div(ONE, constant(positive.getAsDouble())) : null;
    }
    OptionalDouble result = Numbers.exactPow(b, e);
    return result.isPresent() ? constant(result.getAsDouble()) : null;
  });

  static final Rule DIV_ONE = rule("div_one", 95, RuleCategory.NUMERIC)
    .div((div, ctx) -> Numbers.is(div.denominator(), 1) ? div.numerator() : null);

  /** {@code 0 / x -> 0}, which loses the hole at {@code x = 0}. */
  static final Rule ZERO_DIV = rule("zero_div", 95, RuleCategory.NUMERIC).altersDomain()
    .div((div, ctx) -> Numbers.is(div.numerator(), 0) && !Numbers.is(div.denominator(), 0) ? ZERO : null);

  static final Rule POWER_ONE = rule("power_one", 95, RuleCategory.NUMERIC)
    .pow((pow, ctx) -> Numbers.is(pow.exponent(), 1) ? pow.base() : null);

  /** {@code x^0 -> 1}, which defines the result where {@code x} was undefined. */
  static final Rule POWER_ZERO = rule("power_zero", 95, RuleCategory.NUMERIC).altersDomain()
    .pow((pow, ctx) -> Numbers.is(pow.exponent(), 0) ? ONE : null);

  static final Rule ONE_POWER = rule("one_power", 95, RuleCategory.NUMERIC)
    .pow((pow, ctx) -> Numbers.is(pow.base(), 1) && (!ctx.domainSafe() || Domains.isTotal(pow.exponent())) ? ONE :
      null);

  static final Rule ZERO_POWER = rule("zero_power", 95, RuleCategory.NUMERIC).pow((pow, ctx) -> {
    OptionalDouble exponent = Numbers.valueOf(pow.exponent());
    return Numbers.is(pow.base(), 0) && exponent.isPresent() && exponent.getAsDouble() > 0 ? ZERO : null;
  });

  private static List<Expression> prepend(Expression first, List<Expression> rest) {
    List<Expression> result = new ArrayList<>(rest.size() + 1);
    result.add(first);
    result.addAll(rest);
    return result;
  }

  static List<Rule> all() {
    return List.of(
      PRODUCT_ZERO,
      SUM_FOLD_CONSTANTS,
      PRODUCT_FOLD_CONSTANTS,
      DIV_FOLD_CONSTANTS,
      POW_FOLD_CONSTANTS,
      DIV_ONE,
      ZERO_DIV,
      POWER_ONE,
      POWER_ZERO,
      ONE_POWER,
      ZERO_POWER
    );
  }
}
