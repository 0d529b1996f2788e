package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.ZERO;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.pow;
import static com.symplify.expression.Expression.product;
import static com.symplify.expression.Expression.sum;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** Rules that flatten nested quotients and cancel common factors. */
final class FractionRules {

  private FractionRules() {}

  /** {@code (a/b)/c -> a/(b*c)}. */
  static final Rule DIV_DIV_NUMERATOR = rule("div_div_numerator", 95, RuleCategory.ALGEBRAIC).div((div, ctx) ->
    div.numerator() instanceof Expression.Div inner && !Numbers.isNumeric(div) ?
      div(inner.numerator(), product(inner.denominator(), div.denominator())) : null);

  /** {@code a/(b/c) -> (a*c)/b}, which defines the result where {@code c = 0}. */
  static final Rule DIV_DIV_DENOMINATOR = rule("div_div_denominator", 95, RuleCategory.ALGEBRAIC).altersDomain()
    .div((div, ctx) -> div.denominator() instanceof Expression.Div inner ?
      div(product(div.numerator(), inner.denominator()), inner.numerator()) : null);

  /** Kept only if distributing a power over a product lets factors cancel across the quotient. */
  static final Rule EXPAND_POWER_FOR_CANCELLATION = rule("expand_power_for_cancellation", 95,
    RuleCategory.ALGEBRAIC).speculative().div((div, ctx) -> {
      Expression numerator = distributePowers(div.numerator());
      Expression denominator = distributePowers(div.denominator());
      return numerator == null && denominator == null ? null :
        div(numerator == null ? div.numerator() : numerator, denominator == null ? div.denominator() : denominator);
    });

  /** {@code x/x -> 1}, which loses the hole at {@code x = 0}. */
  static final Rule DIV_SELF = rule("div_self", 90, RuleCategory.ALGEBRAIC).altersDomain()
    .div((div, ctx) -> !Numbers.isNumeric(div.numerator()) && div.numerator().equals(div.denominator()) ? ONE :
      null);

  /** {@code 6*x/(4*y) -> 3*x/(2*y)}, moving every numeric factor into one reduced coefficient. */
  static final Rule FRACTION_NUMERIC_GCD = rule("fraction_numeric_gcd", 88, RuleCategory.ALGEBRAIC)
    .div((div, ctx) -> {
      if (Numbers.isNumeric(div)) {
        return null;
      }
      Terms.Split split = Terms.split(div);
      if (split.coefficient() == 0 || !Double.isFinite(split.coefficient())) {
        return null;
      }
      Expression rebuilt = Terms.withCoefficient(split.coefficient(), split.rest());
      return rebuilt.equals(div) ? null : rebuilt;
    });

  /** {@code x^3*y/(x*z) -> x^2*y/z}, cancelling common bases between numerator and denominator. */
  static final Rule FRACTION_CANCELLATION = rule("fraction_cancellation", 87, RuleCategory.ALGEBRAIC).altersDomain()
    .div((div, ctx) -> {
      Terms.Split numerator = Terms.split(div.numerator());
      Terms.Split denominator = Terms.split(div.denominator());
      if (denominator.isNumeric() || numerator.isNumeric()) {
        return null;
      }
      List<Terms.Power> top = powers(numerator.rest());
      List<Terms.Power> bottom = powers(denominator.rest());
      boolean changed = false;
      for (int i = 0; i < top.size(); i++) {
        for (int j = 0; j < bottom.size(); j++) {
          Terms.Power a = top.get(i);
          Terms.Power b = bottom.get(j);
          if (!a.base().equals(b.base()) || Numbers.is(a.exponent(), 0) || Numbers.is(b.exponent(), 0)) {
            continue;
          }
          OptionalDouble ea = Numbers.valueOf(a.exponent());
          OptionalDouble eb = Numbers.valueOf(b.exponent());
          if (ea.isPresent() && eb.isPresent()) {
            double difference = ea.getAsDouble() - eb.getAsDouble();
            top.set(i, new Terms.Power(a.base(), Numbers.toExpression(Math.max(difference, 0))));
            bottom.set(j, new Terms.Power(b.base(), Numbers.toExpression(Math.max(-difference, 0))));
          } else if (a.exponent().equals(b.exponent())) {
            top.set(i, new Terms.Power(a.base(), ZERO));
            bottom.set(j, new Terms.Power(b.base(), ZERO));
          } else {
            continue;
          }
          changed = true;
          break;
        }
      }
      if (!changed) {
        return null;
      }
      Expression newNumerator = Terms.withCoefficient(numerator.coefficient(), build(top));
      Expression newDenominator = Terms.withCoefficient(denominator.coefficient(), build(bottom));
      return Numbers.is(newDenominator, 1) ? newNumerator : div(newNumerator, newDenominator);
    });

  /** {@code x/(-y - 1) -> -x/(y + 1)}, keeping a leading minus out of sum denominators. */
  static final Rule CANONICAL_DENOMINATOR_SIGN = rule("canonical_denominator_sign", 15, RuleCategory.ALGEBRAIC)
    .div((div, ctx) -> {
      if (div.denominator() instanceof Expression.Sum denominator &&
        denominator.terms().stream().allMatch(Terms::isNegative)) {
        return div(Terms.negate(div.numerator()), sum(denominator.terms().stream().map(Terms::negate).toList()));
      }
      return null;
    });

  private static List<Terms.Power> powers(Expression expression) {
    List<Terms.Power> result = new ArrayList<>();
    for (Expression factor : Terms.factors(expression)) {
      result.add(Terms.power(factor));
    }
    return result;
  }

  private static Expression build(List<Terms.Power> powers) {
    List<Expression> factors = new ArrayList<>();
    for (Terms.Power power : powers) {
      if (Numbers.is(power.exponent(), 1)) {
        factors.add(power.base());
      } else if (!Numbers.is(power.exponent(), 0)) {
        factors.add(pow(power.base(), power.exponent()));
      }
    }
    return product(factors);
  }

  /** Returns {@code expression} with {@code (a*b)^n} factors replaced by {@code a^n*b^n}, or null if there are none. */
  private static Expression distributePowers(Expression expression) {
    List<Expression> factors = new ArrayList<>();
    boolean changed = false;
    for (Expression factor : Terms.factors(expression)) {
      if (factor instanceof Expression.Pow p && p.base() instanceof Expression.Product base &&
        Numbers.isInteger(p.exponent())) {
        base.factors().forEach(f -> factors.add(pow(f, p.exponent())));
        changed = true;
      } else {
        factors.add(factor);
      }
    }
    return changed ? product(factors) : null;
  }

  static List<Rule> all() {
    return List.of(
      DIV_DIV_NUMERATOR,
      DIV_DIV_DENOMINATOR,
      EXPAND_POWER_FOR_CANCELLATION,
      DIV_SELF,
      FRACTION_NUMERIC_GCD,
      FRACTION_CANCELLATION,
      CANONICAL_DENOMINATOR_SIGN
    );
  }
}
