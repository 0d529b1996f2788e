package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.ZERO;
import static com.symplify.expression.Expression.call;
import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.pow;
import static com.symplify.expression.Expression.product;
import static com.symplify.expression.Expression.sum;
import static com.symplify.expression.KnownFunctions.ABS;
import static com.symplify.expression.KnownFunctions.EXP;
import static com.symplify.expression.KnownFunctions.LN;
import static com.symplify.expression.KnownFunctions.LOG10;
import static com.symplify.expression.KnownFunctions.LOG2;
import static com.symplify.expression.KnownFunctions.SQRT;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** Rules for {@code exp}, {@code ln}, {@code log10} and {@code log2}. */
final class ExponentialRules {

  private ExponentialRules() {}

  static final Rule EXP_ZERO = rule("exp_zero", 95, RuleCategory.EXPONENTIAL).call(EXP)
    .apply((f, ctx) -> Numbers.is(f.arg(), 0) ? ONE : null);

  static final Rule LN_ONE = rule("ln_one", 95, RuleCategory.EXPONENTIAL).call(LN)
    .apply((f, ctx) -> Numbers.is(f.arg(), 1) ? ZERO : null);

  static final Rule LN_E = rule("ln_e", 95, RuleCategory.EXPONENTIAL).call(LN)
    .apply((f, ctx) -> ctx.isEuler(f.arg()) ? ONE : null);

  /** {@code log10(1000) -> 3}, {@code log2(1/8) -> -3} for exact powers of the base. */
  static final Rule LOG_BASE_VALUES = rule("log_base_values", 95, RuleCategory.EXPONENTIAL).call(LOG10, LOG2)
    .apply((f, ctx) -> {
      OptionalDouble value = Numbers.valueOf(f.arg());
      if (value.isEmpty() || value.getAsDouble() <= 0) {
        return null;
      }
      double base = f.is(LOG10) ? 10 : 2;
      double exponent = Math.rint(Math.log(value.getAsDouble()) / Math.log(base));
      OptionalDouble power = Numbers.exactPow(base, Math.abs(exponent));
      if (power.isEmpty()) {
        return null;
      }
      double expected = exponent >= 0 ? power.getAsDouble() : 1 / power.getAsDouble();
      return Numbers.approxEquals(expected, value.getAsDouble()) ? constant(exponent) : null;
    });

  /** {@code e^x -> exp(x)}. */
  static final Rule E_POW_TO_EXP = rule("e_pow_to_exp", 90, RuleCategory.EXPONENTIAL)
    .pow((pow, ctx) -> ctx.isEuler(pow.base()) ? call(EXP, pow.exponent()) : null);

  /** {@code ln(x^2) -> 2*ln(x)}, which drops the negative half of the domain. */
  static final Rule LN_EVEN_POWER_AGGRESSIVE = rule("ln_even_power_aggressive", 81, RuleCategory.EXPONENTIAL)
    .altersDomain().call(LN).apply((f, ctx) ->
      f.arg() instanceof Expression.Pow p && Numbers.isEvenInteger(p.exponent()) ?
        Terms.multiply(p.exponent(), call(LN, p.base())) : null);

  /** {@code exp(ln(x)) -> x}, which extends the domain to {@code x <= 0}. */
  static final Rule EXP_LN = rule("exp_ln", 80, RuleCategory.EXPONENTIAL).altersDomain().call(EXP)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), LN));

  static final Rule LN_EXP = rule("ln_exp", 80, RuleCategory.EXPONENTIAL).call(LN)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), EXP));

  /** {@code exp(n*ln(x)) -> x^n}. */
  static final Rule EXP_MUL_LN = rule("exp_mul_ln", 80, RuleCategory.EXPONENTIAL).altersDomain().call(EXP)
    .apply((f, ctx) -> {
      List<Expression> factors = Terms.factors(f.arg());
      int found = -1;
      for (int i = 0; i < factors.size(); i++) {
        if (Patterns.argOf(factors.get(i), LN) != null) {
          if (found >= 0) {
            return null;
          }
          found = i;
        }
      }
      if (found < 0 || factors.size() < 2) {
        return null;
      }
      return pow(Patterns.argOf(factors.get(found), LN), product(Patterns.without(factors, found)));
    });

  /** {@code ln(x^n) -> n*ln(x)}, through {@code |x|} when {@code n} is even. */
  static final Rule LN_POWER = rule("ln_power", 80, RuleCategory.EXPONENTIAL).call(LN).apply((f, ctx) -> {
    if (!(f.arg() instanceof Expression.Pow p) || !Numbers.isNumeric(p.exponent())) {
      return null;
    }
    Expression base = Numbers.isEvenInteger(p.exponent()) ? call(ABS, p.base()) : p.base();
    return Terms.multiply(p.exponent(), call(LN, base));
  });

  /** {@code ln(sqrt(x)) -> ln(x)/2}. */
  static final Rule LN_SQRT = rule("ln_sqrt", 80, RuleCategory.EXPONENTIAL).call(LN).apply((f, ctx) -> {
    Expression arg = Patterns.argOf(f.arg(), SQRT);
    return arg == null ? null : div(call(LN, arg), constant(2));
  });

  /** {@code exp(a) * exp(b) -> exp(a + b)}. */
  static final Rule EXP_PRODUCT = rule("exp_product", 80, RuleCategory.EXPONENTIAL).product((product, ctx) -> {
    List<Expression> rest = new ArrayList<>();
    List<Expression> exponents = new ArrayList<>();
    for (Expression factor : product.factors()) {
      Expression arg = Patterns.argOf(factor, EXP);
      if (arg != null) {
        exponents.add(arg);
      } else {
        rest.add(factor);
      }
    }
    if (exponents.size() < 2) {
      return null;
    }
    rest.add(call(EXP, sum(exponents)));
    return product(rest);
  });

  /** {@code exp(a)^n -> exp(n*a)}. */
  static final Rule EXP_POWER = rule("exp_power", 80, RuleCategory.EXPONENTIAL).pow((pow, ctx) -> {
    Expression arg = Patterns.argOf(pow.base(), EXP);
    return arg == null ? null : call(EXP, Terms.multiply(pow.exponent(), arg));
  });

  /** {@code exp(a) / exp(b) -> exp(a - b)}. */
  static final Rule EXP_QUOTIENT = rule("exp_quotient", 80, RuleCategory.EXPONENTIAL).div((div, ctx) -> {
    Expression a = Patterns.argOf(div.numerator(), EXP);
    Expression b = Patterns.argOf(div.denominator(), EXP);
    return a == null || b == null ? null : call(EXP, sum(a, Terms.negate(b)));
  });

  /**
   * {@code ln(a) + ln(b) - ln(c) -> ln(a*b/c)}, which can widen the domain to where {@code a} and {@code b} are both
   * negative.
   */
  static final Rule LOG_COMBINATION = rule("log_combination", 40, RuleCategory.EXPONENTIAL).altersDomain()
    .sum((sum, ctx) -> {
      List<Expression> numerators = new ArrayList<>();
      List<Expression> denominators = new ArrayList<>();
      List<Expression> rest = new ArrayList<>();
      for (Expression term : sum.terms()) {
        Terms.Split split = Terms.split(term);
        Expression arg = Patterns.argOf(split.rest(), LN);
        if (arg != null && split.coefficient() == 1) {
          numerators.add(arg);
        } else if (arg != null && split.coefficient() == -1) {
          denominators.add(arg);
        } else {
          rest.add(term);
        }
      }
      if (numerators.size() + denominators.size() < 2) {
        return null;
      }
      Expression combined = denominators.isEmpty() ? product(numerators) :
        div(product(numerators), product(denominators));
      rest.add(call(LN, combined));
      return sum(rest);
    });

  static List<Rule> all() {
    return List.of(
      EXP_ZERO,
      LN_ONE,
      LN_E,
      LOG_BASE_VALUES,
      E_POW_TO_EXP,
      LN_EVEN_POWER_AGGRESSIVE,
      EXP_LN,
      LN_EXP,
      EXP_MUL_LN,
      LN_POWER,
      LN_SQRT,
      EXP_PRODUCT,
      EXP_POWER,
      EXP_QUOTIENT,
      LOG_COMBINATION
    );
  }
}
