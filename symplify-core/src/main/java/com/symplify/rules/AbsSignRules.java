package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.call;
import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.product;
import static com.symplify.expression.KnownFunctions.ABS;
import static com.symplify.expression.KnownFunctions.SIGN;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** Rules for absolute value and sign. */
final class AbsSignRules {

  private AbsSignRules() {}

  static final Rule ABS_NUMERIC = rule("abs_numeric", 95, RuleCategory.ALGEBRAIC).call(ABS).apply((f, ctx) -> {
    OptionalDouble value = Numbers.valueOf(f.arg());
    return value.isPresent() ? Numbers.toExpression(Math.abs(value.getAsDouble())) : null;
  });

  static final Rule SIGN_NUMERIC = rule("sign_numeric", 95, RuleCategory.ALGEBRAIC).call(SIGN).apply((f, ctx) -> {
    OptionalDouble value = Numbers.valueOf(f.arg());
    return value.isPresent() ? constant(Math.signum(value.getAsDouble())) : null;
  });

  static final Rule ABS_ABS = rule("abs_abs", 90, RuleCategory.ALGEBRAIC).call(ABS)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), ABS) != null ? f.arg() : null);

  static final Rule SIGN_SIGN = rule("sign_sign", 90, RuleCategory.ALGEBRAIC).call(SIGN)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), SIGN) != null ? f.arg() : null);

  /**
   * {@code sign(|x|) -> 1}, which only holds for {@code x != 0}: at zero the value changes from 0 to 1, so the rule
   * never runs in domain-safe mode.
   */
  static final Rule SIGN_ABS = rule("sign_abs", 90, RuleCategory.ALGEBRAIC).altersDomain().call(SIGN)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), ABS) != null ? ONE : null);

  /** {@code |-3*x| -> 3*|x|}. */
  static final Rule ABS_CONSTANT_FACTOR = rule("abs_constant_factor", 88, RuleCategory.ALGEBRAIC).call(ABS)
    .apply((f, ctx) -> {
      Terms.Split split = Terms.split(f.arg());
      if (split.isNumeric() || split.coefficient() == 1 || split.coefficient() == 0) {
        return null;
      }
      return Terms.withCoefficient(Math.abs(split.coefficient()), call(ABS, split.rest()));
    });

  /** {@code |x^2| -> x^2}. */
  static final Rule ABS_EVEN_POWER = rule("abs_even_power", 85, RuleCategory.ALGEBRAIC).call(ABS)
    .apply((f, ctx) -> f.arg() instanceof Expression.Pow p && Numbers.isEvenInteger(p.exponent()) ? p : null);

  static final Rule ABS_NONNEGATIVE = rule("abs_nonnegative", 84, RuleCategory.ALGEBRAIC).call(ABS)
    .apply((f, ctx) -> Domains.isNonNegative(f.arg()) ? f.arg() : null);

  /** {@code |x| * sign(x) -> x}. */
  static final Rule ABS_SIGN_PRODUCT = rule("abs_sign_product", 85, RuleCategory.ALGEBRAIC)
    .product((product, ctx) -> {
      List<Expression> factors = product.factors();
      for (int i = 0; i < factors.size(); i++) {
        Expression arg = Patterns.argOf(factors.get(i), ABS);
        if (arg == null) {
          continue;
        }
        for (int j = 0; j < factors.size(); j++) {
          if (arg.equals(Patterns.argOf(factors.get(j), SIGN))) {
            List<Expression> rest = new ArrayList<>(Patterns.without(factors, i, j));
            rest.add(arg);
            return product(rest);
          }
        }
      }
      return null;
    });

  static List<Rule> all() {
    return List.of(
      ABS_NUMERIC,
      SIGN_NUMERIC,
      ABS_ABS,
      SIGN_SIGN,
      SIGN_ABS,
      ABS_CONSTANT_FACTOR,
      ABS_EVEN_POWER,
      ABS_NONNEGATIVE,
      ABS_SIGN_PRODUCT
    );
  }
}
