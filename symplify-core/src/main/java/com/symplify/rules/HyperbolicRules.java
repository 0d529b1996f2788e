package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.ZERO;
import static com.symplify.expression.Expression.call;
import static com.symplify.expression.Expression.pow;
import static com.symplify.expression.KnownFunctions.ABS;
import static com.symplify.expression.KnownFunctions.ACOSH;
import static com.symplify.expression.KnownFunctions.ASINH;
import static com.symplify.expression.KnownFunctions.ATANH;
import static com.symplify.expression.KnownFunctions.COSH;
import static com.symplify.expression.KnownFunctions.COTH;
import static com.symplify.expression.KnownFunctions.CSCH;
import static com.symplify.expression.KnownFunctions.EXP;
import static com.symplify.expression.KnownFunctions.SECH;
import static com.symplify.expression.KnownFunctions.SINH;
import static com.symplify.expression.KnownFunctions.TANH;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/** Hyperbolic rules, mirroring the trigonometric ones plus recognizing the exponential definitions. */
final class HyperbolicRules {

  private static final Set<String> ODD = Set.of(SINH, TANH, COTH, CSCH, ASINH, ATANH);

  private HyperbolicRules() {}

  static final Rule HYPERBOLIC_ZERO = rule("hyperbolic_zero", 95, RuleCategory.HYPERBOLIC)
    .call(SINH, COSH, TANH, ASINH, ATANH, ACOSH).apply((f, ctx) -> {
      if (f.is(ACOSH)) {
        return Numbers.is(f.arg(), 1) ? ZERO : null;
      } else if (!Numbers.is(f.arg(), 0)) {
        return null;
      }
      return f.is(COSH) ? ONE : ZERO;
    });

  /** {@code sinh(-x) -> -sinh(x)}, {@code cosh(-x) -> cosh(x)}. */
  static final Rule HYPERBOLIC_NEGATION = rule("hyperbolic_negation", 90, RuleCategory.HYPERBOLIC)
    .call(SINH, COSH, TANH, COTH, SECH, CSCH, ASINH, ATANH).apply((f, ctx) -> {
      if (!Terms.isNegative(f.arg())) {
        return null;
      }
      Expression result = call(f.name(), Terms.negate(f.arg()));
      return ODD.contains(f.name()) ? Terms.negate(result) : result;
    });

  static final Rule SINH_ASINH = rule("sinh_asinh", 90, RuleCategory.HYPERBOLIC).call(SINH)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), ASINH));

  /** {@code cosh(acosh(x)) -> x} and {@code tanh(atanh(x)) -> x}, which extend the domain of the inverse. */
  static final Rule HYPERBOLIC_INVERSE_IDENTITY = rule("hyperbolic_inverse_identity", 90, RuleCategory.HYPERBOLIC)
    .altersDomain().call(COSH, TANH).apply((f, ctx) -> Patterns.argOf(f.arg(), f.is(COSH) ? ACOSH : ATANH));

  /** {@code asinh(sinh(x)) -> x}, {@code atanh(tanh(x)) -> x}, {@code acosh(cosh(x)) -> |x|}. */
  static final Rule INVERSE_HYPERBOLIC_COMPOSITION = rule("inverse_hyperbolic_composition", 85,
    RuleCategory.HYPERBOLIC).call(ASINH, ATANH, ACOSH).apply((f, ctx) -> {
      if (f.is(ACOSH)) {
        Expression arg = Patterns.argOf(f.arg(), COSH);
        return arg == null ? null : call(ABS, arg);
      }
      return Patterns.argOf(f.arg(), f.is(ASINH) ? SINH : TANH);
    });

  /** {@code sinh(x)/cosh(x) -> tanh(x)} and {@code cosh(x)/sinh(x) -> coth(x)}. */
  static final Rule HYPERBOLIC_QUOTIENT = rule("hyperbolic_quotient", 80, RuleCategory.HYPERBOLIC)
    .div((div, ctx) -> {
      Expression result = TrigRules.quotient(div, SINH, COSH, TANH);
      return result != null ? result : TrigRules.quotient(div, COSH, SINH, COTH);
    });

  /** {@code 1/cosh(x) -> sech(x)}, {@code 1/sinh(x) -> csch(x)}, {@code 1/tanh(x) -> coth(x)} and {@code 1/sech(x)}. */
  static final Rule HYPERBOLIC_RECIPROCAL = rule("hyperbolic_reciprocal", 80, RuleCategory.HYPERBOLIC)
    .div((div, ctx) -> {
      Expression result = TrigRules.reciprocal(div, COSH, SECH);
      result = result != null ? result : TrigRules.reciprocal(div, SINH, CSCH);
      result = result != null ? result : TrigRules.reciprocal(div, TANH, COTH);
      return result != null ? result : TrigRules.reciprocal(div, SECH, COSH);
    });

  /** {@code 1/coth(x) -> tanh(x)} and {@code 1/csch(x) -> sinh(x)}, which fill in the hole at zero. */
  static final Rule HYPERBOLIC_RECIPROCAL_INVERSE = rule("hyperbolic_reciprocal_inverse", 80,
    RuleCategory.HYPERBOLIC).altersDomain().div((div, ctx) -> {
      Expression result = TrigRules.reciprocal(div, COTH, TANH);
      return result != null ? result : TrigRules.reciprocal(div, CSCH, SINH);
    });

  /** {@code (exp(x) - exp(-x))/2 -> sinh(x)}. */
  static final Rule SINH_FROM_EXP = rule("sinh_from_exp", 80, RuleCategory.HYPERBOLIC).div((div, ctx) -> {
    Expression arg = Numbers.is(div.denominator(), 2) ? exponentialPair(div.numerator(), -1) : null;
    return arg == null ? null : call(SINH, arg);
  });

  /** {@code (exp(x) + exp(-x))/2 -> cosh(x)}. */
  static final Rule COSH_FROM_EXP = rule("cosh_from_exp", 80, RuleCategory.HYPERBOLIC).div((div, ctx) -> {
    Expression arg = Numbers.is(div.denominator(), 2) ? exponentialPair(div.numerator(), 1) : null;
    return arg == null ? null : call(COSH, arg);
  });

  /** {@code (exp(x) - exp(-x))/(exp(x) + exp(-x)) -> tanh(x)}. */
  static final Rule TANH_FROM_EXP = rule("tanh_from_exp", 80, RuleCategory.HYPERBOLIC).div((div, ctx) -> {
    Expression top = exponentialPair(div.numerator(), -1);
    return top != null && top.equals(exponentialPair(div.denominator(), 1)) ? call(TANH, top) : null;
  });

  /** {@code c*cosh(x)^2 - c*sinh(x)^2 -> c}. */
  static final Rule HYPERBOLIC_IDENTITY = rule("hyperbolic_identity", 70, RuleCategory.HYPERBOLIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      Expression arg = Patterns.squaredArgOf(a.rest(), COSH);
      return arg != null && arg.equals(Patterns.squaredArgOf(b.rest(), SINH)) &&
        Numbers.approxEquals(b.coefficient(), -a.coefficient()) ? Numbers.toExpression(a.coefficient()) : null;
    }));

  /** {@code 1 - tanh(x)^2 -> sech(x)^2} and {@code coth(x)^2 - 1 -> csch(x)^2}. */
  static final Rule HYPERBOLIC_TANH_IDENTITY = rule("hyperbolic_tanh_identity", 70, RuleCategory.HYPERBOLIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      if (!a.isNumeric() || a.coefficient() == 0 || !Numbers.approxEquals(b.coefficient(), -a.coefficient())) {
        return null;
      }
      Expression arg = Patterns.squaredArgOf(b.rest(), TANH);
      if (arg != null) {
        return Terms.withCoefficient(a.coefficient(), pow(call(SECH, arg), 2));
      }
      arg = Patterns.squaredArgOf(b.rest(), COTH);
      return arg == null ? null : Terms.withCoefficient(b.coefficient(), pow(call(CSCH, arg), 2));
    }));

  /** {@code cosh(x)^2 + sinh(x)^2 -> cosh(2*x)}. */
  static final Rule COSH_DOUBLE_ANGLE = rule("cosh_double_angle", 65, RuleCategory.HYPERBOLIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      Expression arg = Patterns.squaredArgOf(a.rest(), COSH);
      return arg != null && arg.equals(Patterns.squaredArgOf(b.rest(), SINH)) &&
        Numbers.approxEquals(b.coefficient(), a.coefficient()) ?
        Terms.withCoefficient(a.coefficient(), call(COSH, Terms.scaleBy(2, arg))) : null;
    }));

  /** {@code 2*sinh(x)*cosh(x) -> sinh(2*x)}. */
  static final Rule SINH_DOUBLE_ANGLE = rule("sinh_double_angle", 65, RuleCategory.HYPERBOLIC)
    .product((product, ctx) -> {
      Terms.Split split = Terms.split(product);
      Expression[] args = TrigRules.callArgs(split.rest(), SINH, COSH);
      if (args == null || !args[0].equals(args[1]) || !Numbers.isEvenInteger(split.coefficient()) ||
        split.coefficient() == 0) {
        return null;
      }
      return Terms.withCoefficient(split.coefficient() / 2, call(SINH, Terms.scaleBy(2, args[0])));
    });

  /**
   * Returns {@code x} if {@code expression} is {@code exp(x) + sign*exp(-x)}, where {@code x} is the argument of the
   * term with coefficient {@code +1}, otherwise null.
   */
  @Nullable
  private static Expression exponentialPair(Expression expression, int sign) {
    if (!(expression instanceof Expression.Sum sum) || sum.terms().size() != 2) {
      return null;
    }
    for (int i = 0; i < 2; i++) {
      Terms.Split first = Terms.split(sum.terms().get(i));
      Terms.Split second = Terms.split(sum.terms().get(1 - i));
      Expression a = Patterns.argOf(first.rest(), EXP);
      Expression b = Patterns.argOf(second.rest(), EXP);
      if (a != null && b != null && first.coefficient() == 1 && second.coefficient() == sign &&
        b.equals(Terms.negate(a)) && (sign < 0 || !Terms.isNegative(a))) {
        return a;
      }
    }
    return null;
  }

  static List<Rule> all() {
    return List.of(
      HYPERBOLIC_ZERO,
      HYPERBOLIC_NEGATION,
      SINH_ASINH,
      HYPERBOLIC_INVERSE_IDENTITY,
      INVERSE_HYPERBOLIC_COMPOSITION,
      HYPERBOLIC_QUOTIENT,
      HYPERBOLIC_RECIPROCAL,
      HYPERBOLIC_RECIPROCAL_INVERSE,
      SINH_FROM_EXP,
      COSH_FROM_EXP,
      TANH_FROM_EXP,
      HYPERBOLIC_IDENTITY,
      HYPERBOLIC_TANH_IDENTITY,
      COSH_DOUBLE_ANGLE,
      SINH_DOUBLE_ANGLE
    );
  }
}
