package com.symplify.rules;

import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.ZERO;
import static com.symplify.expression.Expression.call;
import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.pow;
import static com.symplify.expression.Expression.sum;
import static com.symplify.expression.KnownFunctions.ACOS;
import static com.symplify.expression.KnownFunctions.ASIN;
import static com.symplify.expression.KnownFunctions.ATAN;
import static com.symplify.expression.KnownFunctions.COS;
import static com.symplify.expression.KnownFunctions.COT;
import static com.symplify.expression.KnownFunctions.CSC;
import static com.symplify.expression.KnownFunctions.SEC;
import static com.symplify.expression.KnownFunctions.SIN;
import static com.symplify.expression.KnownFunctions.SQRT;
import static com.symplify.expression.KnownFunctions.TAN;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Trigonometric rules: exact values at multiples of {@code pi/12}, symmetry, periodicity, quotient and reciprocal
 * identities, the Pythagorean identities, and the double-angle and angle-addition formulas.
 */
final class TrigRules {

  private static final Set<String> ODD = Set.of(SIN, TAN, COT, CSC, ASIN, ATAN);

  private TrigRules() {}

  /** {@code sin(pi/6) -> 1/2}, {@code cos(3*pi/4) -> -sqrt(2)/2}, {@code tan(pi/3) -> sqrt(3)}. */
  static final Rule TRIG_EXACT_VALUES = rule("trig_exact_values", 95, RuleCategory.TRIGONOMETRIC).call(SIN, COS, TAN)
    .apply((f, ctx) -> {
      OptionalDouble multiple = Patterns.piMultiple(f.arg(), ctx);
      if (multiple.isEmpty()) {
        return null;
      }
      double twelfths = multiple.getAsDouble() * 12;
      double rounded = Math.rint(twelfths);
      if (!Numbers.approxEquals(twelfths, rounded) || Math.abs(rounded) > Integer.MAX_VALUE) {
        return null;
      }
      int m = (int) Math.floorMod((long) rounded, 24);
      return switch (f.name()) {
        case SIN -> sinAt(m);
        case COS -> sinAt((m + 6) % 24);
        default -> tanAt(m % 12);
      };
    });

  /** {@code asin(1/2) -> pi/6}, {@code acos(-1) -> pi}, {@code atan(1) -> pi/4}. */
  static final Rule INVERSE_TRIG_VALUES = rule("inverse_trig_values", 95, RuleCategory.TRIGONOMETRIC)
    .call(ASIN, ACOS, ATAN).apply((f, ctx) -> {
      OptionalDouble value = Numbers.valueOf(f.arg());
      if (value.isEmpty()) {
        return null;
      }
      double v = value.getAsDouble();
      double multiple = switch (f.name()) {
        case ASIN -> lookup(v, 0, 0, 0.5, 1.0 / 6, 1, 0.5, -0.5, -1.0 / 6, -1, -0.5);
        case ACOS -> lookup(v, 1, 0, 0.5, 1.0 / 3, 0, 0.5, -0.5, 2.0 / 3, -1, 1);
        default -> lookup(v, 0, 0, 1, 0.25, -1, -0.25);
      };
      if (Double.isNaN(multiple)) {
        return null;
      } else if (multiple == 0) {
        return ZERO;
      }
      Expression pi = ctx.pi();
      return pi == null ? null : Terms.withCoefficient(multiple, pi);
    });

  /** {@code sin(-x) -> -sin(x)}, {@code cos(-x) -> cos(x)}. */
  static final Rule TRIG_NEGATION = rule("trig_negation", 90, RuleCategory.TRIGONOMETRIC)
    .call(SIN, COS, TAN, COT, SEC, CSC, ASIN, ATAN).apply((f, ctx) -> {
      if (!Terms.isNegative(f.arg())) {
        return null;
      }
      Expression result = call(f.name(), Terms.negate(f.arg()));
      return ODD.contains(f.name()) ? Terms.negate(result) : result;
    });

  /** {@code sin(asin(x)) -> x}, which extends the domain beyond {@code [-1, 1]}. */
  static final Rule INVERSE_TRIG_IDENTITY = rule("inverse_trig_identity", 90, RuleCategory.TRIGONOMETRIC)
    .altersDomain().call(SIN, COS).apply((f, ctx) -> Patterns.argOf(f.arg(), f.is(SIN) ? ASIN : ACOS));

  static final Rule TAN_ATAN = rule("tan_atan", 90, RuleCategory.TRIGONOMETRIC).call(TAN)
    .apply((f, ctx) -> Patterns.argOf(f.arg(), ATAN));

  /** {@code sin(x + 2*pi) -> sin(x)}, {@code tan(x + pi) -> tan(x)}. */
  static final Rule TRIG_PERIODICITY = rule("trig_periodicity", 85, RuleCategory.TRIGONOMETRIC)
    .call(SIN, COS, TAN, COT, SEC, CSC).apply((f, ctx) -> {
      if (!(f.arg() instanceof Expression.Sum sum)) {
        return null;
      }
      double period = period(f.name());
      List<Expression> terms = sum.terms();
      for (int i = 0; i < terms.size(); i++) {
        OptionalDouble multiple = Patterns.piMultiple(terms.get(i), ctx);
        if (multiple.isPresent() && multiple.getAsDouble() != 0 &&
          Numbers.isInteger(multiple.getAsDouble() / period)) {
          return call(f.name(), sum(Patterns.without(terms, i)));
        }
      }
      return null;
    });

  /** {@code sin(x + pi/2) -> cos(x)}, {@code cos(x + pi) -> -cos(x)} and the other half-period shifts. */
  static final Rule TRIG_SHIFT = rule("trig_shift", 85, RuleCategory.TRIGONOMETRIC)
    .call(SIN, COS, TAN, COT, SEC, CSC).apply((f, ctx) -> {
      if (!(f.arg() instanceof Expression.Sum sum)) {
        return null;
      }
      double period = period(f.name());
      List<Expression> terms = sum.terms();
      for (int i = 0; i < terms.size(); i++) {
        OptionalDouble multiple = Patterns.piMultiple(terms.get(i), ctx);
        if (multiple.isEmpty() || !Numbers.isInteger(2 * multiple.getAsDouble())) {
          continue;
        }
        double shift = ((multiple.getAsDouble() % period) + period) % period;
        Expression shifted = shift == 0 ? null : shift(f.name(), shift, sum(Patterns.without(terms, i)));
        if (shifted != null) {
          return shifted;
        }
      }
      return null;
    });

  /** {@code asin(sin(x)) -> x}, which is only right on the principal branch. */
  static final Rule INVERSE_TRIG_COMPOSITION = rule("inverse_trig_composition", 85, RuleCategory.TRIGONOMETRIC)
    .altersDomain().call(ASIN, ACOS, ATAN).apply((f, ctx) -> Patterns.argOf(f.arg(), switch (f.name()) {
      case ASIN -> SIN;
      case ACOS -> COS;
      default -> TAN;
    }));

  /** {@code sin(x)/cos(x) -> tan(x)} and {@code cos(x)/sin(x) -> cot(x)}. */
  static final Rule TRIG_QUOTIENT = rule("trig_quotient", 80, RuleCategory.TRIGONOMETRIC).div((div, ctx) -> {
    Expression result = quotient(div, SIN, COS, TAN);
    return result != null ? result : quotient(div, COS, SIN, COT);
  });

  /** {@code 1/cos(x) -> sec(x)} and {@code 1/sin(x) -> csc(x)}. */
  static final Rule TRIG_RECIPROCAL = rule("trig_reciprocal", 80, RuleCategory.TRIGONOMETRIC).div((div, ctx) -> {
    Expression result = reciprocal(div, COS, SEC);
    return result != null ? result : reciprocal(div, SIN, CSC);
  });

  /** {@code 1/tan(x) -> cot(x)}, {@code 1/sec(x) -> cos(x)} and so on, which fill in removable holes. */
  static final Rule TRIG_RECIPROCAL_INVERSE = rule("trig_reciprocal_inverse", 80, RuleCategory.TRIGONOMETRIC)
    .altersDomain().div((div, ctx) -> {
      Expression result = reciprocal(div, TAN, COT);
      result = result != null ? result : reciprocal(div, COT, TAN);
      result = result != null ? result : reciprocal(div, SEC, COS);
      return result != null ? result : reciprocal(div, CSC, SIN);
    });

  /** {@code c*sin(x)^2 + c*cos(x)^2 -> c}. */
  static final Rule PYTHAGOREAN_IDENTITY = rule("pythagorean_identity", 70, RuleCategory.TRIGONOMETRIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      Expression arg = Patterns.squaredArgOf(a.rest(), SIN);
      return arg != null && arg.equals(Patterns.squaredArgOf(b.rest(), COS)) &&
        Numbers.approxEquals(a.coefficient(), b.coefficient()) ? Numbers.toExpression(a.coefficient()) : null;
    }));

  /** {@code 1 - sin(x)^2 -> cos(x)^2} and {@code 1 - cos(x)^2 -> sin(x)^2}. */
  static final Rule PYTHAGOREAN_COMPLEMENT = rule("pythagorean_complement", 70, RuleCategory.TRIGONOMETRIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      if (!a.isNumeric() || a.coefficient() == 0 || !Numbers.approxEquals(b.coefficient(), -a.coefficient())) {
        return null;
      }
      Expression arg = Patterns.squaredArgOf(b.rest(), SIN);
      if (arg != null) {
        return Terms.withCoefficient(a.coefficient(), pow(call(COS, arg), 2));
      }
      arg = Patterns.squaredArgOf(b.rest(), COS);
      return arg == null ? null : Terms.withCoefficient(a.coefficient(), pow(call(SIN, arg), 2));
    }));

  /** {@code 1 + tan(x)^2 -> sec(x)^2} and {@code 1 + cot(x)^2 -> csc(x)^2}. */
  static final Rule PYTHAGOREAN_TANGENT = rule("pythagorean_tangent", 70, RuleCategory.TRIGONOMETRIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      if (!a.isNumeric() || a.coefficient() == 0 || !Numbers.approxEquals(b.coefficient(), a.coefficient())) {
        return null;
      }
      Expression arg = Patterns.squaredArgOf(b.rest(), TAN);
      if (arg != null) {
        return Terms.withCoefficient(a.coefficient(), pow(call(SEC, arg), 2));
      }
      arg = Patterns.squaredArgOf(b.rest(), COT);
      return arg == null ? null : Terms.withCoefficient(a.coefficient(), pow(call(CSC, arg), 2));
    }));

  /** {@code cos(x)^2 - sin(x)^2 -> cos(2*x)}. */
  static final Rule COS_DOUBLE_ANGLE = rule("cos_double_angle", 65, RuleCategory.TRIGONOMETRIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      Expression arg = Patterns.squaredArgOf(a.rest(), COS);
      return arg != null && arg.equals(Patterns.squaredArgOf(b.rest(), SIN)) &&
        Numbers.approxEquals(b.coefficient(), -a.coefficient()) ?
        Terms.withCoefficient(a.coefficient(), call(COS, Terms.scaleBy(2, arg))) : null;
    }));

  /** {@code 2*sin(x)*cos(x) -> sin(2*x)}. */
  static final Rule SIN_DOUBLE_ANGLE = rule("sin_double_angle", 65, RuleCategory.TRIGONOMETRIC)
    .product((product, ctx) -> {
      Terms.Split split = Terms.split(product);
      Expression[] args = callArgs(split.rest(), SIN, COS);
      if (args == null || !args[0].equals(args[1]) || !Numbers.isEvenInteger(split.coefficient()) ||
        split.coefficient() == 0) {
        return null;
      }
      return Terms.withCoefficient(split.coefficient() / 2, call(SIN, Terms.scaleBy(2, args[0])));
    });

  /**
   * {@code sin(x)*cos(y) + cos(x)*sin(y) -> sin(x + y)}, {@code cos(x)*cos(y) - sin(x)*sin(y) -> cos(x + y)} and
   * the difference forms.
   */
  static final Rule ANGLE_ADDITION = rule("angle_addition", 60, RuleCategory.TRIGONOMETRIC)
    .sum((sum, ctx) -> Patterns.rewritePair(sum, (a, b) -> {
      double c = a.coefficient();
      Expression[] first = callArgs(a.rest(), SIN, COS);
      Expression[] second = callArgs(b.rest(), SIN, COS);
      if (first != null && second != null && !first[0].equals(first[1]) && second[0].equals(first[1]) &&
        second[1].equals(first[0])) {
        if (Numbers.approxEquals(b.coefficient(), c)) {
          return Terms.withCoefficient(c, call(SIN, sum(first[0], first[1])));
        } else if (Numbers.approxEquals(b.coefficient(), -c)) {
          return Terms.withCoefficient(c, call(SIN, sum(first[0], Terms.negate(first[1]))));
        }
        return null;
      }
      first = callArgs(a.rest(), COS, COS);
      second = callArgs(b.rest(), SIN, SIN);
      if (first == null || second == null || first[0].equals(first[1]) ||
        !((second[0].equals(first[0]) && second[1].equals(first[1])) ||
          (second[0].equals(first[1]) && second[1].equals(first[0])))) {
        return null;
      }
      if (Numbers.approxEquals(b.coefficient(), -c)) {
        return Terms.withCoefficient(c, call(COS, sum(first[0], first[1])));
      } else if (Numbers.approxEquals(b.coefficient(), c)) {
        return Terms.withCoefficient(c, call(COS, sum(first[0], Terms.negate(first[1]))));
      }
      return null;
    }));

  private static double period(String name) {
    return name.equals(TAN) || name.equals(COT) ? 1 : 2;
  }

  /** Returns {@code sin(m*pi/12)} for {@code 0 <= m < 24} if it has a closed form, otherwise null. */
  @Nullable
  private static Expression sinAt(int m) {
    if (m >= 12) {
      Expression positive = sinAt(m - 12);
      return positive == null ? null : Terms.negate(positive);
    }
    return switch (m) {
      case 0 -> ZERO;
      case 2, 10 -> div(ONE, constant(2));
      case 3, 9 -> div(call(SQRT, constant(2)), constant(2));
      case 4, 8 -> div(call(SQRT, constant(3)), constant(2));
      case 6 -> ONE;
      default -> null;
    };
  }

  /** Returns {@code tan(m*pi/12)} for {@code 0 <= m < 12} if it is defined and has a closed form, otherwise null. */
  @Nullable
  private static Expression tanAt(int m) {
    return switch (m) {
      case 0 -> ZERO;
      case 2 -> div(call(SQRT, constant(3)), constant(3));
      case 3 -> ONE;
      case 4 -> call(SQRT, constant(3));
      case 8 -> Terms.negate(call(SQRT, constant(3)));
      case 9 -> Expression.NEG_ONE;
      case 10 -> Terms.negate(div(call(SQRT, constant(3)), constant(3)));
      default -> null;
    };
  }

  /** Returns the value paired with {@code value} in {@code table} of {@code key, value} pairs, or NaN. */
  private static double lookup(double value, double... table) {
    for (int i = 0; i < table.length; i += 2) {
      if (Numbers.approxEquals(value, table[i])) {
        return table[i + 1];
      }
    }
    return Double.NaN;
  }

  @Nullable
  private static Expression shift(String name, double shift, Expression theta) {
    if (shift == 0.5) {
      return switch (name) {
        case SIN -> call(COS, theta);
        case COS -> Terms.negate(call(SIN, theta));
        case SEC -> Terms.negate(call(CSC, theta));
        case CSC -> call(SEC, theta);
        case TAN -> Terms.negate(call(COT, theta));
        case COT -> Terms.negate(call(TAN, theta));
        default -> null;
      };
    } else if (shift == 1) {
      return name.equals(TAN) || name.equals(COT) ? null : Terms.negate(call(name, theta));
    } else if (shift == 1.5) {
      return switch (name) {
        case SIN -> Terms.negate(call(COS, theta));
        case COS -> call(SIN, theta);
        case SEC -> call(CSC, theta);
        case CSC -> Terms.negate(call(SEC, theta));
        default -> null;
      };
    }
    return null;
  }

  /** Returns {@code c*result(x)} if {@code div} is {@code c*top(x)/bottom(x)}, otherwise null. */
  @Nullable
  static Expression quotient(Expression.Div div, String top, String bottom, String result) {
    Terms.Split numerator = Terms.split(div.numerator());
    Expression arg = Patterns.argOf(numerator.rest(), top);
    return arg != null && arg.equals(Patterns.argOf(div.denominator(), bottom)) ?
      Terms.withCoefficient(numerator.coefficient(), call(result, arg)) : null;
  }

  /** Returns {@code c*result(x)} if {@code div} is {@code c/bottom(x)} for a numeric {@code c}, otherwise null. */
  @Nullable
  static Expression reciprocal(Expression.Div div, String bottom, String result) {
    OptionalDouble numerator = Numbers.valueOf(div.numerator());
    Expression arg = Patterns.argOf(div.denominator(), bottom);
    return numerator.isPresent() && arg != null ? Terms.withCoefficient(numerator.getAsDouble(), call(result, arg)) :
      null;
  }

  /**
   * Returns the arguments {@code [a, b]} if {@code expression} is the product {@code first(a)*second(b)} in either
   * order, otherwise null.
   */
  @Nullable
  static Expression[] callArgs(Expression expression, String first, String second) {
    if (!(expression instanceof Expression.Product p) || p.factors().size() != 2) {
      return null;
    }
    Expression f0 = p.factors().get(0);
    Expression f1 = p.factors().get(1);
    Expression a = Patterns.argOf(f0, first);
    Expression b = Patterns.argOf(f1, second);
    if (a != null && b != null) {
      return new Expression[]{a, b};
    }
    a = Patterns.argOf(f1, first);
    b = Patterns.argOf(f0, second);
    return a != null && b != null ? new Expression[]{a, b} : null;
  }

  static List<Rule> all() {
    return List.of(
      TRIG_EXACT_VALUES,
      INVERSE_TRIG_VALUES,
      TRIG_NEGATION,
      INVERSE_TRIG_IDENTITY,
      TAN_ATAN,
      TRIG_PERIODICITY,
      TRIG_SHIFT,
      INVERSE_TRIG_COMPOSITION,
      TRIG_QUOTIENT,
      TRIG_RECIPROCAL,
      TRIG_RECIPROCAL_INVERSE,
      PYTHAGOREAN_IDENTITY,
      PYTHAGOREAN_COMPLEMENT,
      PYTHAGOREAN_TANGENT,
      COS_DOUBLE_ANGLE,
      SIN_DOUBLE_ANGLE,
      ANGLE_ADDITION
    );
  }
}
