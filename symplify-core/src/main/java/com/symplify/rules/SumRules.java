package com.symplify.rules;

import static com.symplify.expression.Expression.constant;
import static com.symplify.expression.Expression.div;
import static com.symplify.expression.Expression.pow;
import static com.symplify.expression.Expression.product;
import static com.symplify.expression.Expression.sum;
import static com.symplify.rules.Rule.rule;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import javax.annotation.Nullable;

/** Rules that collect, factor and combine the terms of a sum. */
final class SumRules {

  private SumRules() {}

  /** {@code 2*x + 3*x -> 5*x}, for every group of terms that differ only in their numeric coefficient. */
  static final Rule COMBINE_LIKE_TERMS = rule("combine_like_terms", 80, RuleCategory.ALGEBRAIC).sum((sum, ctx) -> {
    Map<Expression, Double> coefficients = new LinkedHashMap<>();
    Map<Expression, Integer> counts = new LinkedHashMap<>();
    List<Expression> result = new ArrayList<>();
    boolean merged = false;
    for (Expression term : sum.terms()) {
      Terms.Split split = Terms.split(term);
      if (split.isNumeric()) {
        result.add(term);
      } else {
        coefficients.merge(split.rest(), split.coefficient(), Double::sum);
        merged |= counts.merge(split.rest(), 1, Integer::sum) > 1;
      }
    }
    if (!merged) {
      return null;
    }
    coefficients.forEach((rest, coefficient) -> {
      if (coefficient != 0) {
        result.add(Terms.withCoefficient(coefficient, rest));
      }
    });
    return sum(result);
  });

  /** {@code a^2 + 2*a*b + b^2 -> (a + b)^2} and {@code a^2 - 2*a*b + b^2 -> (b - a)^2}. */
  static final Rule PERFECT_SQUARE = rule("perfect_square", 50, RuleCategory.ALGEBRAIC).sum((sum, ctx) -> {
    List<Expression> terms = sum.terms();
    if (terms.size() != 3) {
      return null;
    }
    for (int i = 0; i < 3; i++) {
      for (int j = i + 1; j < 3; j++) {
        Expression a = rootOf(terms.get(i), 2);
        Expression b = a == null ? null : rootOf(terms.get(j), 2);
        if (b == null) {
          continue;
        }
        Expression cross = terms.get(3 - i - j);
        Expression ab = Terms.multiply(a, b);
        if (matches(cross, 2, ab)) {
          return pow(sum(a, b), 2);
        } else if (matches(cross, -2, ab)) {
          return pow(sum(b, Terms.negate(a)), 2);
        }
      }
    }
    return null;
  });

  /** {@code a^3 + 3*a^2*b + 3*a*b^2 + b^3 -> (a + b)^3}, with the signs carried by the cube roots. */
  static final Rule PERFECT_CUBE = rule("perfect_cube", 50, RuleCategory.ALGEBRAIC).sum((sum, ctx) -> {
    List<Expression> terms = sum.terms();
    if (terms.size() != 4) {
      return null;
    }
    for (int i = 0; i < 4; i++) {
      for (int j = i + 1; j < 4; j++) {
        Expression a = rootOf(terms.get(i), 3);
        Expression b = a == null ? null : rootOf(terms.get(j), 3);
        if (b == null) {
          continue;
        }
        List<Expression> others = Patterns.without(terms, i, j);
        Expression aab = Terms.multiply(square(a), b);
        Expression abb = Terms.multiply(a, square(b));
        if ((matches(others.get(0), 3, aab) && matches(others.get(1), 3, abb)) ||
          (matches(others.get(0), 3, abb) && matches(others.get(1), 3, aab))) {
          return pow(sum(a, b), 3);
        }
      }
    }
    return null;
  });

  /** {@code a/d + b/d -> (a + b)/d} for symbolic denominators. */
  static final Rule COMBINE_SAME_DENOMINATOR = rule("combine_same_denominator", 45, RuleCategory.ALGEBRAIC)
    .sum((sum, ctx) -> {
      Map<Expression, List<Expression>> numerators = new LinkedHashMap<>();
      List<Expression> result = new ArrayList<>();
      for (Expression term : sum.terms()) {
        if (term instanceof Expression.Div d && !Numbers.isNumeric(d.denominator())) {
          numerators.computeIfAbsent(d.denominator(), k -> new ArrayList<>()).add(d.numerator());
        } else {
          result.add(term);
        }
      }
      if (numerators.values().stream().noneMatch(group -> group.size() > 1)) {
        return null;
      }
      numerators.forEach((denominator, group) -> result.add(div(sum(group), denominator)));
      return sum(result);
    });

  /**
   * {@code 6*x + 3 -> 3*(2*x + 1)} when every coefficient is an integer with a common factor that one of them equals.
   * The sign is factored out too when every term is negative.
   */
  static final Rule NUMERIC_GCD_FACTORING = rule("numeric_gcd_factoring", 42, RuleCategory.ALGEBRAIC)
    .sum((sum, ctx) -> {
      List<Terms.Split> splits = sum.terms().stream().map(Terms::split).toList();
      long gcd = 0;
      boolean allNegative = true;
      for (Terms.Split split : splits) {
        double coefficient = split.coefficient();
        if (!Numbers.isInteger(coefficient) || coefficient == 0 || Math.abs(coefficient) > Numbers.MAX_EXACT) {
          return null;
        }
        gcd = Numbers.gcd(gcd, (long) coefficient);
        allNegative &= coefficient < 0;
      }
      double common = gcd;
      if (gcd <= 1 || splits.stream().noneMatch(split -> Math.abs(split.coefficient()) == common)) {
        return null;
      }
      double factor = allNegative ? -common : common;
      List<Expression> reduced = splits.stream()
        .map(split -> Terms.withCoefficient(split.coefficient() / factor, split.rest()))
        .toList();
      return product(constant(factor), sum(reduced));
    });

  /** {@code a/b + c/d -> (a*d + c*b)/(b*d)}, kept only if it lets something cancel. */
  static final Rule ADD_FRACTIONS = rule("add_fractions", 38, RuleCategory.ALGEBRAIC).speculative()
    .sum((sum, ctx) -> {
      List<Expression> denominators = new ArrayList<>();
      for (Expression term : sum.terms()) {
        if (isSymbolicFraction(term) && !denominators.contains(((Expression.Div) term).denominator())) {
          denominators.add(((Expression.Div) term).denominator());
        }
      }
      if (denominators.isEmpty() || denominators.size() > 4) {
        return null;
      }
      Expression common = product(denominators);
      List<Expression> numerators = new ArrayList<>();
      for (Expression term : sum.terms()) {
        if (isSymbolicFraction(term)) {
          Expression.Div d = (Expression.Div) term;
          List<Expression> others = new ArrayList<>(denominators);
          others.remove(d.denominator());
          numerators.add(Terms.multiply(d.numerator(), product(others)));
        } else {
          numerators.add(Terms.multiply(term, common));
        }
      }
      return div(sum(numerators), common);
    });

  /** Distributes products and small powers of sums, kept only if the expanded sum ends up smaller. */
  static final Rule EXPAND_FOR_CANCELLATION = rule("expand_for_cancellation", 30, RuleCategory.ALGEBRAIC)
    .speculative()
    .sum((sum, ctx) -> {
      if (sum.terms().stream().noneMatch(Expansion::isExpandable)) {
        return null;
      }
      List<Expression> expanded = Expansion.expand(sum);
      return expanded == null ? null : sum(expanded);
    });

  /** {@code a^2 - b^2 -> (a + b)*(a - b)}. */
  static final Rule FACTOR_DIFFERENCE_OF_SQUARES = rule("factor_difference_of_squares", 10, RuleCategory.ALGEBRAIC)
    .sum((sum, ctx) -> {
      List<Expression> terms = sum.terms();
      if (terms.size() != 2) {
        return null;
      }
      for (int i = 0; i < 2; i++) {
        Expression positive = terms.get(i);
        Expression negative = terms.get(1 - i);
        if (Terms.isNegative(positive) || !Terms.isNegative(negative)) {
          continue;
        }
        Expression a = rootOf(positive, 2);
        Expression b = rootOf(Terms.negate(negative), 2);
        if (a != null && b != null) {
          return product(sum(a, b), sum(a, Terms.negate(b)));
        }
      }
      return null;
    });

  private static boolean isSymbolicFraction(Expression term) {
    return term instanceof Expression.Div d && !Numbers.isNumeric(d.denominator());
  }

  /** Returns true if {@code term} is {@code factor} times {@code expected}. */
  private static boolean matches(Expression term, double factor, Expression expected) {
    Terms.Split actual = Terms.split(term);
    Terms.Split target = Terms.split(expected);
    return actual.rest().equals(target.rest()) && Numbers.approxEquals(actual.coefficient(),
      factor * target.coefficient());
  }

  /**
   * Returns the exact {@code n}-th root of a term made of an integer coefficient and powers whose exponents are
   * multiples of {@code n}, or null.
   */
  @Nullable
  private static Expression rootOf(Expression term, int n) {
    Terms.Split split = Terms.split(term);
    OptionalDouble root = n == 2 ? Numbers.exactSqrt(split.coefficient()) : Numbers.exactCbrt(split.coefficient());
    if (root.isEmpty() || root.getAsDouble() == 0) {
      return null;
    }
    if (split.isNumeric()) {
      return constant(root.getAsDouble());
    }
    List<Expression> factors = new ArrayList<>();
    for (Expression factor : Terms.factors(split.rest())) {
      OptionalDouble exponent = Patterns.numericExponent(factor);
      if (exponent.isEmpty() || !Numbers.isInteger(exponent.getAsDouble()) || exponent.getAsDouble() <= 0 ||
        exponent.getAsDouble() % n != 0) {
        return null;
      }
      factors.add(Patterns.raise(((Expression.Pow) factor).base(), exponent.getAsDouble() / n));
    }
    return Terms.withCoefficient(root.getAsDouble(), product(factors));
  }

  private static Expression square(Expression expression) {
    Terms.Split split = Terms.split(expression);
    if (split.isNumeric()) {
      return Numbers.toExpression(split.coefficient() * split.coefficient());
    }
    List<Expression> factors = new ArrayList<>();
    for (Expression factor : Terms.factors(split.rest())) {
      OptionalDouble exponent = Patterns.numericExponent(factor);
      factors.add(exponent.isPresent() ? Patterns.raise(((Expression.Pow) factor).base(), 2 * exponent.getAsDouble()) :
        pow(factor, 2));
    }
    return Terms.withCoefficient(split.coefficient() * split.coefficient(), product(factors));
  }

  static List<Rule> all() {
    return List.of(
      COMBINE_LIKE_TERMS,
      PERFECT_SQUARE,
      PERFECT_CUBE,
      COMBINE_SAME_DENOMINATOR,
      NUMERIC_GCD_FACTORING,
      ADD_FRACTIONS,
      EXPAND_FOR_CANCELLATION,
      FACTOR_DIFFERENCE_OF_SQUARES
    );
  }
}
