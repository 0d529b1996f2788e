package com.symplify.rules;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import javax.annotation.Nullable;

/** Small structural matchers shared by the rule sets. */
final class Patterns {

  private Patterns() {}

  /** Returns {@code a} if {@code expression} is {@code name(a)}, otherwise null. */
  @Nullable
  static Expression argOf(Expression expression, String name) {
    return expression instanceof Expression.FunctionCall f && f.is(name) ? f.arg() : null;
  }

  /** Returns {@code a} if {@code expression} is {@code name(a)^2}, otherwise null. */
  @Nullable
  static Expression squaredArgOf(Expression expression, String name) {
    return expression instanceof Expression.Pow p && Numbers.is(p.exponent(), 2) ? argOf(p.base(), name) : null;
  }

  /**
   * Returns {@code k} if {@code expression} is {@code k*pi} for a numeric {@code k} (including {@code 0}), or empty.
   */
  static OptionalDouble piMultiple(Expression expression, RuleContext context) {
    Terms.Split split = Terms.split(expression);
    if (split.isNumeric()) {
      return split.coefficient() == 0 ? OptionalDouble.of(0) : OptionalDouble.empty();
    }
    return context.isPi(split.rest()) ? OptionalDouble.of(split.coefficient()) : OptionalDouble.empty();
  }

  /** Returns a copy of {@code items} without the elements at {@code skip} indexes. */
  static List<Expression> without(List<Expression> items, int... skip) {
    List<Expression> result = new ArrayList<>(items.size());
    outer:
    for (int i = 0; i < items.size(); i++) {
      for (int s : skip) {
        if (s == i) {
          continue outer;
        }
      }
      result.add(items.get(i));
    }
    return result;
  }

  /** Returns the terms of {@code sum} with the terms at {@code i} and {@code j} replaced by {@code replacement}. */
  static Expression replacePair(Expression.Sum sum, int i, int j, Expression replacement) {
    List<Expression> terms = without(sum.terms(), i, j);
    terms.add(replacement);
    return Expression.sum(terms);
  }

  /** Rewrites an ordered pair of split terms of a sum into one replacement term, or returns null. */
  @FunctionalInterface
  interface PairRewrite {

    @Nullable
    Expression apply(Terms.Split first, Terms.Split second);
  }

  /**
   * Tries {@code rewrite} on every ordered pair of distinct terms of {@code sum} and replaces the first pair that
   * matches, or returns null if none does.
   */
  @Nullable
  static Expression rewritePair(Expression.Sum sum, PairRewrite rewrite) {
    List<Terms.Split> splits = sum.terms().stream().map(Terms::split).toList();
    for (int i = 0; i < splits.size(); i++) {
      for (int j = 0; j < splits.size(); j++) {
        if (i != j) {
          Expression replacement = rewrite.apply(splits.get(i), splits.get(j));
          if (replacement != null) {
            return replacePair(sum, i, j, replacement);
          }
        }
      }
    }
    return null;
  }

  /** Returns {@code base ^ exponent}, or just {@code base} when the exponent is one. */
  static Expression raise(Expression base, double exponent) {
    return exponent == 1 ? base : Expression.pow(base, exponent);
  }

  /** Returns the numeric exponent of {@code expression} if it is a power with one, or empty. */
  static OptionalDouble numericExponent(Expression expression) {
    return expression instanceof Expression.Pow p ? Numbers.valueOf(p.exponent()) : OptionalDouble.empty();
  }
}
