package com.symplify.rules;

import com.symplify.expression.Expression;
import com.symplify.expression.Numbers;
import com.symplify.expression.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import javax.annotation.Nullable;

/** Distributes products and small integer powers of sums into a flat list of monomials. */
final class Expansion {

  static final int MAX_TERMS = 64;
  static final int MAX_EXPONENT = 6;

  private Expansion() {}

  /** Returns true if {@link #expand(Expression)} would distribute something in {@code expression}. */
  static boolean isExpandable(Expression expression) {
    if (expression instanceof Expression.Pow p) {
      return p.base() instanceof Expression.Sum && smallExponent(p) > 1;
    } else if (expression instanceof Expression.Product p) {
      return p.factors().stream().anyMatch(f -> f instanceof Expression.Sum || isExpandable(f));
    }
    return false;
  }

  private static int smallExponent(Expression.Pow pow) {
    OptionalDouble exponent = Numbers.valueOf(pow.exponent());
    if (exponent.isPresent() && Numbers.isInteger(exponent.getAsDouble()) && exponent.getAsDouble() >= 2 &&
      exponent.getAsDouble() <= MAX_EXPONENT) {
      return (int) exponent.getAsDouble();
    }
    return 0;
  }

  /** Returns the monomials of {@code expression}, or null if there would be more than {@link #MAX_TERMS}. */
  @Nullable
  static List<Expression> expand(Expression expression) {
    if (expression instanceof Expression.Sum sum) {
      List<Expression> result = new ArrayList<>();
      for (Expression term : sum.terms()) {
        List<Expression> expanded = expand(term);
        if (expanded == null || result.size() + expanded.size() > MAX_TERMS) {
          return null;
        }
        result.addAll(expanded);
      }
      return result;
    } else if (expression instanceof Expression.Product product) {
      List<Expression> result = List.of(Expression.ONE);
      for (Expression factor : product.factors()) {
        List<Expression> expanded = expand(factor);
        result = expanded == null ? null : multiply(result, expanded);
        if (result == null) {
          return null;
        }
      }
      return result;
    } else if (expression instanceof Expression.Pow pow && pow.base() instanceof Expression.Sum base) {
      int exponent = smallExponent(pow);
      if (exponent > 1) {
        List<Expression> terms = expand(base);
        List<Expression> result = terms;
        for (int i = 1; i < exponent && result != null; i++) {
          result = multiply(result, terms);
        }
        return result;
      }
    }
    return List.of(expression);
  }

  @Nullable
  private static List<Expression> multiply(List<Expression> as, List<Expression> bs) {
    if (as == null || bs == null || (long) as.size() * bs.size() > MAX_TERMS) {
      return null;
    }
    List<Expression> result = new ArrayList<>(as.size() * bs.size());
    for (Expression a : as) {
      for (Expression b : bs) {
        result.add(Terms.multiply(a, b));
      }
    }
    return result;
  }
}
