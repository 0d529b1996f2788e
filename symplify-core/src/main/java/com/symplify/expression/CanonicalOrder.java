package com.symplify.expression;

import java.util.Comparator;
import java.util.List;

/**
 * Deterministic total order over expressions, used to sort the children of sums and products.
 * <p>
 * Nodes order first by kind: constants, then symbols, function calls, sums, products, quotients and powers. Within a
 * kind, constants compare by value, symbols by name then interned id, function calls by name then arguments, sums and
 * products by child count then children, and quotients and powers by their operands left to right.
 * <p>
 * The order only returns {@code 0} for structurally equal trees, so it is consistent with {@code equals}.
 */
public final class CanonicalOrder implements Comparator<Expression> {

  public static final CanonicalOrder INSTANCE = new CanonicalOrder();

  private CanonicalOrder() {}

  private static int rank(Expression expression) {
    return switch (expression.kind()) {
      case NUMBER -> 0;
      case SYMBOL -> 1;
      case FUNCTION -> 2;
      case SUM -> 3;
      case PRODUCT -> 4;
      case DIV -> 5;
      case POW -> 6;
    };
  }

  @Override
  public int compare(Expression a, Expression b) {
    if (a == b) {
      return 0;
    }
    int result = Integer.compare(rank(a), rank(b));
    if (result != 0) {
      return result;
    }
    if (a instanceof Expression.Constant ca && b instanceof Expression.Constant cb) {
      return Double.compare(ca.value(), cb.value());
    } else if (a instanceof Expression.Symbol sa && b instanceof Expression.Symbol sb) {
      result = sa.name().compareTo(sb.name());
      return result != 0 ? result : Integer.compare(sa.id(), sb.id());
    } else if (a instanceof Expression.FunctionCall fa && b instanceof Expression.FunctionCall fb) {
      result = fa.name().compareTo(fb.name());
      return result != 0 ? result : compareLists(fa.args(), fb.args());
    } else if (a.kind().isCommutative()) {
      List<Expression> ac = a.children();
      List<Expression> bc = b.children();
      result = Integer.compare(ac.size(), bc.size());
      return result != 0 ? result : compareLists(ac, bc);
    } else {
      // Div and Pow: compare operands left to right
      return compareLists(a.children(), b.children());
    }
  }

  private int compareLists(List<Expression> a, List<Expression> b) {
    int n = Math.min(a.size(), b.size());
    for (int i = 0; i < n; i++) {
      int result = compare(a.get(i), b.get(i));
      if (result != 0) {
        return result;
      }
    }
    return Integer.compare(a.size(), b.size());
  }
}
