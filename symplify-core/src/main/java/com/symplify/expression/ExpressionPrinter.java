package com.symplify.expression;

import java.util.stream.Collectors;

/**
 * Renders an expression as plain infix text for log messages and exceptions.
 * <p>
 * This is a diagnostic format, not a display layer: it parenthesizes conservatively and prints {@code a + (-1)*b} as
 * {@code a - b}.
 */
final class ExpressionPrinter {

  private ExpressionPrinter() {}

  static String print(Expression expression) {
    StringBuilder builder = new StringBuilder();
    append(builder, expression);
    return builder.toString();
  }

  private static void append(StringBuilder builder, Expression expression) {
    if (expression instanceof Expression.Constant c) {
      builder.append(format(c.value()));
    } else if (expression instanceof Expression.Symbol s) {
      builder.append(s.name());
    } else if (expression instanceof Expression.Sum s) {
      boolean first = true;
      for (Expression term : s.terms()) {
        if (first) {
          append(builder, term);
        } else if (Terms.isNegative(term)) {
          builder.append(" - ");
          appendFactor(builder, Terms.negate(term));
        } else {
          builder.append(" + ");
          append(builder, term);
        }
        first = false;
      }
    } else if (expression instanceof Expression.Product p) {
      int start = 0;
      if (p.factors().get(0) instanceof Expression.Constant c && c.value() == -1) {
        builder.append('-');
        start = 1;
      }
      for (int i = start; i < p.factors().size(); i++) {
        if (i > start) {
          builder.append(" * ");
        }
        appendFactor(builder, p.factors().get(i));
      }
    } else if (expression instanceof Expression.Div d) {
      appendFactor(builder, d.numerator());
      builder.append(" / ");
      appendGrouped(builder, d.denominator(), !isAtom(d.denominator()));
    } else if (expression instanceof Expression.Pow p) {
      appendGrouped(builder, p.base(), !isAtom(p.base()));
      builder.append('^');
      appendGrouped(builder, p.exponent(), !isAtom(p.exponent()));
    } else if (expression instanceof Expression.FunctionCall f) {
      builder.append(f.name()).append('(');
      builder.append(f.args().stream().map(ExpressionPrinter::print).collect(Collectors.joining(", ")));
      builder.append(')');
    }
  }

  private static void appendFactor(StringBuilder builder, Expression expression) {
    appendGrouped(builder, expression, expression instanceof Expression.Sum || expression instanceof Expression.Div);
  }

  private static void appendGrouped(StringBuilder builder, Expression expression, boolean parens) {
    if (parens) {
      builder.append('(');
    }
    append(builder, expression);
    if (parens) {
      builder.append(')');
    }
  }

  private static boolean isAtom(Expression expression) {
    return (expression instanceof Expression.Constant c && c.value() >= 0) ||
      expression instanceof Expression.Symbol ||
      expression instanceof Expression.FunctionCall;
  }

  private static String format(double value) {
    if (Numbers.isInteger(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
