package com.symplify.rules;

import com.symplify.expression.Expression;
import com.symplify.expression.KnownFunctions;
import com.symplify.expression.Numbers;
import java.util.OptionalDouble;

/**
 * Conservative checks about where an expression is defined and what sign it has, used by rules that only rewrite
 * when it provably does not change the domain. A {@code false} answer means "not known", not "no".
 */
final class Domains {

  private Domains() {}

  /** Returns true if {@code expression} is defined for every real value of its symbols. */
  static boolean isTotal(Expression expression) {
    if (expression instanceof Expression.Constant c) {
      return Double.isFinite(c.value());
    } else if (expression instanceof Expression.Symbol) {
      return true;
    } else if (expression instanceof Expression.Sum || expression instanceof Expression.Product) {
      return expression.children().stream().allMatch(Domains::isTotal);
    } else if (expression instanceof Expression.Pow p) {
      OptionalDouble exponent = Numbers.valueOf(p.exponent());
      return exponent.isPresent() && Numbers.isInteger(exponent.getAsDouble()) && exponent.getAsDouble() >= 0 &&
        isTotal(p.base());
    } else if (expression instanceof Expression.Div d) {
      OptionalDouble denominator = Numbers.valueOf(d.denominator());
      return denominator.isPresent() && denominator.getAsDouble() != 0 && isTotal(d.numerator());
    } else if (expression instanceof Expression.FunctionCall f) {
      return KnownFunctions.TOTAL.contains(f.name()) && f.args().stream().allMatch(Domains::isTotal);
    }
    return false;
  }

  /** Returns true if {@code expression} is provably {@code >= 0} wherever it is defined. */
  static boolean isNonNegative(Expression expression) {
    OptionalDouble value = Numbers.valueOf(expression);
    if (value.isPresent()) {
      return value.getAsDouble() >= 0;
    } else if (expression instanceof Expression.FunctionCall f) {
      return switch (f.name()) {
        case KnownFunctions.ABS, KnownFunctions.EXP, KnownFunctions.COSH, KnownFunctions.SQRT,
          KnownFunctions.SECH, KnownFunctions.ACOS -> true;
        default -> false;
      };
    } else if (expression instanceof Expression.Pow p) {
      return Numbers.isEvenInteger(p.exponent()) || isNonNegative(p.base());
    } else if (expression instanceof Expression.Product || expression instanceof Expression.Sum) {
      return expression.children().stream().allMatch(Domains::isNonNegative);
    } else if (expression instanceof Expression.Div d) {
      return isNonNegative(d.numerator()) && isNonNegative(d.denominator());
    }
    return false;
  }
}
