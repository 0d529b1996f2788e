package com.symplify.rules;

import com.symplify.config.SimplifyConfig;
import com.symplify.expression.Expression;
import com.symplify.expression.KnownFunctions;
import com.symplify.symbol.SymbolScope;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a rule can see about the request it runs in.
 *
 * @param scope           scope that symbols are interned in
 * @param fixedSymbols    symbols that must not be given a built-in meaning
 * @param customFunctions function names with no built-in rules
 * @param domainSafe      true to forbid rewrites that change where an expression is defined
 * @param depth           depth of the node being rewritten, 1 at the root
 * @param pass            bottom-up pass currently running, starting at 1
 */
public record RuleContext(
  SymbolScope scope,
  Set<Expression.Symbol> fixedSymbols,
  Set<String> customFunctions,
  boolean domainSafe,
  int depth,
  int pass
) {

  /** Returns the root context for a request with {@code config}. */
  public static RuleContext of(SimplifyConfig config) {
    SymbolScope scope = config.scope();
    return new RuleContext(
      scope,
      config.fixedSymbols().stream().map(scope::symbol).collect(Collectors.toUnmodifiableSet()),
      config.customFunctionNames(),
      config.domainSafe(),
      1,
      1
    );
  }

  public RuleContext at(int newDepth, int newPass) {
    return newDepth == depth && newPass == pass ? this :
      new RuleContext(scope, fixedSymbols, customFunctions, domainSafe, newDepth, newPass);
  }

  public boolean isFixed(Expression.Symbol symbol) {
    return fixedSymbols.contains(symbol);
  }

  public boolean isCustomFunction(String name) {
    return customFunctions.contains(name);
  }

  /** Returns true if {@code expression} is the circle constant {@code pi} and it has not been fixed. */
  public boolean isPi(Expression expression) {
    return isBuiltinConstant(expression, KnownFunctions.PI);
  }

  /** Returns true if {@code expression} is Euler's number {@code e} and it has not been fixed. */
  public boolean isEuler(Expression expression) {
    return isBuiltinConstant(expression, KnownFunctions.E);
  }

  /** Returns the circle constant, or null if {@code pi} is fixed in this request. */
  public Expression.Symbol pi() {
    Expression.Symbol pi = scope.symbol(KnownFunctions.PI);
    return isFixed(pi) ? null : pi;
  }

  private boolean isBuiltinConstant(Expression expression, String name) {
    return expression instanceof Expression.Symbol s && s.name().equals(name) && !isFixed(s);
  }
}
