package com.symplify.symbol;

import com.symplify.expression.Expression;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Interns symbol names to {@link Expression.Symbol} instances with dense integer ids.
 * <p>
 * Looking up the same name twice in a scope returns equal symbols, and different names get different ids. Lookups
 * and inserts are safe from any number of threads. Symbols from different scopes with the same name are not equal
 * unless they happen to share an id, so keep all the expressions in one simplification in the same scope.
 */
@ThreadSafe
public final class SymbolScope {

  private static final SymbolScope GLOBAL = new SymbolScope("global");

  private final String name;
  private final ConcurrentMap<String, Expression.Symbol> symbols = new ConcurrentHashMap<>();
  private final AtomicInteger nextId = new AtomicInteger(0);

  private SymbolScope(String name) {
    this.name = name;
  }

  /** Returns the process-wide scope used by {@link Expression#symbol(String)}. */
  public static SymbolScope global() {
    return GLOBAL;
  }

  /** Returns a new empty scope, for callers that want symbol ids isolated from the rest of the process. */
  public static SymbolScope create(String name) {
    return new SymbolScope(name);
  }

  /** Returns the symbol for {@code symbolName}, interning it on first use. */
  public Expression.Symbol symbol(String symbolName) {
    if (symbolName == null || symbolName.isBlank()) {
      throw new IllegalArgumentException("Symbol name must not be blank");
    }
    Expression.Symbol existing = symbols.get(symbolName);
    return existing != null ? existing :
      symbols.computeIfAbsent(symbolName, n -> new Expression.Symbol(n, nextId.getAndIncrement()));
  }

  /** Returns the symbol for {@code symbolName} if it has already been interned. */
  public Optional<Expression.Symbol> lookup(String symbolName) {
    return Optional.ofNullable(symbols.get(symbolName));
  }

  public int size() {
    return symbols.size();
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return "SymbolScope{" + name + ", size=" + symbols.size() + "}";
  }
}
