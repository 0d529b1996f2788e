package com.symplify.symbol;

import static org.junit.jupiter.api.Assertions.*;

import com.symplify.expression.Expression;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class SymbolScopeTest {

  @Test
  void testInterning() {
    SymbolScope scope = SymbolScope.create("test");
    Expression.Symbol x = scope.symbol("x");
    assertSame(x, scope.symbol("x"));
    assertEquals(0, x.id());
    assertEquals(1, scope.symbol("y").id());
    assertEquals(2, scope.size());
    assertEquals("test", scope.name());
  }

  @Test
  void testLookup() {
    SymbolScope scope = SymbolScope.create("test");
    assertEquals(Optional.empty(), scope.lookup("x"));
    Expression.Symbol x = scope.symbol("x");
    assertEquals(Optional.of(x), scope.lookup("x"));
    assertEquals(1, scope.size());
  }

  @Test
  void testBlankNameRejected() {
    SymbolScope scope = SymbolScope.create("test");
    assertThrows(IllegalArgumentException.class, () -> scope.symbol(" "));
    assertThrows(IllegalArgumentException.class, () -> scope.symbol(null));
  }

  @Test
  void testScopesAreIndependent() {
    SymbolScope a = SymbolScope.create("a");
    SymbolScope b = SymbolScope.create("b");
    a.symbol("w");
    assertNotEquals(a.symbol("x"), b.symbol("x"));
    assertSame(SymbolScope.global(), SymbolScope.global());
    assertEquals(SymbolScope.global().symbol("x"), Expression.symbol("x"));
  }

  @Test
  void testConcurrentInterning() throws Exception {
    SymbolScope scope = SymbolScope.create("concurrent");
    List<Expression.Symbol> seen = new CopyOnWriteArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int thread = 0; thread < 4; thread++) {
        futures.add(executor.submit(() -> {
          for (int i = 0; i < 100; i++) {
            seen.add(scope.symbol("v" + i));
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }
    assertEquals(100, scope.size());
    Set<Integer> ids = new HashSet<>();
    for (Expression.Symbol symbol : seen) {
      assertSame(scope.symbol(symbol.name()), symbol);
      ids.add(symbol.id());
    }
    assertEquals(100, ids.size());
    assertTrue(ids.stream().allMatch(id -> id >= 0 && id < 100));
  }
}
