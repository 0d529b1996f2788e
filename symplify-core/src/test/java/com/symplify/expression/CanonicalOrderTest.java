package com.symplify.expression;

import static com.symplify.ExpressionTestUtil.parse;
import static org.junit.jupiter.api.Assertions.*;

import com.symplify.symbol.SymbolScope;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CanonicalOrderTest {

  private static List<Expression> sorted(String... expressions) {
    List<Expression> result = new ArrayList<>();
    for (String expression : expressions) {
      result.add(parse(expression));
    }
    result.sort(CanonicalOrder.INSTANCE);
    return result;
  }

  @Test
  void testOrdersByKindFirst() {
    assertEquals(
      List.of(parse("2"), parse("x"), parse("sin(x)"), parse("x + y"), parse("x*y"), parse("x/y"), parse("x^2")),
      sorted("x^2", "x/y", "x*y", "x + y", "sin(x)", "x", "2")
    );
  }

  @Test
  void testOrdersWithinKind() {
    assertEquals(List.of(parse("-1"), parse("0.5"), parse("3")), sorted("3", "0.5", "-1"));
    assertEquals(List.of(parse("a"), parse("b"), parse("z")), sorted("z", "a", "b"));
    assertEquals(List.of(parse("cos(y)"), parse("sin(x)"), parse("sin(y)")), sorted("sin(y)", "cos(y)", "sin(x)"));
  }

  @Test
  void testFewerChildrenFirst() {
    assertEquals(List.of(parse("x*y"), parse("x*y*z")), sorted("x*y*z", "x*y"));
  }

  @Test
  void testConsistentWithEquals() {
    assertEquals(0, CanonicalOrder.INSTANCE.compare(parse("x + y"), parse("y + x")));
    assertNotEquals(0, CanonicalOrder.INSTANCE.compare(parse("x/y"), parse("y/x")));
  }

  @Test
  void testSymbolsWithSameNameOrderById() {
    var first = SymbolScope.create("a").symbol("x");
    var other = SymbolScope.create("b");
    other.symbol("w");
    var second = other.symbol("x");
    assertTrue(CanonicalOrder.INSTANCE.compare(first, second) < 0);
  }
}
