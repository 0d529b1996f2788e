package com.symplify.expression;

import static com.symplify.ExpressionTestUtil.parse;
import static com.symplify.expression.Expression.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionTest {

  private final Symbol x = symbol("x");
  private final Symbol y = symbol("y");

  @Test
  void testSumFlattensAndSorts() {
    Expression nested = sum(y, sum(x, ONE));
    assertEquals(sum(ONE, x, y), nested);
    assertEquals(List.of(ONE, x, y), ((Sum) nested).terms());
  }

  @Test
  void testProductFlattensAndSorts() {
    Expression nested = product(product(y, TWO), x);
    assertEquals(List.of(TWO, x, y), ((Product) nested).factors());
  }

  @Test
  void testCollapseEmptyAndSingleChild() {
    assertEquals(ZERO, sum(List.of()));
    assertEquals(ONE, product(List.of()));
    assertSame(x, sum(x));
    assertSame(x, product(x));
  }

  @Test
  void testNegativeZeroConstant() {
    assertEquals(ZERO, constant(-0.0));
    assertEquals(ZERO.structuralHash(), constant(-0.0).structuralHash());
  }

  @Test
  void testCommutativeOperandsCompareEqual() {
    Expression a = parse("x*y + sin(x) + 3");
    Expression b = parse("3 + sin(x) + y*x");
    assertEquals(a, b);
    assertEquals(a.structuralHash(), b.structuralHash());
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  void testNonCommutativeOperandsDiffer() {
    assertNotEquals(div(x, y), div(y, x));
    assertNotEquals(pow(x, y), pow(y, x));
    assertNotEquals(div(x, y).structuralHash(), div(y, x).structuralHash());
  }

  @Test
  void testNodeCountAndDepth() {
    Expression expression = parse("sin(x)^2 + 1");
    assertEquals(6, expression.nodeCount());
    assertEquals(4, expression.depth());
    assertEquals(1, x.nodeCount());
    assertEquals(1, x.depth());
  }

  @Test
  void testNegAndSub() {
    assertEquals(constant(-3), neg(constant(3)));
    assertEquals(product(NEG_ONE, x), neg(x));
    assertEquals(sum(x, product(NEG_ONE, y)), sub(x, y));
  }

  @Test
  void testWithChildrenRecanonicalizes() {
    Expression sum = sum(x, y);
    assertEquals(sum(ONE, x, y), sum.withChildren(List.of(y, sum(x, ONE))));
    assertEquals(pow(y, TWO), pow(x, TWO).withChildren(List.of(y, TWO)));
    assertEquals(call("sin", y), call("sin", x).withChildren(List.of(y)));
  }

  @Test
  void testContains() {
    Expression expression = parse("1 + sin(x*y)");
    assertTrue(expression.contains(y::equals));
    assertFalse(expression.contains(e -> e instanceof Div));
  }

  @Test
  void testBlankNamesRejected() {
    assertThrows(IllegalArgumentException.class, () -> call(" ", x));
    assertThrows(IllegalArgumentException.class, () -> symbol(""));
  }

  @Test
  void testFunctionCallAccessors() {
    FunctionCall call = call("sin", x);
    assertTrue(call.is("sin"));
    assertFalse(call.is("cos"));
    assertFalse(call("atan2", x, y).is("atan2"));
    assertSame(x, call.arg());
  }

  @Test
  void testToString() {
    assertEquals("x - 2 * y", parse("x - 2*y").toString());
    assertEquals("1 + sin(x)^2", parse("sin(x)^2 + 1").toString());
    assertEquals("(1 + x) / y", parse("(x + 1)/y").toString());
    assertEquals("-x", parse("-x").toString());
  }
}
