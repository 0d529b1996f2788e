package com.symplify.expression;

import static com.symplify.ExpressionTestUtil.parse;
import static org.junit.jupiter.api.Assertions.*;

import com.symplify.symbol.SymbolScope;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ExpressionJsonTest {

  private static final String SIN_SQUARED_PLUS_ONE =
    "{\"op\":\"sum\",\"args\":[1,{\"op\":\"pow\",\"args\":[{\"op\":\"call\",\"name\":\"sin\",\"args\":[\"x\"]},2]}]}";

  @Test
  void testWrite() {
    assertEquals(SIN_SQUARED_PLUS_ONE, ExpressionJson.write(parse("sin(x)^2 + 1")));
    assertEquals("1.5", ExpressionJson.write(Expression.constant(1.5)));
    assertEquals("{\"op\":\"div\",\"args\":[\"x\",2]}", ExpressionJson.write(parse("x/2")));
  }

  @Test
  void testRead() {
    assertEquals(parse("1 + sin(x)^2"), ExpressionJson.read(SIN_SQUARED_PLUS_ONE, SymbolScope.global()));
    assertEquals(parse("x*y*2"),
      ExpressionJson.read("{\"op\":\"PRODUCT\",\"args\":[\"y\",2,\"x\"]}", SymbolScope.global()));
  }

  @Test
  void testReadInternsIntoScope() {
    SymbolScope scope = SymbolScope.create("json");
    Expression expression = ExpressionJson.read("{\"op\":\"sum\",\"args\":[\"a\",\"b\"]}", scope);
    assertEquals(2, scope.size());
    assertTrue(expression.contains(scope.lookup("a").orElseThrow()::equals));
  }

  @Test
  void testReadFromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("expr.json");
    Files.writeString(file, SIN_SQUARED_PLUS_ONE);
    assertEquals(parse("sin(x)^2 + 1"), ExpressionJson.read(file, SymbolScope.global()));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "not json",
    "null",
    "[1, 2]",
    "{\"op\":\"sum\",\"args\":[]}",
    "{\"op\":\"div\",\"args\":[1]}",
    "{\"op\":\"pow\",\"args\":[1, 2, 3]}",
    "{\"op\":\"call\",\"args\":[\"x\"]}",
    "{\"op\":\"call\",\"name\":\"sin\",\"args\":[\"x\", \"y\"]}",
    "{\"op\":\"modulo\",\"args\":[\"x\", \"y\"]}",
    "{\"op\":\"sum\"}",
    "\" \"",
  })
  void testRejectsMalformed(String json) {
    assertThrows(IllegalArgumentException.class, () -> ExpressionJson.read(json, SymbolScope.global()));
  }

  @Test
  void testCustomFunctionsHaveAnyArity() {
    Expression call = ExpressionJson.read("{\"op\":\"call\",\"name\":\"f\",\"args\":[\"x\",\"y\"]}",
      SymbolScope.global());
    assertEquals(Expression.call("f", Expression.symbol("x"), Expression.symbol("y")), call);
  }
}
