package com.symplify.engine;

import static com.symplify.ExpressionTestUtil.assertSameValue;
import static com.symplify.ExpressionTestUtil.parse;
import static com.symplify.expression.Expression.ONE;
import static com.symplify.expression.Expression.call;
import static com.symplify.expression.Expression.sum;
import static com.symplify.rules.Rule.rule;
import static org.junit.jupiter.api.Assertions.*;

import com.symplify.config.SimplifyConfig;
import com.symplify.expression.Expression;
import com.symplify.rules.Rule;
import com.symplify.rules.RuleCategory;
import com.symplify.rules.RuleRegistry;
import com.symplify.stats.SimplifyStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SimplifierTest {

  private static final SimplifyConfig AGGRESSIVE = SimplifyConfig.defaults();
  private static final SimplifyConfig SAFE = SimplifyConfig.defaults().withDomainSafe(true);

  private static Expression simplify(String input, SimplifyConfig config) throws SimplifyException {
    return Simplifier.simplify(parse(input), config);
  }

  /** Rule that wraps its argument in one more {@code + 1} every time it runs, so passes never converge. */
  private static RuleRegistry growing() {
    Rule grow = rule("grow", 50, RuleCategory.NUMERIC).call("grow")
      .apply((f, ctx) -> call("grow", sum(f.arg(), ONE)));
    return RuleRegistry.of(List.of(grow));
  }

  @ParameterizedTest
  @CsvSource({
    "sin(x)^2 + cos(x)^2, 1",
    "x^2 + 2*x + 1, (x + 1)^2",
    "3*(2*x), 6*x",
    "2*x + 3*x, 5*x",
    "2*x*y + 3*y*x, 5*x*y",
    "(x + 1)^2 - x^2 - 2*x, 1",
    "x/x, 1",
    "sqrt(x^2), x",
    "sign(abs(x)), 1",
  })
  void testAggressive(String input, String expected) throws SimplifyException {
    assertEquals(parse(expected), simplify(input, AGGRESSIVE));
  }

  @ParameterizedTest
  @CsvSource({
    "sin(x)^2 + cos(x)^2, 1",
    "x^2 + 2*x + 1, (x + 1)^2",
    "x/x, x/x",
    "sqrt(x^2), abs(x)",
    "sqrt(12*x^2), 2*sqrt(3)*abs(x)",
    "sign(abs(x)), sign(abs(x))",
  })
  void testDomainSafe(String input, String expected) throws SimplifyException {
    assertEquals(parse(expected), simplify(input, SAFE));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "sin(x)^2 + cos(x)^2",
    "x^2 + 2*x + 1",
    "3*(2*x)",
    "2*x*y + 3*y*x",
    "(x + 1)^2 - x^2 - 2*x",
    "(x + 1)^2 + y",
    "sqrt(x^2)",
  })
  void testResultIsFixedPoint(String input) throws SimplifyException {
    for (SimplifyConfig config : List.of(AGGRESSIVE, SAFE)) {
      Expression once = simplify(input, config);
      assertEquals(once, Simplifier.simplify(once, config), input);
    }
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "x^2 + 2*x + 1",
    "sin(x)^2 + cos(x)^2 + y",
    "(x + 1)^2 - x^2 - 2*x",
    "x/x + y",
    "sqrt(x^2)",
    "exp(ln(x))",
    "ln(x) + ln(y) - ln(x*y)",
    "(x^3*y)/(x*y)",
    "sin(x)*cos(y) + cos(x)*sin(y)",
    "(exp(x) - exp(-x))/2",
    "1/x + 1/y",
    "sqrt(12*x)",
    "sqrt(12*x^2)",
    "4^(-1/2)*x",
    "cos(x + pi/2)",
    "x*(y/x)",
    "(2*x)^3/(4*x)",
    "abs(-3*x) + 2*abs(x)",
    "2*sin(x)*cos(x) - sin(2*x)",
  })
  void testKeepsValue(String input) throws SimplifyException {
    Map<String, Double> values = Map.of("x", 0.7, "y", 1.3);
    Expression before = parse(input);
    for (SimplifyConfig config : List.of(AGGRESSIVE, SAFE)) {
      assertSameValue(before, Simplifier.simplify(before, config), values);
    }
  }

  @Test
  void testCommutedInputsGiveSameResult() throws SimplifyException {
    assertEquals(simplify("y*x + 2*x*y + 1", AGGRESSIVE), simplify("1 + 3*y*x", AGGRESSIVE));
    assertEquals(simplify("cos(x)^2 + sin(x)^2", AGGRESSIVE), simplify("sin(x)^2 + cos(x)^2", AGGRESSIVE));
  }

  @Test
  void testSpeculativeRewriteKeptWhenSmaller() throws SimplifyException {
    SimplifyStats stats = SimplifyStats.inMemory();
    Simplifier simplifier = new Simplifier(RuleRegistry.builtin(), AGGRESSIVE, stats);
    assertEquals(ONE, simplifier.simplify(parse("(x + 1)^2 - x^2 - 2*x")));
    assertTrue(stats.speculativeKept() >= 1);
    assertTrue(stats.ruleCounts().containsKey("expand_for_cancellation"));
  }

  @Test
  void testSpeculativeRewriteRejectedWhenNotSmaller() throws SimplifyException {
    SimplifyStats stats = SimplifyStats.inMemory();
    Simplifier simplifier = new Simplifier(RuleRegistry.builtin(), AGGRESSIVE, stats);
    Expression input = parse("(x + 1)^2 + y");
    assertEquals(input, simplifier.simplify(input));
    assertTrue(stats.speculativeRejected() >= 1);
    assertFalse(stats.ruleCounts().containsKey("expand_for_cancellation"));
  }

  @Test
  void testStatsCountRulesAndPasses() throws SimplifyException {
    SimplifyStats stats = SimplifyStats.inMemory();
    new Simplifier(RuleRegistry.builtin(), AGGRESSIVE, stats).simplify(parse("sin(x)^2 + cos(x)^2"));
    assertEquals(1L, stats.ruleCounts().get("pythagorean_identity"));
    assertTrue(stats.passes() >= 1);
    assertEquals(0, stats.nonConvergences());
  }

  @Test
  void testUnchangedInputReturnsEqualTree() throws SimplifyException {
    Expression input = parse("x + y");
    assertEquals(input, Simplifier.simplify(input, AGGRESSIVE));
    assertEquals(parse("x"), simplify("x", AGGRESSIVE));
    assertEquals(parse("2"), simplify("2", AGGRESSIVE));
  }

  @Test
  void testCustomFunctionsAreLeftAlone() throws SimplifyException {
    SimplifyConfig config = AGGRESSIVE.withCustomFunctions("sin");
    assertEquals(parse("sin(0)"), simplify("sin(0)", config));
    assertEquals(parse("2*f(x)"), simplify("f(x) + f(x)", AGGRESSIVE));
    assertEquals(parse("sin(0) + 1"), simplify("sin(0) + cos(0)", config));
  }

  @Test
  void testFixedSymbolsAreOpaque() throws SimplifyException {
    assertEquals(ONE, simplify("ln(e)", AGGRESSIVE));
    assertEquals(parse("ln(e)"), simplify("ln(e)", AGGRESSIVE.withFixedSymbols("e")));
    assertEquals(parse("1/2"), simplify("sin(pi/6)", AGGRESSIVE));
    assertEquals(parse("sin(pi/6)"), simplify("sin(pi/6)", AGGRESSIVE.withFixedSymbols("pi")));
  }

  @Test
  void testTraceDoesNotChangeResult() throws SimplifyException {
    assertEquals(simplify("x^2 + 2*x + 1", AGGRESSIVE), simplify("x^2 + 2*x + 1", AGGRESSIVE.withTrace(true)));
  }

  @Test
  void testDepthLimit() {
    SimplifyException.DepthExceeded e = assertThrows(SimplifyException.DepthExceeded.class,
      () -> simplify("sin(sin(sin(sin(x))))", AGGRESSIVE.withMaxDepth(3)));
    assertEquals("depth_exceeded", e.stat());
    assertEquals(3, e.limit());
    assertTrue(e.depth() > 3);
  }

  @Test
  void testNodeLimit() {
    SimplifyException.NodeCountExceeded e = assertThrows(SimplifyException.NodeCountExceeded.class,
      () -> simplify("x + y + z", AGGRESSIVE.withMaxNodes(3)));
    assertEquals("node_count_exceeded", e.stat());
    assertEquals(4, e.count());
    assertEquals(3, e.limit());
  }

  @Test
  void testStrictPassLimitThrows() {
    SimplifyConfig config = AGGRESSIVE.withMaxPasses(3).withStrictPassLimit(true);
    Simplifier simplifier = new Simplifier(growing(), config, SimplifyStats.noop());
    SimplifyException.PassLimitReached e = assertThrows(SimplifyException.PassLimitReached.class,
      () -> simplifier.simplify(parse("grow(x)")));
    assertEquals("pass_limit_reached", e.stat());
    assertEquals(3, e.passes());
    assertNotNull(e.bestEffort());
  }

  @Test
  void testPassLimitReturnsBestEffort() throws SimplifyException {
    SimplifyStats stats = SimplifyStats.inMemory();
    Simplifier simplifier = new Simplifier(growing(), AGGRESSIVE.withMaxPasses(3), stats);
    Expression result = simplifier.simplify(parse("grow(x)"));
    assertTrue(result instanceof Expression.FunctionCall f && f.name().equals("grow"));
    assertTrue(result.nodeCount() > parse("grow(x)").nodeCount());
    assertEquals(1, stats.nonConvergences());
    assertEquals(3, stats.passes());
  }

  @Test
  void testLocalCycleStops() throws SimplifyException {
    Rule flip = rule("flip", 50, RuleCategory.NUMERIC).call("f", "g")
      .apply((f, ctx) -> call(f.is("f") ? "g" : "f", f.arg()));
    Simplifier simplifier = new Simplifier(RuleRegistry.of(List.of(flip)), AGGRESSIVE, SimplifyStats.noop());
    Expression result = simplifier.simplify(parse("f(x)"));
    assertTrue(result.equals(parse("f(x)")) || result.equals(parse("g(x)")), result::toString);
  }

  @Test
  void testConcurrentRequestsShareOneSimplifier() throws Exception {
    Simplifier simplifier = new Simplifier(AGGRESSIVE);
    List<String> inputs = List.of("sin(x)^2 + cos(x)^2", "x^2 + 2*x + 1", "2*x*y + 3*y*x", "(x + 1)^2 - x^2 - 2*x");
    List<Expression> expected = new ArrayList<>();
    for (String input : inputs) {
      expected.add(simplifier.simplify(parse(input)));
    }
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<Expression>> futures = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        String input = inputs.get(i % inputs.size());
        futures.add(executor.submit(() -> simplifier.simplify(parse(input))));
      }
      for (int i = 0; i < futures.size(); i++) {
        assertEquals(expected.get(i % inputs.size()), futures.get(i).get(30, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
