package com.symplify.rules;

import static com.symplify.ExpressionTestUtil.parse;
import static com.symplify.rules.AbsSignRules.*;
import static com.symplify.rules.RuleAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AbsSignRulesTest {

  @Test
  void testNumericValues() {
    assertRewrites(ABS_NUMERIC, "abs(-3)", "3");
    assertRewrites(ABS_NUMERIC, "abs(-1/2)", "1/2");
    assertRewrites(SIGN_NUMERIC, "sign(-2)", "-1");
    assertRewrites(SIGN_NUMERIC, "sign(0)", "0");
    assertNoMatch(ABS_NUMERIC, "abs(x)");
  }

  @Test
  void testNestedCalls() {
    assertRewrites(ABS_ABS, "abs(abs(x))", "abs(x)");
    assertRewrites(SIGN_SIGN, "sign(sign(x))", "sign(x)");
    assertRewrites(SIGN_ABS, "sign(abs(x))", "1");
    assertTrue(SIGN_ABS.altersDomain());
  }

  @Test
  void testSignAbsOnlyRunsAggressively() {
    RuleRegistry registry = RuleRegistry.builtin();
    assertTrue(registry.candidatesFor(parse("sign(abs(x))"), AGGRESSIVE).contains(SIGN_ABS));
    assertFalse(registry.candidatesFor(parse("sign(abs(x))"), SAFE).contains(SIGN_ABS));
  }

  @Test
  void testAbsConstantFactor() {
    assertRewrites(ABS_CONSTANT_FACTOR, "abs(-3*x)", "3*abs(x)");
    assertRewrites(ABS_CONSTANT_FACTOR, "abs(x/2)", "abs(x)/2");
    assertNoMatch(ABS_CONSTANT_FACTOR, "abs(x*y)");
  }

  @Test
  void testAbsOfNonNegative() {
    assertRewrites(ABS_EVEN_POWER, "abs(x^2)", "x^2");
    assertNoMatch(ABS_EVEN_POWER, "abs(x^3)");
    assertRewrites(ABS_NONNEGATIVE, "abs(exp(x))", "exp(x)");
    assertRewrites(ABS_NONNEGATIVE, "abs(sqrt(x))", "sqrt(x)");
    assertNoMatch(ABS_NONNEGATIVE, "abs(x)");
  }

  @Test
  void testAbsSignProduct() {
    assertRewrites(ABS_SIGN_PRODUCT, "abs(x)*sign(x)*y", "x*y");
    assertRewrites(ABS_SIGN_PRODUCT, "abs(x)*sign(x)", "x");
    assertNoMatch(ABS_SIGN_PRODUCT, "abs(x)*sign(y)");
  }
}
