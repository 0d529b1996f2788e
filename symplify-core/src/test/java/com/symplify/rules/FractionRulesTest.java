package com.symplify.rules;

import static com.symplify.rules.FractionRules.*;
import static com.symplify.rules.RuleAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FractionRulesTest {

  @Test
  void testNestedQuotients() {
    assertRewrites(DIV_DIV_NUMERATOR, "(x/y)/z", "x/(y*z)");
    assertRewrites(DIV_DIV_DENOMINATOR, "x/(y/z)", "(x*z)/y");
    assertFalse(DIV_DIV_NUMERATOR.altersDomain());
    assertTrue(DIV_DIV_DENOMINATOR.altersDomain());
  }

  @Test
  void testExpandPowerForCancellation() {
    assertTrue(EXPAND_POWER_FOR_CANCELLATION.speculative());
    assertRewrites(EXPAND_POWER_FOR_CANCELLATION, "(x*y)^2/x", "x^2*y^2/x");
    assertNoMatch(EXPAND_POWER_FOR_CANCELLATION, "x^2/x");
  }

  @Test
  void testDivSelf() {
    assertRewrites(DIV_SELF, "x/x", "1");
    assertRewrites(DIV_SELF, "(x + 1)/(1 + x)", "1");
    assertNoMatch(DIV_SELF, "2/2");
    assertNoMatch(DIV_SELF, "x/y");
  }

  @Test
  void testFractionNumericGcd() {
    assertRewrites(FRACTION_NUMERIC_GCD, "(6*x)/(4*y)", "(3*x)/(2*y)");
    assertRewrites(FRACTION_NUMERIC_GCD, "(2*x)/4", "x/2");
    assertNoMatch(FRACTION_NUMERIC_GCD, "x/2");
    assertNoMatch(FRACTION_NUMERIC_GCD, "6/4");
  }

  @Test
  void testFractionCancellation() {
    assertRewrites(FRACTION_CANCELLATION, "(x^3*y)/(x*z)", "(x^2*y)/z");
    assertRewrites(FRACTION_CANCELLATION, "x/(2*x)", "1/2");
    assertRewrites(FRACTION_CANCELLATION, "x^2/x", "x");
    assertNoMatch(FRACTION_CANCELLATION, "x/y");
    assertNoMatch(FRACTION_CANCELLATION, "x/2");
  }

  @Test
  void testCanonicalDenominatorSign() {
    assertRewrites(CANONICAL_DENOMINATOR_SIGN, "x/(-y - 1)", "-x/(y + 1)");
    assertNoMatch(CANONICAL_DENOMINATOR_SIGN, "x/(y - 1)");
  }
}
