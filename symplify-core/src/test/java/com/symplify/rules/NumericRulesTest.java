package com.symplify.rules;

import static com.symplify.rules.NumericRules.*;
import static com.symplify.rules.RuleAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class NumericRulesTest {

  @Test
  void testProductZero() {
    assertRewrites(PRODUCT_ZERO, "0*x*y", "0");
    assertRewrites(PRODUCT_ZERO, "0*x*y", "0", SAFE);
    assertRewrites(PRODUCT_ZERO, "0*ln(x)", "0");
    assertNoMatch(PRODUCT_ZERO, "0*ln(x)", SAFE);
    assertNoMatch(PRODUCT_ZERO, "2*x");
  }

  @Test
  void testSumFoldConstants() {
    assertRewrites(SUM_FOLD_CONSTANTS, "1 + 2 + x", "x + 3");
    assertRewrites(SUM_FOLD_CONSTANTS, "x + 0", "x");
    assertRewrites(SUM_FOLD_CONSTANTS, "1/2 + 1/3 + x", "x + 5/6");
    assertRewrites(SUM_FOLD_CONSTANTS, "1 - 1 + x", "x");
    assertNoMatch(SUM_FOLD_CONSTANTS, "x + 1");
  }

  @Test
  void testProductFoldConstants() {
    assertRewrites(PRODUCT_FOLD_CONSTANTS, "2*3*x", "6*x");
    assertRewrites(PRODUCT_FOLD_CONSTANTS, "1*x", "x");
    assertRewrites(PRODUCT_FOLD_CONSTANTS, "(1/2)*x", "x/2");
    assertRewrites(PRODUCT_FOLD_CONSTANTS, "2*3", "6");
    assertNoMatch(PRODUCT_FOLD_CONSTANTS, "2*x");
    assertNoMatch(PRODUCT_FOLD_CONSTANTS, "0*x");
  }

  @Test
  void testDivFoldConstants() {
    assertRewrites(DIV_FOLD_CONSTANTS, "6/4", "3/2");
    assertRewrites(DIV_FOLD_CONSTANTS, "4/2", "2");
    assertRewrites(DIV_FOLD_CONSTANTS, "3/-6", "-1/2");
    assertRewrites(DIV_FOLD_CONSTANTS, "1.5/0.5", "3");
    assertNoMatch(DIV_FOLD_CONSTANTS, "1/2");
    assertNoMatch(DIV_FOLD_CONSTANTS, "1/0");
    assertNoMatch(DIV_FOLD_CONSTANTS, "x/2");
  }

  @Test
  void testPowFoldConstants() {
    assertRewrites(POW_FOLD_CONSTANTS, "2^10", "1024");
    assertRewrites(POW_FOLD_CONSTANTS, "2^-2", "1/4");
    assertRewrites(POW_FOLD_CONSTANTS, "4^(1/2)", "2");
    assertRewrites(POW_FOLD_CONSTANTS, "4^(-1/2)", "1/2");
    assertRewrites(POW_FOLD_CONSTANTS, "8^(-2/3)", "1/4");
    assertNoMatch(POW_FOLD_CONSTANTS, "2^(-1/2)");
    assertNoMatch(POW_FOLD_CONSTANTS, "2^(1/2)");
    assertNoMatch(POW_FOLD_CONSTANTS, "0^-1");
    assertNoMatch(POW_FOLD_CONSTANTS, "x^2");
  }

  @Test
  void testIdentities() {
    assertRewrites(DIV_ONE, "x/1", "x");
    assertRewrites(ZERO_DIV, "0/x", "0");
    assertNoMatch(ZERO_DIV, "0/0");
    assertRewrites(POWER_ONE, "x^1", "x");
    assertRewrites(POWER_ZERO, "x^0", "1");
    assertRewrites(ONE_POWER, "1^x", "1");
    assertRewrites(ONE_POWER, "1^x", "1", SAFE);
    assertNoMatch(ONE_POWER, "1^ln(x)", SAFE);
    assertRewrites(ZERO_POWER, "0^2", "0");
    assertNoMatch(ZERO_POWER, "0^x");
  }

  @Test
  void testDomainFlags() {
    assertTrue(ZERO_DIV.altersDomain());
    assertTrue(POWER_ZERO.altersDomain());
    assertFalse(PRODUCT_ZERO.altersDomain());
    assertFalse(ONE_POWER.altersDomain());
  }
}
