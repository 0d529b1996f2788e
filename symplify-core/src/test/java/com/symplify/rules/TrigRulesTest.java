package com.symplify.rules;

import static com.symplify.ExpressionTestUtil.assertSameValue;
import static com.symplify.ExpressionTestUtil.parse;
import static com.symplify.rules.RuleAssertions.*;
import static com.symplify.rules.TrigRules.*;
import static org.junit.jupiter.api.Assertions.*;

import com.symplify.expression.Expression;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TrigRulesTest {

  @ParameterizedTest
  @CsvSource({
    "sin(0), 0",
    "sin(pi/6), 1/2",
    "sin(pi/2), 1",
    "cos(pi), -1",
    "cos(pi/3), 1/2",
    "cos(3*pi/4), -sqrt(2)/2",
    "sin(-pi/2), -1",
    "sin(7*pi/6), -1/2",
    "tan(pi/4), 1",
    "tan(pi/3), sqrt(3)",
    "tan(3*pi/4), -1",
  })
  void testExactValues(String input, String expected) {
    assertRewrites(TRIG_EXACT_VALUES, input, expected);
  }

  @Test
  void testExactValuesUndefinedOrUnknown() {
    assertNoMatch(TRIG_EXACT_VALUES, "tan(pi/2)");
    assertNoMatch(TRIG_EXACT_VALUES, "sin(pi/5)");
    assertNoMatch(TRIG_EXACT_VALUES, "sin(x)");
    assertNoMatch(TRIG_EXACT_VALUES, "sin(pi/6)", fixing("pi"));
  }

  @ParameterizedTest
  @CsvSource({
    "asin(1/2), pi/6",
    "asin(-1), -pi/2",
    "acos(-1), pi",
    "acos(1/2), pi/3",
    "acos(1), 0",
    "atan(1), pi/4",
    "atan(0), 0",
  })
  void testInverseValues(String input, String expected) {
    assertRewrites(INVERSE_TRIG_VALUES, input, expected);
  }

  @Test
  void testInverseValuesNeedPi() {
    assertNoMatch(INVERSE_TRIG_VALUES, "asin(1)", fixing("pi"));
    assertNoMatch(INVERSE_TRIG_VALUES, "asin(2)");
  }

  @Test
  void testNegation() {
    assertRewrites(TRIG_NEGATION, "sin(-x)", "-sin(x)");
    assertRewrites(TRIG_NEGATION, "cos(-x)", "cos(x)");
    assertRewrites(TRIG_NEGATION, "tan(-2*x)", "-tan(2*x)");
    assertNoMatch(TRIG_NEGATION, "sin(x)");
  }

  @Test
  void testInverseIdentities() {
    assertRewrites(INVERSE_TRIG_IDENTITY, "sin(asin(x))", "x");
    assertRewrites(INVERSE_TRIG_IDENTITY, "cos(acos(x))", "x");
    assertTrue(INVERSE_TRIG_IDENTITY.altersDomain());
    assertRewrites(TAN_ATAN, "tan(atan(x))", "x");
    assertFalse(TAN_ATAN.altersDomain());
    assertRewrites(INVERSE_TRIG_COMPOSITION, "asin(sin(x))", "x");
    assertTrue(INVERSE_TRIG_COMPOSITION.altersDomain());
  }

  @Test
  void testPeriodicity() {
    assertRewrites(TRIG_PERIODICITY, "sin(x + 2*pi)", "sin(x)");
    assertRewrites(TRIG_PERIODICITY, "tan(x + pi)", "tan(x)");
    assertNoMatch(TRIG_PERIODICITY, "sin(x + pi)");
    assertNoMatch(TRIG_PERIODICITY, "sin(x + 2*pi)", fixing("pi"));
  }

  @Test
  void testShift() {
    assertRewrites(TRIG_SHIFT, "sin(x + pi/2)", "cos(x)");
    assertRewrites(TRIG_SHIFT, "cos(x + pi)", "-cos(x)");
    assertRewrites(TRIG_SHIFT, "tan(x + pi/2)", "-cot(x)");
    assertNoMatch(TRIG_SHIFT, "sin(x + pi/3)");
  }

  @Test
  void testQuotientAndReciprocal() {
    assertRewrites(TRIG_QUOTIENT, "sin(x)/cos(x)", "tan(x)");
    assertRewrites(TRIG_QUOTIENT, "2*sin(x)/cos(x)", "2*tan(x)");
    assertRewrites(TRIG_QUOTIENT, "cos(x)/sin(x)", "cot(x)");
    assertNoMatch(TRIG_QUOTIENT, "sin(x)/cos(y)");
    assertRewrites(TRIG_RECIPROCAL, "1/cos(x)", "sec(x)");
    assertRewrites(TRIG_RECIPROCAL, "3/sin(x)", "3*csc(x)");
    assertRewrites(TRIG_RECIPROCAL_INVERSE, "1/tan(x)", "cot(x)");
    assertRewrites(TRIG_RECIPROCAL_INVERSE, "1/sec(x)", "cos(x)");
    assertTrue(TRIG_RECIPROCAL_INVERSE.altersDomain());
  }

  @Test
  void testPythagorean() {
    assertRewrites(PYTHAGOREAN_IDENTITY, "sin(x)^2 + cos(x)^2", "1");
    assertRewrites(PYTHAGOREAN_IDENTITY, "3*sin(x)^2 + 3*cos(x)^2 + y", "y + 3");
    assertNoMatch(PYTHAGOREAN_IDENTITY, "sin(x)^2 + cos(y)^2");
    assertNoMatch(PYTHAGOREAN_IDENTITY, "2*sin(x)^2 + cos(x)^2");
    assertRewrites(PYTHAGOREAN_COMPLEMENT, "1 - sin(x)^2", "cos(x)^2");
    assertRewrites(PYTHAGOREAN_COMPLEMENT, "1 - cos(x)^2", "sin(x)^2");
    assertRewrites(PYTHAGOREAN_TANGENT, "1 + tan(x)^2", "sec(x)^2");
    assertRewrites(PYTHAGOREAN_TANGENT, "1 + cot(x)^2", "csc(x)^2");
  }

  @Test
  void testDoubleAngle() {
    assertRewrites(COS_DOUBLE_ANGLE, "cos(x)^2 - sin(x)^2", "cos(2*x)");
    assertRewrites(SIN_DOUBLE_ANGLE, "2*sin(x)*cos(x)", "sin(2*x)");
    assertRewrites(SIN_DOUBLE_ANGLE, "4*sin(x)*cos(x)", "2*sin(2*x)");
    assertNoMatch(SIN_DOUBLE_ANGLE, "sin(x)*cos(x)");
    assertNoMatch(SIN_DOUBLE_ANGLE, "2*sin(x)*cos(y)");
  }

  @Test
  void testAngleAddition() {
    assertRewrites(ANGLE_ADDITION, "sin(x)*cos(y) + cos(x)*sin(y)", "sin(x + y)");
    assertRewrites(ANGLE_ADDITION, "cos(x)*cos(y) - sin(x)*sin(y)", "cos(x + y)");
    assertNoMatch(ANGLE_ADDITION, "sin(x)*cos(y) + cos(x)*sin(z)");
  }

  @Test
  void testAngleDifferenceKeepsValue() {
    Map<String, Double> values = Map.of("x", 0.7, "y", -1.3);
    for (String input : new String[]{"sin(x)*cos(y) - cos(x)*sin(y)", "cos(x)*cos(y) + sin(x)*sin(y)"}) {
      Expression before = parse(input);
      Expression after = apply(ANGLE_ADDITION, input, AGGRESSIVE);
      assertNotNull(after, input);
      assertSameValue(before, after, values);
    }
  }
}
