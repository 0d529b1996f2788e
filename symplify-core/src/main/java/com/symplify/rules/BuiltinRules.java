package com.symplify.rules;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The rule sets that ship with the simplifier, in registration order. */
public final class BuiltinRules {

  private BuiltinRules() {}

  /** Returns every built-in rule. */
  public static List<Rule> all() {
    return ImmutableList.<Rule>builder()
      .addAll(NumericRules.all())
      .addAll(SumRules.all())
      .addAll(PowerRules.all())
      .addAll(FractionRules.all())
      .addAll(AbsSignRules.all())
      .addAll(ExponentialRules.all())
      .addAll(RootRules.all())
      .addAll(TrigRules.all())
      .addAll(HyperbolicRules.all())
      .build();
  }
}
