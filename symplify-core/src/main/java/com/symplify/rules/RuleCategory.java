package com.symplify.rules;

/**
 * Mathematical family of a rule. The ordinal breaks ties between rules of equal priority, so the declaration order
 * here is part of the dispatch order.
 */
public enum RuleCategory {
  NUMERIC,
  ALGEBRAIC,
  TRIGONOMETRIC,
  HYPERBOLIC,
  EXPONENTIAL,
  ROOT
}
