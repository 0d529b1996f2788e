package com.symplify.expression;

/** The shape of an {@link Expression} node, used to dispatch rules to the nodes they can rewrite. */
public enum ExpressionKind {
  NUMBER,
  SYMBOL,
  SUM,
  PRODUCT,
  DIV,
  POW,
  FUNCTION;

  /** Returns true for the n-ary commutative kinds whose children are kept in canonical order. */
  public boolean isCommutative() {
    return this == SUM || this == PRODUCT;
  }
}
