package com.symplify.expression;

import com.symplify.util.Hashing;
import java.util.List;

/** Structural hash and size bookkeeping shared by the expression node types. */
final class NodeHashes {

  static final long NUMBER = 1;
  static final long SYMBOL = 2;
  static final long SUM = 3;
  static final long PRODUCT = 4;
  static final long DIV = 5;
  static final long POW = 6;
  static final long FUNCTION = 7;

  private NodeHashes() {}

  static long tag(long tag) {
    return Hashing.fnv1a64(Hashing.FNV1_64_INIT, tag);
  }

  /** Order-independent combination: wrapping sum of the child hashes mixed into the tag. */
  static long commutative(long tag, List<Expression> children) {
    long combined = 0;
    for (Expression child : children) {
      combined += child.structuralHash();
    }
    return Hashing.fnv1a64(tag(tag), combined);
  }

  static long ordered(long init, List<Expression> children) {
    long hash = init;
    for (Expression child : children) {
      hash = Hashing.fnv1a64(hash, child.structuralHash());
    }
    return hash;
  }

  static int nodeCount(List<Expression> children) {
    int count = 1;
    for (Expression child : children) {
      count += child.nodeCount();
    }
    return count;
  }

  static int depth(List<Expression> children) {
    int max = 0;
    for (Expression child : children) {
      max = Math.max(max, child.depth());
    }
    return max + 1;
  }
}
