package com.symplify.stats;

import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * A {@code long} value that only goes up, safe to increment from simplifications running on several threads.
 */
public interface Counter extends LongSupplier {

  default void inc() {
    incBy(1);
  }

  void incBy(long value);

  long get();

  @Override
  default long getAsLong() {
    return get();
  }

  /** Returns a counter backed by a {@link LongAdder}, which stays cheap under contention and sums on read. */
  static Counter newConcurrentCounter() {
    return new Concurrent();
  }

  /** Counter that adds up per-cell increments on read. */
  final class Concurrent implements Counter {

    private final LongAdder adder = new LongAdder();

    private Concurrent() {}

    @Override
    public void incBy(long value) {
      adder.add(value);
    }

    @Override
    public long get() {
      return adder.sum();
    }

    @Override
    public String toString() {
      return Long.toString(get());
    }
  }
}
