package com.symplify.stats;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SimplifyStatsTest {

  @Test
  void testInMemory() {
    SimplifyStats stats = SimplifyStats.inMemory();
    stats.ruleApplied("div_self");
    stats.ruleApplied("div_self");
    stats.ruleApplied("sum_fold_constants");
    stats.speculativeRewrite("expand_for_cancellation", true);
    stats.speculativeRewrite("expand_for_cancellation", false);
    stats.speculativeRewrite("add_fractions", false);
    stats.passCompleted();
    stats.nonConvergence();

    assertEquals(Map.of("div_self", 2L, "sum_fold_constants", 1L), stats.ruleCounts());
    assertEquals(1, stats.speculativeKept());
    assertEquals(2, stats.speculativeRejected());
    assertEquals(1, stats.passes());
    assertEquals(1, stats.nonConvergences());
    stats.printSummary();
  }

  @Test
  void testNoop() {
    SimplifyStats stats = SimplifyStats.noop();
    stats.ruleApplied("div_self");
    stats.passCompleted();
    stats.nonConvergence();
    stats.speculativeRewrite("add_fractions", true);
    assertEquals(Map.of(), stats.ruleCounts());
    assertEquals(0, stats.passes());
    assertEquals(0, stats.nonConvergences());
    assertEquals(0, stats.speculativeKept());
    assertSame(SimplifyStats.noop(), stats);
  }

  @Test
  void testConcurrentUpdates() throws InterruptedException {
    SimplifyStats stats = SimplifyStats.inMemory();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    for (int i = 0; i < 4; i++) {
      executor.execute(() -> {
        for (int j = 0; j < 1000; j++) {
          stats.ruleApplied("rule");
          stats.passCompleted();
        }
      });
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    assertEquals(4000L, stats.ruleCounts().get("rule"));
    assertEquals(4000, stats.passes());
  }

  @Test
  void testCounter() {
    Counter counter = Counter.newConcurrentCounter();
    counter.inc();
    counter.incBy(4);
    assertEquals(5, counter.get());
    assertEquals(5, counter.getAsLong());
  }
}
