package com.symplify.stats;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects counts of what the simplifier did: how often each rule fired, how many passes ran, and how many
 * speculative rewrites were kept or thrown away.
 * <p>
 * {@link #inMemory()} keeps the counts to report through {@link #printSummary()} and {@link #noop()} discards them.
 */
public interface SimplifyStats {

  /** Returns a new stat collector that stores counts in memory, safe to share between threads. */
  static SimplifyStats inMemory() {
    return new InMemory();
  }

  /** Returns a stat collector that ignores everything. */
  static SimplifyStats noop() {
    return NoopStats.INSTANCE;
  }

  /** Records that rule {@code ruleName} rewrote a node. */
  void ruleApplied(String ruleName);

  /** Records that speculative rule {@code ruleName} was tried and whether the rewrite was kept. */
  void speculativeRewrite(String ruleName, boolean kept);

  /** Records that one bottom-up pass over a whole tree finished. */
  void passCompleted();

  /** Records that a simplification stopped without reaching a fixed point. */
  void nonConvergence();

  /** Returns how many times each rule fired, by rule name. */
  Map<String, Long> ruleCounts();

  long passes();

  long speculativeKept();

  long speculativeRejected();

  long nonConvergences();

  /** Logs the totals and the rules that fired, most frequent first. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(SimplifyStats.class);
    logger.info("-".repeat(40));
    logger.info("passes: {} non-converging: {} speculative kept: {} rejected: {}", passes(), nonConvergences(),
      speculativeKept(), speculativeRejected());
    ruleCounts().entrySet().stream()
      .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
      .forEach(entry -> logger.info("\t{}\t{}", entry.getKey(), entry.getValue()));
    logger.info("-".repeat(40));
  }

  /** Stat collector that keeps counters in memory. */
  class InMemory implements SimplifyStats {

    private final ConcurrentMap<String, Counter> rules = new ConcurrentHashMap<>();
    private final Counter passes = Counter.newConcurrentCounter();
    private final Counter kept = Counter.newConcurrentCounter();
    private final Counter rejected = Counter.newConcurrentCounter();
    private final Counter nonConvergences = Counter.newConcurrentCounter();

    InMemory() {}

    @Override
    public void ruleApplied(String ruleName) {
      rules.computeIfAbsent(ruleName, name -> Counter.newConcurrentCounter()).inc();
    }

    @Override
    public void speculativeRewrite(String ruleName, boolean wasKept) {
      (wasKept ? kept : rejected).inc();
    }

    @Override
    public void passCompleted() {
      passes.inc();
    }

    @Override
    public void nonConvergence() {
      nonConvergences.inc();
    }

    @Override
    public Map<String, Long> ruleCounts() {
      Map<String, Long> result = new TreeMap<>();
      rules.forEach((name, counter) -> result.put(name, counter.get()));
      return result;
    }

    @Override
    public long passes() {
      return passes.get();
    }

    @Override
    public long speculativeKept() {
      return kept.get();
    }

    @Override
    public long speculativeRejected() {
      return rejected.get();
    }

    @Override
    public long nonConvergences() {
      return nonConvergences.get();
    }
  }

  /** Stat collector that drops everything. */
  final class NoopStats implements SimplifyStats {

    private static final NoopStats INSTANCE = new NoopStats();

    private NoopStats() {}

    @Override
    public void ruleApplied(String ruleName) {}

    @Override
    public void speculativeRewrite(String ruleName, boolean kept) {}

    @Override
    public void passCompleted() {}

    @Override
    public void nonConvergence() {}

    @Override
    public Map<String, Long> ruleCounts() {
      return Map.of();
    }

    @Override
    public long passes() {
      return 0;
    }

    @Override
    public long speculativeKept() {
      return 0;
    }

    @Override
    public long speculativeRejected() {
      return 0;
    }

    @Override
    public long nonConvergences() {
      return 0;
    }
  }
}
