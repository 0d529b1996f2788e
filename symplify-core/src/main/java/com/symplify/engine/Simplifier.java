package com.symplify.engine;

import com.symplify.config.SimplifyConfig;
import com.symplify.expression.Expression;
import com.symplify.rules.Rule;
import com.symplify.rules.RuleContext;
import com.symplify.rules.RuleRegistry;
import com.symplify.stats.SimplifyStats;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites an expression tree bottom-up with the rules in a {@link RuleRegistry} until no rule changes it.
 * <p>
 * Each pass visits every node children-first and keeps rewriting a node with the first candidate rule that changes it
 * until none does. Passes repeat until one leaves the tree unchanged, so the result is a fixed point: simplifying it
 * again returns an equal tree. Work is bounded by {@link SimplifyConfig#maxDepth()},
 * {@link SimplifyConfig#maxNodes()} and {@link SimplifyConfig#maxPasses()}.
 * <p>
 * Instances hold no per-request state, so one instance can serve concurrent requests.
 */
@ThreadSafe
public class Simplifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(Simplifier.class);
  /** Most rewrites applied to one node in a single visit before giving up on it. */
  static final int MAX_LOCAL_REWRITES = 64;
  /** Most speculative rewrites that can be nested inside each other. */
  static final int MAX_PROBE_DEPTH = 3;

  private final RuleRegistry registry;
  private final SimplifyConfig config;
  private final SimplifyStats stats;

  public Simplifier(RuleRegistry registry, SimplifyConfig config, SimplifyStats stats) {
    this.registry = registry;
    this.config = config;
    this.stats = stats;
  }

  public Simplifier(SimplifyConfig config) {
    this(RuleRegistry.builtin(), config, SimplifyStats.noop());
  }

  /** Simplifies {@code expression} with the built-in rules. */
  public static Expression simplify(Expression expression, SimplifyConfig config) throws SimplifyException {
    return new Simplifier(config).simplify(expression);
  }

  /**
   * Returns the simplified fixed point of {@code expression}.
   *
   * @throws SimplifyException.DepthExceeded     if the tree is, or grows, deeper than the limit
   * @throws SimplifyException.NodeCountExceeded if the tree has, or grows to, more nodes than the limit
   * @throws SimplifyException.PassLimitReached  if passes stop converging and the config asks for a strict limit
   */
  public Expression simplify(Expression expression) throws SimplifyException {
    return new Run().simplify(expression);
  }

  public SimplifyConfig config() {
    return config;
  }

  public RuleRegistry registry() {
    return registry;
  }

  public SimplifyStats stats() {
    return stats;
  }

  private record ProbeKey(String rule, Expression node) {}

  /** State for one request. */
  private final class Run {

    private final RuleContext root = RuleContext.of(config);
    private final Map<Expression, Expression> memo = new HashMap<>();
    private final Set<ProbeKey> probing = new HashSet<>();
    private int probeDepth = 0;
    private int pass = 0;

    Expression simplify(Expression input) throws SimplifyException {
      checkDepth(input.depth());
      checkNodeCount(input.nodeCount());
      Set<Expression> seen = new HashSet<>();
      seen.add(input);
      Expression current = input;
      for (pass = 1; pass <= config.maxPasses(); pass++) {
        memo.clear();
        Expression next = visit(current, 1);
        stats.passCompleted();
        if (next.equals(current)) {
          LOGGER.debug("Reached fixed point after {} passes", pass);
          return next;
        } else if (!seen.add(next)) {
          return notConverged(next, pass, "passes are repeating earlier trees");
        }
        current = next;
      }
      return notConverged(current, config.maxPasses(), "reached max_passes");
    }

    private Expression notConverged(Expression bestEffort, int passes, String reason)
      throws SimplifyException.PassLimitReached {
      stats.nonConvergence();
      if (config.strictPassLimit()) {
        throw new SimplifyException.PassLimitReached(passes, bestEffort);
      }
      LOGGER.warn("No fixed point after {} passes ({}), returning best effort {}", passes, reason, bestEffort);
      return bestEffort;
    }

    private Expression visit(Expression node, int depth) throws SimplifyException {
      if (depth > config.maxDepth()) {
        throw new SimplifyException.DepthExceeded(depth, config.maxDepth());
      }
      // probes see different guards than the main visit, so only cache results outside of them
      boolean cache = probeDepth == 0;
      Expression cached = cache ? memo.get(node) : null;
      if (cached != null) {
        checkDepth(depth + cached.depth() - 1);
        return cached;
      }
      Expression result = rewrite(visitChildren(node, depth), depth);
      if (cache) {
        memo.put(node, result);
      }
      return result;
    }

    private Expression visitChildren(Expression node, int depth) throws SimplifyException {
      List<Expression> children = node.children();
      List<Expression> visited = null;
      for (int i = 0; i < children.size(); i++) {
        Expression child = children.get(i);
        Expression result = visit(child, depth + 1);
        if (visited == null && result != child) {
          visited = new ArrayList<>(children.subList(0, i));
        }
        if (visited != null) {
          visited.add(result);
        }
      }
      return visited == null ? node : node.withChildren(visited);
    }

    private Expression rewrite(Expression node, int depth) throws SimplifyException {
      Expression current = node;
      Set<Expression> forms = null;
      for (int i = 0; i < MAX_LOCAL_REWRITES; i++) {
        Expression next = applyFirst(current, depth);
        if (next == null) {
          return current;
        }
        checkNodeCount(next.nodeCount());
        checkDepth(depth + next.depth() - 1);
        if (forms == null) {
          forms = new HashSet<>();
          forms.add(current);
        }
        if (!forms.add(next)) {
          LOGGER.debug("Rewrites of {} are cycling, stopping at {}", node, next);
          return next;
        }
        current = visitChildren(next, depth);
      }
      LOGGER.debug("Stopped rewriting {} after {} rewrites", node, MAX_LOCAL_REWRITES);
      return current;
    }

    @Nullable
    private Expression applyFirst(Expression node, int depth) throws SimplifyException {
      RuleContext context = root.at(depth, pass);
      for (Rule rule : registry.candidatesFor(node, context)) {
        Expression result = rule.tryApply(node, context);
        if (result == null || result.equals(node)) {
          continue;
        }
        if (rule.speculative()) {
          result = probe(rule, node, result, depth);
          if (result == null) {
            continue;
          }
        }
        if (config.trace()) {
          LOGGER.info("{}: {} => {}", rule.name(), node, result);
        } else if (LOGGER.isTraceEnabled()) {
          LOGGER.trace("{}: {} => {}", rule.name(), node, result);
        }
        stats.ruleApplied(rule.name());
        return result;
      }
      return null;
    }

    /** Returns the simplified {@code candidate} if it ends up smaller than {@code node}, otherwise null. */
    @Nullable
    private Expression probe(Rule rule, Expression node, Expression candidate, int depth) {
      ProbeKey key = new ProbeKey(rule.name(), node);
      if (probeDepth >= MAX_PROBE_DEPTH || !probing.add(key)) {
        return null;
      }
      probeDepth++;
      try {
        Expression simplified = visit(candidate, depth);
        boolean kept = simplified.nodeCount() < node.nodeCount();
        stats.speculativeRewrite(rule.name(), kept);
        return kept ? simplified : null;
      } catch (SimplifyException e) {
        LOGGER.debug("Rejected {} on {}: {}", rule.name(), node, e.getMessage());
        stats.speculativeRewrite(rule.name(), false);
        return null;
      } finally {
        probeDepth--;
        probing.remove(key);
      }
    }

    private void checkDepth(int depth) throws SimplifyException.DepthExceeded {
      if (depth > config.maxDepth()) {
        throw new SimplifyException.DepthExceeded(depth, config.maxDepth());
      }
    }

    private void checkNodeCount(int count) throws SimplifyException.NodeCountExceeded {
      if (count > config.maxNodes()) {
        throw new SimplifyException.NodeCountExceeded(count, config.maxNodes());
      }
    }
  }
}
