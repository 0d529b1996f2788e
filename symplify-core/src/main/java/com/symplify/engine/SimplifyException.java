package com.symplify.engine;

import com.symplify.expression.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error that stopped a simplification request before it produced a result. The caller still holds its original,
 * untouched expression.
 */
public abstract class SimplifyException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimplifyException.class);

  private final String stat;

  /**
   * Constructs a new exception.
   *
   * @param stat    string that uniquely identifies this error condition, for counting occurrences
   * @param message description of the error to log
   */
  protected SimplifyException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  /** Returns the unique code for this error condition. */
  public String stat() {
    return stat;
  }

  /** Logs this error as a warning prefixed with {@code logContext}. */
  public void log(String logContext) {
    LOGGER.warn("{}: {} ({})", logContext, getMessage(), stat);
  }

  /** The tree, or a node produced while rewriting it, is nested deeper than {@code maxDepth}. */
  public static final class DepthExceeded extends SimplifyException {

    private final int depth;
    private final int limit;

    public DepthExceeded(int depth, int limit) {
      super("depth_exceeded", "Expression depth " + depth + " exceeds limit " + limit);
      this.depth = depth;
      this.limit = limit;
    }

    public int depth() {
      return depth;
    }

    public int limit() {
      return limit;
    }
  }

  /** The tree, or a node produced while rewriting it, has more than {@code maxNodes} nodes. */
  public static final class NodeCountExceeded extends SimplifyException {

    private final int count;
    private final int limit;

    public NodeCountExceeded(int count, int limit) {
      super("node_count_exceeded", "Expression has " + count + " nodes, more than limit " + limit);
      this.count = count;
      this.limit = limit;
    }

    public int count() {
      return count;
    }

    public int limit() {
      return limit;
    }
  }

  /**
   * Passes stopped before reaching a fixed point, because they hit {@code maxPasses} or started repeating earlier
   * trees. Only thrown when {@code strictPassLimit} is set.
   */
  public static final class PassLimitReached extends SimplifyException {

    private final int passes;
    private final transient Expression bestEffort;

    public PassLimitReached(int passes, Expression bestEffort) {
      super("pass_limit_reached", "No fixed point after " + passes + " passes");
      this.passes = passes;
      this.bestEffort = bestEffort;
    }

    public int passes() {
      return passes;
    }

    /** Returns the tree after the last pass, which is equivalent to the input but may simplify further. */
    public Expression bestEffort() {
      return bestEffort;
    }
  }
}
