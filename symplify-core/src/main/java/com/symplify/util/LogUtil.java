package com.symplify.util;

import org.slf4j.MDC;

/**
 * Wrapper for SLF4j {@link MDC} log utility to prepend {@code [stage]} to log output of a command-line task.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Prepends {@code [stage]} to all subsequent logs from this thread. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[%s] ".formatted(stage));
  }

  /** Removes {@code [stage]} from subsequent logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the current {@code [stage]} value prepended to log for this thread. */
  public static String getStage() {
    // strip out the "[stage] " wrapper
    String stage = MDC.get(STAGE_KEY);
    return stage == null ? null : stage.substring(1, stage.length() - 2);
  }

  /**
   * Runs {@code task} with {@code [stage]} prepended to its logs, then restores whatever stage was active before.
   */
  public static <T, E extends Exception> T inStage(String stage, Task<T, E> task) throws E {
    String previous = getStage();
    setStage(stage);
    try {
      return task.run();
    } finally {
      if (previous == null) {
        clearStage();
      } else {
        setStage(previous);
      }
    }
  }

  /** A unit of work that runs inside a logging stage. */
  @FunctionalInterface
  public interface Task<T, E extends Exception> {

    T run() throws E;
  }
}
