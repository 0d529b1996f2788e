package com.symplify.config;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.symplify.symbol.SymbolScope;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for one simplification request.
 *
 * @param domainSafe          when true, skip every rewrite that could change the set of inputs the expression is
 *                            defined for, like {@code x/x -> 1}
 * @param fixedSymbols        symbol names that never get a built-in meaning, so a fixed {@code e} is not Euler's
 *                            number and a fixed {@code pi} is not the circle constant
 * @param maxDepth            deepest tree the engine will descend into before failing
 * @param maxNodes            largest tree the engine will accept or produce before failing
 * @param maxPasses           most bottom-up passes to run while waiting for a fixed point
 * @param customFunctionNames function names that are recognized but never rewritten by built-in rules
 * @param strictPassLimit     when true, failing to converge within {@code maxPasses} throws instead of returning the
 *                            last tree
 * @param trace               log every rule application at INFO level
 * @param scope               symbol scope that {@code fixedSymbols} and built-in constants are resolved in
 */
public record SimplifyConfig(
  boolean domainSafe,
  Set<String> fixedSymbols,
  int maxDepth,
  int maxNodes,
  int maxPasses,
  Set<String> customFunctionNames,
  boolean strictPassLimit,
  boolean trace,
  SymbolScope scope
) {

  public static final int DEFAULT_MAX_DEPTH = 100;
  public static final int DEFAULT_MAX_NODES = 10_000;
  public static final int DEFAULT_MAX_PASSES = 100;

  private static final class ProcessDefaults {

    static final SimplifyConfig INSTANCE = from(Arguments.fromJvmProperties().orElse(Arguments.fromEnvironment()));
  }

  public SimplifyConfig {
    Objects.requireNonNull(scope, "scope");
    fixedSymbols = ImmutableSortedSet.copyOf(Objects.requireNonNull(fixedSymbols, "fixedSymbols"));
    customFunctionNames = ImmutableSortedSet.copyOf(Objects.requireNonNull(customFunctionNames, "customFunctionNames"));
    if (maxDepth < 1) {
      throw new InvalidConfigurationException("max_depth must be at least 1, got " + maxDepth);
    }
    if (maxNodes < 1) {
      throw new InvalidConfigurationException("max_nodes must be at least 1, got " + maxNodes);
    }
    if (maxPasses < 1) {
      throw new InvalidConfigurationException("max_passes must be at least 1, got " + maxPasses);
    }
    for (String name : Sets.union(fixedSymbols, customFunctionNames)) {
      if (name.isBlank()) {
        throw new InvalidConfigurationException("Symbol and function names must not be blank");
      }
    }
    var conflicts = Sets.intersection(fixedSymbols, customFunctionNames);
    if (!conflicts.isEmpty()) {
      throw new InvalidConfigurationException("Names declared both as fixed symbols and custom functions: " + conflicts);
    }
  }

  /** Returns a config with every setting at its default value, ignoring the environment. */
  public static SimplifyConfig defaults() {
    return from(Arguments.of());
  }

  /**
   * Returns the process-wide defaults, read once from {@code -Dsymplify.*} JVM properties and {@code SYMPLIFY_*}
   * environmental variables.
   */
  public static SimplifyConfig processDefaults() {
    return ProcessDefaults.INSTANCE;
  }

  /** Returns a config parsed from {@code arguments}, with defaults for anything not set. */
  public static SimplifyConfig from(Arguments arguments) {
    return new SimplifyConfig(
      arguments.getBoolean("domain_safe", "skip rewrites that could change where the expression is defined", false),
      arguments.getNameSet("fixed_symbols", "symbols that never get a built-in meaning"),
      arguments.getInteger("max_depth", "deepest expression tree to descend into", DEFAULT_MAX_DEPTH),
      arguments.getInteger("max_nodes", "largest expression tree to accept or produce", DEFAULT_MAX_NODES),
      arguments.getInteger("max_passes", "most bottom-up passes to run before giving up", DEFAULT_MAX_PASSES),
      arguments.getNameSet("custom_functions", "function names with no built-in rules"),
      arguments.getBoolean("strict_pass_limit", "fail instead of returning a best effort when not converging", false),
      arguments.getBoolean("trace", "log every rule application", false),
      SymbolScope.global()
    );
  }

  public SimplifyConfig withDomainSafe(boolean value) {
    return new SimplifyConfig(value, fixedSymbols, maxDepth, maxNodes, maxPasses, customFunctionNames,
      strictPassLimit, trace, scope);
  }

  public SimplifyConfig withFixedSymbols(String... names) {
    return new SimplifyConfig(domainSafe, Set.copyOf(Arrays.asList(names)), maxDepth, maxNodes, maxPasses,
      customFunctionNames, strictPassLimit, trace, scope);
  }

  public SimplifyConfig withCustomFunctions(String... names) {
    return new SimplifyConfig(domainSafe, fixedSymbols, maxDepth, maxNodes, maxPasses,
      Set.copyOf(Arrays.asList(names)), strictPassLimit, trace, scope);
  }

  public SimplifyConfig withMaxDepth(int value) {
    return new SimplifyConfig(domainSafe, fixedSymbols, value, maxNodes, maxPasses, customFunctionNames,
      strictPassLimit, trace, scope);
  }

  public SimplifyConfig withMaxNodes(int value) {
    return new SimplifyConfig(domainSafe, fixedSymbols, maxDepth, value, maxPasses, customFunctionNames,
      strictPassLimit, trace, scope);
  }

  public SimplifyConfig withMaxPasses(int value) {
    return new SimplifyConfig(domainSafe, fixedSymbols, maxDepth, maxNodes, value, customFunctionNames,
      strictPassLimit, trace, scope);
  }

  public SimplifyConfig withStrictPassLimit(boolean value) {
    return new SimplifyConfig(domainSafe, fixedSymbols, maxDepth, maxNodes, maxPasses, customFunctionNames,
      value, trace, scope);
  }

  public SimplifyConfig withTrace(boolean value) {
    return new SimplifyConfig(domainSafe, fixedSymbols, maxDepth, maxNodes, maxPasses, customFunctionNames,
      strictPassLimit, value, scope);
  }

  public SimplifyConfig withScope(SymbolScope value) {
    return new SimplifyConfig(domainSafe, fixedSymbols, maxDepth, maxNodes, maxPasses, customFunctionNames,
      strictPassLimit, trace, value);
  }
}
