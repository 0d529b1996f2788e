package com.symplify.rules;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.symplify.expression.Expression;
import com.symplify.expression.ExpressionKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Rules indexed by the kind of node they rewrite and, for function calls, by function name.
 * <p>
 * Every candidate list is sorted once at construction by priority (highest first), then {@link RuleCategory} ordinal,
 * then registration order, so dispatch is deterministic. A second copy of every index leaves out the rules that alter
 * the domain, so in domain-safe mode those rules are never even offered to the engine.
 */
@ThreadSafe
public final class RuleRegistry {

  private final List<Rule> rules;
  private final Index aggressive;
  private final Index safe;

  private RuleRegistry(List<Rule> rules) {
    Set<String> names = new HashSet<>();
    for (Rule rule : rules) {
      if (!names.add(rule.name())) {
        throw new IllegalArgumentException("Duplicate rule name: " + rule.name());
      }
    }
    List<Rule> sorted = new ArrayList<>(rules);
    // stable sort keeps registration order for ties
    sorted.sort(Comparator.comparingInt(Rule::priority).reversed()
      .thenComparing(Rule::category));
    this.rules = ImmutableList.copyOf(sorted);
    this.aggressive = new Index(this.rules);
    this.safe = new Index(this.rules.stream().filter(rule -> !rule.altersDomain()).toList());
  }

  /** Returns a registry over {@code rules}, which must have unique names. */
  public static RuleRegistry of(List<Rule> rules) {
    return new RuleRegistry(rules);
  }

  /** Returns the registry of every built-in rule, created on first use. */
  public static RuleRegistry builtin() {
    return Builtin.INSTANCE;
  }

  private static final class Builtin {

    static final RuleRegistry INSTANCE = of(BuiltinRules.all());
  }

  /**
   * Returns the rules to try on {@code expression} in the order to try them, leaving out domain-altering rules when
   * {@code context} is domain-safe and returning nothing for calls to custom functions.
   */
  public List<Rule> candidatesFor(Expression expression, RuleContext context) {
    Index index = context.domainSafe() ? safe : aggressive;
    if (expression instanceof Expression.FunctionCall call) {
      if (context.isCustomFunction(call.name())) {
        return List.of();
      }
      List<Rule> named = index.byFunction.get(call.name());
      return named.isEmpty() ? index.anyFunction : named;
    }
    return index.byKind.get(expression.kind());
  }

  /** Returns every rule in dispatch order. */
  public List<Rule> rules() {
    return rules;
  }

  /** Returns the rules that are skipped in domain-safe mode. */
  public List<Rule> domainAlteringRules() {
    return rules.stream().filter(Rule::altersDomain).toList();
  }

  public Rule get(String name) {
    return rules.stream().filter(rule -> rule.name().equals(name)).findFirst()
      .orElseThrow(() -> new IllegalArgumentException("No rule named " + name));
  }

  public int size() {
    return rules.size();
  }

  private static final class Index {

    private final Map<ExpressionKind, List<Rule>> byKind = new EnumMap<>(ExpressionKind.class);
    private final ImmutableListMultimap<String, Rule> byFunction;
    private final List<Rule> anyFunction;

    Index(List<Rule> sorted) {
      for (ExpressionKind kind : ExpressionKind.values()) {
        byKind.put(kind, sorted.stream().filter(rule -> rule.kinds().contains(kind)).toList());
      }
      List<Rule> functionRules = byKind.get(ExpressionKind.FUNCTION);
      anyFunction = functionRules.stream().filter(rule -> rule.functions().isEmpty()).toList();
      ListMultimap<String, Rule> named = MultimapBuilder.hashKeys().arrayListValues().build();
      Set<String> names = new HashSet<>();
      functionRules.forEach(rule -> names.addAll(rule.functions()));
      // each name gets its own rules merged with the name-agnostic ones, still in dispatch order
      for (String name : names) {
        for (Rule rule : functionRules) {
          if (rule.functions().isEmpty() || rule.functions().contains(name)) {
            named.put(name, rule);
          }
        }
      }
      byFunction = ImmutableListMultimap.copyOf(named);
    }
  }
}
