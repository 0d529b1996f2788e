package com.symplify.rules;

import com.symplify.expression.Expression;
import com.symplify.expression.ExpressionKind;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * One algebraic identity that can rewrite an expression node.
 * <p>
 * {@link #tryApply(Expression, RuleContext)} returns {@code null} when the rule does not match, which is the normal
 * outcome for most candidates and not an error. The remaining methods are metadata that {@link RuleRegistry} uses to
 * decide which rules to try on a node and in what order.
 * <p>
 * Define rules with the fluent builder:
 * <pre>{@code
 * Rule divSelf = Rule.rule("div_self", 90, RuleCategory.ALGEBRAIC)
 *   .altersDomain()
 *   .div((div, ctx) -> div.numerator().equals(div.denominator()) ? Expression.ONE : null);
 * }</pre>
 */
public interface Rule {

  /** Unique name, used in traces, stats and the rule catalog. */
  String name();

  /**
   * Higher runs first. 100 and up fold constants and expand, 50 to 99 apply identities and cancel, 1 to 49
   * consolidate and canonicalize.
   */
  int priority();

  RuleCategory category();

  /** Kinds of node this rule can rewrite. */
  Set<ExpressionKind> kinds();

  /** Function names this rule targets when it applies to function calls, empty for any function. */
  Set<String> functions();

  /** True if the rewrite is only valid outside some set of inputs, so it must be skipped in domain-safe mode. */
  boolean altersDomain();

  /**
   * True if the rewrite should only be kept when re-simplifying its result produces a strictly smaller tree, which
   * keeps expansions that enable cancellation from fighting with the rules that collect them again.
   */
  boolean speculative();

  /** Returns the rewritten node, or {@code null} if this rule does not apply to {@code expression}. */
  @Nullable
  Expression tryApply(Expression expression, RuleContext context);

  static Builder rule(String name, int priority, RuleCategory category) {
    return new Builder(name, priority, category);
  }

  /** The rewrite logic of a rule, receiving the node already narrowed to the type the rule targets. */
  @FunctionalInterface
  interface Body<T extends Expression> {

    @Nullable
    Expression apply(T expression, RuleContext context);
  }

  /** A rule assembled by {@link Builder}. */
  record Definition(
    String name,
    int priority,
    RuleCategory category,
    Set<ExpressionKind> kinds,
    Set<String> functions,
    boolean altersDomain,
    boolean speculative,
    Body<Expression> body
  ) implements Rule {

    public Definition {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(category, "category");
      kinds = Set.copyOf(kinds);
      functions = Set.copyOf(functions);
      if (kinds.isEmpty()) {
        throw new IllegalArgumentException("Rule " + name + " does not target any expression kind");
      }
    }

    @Nullable
    @Override
    public Expression tryApply(Expression expression, RuleContext context) {
      return body.apply(expression, context);
    }

    @Override
    public String toString() {
      return name + "(" + priority + ")";
    }
  }

  /** Fluent builder for {@link Definition}, finished by one of the typed terminal methods. */
  final class Builder {

    private final String name;
    private final int priority;
    private final RuleCategory category;
    private boolean altersDomain = false;
    private boolean speculative = false;

    private Builder(String name, int priority, RuleCategory category) {
      this.name = name;
      this.priority = priority;
      this.category = category;
    }

    public Builder altersDomain() {
      this.altersDomain = true;
      return this;
    }

    public Builder speculative() {
      this.speculative = true;
      return this;
    }

    private Rule build(ExpressionKind kind, Set<String> functions, Body<Expression> body) {
      return new Definition(name, priority, category, EnumSet.of(kind), functions, altersDomain, speculative, body);
    }

    public Rule sum(Body<Expression.Sum> body) {
      return build(ExpressionKind.SUM, Set.of(), (e, ctx) -> e instanceof Expression.Sum s ? body.apply(s, ctx) : null);
    }

    public Rule product(Body<Expression.Product> body) {
      return build(ExpressionKind.PRODUCT, Set.of(),
        (e, ctx) -> e instanceof Expression.Product p ? body.apply(p, ctx) : null);
    }

    public Rule div(Body<Expression.Div> body) {
      return build(ExpressionKind.DIV, Set.of(), (e, ctx) -> e instanceof Expression.Div d ? body.apply(d, ctx) : null);
    }

    public Rule pow(Body<Expression.Pow> body) {
      return build(ExpressionKind.POW, Set.of(), (e, ctx) -> e instanceof Expression.Pow p ? body.apply(p, ctx) : null);
    }

    /** Finishes a rule that targets unary calls to any of {@code names}, or any function when empty. */
    public FunctionRuleBuilder call(String... names) {
      return body -> build(ExpressionKind.FUNCTION, Set.copyOf(Arrays.asList(names)),
        (e, ctx) -> e instanceof Expression.FunctionCall f && f.args().size() == 1 &&
          (names.length == 0 || Arrays.asList(names).contains(f.name())) ? body.apply(f, ctx) : null);
    }
  }

  /** Second step of {@link Builder#call(String...)} that takes the body. */
  @FunctionalInterface
  interface FunctionRuleBuilder {

    Rule apply(Body<Expression.FunctionCall> body);
  }
}
