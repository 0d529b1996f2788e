package com.symplify.expression;

import com.symplify.symbol.SymbolScope;
import com.symplify.util.Hashing;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable node in a symbolic expression tree.
 * <p>
 * Build nodes through the static factories on this interface. {@link #sum(List)} and {@link #product(List)} flatten
 * nested sums and products, sort their children into {@link CanonicalOrder} and collapse empty or single-child nodes,
 * so two trees that differ only by the order or grouping of commutative operands are {@code equals}.
 * <p>
 * Every node caches its {@link #structuralHash()}, {@link #nodeCount()} and {@link #depth()} when it is created.
 * {@code equals} rejects on a hash mismatch before comparing children, and rewrites share unchanged subtrees.
 * <p>
 * Subtraction is represented as {@code a + (-1)*b}, negation as {@code (-1)*b}, and rational constants as a
 * {@link Div} of two {@link Constant Constants} in lowest terms.
 */
@Immutable
public sealed interface Expression
  permits Expression.Constant, Expression.Symbol, Expression.Sum, Expression.Product, Expression.Div,
  Expression.Pow, Expression.FunctionCall {

  Constant ZERO = new Constant(0);
  Constant ONE = new Constant(1);
  Constant NEG_ONE = new Constant(-1);
  Constant TWO = new Constant(2);

  ExpressionKind kind();

  /** Hash over this node's shape and children, equal for structurally equal trees. */
  long structuralHash();

  /** Number of nodes in this tree, including this one. */
  int nodeCount();

  /** Length of the longest path from this node to a leaf, where a leaf has depth 1. */
  int depth();

  /** Returns the direct children of this node, in order. */
  List<Expression> children();

  /**
   * Returns a node of the same kind with {@code children} replaced, going through the normal factory so that sums
   * and products are re-flattened and re-sorted.
   */
  Expression withChildren(List<Expression> children);

  /** Returns true if this node or any node below it matches {@code predicate}. */
  default boolean contains(Predicate<Expression> predicate) {
    if (predicate.test(this)) {
      return true;
    }
    for (Expression child : children()) {
      if (child.contains(predicate)) {
        return true;
      }
    }
    return false;
  }

  static Constant constant(double value) {
    return new Constant(value);
  }

  /** Returns a symbol interned in the process-wide {@link SymbolScope#global()} scope. */
  static Symbol symbol(String name) {
    return SymbolScope.global().symbol(name);
  }

  static Expression sum(Expression... terms) {
    return sum(Arrays.asList(terms));
  }

  static Expression sum(List<? extends Expression> terms) {
    List<Expression> flat = new ArrayList<>(terms.size());
    for (Expression term : terms) {
      if (term instanceof Sum sum) {
        flat.addAll(sum.terms);
      } else {
        flat.add(Objects.requireNonNull(term, "term"));
      }
    }
    return switch (flat.size()) {
      case 0 -> ZERO;
      case 1 -> flat.get(0);
      default -> {
        flat.sort(CanonicalOrder.INSTANCE);
        yield new Sum(List.copyOf(flat));
      }
    };
  }

  static Expression product(Expression... factors) {
    return product(Arrays.asList(factors));
  }

  static Expression product(List<? extends Expression> factors) {
    List<Expression> flat = new ArrayList<>(factors.size());
    for (Expression factor : factors) {
      if (factor instanceof Product product) {
        flat.addAll(product.factors);
      } else {
        flat.add(Objects.requireNonNull(factor, "factor"));
      }
    }
    return switch (flat.size()) {
      case 0 -> ONE;
      case 1 -> flat.get(0);
      default -> {
        flat.sort(CanonicalOrder.INSTANCE);
        yield new Product(List.copyOf(flat));
      }
    };
  }

  static Div div(Expression numerator, Expression denominator) {
    return new Div(Objects.requireNonNull(numerator), Objects.requireNonNull(denominator));
  }

  static Pow pow(Expression base, Expression exponent) {
    return new Pow(Objects.requireNonNull(base), Objects.requireNonNull(exponent));
  }

  static Pow pow(Expression base, double exponent) {
    return pow(base, constant(exponent));
  }

  static FunctionCall call(String name, Expression... args) {
    return call(name, Arrays.asList(args));
  }

  static FunctionCall call(String name, List<? extends Expression> args) {
    return new FunctionCall(name, List.copyOf(args));
  }

  /** Returns {@code -expression} as {@code (-1)*expression}, folding constants. */
  static Expression neg(Expression expression) {
    return expression instanceof Constant c ? constant(-c.value) : product(NEG_ONE, expression);
  }

  /** Returns {@code a - b} as {@code a + (-1)*b}. */
  static Expression sub(Expression a, Expression b) {
    return sum(a, neg(b));
  }

  /** A numeric literal. {@code -0.0} is stored as {@code 0.0}. */
  record Constant(double value) implements Expression {

    public Constant {
      if (value == 0d) {
        value = 0d;
      }
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.NUMBER;
    }

    @Override
    public long structuralHash() {
      return Hashing.fnv1a64(NodeHashes.tag(NodeHashes.NUMBER), Double.doubleToLongBits(value));
    }

    @Override
    public int nodeCount() {
      return 1;
    }

    @Override
    public int depth() {
      return 1;
    }

    @Override
    public List<Expression> children() {
      return List.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return this;
    }

    public boolean isInteger() {
      return Numbers.isInteger(value);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(structuralHash());
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Constant other && Double.compare(value, other.value) == 0);
    }

    @Override
    public String toString() {
      return ExpressionPrinter.print(this);
    }
  }

  /**
   * A named variable. Create these through a {@link SymbolScope} so that {@code id} is unique within that scope.
   */
  record Symbol(String name, int id) implements Expression {

    public Symbol {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Symbol name must not be blank");
      }
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.SYMBOL;
    }

    @Override
    public long structuralHash() {
      return Hashing.fnv1a64(Hashing.fnv1a64(NodeHashes.tag(NodeHashes.SYMBOL), id), name);
    }

    @Override
    public int nodeCount() {
      return 1;
    }

    @Override
    public int depth() {
      return 1;
    }

    @Override
    public List<Expression> children() {
      return List.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return this;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(structuralHash());
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Symbol other && id == other.id && name.equals(other.name));
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** An n-ary sum with at least two terms, none of which are sums, in canonical order. */
  final class Sum implements Expression {

    private final List<Expression> terms;
    private final long hash;
    private final int nodeCount;
    private final int depth;

    private Sum(List<Expression> terms) {
      this.terms = terms;
      this.hash = NodeHashes.commutative(NodeHashes.SUM, terms);
      this.nodeCount = NodeHashes.nodeCount(terms);
      this.depth = NodeHashes.depth(terms);
    }

    public List<Expression> terms() {
      return terms;
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.SUM;
    }

    @Override
    public long structuralHash() {
      return hash;
    }

    @Override
    public int nodeCount() {
      return nodeCount;
    }

    @Override
    public int depth() {
      return depth;
    }

    @Override
    public List<Expression> children() {
      return terms;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return sum(children);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(hash);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Sum other && hash == other.hash && terms.equals(other.terms));
    }

    @Override
    public String toString() {
      return ExpressionPrinter.print(this);
    }
  }

  /** An n-ary product with at least two factors, none of which are products, in canonical order. */
  final class Product implements Expression {

    private final List<Expression> factors;
    private final long hash;
    private final int nodeCount;
    private final int depth;

    private Product(List<Expression> factors) {
      this.factors = factors;
      this.hash = NodeHashes.commutative(NodeHashes.PRODUCT, factors);
      this.nodeCount = NodeHashes.nodeCount(factors);
      this.depth = NodeHashes.depth(factors);
    }

    public List<Expression> factors() {
      return factors;
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.PRODUCT;
    }

    @Override
    public long structuralHash() {
      return hash;
    }

    @Override
    public int nodeCount() {
      return nodeCount;
    }

    @Override
    public int depth() {
      return depth;
    }

    @Override
    public List<Expression> children() {
      return factors;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return product(children);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(hash);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Product other && hash == other.hash && factors.equals(other.factors));
    }

    @Override
    public String toString() {
      return ExpressionPrinter.print(this);
    }
  }

  /** {@code numerator / denominator}. */
  final class Div implements Expression {

    private final Expression numerator;
    private final Expression denominator;
    private final long hash;
    private final int nodeCount;
    private final int depth;

    private Div(Expression numerator, Expression denominator) {
      this.numerator = numerator;
      this.denominator = denominator;
      List<Expression> children = List.of(numerator, denominator);
      this.hash = NodeHashes.ordered(NodeHashes.tag(NodeHashes.DIV), children);
      this.nodeCount = NodeHashes.nodeCount(children);
      this.depth = NodeHashes.depth(children);
    }

    public Expression numerator() {
      return numerator;
    }

    public Expression denominator() {
      return denominator;
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.DIV;
    }

    @Override
    public long structuralHash() {
      return hash;
    }

    @Override
    public int nodeCount() {
      return nodeCount;
    }

    @Override
    public int depth() {
      return depth;
    }

    @Override
    public List<Expression> children() {
      return List.of(numerator, denominator);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return div(children.get(0), children.get(1));
    }

    @Override
    public int hashCode() {
      return Long.hashCode(hash);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Div other && hash == other.hash && numerator.equals(other.numerator) &&
        denominator.equals(other.denominator));
    }

    @Override
    public String toString() {
      return ExpressionPrinter.print(this);
    }
  }

  /** {@code base ^ exponent}. */
  final class Pow implements Expression {

    private final Expression base;
    private final Expression exponent;
    private final long hash;
    private final int nodeCount;
    private final int depth;

    private Pow(Expression base, Expression exponent) {
      this.base = base;
      this.exponent = exponent;
      List<Expression> children = List.of(base, exponent);
      this.hash = NodeHashes.ordered(NodeHashes.tag(NodeHashes.POW), children);
      this.nodeCount = NodeHashes.nodeCount(children);
      this.depth = NodeHashes.depth(children);
    }

    public Expression base() {
      return base;
    }

    public Expression exponent() {
      return exponent;
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.POW;
    }

    @Override
    public long structuralHash() {
      return hash;
    }

    @Override
    public int nodeCount() {
      return nodeCount;
    }

    @Override
    public int depth() {
      return depth;
    }

    @Override
    public List<Expression> children() {
      return List.of(base, exponent);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return pow(children.get(0), children.get(1));
    }

    @Override
    public int hashCode() {
      return Long.hashCode(hash);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Pow other && hash == other.hash && base.equals(other.base) &&
        exponent.equals(other.exponent));
    }

    @Override
    public String toString() {
      return ExpressionPrinter.print(this);
    }
  }

  /** A call to a named function, either one of the {@link KnownFunctions} or a caller-defined one. */
  final class FunctionCall implements Expression {

    private final String name;
    private final List<Expression> args;
    private final long hash;
    private final int nodeCount;
    private final int depth;

    private FunctionCall(String name, List<Expression> args) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Function name must not be blank");
      }
      this.name = name;
      this.args = args;
      this.hash = NodeHashes.ordered(Hashing.fnv1a64(NodeHashes.tag(NodeHashes.FUNCTION), name), args);
      this.nodeCount = NodeHashes.nodeCount(args);
      this.depth = NodeHashes.depth(args);
    }

    public String name() {
      return name;
    }

    public List<Expression> args() {
      return args;
    }

    /** Returns the only argument of a unary function call. */
    public Expression arg() {
      return args.get(0);
    }

    public boolean is(String functionName) {
      return name.equals(functionName) && args.size() == 1;
    }

    @Override
    public ExpressionKind kind() {
      return ExpressionKind.FUNCTION;
    }

    @Override
    public long structuralHash() {
      return hash;
    }

    @Override
    public int nodeCount() {
      return nodeCount;
    }

    @Override
    public int depth() {
      return depth;
    }

    @Override
    public List<Expression> children() {
      return args;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      return call(name, children);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(hash);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof FunctionCall other && hash == other.hash && name.equals(other.name) &&
        args.equals(other.args));
    }

    @Override
    public String toString() {
      return ExpressionPrinter.print(this);
    }
  }
}
