package com.symplify.expression;

import java.util.Map;
import java.util.Set;

/** Names and arities of the functions that have built-in simplification rules. */
public final class KnownFunctions {

  public static final String SIN = "sin";
  public static final String COS = "cos";
  public static final String TAN = "tan";
  public static final String COT = "cot";
  public static final String SEC = "sec";
  public static final String CSC = "csc";
  public static final String ASIN = "asin";
  public static final String ACOS = "acos";
  public static final String ATAN = "atan";
  public static final String SINH = "sinh";
  public static final String COSH = "cosh";
  public static final String TANH = "tanh";
  public static final String COTH = "coth";
  public static final String SECH = "sech";
  public static final String CSCH = "csch";
  public static final String ASINH = "asinh";
  public static final String ACOSH = "acosh";
  public static final String ATANH = "atanh";
  public static final String EXP = "exp";
  public static final String LN = "ln";
  public static final String LOG10 = "log10";
  public static final String LOG2 = "log2";
  public static final String SQRT = "sqrt";
  public static final String CBRT = "cbrt";
  public static final String ABS = "abs";
  public static final String SIGN = "sign";

  /** Symbol name treated as the circle constant unless it is fixed. */
  public static final String PI = "pi";
  /** Symbol name treated as Euler's number unless it is fixed. */
  public static final String E = "e";

  private static final Map<String, Integer> ARITY = Map.ofEntries(
    Map.entry(SIN, 1), Map.entry(COS, 1), Map.entry(TAN, 1), Map.entry(COT, 1), Map.entry(SEC, 1),
    Map.entry(CSC, 1), Map.entry(ASIN, 1), Map.entry(ACOS, 1), Map.entry(ATAN, 1),
    Map.entry(SINH, 1), Map.entry(COSH, 1), Map.entry(TANH, 1), Map.entry(COTH, 1), Map.entry(SECH, 1),
    Map.entry(CSCH, 1), Map.entry(ASINH, 1), Map.entry(ACOSH, 1), Map.entry(ATANH, 1),
    Map.entry(EXP, 1), Map.entry(LN, 1), Map.entry(LOG10, 1), Map.entry(LOG2, 1),
    Map.entry(SQRT, 1), Map.entry(CBRT, 1), Map.entry(ABS, 1), Map.entry(SIGN, 1)
  );

  /** Functions that are defined for every real argument. */
  public static final Set<String> TOTAL = Set.of(SIN, COS, ATAN, SINH, COSH, TANH, ASINH, EXP, CBRT, ABS, SIGN);

  private KnownFunctions() {}

  public static boolean isKnown(String name) {
    return ARITY.containsKey(name);
  }

  /** Returns the expected number of arguments for a built-in function, or -1 if {@code name} is not built in. */
  public static int arity(String name) {
    return ARITY.getOrDefault(name, -1);
  }

  public static Set<String> names() {
    return ARITY.keySet();
  }
}
