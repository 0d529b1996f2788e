package com.symplify;

import com.symplify.config.Arguments;
import com.symplify.config.SimplifyConfig;
import com.symplify.engine.Simplifier;
import com.symplify.engine.SimplifyException;
import com.symplify.expression.Expression;
import com.symplify.expression.ExpressionJson;
import com.symplify.rules.RuleRegistry;
import com.symplify.stats.SimplifyStats;
import com.symplify.util.LogUtil;
import java.io.PrintStream;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line task that simplifies one expression given as JSON and prints the result as JSON.
 * <p>
 * To run: {@code java -jar symplify.jar simplify --expr='{"op":"sum","args":[...]}' [--domain_safe] [--stats]} or
 * {@code --input=expr.json} to read the expression from a file. Every {@link SimplifyConfig#from(Arguments)} key is
 * accepted too.
 */
public class SimplifyMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimplifyMain.class);

  private SimplifyMain() {}

  public static void main(String... args) {
    int status = run(Arguments.fromArgsOrConfigFile(args), System.out);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the task and returns the process exit status: 0 on success, 1 if simplification failed. */
  static int run(Arguments arguments, PrintStream out) {
    SimplifyConfig config = SimplifyConfig.from(arguments);
    boolean printStats = arguments.getBoolean("stats", "log rule statistics when finished", false);
    Expression input = arguments.hasArgument("expr") ?
      ExpressionJson.read(arguments.getString("expr", "expression to simplify as JSON"), config.scope()) :
      ExpressionJson.read(arguments.inputFile("input", "file containing the expression to simplify as JSON"),
        config.scope());
    SimplifyStats stats = printStats ? SimplifyStats.inMemory() : SimplifyStats.noop();
    if (printStats) {
      LOGGER.info("Arguments: {}", new TreeMap<>(arguments.toMap()));
    }
    Simplifier simplifier = new Simplifier(RuleRegistry.builtin(), config, stats);
    LOGGER.debug("Simplifying {} nodes with {} rules", input.nodeCount(), simplifier.registry().size());
    try {
      Expression result = LogUtil.inStage("simplify", () -> simplifier.simplify(input));
      out.println(ExpressionJson.write(result));
      return 0;
    } catch (SimplifyException e) {
      e.log("simplify");
      return 1;
    } finally {
      if (printStats) {
        stats.printSummary();
      }
    }
  }
}
