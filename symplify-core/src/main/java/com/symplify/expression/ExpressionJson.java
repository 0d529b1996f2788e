package com.symplify.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.symplify.symbol.SymbolScope;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes expression trees as JSON.
 * <p>
 * A number is a JSON number, a symbol is a JSON string, and every other node is an object
 * {@code {"op": "sum"|"product"|"div"|"pow"|"call", "name": "...", "args": [...]}} where {@code name} is only present
 * for {@code call}. For example {@code sin(x)^2 + 1} is
 * {@code {"op":"sum","args":[1,{"op":"pow","args":[{"op":"call","name":"sin","args":["x"]},2]}]}}.
 */
public final class ExpressionJson {

  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

  private ExpressionJson() {}

  /**
   * Parses {@code json} into an expression, interning symbols into {@code scope}.
   *
   * @throws IllegalArgumentException if the input is not valid JSON or does not describe a well-formed expression
   */
  public static Expression read(String json, SymbolScope scope) {
    try {
      return read(objectMapper.readTree(json), scope);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid expression JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Parses the JSON expression in {@code path}, interning symbols into {@code scope}. */
  public static Expression read(Path path, SymbolScope scope) {
    try (InputStream stream = Files.newInputStream(path)) {
      return read(objectMapper.readTree(stream), scope);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid expression JSON in " + path + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Converts a parsed JSON tree into an expression, interning symbols into {@code scope}. */
  public static Expression read(JsonNode json, SymbolScope scope) {
    if (json == null || json.isMissingNode() || json.isNull()) {
      throw new IllegalArgumentException("Missing expression");
    } else if (json.isNumber()) {
      return Expression.constant(json.doubleValue());
    } else if (json.isTextual()) {
      return scope.symbol(json.textValue());
    } else if (!json.isObject()) {
      throw new IllegalArgumentException("Expected a number, string or object but got: " + json);
    }
    String op = json.path("op").asText("").toLowerCase(Locale.ROOT);
    JsonNode argsNode = json.get("args");
    if (argsNode == null || !argsNode.isArray()) {
      throw new IllegalArgumentException("Expected an args array in: " + json);
    }
    List<Expression> args = new ArrayList<>(argsNode.size());
    for (JsonNode arg : argsNode) {
      args.add(read(arg, scope));
    }
    return switch (op) {
      case "sum" -> Expression.sum(nonEmpty(op, args));
      case "product" -> Expression.product(nonEmpty(op, args));
      case "div" -> Expression.div(binary(op, args).get(0), args.get(1));
      case "pow" -> Expression.pow(binary(op, args).get(0), args.get(1));
      case "call" -> call(json, args);
      default -> throw new IllegalArgumentException("Unknown op '" + op + "' in: " + json);
    };
  }

  private static Expression call(JsonNode json, List<Expression> args) {
    String name = json.path("name").asText("");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Function call without a name: " + json);
    }
    int arity = KnownFunctions.arity(name);
    if (arity >= 0 && arity != args.size()) {
      throw new IllegalArgumentException(name + " takes " + arity + " argument(s) but got " + args.size());
    }
    return Expression.call(name, args);
  }

  private static List<Expression> nonEmpty(String op, List<Expression> args) {
    if (args.isEmpty()) {
      throw new IllegalArgumentException(op + " needs at least one argument");
    }
    return args;
  }

  private static List<Expression> binary(String op, List<Expression> args) {
    if (args.size() != 2) {
      throw new IllegalArgumentException(op + " takes 2 arguments but got " + args.size());
    }
    return args;
  }

  /** Returns {@code expression} as a JSON tree. */
  public static JsonNode toJson(Expression expression) {
    if (expression instanceof Expression.Constant c) {
      double value = c.value();
      return c.isInteger() && Math.abs(value) <= Numbers.MAX_EXACT ? nodes.numberNode((long) value) :
        nodes.numberNode(value);
    } else if (expression instanceof Expression.Symbol s) {
      return nodes.textNode(s.name());
    }
    ObjectNode result = nodes.objectNode();
    if (expression instanceof Expression.FunctionCall f) {
      result.put("op", "call");
      result.put("name", f.name());
    } else {
      result.put("op", expression.kind().name().toLowerCase(Locale.ROOT));
    }
    ArrayNode args = result.putArray("args");
    for (Expression child : expression.children()) {
      args.add(toJson(child));
    }
    return result;
  }

  /** Returns {@code expression} as a compact JSON string. */
  public static String write(Expression expression) {
    try {
      return objectMapper.writeValueAsString(toJson(expression));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Unable to write " + expression, e);
    }
  }
}
