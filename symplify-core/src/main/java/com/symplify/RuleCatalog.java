package com.symplify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.symplify.config.Arguments;
import com.symplify.expression.ExpressionKind;
import com.symplify.rules.Rule;
import com.symplify.rules.RuleRegistry;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Describes the rules in a registry as JSON, in dispatch order.
 * <p>
 * To print the built-in catalog: {@code java -jar symplify.jar rules [--domain_safe]}
 */
public class RuleCatalog {

  private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private RuleCatalog() {}

  public static void main(String... args) {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    boolean domainSafe = arguments.getBoolean("domain_safe", "only list rules that run in domain-safe mode", false);
    System.out.println(write(RuleRegistry.builtin(), domainSafe));
  }

  /** Returns one object per rule with its name, priority, category, kinds, functions and flags. */
  public static ArrayNode toJson(RuleRegistry registry, boolean domainSafe) {
    ArrayNode result = JsonNodeFactory.instance.arrayNode();
    for (Rule rule : registry.rules()) {
      if (domainSafe && rule.altersDomain()) {
        continue;
      }
      ObjectNode node = result.addObject();
      node.put("name", rule.name());
      node.put("priority", rule.priority());
      node.put("category", rule.category().name().toLowerCase(Locale.ROOT));
      ArrayNode kinds = node.putArray("kinds");
      rule.kinds().stream().sorted().map(ExpressionKind::name).map(k -> k.toLowerCase(Locale.ROOT))
        .forEach(kinds::add);
      ArrayNode functions = node.putArray("functions");
      new TreeSet<>(rule.functions()).forEach(functions::add);
      node.put("alters_domain", rule.altersDomain());
      node.put("speculative", rule.speculative());
    }
    return result;
  }

  public static String write(RuleRegistry registry, boolean domainSafe) {
    try {
      return objectMapper.writeValueAsString(toJson(registry, domainSafe));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Unable to write rule catalog", e);
    }
  }
}
