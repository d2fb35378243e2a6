package com.gentoro.kerai.suggest;

import com.gentoro.kerai.exception.ConfigException;
import com.gentoro.kerai.suggest.rules.MissingDocRule;
import com.gentoro.kerai.suggest.rules.StutterRule;
import com.gentoro.kerai.suggest.rules.UnwrapCallRule;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Suggestion rules keyed by rule id. */
public final class RuleRegistry {
  private final Map<String, SuggestionRule> rules = new LinkedHashMap<>();

  public RuleRegistry register(SuggestionRule rule) {
    rules.put(rule.id(), rule);
    return this;
  }

  public boolean contains(String id) {
    return rules.containsKey(id);
  }

  public Collection<SuggestionRule> all() {
    return rules.values();
  }

  /** Registry with the built-in rules. */
  public static RuleRegistry defaults() {
    return new RuleRegistry()
        .register(new MissingDocRule())
        .register(new StutterRule())
        .register(new UnwrapCallRule());
  }

  /** Keep only the rules named in {@code ids}; an empty list keeps every rule. */
  public RuleRegistry restrictTo(List<String> ids) {
    if (ids == null || ids.isEmpty()) return this;
    RuleRegistry restricted = new RuleRegistry();
    for (String id : ids) {
      SuggestionRule rule = rules.get(id.trim());
      if (rule == null) throw new ConfigException("Unknown suggestion rule: " + id);
      restricted.register(rule);
    }
    return restricted;
  }

  public List<Finding> inspect(RuleContext context) {
    List<Finding> out = new ArrayList<>();
    for (SuggestionRule rule : rules.values()) out.addAll(rule.inspect(context));
    return out;
  }
}
