package com.gentoro.kerai.suggest;

import java.util.List;

/** A detector that inspects a freshly extracted file. Implementations must be stateless. */
public interface SuggestionRule {
  /** Stable rule id, also the tag carried by advisory markers. */
  String id();

  List<Finding> inspect(RuleContext context);
}
