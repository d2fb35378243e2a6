package com.gentoro.kerai.suggest.rules;

import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.suggest.Finding;
import com.gentoro.kerai.suggest.RuleContext;
import com.gentoro.kerai.suggest.SuggestionRule;
import java.util.ArrayList;
import java.util.List;

/** Functions that call {@code .unwrap()}. */
public class UnwrapCallRule implements SuggestionRule {
  public static final String ID = "unwrap_call";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<Finding> inspect(RuleContext context) {
    List<Finding> out = new ArrayList<>();
    for (Node n : context.structuralNodes()) {
      if (!NodeKinds.FUNCTION.equals(n.getKind())) continue;
      String content = n.getContent();
      if (content == null || !content.contains(".unwrap()")) continue;
      out.add(
          new Finding(
              ID,
              n.getId(),
              "`"
                  + n.metaString(MetaKeys.NAME)
                  + "` calls .unwrap(); consider propagating the error"));
    }
    return out;
  }
}
