package com.gentoro.kerai.suggest.rules;

import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.suggest.Finding;
import com.gentoro.kerai.suggest.RuleContext;
import com.gentoro.kerai.suggest.SuggestionRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Public items without a doc comment. */
public class MissingDocRule implements SuggestionRule {
  public static final String ID = "missing_doc";

  private static final Set<String> DOCUMENTED_KINDS =
      Set.of(
          NodeKinds.FUNCTION,
          NodeKinds.STRUCT,
          NodeKinds.ENUM,
          NodeKinds.TRAIT,
          NodeKinds.TYPE_ALIAS,
          NodeKinds.CONST,
          NodeKinds.STATIC);

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<Finding> inspect(RuleContext context) {
    List<Finding> out = new ArrayList<>();
    for (Node n : context.structuralNodes()) {
      if (!DOCUMENTED_KINDS.contains(n.getKind()) || !context.isPublic(n)) continue;
      if (context.hasDocComment(n)) continue;
      String name = n.metaString(MetaKeys.NAME);
      out.add(
          new Finding(
              ID, n.getId(), "public " + n.getKind() + " `" + name + "` has no doc comment"));
    }
    return out;
  }
}
