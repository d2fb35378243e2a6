package com.gentoro.kerai.suggest.rules;

import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.suggest.Finding;
import com.gentoro.kerai.suggest.RuleContext;
import com.gentoro.kerai.suggest.SuggestionRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Public type names that repeat their module name, e.g. {@code ParserConfig} in {@code parser.rs}.
 */
public class StutterRule implements SuggestionRule {
  public static final String ID = "stutter";

  private static final Set<String> TYPE_KINDS =
      Set.of(NodeKinds.STRUCT, NodeKinds.ENUM, NodeKinds.TRAIT, NodeKinds.TYPE_ALIAS);
  private static final Set<String> GENERIC_STEMS = Set.of("mod", "lib", "main");

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<Finding> inspect(RuleContext context) {
    String stem = context.fileStem();
    if (GENERIC_STEMS.contains(stem)) return List.of();
    String prefix = pascalCase(stem);
    if (prefix.isEmpty()) return List.of();

    List<Finding> out = new ArrayList<>();
    for (Node n : context.structuralNodes()) {
      if (!TYPE_KINDS.contains(n.getKind()) || !context.isPublic(n)) continue;
      String name = n.metaString(MetaKeys.NAME);
      if (name == null || name.length() <= prefix.length() || !name.startsWith(prefix)) continue;
      if (!Character.isUpperCase(name.charAt(prefix.length()))) continue;
      out.add(
          new Finding(
              ID,
              n.getId(),
              "type name `" + name + "` repeats the module name `" + stem + "`"));
    }
    return out;
  }

  static String pascalCase(String stem) {
    StringBuilder sb = new StringBuilder();
    for (String part : stem.split("[_\\-]+")) {
      if (part.isEmpty()) continue;
      sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
    }
    return sb.toString();
  }
}
