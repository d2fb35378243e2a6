package com.gentoro.kerai.graph;

/** Well-known node kinds. Grammars may introduce more; see {@link NodeKindRegistry}. */
public final class NodeKinds {
  public static final String FILE = "file";
  public static final String COMMENT_BLOCK = "comment_block";
  public static final String SUGGESTION = "suggestion";

  public static final String USE = "use";
  public static final String FUNCTION = "function";
  public static final String STRUCT = "struct";
  public static final String ENUM = "enum";
  public static final String TRAIT = "trait";
  public static final String IMPL = "impl";
  public static final String MOD = "mod";
  public static final String CONST = "const";
  public static final String STATIC = "static";
  public static final String TYPE_ALIAS = "type_alias";
  public static final String MACRO_DEF = "macro_def";
  public static final String MACRO_CALL = "macro_call";
  public static final String EXTERN_CRATE = "extern_crate";
  public static final String STATEMENT = "statement";

  private NodeKinds() {}
}
