package com.gentoro.kerai.suggest;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.KeraiFixture;
import com.gentoro.kerai.exception.ConfigException;
import com.gentoro.kerai.graph.MetaKeys;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.suggest.rules.StutterRule;
import com.gentoro.kerai.suggest.rules.UnwrapCallRule;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class RuleRegistryTest {

  private static List<String> messages(KeraiFixture k, String path) {
    return k.suggestions(path).stream()
        .map(n -> n.metaString(MetaKeys.MESSAGE))
        .sorted()
        .collect(Collectors.toList());
  }

  @Test
  void restrictToKeepsNamedRulesInOrder() {
    RuleRegistry r = RuleRegistry.defaults().restrictTo(List.of("unwrap_call", " stutter"));
    assertEquals(
        List.of(UnwrapCallRule.ID, StutterRule.ID),
        r.all().stream().map(SuggestionRule::id).collect(Collectors.toList()));
    assertEquals(3, RuleRegistry.defaults().restrictTo(List.of()).all().size());
    assertThrows(ConfigException.class, () -> RuleRegistry.defaults().restrictTo(List.of("nope")));
  }

  @Test
  void stutterFiresOnTypesRepeatingTheModuleName() {
    KeraiFixture k = KeraiFixture.withRules(new RuleRegistry().register(new StutterRule()));
    k.ingest.ingest(
        "src/parser.rs",
        "pub struct ParserConfig;\n\npub struct Parser;\n\npub struct Parsers;\n\n"
            + "struct ParserState;\n");

    assertEquals(
        List.of("type name `ParserConfig` repeats the module name `parser`"),
        messages(k, "src/parser.rs"));

    k.ingest.ingest("src/lib.rs", "pub struct LibConfig;\n");
    assertTrue(k.suggestions("src/lib.rs").isEmpty());
  }

  @Test
  void unwrapFiresOnFunctionsCallingUnwrap() {
    KeraiFixture k = KeraiFixture.withRules(new RuleRegistry().register(new UnwrapCallRule()));
    k.ingest.ingest(
        "main.rs",
        "fn load() -> u32 {\n    read().unwrap()\n}\n\n"
            + "fn safe() -> Option<u32> {\n    read()\n}\n");

    List<Node> found = k.suggestions("main.rs");
    assertEquals(1, found.size());
    assertEquals(
        "`load` calls .unwrap(); consider propagating the error",
        found.get(0).metaString(MetaKeys.MESSAGE));
  }
}
