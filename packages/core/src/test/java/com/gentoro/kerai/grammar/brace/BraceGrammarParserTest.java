package com.gentoro.kerai.grammar.brace;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.exception.GrammarParseException;
import com.gentoro.kerai.exception.KeraiErrorCode;
import com.gentoro.kerai.grammar.SyntaxTree;
import com.gentoro.kerai.grammar.SyntaxUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BraceGrammarParserTest {
  private final BraceGrammarParser parser = new BraceGrammarParser();

  private static final String SOURCE =
      String.join(
          "\n",
          "use std::io;",
          "",
          "#[derive(Debug)]",
          "pub struct Point {",
          "    x: i32,",
          "}",
          "",
          "impl Point {",
          "    pub fn new() -> Self {",
          "        Point { x: 0 }",
          "    }",
          "}",
          "");

  @Test
  @DisplayName("top-level items become units; attributes stay with their item")
  void splitsTopLevelUnits() {
    SyntaxTree tree = parser.parse("geo.rs", SOURCE);
    assertEquals("rust", tree.language());
    assertEquals(3, tree.units().size());

    SyntaxUnit use = tree.units().get(0);
    assertEquals("use", use.kindHint());
    assertEquals("std::io", use.name());
    assertEquals(1, use.startLine());
    assertEquals(1, use.endLine());

    SyntaxUnit struct = tree.units().get(1);
    assertEquals("struct", struct.kindHint());
    assertEquals("Point", struct.name());
    assertEquals("pub", struct.visibility());
    assertEquals(3, struct.startLine());
    assertEquals(6, struct.endLine());
    assertFalse(struct.isContainer());
  }

  @Test
  @DisplayName("impl blocks are containers whose body is split recursively")
  void implIsContainer() {
    SyntaxUnit impl = parser.parse("geo.rs", SOURCE).units().get(2);
    assertEquals("impl", impl.kindHint());
    assertEquals("Point", impl.name());
    assertTrue(impl.isContainer());
    assertEquals(9, impl.bodyStartLine());
    assertEquals(11, impl.bodyEndLine());
    assertEquals(1, impl.children().size());

    SyntaxUnit fn = impl.children().get(0);
    assertEquals("fn", fn.kindHint());
    assertEquals("new", fn.name());
    assertEquals(9, fn.startLine());
    assertEquals(11, fn.endLine());
    assertEquals(4, fn.startCol());
  }

  @Test
  void classifiesHeads() {
    SyntaxTree tree =
        parser.parse(
            "k.rs",
            String.join(
                "\n",
                "pub(crate) const MAX: u32 = 3;",
                "static mut COUNT: u32 = 0;",
                "type Id = u64;",
                "extern crate alloc;",
                "macro_rules! hello {",
                "    () => {};",
                "}",
                "println!(\"x\");",
                "impl<T> Display for Wrapper<T> {}",
                ""));
    assertEquals("const", tree.units().get(0).kindHint());
    assertEquals("pub(crate)", tree.units().get(0).visibility());
    assertEquals("COUNT", tree.units().get(1).name());
    assertEquals("type_alias", tree.units().get(2).kindHint());
    assertEquals("extern_crate", tree.units().get(3).kindHint());
    assertEquals("macro_def", tree.units().get(4).kindHint());
    assertEquals("hello", tree.units().get(4).name());
    assertEquals("macro_call", tree.units().get(5).kindHint());
    assertEquals("Wrapper", tree.units().get(6).name());
  }

  @Test
  @DisplayName("comment markers inside strings do not hide the closing brace")
  void stringsAreOpaque() {
    SyntaxTree tree =
        parser.parse("s.rs", "fn f() {\n    let s = \"} // {\";\n}\nfn g() {}\n");
    assertEquals(2, tree.units().size());
    assertEquals(3, tree.units().get(0).endLine());
  }

  @Test
  void unbalancedClosingBraceFails() {
    GrammarParseException e =
        assertThrows(GrammarParseException.class, () -> parser.parse("bad.rs", "fn f() {\n}\n}\n"));
    assertEquals(KeraiErrorCode.PARSE_ERROR, e.getCode());
    assertEquals("bad.rs", e.getContext().get("file"));
  }

  @Test
  void unterminatedStringFails() {
    assertThrows(
        GrammarParseException.class, () -> parser.parse("bad.rs", "const S: &str = \"open;\n"));
  }

  @Test
  void unterminatedBlockCommentFails() {
    GrammarParseException e =
        assertThrows(
            GrammarParseException.class, () -> parser.parse("bad.rs", "fn f() {}\n/* open\n"));
    assertEquals(2, e.getLine().intValue());
  }
}
