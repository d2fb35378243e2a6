package com.gentoro.kerai.reconstruct;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.KeraiFixture;
import com.gentoro.kerai.exception.NotFoundException;
import com.gentoro.kerai.graph.FileFlags;
import com.gentoro.kerai.normalize.TextNormalizer;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoundTripTest {
  private static final String PATH = "src/geometry.rs";

  static final String SOURCE =
      String.join(
          "\n",
          "//! Geometry helpers.",
          "",
          "use std::io;",
          "use crate::util::helper;",
          "",
          "/// A point.",
          "#[derive(Debug, Clone)]",
          "pub struct Point {",
          "    x: i32,",
          "    y: i32,",
          "}",
          "",
          "const MAX: u32 = 10; // limit",
          "",
          "impl Point {",
          "    /// Creates a point.",
          "    pub fn new(x: i32, y: i32) -> Self {",
          "        Point { x, y }",
          "    }",
          "",
          "    // accessors",
          "    pub fn x(&self) -> i32 {",
          "        self.x // the x",
          "    }",
          "}",
          "",
          "fn main() {",
          "    let s = \"// not a comment\";",
          "    let p = Point::new(1, 2);",
          "    println!(\"{} {}\", s, p.x());",
          "}",
          "",
          "/* trailing block */",
          "");

  @Test
  @DisplayName("reconstructing with every pass skipped returns the normalized input")
  void skipReproducesInput() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(PATH, SOURCE);
    String out = k.reconstruction.reconstructPath(PATH, ReconstructionOptions.SKIP_ALL);
    assertEquals(TextNormalizer.normalize(SOURCE), out);
  }

  @Test
  @DisplayName("the skip_all file flag has the same effect as skipping per call")
  void fileFlagSkipsPasses() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(PATH, SOURCE);
    k.reconstruction.setFileFlags(KeraiFixture.rootId(PATH), FileFlags.SKIP_ALL);
    assertEquals(
        TextNormalizer.normalize(SOURCE),
        k.reconstruction.reconstructPath(PATH, ReconstructionOptions.DEFAULTS));
  }

  @Test
  @DisplayName("passes are applied on default reconstruction")
  void defaultsApplyPasses() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(PATH, SOURCE);
    String out = k.reconstruction.reconstructPath(PATH, ReconstructionOptions.DEFAULTS);
    assertTrue(out.contains("#[derive(Clone, Debug)]"));
    assertTrue(out.contains("use std::io;\n\nuse crate::util::helper;\n"));
    assertTrue(out.contains("const MAX: u32 = 10; // limit\n"));
  }

  @Test
  @DisplayName("parse, reconstruct, parse, reconstruct reaches a fixed point")
  void reparseIsIdempotent() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(PATH, SOURCE);
    String first = k.reconstruction.reconstructPath(PATH, ReconstructionOptions.DEFAULTS);
    k.ingest.ingest(PATH, first);
    String second = k.reconstruction.reconstructPath(PATH, ReconstructionOptions.DEFAULTS);
    k.ingest.ingest(PATH, second);
    String third = k.reconstruction.reconstructPath(PATH, ReconstructionOptions.DEFAULTS);
    assertEquals(first, second);
    assertEquals(second, third);
  }

  @Test
  void reingestingUnchangedTextSubmitsNothing() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(PATH, SOURCE);
    int before = k.store.operationCount();
    assertEquals(0, k.ingest.ingest(PATH, SOURCE).operations());
    assertEquals(before, k.store.operationCount());
  }

  @Test
  void emptyFileReconstructsToEmptyText() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest("empty.rs", "  \n\n");
    assertEquals("", k.reconstruction.reconstructPath("empty.rs", ReconstructionOptions.DEFAULTS));
  }

  @Test
  void reconstructAllCoversEveryFile() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest("b.rs", "fn b() {}\n");
    k.ingest.ingest("a.rs", "fn a() {}\n");
    Map<String, String> all = k.reconstruction.reconstructAll(ReconstructionOptions.SKIP_ALL);
    assertEquals(Map.of("a.rs", "fn a() {}\n", "b.rs", "fn b() {}\n"), all);
    assertEquals("a.rs", all.keySet().iterator().next());
  }

  @Test
  void unknownFileIsNotFound() {
    KeraiFixture k = KeraiFixture.plain();
    assertThrows(
        NotFoundException.class,
        () -> k.reconstruction.reconstructPath("missing.rs", ReconstructionOptions.DEFAULTS));
  }
}
