package com.gentoro.kerai.reconstruct.pass;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.KeraiFixture;
import com.gentoro.kerai.reconstruct.ReconstructionOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ImportGroupingPassTest {

  @Test
  void sortKeyIgnoresAttributesVisibilityAndSpacing() {
    assertEquals("std::io", ImportGroupingPass.sortKey("use std :: io;"));
    assertEquals("crate::a::b", ImportGroupingPass.sortKey("pub(crate) use crate::a::B;"));
    assertEquals(
        "serde::de", ImportGroupingPass.sortKey("#[cfg(feature = \"x\")]\npub use serde::de;"));
    assertEquals("core::fmt", ImportGroupingPass.sortKey("use ::core::fmt;"));
  }

  @Test
  void groupsByFirstSegment() {
    assertEquals(ImportGroupingPass.ImportGroup.STD, ImportGroupingPass.groupOf("alloc::vec"));
    assertEquals(ImportGroupingPass.ImportGroup.STD, ImportGroupingPass.groupOf("std::{io, fs}"));
    assertEquals(ImportGroupingPass.ImportGroup.INTERNAL, ImportGroupingPass.groupOf("super::x"));
    assertEquals(ImportGroupingPass.ImportGroup.INTERNAL, ImportGroupingPass.groupOf("self::y"));
    assertEquals(ImportGroupingPass.ImportGroup.EXTERNAL, ImportGroupingPass.groupOf("stdx::z"));
  }

  @Test
  void sortsNestedBraceLists() {
    ImportGroupingPass pass = new ImportGroupingPass();
    assertEquals("use std::{fmt, io};", pass.apply("use std::{io, fmt};"));
    assertEquals(
        "use a::{b::{C, d}, e};", pass.apply("use a::{e, b::{d, C}};"));
    assertEquals("use x::{ A, b };", pass.apply("use x::{ b, A };"));
  }

  @Test
  @DisplayName("std, external and internal imports come out grouped, sorted and deduplicated")
  void groupsImportsOnReconstruction() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(
        "lib.rs",
        String.join(
            "\n",
            "use crate::b;",
            "use serde::Serialize;",
            "use std::fmt;",
            "use crate::a;",
            "use std::fmt;",
            "",
            "fn main() {}",
            ""));
    assertEquals(
        String.join(
            "\n",
            "use std::fmt;",
            "",
            "use serde::Serialize;",
            "",
            "use crate::a;",
            "use crate::b;",
            "",
            "fn main() {}",
            ""),
        k.reconstruction.reconstructPath("lib.rs", ReconstructionOptions.DEFAULTS));
  }

  @Test
  @DisplayName("a comment placed above an import travels with it")
  void commentsTravelWithTheirImport() {
    KeraiFixture k = KeraiFixture.plain();
    k.ingest.ingest(
        "lib.rs", "use zeta::Z;\n// logging\nuse log::info;\n\nfn main() {}\n");
    assertEquals(
        "// logging\nuse log::info;\nuse zeta::Z;\n\nfn main() {}\n",
        k.reconstruction.reconstructPath("lib.rs", ReconstructionOptions.DEFAULTS));
  }

  @Test
  void disabledSortingKeepsSourceOrder() {
    KeraiFixture k = KeraiFixture.plain();
    String text = "use crate::b;\nuse std::fmt;\n";
    k.ingest.ingest("lib.rs", text);
    assertEquals(
        text,
        k.reconstruction.reconstructPath(
            "lib.rs", new ReconstructionOptions(false, null, null)));
  }
}
