package com.gentoro.kerai.reconstruct.pass;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AttributeOrderingPassTest {
  private final AttributeOrderingPass pass = new AttributeOrderingPass();

  @Test
  void sortsDeriveListCaseInsensitively() {
    assertEquals(
        "#[derive(clone, Debug, Serialize)]\npub struct A;",
        pass.apply("#[derive(Serialize, Debug, clone)]\npub struct A;"));
  }

  @Test
  void sortsEachAttributeOnItsOwn() {
    assertEquals(
        "#[derive(A, B)]\n#[derive(C, D)]\nstruct S;",
        pass.apply("#[derive(B, A)]\n#[derive(D, C)]\nstruct S;"));
    assertEquals(
        "    #[derive(Eq, PartialEq)] #[derive(Clone, Copy)]",
        pass.apply("    #[derive(PartialEq, Eq)] #[derive(Copy, Clone)]"));
  }

  @Test
  void leavesEmptyAndNonDeriveAttributesAlone() {
    assertEquals("#[derive()]\nstruct E;", pass.apply("#[derive()]\nstruct E;"));
    assertEquals("#[cfg(test, b, a)]\nmod t;", pass.apply("#[cfg(test, b, a)]\nmod t;"));
  }

  @Test
  void ignoresDeriveTextOutsideAttributeLines() {
    String code = "fn f() {\n    let s = \"#[derive(B, A)]\";\n}";
    assertEquals(code, pass.apply(code));
  }
}
