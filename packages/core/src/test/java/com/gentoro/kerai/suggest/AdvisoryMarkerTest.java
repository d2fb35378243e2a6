package com.gentoro.kerai.suggest;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AdvisoryMarkerTest {

  @Test
  void rendersAndParsesBack() {
    AdvisoryMarker m = new AdvisoryMarker("missing_doc", "public function `f` (pub) is bare");
    String line = m.render("    ");
    assertEquals("    // kerai: public function `f` (pub) is bare (missing_doc)", line);
    assertEquals(m, AdvisoryMarker.parse(line).orElseThrow());
  }

  @Test
  void rejectsLookalikes() {
    assertFalse(AdvisoryMarker.isMarker("// kerai: no rule id"));
    assertFalse(AdvisoryMarker.isMarker("let x = 1; // kerai: msg (rule)"));
    assertFalse(AdvisoryMarker.isMarker("// kerai:msg (rule)"));
    assertFalse(AdvisoryMarker.isMarker(null));
  }

  @Test
  void stripperRemembersAnnotatedLines() {
    MarkerStripper.Stripped s =
        MarkerStripper.strip(
            "// kerai: a (r1)\n\nfn a() {}\n\n// kerai: b (r2)\n// kerai: c (r3)\n\nfn b() {}\n",
            Set.of(1, 5, 6),
            Set.of("r1", "r2", "r3"));

    assertEquals("fn a() {}\n\nfn b() {}\n", s.text());
    assertEquals(
        List.of(
            new MarkerStripper.Hit("r1", 1),
            new MarkerStripper.Hit("r2", 3),
            new MarkerStripper.Hit("r3", 3)),
        s.hits());
  }

  @Test
  void onlyOutstandingRulesStrip() {
    String text = "// kerai: revisit after release (todo)\n// kerai: a (r1)\nfn a() {}\n";
    MarkerStripper.Stripped s = MarkerStripper.strip(text, Set.of(1, 2), Set.of("r1"));

    assertEquals("// kerai: revisit after release (todo)\nfn a() {}\n", s.text());
    assertEquals(List.of(new MarkerStripper.Hit("r1", 2)), s.hits());
  }

  @Test
  void linesThatAreNotCommentsStay() {
    String text = "const S: &str = \"\n// kerai: a (r1)\n\";\n";
    MarkerStripper.Stripped s = MarkerStripper.strip(text, Set.of(), Set.of("r1"));

    assertSame(text, s.text());
    assertTrue(s.hits().isEmpty());
  }

  @Test
  void textWithoutMarkersIsReturnedAsIs() {
    String text = "fn a() {}\n\n\n";
    MarkerStripper.Stripped s = MarkerStripper.strip(text, Set.of(), Set.of("r1"));
    assertSame(text, s.text());
    assertTrue(s.hits().isEmpty());
  }
}
