package com.gentoro.kerai.crdt;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class VersionVectorTest {

  @Test
  void watermarkAdvancesOnlyOverContiguousRuns() {
    VersionVector v = new VersionVector();
    v.observe("a", 1);
    v.observe("a", 2);
    v.observe("a", 4);
    assertEquals(2, v.get("a"));
    assertEquals(4, v.highest("a"));

    v.observe("a", 3);
    assertEquals(4, v.get("a"));
    assertEquals(4, v.highest("a"));
  }

  @Test
  void staleAndUnknownPeers() {
    VersionVector v = new VersionVector();
    v.observe("b", 1);
    v.observe("b", 1);
    assertEquals(1, v.get("b"));
    assertEquals(0, v.get("c"));
    assertEquals(0, v.highest("c"));
    assertEquals(Map.of("b", 1L), v.asMap());
  }

  @Test
  void peerWithOnlyAGapStaysAtZero() {
    VersionVector v = new VersionVector();
    v.observe("a", 3);
    assertEquals(0, v.get("a"));
    assertEquals(Map.of("a", 0L), v.asMap());
  }
}
