package com.gentoro.kerai.ingest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import com.gentoro.kerai.KeraiFixture;
import com.gentoro.kerai.exception.GrammarParseException;
import com.gentoro.kerai.exception.StoreException;
import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.graph.FileFlags;
import com.gentoro.kerai.graph.NodeKinds;
import com.gentoro.kerai.graph.NodeStatus;
import com.gentoro.kerai.reconstruct.ReconstructionOptions;
import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.suggest.RuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestServiceTest {
  private static final String PATH = "src/calc.rs";
  private static final String V1 =
      "fn add(a: i32, b: i32) -> i32 {\n    a + b\n}\n\nfn sub(a: i32, b: i32) -> i32 {\n"
          + "    a - b\n}\n";

  @Mock private GraphStore unavailable;

  private KeraiFixture k;

  @BeforeEach
  void setUp() {
    k = KeraiFixture.plain();
  }

  private NodeStatus statusOf(String name) {
    return k.store.nodeStatus(k.named(NodeKinds.FUNCTION, name).getId());
  }

  @Test
  void firstIngestCreatesTheFileSubtree() {
    IngestResult result = k.ingest.ingest(PATH, V1);

    assertEquals(KeraiFixture.rootId(PATH), result.rootId());
    assertEquals("rust", result.language());
    assertEquals(3, result.nodes());
    assertTrue(result.changed());
    assertEquals(result.operations(), k.store.operationCount());
    assertEquals(2, k.query.children(result.rootId()).size());
  }

  @Test
  void editTouchesOnlyTheChangedNode() {
    k.ingest.ingest(PATH, V1);
    String v2 = V1.replace("a - b", "b - a");

    IngestResult result = k.ingest.ingest(PATH, v2);

    assertEquals(1, result.operations());
    assertEquals(NodeStatus.EDITED, statusOf("sub"));
    assertEquals(NodeStatus.PRESENT, statusOf("add"));
    assertEquals(v2, k.reconstruction.reconstructPath(PATH, ReconstructionOptions.SKIP_ALL));
  }

  @Test
  void removedDeclarationIsTombstoned() {
    k.ingest.ingest(PATH, V1);
    String subId = k.named(NodeKinds.FUNCTION, "sub").getId();

    k.ingest.ingest(PATH, "fn add(a: i32, b: i32) -> i32 {\n    a + b\n}\n");

    assertEquals(NodeStatus.TOMBSTONED, k.store.nodeStatus(subId));
    assertTrue(k.store.readNode(subId).isEmpty());
  }

  @Test
  void reorderKeepsNodeIdentity() {
    k.ingest.ingest(PATH, V1);
    String swapped =
        "fn sub(a: i32, b: i32) -> i32 {\n    a - b\n}\n\nfn add(a: i32, b: i32) -> i32 {\n"
            + "    a + b\n}\n";

    String subId = k.named(NodeKinds.FUNCTION, "sub").getId();
    String addId = k.named(NodeKinds.FUNCTION, "add").getId();

    k.ingest.ingest(PATH, swapped);

    assertEquals(subId, k.named(NodeKinds.FUNCTION, "sub").getId());
    assertEquals(addId, k.named(NodeKinds.FUNCTION, "add").getId());
    assertTrue(
        k.store.readNode(subId).orElseThrow().getPosition()
            < k.store.readNode(addId).orElseThrow().getPosition());
    assertEquals(swapped, k.reconstruction.reconstructPath(PATH, ReconstructionOptions.SKIP_ALL));
  }

  @Test
  void parseFailureCommitsNothing() {
    k.ingest.ingest(PATH, V1);
    int before = k.store.operationCount();

    assertThrows(GrammarParseException.class, () -> k.ingest.ingest(PATH, "fn broken() {\n"));

    assertEquals(before, k.store.operationCount());
    assertEquals(V1, k.reconstruction.reconstructPath(PATH, ReconstructionOptions.SKIP_ALL));
  }

  @Test
  void storeFailurePropagates() {
    // Arrange
    when(unavailable.appendOperations(anyList())).thenThrow(new StoreException("store is down"));
    KeraiFixture broken = new KeraiFixture("local", unavailable, new RuleRegistry());

    // Act & Assert
    StoreException e = assertThrows(StoreException.class, () -> broken.ingest.ingest(PATH, V1));
    assertEquals("store is down", e.getMessage());
  }

  @Test
  void fileFlagsSurviveReingest() {
    k.ingest.ingest(PATH, V1);
    FileFlags flags = new FileFlags(true, false, false, false);
    k.reconstruction.setFileFlags(KeraiFixture.rootId(PATH), flags);

    k.ingest.ingest(PATH, V1.replace("a + b", "b + a"));

    assertEquals(flags, k.reconstruction.fileFlags(KeraiFixture.rootId(PATH)));
  }

  @Test
  void filesAreIndependent() {
    k.ingest.ingest(PATH, V1);
    k.ingest.ingest("src/other.rs", "fn add() {}\n");
    int before = k.store.operationCount();

    assertEquals(0, k.ingest.ingest(PATH, V1).operations());
    assertEquals(before, k.store.operationCount());
    assertEquals(2, k.query.status().files());
  }

  @Test
  void blankPathIsRejected() {
    assertThrows(ValidationException.class, () -> k.ingest.ingest(" ", V1));
  }
}
