package com.gentoro.kerai.store.journal;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kerai.crdt.OperationDraft;
import com.gentoro.kerai.crdt.OperationLog;
import com.gentoro.kerai.exception.StoreException;
import com.gentoro.kerai.graph.Edge;
import com.gentoro.kerai.graph.EdgeKinds;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeStatus;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JournalGraphStoreTest {
  @TempDir Path dir;

  private JournalGraphStore open(Path journal) {
    JournalGraphStore store = new JournalGraphStore(journal);
    store.initialize();
    return store;
  }

  private static void seed(JournalGraphStore store) {
    OperationLog log = new OperationLog("a", store);
    log.submit(
        List.of(
            OperationDraft.insert(new Node("f", "function", "fn f() {}", null, 0, Map.of())),
            OperationDraft.insert(new Node("g", "function", "fn g() {}", null, 1, Map.of()))));
    log.submit(
        List.of(
            OperationDraft.addEdge(new Edge(EdgeKinds.CALLS, "f", "g")),
            OperationDraft.delete("g")));
  }

  @Test
  void replaysJournalOnInitialize() throws Exception {
    Path journal = dir.resolve("nested/graph.jsonl");
    seed(open(journal));
    assertEquals(2, Files.readAllLines(journal).size());

    JournalGraphStore reopened = open(journal);
    assertEquals(4, reopened.operationCount());
    assertEquals("fn f() {}", reopened.readNode("f").orElseThrow().getContent());
    assertEquals(NodeStatus.TOMBSTONED, reopened.nodeStatus("g"));
    assertEquals(1, reopened.readEdges("f", EdgeKinds.CALLS).size());
    assertEquals(Map.of("a", 4L), reopened.versionVector());

    OperationLog resumed = new OperationLog("a", reopened);
    assertEquals(
        "a:5",
        resumed.submit(List.of(OperationDraft.delete("f"))).get(0).getId());
  }

  @Test
  void duplicateBatchesAreNotJournaled() throws Exception {
    Path journal = dir.resolve("graph.jsonl");
    JournalGraphStore store = open(journal);
    seed(store);
    JournalGraphStore other = open(dir.resolve("other.jsonl"));

    assertEquals(4, other.appendOperations(store.operationsSince("a", 0)));
    assertEquals(0, other.appendOperations(store.operationsSince("a", 0)));
    assertEquals(1, Files.readAllLines(dir.resolve("other.jsonl")).size());
  }

  @Test
  void truncatedLastLineIsSkipped() throws Exception {
    Path journal = dir.resolve("graph.jsonl");
    seed(open(journal));
    Files.writeString(
        journal, "[{\"id\":\"a:5\",\"peerI", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

    JournalGraphStore reopened = open(journal);
    assertEquals(4, reopened.operationCount());
  }

  @Test
  void recoveredJournalAcceptsFurtherBatches() throws Exception {
    Path journal = dir.resolve("graph.jsonl");
    seed(open(journal));
    Files.writeString(
        journal, "[{\"id\":\"a:5\",\"peerI", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

    JournalGraphStore recovered = open(journal);
    assertEquals(2, Files.readAllLines(journal).size());
    OperationLog log = new OperationLog("a", recovered);
    log.submit(List.of(OperationDraft.delete("f")));
    log.submit(
        List.of(OperationDraft.insert(new Node("h", "function", "fn h() {}", null, 2, Map.of()))));

    JournalGraphStore reopened = open(journal);
    assertEquals(6, reopened.operationCount());
    assertEquals(NodeStatus.TOMBSTONED, reopened.nodeStatus("f"));
    assertEquals("fn h() {}", reopened.readNode("h").orElseThrow().getContent());
    assertEquals(4, Files.readAllLines(journal).size());
  }

  @Test
  void lastLineMissingItsNewlineIsKeptAndTerminated() throws Exception {
    Path journal = dir.resolve("graph.jsonl");
    seed(open(journal));
    String text = Files.readString(journal);
    Files.writeString(journal, text.substring(0, text.length() - 1));

    JournalGraphStore recovered = open(journal);
    assertEquals(4, recovered.operationCount());
    assertEquals(text, Files.readString(journal));
  }

  @Test
  void corruptMiddleLineFailsInitialization() throws Exception {
    Path journal = dir.resolve("graph.jsonl");
    seed(open(journal));
    List<String> lines = Files.readAllLines(journal);
    Files.write(journal, List.of(lines.get(0), "{not json", lines.get(1)));

    StoreException e = assertThrows(StoreException.class, () -> open(journal));
    assertTrue(e.getMessage().contains("line 2"), e.getMessage());
  }

  @Test
  void appendBeforeInitializeFails() {
    JournalGraphStore store = new JournalGraphStore(dir.resolve("graph.jsonl"));
    assertThrows(StoreException.class, () -> store.appendOperations(List.of()));
  }
}
