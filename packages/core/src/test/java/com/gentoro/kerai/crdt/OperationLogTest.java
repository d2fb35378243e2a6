package com.gentoro.kerai.crdt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import com.gentoro.kerai.exception.StoreException;
import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.graph.Node;
import com.gentoro.kerai.graph.NodeStatus;
import com.gentoro.kerai.store.GraphStore;
import com.gentoro.kerai.store.memory.InMemoryGraphStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OperationLogTest {

  @Mock private GraphStore failingStore;

  private static OperationDraft insert(String id, String content) {
    return OperationDraft.insert(new Node(id, "function", content, null, 0, Map.of()));
  }

  @Test
  void submitStampsSequentialIdsAndLamportTimes() {
    OperationLog log = new OperationLog("a", new InMemoryGraphStore());

    List<Operation> first = log.submit(List.of(insert("x", "1"), insert("y", "2")));
    List<Operation> second = log.submit(List.of(OperationDraft.delete("x")));

    assertEquals(List.of("a:1", "a:2"), first.stream().map(Operation::getId).toList());
    assertEquals("a:3", second.get(0).getId());
    assertEquals(3, second.get(0).getLamport());
    assertEquals(NodeStatus.TOMBSTONED, log.store().nodeStatus("x"));
    assertTrue(log.submit(List.of()).isEmpty());
  }

  @Test
  void storeFailureRollsBackSequence() {
    // Arrange
    when(failingStore.appendOperations(anyList()))
        .thenThrow(new StoreException("down"))
        .thenReturn(1);
    OperationLog log = new OperationLog("a", failingStore);

    // Act & Assert - the failed batch consumes no sequence numbers
    assertThrows(StoreException.class, () -> log.submit(List.of(insert("x", "1"))));
    List<Operation> retried = log.submit(List.of(insert("x", "1")));
    assertEquals("a:1", retried.get(0).getId());
    verify(failingStore, times(2)).appendOperations(anyList());
  }

  @Test
  void sequenceResumesFromStore() {
    InMemoryGraphStore store = new InMemoryGraphStore();
    new OperationLog("a", store).submit(List.of(insert("x", "1"), insert("y", "2")));

    Operation next = new OperationLog("a", store).submit(List.of(insert("z", "3"))).get(0);

    assertEquals("a:3", next.getId());
    assertEquals(3, next.getLamport());
  }

  @Test
  void pullConvergesBothPeers() {
    OperationLog a = new OperationLog("a", new InMemoryGraphStore());
    OperationLog b = new OperationLog("b", new InMemoryGraphStore());
    a.submit(List.of(insert("n", "from a")));
    b.submit(List.of(OperationDraft.update("n", "from b", Map.of())));
    b.submit(List.of(insert("m", "only b")));

    assertEquals(2, a.pullFrom(b));
    assertEquals(1, b.pullFrom(a));
    assertEquals(0, b.pullFrom(a));

    assertEquals(a.store().readAllNodes(), b.store().readAllNodes());
    assertEquals(Map.of("a", 1L, "b", 2L), a.store().versionVector());
    // b's edit has lamport 1 like a's insert, so it wins on peer id.
    assertEquals("from b", a.store().readNode("n").orElseThrow().getContent());
  }

  @Test
  void mergeAdvancesLocalClock() {
    OperationLog a = new OperationLog("a", new InMemoryGraphStore());
    Operation remote = insert("r", "remote").stamp("b", 1, 40);

    assertEquals(1, a.merge(List.of(remote)));
    assertEquals(41, a.submit(List.of(insert("l", "local"))).get(0).getLamport());
  }

  @Test
  void requiredSignaturesRejectUnsignedAndForged() {
    PeerIdentity alice = PeerIdentity.generate("a");
    PeerIdentity mallory = PeerIdentity.generate("a");
    OperationSigner signer = new OperationSigner(PeerIdentity.generate("b"));
    signer.trust("a", alice.publicKey());
    OperationLog strict = new OperationLog("b", new InMemoryGraphStore(), signer, true);

    Operation unsigned = insert("u", "u").stamp("a", 1, 1);
    Operation forged = new OperationSigner(mallory).sign(insert("f", "f").stamp("a", 2, 2));
    Operation genuine = new OperationSigner(alice).sign(insert("g", "g").stamp("a", 3, 3));

    assertEquals(1, strict.merge(List.of(unsigned, forged, genuine)));
    assertTrue(strict.store().readNode("g").isPresent());
    assertTrue(strict.store().readNode("u").isEmpty());
    assertTrue(strict.store().readNode("f").isEmpty());
  }

  @Test
  void lenientLogAcceptsUnsigned() {
    OperationLog lenient = new OperationLog("b", new InMemoryGraphStore());
    assertEquals(1, lenient.merge(List.of(insert("u", "u").stamp("a", 1, 1))));
  }

  @Test
  void blankPeerIdIsRejected() {
    assertThrows(ValidationException.class, () -> new OperationLog(" ", new InMemoryGraphStore()));
  }
}
