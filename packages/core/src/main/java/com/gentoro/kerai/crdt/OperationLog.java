package com.gentoro.kerai.crdt;

import com.gentoro.kerai.exception.ValidationException;
import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.store.GraphStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * A peer's view of the replicated operation log.
 *
 * <p>Local mutations are stamped with this peer's next sequence numbers and Lamport times, signed
 * when an identity is configured, and appended to the store as one batch. Remote operations are
 * verified, advance the local clock, and are handed to the store, which drops the ones it has
 * already applied.
 */
public class OperationLog {
  private static final Logger log = LoggingService.getLogger(OperationLog.class);

  private final String peerId;
  private final GraphStore store;
  private final OperationSigner signer;
  private final boolean requireSignatures;
  private final LamportClock clock;
  private long seq;

  public OperationLog(String peerId, GraphStore store) {
    this(peerId, store, new OperationSigner(null), false);
  }

  public OperationLog(
      String peerId, GraphStore store, OperationSigner signer, boolean requireSignatures) {
    if (peerId == null || peerId.isBlank()) {
      throw new ValidationException("Peer id cannot be null or empty");
    }
    this.peerId = peerId;
    this.store = Objects.requireNonNull(store, "store");
    this.signer = Objects.requireNonNull(signer, "signer");
    this.requireSignatures = requireSignatures;
    this.clock = new LamportClock(store.maxLamport());
    this.seq = store.highestSeq(peerId);
  }

  public String peerId() {
    return peerId;
  }

  public GraphStore store() {
    return store;
  }

  public OperationSigner signer() {
    return signer;
  }

  /**
   * Stamp and append {@code drafts} as one all-or-nothing batch. If the store rejects the batch the
   * sequence counter is rolled back, so nothing is skipped on retry.
   *
   * @return the operations as appended
   */
  public synchronized List<Operation> submit(List<OperationDraft> drafts) {
    if (drafts.isEmpty()) return List.of();
    long firstSeq = seq;
    List<Operation> batch = new ArrayList<>(drafts.size());
    for (OperationDraft draft : drafts) {
      batch.add(signer.sign(draft.stamp(peerId, ++seq, clock.tick())));
    }
    try {
      store.appendOperations(batch);
    } catch (RuntimeException e) {
      seq = firstSeq;
      throw e;
    }
    log.debug(
        "Peer {} appended {} operations (seq {}..{})", peerId, batch.size(), firstSeq + 1, seq);
    return batch;
  }

  /**
   * Merge operations received from other peers. Operations with a bad signature, or unsigned ones
   * when signatures are required, are dropped.
   *
   * @return number of operations newly applied
   */
  public synchronized int merge(List<Operation> remote) {
    List<Operation> accepted = new ArrayList<>(remote.size());
    for (Operation op : remote) {
      OperationSigner.Verdict verdict = signer.verify(op);
      boolean ok =
          verdict == OperationSigner.Verdict.VALID
              || (!requireSignatures && verdict != OperationSigner.Verdict.INVALID);
      if (!ok) {
        log.warn(
            "Rejecting operation {} from {}: signature {}", op.getId(), op.getPeerId(), verdict);
        continue;
      }
      clock.observe(op.getLamport());
      accepted.add(op);
    }
    if (accepted.isEmpty()) return 0;
    int applied = store.appendOperations(accepted);
    log.debug("Merged {} of {} remote operations into {}", applied, remote.size(), peerId);
    return applied;
  }

  /** Pull everything {@code other} has that this peer has not seen, peer by peer. */
  public int pullFrom(OperationLog other) {
    Map<String, Long> mine = store.versionVector();
    List<Operation> missing = new ArrayList<>();
    for (String peer : other.store().versionVector().keySet()) {
      missing.addAll(other.store().operationsSince(peer, mine.getOrDefault(peer, 0L)));
    }
    return merge(missing);
  }
}
