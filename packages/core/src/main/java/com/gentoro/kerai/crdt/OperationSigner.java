package com.gentoro.kerai.crdt;

import com.gentoro.kerai.logging.LoggingService;
import com.gentoro.kerai.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * Signs local operations and verifies remote ones.
 *
 * <p>The signed message is {@code type|node_id|seq|payload_json}, with {@code null} for edge
 * operations' node id and the payload serialized with sorted keys, so every peer derives the same
 * bytes from the same operation.
 */
public class OperationSigner {
  private static final Logger log = LoggingService.getLogger(OperationSigner.class);

  public enum Verdict {
    VALID,
    INVALID,
    UNSIGNED,
    UNKNOWN_PEER
  }

  private final PeerIdentity local;
  private final Map<String, PublicKey> knownKeys = new ConcurrentHashMap<>();

  /** @param local identity used to sign; {@code null} leaves local operations unsigned */
  public OperationSigner(PeerIdentity local) {
    this.local = local;
    if (local != null) knownKeys.put(local.peerId(), local.publicKey());
  }

  public void trust(String peerId, PublicKey key) {
    knownKeys.put(peerId, key);
    log.debug("Trusting peer {} with key {}", peerId, PeerIdentity.fingerprint(key));
  }

  public Optional<PeerIdentity> localIdentity() {
    return Optional.ofNullable(local);
  }

  public Operation sign(Operation op) {
    if (local == null) return op;
    byte[] sig = local.sign(signable(op));
    return op.withSignature(Base64.getEncoder().encodeToString(sig));
  }

  public Verdict verify(Operation op) {
    if (op.getSignature() == null || op.getSignature().isEmpty()) return Verdict.UNSIGNED;
    PublicKey key = knownKeys.get(op.getPeerId());
    if (key == null) return Verdict.UNKNOWN_PEER;
    byte[] sig;
    try {
      sig = Base64.getDecoder().decode(op.getSignature());
    } catch (IllegalArgumentException e) {
      return Verdict.INVALID;
    }
    return PeerIdentity.verify(key, signable(op), sig) ? Verdict.VALID : Verdict.INVALID;
  }

  static byte[] signable(Operation op) {
    String text =
        op.getType().wireName()
            + "|"
            + (op.getNodeId() == null ? "null" : op.getNodeId())
            + "|"
            + op.getSeq()
            + "|"
            + JacksonUtility.toCanonicalJson(op.getPayload());
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
