package com.gentoro.kerai.crdt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An atomic, replayable graph mutation and the unit of replication between peers.
 *
 * <p>The id is {@code peerId:seq}, unique per originating peer. The payload carries everything
 * needed to apply the operation without looking at earlier ones: {@code move_node} carries the
 * target parent and position, {@code update_content} the full content and metadata.
 *
 * <table>
 *   <caption>Payload keys</caption>
 *   <tr><td>insert_node</td><td>kind, content, parent_id, position, metadata</td></tr>
 *   <tr><td>move_node</td><td>parent_id, position</td></tr>
 *   <tr><td>update_content</td><td>content, metadata</td></tr>
 *   <tr><td>delete_node</td><td>(none)</td></tr>
 *   <tr><td>add_edge</td><td>kind, source, target, metadata</td></tr>
 *   <tr><td>remove_edge</td><td>kind, source, target</td></tr>
 * </table>
 */
public final class Operation {
  private final String id;
  private final String peerId;
  private final long seq;
  private final long lamport;
  private final OperationType type;
  private final String nodeId;
  private final Map<String, Object> payload;
  private final String signature;

  @JsonCreator
  public Operation(
      @JsonProperty("id") String id,
      @JsonProperty("peerId") String peerId,
      @JsonProperty("seq") long seq,
      @JsonProperty("lamport") long lamport,
      @JsonProperty("type") OperationType type,
      @JsonProperty("nodeId") String nodeId,
      @JsonProperty("payload") Map<String, Object> payload,
      @JsonProperty("signature") String signature) {
    this.peerId = Objects.requireNonNull(peerId, "peerId");
    this.id = id != null ? id : peerId + ":" + seq;
    this.seq = seq;
    this.lamport = lamport;
    this.type = Objects.requireNonNull(type, "type");
    this.nodeId = nodeId;
    this.payload =
        payload == null || payload.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    this.signature = signature;
  }

  public String getId() {
    return id;
  }

  public String getPeerId() {
    return peerId;
  }

  public long getSeq() {
    return seq;
  }

  public long getLamport() {
    return lamport;
  }

  public OperationType getType() {
    return type;
  }

  /** Target node id; {@code null} for edge operations. */
  public String getNodeId() {
    return nodeId;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  /** Base64 Ed25519 signature, or {@code null} when unsigned. */
  public String getSignature() {
    return signature;
  }

  @JsonIgnore
  public OpKey key() {
    return new OpKey(lamport, peerId, seq);
  }

  public Operation withSignature(String newSignature) {
    return new Operation(id, peerId, seq, lamport, type, nodeId, payload, newSignature);
  }

  String payloadString(String key) {
    Object v = payload.get(key);
    return v == null ? null : v.toString();
  }

  long payloadLong(String key) {
    Object v = payload.get(key);
    if (v instanceof Number n) return n.longValue();
    return v == null ? 0L : Long.parseLong(v.toString());
  }

  @SuppressWarnings("unchecked")
  Map<String, Object> payloadMap(String key) {
    Object v = payload.get(key);
    return v instanceof Map<?, ?> m ? (Map<String, Object>) m : Collections.emptyMap();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Operation other && id.equals(other.id));
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Operation{" + id + " " + type.wireName() + " @" + lamport
        + (nodeId == null ? "" : " node=" + nodeId) + '}';
  }
}
