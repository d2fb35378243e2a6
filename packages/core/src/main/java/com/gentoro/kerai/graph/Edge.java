package com.gentoro.kerai.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, directed relationship between two nodes, independent of containment.
 *
 * <p>Edges are plain id pairs. The target may no longer exist; resolving it is a lookup that can
 * come back empty, which is how dangling relationships are detected.
 */
public final class Edge {
  private final String kind;
  private final String sourceId;
  private final String targetId;
  private final Map<String, Object> metadata;

  @JsonCreator
  public Edge(
      @JsonProperty("kind") String kind,
      @JsonProperty("sourceId") String sourceId,
      @JsonProperty("targetId") String targetId,
      @JsonProperty("metadata") Map<String, Object> metadata) {
    if (kind == null || kind.isBlank()) {
      throw new IllegalArgumentException("Edge kind cannot be null or empty");
    }
    this.kind = kind;
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.targetId = Objects.requireNonNull(targetId, "targetId");
    this.metadata =
        metadata == null || metadata.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Edge(String kind, String sourceId, String targetId) {
    this(kind, sourceId, targetId, null);
  }

  public String getKind() {
    return kind;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /** Identity of the edge: kind, source and target. Metadata is a last-writer-wins attribute. */
  @JsonIgnore
  public EdgeKey key() {
    return new EdgeKey(kind, sourceId, targetId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Edge other)) return false;
    return key().equals(other.key()) && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, sourceId, targetId, metadata);
  }

  @Override
  public String toString() {
    return "Edge{" + sourceId + " -" + kind + "-> " + targetId + '}';
  }
}
