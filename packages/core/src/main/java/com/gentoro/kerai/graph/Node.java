package com.gentoro.kerai.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One structural unit of the graph: a declaration, a comment group, a suggestion, or a file root.
 *
 * <p>Nodes are immutable snapshots. They are produced by the extraction pipeline or materialized
 * from the operation log, and are never mutated in place; a change is always a new operation.
 * {@link #getPosition()} orders a node among siblings sharing the same parent, ties broken by id.
 */
public final class Node {
  private final String id;
  private final String kind;
  private final String content;
  private final String parentId;
  private final long position;
  private final Map<String, Object> metadata;

  @JsonCreator
  public Node(
      @JsonProperty("id") String id,
      @JsonProperty("kind") String kind,
      @JsonProperty("content") String content,
      @JsonProperty("parentId") String parentId,
      @JsonProperty("position") long position,
      @JsonProperty("metadata") Map<String, Object> metadata) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Node id cannot be null or empty");
    }
    if (kind == null || kind.isBlank()) {
      throw new IllegalArgumentException("Node kind cannot be null or empty");
    }
    this.id = id;
    this.kind = kind;
    this.content = content;
    this.parentId = parentId;
    this.position = position;
    this.metadata =
        metadata == null || metadata.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public String getId() {
    return id;
  }

  public String getKind() {
    return kind;
  }

  /** Literal text of the unit, or {@code null} for purely structural containers. */
  public String getContent() {
    return content;
  }

  public String getParentId() {
    return parentId;
  }

  public long getPosition() {
    return position;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public String metaString(String key) {
    Object v = metadata.get(key);
    return v == null ? null : v.toString();
  }

  public int metaInt(String key, int defaultValue) {
    Object v = metadata.get(key);
    if (v instanceof Number n) return n.intValue();
    if (v instanceof String s && !s.isBlank()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  public boolean metaBoolean(String key) {
    Object v = metadata.get(key);
    return v instanceof Boolean b ? b : v != null && Boolean.parseBoolean(v.toString());
  }

  public Node withContent(String newContent, Map<String, Object> newMetadata) {
    return new Node(id, kind, newContent, parentId, position, newMetadata);
  }

  public Node withPlacement(String newParentId, long newPosition) {
    return new Node(id, kind, content, newParentId, newPosition, metadata);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Node other)) return false;
    return position == other.position
        && id.equals(other.id)
        && kind.equals(other.kind)
        && Objects.equals(content, other.content)
        && Objects.equals(parentId, other.parentId)
        && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, kind, content, parentId, position, metadata);
  }

  @Override
  public String toString() {
    return "Node{" + kind + ":" + id + ", parent=" + parentId + ", pos=" + position + '}';
  }
}
