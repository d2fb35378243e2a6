package com.gentoro.kerai.crdt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.kerai.exception.SerializationException;
import java.util.Locale;

/** The six graph mutations. */
public enum OperationType {
  INSERT_NODE,
  MOVE_NODE,
  UPDATE_CONTENT,
  DELETE_NODE,
  ADD_EDGE,
  REMOVE_EDGE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static OperationType fromWire(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (RuntimeException e) {
      throw new SerializationException("Unknown operation type: " + value, e);
    }
  }

  public boolean targetsEdge() {
    return this == ADD_EDGE || this == REMOVE_EDGE;
  }
}
