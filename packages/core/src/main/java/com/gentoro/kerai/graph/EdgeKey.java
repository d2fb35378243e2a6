package com.gentoro.kerai.graph;

/** Identity of an edge. */
public record EdgeKey(String kind, String sourceId, String targetId) {}
