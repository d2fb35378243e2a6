package com.gentoro.kerai.graph;

/** Well-known edge kinds. The vocabulary is open; these are the ones the pipeline emits. */
public final class EdgeKinds {
  public static final String DOCUMENTS = "documents";
  public static final String REFERENCES = "references";
  public static final String CALLS = "calls";
  public static final String SUGGESTS = "suggests";

  private EdgeKinds() {}
}
