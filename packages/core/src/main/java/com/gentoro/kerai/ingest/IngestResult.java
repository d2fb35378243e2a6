package com.gentoro.kerai.ingest;

/** Summary of one ingest. {@code operations} is zero when the text was already stored as is. */
public record IngestResult(
    String path,
    String rootId,
    String language,
    int nodes,
    int edges,
    int operations,
    int suggestionsEmitted) {

  public boolean changed() {
    return operations > 0;
  }
}
