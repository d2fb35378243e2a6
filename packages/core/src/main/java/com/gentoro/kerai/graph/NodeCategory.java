package com.gentoro.kerai.graph;

/** How the pipeline treats a node kind. */
public enum NodeCategory {
  /** Root of one ingested file. */
  FILE,
  /** Code unit; its content is emitted verbatim, through the enabled passes. */
  STRUCTURAL,
  /** Free-floating comment group, emitted according to its placement. */
  COMMENT,
  /** Synthesized annotation that never appears as text of its own. */
  ANNOTATION
}
