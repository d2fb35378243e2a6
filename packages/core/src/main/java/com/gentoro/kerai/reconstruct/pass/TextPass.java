package com.gentoro.kerai.reconstruct.pass;

/** A purely textual rewrite of one node's emitted text. Never touches the graph. */
@FunctionalInterface
public interface TextPass {
  String apply(String text);
}
