package com.gentoro.kerai.comment;

import java.util.Locale;

public enum CommentStyle {
  LINE,
  BLOCK;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
