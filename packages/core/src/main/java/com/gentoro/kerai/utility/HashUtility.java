package com.gentoro.kerai.utility;

import com.gentoro.kerai.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

/** Hashing helpers for content fingerprints and deterministic identifiers. */
public final class HashUtility {
  private HashUtility() {}

  public static byte[] sha256(byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 not available", e);
    }
  }

  /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code text}. */
  public static String sha256Hex(String text) {
    return HexFormat.of().formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
  }

  public static String sha256Base64(byte[] data) {
    return Base64.getEncoder().encodeToString(sha256(data));
  }

  /** Name-based UUID; the same parts always yield the same id. */
  public static String stableId(String... parts) {
    String joined = String.join("|", parts);
    return UUID.nameUUIDFromBytes(joined.getBytes(StandardCharsets.UTF_8)).toString();
  }
}
