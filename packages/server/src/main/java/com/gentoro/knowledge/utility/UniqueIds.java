package com.gentoro.knowledge.utility;

import com.gentoro.knowledge.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Deterministic, salted identifiers derived from strings. */
public final class UniqueIds {
  private UniqueIds() {}

  /**
   * Hex-encoded SHA-256 of {@code salt + ":" + value}, truncated to {@code numChars} characters
   * (at most 64).
   */
  public static String fromString(String value, int numChars, String salt) {
    if (numChars <= 0 || numChars > 64) {
      throw new IllegalArgumentException("numChars must be within 1..64: " + numChars);
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest((salt + ":" + value).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, numChars);
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 is not available", e);
    }
  }
}
