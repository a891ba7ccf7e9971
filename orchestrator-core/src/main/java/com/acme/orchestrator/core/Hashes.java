package com.acme.orchestrator.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/** SHA-256 fingerprints for payloads and error grouping. */
public final class Hashes {
  private static final HexFormat HEX = HexFormat.of();

  /** Error hashes keep only the first 8 bytes of the digest. */
  private static final int ERROR_HASH_BYTES = 8;

  private Hashes() {}

  /** Hex SHA-256 of the given bytes. A null array hashes like an empty one. */
  public static String hashData(byte[] data) {
    return HEX.formatHex(sha256(data == null ? new byte[0] : data));
  }

  /**
   * Grouping hash for an error message. Only the text before the first {@code ':'} is hashed, so
   * {@code "PAYMENT_FAILED: timeout"} and {@code "PAYMENT_FAILED: network_error"} share a hash.
   *
   * @return 16 lowercase hex characters, or an empty string for an empty message
   */
  public static String hashError(String message) {
    if (message == null || message.isEmpty()) {
      return "";
    }
    int colon = message.indexOf(':');
    String errorType = colon >= 0 ? message.substring(0, colon) : message;
    byte[] digest = sha256(errorType.getBytes(StandardCharsets.UTF_8));
    return HEX.formatHex(Arrays.copyOf(digest, ERROR_HASH_BYTES));
  }

  private static byte[] sha256(byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
