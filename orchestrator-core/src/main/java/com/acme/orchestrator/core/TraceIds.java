package com.acme.orchestrator.core;

import java.security.SecureRandom;
import java.util.HexFormat;

/** Random identifiers sized like W3C trace and span ids. */
public final class TraceIds {
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  private TraceIds() {}

  /** 16 random bytes as 32 lowercase hex characters. */
  public static String generate() {
    return random(16);
  }

  /** 8 random bytes as 16 lowercase hex characters. */
  public static String generateSpanId() {
    return random(8);
  }

  private static String random(int size) {
    byte[] bytes = new byte[size];
    RANDOM.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }
}
