// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/// SHA-256 hashing of record contents rendered as lower case hex.
public final class Digests {
  public static final String ALGORITHM = "SHA-256";

  static final HexFormat HEX_FORMAT = HexFormat.of();

  private Digests() {
  }

  public static String sha256Hex(String text) {
    return HEX_FORMAT.formatHex(messageDigest().digest(text.getBytes(StandardCharsets.UTF_8)));
  }

  static MessageDigest messageDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      // every JVM is required to ship SHA-256
      throw new IllegalStateException("Failed to initialize MessageDigest for " + ALGORITHM, e);
    }
  }
}
