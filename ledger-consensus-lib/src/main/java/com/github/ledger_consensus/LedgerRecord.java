// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.Optional;
import java.util.OptionalLong;

/// An immutable entry of the [Ledger]. The hash is a pure function of all the other fields so that any change to a
/// field is detected by [#hasValidHash()].
///
/// @param index        The position in the ledger. Strictly increasing from zero.
/// @param timestamp    An opaque ordering token taken when the record was built.
/// @param payload      The application data.
/// @param previousHash The hash of the record at `index - 1` or the empty string for the genesis record.
/// @param hash         The SHA-256 hex digest over the other fields.
/// @param tag          The protocol specific annotation.
public record LedgerRecord(
    long index,
    String timestamp,
    String payload,
    String previousHash,
    String hash,
    RecordTag tag
) {
  public static final String GENESIS_PAYLOAD = "Genesis Block";

  public LedgerRecord {
    if (index < 0) throw new IllegalArgumentException("index must be non-negative");
    if (timestamp == null) throw new IllegalArgumentException("timestamp must not be null");
    if (payload == null) throw new IllegalArgumentException("payload must not be null");
    if (previousHash == null) throw new IllegalArgumentException("previousHash must not be null");
    if (hash == null) throw new IllegalArgumentException("hash must not be null");
    if (tag == null) throw new IllegalArgumentException("tag must not be null");
  }

  /// Builds a record and computes its hash.
  public static LedgerRecord create(long index, String timestamp, String payload, String previousHash, RecordTag tag) {
    return new LedgerRecord(index, timestamp, payload, previousHash,
        hashOf(index, timestamp, payload, previousHash, tag), tag);
  }

  /// Builds the record that would follow `previous`.
  public static LedgerRecord next(LedgerRecord previous, String timestamp, String payload, RecordTag tag) {
    return create(previous.index() + 1, timestamp, payload, previous.hash(), tag);
  }

  static String hashOf(long index, String timestamp, String payload, String previousHash, RecordTag tag) {
    return Digests.sha256Hex(index + timestamp + payload + previousHash + tag.hashMaterial());
  }

  public String computeHash() {
    return hashOf(index, timestamp, payload, previousHash, tag);
  }

  public boolean hasValidHash() {
    return hash.equals(computeHash());
  }

  public boolean isGenesis() {
    return index == 0 && previousHash.isEmpty();
  }

  /// True if this record directly extends `previous` in the hash chain.
  public boolean follows(LedgerRecord previous) {
    return index == previous.index() + 1 && previousHash.equals(previous.hash());
  }

  /// A copy with a new work proof and a recomputed hash.
  public LedgerRecord withNonce(long nonce) {
    return create(index, timestamp, payload, previousHash, new RecordTag.Nonce(nonce));
  }

  public Optional<ParticipantId> proposer() {
    return tag instanceof RecordTag.Proposer p ? Optional.of(p.id()) : Optional.empty();
  }

  public OptionalLong nonce() {
    return tag instanceof RecordTag.Nonce n ? OptionalLong.of(n.value()) : OptionalLong.empty();
  }

  @Override
  public String toString() {
    return "R(i=" + index + ",p='" + payload + "',h=" + abbreviate(hash) + ",ph=" + abbreviate(previousHash)
        + "," + tag + ")";
  }

  private static String abbreviate(String hash) {
    return hash.length() > 8 ? hash.substring(0, 8) : hash;
  }
}
