// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// The zero or one protocol specific annotation carried by a [LedgerRecord]. The tag takes part in the record hash so
/// changing it invalidates the record.
public sealed interface RecordTag permits RecordTag.Untagged, RecordTag.Proposer, RecordTag.Nonce {

  /// The text that is appended to the other record fields before hashing. Tagged kinds start with a distinct letter
  /// so that a proposer and a nonce with the same text never hash alike.
  String hashMaterial();

  /// Records of protocols that do not annotate them.
  record Untagged() implements RecordTag {
    public static final Untagged INSTANCE = new Untagged();

    @Override
    public String hashMaterial() {
      return "";
    }

    @Override
    public String toString() {
      return "-";
    }
  }

  /// The validator or delegate that produced the record (PoS and DPoS).
  record Proposer(ParticipantId id) implements RecordTag {
    public Proposer {
      if (id == null) throw new IllegalArgumentException("proposer id must not be null");
    }

    @Override
    public String hashMaterial() {
      return "P" + id.value();
    }

    @Override
    public String toString() {
      return "proposer=" + id;
    }
  }

  /// The work proof found by mining (PoW).
  record Nonce(long value) implements RecordTag {
    public Nonce {
      if (value < 0) throw new IllegalArgumentException("nonce must be non-negative");
    }

    @Override
    public String hashMaterial() {
      return "N" + value;
    }

    @Override
    public String toString() {
      return "nonce=" + value;
    }
  }
}
