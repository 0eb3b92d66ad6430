// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// The stable identity of a participant. It must be unique within a network.
public record ParticipantId(String value) implements Comparable<ParticipantId> {
  public ParticipantId {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("participant id must not be blank");
    }
  }

  /// Numbered participants used by the PBFT, Raft and Paxos networks.
  public static ParticipantId ofIndex(int index) {
    if (index < 0) throw new IllegalArgumentException("index must be non-negative");
    return new ParticipantId("node-" + index);
  }

  @Override
  public int compareTo(ParticipantId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
