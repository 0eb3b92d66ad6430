// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// A candidate value plus the bookkeeping of the voting protocols. PBFT and Raft propose a whole [LedgerRecord] while
/// Paxos proposes the payload and builds the record once it is chosen.
///
/// @param number   Orders proposals. It must increase from one proposal to the next.
/// @param value    The proposed value.
/// @param accepted Whether a quorum accepted the proposal.
public record Proposal<V>(long number, V value, boolean accepted) {
  public Proposal {
    if (value == null) throw new IllegalArgumentException("value must not be null");
  }

  public static <V> Proposal<V> of(long number, V value) {
    return new Proposal<>(number, value, false);
  }

  public Proposal<V> accept() {
    return accepted ? this : new Proposal<>(number, value, true);
  }

  public boolean supersedes(Proposal<?> other) {
    return number > other.number();
  }
}
