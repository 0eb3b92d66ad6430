// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// How faithfully Raft elections and Paxos acceptance are simulated.
public enum VotingMode {
  /// Raft voters always grant their vote and Paxos acceptors accept any proposal number they already know. There are
  /// no terms, no log comparisons and no promises.
  SIMPLIFIED,
  /// Raft tracks monotonic terms, grants one vote per term and compares logs. Paxos runs a prepare/promise round with
  /// ballot numbers and the proposer adopts the highest previously accepted value.
  STRICT
}
