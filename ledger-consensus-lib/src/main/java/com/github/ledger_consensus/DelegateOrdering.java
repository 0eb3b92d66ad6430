// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// How a DPoS tally orders the delegates that received votes.
public enum DelegateOrdering {
  /// Shuffle the voted for delegates ignoring how many votes each received.
  SHUFFLE,
  /// Sort by descending vote count and only shuffle delegates that tie.
  BY_VOTES_SHUFFLE_TIES
}
