// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.Collection;

/// The interface to provide a strategy for determining whether a quorum has been reached. Every round in this library
/// is synchronous so all the votes are in by the time they are assessed and the outcome is either a win or a loss.
public interface QuorumStrategy {
  QuorumOutcome assess(Collection<Vote> votes);

  enum QuorumOutcome {
    WIN, LOSE
  }

  static long approvals(Collection<Vote> votes) {
    return votes.stream().filter(Vote::vote).count();
  }
}
