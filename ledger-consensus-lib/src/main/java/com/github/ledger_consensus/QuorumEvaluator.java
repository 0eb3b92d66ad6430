// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.Collection;

/// Evaluates votes against a [ThresholdPolicy] over a fixed number of participants. Participants that did not vote
/// still count towards the total.
///
/// @param policy The threshold rule.
/// @param total  The number of participants in the network which is the denominator of the threshold.
public record QuorumEvaluator(ThresholdPolicy policy, int total) implements QuorumStrategy {
  public QuorumEvaluator {
    if (policy == null) throw new IllegalArgumentException("policy must not be null");
    if (total < 1) throw new IllegalArgumentException("total must be at least 1");
  }

  /// The pure threshold computation. No side effects and no retries.
  public static boolean reached(int approvals, int total, ThresholdPolicy policy) {
    if (approvals < 0 || total < 0) {
      throw new IllegalArgumentException("approvals=" + approvals + " total=" + total);
    }
    return policy.passes(approvals, total);
  }

  public boolean reached(int approvals) {
    return reached(approvals, total, policy);
  }

  @Override
  public QuorumOutcome assess(Collection<Vote> votes) {
    return reached((int) QuorumStrategy.approvals(votes)) ? QuorumOutcome.WIN : QuorumOutcome.LOSE;
  }

  /// Throws if the votes are not a quorum.
  public void require(Collection<Vote> votes) {
    final var approvals = (int) QuorumStrategy.approvals(votes);
    if (!reached(approvals)) {
      throw new QuorumNotReachedException(approvals, total, policy);
    }
  }
}
