// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// Thrown when a broadcast proposal did not collect enough approvals. The proposal is dropped and the ledger is
/// unchanged.
public class QuorumNotReachedException extends ConsensusException {
  private final int approvals;
  private final int total;
  private final ThresholdPolicy policy;

  public QuorumNotReachedException(int approvals, int total, ThresholdPolicy policy) {
    super(ErrorStrings.QUORUM_NOT_REACHED + approvals + "/" + total + " under " + policy);
    this.approvals = approvals;
    this.total = total;
    this.policy = policy;
  }

  public int approvals() {
    return approvals;
  }

  public int total() {
    return total;
  }

  public ThresholdPolicy policy() {
    return policy;
  }
}
