// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// The rule that decides whether a count of approvals out of a total is a quorum. Both use integer division.
public enum ThresholdPolicy {
  /// Strict majority `approvals > total / 2`. A tie on an even total fails. Used by Raft and Paxos.
  MAJORITY_OVER_HALF {
    @Override
    public boolean passes(int approvals, int total) {
      return approvals > total / 2;
    }
  },
  /// `approvals >= floor(2 * total / 3)`. Used by PBFT.
  TWO_THIRDS_OR_MORE {
    @Override
    public boolean passes(int approvals, int total) {
      return approvals >= (2L * total) / 3;
    }
  };

  public abstract boolean passes(int approvals, int total);
}
