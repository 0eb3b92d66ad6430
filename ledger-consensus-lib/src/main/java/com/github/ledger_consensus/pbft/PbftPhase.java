// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pbft;

/// The phases a PBFT proposal passes through. There is no view change.
public enum PbftPhase {
  /// The primary builds the candidate record.
  PRE_PREPARE,
  /// Each replica verifies the candidate and the verification is its vote.
  PREPARE,
  /// The votes are assessed and on a quorum every participant commits.
  COMMIT
}
