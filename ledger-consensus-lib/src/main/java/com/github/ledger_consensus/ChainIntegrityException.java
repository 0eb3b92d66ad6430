// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// Thrown when an append would break the hash chain. The ledger is left exactly as it was.
public class ChainIntegrityException extends ConsensusException {
  public ChainIntegrityException(String message) {
    super(message);
  }
}
