// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// The base of the failures raised by the consensus core. None of them are retried by the library. A caller that sees
/// a dropped proposal must explicitly resubmit.
public class ConsensusException extends RuntimeException {
  public ConsensusException(String message) {
    super(message);
  }
}
