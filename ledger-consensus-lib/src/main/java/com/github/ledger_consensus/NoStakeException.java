// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// Thrown by a stake weighted selection when the total stake is zero. Fatal to that round only.
public class NoStakeException extends ConsensusException {
  public NoStakeException() {
    super(ErrorStrings.NO_STAKE);
  }
}
