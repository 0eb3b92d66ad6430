// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

public class EmptyLedgerException extends ConsensusException {
  public EmptyLedgerException() {
    super(ErrorStrings.EMPTY_LEDGER);
  }
}
