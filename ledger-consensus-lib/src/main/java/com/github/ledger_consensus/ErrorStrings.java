// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// Shared exception and log messages.
public final class ErrorStrings {
  public static final String PREVIOUS_HASH_MISMATCH = "Record previous hash does not match the ledger tip: ";
  public static final String NON_CONTIGUOUS_INDEX = "Record index is not contiguous with the ledger tip: ";
  public static final String INVALID_SELF_HASH = "Record hash does not recompute from its fields: ";
  public static final String EMPTY_LEDGER = "Ledger has no genesis record";
  public static final String NO_STAKE = "Total stake is zero so no proposer can be selected";
  public static final String QUORUM_NOT_REACHED = "Quorum not reached so the proposal was dropped: ";
  public static final String NOT_LEADER = "Only the leader may lead a round: ";
  public static final String NO_LEADER = "No participant is leading and none could be elected";
  public static final String NO_DELEGATES = "There are no delegates to select from";
  public static final String UNKNOWN_PARTICIPANT = "Unknown participant: ";
  public static final String INTERRUPTED = "Interrupted while waiting for the network mutex";

  private ErrorStrings() {
  }
}
