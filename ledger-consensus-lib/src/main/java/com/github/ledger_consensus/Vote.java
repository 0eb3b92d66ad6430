// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// Participants vote on whether a proposal may be committed. This object tracks such votes.
public record Vote(ParticipantId from, long number, boolean vote) {
  public Vote {
    if (from == null) throw new IllegalArgumentException("from must not be null");
  }
}
