// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/**
 * Progress is a participant's view of the shared ledger. Every participant independently commits each agreed record
 * and this tracks the highest index it has committed.
 *
 * @param participantId         The participant this progress belongs to. This is here to ensure we do not
 *                              accidentally use the wrong state.
 * @param highestCommittedIndex The highest ledger index this participant has committed. The genesis record is always
 *                              committed.
 */
public record Progress(ParticipantId participantId, long highestCommittedIndex) {

  public Progress {
    if (participantId == null) throw new IllegalArgumentException("participantId must not be null");
    if (highestCommittedIndex < 0) throw new IllegalArgumentException("highestCommittedIndex must be non-negative");
  }

  /**
   * A participant that has only seen the genesis record.
   *
   * @param participantId The participant.
   */
  public Progress(ParticipantId participantId) {
    this(participantId, 0L);
  }

  // Java may get withers so that we can retire this method.
  public Progress withHighestCommitted(long committedIndex) {
    if (committedIndex <= highestCommittedIndex) {
      return this;
    }
    return new Progress(participantId, committedIndex);
  }

  @Override
  public String toString() {
    return "P(" + participantId + ",c={" + highestCommittedIndex + "})";
  }
}
