// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.dpos;

import com.github.ledger_consensus.Participant;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Role;

/// A registered block producer. It remembers how many votes it received at the last tally.
public class Delegate extends Participant {
  public enum DelegateRole implements Role {DELEGATE}

  private int votesReceived = 0;

  public Delegate(ParticipantId id) {
    super(id);
  }

  @Override
  public Role role() {
    return DelegateRole.DELEGATE;
  }

  public int votesReceived() {
    return votesReceived;
  }

  void votesReceived(int votes) {
    this.votesReceived = votes;
  }
}
