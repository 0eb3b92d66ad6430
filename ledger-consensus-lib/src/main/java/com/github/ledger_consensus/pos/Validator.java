// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pos;

import com.github.ledger_consensus.Participant;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Role;

/// A participant whose chance of proposing is its share of the total stake.
public class Validator extends Participant {
  public enum ValidatorRole implements Role {VALIDATOR}

  private int stake;

  public Validator(ParticipantId id, int stake) {
    super(id);
    assignStake(stake);
  }

  @Override
  public Role role() {
    return ValidatorRole.VALIDATOR;
  }

  public int stake() {
    return stake;
  }

  void assignStake(int stake) {
    if (stake < 0) throw new IllegalArgumentException("stake must be non-negative: " + stake);
    this.stake = stake;
  }

  @Override
  public String toString() {
    return "Validator(" + id + ",stake=" + stake + ")";
  }
}
