// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pbft;

import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.Participant;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.RecordTag;
import com.github.ledger_consensus.Role;

/// A PBFT participant. The first registered participant is the fixed primary.
public class PbftReplica extends Participant {
  public enum PbftRole implements Role {PRIMARY, REPLICA}

  private final PbftRole role;

  public PbftReplica(ParticipantId id, PbftRole role) {
    super(id);
    if (role == null) throw new IllegalArgumentException("role must not be null");
    this.role = role;
  }

  @Override
  public Role role() {
    return role;
  }

  public boolean isPrimary() {
    return role == PbftRole.PRIMARY;
  }

  /// The pre-prepare step: the primary builds a candidate record that extends its view of the ledger. The proposal is
  /// numbered with the sequence number of the record.
  public Proposal<LedgerRecord> prePrepare(Ledger view, String timestamp, String data) {
    if (!isPrimary()) {
      throw new IllegalStateException("only the primary may pre-prepare: " + id);
    }
    final var candidate = LedgerRecord.next(view.tip(), timestamp, data, RecordTag.Untagged.INSTANCE);
    return Proposal.of(candidate.index(), candidate);
  }
}
