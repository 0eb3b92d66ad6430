// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.Objects;

/// An actor in a consensus protocol. Participants are created when their [Network] is built and live as long as it.
/// Subclasses hold the role specific state of their protocol such as stake, votes, terms or known proposals.
///
/// This class is not thread safe. The [Network] runs one round at a time.
public abstract class Participant {
  protected final ParticipantId id;

  protected Progress progress;

  protected Participant(ParticipantId id) {
    this.id = Objects.requireNonNull(id, "id");
    this.progress = new Progress(id);
  }

  public ParticipantId id() {
    return id;
  }

  public abstract Role role();

  public Progress progress() {
    return progress;
  }

  /// Checks that a candidate extends the tip of this participant's view of the ledger and that its hash recomputes.
  /// Where a protocol has an implicit vote this check is the vote.
  public boolean verify(LedgerRecord candidate, Ledger view) {
    return candidate.follows(view.tip()) && candidate.hasValidHash();
  }

  public Vote vote(long number, LedgerRecord candidate, Ledger view) {
    return new Vote(id, number, verify(candidate, view));
  }

  /// Learns that a record has been committed.
  public void commit(LedgerRecord record) {
    progress = progress.withHighestCommitted(record.index());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + id + "," + role().name() + ")";
  }
}
