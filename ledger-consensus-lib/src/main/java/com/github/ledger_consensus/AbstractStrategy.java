// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.List;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// The record and chain scaffolding shared by the six protocols.
public abstract class AbstractStrategy<P extends Participant> implements ConsensusStrategy {
  protected final Ledger ledger;
  protected final List<P> participants;
  protected final ConsensusConfig config;

  protected AbstractStrategy(Ledger ledger, List<P> participants, ConsensusConfig config) {
    if (ledger == null) throw new IllegalArgumentException("ledger must not be null");
    if (participants == null) throw new IllegalArgumentException("participants must not be null");
    if (config == null) throw new IllegalArgumentException("config must not be null");
    final var distinct = participants.stream().map(Participant::id).distinct().count();
    if (distinct != participants.size()) {
      throw new IllegalArgumentException("participant ids must be unique: " + participants);
    }
    this.ledger = ledger;
    this.participants = List.copyOf(participants);
    this.config = config;
  }

  @Override
  public Ledger ledger() {
    return ledger;
  }

  @Override
  public List<P> participants() {
    return participants;
  }

  public ConsensusConfig config() {
    return config;
  }

  public P participant(ParticipantId id) {
    return participants.stream()
        .filter(p -> p.id().equals(id))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(ErrorStrings.UNKNOWN_PARTICIPANT + id));
  }

  /// Builds the record that extends the current tip.
  protected LedgerRecord nextRecord(String payload, RecordTag tag) {
    return LedgerRecord.next(ledger.tip(), Ledger.timestamp(config.clock()), payload, tag);
  }

  /// Appends to the shared ledger once and then lets every participant commit the record to its own view.
  protected LedgerRecord commitToAll(LedgerRecord record) {
    ledger.append(record);
    participants.forEach(p -> p.commit(record));
    LOGGER.log(config.logAtLevel(), () -> name() + " COMMITTED " + record);
    return record;
  }

  @Override
  public String toString() {
    return name() + "(participants=" + participants.size() + ",ledger=" + ledger.size() + ")";
  }
}
