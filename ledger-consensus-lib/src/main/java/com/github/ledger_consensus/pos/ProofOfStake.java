// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pos;

import com.github.ledger_consensus.AbstractStrategy;
import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.NoStakeException;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.RecordTag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Proof of Stake. A proposer is drawn with probability proportional to its stake and its record is appended
/// without a voting phase.
public class ProofOfStake extends AbstractStrategy<Validator> {
  public static final String NAME = "PoS";

  ProofOfStake(Ledger ledger, List<Validator> validators, ConsensusConfig config) {
    super(ledger, validators, config);
  }

  /// @param validators The validators in the fixed order the selection walks them. The genesis record is tagged
  ///                   with the first.
  /// @param stakes     The stake of each validator. A validator without an entry has no stake.
  public static ProofOfStake create(List<String> validators, Map<String, Integer> stakes, ConsensusConfig config) {
    if (validators.isEmpty()) throw new IllegalArgumentException("at least one validator is required");
    final var unknown = stakes.keySet().stream().filter(k -> !validators.contains(k)).toList();
    if (!unknown.isEmpty()) throw new IllegalArgumentException("stakes for unknown validators: " + unknown);
    final var participants = validators.stream()
        .map(v -> new Validator(new ParticipantId(v), stakes.getOrDefault(v, 0)))
        .toList();
    final var ledger = Ledger.create(config.clock(), new RecordTag.Proposer(participants.get(0).id()));
    return new ProofOfStake(ledger, participants, config);
  }

  @Override
  public String name() {
    return NAME;
  }

  public void assignStake(String validator, int stake) {
    participant(new ParticipantId(validator)).assignStake(stake);
  }

  public long totalStake() {
    return participants.stream().mapToLong(Validator::stake).sum();
  }

  /// The stake table in enumeration order.
  public Map<ParticipantId, Integer> stakes() {
    final var result = new LinkedHashMap<ParticipantId, Integer>();
    participants.forEach(v -> result.put(v.id(), v.stake()));
    return result;
  }

  /// Draws uniformly from `[0, totalStake)` and walks the validators accumulating stake until the running total
  /// exceeds the draw.
  ///
  /// @throws NoStakeException if the total stake is zero.
  public Validator selectProposer() {
    final var total = totalStake();
    if (total <= 0) {
      throw new NoStakeException();
    }
    final var pick = config.random().nextLong(total);
    long running = 0;
    for (var validator : participants) {
      running += validator.stake();
      if (running > pick) {
        LOGGER.finer(() -> "pick " + pick + " of " + total + " selected " + validator);
        return validator;
      }
    }
    // the running total reaches total which is greater than any pick
    throw new IllegalStateException("stake walk did not select a validator pick=" + pick + " total=" + total);
  }

  public LedgerRecord addRecord(String data) {
    return proposeAndCommit(data);
  }

  @Override
  public LedgerRecord proposeAndCommit(String data) {
    final var proposer = selectProposer();
    return commitToAll(nextRecord(data, new RecordTag.Proposer(proposer.id())));
  }
}
