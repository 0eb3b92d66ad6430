// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.dpos;

import com.github.ledger_consensus.AbstractStrategy;
import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.DelegateOrdering;
import com.github.ledger_consensus.ErrorStrings;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.RecordTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Delegated Proof of Stake. Voters elect delegates and a delegate picked uniformly at random from the current order
/// produces each record which is appended without a further vote.
///
/// Votes are not validated: a voter may vote for a name that is not a registered delegate and that name will be in
/// the order after the next tally.
public class DelegatedProofOfStake extends AbstractStrategy<Delegate> {
  public static final String NAME = "DPoS";

  /// The current producer order. Replaced by each tally.
  private final List<ParticipantId> delegateOrder;

  /// voter to delegate; the last vote of a voter wins
  private final Map<ParticipantId, ParticipantId> votes = new LinkedHashMap<>();

  DelegatedProofOfStake(Ledger ledger, List<Delegate> delegates, Map<String, String> initialVotes,
                        ConsensusConfig config) {
    super(ledger, delegates, config);
    this.delegateOrder = new ArrayList<>(delegates.stream().map(Delegate::id).toList());
    initialVotes.forEach((voter, delegate) -> votes.put(new ParticipantId(voter), new ParticipantId(delegate)));
  }

  /// @param delegates The initial delegate order. The genesis record is tagged with the first.
  /// @param votes     Initial voter to delegate choices.
  public static DelegatedProofOfStake create(List<String> delegates, Map<String, String> votes,
                                             ConsensusConfig config) {
    if (delegates.isEmpty()) throw new IllegalArgumentException("at least one delegate is required");
    final var participants = delegates.stream().map(d -> new Delegate(new ParticipantId(d))).toList();
    final var ledger = Ledger.create(config.clock(), new RecordTag.Proposer(participants.get(0).id()));
    return new DelegatedProofOfStake(ledger, participants, votes, config);
  }

  @Override
  public String name() {
    return NAME;
  }

  /// Records a vote overwriting any earlier vote by the same voter.
  public void vote(String voter, String delegate) {
    final var voterId = new ParticipantId(voter);
    final var delegateId = new ParticipantId(delegate);
    final var prior = votes.put(voterId, delegateId);
    LOGGER.finer(() -> voter + " votes for " + delegate + (prior == null ? "" : " replacing " + prior));
  }

  public Map<ParticipantId, ParticipantId> votes() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(votes));
  }

  public List<ParticipantId> delegates() {
    return List.copyOf(delegateOrder);
  }

  /// Counts the votes per delegate and replaces the delegate order with the delegates that received votes ordered
  /// according to the configured [DelegateOrdering].
  ///
  /// @return The vote count of every voted for delegate.
  public Map<ParticipantId, Integer> tallyVotes() {
    final var counts = new LinkedHashMap<ParticipantId, Integer>();
    votes.values().forEach(d -> counts.merge(d, 1, Integer::sum));

    participants.forEach(d -> d.votesReceived(counts.getOrDefault(d.id(), 0)));

    final var ordered = new ArrayList<>(counts.keySet());
    shuffle(ordered, config.random());
    if (config.delegateOrdering() == DelegateOrdering.BY_VOTES_SHUFFLE_TIES) {
      // the sort is stable so ties keep their shuffled order
      ordered.sort((a, b) -> Integer.compare(counts.get(b), counts.get(a)));
    }
    delegateOrder.clear();
    delegateOrder.addAll(ordered);
    LOGGER.fine(() -> "tally " + counts + " delegate order " + delegateOrder);
    return Collections.unmodifiableMap(counts);
  }

  /// Picks a delegate uniformly at random from the current order.
  public ParticipantId selectDelegate() {
    if (delegateOrder.isEmpty()) {
      throw new IllegalStateException(ErrorStrings.NO_DELEGATES);
    }
    return delegateOrder.get(config.random().nextInt(delegateOrder.size()));
  }

  public LedgerRecord addRecord(String data) {
    return proposeAndCommit(data);
  }

  @Override
  public LedgerRecord proposeAndCommit(String data) {
    final var delegate = selectDelegate();
    return commitToAll(nextRecord(data, new RecordTag.Proposer(delegate)));
  }

  /// Fisher-Yates using the configured generator.
  static <T> void shuffle(List<T> list, RandomGenerator random) {
    for (int i = list.size() - 1; i > 0; i--) {
      Collections.swap(list, i, random.nextInt(i + 1));
    }
  }
}
