// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pbft;

import com.github.ledger_consensus.AbstractStrategy;
import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.QuorumEvaluator;
import com.github.ledger_consensus.QuorumNotReachedException;
import com.github.ledger_consensus.QuorumStrategy;
import com.github.ledger_consensus.ThresholdPolicy;
import com.github.ledger_consensus.Vote;

import java.util.List;
import java.util.stream.IntStream;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Practical Byzantine Fault Tolerance with a fixed primary. A proposal moves through
/// [PbftPhase#PRE_PREPARE], [PbftPhase#PREPARE] and [PbftPhase#COMMIT] in one synchronous step. The denominator of
/// the two thirds quorum is every participant including the primary.
///
/// Faulty replicas are not simulated. The configured number of withheld votes removes that many replicas, counted
/// from the end of the enumeration order, from the prepare phase.
public class PracticalByzantineFaultTolerance extends AbstractStrategy<PbftReplica> {
  public static final String NAME = "PBFT";

  private final QuorumEvaluator quorum;

  private PbftPhase phase = PbftPhase.COMMIT;

  PracticalByzantineFaultTolerance(Ledger ledger, List<PbftReplica> replicas, ConsensusConfig config) {
    super(ledger, replicas, config);
    if (replicas.isEmpty() || !replicas.get(0).isPrimary()) {
      throw new IllegalArgumentException("the first replica must be the primary");
    }
    if (replicas.stream().filter(PbftReplica::isPrimary).count() != 1) {
      throw new IllegalArgumentException("there must be exactly one primary");
    }
    this.quorum = new QuorumEvaluator(ThresholdPolicy.TWO_THIRDS_OR_MORE, replicas.size());
  }

  public static PracticalByzantineFaultTolerance create(int size, ConsensusConfig config) {
    if (size < 1) throw new IllegalArgumentException("size must be at least 1");
    final var replicas = IntStream.range(0, size)
        .mapToObj(i -> new PbftReplica(ParticipantId.ofIndex(i),
            i == 0 ? PbftReplica.PbftRole.PRIMARY : PbftReplica.PbftRole.REPLICA))
        .toList();
    return new PracticalByzantineFaultTolerance(Ledger.create(config.clock()), replicas, config);
  }

  @Override
  public String name() {
    return NAME;
  }

  public PbftReplica primary() {
    return participants.get(0);
  }

  /// The phase of the latest proposal.
  public PbftPhase phase() {
    return phase;
  }

  public QuorumEvaluator quorum() {
    return quorum;
  }

  /// Runs pre-prepare, prepare and commit for the data.
  ///
  /// @throws QuorumNotReachedException if fewer than two thirds of the participants verified the candidate. The
  ///                                   proposal is discarded and there is no view change or retry.
  public LedgerRecord runConsensusRound(String data) {
    moveTo(PbftPhase.PRE_PREPARE);
    final var proposal = primary().prePrepare(ledger, Ledger.timestamp(config.clock()), data);

    moveTo(PbftPhase.PREPARE);
    final var votes = prepare(proposal);

    moveTo(PbftPhase.COMMIT);
    if (quorum.assess(votes) == QuorumStrategy.QuorumOutcome.LOSE) {
      final var approvals = (int) QuorumStrategy.approvals(votes);
      throw new QuorumNotReachedException(approvals, quorum.total(), quorum.policy());
    }
    return commitToAll(proposal.accept().value());
  }

  List<Vote> prepare(Proposal<LedgerRecord> proposal) {
    final var withheld = Math.min(config.withheldVotes(), participants.size() - 1);
    final var voters = participants.subList(0, participants.size() - withheld);
    final var votes = voters.stream()
        .map(p -> p.vote(proposal.number(), proposal.value(), ledger))
        .toList();
    LOGGER.finer(() -> NAME + " prepare votes " + votes + " withheld " + withheld);
    return votes;
  }

  private void moveTo(PbftPhase next) {
    LOGGER.finer(() -> NAME + " " + phase + " -> " + next);
    phase = next;
  }

  @Override
  public LedgerRecord proposeAndCommit(String data) {
    return runConsensusRound(data);
  }
}
