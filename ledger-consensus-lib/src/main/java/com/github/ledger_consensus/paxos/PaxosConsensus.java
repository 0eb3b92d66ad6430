// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.paxos;

import com.github.ledger_consensus.AbstractStrategy;
import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.QuorumEvaluator;
import com.github.ledger_consensus.QuorumNotReachedException;
import com.github.ledger_consensus.QuorumStrategy;
import com.github.ledger_consensus.RecordTag;
import com.github.ledger_consensus.ThresholdPolicy;
import com.github.ledger_consensus.Vote;
import com.github.ledger_consensus.VotingMode;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Paxos with a single fixed proposer, the first node. Each round chooses the payload of the next ledger record.
///
/// In [VotingMode#SIMPLIFIED] mode the prepare/promise phase is collapsed: the proposer shares the proposal number
/// with the acceptors and an acceptor accepts a broadcast proposal only if it already knows its number. Proposal
/// numbers are chosen by the caller who is responsible for their uniqueness.
///
/// In [VotingMode#STRICT] mode a real prepare/promise round is run with [BallotNumber]s. Acceptors promise only a
/// strictly higher ballot and report any value they accepted for the slot. The proposer must then propose the value
/// accepted under the highest ballot instead of its own.
///
/// Both modes need a strict majority of all the nodes for every phase.
public class PaxosConsensus extends AbstractStrategy<PaxosNode> {
  public static final String NAME = "Paxos";

  private final QuorumEvaluator quorum;

  private long highestProposalNumber = 0;

  PaxosConsensus(Ledger ledger, List<PaxosNode> nodes, ConsensusConfig config) {
    super(ledger, nodes, config);
    this.quorum = new QuorumEvaluator(ThresholdPolicy.MAJORITY_OVER_HALF, nodes.size());
  }

  public static PaxosConsensus create(int size, ConsensusConfig config) {
    if (size < 1) throw new IllegalArgumentException("size must be at least 1");
    final var nodes = IntStream.range(0, size).mapToObj(PaxosNode::new).toList();
    return new PaxosConsensus(Ledger.create(config.clock()), nodes, config);
  }

  @Override
  public String name() {
    return NAME;
  }

  public PaxosNode proposer() {
    return participants.get(0);
  }

  /// The fixed proposer creates a proposal with the caller's number.
  public Proposal<String> propose(String data, long proposalNumber) {
    highestProposalNumber = Math.max(highestProposalNumber, proposalNumber);
    return proposer().propose(data, proposalNumber);
  }

  /// Collects the acceptance votes for the proposal from every node.
  ///
  /// @return true if a majority accepted.
  public boolean broadcast(Proposal<String> proposal) {
    final var votes = participants.stream()
        .map(n -> new Vote(n.id(), proposal.number(), n.accept(proposal)))
        .toList();
    LOGGER.finer(() -> NAME + " accept votes " + votes);
    return quorum.assess(votes) == QuorumStrategy.QuorumOutcome.WIN;
  }

  /// Every node learns the chosen value. A record carrying the data is built against the tip and committed.
  public LedgerRecord commit(Proposal<String> proposal) {
    final var record = commitToAll(nextRecord(proposal.value(), RecordTag.Untagged.INSTANCE));
    participants.forEach(n -> n.discardThrough(proposal));
    return record;
  }

  /// Runs a full round with the caller's proposal number.
  ///
  /// @throws QuorumNotReachedException if a majority did not promise or accept. The ledger is unchanged.
  public LedgerRecord runConsensusRound(String data, long proposalNumber) {
    return config.votingMode() == VotingMode.STRICT
        ? strictRound(data, proposalNumber)
        : simplifiedRound(data, proposalNumber);
  }

  /// Runs a round numbering the proposal one higher than any seen so far.
  @Override
  public LedgerRecord proposeAndCommit(String data) {
    return runConsensusRound(data, highestProposalNumber + 1);
  }

  private LedgerRecord simplifiedRound(String data, long proposalNumber) {
    final var proposal = propose(data, proposalNumber);
    participants.forEach(n -> n.learn(proposal));
    if (!broadcast(proposal)) {
      final var approvals = (int) participants.stream().filter(n -> n.knows(proposalNumber)).count();
      throw new QuorumNotReachedException(approvals, quorum.total(), quorum.policy());
    }
    return commit(proposal.accept());
  }

  private LedgerRecord strictRound(String data, long proposalNumber) {
    highestProposalNumber = Math.max(highestProposalNumber, proposalNumber);
    final var slot = ledger.tip().index() + 1;
    final var ballot = new BallotNumber(proposalNumber, proposer().index());

    // phase 1
    final var promises = participants.stream().map(n -> n.promise(slot, ballot)).toList();
    quorum.require(promises.stream().map(p -> new Vote(p.from(), proposalNumber, p.vote())).toList());

    // we must propose the value accepted under the highest ballot if there is one
    final Optional<Promise.Accepted> prior = promises.stream()
        .filter(Promise::vote)
        .flatMap(p -> p.highestAccepted().stream())
        .max(Comparator.comparing(Promise.Accepted::number));
    final var value = prior.map(a -> a.proposal().value()).orElse(data);
    prior.ifPresent(a -> LOGGER.fine(() -> NAME + " adopting previously accepted value at slot " + slot + ": " + a));
    final var proposal = proposer().propose(value, proposalNumber);

    // phase 2
    final var accepts = participants.stream()
        .map(n -> new Vote(n.id(), proposalNumber, n.accept(slot, ballot, proposal)))
        .toList();
    quorum.require(accepts);
    return commit(proposal.accept());
  }
}
