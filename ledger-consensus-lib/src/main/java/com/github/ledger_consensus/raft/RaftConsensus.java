// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.raft;

import com.github.ledger_consensus.AbstractStrategy;
import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.ErrorStrings;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.QuorumEvaluator;
import com.github.ledger_consensus.QuorumStrategy;
import com.github.ledger_consensus.RecordTag;
import com.github.ledger_consensus.ThresholdPolicy;
import com.github.ledger_consensus.Vote;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Raft leader election and log replication over the shared ledger. Both the election and the replication of an
/// entry need a strict majority of all the nodes.
///
/// In the default [com.github.ledger_consensus.VotingMode#SIMPLIFIED] mode every node votes for any candidate, so
/// the real Raft safety properties around terms and log completeness are not enforced. The
/// [com.github.ledger_consensus.VotingMode#STRICT] mode enforces them.
public class RaftConsensus extends AbstractStrategy<RaftNode> {
  public static final String NAME = "Raft";

  private final QuorumEvaluator quorum;

  private RaftNode leader = null;

  RaftConsensus(Ledger ledger, List<RaftNode> nodes, ConsensusConfig config) {
    super(ledger, nodes, config);
    this.quorum = new QuorumEvaluator(ThresholdPolicy.MAJORITY_OVER_HALF, nodes.size());
    nodes.forEach(n -> n.attach(this));
  }

  public static RaftConsensus create(int size, ConsensusConfig config) {
    if (size < 1) throw new IllegalArgumentException("size must be at least 1");
    final var nodes = IntStream.range(0, size)
        .mapToObj(i -> new RaftNode(ParticipantId.ofIndex(i)))
        .toList();
    return new RaftConsensus(Ledger.create(config.clock()), nodes, config);
  }

  @Override
  public String name() {
    return NAME;
  }

  public Optional<RaftNode> leader() {
    return Optional.ofNullable(leader);
  }

  public RaftNode node(int index) {
    return participants.get(index);
  }

  /// Runs an election for the candidate.
  ///
  /// @return true if the candidate won a majority and is now the leader. Every other node is then a follower.
  public boolean requestVote(RaftNode candidate) {
    if (!participants.contains(candidate)) {
      throw new IllegalArgumentException(ErrorStrings.UNKNOWN_PARTICIPANT + candidate.id());
    }
    candidate.becomeCandidate();
    final var term = candidate.currentTerm();
    final var lastLogIndex = candidate.progress().highestCommittedIndex();
    final var votes = participants.stream()
        .map(n -> new Vote(n.id(), term,
            n == candidate || n.grantVote(candidate.id(), term, lastLogIndex, config.votingMode())))
        .toList();
    LOGGER.finer(() -> NAME + " election for " + candidate + " votes " + votes);

    if (leader != null && !leader.isLeader()) {
      // a strict mode election with a higher term makes the old leader step down
      leader = null;
    }
    if (quorum.assess(votes) == QuorumStrategy.QuorumOutcome.WIN) {
      participants.stream().filter(n -> n != candidate).forEach(n -> n.changeRole(RaftNode.RaftRole.FOLLOW));
      candidate.changeRole(RaftNode.RaftRole.LEAD);
      leader = candidate;
      LOGGER.info(() -> NAME + " leader elected: " + candidate);
      return true;
    }
    candidate.changeRole(RaftNode.RaftRole.FOLLOW);
    LOGGER.info(() -> NAME + " election lost by " + candidate + " with " + QuorumStrategy.approvals(votes)
        + "/" + quorum.total());
    return false;
  }

  /// The leader builds a record extending the tip, every node verifies it and on a majority every node commits it.
  ///
  /// @throws IllegalStateException if the node is not the leader.
  /// @throws com.github.ledger_consensus.QuorumNotReachedException if a majority did not accept the entry.
  LedgerRecord lead(RaftNode node, String data) {
    if (!node.isLeader()) {
      throw new IllegalStateException(ErrorStrings.NOT_LEADER + node.id());
    }
    final var candidate = nextRecord(data, RecordTag.Untagged.INSTANCE);
    final var proposal = Proposal.of(candidate.index(), candidate);
    final var votes = participants.stream()
        .map(n -> new Vote(n.id(), proposal.number(),
            n.acceptEntry(node, proposal.value(), ledger, config.votingMode())))
        .toList();
    quorum.require(votes);
    return commitToAll(proposal.accept().value());
  }

  /// Leads with the current leader electing the first node if there is none.
  @Override
  public LedgerRecord proposeAndCommit(String data) {
    if (leader == null && !requestVote(node(0))) {
      throw new IllegalStateException(ErrorStrings.NO_LEADER);
    }
    return leader.lead(data);
  }
}
