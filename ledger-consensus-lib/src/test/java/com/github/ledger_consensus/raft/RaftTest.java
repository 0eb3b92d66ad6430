// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.raft;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.LoggerConfig;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.QuorumNotReachedException;
import com.github.ledger_consensus.VotingMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RaftTest {
  static {
    LoggerConfig.initialize();
  }

  final ConsensusConfig strict = ConsensusConfig.seeded(1).withVotingMode(VotingMode.STRICT);

  @Test
  public void electedLeaderReplicatesRecords() {
    final var raft = RaftConsensus.create(5, ConsensusConfig.seeded(1));
    final var node0 = raft.node(0);

    assertThat(node0.requestVote()).isTrue();
    node0.lead("block1");
    node0.lead("block2");

    assertThat(raft.ledger().records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "block1", "block2");
    assertThat(raft.ledger().tip().payload()).isEqualTo("block2");
    assertThat(raft.leader()).containsSame(node0);
    assertThat(raft.participants()).filteredOn(RaftNode::isLeader).containsExactly(node0);
    assertThat(raft.participants())
        .allSatisfy(n -> assertThat(n.progress().highestCommittedIndex()).isEqualTo(2L));
  }

  @Test
  public void electionMakesEveryOtherNodeAFollower() {
    final var raft = RaftConsensus.create(3, ConsensusConfig.seeded(1));

    raft.node(0).requestVote();
    raft.node(2).requestVote();

    assertThat(raft.node(2).role()).isEqualTo(RaftNode.RaftRole.LEAD);
    assertThat(raft.node(0).role()).isEqualTo(RaftNode.RaftRole.FOLLOW);
    assertThat(raft.node(1).role()).isEqualTo(RaftNode.RaftRole.FOLLOW);
    assertThat(raft.node(2).currentTerm()).isEqualTo(1L);
  }

  @Test
  public void nonLeaderCannotLead() {
    final var raft = RaftConsensus.create(3, ConsensusConfig.seeded(1));
    raft.node(0).requestVote();

    assertThatThrownBy(() -> raft.node(1).lead("x")).isInstanceOf(IllegalStateException.class);
    assertThat(raft.ledger().size()).isEqualTo(1);
  }

  @Test
  public void proposeAndCommitElectsTheFirstNodeWhenLeaderless() {
    final var raft = RaftConsensus.create(3, ConsensusConfig.seeded(1));

    raft.proposeAndCommit("auto");

    assertThat(raft.leader()).containsSame(raft.node(0));
    assertThat(raft.ledger().tip().payload()).isEqualTo("auto");
  }

  @Test
  public void strictModeRefusesASecondCandidateInTheSameTerm() {
    final var raft = RaftConsensus.create(5, strict);
    assertThat(raft.node(0).requestVote()).isTrue();

    final var rival = raft.node(1);
    rival.setTerm(0);

    assertThat(rival.requestVote()).isFalse();
    assertThat(rival.role()).isEqualTo(RaftNode.RaftRole.FOLLOW);
    assertThat(raft.leader()).containsSame(raft.node(0));
  }

  @Test
  public void strictModeHigherTermTakesOverLeadership() {
    final var raft = RaftConsensus.create(3, strict);
    raft.node(0).requestVote();
    raft.node(0).lead("one");

    assertThat(raft.node(1).requestVote()).isTrue();

    assertThat(raft.node(0).isLeader()).isFalse();
    assertThat(raft.leader()).containsSame(raft.node(1));
    raft.node(1).lead("two");
    assertThat(raft.ledger().records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "one", "two");
  }

  @Test
  public void strictModeStaleLeaderCannotReplicate() {
    final var raft = RaftConsensus.create(3, strict);
    raft.node(0).requestVote();
    raft.node(1).setTerm(5);
    raft.node(2).setTerm(5);

    assertThatThrownBy(() -> raft.node(0).lead("stale"))
        .isInstanceOf(QuorumNotReachedException.class);
    assertThat(raft.ledger().size()).isEqualTo(1);
  }

  @Test
  public void simplifiedModeGrantsEveryVote() {
    final var node = new RaftNode(ParticipantId.ofIndex(9));
    node.setTerm(10);

    assertThat(node.grantVote(ParticipantId.ofIndex(1), 1, 0, VotingMode.SIMPLIFIED))
        .isTrue();
    assertThat(node.grantVote(ParticipantId.ofIndex(1), 1, 0, VotingMode.STRICT))
        .isFalse();
  }
}
