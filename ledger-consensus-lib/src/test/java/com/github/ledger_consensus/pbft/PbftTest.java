// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pbft;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.LoggerConfig;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.QuorumNotReachedException;
import com.github.ledger_consensus.RecordTag;
import com.github.ledger_consensus.ThresholdPolicy;
import com.github.ledger_consensus.Vote;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PbftTest {
  static {
    LoggerConfig.initialize();
  }

  @Test
  public void fiveReplicasCommitTwoRecords() {
    final var pbft = PracticalByzantineFaultTolerance.create(5, ConsensusConfig.seeded(1));

    pbft.runConsensusRound("tx1");
    pbft.runConsensusRound("tx2");

    assertThat(pbft.ledger().records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "tx1", "tx2");
    assertThat(pbft.ledger().isValid()).isTrue();
    assertThat(pbft.phase()).isEqualTo(PbftPhase.COMMIT);
    assertThat(pbft.participants())
        .allSatisfy(r -> assertThat(r.progress().highestCommittedIndex()).isEqualTo(2L));
  }

  @Test
  public void primaryIsTheFirstReplica() {
    final var pbft = PracticalByzantineFaultTolerance.create(4, ConsensusConfig.seeded(1));

    assertThat(pbft.primary().id()).isEqualTo(ParticipantId.ofIndex(0));
    assertThat(pbft.participants()).filteredOn(PbftReplica::isPrimary).hasSize(1);
    assertThat(pbft.quorum().policy()).isEqualTo(ThresholdPolicy.TWO_THIRDS_OR_MORE);
  }

  @Test
  public void twoWithheldVotesOfFiveStillCommit() {
    final var pbft = PracticalByzantineFaultTolerance.create(5, ConsensusConfig.seeded(1).withWithheldVotes(2));

    pbft.runConsensusRound("tx");

    assertThat(pbft.ledger().size()).isEqualTo(2);
  }

  @Test
  public void threeWithheldVotesOfFiveDropTheProposal() {
    final var pbft = PracticalByzantineFaultTolerance.create(5, ConsensusConfig.seeded(1).withWithheldVotes(3));

    assertThatThrownBy(() -> pbft.runConsensusRound("tx"))
        .isInstanceOfSatisfying(QuorumNotReachedException.class, e -> {
          assertThat(e.approvals()).isEqualTo(2);
          assertThat(e.total()).isEqualTo(5);
        });
    assertThat(pbft.ledger().size()).isEqualTo(1);
    assertThat(pbft.participants())
        .allSatisfy(r -> assertThat(r.progress().highestCommittedIndex()).isZero());
  }

  @Test
  public void replicasRefuseACandidateThatDoesNotExtendTheTip() {
    final var pbft = PracticalByzantineFaultTolerance.create(4, ConsensusConfig.seeded(1));
    final var stale = LedgerRecord.create(1, "t", "forged", "not-the-tip", RecordTag.Untagged.INSTANCE);

    final var votes = pbft.prepare(Proposal.of(1, stale));

    assertThat(votes).hasSize(4).noneMatch(Vote::vote);
  }

  @Test
  public void onlyThePrimaryMayPrePrepare() {
    final var pbft = PracticalByzantineFaultTolerance.create(3, ConsensusConfig.seeded(1));
    final var replica = pbft.participants().get(1);

    assertThatThrownBy(() -> replica.prePrepare(pbft.ledger(), "t", "x"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void singleReplicaCommitsAlone() {
    final var pbft = PracticalByzantineFaultTolerance.create(1, ConsensusConfig.seeded(1).withWithheldVotes(5));

    pbft.runConsensusRound("solo");

    assertThat(pbft.ledger().tip().payload()).isEqualTo("solo");
  }
}
