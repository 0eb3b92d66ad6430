// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.paxos;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.LoggerConfig;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.QuorumNotReachedException;
import com.github.ledger_consensus.VotingMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PaxosTest {
  static {
    LoggerConfig.initialize();
  }

  final ConsensusConfig strict = ConsensusConfig.seeded(1).withVotingMode(VotingMode.STRICT);

  @Test
  public void roundsAppendInOrder() {
    final var paxos = PaxosConsensus.create(5, ConsensusConfig.seeded(1));

    paxos.runConsensusRound("d1", 1);
    paxos.runConsensusRound("d2", 2);

    assertThat(paxos.ledger().records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "d1", "d2");
    assertThat(paxos.ledger().isValid()).isTrue();
    assertThat(paxos.participants())
        .allSatisfy(n -> {
          assertThat(n.progress().highestCommittedIndex()).isEqualTo(2L);
          assertThat(n.proposals()).isEmpty();
        });
  }

  @Test
  public void onlyTheFirstNodeProposes() {
    final var paxos = PaxosConsensus.create(3, ConsensusConfig.seeded(1));

    assertThat(paxos.proposer().role()).isEqualTo(PaxosNode.PaxosRole.PROPOSER);
    assertThat(paxos.participants().subList(1, 3))
        .allSatisfy(n -> assertThat(n.role()).isEqualTo(PaxosNode.PaxosRole.ACCEPTOR));
  }

  @Test
  public void broadcastOfAnUnsharedNumberIsRefused() {
    final var paxos = PaxosConsensus.create(5, ConsensusConfig.seeded(1));

    final var proposal = paxos.propose("secret", 99);

    assertThat(paxos.broadcast(proposal)).isFalse();
    assertThat(paxos.ledger().size()).isEqualTo(1);
  }

  @Test
  public void proposeAndCommitNumbersAboveTheHighestSeen() {
    final var paxos = PaxosConsensus.create(3, ConsensusConfig.seeded(1));

    paxos.runConsensusRound("first", 10);
    paxos.proposeAndCommit("second");

    assertThat(paxos.ledger().tip().payload()).isEqualTo("second");
    assertThat(paxos.ledger().size()).isEqualTo(3);
  }

  @Test
  public void acceptorOnlyAcceptsAKnownNumber() {
    final var node = new PaxosNode(1);
    final var proposal = Proposal.of(3, "v");

    assertThat(node.accept(proposal)).isFalse();
    node.learn(proposal);
    assertThat(node.accept(proposal)).isTrue();
    assertThat(node.proposals()).containsExactly(proposal.accept());
  }

  @Test
  public void strictRoundsAppendInOrder() {
    final var paxos = PaxosConsensus.create(5, strict);

    paxos.runConsensusRound("d1", 1);
    paxos.runConsensusRound("d2", 2);

    assertThat(paxos.ledger().records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "d1", "d2");
    assertThat(paxos.participants())
        .allSatisfy(n -> assertThat(n.highestPromised()).isEqualTo(new BallotNumber(2, 0)));
  }

  @Test
  public void strictReusedBallotIsRefused() {
    final var paxos = PaxosConsensus.create(5, strict);
    paxos.runConsensusRound("d1", 1);

    assertThatThrownBy(() -> paxos.runConsensusRound("d2", 1))
        .isInstanceOf(QuorumNotReachedException.class);
    assertThat(paxos.ledger().size()).isEqualTo(2);
  }

  @Test
  public void promiseReportsTheAcceptedValue() {
    final var node = new PaxosNode(2);
    final var low = new BallotNumber(1, 0);
    final var high = new BallotNumber(2, 1);

    assertThat(node.promise(1, low).vote()).isTrue();
    assertThat(node.accept(1, low, Proposal.of(1, "chosen"))).isTrue();

    final var promise = node.promise(1, high);
    assertThat(promise.vote()).isTrue();
    assertThat(promise.highestAccepted()).hasValueSatisfying(a -> {
      assertThat(a.number()).isEqualTo(low);
      assertThat(a.proposal().value()).isEqualTo("chosen");
    });

    assertThat(node.promise(1, high).vote()).isFalse();
    assertThat(node.promise(1, low).vote()).isFalse();
    assertThat(node.accept(1, low, Proposal.of(1, "late"))).isFalse();
  }

  @Test
  public void strictProposerAdoptsAPreviouslyAcceptedValue() {
    final var paxos = PaxosConsensus.create(3, strict);
    final var slot = paxos.ledger().tip().index() + 1;
    final var earlier = new BallotNumber(1, 2);
    // a majority accepted a value at the next slot under an earlier ballot which was never committed
    paxos.participants().subList(1, 3).forEach(n -> {
      n.promise(slot, earlier);
      n.accept(slot, earlier, Proposal.of(1, "already chosen"));
    });

    paxos.runConsensusRound("mine", 5);

    assertThat(paxos.ledger().tip().payload()).isEqualTo("already chosen");
    assertThat(paxos.participants()).allSatisfy(n -> assertThat(n.accepted(slot)).isEmpty());
  }

  @Test
  public void ballotNumbersOrderByCounterThenProposer() {
    assertThat(new BallotNumber(1, 5).lessThan(new BallotNumber(2, 0))).isTrue();
    assertThat(new BallotNumber(2, 0).lessThan(new BallotNumber(2, 1))).isTrue();
    assertThat(new BallotNumber(2, 1).greaterThan(BallotNumber.MIN)).isTrue();
    assertThat(new BallotNumber(3, 3).lessThanOrEqualTo(new BallotNumber(3, 3))).isTrue();
  }
}
