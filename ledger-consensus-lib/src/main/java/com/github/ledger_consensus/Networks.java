// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import com.github.ledger_consensus.dpos.DelegatedProofOfStake;
import com.github.ledger_consensus.paxos.PaxosConsensus;
import com.github.ledger_consensus.pbft.PracticalByzantineFaultTolerance;
import com.github.ledger_consensus.pos.ProofOfStake;
import com.github.ledger_consensus.pow.ProofOfWork;
import com.github.ledger_consensus.raft.RaftConsensus;

import java.util.List;
import java.util.Map;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Builds a [Network] for each of the six protocols. Every network starts with a ledger holding only its genesis
/// record. The overloads without a [ConsensusConfig] use [ConsensusConfig#defaults()].
public final class Networks {
  private Networks() {
  }

  public static Network<ProofOfWork> proofOfWork() {
    return proofOfWork(ConsensusConfig.defaults());
  }

  public static Network<ProofOfWork> proofOfWork(ConsensusConfig config) {
    return created(ProofOfWork.create(config));
  }

  public static Network<ProofOfStake> proofOfStake(List<String> validators, Map<String, Integer> stakes) {
    return proofOfStake(validators, stakes, ConsensusConfig.defaults());
  }

  public static Network<ProofOfStake> proofOfStake(List<String> validators, Map<String, Integer> stakes,
                                                   ConsensusConfig config) {
    return created(ProofOfStake.create(validators, stakes, config));
  }

  public static Network<DelegatedProofOfStake> delegatedProofOfStake(List<String> delegates,
                                                                     Map<String, String> votes) {
    return delegatedProofOfStake(delegates, votes, ConsensusConfig.defaults());
  }

  public static Network<DelegatedProofOfStake> delegatedProofOfStake(List<String> delegates,
                                                                     Map<String, String> votes,
                                                                     ConsensusConfig config) {
    return created(DelegatedProofOfStake.create(delegates, votes, config));
  }

  public static Network<PracticalByzantineFaultTolerance> pbft(int size) {
    return pbft(size, ConsensusConfig.defaults());
  }

  public static Network<PracticalByzantineFaultTolerance> pbft(int size, ConsensusConfig config) {
    return created(PracticalByzantineFaultTolerance.create(size, config));
  }

  public static Network<RaftConsensus> raft(int size) {
    return raft(size, ConsensusConfig.defaults());
  }

  public static Network<RaftConsensus> raft(int size, ConsensusConfig config) {
    return created(RaftConsensus.create(size, config));
  }

  public static Network<PaxosConsensus> paxos(int size) {
    return paxos(size, ConsensusConfig.defaults());
  }

  public static Network<PaxosConsensus> paxos(int size, ConsensusConfig config) {
    return created(PaxosConsensus.create(size, config));
  }

  private static <S extends ConsensusStrategy> Network<S> created(S strategy) {
    LOGGER.fine(() -> "Created network " + strategy);
    return new Network<>(strategy);
  }
}
