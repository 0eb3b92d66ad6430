// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.raft;

import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.Participant;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Role;
import com.github.ledger_consensus.VotingMode;
import org.jetbrains.annotations.TestOnly;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// A Raft participant. Every node starts as a follower. A node becomes a candidate when it asks for votes and the
/// leader when a majority grant them. Leadership never expires as there are no heartbeats or timeouts.
public class RaftNode extends Participant {
  public enum RaftRole implements Role {FOLLOW, CANDIDATE, LEAD}

  private RaftConsensus raft;

  RaftRole role = RaftRole.FOLLOW;

  long currentTerm = 0;

  /// The candidate this node voted for in the current term or null.
  ParticipantId votedFor = null;

  RaftNode(ParticipantId id) {
    super(id);
  }

  void attach(RaftConsensus raft) {
    if (this.raft != null && this.raft != raft) {
      throw new IllegalStateException(id + " already belongs to another network");
    }
    this.raft = raft;
  }

  @Override
  public Role role() {
    return role;
  }

  public boolean isLeader() {
    return role == RaftRole.LEAD;
  }

  public long currentTerm() {
    return currentTerm;
  }

  /// Asks every node for its vote.
  ///
  /// @return true if this node became the leader.
  public boolean requestVote() {
    return raft.requestVote(this);
  }

  /// Proposes a record for the data to the other nodes. Only the leader may lead.
  ///
  /// @throws IllegalStateException if this node is not the leader.
  public LedgerRecord lead(String data) {
    return raft.lead(this, data);
  }

  void becomeCandidate() {
    currentTerm++;
    votedFor = id;
    changeRole(RaftRole.CANDIDATE);
  }

  void changeRole(RaftRole next) {
    if (role != next) {
      final var prior = role;
      role = next;
      LOGGER.fine(() -> "Node has changed role: " + id + " " + prior + " -> " + next + " term=" + currentTerm);
    }
  }

  /// Decides whether to vote for a candidate. In [VotingMode#SIMPLIFIED] the vote is always granted. In
  /// [VotingMode#STRICT] a node refuses a stale term, votes at most once per term and refuses a candidate whose log
  /// is behind its own.
  boolean grantVote(ParticipantId candidate, long term, long lastLogIndex, VotingMode mode) {
    if (mode == VotingMode.SIMPLIFIED) {
      return true;
    }
    if (term < currentTerm) {
      return false;
    }
    if (term > currentTerm) {
      currentTerm = term;
      votedFor = null;
      changeRole(RaftRole.FOLLOW);
    }
    if (votedFor != null && !votedFor.equals(candidate)) {
      return false;
    }
    if (lastLogIndex < progress.highestCommittedIndex()) {
      return false;
    }
    votedFor = candidate;
    return true;
  }

  /// Decides whether to accept an entry from the leader. The entry must extend the tip and hash correctly. In
  /// [VotingMode#STRICT] the leader's term must also not be stale.
  boolean acceptEntry(RaftNode leader, LedgerRecord candidate, Ledger view, VotingMode mode) {
    if (mode == VotingMode.STRICT && leader.currentTerm < currentTerm) {
      return false;
    }
    return verify(candidate, view);
  }

  @TestOnly
  void setTerm(long term) {
    this.currentTerm = term;
  }

  @Override
  public String toString() {
    return "RaftNode(" + id + "," + role + ",t=" + currentTerm + ")";
  }
}
