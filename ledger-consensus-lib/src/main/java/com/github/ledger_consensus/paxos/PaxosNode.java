// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.paxos;

import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.Participant;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Proposal;
import com.github.ledger_consensus.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// A Paxos participant. Every node is an acceptor and a learner. The first node is also the proposer.
public class PaxosNode extends Participant {
  public enum PaxosRole implements Role {PROPOSER, ACCEPTOR}

  private final PaxosRole role;

  private final int index;

  /// The proposals this node has made or learnt of. Dropped once committed or superseded by a committed proposal.
  final List<Proposal<String>> proposals = new ArrayList<>();

  /// Strict mode: the highest ballot promised.
  BallotNumber highestPromised = BallotNumber.MIN;

  /// Strict mode: what this node accepted at each uncommitted slot.
  final NavigableMap<Long, Promise.Accepted> acceptedBySlot = new TreeMap<>();

  PaxosNode(int index) {
    super(ParticipantId.ofIndex(index));
    this.index = index;
    this.role = index == 0 ? PaxosRole.PROPOSER : PaxosRole.ACCEPTOR;
  }

  @Override
  public Role role() {
    return role;
  }

  public int index() {
    return index;
  }

  public List<Proposal<String>> proposals() {
    return List.copyOf(proposals);
  }

  public BallotNumber highestPromised() {
    return highestPromised;
  }

  public Optional<Promise.Accepted> accepted(long slot) {
    return Optional.ofNullable(acceptedBySlot.get(slot));
  }

  /// Creates a proposal and records it in this node's own list. The caller chooses the proposal number and is
  /// responsible for it being unique.
  public Proposal<String> propose(String data, long proposalNumber) {
    final var proposal = Proposal.of(proposalNumber, data);
    proposals.add(proposal);
    return proposal;
  }

  /// Simplified mode collapsed prepare: the node records the proposal number as known.
  void learn(Proposal<String> proposal) {
    if (!knows(proposal.number())) {
      proposals.add(proposal);
    }
  }

  boolean knows(long proposalNumber) {
    return proposals.stream().anyMatch(p -> p.number() == proposalNumber);
  }

  /// Simplified mode acceptance: only a proposal number this node already knows is accepted.
  boolean accept(Proposal<String> proposal) {
    for (int i = 0; i < proposals.size(); i++) {
      if (proposals.get(i).number() == proposal.number()) {
        proposals.set(i, proposals.get(i).accept());
        return true;
      }
    }
    return false;
  }

  /// Strict mode phase 1b. Promise a strictly higher ballot and return the value accepted at the slot if any.
  Promise promise(long slot, BallotNumber number) {
    if (number.lessThanOrEqualTo(highestPromised)) {
      LOGGER.finer(() -> id + " refusing prepare " + number + " having promised " + highestPromised);
      return new Promise(id, number, false, Optional.empty());
    }
    highestPromised = number;
    return new Promise(id, number, true, accepted(slot));
  }

  /// Strict mode phase 2b. Accept unless a higher ballot has been promised.
  boolean accept(long slot, BallotNumber number, Proposal<String> proposal) {
    if (number.lessThan(highestPromised)) {
      return false;
    }
    highestPromised = number;
    acceptedBySlot.put(slot, new Promise.Accepted(number, proposal.accept()));
    return true;
  }

  /// Learning a committed record fixes its slot so the values accepted up to that slot are discarded.
  @Override
  public void commit(LedgerRecord record) {
    super.commit(record);
    acceptedBySlot.headMap(record.index(), true).clear();
  }

  /// Discards the committed proposal and every proposal it supersedes.
  void discardThrough(Proposal<String> committed) {
    proposals.removeIf(p -> !p.supersedes(committed));
  }

  @Override
  public String toString() {
    return "PaxosNode(" + id + "," + role + ",p=" + highestPromised + ")";
  }
}
