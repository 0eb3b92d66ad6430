// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pow;

import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.Participant;
import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.RecordTag;
import com.github.ledger_consensus.Role;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Searches for a nonce that gives a record hash with the required number of leading zero hex digits.
/// There is no bound on the number of attempts.
public class Miner extends Participant {
  public enum MinerRole implements Role {MINER}

  private final int difficulty;

  private long hashesComputed = 0;

  public Miner(ParticipantId id, int difficulty) {
    super(id);
    if (difficulty < 0) throw new IllegalArgumentException("difficulty must be non-negative");
    this.difficulty = difficulty;
  }

  @Override
  public Role role() {
    return MinerRole.MINER;
  }

  public int difficulty() {
    return difficulty;
  }

  /// The total number of hashes this miner has computed.
  public long hashesComputed() {
    return hashesComputed;
  }

  /// Mines a record starting the search at nonce zero.
  public LedgerRecord mine(long index, String timestamp, String payload, String previousHash) {
    var candidate = LedgerRecord.create(index, timestamp, payload, previousHash, new RecordTag.Nonce(0));
    long nonce = 0;
    while (!ProofOfWork.meetsDifficulty(candidate.hash(), difficulty)) {
      nonce++;
      candidate = candidate.withNonce(nonce);
    }
    hashesComputed += nonce + 1;
    final var attempts = nonce + 1;
    final var found = candidate;
    LOGGER.finer(() -> id + " mined index " + index + " after " + attempts + " hashes: " + found.hash());
    return candidate;
  }
}
