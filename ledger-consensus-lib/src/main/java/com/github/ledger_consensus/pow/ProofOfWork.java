// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.pow;

import com.github.ledger_consensus.AbstractStrategy;
import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.ParticipantId;

import java.util.List;

/// Proof of Work. The work proof is the admission control so a mined record is appended without any vote.
/// The genesis record is mined too.
public class ProofOfWork extends AbstractStrategy<Miner> {
  public static final String NAME = "PoW";

  private final Miner miner;

  ProofOfWork(Ledger ledger, Miner miner, ConsensusConfig config) {
    super(ledger, List.of(miner), config);
    this.miner = miner;
  }

  public static ProofOfWork create(ConsensusConfig config) {
    final var miner = new Miner(new ParticipantId("miner-0"), config.difficulty());
    final var genesis = miner.mine(0, Ledger.timestamp(config.clock()), LedgerRecord.GENESIS_PAYLOAD, "");
    return new ProofOfWork(Ledger.fromGenesis(genesis), miner, config);
  }

  /// True if the hash starts with `difficulty` zero characters.
  public static boolean meetsDifficulty(String hash, int difficulty) {
    if (hash.length() < difficulty) {
      return false;
    }
    for (int i = 0; i < difficulty; i++) {
      if (hash.charAt(i) != '0') {
        return false;
      }
    }
    return true;
  }

  @Override
  public String name() {
    return NAME;
  }

  public int difficulty() {
    return miner.difficulty();
  }

  public Miner miner() {
    return miner;
  }

  /// Checks a record's proof without mining again.
  public boolean verifyWork(LedgerRecord record) {
    return record.nonce().isPresent() && record.hasValidHash() && meetsDifficulty(record.hash(), difficulty());
  }

  public LedgerRecord addRecord(String data) {
    return proposeAndCommit(data);
  }

  @Override
  public LedgerRecord proposeAndCommit(String data) {
    final var tip = ledger.tip();
    final var mined = miner.mine(tip.index() + 1, Ledger.timestamp(config.clock()), data, tip.hash());
    return commitToAll(mined);
  }
}
