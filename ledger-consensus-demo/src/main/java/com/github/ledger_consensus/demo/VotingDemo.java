// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.demo;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.Networks;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/// Voters elect Delegated Proof of Stake delegates, the votes are tallied and two records are produced.
public class VotingDemo {
  static {
    LoggerConfig.initialize();
  }

  public static final List<String> DELEGATES = List.of("Alice", "Bob", "Charlie");

  public static void main(String[] args) {
    run(ConsensusConfig.defaults(), System.out);
  }

  public static Ledger run(ConsensusConfig config, PrintStream out) {
    final var network = Networks.delegatedProofOfStake(DELEGATES, Map.of(), config);

    final var counts = network.execute(dpos -> {
      dpos.vote("Voter1", "Alice");
      dpos.vote("Voter2", "Bob");
      dpos.vote("Voter3", "Alice");
      dpos.vote("Voter4", "Charlie");
      dpos.vote("Voter5", "Bob");
      return dpos.tallyVotes();
    });
    counts.forEach((delegate, votes) -> out.println(delegate + " received " + votes + " votes"));
    out.println();

    network.submit("Block 1 Data");
    network.submit("Block 2 Data");

    final var ledger = network.ledger();
    new LedgerPrinter(out, LedgerPrinter.DELEGATE).print(ledger);
    return ledger;
  }
}
