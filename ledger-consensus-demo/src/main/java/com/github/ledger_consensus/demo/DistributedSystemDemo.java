// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.demo;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.Networks;

import java.io.PrintStream;
import java.util.stream.IntStream;

/// Five Paxos participants agree three payloads, numbering each proposal with its round, and print the chain.
public class DistributedSystemDemo {
  static {
    LoggerConfig.initialize();
  }

  public static final int PARTICIPANTS = 5;

  public static void main(String[] args) {
    run(ConsensusConfig.defaults(), System.out);
  }

  public static Ledger run(ConsensusConfig config, PrintStream out) {
    final var network = Networks.paxos(PARTICIPANTS, config);

    IntStream.rangeClosed(1, 3).forEach(round ->
        network.execute(paxos -> paxos.runConsensusRound("Data for round " + round, round)));

    final var ledger = network.ledger();
    new LedgerPrinter(out).print(ledger);
    return ledger;
  }
}
