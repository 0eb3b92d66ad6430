// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.demo;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.Networks;

import java.io.PrintStream;

/// Mines three records with Proof of Work and prints the chain.
public class BlockchainDemo {
  static {
    LoggerConfig.initialize();
  }

  public static void main(String[] args) {
    run(ConsensusConfig.defaults(), System.out);
  }

  public static Ledger run(ConsensusConfig config, PrintStream out) {
    final var network = Networks.proofOfWork(config);

    network.submit("Block 1 Data");
    network.submit("Block 2 Data");
    network.submit("Block 3 Data");

    final var ledger = network.ledger();
    new LedgerPrinter(out).print(ledger);
    return ledger;
  }
}
