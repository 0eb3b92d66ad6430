// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.demo;

import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.RecordTag;

import java.io.PrintStream;
import java.util.Optional;

/// Prints every record of a ledger one field per line with a blank line between records. A proposer tag is printed
/// under the protocol's own name for it such as `Validator` for PoS or `Delegate` for DPoS.
public class LedgerPrinter {
  public static final String PROPOSER = "Proposer";
  public static final String VALIDATOR = "Validator";
  public static final String DELEGATE = "Delegate";

  private final PrintStream out;

  private final String proposerLabel;

  public LedgerPrinter(PrintStream out) {
    this(out, PROPOSER);
  }

  public LedgerPrinter(PrintStream out, String proposerLabel) {
    this.out = out;
    this.proposerLabel = proposerLabel;
  }

  public void print(Ledger ledger) {
    ledger.records().forEach(this::print);
  }

  public void print(LedgerRecord record) {
    out.println("Index: " + record.index());
    out.println("Timestamp: " + record.timestamp());
    out.println("Data: " + record.payload());
    out.println("Previous Hash: " + record.previousHash());
    out.println("Hash: " + record.hash());
    tagLine(record.tag(), proposerLabel).ifPresent(out::println);
    out.println();
  }

  static Optional<String> tagLine(RecordTag tag, String proposerLabel) {
    if (tag instanceof RecordTag.Proposer proposer) {
      return Optional.of(proposerLabel + ": " + proposer.id());
    }
    if (tag instanceof RecordTag.Nonce nonce) {
      return Optional.of("Nonce: " + nonce.value());
    }
    return Optional.empty();
  }
}
