// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.demo;

import com.github.ledger_consensus.ConsensusConfig;
import com.github.ledger_consensus.Ledger;
import com.github.ledger_consensus.LedgerRecord;
import com.github.ledger_consensus.Networks;
import com.github.ledger_consensus.ParticipantId;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class DemoTest {

  final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

  String printed() {
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void blockchainDemoMinesThreeRecords() {
    final var ledger = BlockchainDemo.run(ConsensusConfig.seeded(1).withDifficulty(2), out);

    assertThat(ledger.records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "Block 1 Data", "Block 2 Data", "Block 3 Data");
    assertThat(ledger.isValid()).isTrue();
    assertThat(printed())
        .contains("Index: 3")
        .contains("Data: Block 3 Data")
        .contains("Previous Hash: " + ledger.get(2).hash())
        .contains("Nonce: ");
  }

  @Test
  public void distributedSystemDemoAgreesThreeRounds() {
    final var ledger = DistributedSystemDemo.run(ConsensusConfig.seeded(1), out);

    assertThat(ledger.records()).extracting(LedgerRecord::payload)
        .containsExactly("Genesis Block", "Data for round 1", "Data for round 2", "Data for round 3");
    assertThat(printed()).contains("Data: Data for round 2");
  }

  @Test
  public void votingDemoTalliesThenProducesTwoRecords() {
    final var ledger = VotingDemo.run(ConsensusConfig.seeded(1), out);

    assertThat(ledger.size()).isEqualTo(3);
    assertThat(ledger.records().subList(1, 3))
        .allSatisfy(r -> assertThat(r.proposer().map(ParticipantId::value).orElseThrow())
            .isIn(VotingDemo.DELEGATES));
    assertThat(printed())
        .contains("Alice received 2 votes")
        .contains("Bob received 2 votes")
        .contains("Charlie received 1 votes")
        .contains("Delegate: Alice");
  }

  @Test
  public void printerNamesTheProposerByProtocol() {
    final var pos = Networks.proofOfStake(List.of("A"), Map.of("A", 1), ConsensusConfig.seeded(1));
    pos.submit("staked");

    new LedgerPrinter(out, LedgerPrinter.VALIDATOR).print(pos.ledger());

    assertThat(printed())
        .contains("Validator: A")
        .doesNotContain("Delegate:");
  }

  @Test
  public void printerDefaultsToAProposerLabel() {
    final var pos = Networks.proofOfStake(List.of("A"), Map.of("A", 1), ConsensusConfig.seeded(1));

    new LedgerPrinter(out).print(pos.ledger());

    assertThat(printed()).contains("Proposer: A");
  }

  @Test
  public void printerOmitsTheTagLineForUntaggedRecords() {
    final var ledger = Ledger.create();

    new LedgerPrinter(out).print(ledger);

    assertThat(printed())
        .startsWith("Index: 0")
        .contains("Data: Genesis Block")
        .contains("Previous Hash: " + System.lineSeparator())
        .doesNotContain("Delegate:")
        .doesNotContain("Nonce:");
  }
}
