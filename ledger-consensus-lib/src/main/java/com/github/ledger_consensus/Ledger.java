// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// The append-only hash chained sequence of [LedgerRecord]s shared by every participant of a [Network].
///
/// Index zero always holds the genesis record which has an empty previous hash. For every other record the previous
/// hash equals the hash of the record before it and the indexes are contiguous. The only mutation is [#append]
/// which is all-or-nothing: a record that would break the chain is refused with a [ChainIntegrityException] and the
/// ledger is left untouched.
///
/// Appends are serialised on this object so there is only ever a single writer even if a host application runs
/// rounds from many threads.
public class Ledger {
  private final List<LedgerRecord> records = new ArrayList<>();

  Ledger(LedgerRecord genesis) {
    if (!genesis.isGenesis()) {
      throw new IllegalArgumentException("not a genesis record: " + genesis);
    }
    if (!genesis.hasValidHash()) {
      throw new ChainIntegrityException(ErrorStrings.INVALID_SELF_HASH + genesis);
    }
    records.add(genesis);
  }

  /// A ledger with an untagged genesis record stamped by the system clock.
  public static Ledger create() {
    return create(Clock.systemUTC());
  }

  public static Ledger create(Clock clock) {
    return create(clock, RecordTag.Untagged.INSTANCE);
  }

  public static Ledger create(Clock clock, RecordTag genesisTag) {
    return new Ledger(genesis(clock, genesisTag));
  }

  /// Adopts an already built genesis record such as a mined one.
  public static Ledger fromGenesis(LedgerRecord genesis) {
    return new Ledger(genesis);
  }

  public static LedgerRecord genesis(Clock clock, RecordTag tag) {
    return LedgerRecord.create(0, timestamp(clock), LedgerRecord.GENESIS_PAYLOAD, "", tag);
  }

  /// The opaque ordering token stored on records.
  public static String timestamp(Clock clock) {
    return clock.instant().toString();
  }

  /// Appends a record that extends the current tip. Only strategies in this package write to the ledger, through
  /// [AbstractStrategy#commitToAll].
  ///
  /// @param record A record whose index is one more than the tip, whose previous hash is the hash of the tip and whose
  ///               own hash recomputes from its fields.
  /// @throws ChainIntegrityException if any of those conditions fail. Nothing is changed.
  synchronized void append(LedgerRecord record) {
    final var tip = tip();
    if (record.index() != tip.index() + 1) {
      throw new ChainIntegrityException(ErrorStrings.NON_CONTIGUOUS_INDEX
          + "expected=" + (tip.index() + 1) + " actual=" + record.index());
    }
    if (!record.previousHash().equals(tip.hash())) {
      throw new ChainIntegrityException(ErrorStrings.PREVIOUS_HASH_MISMATCH + record);
    }
    if (!record.hasValidHash()) {
      throw new ChainIntegrityException(ErrorStrings.INVALID_SELF_HASH + record);
    }
    records.add(record);
    LOGGER.finer(() -> "appended " + record);
  }

  /// The last record which is the genesis record on a fresh ledger.
  public synchronized LedgerRecord tip() {
    if (records.isEmpty()) {
      throw new EmptyLedgerException();
    }
    return records.get(records.size() - 1);
  }

  public synchronized LedgerRecord get(long index) {
    if (index < 0 || index >= records.size()) {
      throw new IndexOutOfBoundsException("index " + index + " size " + records.size());
    }
    return records.get((int) index);
  }

  public synchronized int size() {
    return records.size();
  }

  /// An unmodifiable snapshot of the records in index order.
  public synchronized List<LedgerRecord> records() {
    return Collections.unmodifiableList(new ArrayList<>(records));
  }

  /// A lazy sequence of integrity checks. The first element checks the genesis record and each later element checks
  /// that the record at that index links to its predecessor and that its own hash recomputes.
  public Stream<Boolean> verify() {
    final var snapshot = records();
    return Stream.concat(
        Stream.of(snapshot.get(0).isGenesis() && snapshot.get(0).hasValidHash()),
        IntStream.range(1, snapshot.size())
            .mapToObj(i -> snapshot.get(i).follows(snapshot.get(i - 1)) && snapshot.get(i).hasValidHash())
    );
  }

  public boolean isValid() {
    return verify().allMatch(Boolean::booleanValue);
  }

  @Override
  public String toString() {
    return "Ledger(size=" + size() + ",tip=" + tip() + ")";
  }
}
