// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// A fixed collection of participants plus the active [ConsensusStrategy]. This is the entry point to submit data and
/// get back the updated [Ledger].
///
/// The strategies are not thread safe. A network runs one round at a time so that the ledger keeps a single writer:
/// - [#submit(String)] runs the protocol's generic round.
/// - [#execute(Function)] runs any protocol specific operation such as a vote or an election under the same mutex.
public class Network<S extends ConsensusStrategy> {
  private final S strategy;

  /// The Semaphore acts as a mutex with:
  /// - Non-reentrant locking
  /// - Fair queuing of threads
  private final Semaphore mutex = new Semaphore(1, true);

  public Network(S strategy) {
    if (strategy == null) throw new IllegalArgumentException("strategy must not be null");
    this.strategy = strategy;
  }

  /// Runs one round of the protocol for the data.
  ///
  /// @return The ledger which has the new record at its tip.
  /// @throws QuorumNotReachedException when the proposal was dropped. Nothing is retried.
  public Ledger submit(String data) {
    execute(s -> s.proposeAndCommit(data));
    return strategy.ledger();
  }

  /// Runs an operation against the strategy while holding the network mutex.
  public <R> R execute(Function<S, R> operation) {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ErrorStrings.INTERRUPTED, e);
    }
    try {
      return operation.apply(strategy);
    } catch (QuorumNotReachedException e) {
      LOGGER.warning(() -> strategy.name() + " dropped proposal: " + e.getMessage());
      throw e;
    } finally {
      mutex.release();
    }
  }

  public S strategy() {
    return strategy;
  }

  public Ledger ledger() {
    return strategy.ledger();
  }

  public List<? extends Participant> participants() {
    return strategy.participants();
  }

  @Override
  public String toString() {
    return "Network(" + strategy + ")";
  }
}
