// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import lombok.With;

import java.time.Clock;
import java.util.logging.Level;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

import static com.github.ledger_consensus.ConsensusLogger.LOGGER;

/// Immutable configuration shared by the networks built in [Networks].
///
/// @param difficulty       The number of leading zero hex digits a PoW hash needs.
/// @param random           The only source of non-determinism: stake draws, delegate shuffles and delegate picks.
/// @param clock            Stamps record timestamps.
/// @param votingMode       Whether Raft and Paxos run their simplified or strict rules.
/// @param delegateOrdering How a DPoS tally orders delegates.
/// @param withheldVotes    The number of PBFT replicas whose votes are not counted. This is the only representation
///                         of faulty replicas.
/// @param logAtLevel       The level to log committed records at.
@With
public record ConsensusConfig(
    int difficulty,
    RandomGenerator random,
    Clock clock,
    VotingMode votingMode,
    DelegateOrdering delegateOrdering,
    int withheldVotes,
    Level logAtLevel
) {
  public static final int DEFAULT_DIFFICULTY = 4;

  public ConsensusConfig {
    if (difficulty < 0 || difficulty > 64) throw new IllegalArgumentException("difficulty must be in [0, 64]");
    if (random == null) throw new IllegalArgumentException("random must not be null");
    if (clock == null) throw new IllegalArgumentException("clock must not be null");
    if (votingMode == null) throw new IllegalArgumentException("votingMode must not be null");
    if (delegateOrdering == null) throw new IllegalArgumentException("delegateOrdering must not be null");
    if (withheldVotes < 0) throw new IllegalArgumentException("withheldVotes must be non-negative");
    if (logAtLevel == null) throw new IllegalArgumentException("logAtLevel must not be null");
  }

  public static ConsensusConfig defaults() {
    return new ConsensusConfig(
        DEFAULT_DIFFICULTY,
        RandomGenerator.getDefault(),
        Clock.systemUTC(),
        VotingMode.SIMPLIFIED,
        DelegateOrdering.SHUFFLE,
        0,
        Level.FINE
    );
  }

  /// Defaults with a repeatable random source.
  public static ConsensusConfig seeded(long seed) {
    return defaults().withRandom(repeatableRandomGenerator(seed));
  }

  public static RandomGenerator repeatableRandomGenerator(long seed) {
    RandomGeneratorFactory<RandomGenerator> factory = RandomGeneratorFactory.of("L64X128MixRandom");
    final RandomGenerator rng = factory.create(seed);
    LOGGER.fine(() -> "Using seed: " + seed);
    return rng;
  }
}
