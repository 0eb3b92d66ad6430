// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.paxos;

/// Orders strict mode Paxos proposals by combining the caller's proposal number with the index of the proposing
/// node so that two proposers can never issue the same ballot.
public record BallotNumber(long counter, int proposerIndex) implements Comparable<BallotNumber> {
  public static final BallotNumber MIN = new BallotNumber(Long.MIN_VALUE, Integer.MIN_VALUE);

  @Override
  public int compareTo(BallotNumber that) {
    if (this == that) {
      return 0;
    }
    if (this.counter > that.counter) {
      return 1;
    } else if (this.counter < that.counter) {
      return -1;
    } else {
      return Integer.compare(this.proposerIndex, that.proposerIndex);
    }
  }

  @Override
  public String toString() {
    return String.format("N(c=%d,n=%d)", counter, proposerIndex);
  }

  public boolean lessThan(BallotNumber ballotNumber) {
    return this.compareTo(ballotNumber) < 0;
  }

  public boolean greaterThan(BallotNumber ballotNumber) {
    return this.compareTo(ballotNumber) > 0;
  }

  public boolean lessThanOrEqualTo(BallotNumber number) {
    return this.compareTo(number) <= 0;
  }
}
