// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.paxos;

import com.github.ledger_consensus.ParticipantId;
import com.github.ledger_consensus.Proposal;

import java.util.Objects;
import java.util.Optional;

/// The response to a strict mode prepare. When the vote is positive the acceptor has promised not to accept any
/// lower ballot and reports the value it has already accepted for the slot, if any, which the proposer must adopt.
///
/// @param from            The acceptor.
/// @param number          The ballot being prepared.
/// @param vote            Whether the acceptor promised.
/// @param highestAccepted The value accepted at the slot under the highest ballot if any.
public record Promise(
    ParticipantId from,
    BallotNumber number,
    boolean vote,
    Optional<Accepted> highestAccepted
) {
  public Promise {
    Objects.requireNonNull(from);
    Objects.requireNonNull(number);
    Objects.requireNonNull(highestAccepted);
  }

  /// A proposal accepted by an acceptor under a ballot.
  public record Accepted(BallotNumber number, Proposal<String> proposal) {
    public Accepted {
      Objects.requireNonNull(number);
      Objects.requireNonNull(proposal);
    }
  }
}
