// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

import java.util.List;

/// The capability shared by the six protocols: decide the next record under the protocol's rules and commit it to the
/// ledger. Implementations are not thread safe; the [Network] serialises rounds.
public interface ConsensusStrategy {

  /// A short protocol name used in logging.
  String name();

  Ledger ledger();

  List<? extends Participant> participants();

  /// Runs one round for the data.
  ///
  /// @return The committed record which is the new ledger tip.
  /// @throws QuorumNotReachedException if a voting protocol dropped the proposal. The ledger is unchanged.
  /// @throws NoStakeException          if a stake weighted protocol has nothing to select from.
  LedgerRecord proposeAndCommit(String data);
}
