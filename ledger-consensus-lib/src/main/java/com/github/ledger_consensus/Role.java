// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus;

/// The protocol role tag of a participant. Each protocol supplies an enum of its roles.
public interface Role {
  String name();
}
