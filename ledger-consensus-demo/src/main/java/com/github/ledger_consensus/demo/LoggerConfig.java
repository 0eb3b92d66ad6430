// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.ledger_consensus.demo;

import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// Sends the library logging to stdout at the level named by the `LOG_LEVEL` environment variable.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      // Get level from environment or default to INFO
      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("INFO");
      Level level = Level.parse(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          return String.format("[%s] %s%n",
              record.getLevel().getName(),
              record.getMessage());
        }
      });

    } catch (IllegalArgumentException e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  public static void initialize() {
    // Method to trigger static initialization which will configure the logger
  }
}
