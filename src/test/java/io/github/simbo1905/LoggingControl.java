// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT
//
package io.github.simbo1905;

import java.util.logging.*;

/// Test logging setup: one compact line per record on the console.
/// The level defaults to WARNING and can be raised with
/// `-Djava.util.logging.ConsoleHandler.level=FINE` to see compiled descriptor trees and cache traffic.
public sealed interface LoggingControl permits LoggingControl.Config {

  record Config(Level defaultLevel) implements LoggingControl {
  }

  static void setupCleanLogging(Config config) {
    final String logLevel = System.getProperty("java.util.logging.ConsoleHandler.level");
    final Level level = (logLevel != null) ? Level.parse(logLevel) : config.defaultLevel();

    final Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }

    final ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    consoleHandler.setFormatter(new Formatter() {
      @Override
      public String format(LogRecord record) {
        return record.getLevel() + " " + record.getLoggerName() + ": " + formatMessage(record) + "\n";
      }
    });

    rootLogger.addHandler(consoleHandler);
    rootLogger.setLevel(level);
  }

  static void setupCleanLogging() {
    setupCleanLogging(new Config(Level.WARNING));
  }
}
