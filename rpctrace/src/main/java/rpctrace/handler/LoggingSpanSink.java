/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.handler;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SpanSink} which logs the line through java.util.logging at INFO level.
 *
 * <p>This is the default sink. Use the {@code rpctrace-slf4j} module to route lines through SLF4J.
 */
public final class LoggingSpanSink implements SpanSink {

  public static LoggingSpanSink create() {
    return new LoggingSpanSink(Logger.getLogger(LoggingSpanSink.class.getName()));
  }

  public static LoggingSpanSink create(String loggerName) {
    if (loggerName == null || loggerName.isEmpty()) {
      throw new IllegalArgumentException("loggerName is empty");
    }
    return new LoggingSpanSink(Logger.getLogger(loggerName));
  }

  final Logger logger;

  LoggingSpanSink(Logger logger) {
    this.logger = logger;
  }

  @Override public void write(String line) {
    if (!logger.isLoggable(Level.INFO)) return;
    logger.info(line);
  }

  @Override public String toString() {
    return "LoggingSpanSink{name=" + logger.getName() + "}";
  }
}
