/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.slf4j;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rpctrace.handler.SpanSink;

/**
 * {@link SpanSink} implementation that logs through SLF4J at INFO level.
 */
public final class Slf4jSpanSink implements SpanSink {

  public static Slf4jSpanSink create() {
    return new Slf4jSpanSink(LoggerFactory.getLogger(Slf4jSpanSink.class));
  }

  public static Slf4jSpanSink create(String loggerName) {
    if (loggerName == null || loggerName.trim().isEmpty()) {
      throw new IllegalArgumentException("loggerName must not be blank or null");
    }
    return new Slf4jSpanSink(LoggerFactory.getLogger(loggerName));
  }

  public static Slf4jSpanSink create(Logger logger) {
    if (logger == null) throw new NullPointerException("logger == null");
    return new Slf4jSpanSink(logger);
  }

  final Logger logger;

  Slf4jSpanSink(Logger logger) {
    this.logger = logger;
  }

  @Override public void write(String line) {
    if (logger.isInfoEnabled()) {
      logger.info(line);
    }
  }

  public Logger logger() {
    return logger;
  }

  @Override public String toString() {
    return "Slf4jSpanSink{name=" + logger.getName() + "}";
  }
}
