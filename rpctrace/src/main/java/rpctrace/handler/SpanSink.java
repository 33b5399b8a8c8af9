/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.handler;

/**
 * Receives one rendered line per logged span. Writes are fire-and-forget: nothing is returned and
 * exceptions are logged and dropped by the caller, as span logging must not affect the call.
 *
 * <p>Implementations are invoked from scheduler threads, so must be thread-safe and not block.
 *
 * @see LoggingSpanSink
 */
// @FunctionalInterface. Do not add methods as it will break API!
public interface SpanSink {
  /** Drops all lines. */
  SpanSink NOOP = new SpanSink() {
    @Override public void write(String line) {
    }

    @Override public String toString() {
      return "NoopSpanSink{}";
    }
  };

  /** Prints {@code [SPAN_LOG] <line>} to standard error. Useful for debugging. */
  SpanSink CONSOLE = new SpanSink() {
    @Override public void write(String line) {
      System.err.println("[SPAN_LOG] " + line);
    }

    @Override public String toString() {
      return "ConsoleSpanSink{}";
    }
  };

  void write(String line);
}
