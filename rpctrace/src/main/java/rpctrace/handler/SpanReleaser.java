/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.handler;

import rpctrace.RpcSpan;

/**
 * Called exactly once for every span given to {@link SpanLogger#newLogTask(RpcSpan)}, after which
 * the pipeline no longer reads it. Use this to return spans to a pool, or to count them.
 *
 * <p>The span was either rejected by the sampler, discarded with its work, or logged.
 */
// @FunctionalInterface. Do not add methods as it will break API!
public interface SpanReleaser {
  /** Leaves the span to garbage collection. */
  SpanReleaser NOOP = new SpanReleaser() {
    @Override public void release(RpcSpan span) {
    }

    @Override public String toString() {
      return "NoopSpanReleaser{}";
    }
  };

  void release(RpcSpan span);
}
