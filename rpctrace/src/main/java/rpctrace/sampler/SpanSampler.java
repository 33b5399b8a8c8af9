/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.sampler;

import rpctrace.RpcSpan;

/**
 * Decides if a finished span is worth logging. Unlike a trace sampler, the decision is made after
 * the call completed, once per span, and may depend on state such as recent throughput.
 */
// abstract for factory-method support
public abstract class SpanSampler {

  public static final SpanSampler ALWAYS_SAMPLE = new SpanSampler() {
    @Override public boolean isSampled(RpcSpan span) {
      return true;
    }

    @Override public String toString() {
      return "AlwaysSample";
    }
  };

  public static final SpanSampler NEVER_SAMPLE = new SpanSampler() {
    @Override public boolean isSampled(RpcSpan span) {
      return false;
    }

    @Override public String toString() {
      return "NeverSample";
    }
  };

  /**
   * Returns true if the span should be logged. Implementations may update internal state, so call
   * this once per span.
   */
  public abstract boolean isSampled(RpcSpan span);
}
