/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.sampler;

import java.util.concurrent.atomic.AtomicLong;
import rpctrace.Clock;
import rpctrace.RpcSpan;
import rpctrace.internal.Platform;

/**
 * The span-limit sampler accepts at most {@link #spanLimit()} spans per millisecond. This bounds
 * the worst-case log volume of a high-QPS service at a very low cost per decision.
 *
 * <p>For example, to log at most 100 spans per millisecond:
 * <pre>{@code
 * spanLoggerBuilder.sampler(SpanLimitSampler.create(100));
 * }</pre>
 *
 * <h3>Forced sampling</h3>
 *
 * <p>A span with a {@linkplain RpcSpan#hasTraceId() trace ID} was forced by an upstream caller,
 * for example diagnostic tooling. Such spans are always accepted, regardless of the limit. They
 * still count towards the current millisecond, so a burst of forced spans leaves no room for others.
 *
 * <h3>Implementation</h3>
 *
 * <p>The current millisecond bucket and the count accepted within it share one word: the bucket
 * in the upper {@value #BUCKET_BITS} bits, the count in the lower {@value #COUNT_BITS}. Both move
 * together with compare-and-set, so a reset can't interleave with an increment. The count
 * saturates at {@link #MAX_SPAN_LIMIT}.
 *
 * <p>Clock values outside {@code [0, 2^42)} can't be bucketed: forced spans are still accepted
 * and others are rejected.
 */
public final class SpanLimitSampler extends SpanSampler {
  public static final int DEFAULT_SPAN_LIMIT = 5000;

  static final int COUNT_BITS = 22, BUCKET_BITS = 64 - COUNT_BITS;
  static final long COUNT_MAX = (1L << COUNT_BITS) - 1, BUCKET_MAX = (1L << BUCKET_BITS) - 1;
  public static final int MAX_SPAN_LIMIT = (int) COUNT_MAX;

  public static SpanLimitSampler create() {
    return create(DEFAULT_SPAN_LIMIT);
  }

  /** @param spanLimit spans accepted per millisecond. Zero only accepts forced spans. */
  public static SpanLimitSampler create(int spanLimit) {
    return create(spanLimit, Platform.get().clock());
  }

  public static SpanLimitSampler create(int spanLimit, Clock clock) {
    if (clock == null) throw new NullPointerException("clock == null");
    return new SpanLimitSampler(checkSpanLimit(spanLimit), clock);
  }

  final Clock clock;
  final AtomicLong state = new AtomicLong(); // bucket << COUNT_BITS | count
  volatile int spanLimit;

  SpanLimitSampler(int spanLimit, Clock clock) {
    this.spanLimit = spanLimit;
    this.clock = clock;
  }

  public int spanLimit() {
    return spanLimit;
  }

  /** Changes the limit. Takes effect on the next decision, without resetting the current count. */
  public SpanLimitSampler spanLimit(int spanLimit) {
    this.spanLimit = checkSpanLimit(spanLimit);
    return this;
  }

  @Override public boolean isSampled(RpcSpan span) {
    boolean forced = span.hasTraceId();
    long now = clock.currentTickMillis();
    if (now < 0 || now > BUCKET_MAX) return forced;

    int limit = spanLimit;
    long prev, next;
    do {
      prev = state.get();
      long bucket = prev >>> COUNT_BITS, count = prev & COUNT_MAX;
      if (now > bucket) {
        if (!forced && limit == 0) return false;
        next = pack(now, 1L);
      } else if (forced) {
        next = pack(bucket, Math.min(count + 1, COUNT_MAX));
      } else if (now == bucket && count < limit) {
        next = pack(bucket, count + 1);
      } else {
        return false; // full, or the clock went backward
      }
    } while (!state.compareAndSet(prev, next));
    return true;
  }

  static long pack(long bucket, long count) {
    return bucket << COUNT_BITS | count;
  }

  static int checkSpanLimit(int spanLimit) {
    if (spanLimit < 0) throw new IllegalArgumentException("spanLimit < 0");
    if (spanLimit > MAX_SPAN_LIMIT) {
      throw new IllegalArgumentException("spanLimit > " + MAX_SPAN_LIMIT);
    }
    return spanLimit;
  }

  @Override public String toString() {
    return "SpanLimitSampler{spanLimit=" + spanLimit + "}";
  }
}
