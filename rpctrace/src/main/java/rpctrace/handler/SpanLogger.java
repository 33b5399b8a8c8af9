/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.handler;

import rpctrace.RpcSpan;
import rpctrace.internal.Nullable;
import rpctrace.internal.Platform;
import rpctrace.sampler.SpanLimitSampler;
import rpctrace.sampler.SpanSampler;
import rpctrace.task.Work;

import static rpctrace.internal.Throwables.propagateIfFatal;

/**
 * Turns a finished span into {@link Work} for the host scheduler.
 *
 * <p>Ownership of the span passes to {@link #newLogTask(RpcSpan)}. Spans that won't be logged are
 * released immediately and {@link Work#NOOP} is returned. Otherwise, a {@link SpanLogTask}
 * releases the span when it is executed or discarded.
 *
 * <p>There are two variants: {@link #NOOP}, used when span logging is disabled, and a sampled
 * logger built with {@link #newBuilder()}.
 */
public abstract class SpanLogger {

  /** Logs nothing. Spans are left to garbage collection. */
  public static final SpanLogger NOOP = new Disabled(SpanReleaser.NOOP);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    boolean enabled = true;
    SpanSampler sampler;
    SpanSink sink;
    SpanReleaser releaser = SpanReleaser.NOOP;
    SpanLogTask.Callback callback;

    /** When false, {@link #build()} returns a logger that discards every span. Defaults to true. */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /** Defaults to {@link SpanLimitSampler#create()}. */
    public Builder sampler(SpanSampler sampler) {
      if (sampler == null) throw new NullPointerException("sampler == null");
      this.sampler = sampler;
      return this;
    }

    /** Defaults to {@link LoggingSpanSink#create()}. */
    public Builder sink(SpanSink sink) {
      if (sink == null) throw new NullPointerException("sink == null");
      this.sink = sink;
      return this;
    }

    /** Defaults to {@link SpanReleaser#NOOP}. */
    public Builder releaser(SpanReleaser releaser) {
      if (releaser == null) throw new NullPointerException("releaser == null");
      this.releaser = releaser;
      return this;
    }

    /** Invoked with each task after its line was written. No default. */
    public Builder callback(@Nullable SpanLogTask.Callback callback) {
      this.callback = callback;
      return this;
    }

    public SpanLogger build() {
      if (!enabled) return releaser == SpanReleaser.NOOP ? NOOP : new Disabled(releaser);
      SpanSampler sampler = this.sampler != null ? this.sampler : SpanLimitSampler.create();
      SpanSink sink = this.sink != null ? this.sink : LoggingSpanSink.create();
      return new Sampled(sampler, sink, releaser, callback);
    }

    Builder() {
    }
  }

  /**
   * Takes ownership of the span and returns work to schedule. The result is never null.
   *
   * @param span a finished span, not used by the caller afterwards
   */
  public abstract Work newLogTask(RpcSpan span);

  static void release(SpanReleaser releaser, RpcSpan span) {
    try {
      releaser.release(span);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().log("error releasing span {0}", span, t);
    }
  }

  static final class Disabled extends SpanLogger {
    final SpanReleaser releaser;

    Disabled(SpanReleaser releaser) {
      this.releaser = releaser;
    }

    @Override public Work newLogTask(RpcSpan span) {
      if (span == null) throw new NullPointerException("span == null");
      release(releaser, span);
      return Work.NOOP;
    }

    @Override public String toString() {
      return "DisabledSpanLogger{}";
    }
  }

  static final class Sampled extends SpanLogger {
    final SpanSampler sampler;
    final SpanSink sink;
    final SpanReleaser releaser;
    @Nullable final SpanLogTask.Callback callback;

    Sampled(SpanSampler sampler, SpanSink sink, SpanReleaser releaser,
      @Nullable SpanLogTask.Callback callback) {
      this.sampler = sampler;
      this.sink = sink;
      this.releaser = releaser;
      this.callback = callback;
    }

    @Override public Work newLogTask(RpcSpan span) {
      if (span == null) throw new NullPointerException("span == null");
      if (!sampler.isSampled(span)) {
        release(releaser, span);
        return Work.NOOP;
      }
      return new SpanLogTask(span, sink, releaser, callback);
    }

    @Override public String toString() {
      return "SampledSpanLogger{sampler=" + sampler + ", sink=" + sink + "}";
    }
  }
}
