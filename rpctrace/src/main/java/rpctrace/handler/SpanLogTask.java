/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.handler;

import java.util.concurrent.atomic.AtomicInteger;
import rpctrace.RpcSpan;
import rpctrace.internal.Nullable;
import rpctrace.internal.Platform;
import rpctrace.task.Series;
import rpctrace.task.Work;

import static rpctrace.internal.Throwables.propagateIfFatal;

/**
 * Work that logs one sampled span. On execution, it renders the span with {@link SpanLogFormat},
 * writes the line to the {@link SpanSink}, invokes the {@link Callback}, releases the span and
 * finally signals the series.
 *
 * <p>This logs exceptions from the sink and callback instead of raising them, as the supplied
 * collaborators could have bugs and a traced call must not fail because of its span.
 *
 * <p>The span is released exactly once, whether by {@link #execute(Series)} or
 * {@link #discard()}, even when both race on a cancelled series. Execution claims the span before
 * reading it, so a discard arriving mid-write leaves release to the execution. A discarded task
 * that is executed anyway writes nothing, but still signals its series.
 *
 * <p>Execute at most once. Later calls do nothing, and in particular don't signal the series again.
 */
public final class SpanLogTask extends Work {

  /** Observes a task after its line was written, while the span is still readable. */
  // @FunctionalInterface. Do not add methods as it will break API!
  public interface Callback {
    void onDone(SpanLogTask task);
  }

  final RpcSpan span;
  final SpanSink sink;
  final SpanReleaser releaser;
  @Nullable final Callback callback;

  static final int NEW = 0, RUNNING = 1, DISCARDED = 2, DONE = 3;
  final AtomicInteger state = new AtomicInteger(NEW);

  SpanLogTask(RpcSpan span, SpanSink sink, SpanReleaser releaser, @Nullable Callback callback) {
    this.span = span;
    this.sink = sink;
    this.releaser = releaser;
    this.callback = callback;
  }

  /** The span being logged. Do not read it after the task completed. */
  public RpcSpan span() {
    return span;
  }

  /** Returns true once the span was handed to the {@link SpanReleaser}. */
  public boolean isReleased() {
    int state = this.state.get();
    return state == DISCARDED || state == DONE;
  }

  @Override public void execute(Series series) {
    if (series == null) throw new NullPointerException("series == null");
    if (state.compareAndSet(NEW, RUNNING)) {
      write();
      state.set(DONE);
      SpanLogger.release(releaser, span);
    } else if (!state.compareAndSet(DISCARDED, DONE)) {
      Platform.get().log("ignoring repeated execution of {0}", this, null);
      return;
    }
    series.workDone(this);
  }

  void write() {
    String line = SpanLogFormat.format(span);
    try {
      sink.write(line);
    } catch (Throwable t) {
      propagateIfFatal(t);
      Platform.get().log("error writing span log {0}", line, t);
    }

    if (callback != null) {
      try {
        callback.onDone(this);
      } catch (Throwable t) {
        propagateIfFatal(t);
        Platform.get().log("error invoking span log callback {0}", callback, t);
      }
    }
  }

  /** Releases the span unless execution already claimed it. */
  @Override public void discard() {
    if (state.compareAndSet(NEW, DISCARDED)) SpanLogger.release(releaser, span);
  }

  @Override public String toString() {
    return "SpanLogTask{span=" + span + "}";
  }
}
