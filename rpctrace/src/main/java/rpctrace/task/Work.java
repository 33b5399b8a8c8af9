/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.task;

/**
 * A unit of work handed to a host scheduler. The scheduler either {@linkplain #execute(Series)
 * executes} it or, if the owning series was cancelled first, {@linkplain #discard() discards} it.
 * One of the two must eventually happen, otherwise resources held by the work leak.
 *
 * <p>Execution runs to completion on the calling thread without blocking, then signals the series.
 * No threading model is assumed beyond that.
 */
public abstract class Work {

  /** Does nothing, except signal completion. */
  public static final Work NOOP = new Work() {
    @Override public void execute(Series series) {
      if (series == null) throw new NullPointerException("series == null");
      series.workDone(this);
    }

    @Override public void discard() {
    }

    @Override public String toString() {
      return "NoopWork";
    }
  };

  /**
   * Runs this work and then calls {@link Series#workDone(Work)} exactly once.
   *
   * @param series the series this work belongs to
   */
  public abstract void execute(Series series);

  /** Releases what this work holds without running it. Has no effect after execution. */
  public abstract void discard();
}
