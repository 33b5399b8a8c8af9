/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.task;

/**
 * A host scheduler's sequence of {@link Work}. The series runs one work at a time and moves to the
 * next once the current one reports {@linkplain #workDone(Work) completion}.
 *
 * <p><em>Note</em>: This type is safe to implement as a lambda, or use as a method reference.
 */
// @FunctionalInterface. Do not add methods as it will break API!
public interface Series {

  /** Called exactly once per execution, from the thread that ran the work. */
  void workDone(Work work);
}
