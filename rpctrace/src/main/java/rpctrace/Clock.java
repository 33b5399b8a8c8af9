/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace;

/**
 * Monotonic milliseconds used to stamp identifiers and to bucket sampling decisions.
 *
 * <p>The default clock counts from {@link rpctrace.id.IdLayout#EPOCH_MILLIS}, so values remain
 * comparable across restarts of a process. They must never go backward on a healthy host: {@link rpctrace.id.IdAllocator} refuses to allocate when they do, and
 * {@link rpctrace.sampler.SpanLimitSampler} rejects un-forced spans until the clock catches up.
 *
 * <p><em>Note</em>: This type is safe to implement as a lambda, or use as a method reference.
 */
// @FunctionalInterface. Do not add methods as it will break API!
public interface Clock {

  long currentTickMillis();
}
