/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.id;

import rpctrace.internal.Nullable;

/**
 * Outcome of {@link IdAllocator#allocate(long, long)}: either an identifier or the reason none was
 * produced.
 *
 * <p>A failure is a control-flow signal, not an error. The allocator never retries, so callers
 * decide their own backoff. For example, on {@link Failure#SEQUENCE_EXHAUSTED} it is enough to
 * retry in the next millisecond.
 */
public final class IdAllocation {
  public enum Failure {
    /** The group or machine identity is outside its configured width. No clock was read. */
    INVALID_IDENTITY,
    /** The clock moved backward since the last successful allocation. */
    CLOCK_REGRESSION,
    /** Every sequence of the current millisecond was handed out. */
    SEQUENCE_EXHAUSTED,
    /** The clock no longer fits the configured timestamp bits. */
    TIMESTAMP_OVERFLOW
  }

  static final IdAllocation[] FAILURES;

  static {
    Failure[] values = Failure.values();
    FAILURES = new IdAllocation[values.length];
    for (int i = 0; i < values.length; i++) {
      FAILURES[i] = new IdAllocation(0L, values[i]);
    }
  }

  static IdAllocation success(long id) {
    return new IdAllocation(id, null);
  }

  static IdAllocation failed(Failure failure) {
    return FAILURES[failure.ordinal()];
  }

  final long id;
  @Nullable final Failure failure;

  IdAllocation(long id, @Nullable Failure failure) {
    this.id = id;
    this.failure = failure;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * Returns the allocated identifier. Compare identifiers with {@link Long#compareUnsigned}, as
   * wide timestamps can set the sign bit.
   *
   * @throws IllegalStateException if the allocation failed
   */
  public long id() {
    if (failure != null) throw new IllegalStateException("allocation failed: " + failure);
    return id;
  }

  /** Returns the reason no identifier was produced, or null on success. */
  @Nullable public Failure failure() {
    return failure;
  }

  @Override public String toString() {
    if (failure != null) return "IdAllocation{failure=" + failure + "}";
    return "IdAllocation{id=" + Long.toUnsignedString(id) + "}";
  }
}
