/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.id;

import java.util.concurrent.atomic.AtomicLong;
import rpctrace.Clock;
import rpctrace.internal.Platform;

import static rpctrace.id.IdAllocation.Failure.CLOCK_REGRESSION;
import static rpctrace.id.IdAllocation.Failure.INVALID_IDENTITY;
import static rpctrace.id.IdAllocation.Failure.SEQUENCE_EXHAUSTED;
import static rpctrace.id.IdAllocation.Failure.TIMESTAMP_OVERFLOW;

/**
 * Allocates 64-bit identifiers from the {@link IdLayout}, the local {@link Clock} and a
 * caller-supplied group and machine identity. No coordination service is involved.
 *
 * <p>For a fixed group and machine, identifiers returned by one allocator are unique and strictly
 * increasing (unsigned), as the pair of timestamp and sequence only ever moves forward.
 *
 * <h3>Implementation</h3>
 *
 * <p>The last timestamp and its sequence are packed into one word, {@code timestamp <<
 * sequenceBits | sequence}, and advanced with compare-and-set. Concurrent callers can therefore
 * never observe one field updated without the other. A caller that loses the race recomputes its
 * decision against the winner's state.
 *
 * <p>The state starts at timestamp zero, sequence zero, as if that identifier was already issued.
 */
public final class IdAllocator {
  public static IdAllocator create() {
    return create(IdLayout.DEFAULT, Platform.get().clock());
  }

  public static IdAllocator create(IdLayout layout) {
    return create(layout, Platform.get().clock());
  }

  public static IdAllocator create(IdLayout layout, Clock clock) {
    if (layout == null) throw new NullPointerException("layout == null");
    if (clock == null) throw new NullPointerException("clock == null");
    return new IdAllocator(layout, clock);
  }

  final IdLayout layout;
  final Clock clock;
  final AtomicLong state = new AtomicLong();

  IdAllocator(IdLayout layout, Clock clock) {
    this.layout = layout;
    this.clock = clock;
  }

  public IdLayout layout() {
    return layout;
  }

  /**
   * Returns a new identifier for the given identity, or the reason none could be made.
   *
   * <p>This never blocks and never retries.
   */
  public IdAllocation allocate(long groupId, long machineId) {
    if (!layout.isValidGroupId(groupId) || !layout.isValidMachineId(machineId)) {
      return IdAllocation.failed(INVALID_IDENTITY);
    }

    long now = clock.currentTickMillis();
    int sequenceBits = layout.sequenceBits;
    long prev, next, sequence;
    do {
      prev = state.get();
      long lastTimestamp = prev >>> sequenceBits;
      if (now < lastTimestamp) return IdAllocation.failed(CLOCK_REGRESSION);
      if (now > layout.timestampMax) return IdAllocation.failed(TIMESTAMP_OVERFLOW);

      if (now == lastTimestamp) {
        sequence = (prev & layout.sequenceMax) + 1;
        if (sequence > layout.sequenceMax) return IdAllocation.failed(SEQUENCE_EXHAUSTED);
      } else {
        sequence = 0L;
      }
      next = (now << sequenceBits) | sequence;
    } while (!state.compareAndSet(prev, next));

    return IdAllocation.success(layout.compose(now, groupId, machineId, sequence));
  }

  @Override public String toString() {
    return "IdAllocator{layout=" + layout + ", clock=" + clock + "}";
  }
}
