/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.id;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import rpctrace.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static rpctrace.id.IdAllocation.Failure.CLOCK_REGRESSION;
import static rpctrace.id.IdAllocation.Failure.INVALID_IDENTITY;
import static rpctrace.id.IdAllocation.Failure.SEQUENCE_EXHAUSTED;
import static rpctrace.id.IdAllocation.Failure.TIMESTAMP_OVERFLOW;

class IdAllocatorTest {
  AtomicLong tick = new AtomicLong(1000L);
  Clock clock = tick::get;
  IdAllocator allocator = IdAllocator.create(IdLayout.DEFAULT, clock);

  @Test void idsAreStrictlyIncreasing() {
    long previous = allocator.allocate(3, 17).id();
    for (int i = 0; i < 10_000; i++) {
      if (i % 100 == 0) tick.incrementAndGet();
      long next = allocator.allocate(3, 17).id();
      assertThat(Long.compareUnsigned(next, previous)).isPositive();
      previous = next;
    }
  }

  @Test void decodesToInputs() {
    tick.set(123_456L);
    allocator.allocate(3, 17);
    long id = allocator.allocate(3, 17).id();

    IdLayout layout = allocator.layout();
    assertThat(layout.timestamp(id)).isEqualTo(123_456L);
    assertThat(layout.groupId(id)).isEqualTo(3);
    assertThat(layout.machineId(id)).isEqualTo(17);
    assertThat(layout.sequence(id)).isEqualTo(1);
  }

  @Test void sequenceResetsWhenMillisecondAdvances() {
    allocator.allocate(0, 0);
    allocator.allocate(0, 0);
    tick.incrementAndGet();

    long id = allocator.allocate(0, 0).id();
    assertThat(allocator.layout().sequence(id)).isZero();
    assertThat(allocator.layout().timestamp(id)).isEqualTo(1001L);
  }

  @Test void sequenceExhausted() {
    IdLayout layout = IdLayout.newBuilder().machineBits(18).build(); // 4 sequence bits
    IdAllocator allocator = IdAllocator.create(layout, clock);

    for (int i = 0; i < 16; i++) {
      assertThat(allocator.allocate(1, 1).isSuccess())
        .withFailMessage("failed after " + (i + 1))
        .isTrue();
    }
    for (int i = 0; i < 5; i++) {
      assertThat(allocator.allocate(1, 1).failure()).isEqualTo(SEQUENCE_EXHAUSTED);
    }

    tick.incrementAndGet(); // caller waits for the next millisecond
    assertThat(allocator.allocate(1, 1).isSuccess()).isTrue();
  }

  @Test void clockRegression() {
    assertThat(allocator.allocate(1, 1).isSuccess()).isTrue();

    tick.decrementAndGet();
    assertThat(allocator.allocate(1, 1).failure()).isEqualTo(CLOCK_REGRESSION);

    tick.incrementAndGet(); // caught up
    assertThat(allocator.allocate(1, 1).isSuccess()).isTrue();
  }

  @Test void negativeClockIsARegression() {
    tick.set(-5L);
    assertThat(allocator.allocate(1, 1).failure()).isEqualTo(CLOCK_REGRESSION);
  }

  @Test void timestampOverflow() {
    IdLayout layout = IdLayout.newBuilder().timestampBits(4).build();
    IdAllocator allocator = IdAllocator.create(layout, clock);

    tick.set(15L);
    assertThat(allocator.allocate(1, 1).isSuccess()).isTrue();
    tick.set(16L);
    assertThat(allocator.allocate(1, 1).failure()).isEqualTo(TIMESTAMP_OVERFLOW);
  }

  @Test void invalidGroup() {
    assertThat(allocator.allocate(32, 0).failure()).isEqualTo(INVALID_IDENTITY);
    assertThat(allocator.allocate(100, 0).failure()).isEqualTo(INVALID_IDENTITY);
    assertThat(allocator.allocate(-1, 0).failure()).isEqualTo(INVALID_IDENTITY);
  }

  @Test void invalidMachine() {
    assertThat(allocator.allocate(0, 1024).failure()).isEqualTo(INVALID_IDENTITY);
    assertThat(allocator.allocate(0, -1).failure()).isEqualTo(INVALID_IDENTITY);
  }

  @Test void invalidIdentityDoesntReadClock() {
    Clock clock = () -> {
      throw new AssertionError("clock read");
    };
    IdAllocator allocator = IdAllocator.create(IdLayout.DEFAULT, clock);

    assertThat(allocator.allocate(32, 1024).failure()).isEqualTo(INVALID_IDENTITY);
  }

  @Test void invalidIdentityDoesntConsumeSequence() {
    allocator.allocate(1, 1);
    allocator.allocate(99, 1);

    long id = allocator.allocate(1, 1).id();
    assertThat(allocator.layout().sequence(id)).isEqualTo(1);
  }

  @Test void idOfFailureThrows() {
    IdAllocation failed = allocator.allocate(32, 0);

    assertThat(failed.isSuccess()).isFalse();
    assertThatThrownBy(failed::id)
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("allocation failed: INVALID_IDENTITY");
  }

  @Test void failuresAreShared() {
    assertThat(allocator.allocate(32, 0)).isSameAs(allocator.allocate(33, 0));
  }

  @Test void toStringIsUnsigned() {
    tick.set(IdLayout.DEFAULT.timestampMax());

    assertThat(allocator.allocate(0, 0))
      .hasToString("IdAllocation{id=" + Long.toUnsignedString(
        IdLayout.DEFAULT.compose(IdLayout.DEFAULT.timestampMax(), 0, 0, 0)) + "}");
  }

  @Test void concurrentCallersGetUniqueIds() throws Exception {
    IdAllocator allocator = IdAllocator.create();
    Set<Long> ids = ConcurrentHashMap.newKeySet();
    int threadCount = 8, idsPerThread = 20_000;

    ExecutorService service = Executors.newFixedThreadPool(threadCount);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < threadCount; i++) {
      futures.add(service.submit(() -> {
        int allocated = 0;
        while (allocated < idsPerThread) {
          IdAllocation allocation = allocator.allocate(1, 2);
          if (!allocation.isSuccess()) {
            assertThat(allocation.failure()).isEqualTo(SEQUENCE_EXHAUSTED);
            Thread.yield();
            continue;
          }
          ids.add(allocation.id());
          allocated++;
        }
      }));
    }
    for (Future<?> future : futures) future.get();
    service.shutdown();

    assertThat(ids).hasSize(threadCount * idsPerThread);
  }

  @Test void nullArgs() {
    assertThatThrownBy(() -> IdAllocator.create(null, clock))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("layout == null");
    assertThatThrownBy(() -> IdAllocator.create(IdLayout.DEFAULT, null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("clock == null");
  }
}
