/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace;

import rpctrace.handler.SpanLogger;
import rpctrace.id.IdAllocation;
import rpctrace.id.IdAllocator;
import rpctrace.id.IdLayout;
import rpctrace.internal.Platform;

/**
 * This provides utilities needed for tracing RPC calls on one node: identifier allocation for its
 * group and machine, and a {@link SpanLogger} for finished spans.
 *
 * <p>Ex.
 * <pre>{@code
 * tracing = RpcTracing.newBuilder()
 *                     .groupId(3)
 *                     .machineId(17)
 *                     .spanLogger(SpanLogger.newBuilder().sink(sink).build())
 *                     .build();
 *
 * IdAllocation allocation = tracing.nextId();
 * if (allocation.isSuccess()) span.traceId(allocation.id());
 * --snip--
 * return tracing.spanLogger().newLogTask(span);
 * }</pre>
 */
public final class RpcTracing {

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    IdLayout idLayout = IdLayout.DEFAULT;
    Clock clock;
    long groupId, machineId;
    SpanLogger spanLogger;

    /** Bit widths of allocated identifiers. Defaults to {@link IdLayout#DEFAULT}. */
    public Builder idLayout(IdLayout idLayout) {
      if (idLayout == null) throw new NullPointerException("idLayout == null");
      this.idLayout = idLayout;
      return this;
    }

    /**
     * Monotonic clock used to stamp identifiers. Defaults to the platform tick clock, which counts
     * milliseconds since {@link IdLayout#EPOCH_MILLIS}.
     */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Group of this node, within {@link IdLayout#groupIdMax()}. Defaults to zero. */
    public Builder groupId(long groupId) {
      this.groupId = groupId;
      return this;
    }

    /** Machine of this node, within {@link IdLayout#machineIdMax()}. Defaults to zero. */
    public Builder machineId(long machineId) {
      this.machineId = machineId;
      return this;
    }

    /** Defaults to a sampled logger built with {@link SpanLogger#newBuilder()}. */
    public Builder spanLogger(SpanLogger spanLogger) {
      if (spanLogger == null) throw new NullPointerException("spanLogger == null");
      this.spanLogger = spanLogger;
      return this;
    }

    public RpcTracing build() {
      if (!idLayout.isValidGroupId(groupId)) {
        throw new IllegalArgumentException(
          "groupId " + groupId + " is not within [0, " + idLayout.groupIdMax() + "]");
      }
      if (!idLayout.isValidMachineId(machineId)) {
        throw new IllegalArgumentException(
          "machineId " + machineId + " is not within [0, " + idLayout.machineIdMax() + "]");
      }
      return new RpcTracing(this);
    }

    Builder() {
    }
  }

  final IdAllocator idAllocator;
  final long groupId, machineId;
  final SpanLogger spanLogger;

  RpcTracing(Builder builder) {
    Clock clock = builder.clock != null ? builder.clock : Platform.get().clock();
    this.idAllocator = IdAllocator.create(builder.idLayout, clock);
    this.groupId = builder.groupId;
    this.machineId = builder.machineId;
    this.spanLogger =
      builder.spanLogger != null ? builder.spanLogger : SpanLogger.newBuilder().build();
  }

  public IdAllocator idAllocator() {
    return idAllocator;
  }

  /** Allocates an identifier for this node's group and machine. */
  public IdAllocation nextId() {
    return idAllocator.allocate(groupId, machineId);
  }

  public SpanLogger spanLogger() {
    return spanLogger;
  }

  @Override public String toString() {
    return "RpcTracing{"
      + "groupId=" + groupId + ", "
      + "machineId=" + machineId + ", "
      + "idAllocator=" + idAllocator + ", "
      + "spanLogger=" + spanLogger
      + "}";
  }
}
