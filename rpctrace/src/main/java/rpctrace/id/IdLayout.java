/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.id;

/**
 * Bit layout of a 64-bit identifier, most significant first:
 * {@code [timestamp][group][machine][sequence]}.
 *
 * <p>The sequence takes whatever bits the other three leave. With the {@linkplain #DEFAULT
 * default} widths of 37, 5 and 10 bits, 12 bits remain, so 4096 identifiers can be allocated per
 * millisecond per machine, and timestamps last roughly four years past the epoch.
 *
 * <p>Widths are fixed at construction. Derived maxima and shifts are computed once.
 *
 * <h3>Timestamps</h3>
 *
 * <p>The default {@link rpctrace.Clock} counts milliseconds since {@link #EPOCH_MILLIS}
 * (2026-01-01T00:00:00Z), so that timestamps keep increasing across process restarts and 37 bits
 * last until mid-2030. Layouts meant to outlive that need more timestamp bits.
 */
public final class IdLayout {
  static final int TOTAL_BITS = 64;

  /** 2026-01-01T00:00:00Z in epoch milliseconds: timestamp zero of the default clock. */
  public static final long EPOCH_MILLIS = 1767225600000L;

  public static final IdLayout DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    int timestampBits = 37, groupBits = 5, machineBits = 10;

    /** Bits holding monotonic milliseconds, at most 63. Defaults to 37. */
    public Builder timestampBits(int timestampBits) {
      this.timestampBits = timestampBits;
      return this;
    }

    /** Bits holding the group identity. Defaults to 5. */
    public Builder groupBits(int groupBits) {
      this.groupBits = groupBits;
      return this;
    }

    /** Bits holding the machine identity. Defaults to 10. */
    public Builder machineBits(int machineBits) {
      this.machineBits = machineBits;
      return this;
    }

    public IdLayout build() {
      if (timestampBits < 1) throw new IllegalArgumentException("timestampBits < 1");
      if (timestampBits >= TOTAL_BITS) throw new IllegalArgumentException("timestampBits > 63");
      if (groupBits < 0) throw new IllegalArgumentException("groupBits < 0");
      if (machineBits < 0) throw new IllegalArgumentException("machineBits < 0");
      if (timestampBits + groupBits + machineBits > TOTAL_BITS) {
        throw new IllegalArgumentException(
          "timestampBits + groupBits + machineBits > " + TOTAL_BITS);
      }
      return new IdLayout(this);
    }

    Builder() {
    }
  }

  final int timestampBits, groupBits, machineBits, sequenceBits;
  final long timestampMax, groupIdMax, machineIdMax, sequenceMax;
  final int timestampShift, groupShift, machineShift;

  IdLayout(Builder builder) {
    timestampBits = builder.timestampBits;
    groupBits = builder.groupBits;
    machineBits = builder.machineBits;
    sequenceBits = TOTAL_BITS - timestampBits - groupBits - machineBits;

    timestampMax = maxValue(timestampBits);
    groupIdMax = maxValue(groupBits);
    machineIdMax = maxValue(machineBits);
    sequenceMax = maxValue(sequenceBits);

    machineShift = sequenceBits;
    groupShift = machineShift + machineBits;
    timestampShift = groupShift + groupBits;
  }

  static long maxValue(int bits) {
    return (1L << bits) - 1;
  }

  public int timestampBits() {
    return timestampBits;
  }

  public int groupBits() {
    return groupBits;
  }

  public int machineBits() {
    return machineBits;
  }

  public int sequenceBits() {
    return sequenceBits;
  }

  /** Largest timestamp an identifier can hold, in milliseconds. */
  public long timestampMax() {
    return timestampMax;
  }

  public long groupIdMax() {
    return groupIdMax;
  }

  public long machineIdMax() {
    return machineIdMax;
  }

  /** Largest sequence within one millisecond. One more than this are available per millisecond. */
  public long sequenceMax() {
    return sequenceMax;
  }

  public boolean isValidGroupId(long groupId) {
    return groupId >= 0 && groupId <= groupIdMax;
  }

  public boolean isValidMachineId(long machineId) {
    return machineId >= 0 && machineId <= machineIdMax;
  }

  /** Packs the fields without validating them. */
  long compose(long timestamp, long groupId, long machineId, long sequence) {
    return (timestamp << timestampShift)
      | (groupId << groupShift)
      | (machineId << machineShift)
      | sequence;
  }

  public long timestamp(long id) {
    return (id >>> timestampShift) & timestampMax;
  }

  public long groupId(long id) {
    return (id >>> groupShift) & groupIdMax;
  }

  public long machineId(long id) {
    return (id >>> machineShift) & machineIdMax;
  }

  public long sequence(long id) {
    return id & sequenceMax;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof IdLayout)) return false;
    IdLayout that = (IdLayout) o;
    return timestampBits == that.timestampBits
      && groupBits == that.groupBits
      && machineBits == that.machineBits;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= timestampBits;
    h *= 1000003;
    h ^= groupBits;
    h *= 1000003;
    h ^= machineBits;
    return h;
  }

  @Override public String toString() {
    return "IdLayout{"
      + "timestampBits=" + timestampBits + ", "
      + "groupBits=" + groupBits + ", "
      + "machineBits=" + machineBits + ", "
      + "sequenceBits=" + sequenceBits
      + "}";
  }
}
