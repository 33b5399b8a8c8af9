/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace;

/**
 * This represents one traced RPC call: its identity, timing and outcome. It is mutable, as the RPC
 * layer fills it in while the call progresses.
 *
 * <h3>Unset fields</h3>
 * Numeric fields start "unset" instead of zero, because zero is a valid value for all of them.
 * Identifiers and times are unsigned, so their unset value is all ones ({@link #UINT64_UNSET},
 * {@link #UINT_UNSET}). The small integer codes use {@link #INT_UNSET}. Text fields start empty.
 * Use the {@code hasXxx()} methods rather than comparing against sentinels.
 *
 * <h3>Ownership</h3>
 * This type is not thread safe. Once passed to {@link rpctrace.handler.SpanLogger#newLogTask},
 * the span belongs to the logging pipeline, which releases it exactly once. Callers must not keep
 * mutating it after the hand-off. Use the {@linkplain #RpcSpan(RpcSpan) copy constructor} to keep
 * a private copy.
 *
 * <p>A set {@linkplain #traceId() trace ID} means the caller forced sampling of this span.
 */
public final class RpcSpan {
  public static final long UINT64_UNSET = -1L; // 0xffffffffffffffff
  public static final int UINT_UNSET = -1; // 0xffffffff
  public static final int INT_UNSET = -1;

  long traceId = UINT64_UNSET;
  int spanId = UINT_UNSET, parentSpanId = UINT_UNSET;
  String serviceName = "", methodName = "", remoteIp = "";
  int dataType = INT_UNSET, compressType = INT_UNSET, status = INT_UNSET, error = INT_UNSET;
  long startTime = UINT64_UNSET, endTime = UINT64_UNSET, cost = UINT64_UNSET;

  public RpcSpan() {
  }

  public RpcSpan(RpcSpan toCopy) {
    if (toCopy == null) throw new NullPointerException("toCopy == null");
    traceId = toCopy.traceId;
    spanId = toCopy.spanId;
    parentSpanId = toCopy.parentSpanId;
    serviceName = toCopy.serviceName;
    methodName = toCopy.methodName;
    remoteIp = toCopy.remoteIp;
    dataType = toCopy.dataType;
    compressType = toCopy.compressType;
    status = toCopy.status;
    error = toCopy.error;
    startTime = toCopy.startTime;
    endTime = toCopy.endTime;
    cost = toCopy.cost;
  }

  /** Identifier shared by every span of one call chain, unsigned. */
  public long traceId() {
    return traceId;
  }

  public void traceId(long traceId) {
    this.traceId = traceId;
  }

  public boolean hasTraceId() {
    return traceId != UINT64_UNSET;
  }

  /** Identifier of this call within its trace, unsigned 32-bit. */
  public int spanId() {
    return spanId;
  }

  public void spanId(int spanId) {
    this.spanId = spanId;
  }

  public boolean hasSpanId() {
    return spanId != UINT_UNSET;
  }

  /** Unset on a root span. */
  public int parentSpanId() {
    return parentSpanId;
  }

  public void parentSpanId(int parentSpanId) {
    this.parentSpanId = parentSpanId;
  }

  public boolean hasParentSpanId() {
    return parentSpanId != UINT_UNSET;
  }

  public String serviceName() {
    return serviceName;
  }

  public void serviceName(String serviceName) {
    if (serviceName == null) throw new NullPointerException("serviceName == null");
    this.serviceName = serviceName;
  }

  public String methodName() {
    return methodName;
  }

  public void methodName(String methodName) {
    if (methodName == null) throw new NullPointerException("methodName == null");
    this.methodName = methodName;
  }

  /** Text form of the peer address, or empty. */
  public String remoteIp() {
    return remoteIp;
  }

  public void remoteIp(String remoteIp) {
    if (remoteIp == null) throw new NullPointerException("remoteIp == null");
    this.remoteIp = remoteIp;
  }

  /** Serialization code of the payload, as defined by the transport. */
  public int dataType() {
    return dataType;
  }

  public void dataType(int dataType) {
    this.dataType = dataType;
  }

  public boolean hasDataType() {
    return dataType != INT_UNSET;
  }

  /** Compression code of the payload, as defined by the transport. */
  public int compressType() {
    return compressType;
  }

  public void compressType(int compressType) {
    this.compressType = compressType;
  }

  public boolean hasCompressType() {
    return compressType != INT_UNSET;
  }

  public int status() {
    return status;
  }

  public void status(int status) {
    this.status = status;
  }

  public boolean hasStatus() {
    return status != INT_UNSET;
  }

  public int error() {
    return error;
  }

  public void error(int error) {
    this.error = error;
  }

  public boolean hasError() {
    return error != INT_UNSET;
  }

  /** Epoch milliseconds when the call began, unsigned. */
  public long startTime() {
    return startTime;
  }

  public void startTime(long startTime) {
    this.startTime = startTime;
  }

  public boolean hasStartTime() {
    return startTime != UINT64_UNSET;
  }

  /** Epoch milliseconds when the call completed, unsigned. */
  public long endTime() {
    return endTime;
  }

  public void endTime(long endTime) {
    this.endTime = endTime;
  }

  public boolean hasEndTime() {
    return endTime != UINT64_UNSET;
  }

  /** Duration of the call in milliseconds, unsigned. */
  public long cost() {
    return cost;
  }

  public void cost(long cost) {
    this.cost = cost;
  }

  public boolean hasCost() {
    return cost != UINT64_UNSET;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RpcSpan)) return false;
    RpcSpan that = (RpcSpan) o;
    return traceId == that.traceId
      && spanId == that.spanId
      && parentSpanId == that.parentSpanId
      && serviceName.equals(that.serviceName)
      && methodName.equals(that.methodName)
      && remoteIp.equals(that.remoteIp)
      && dataType == that.dataType
      && compressType == that.compressType
      && status == that.status
      && error == that.error
      && startTime == that.startTime
      && endTime == that.endTime
      && cost == that.cost;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= spanId;
    h *= 1000003;
    h ^= parentSpanId;
    h *= 1000003;
    h ^= serviceName.hashCode();
    h *= 1000003;
    h ^= methodName.hashCode();
    h *= 1000003;
    h ^= (int) ((startTime >>> 32) ^ startTime);
    return h;
  }

  /** Returns a debug representation which only includes set fields. */
  @Override public String toString() {
    StringBuilder result = new StringBuilder("RpcSpan{");
    if (hasTraceId()) result.append("traceId=").append(Long.toUnsignedString(traceId)).append(", ");
    if (hasSpanId()) result.append("spanId=").append(Integer.toUnsignedString(spanId)).append(", ");
    if (hasParentSpanId()) {
      result.append("parentSpanId=").append(Integer.toUnsignedString(parentSpanId)).append(", ");
    }
    if (!serviceName.isEmpty()) result.append("serviceName=").append(serviceName).append(", ");
    if (!methodName.isEmpty()) result.append("methodName=").append(methodName).append(", ");
    if (!remoteIp.isEmpty()) result.append("remoteIp=").append(remoteIp).append(", ");
    if (hasDataType()) result.append("dataType=").append(dataType).append(", ");
    if (hasCompressType()) result.append("compressType=").append(compressType).append(", ");
    if (hasStatus()) result.append("status=").append(status).append(", ");
    if (hasError()) result.append("error=").append(error).append(", ");
    if (hasStartTime()) {
      result.append("startTime=").append(Long.toUnsignedString(startTime)).append(", ");
    }
    if (hasEndTime()) result.append("endTime=").append(Long.toUnsignedString(endTime)).append(", ");
    if (hasCost()) result.append("cost=").append(Long.toUnsignedString(cost)).append(", ");
    int length = result.length();
    if (result.charAt(length - 2) == ',') result.setLength(length - 2);
    return result.append("}").toString();
  }
}
