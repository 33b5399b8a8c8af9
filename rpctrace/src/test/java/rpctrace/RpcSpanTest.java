/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcSpanTest {

  @Test void defaultsToUnset() {
    RpcSpan span = new RpcSpan();

    assertThat(span.hasTraceId()).isFalse();
    assertThat(span.hasSpanId()).isFalse();
    assertThat(span.hasParentSpanId()).isFalse();
    assertThat(span.hasDataType()).isFalse();
    assertThat(span.hasCompressType()).isFalse();
    assertThat(span.hasStatus()).isFalse();
    assertThat(span.hasError()).isFalse();
    assertThat(span.hasStartTime()).isFalse();
    assertThat(span.hasEndTime()).isFalse();
    assertThat(span.hasCost()).isFalse();

    assertThat(span.traceId()).isEqualTo(RpcSpan.UINT64_UNSET);
    assertThat(span.spanId()).isEqualTo(RpcSpan.UINT_UNSET);
    assertThat(span.status()).isEqualTo(RpcSpan.INT_UNSET);
    assertThat(span.serviceName()).isEmpty();
    assertThat(span.methodName()).isEmpty();
    assertThat(span.remoteIp()).isEmpty();
  }

  @Test void zeroIsSet() {
    RpcSpan span = new RpcSpan();
    span.traceId(0L);
    span.spanId(0);
    span.cost(0L);
    span.error(0);

    assertThat(span.hasTraceId()).isTrue();
    assertThat(span.hasSpanId()).isTrue();
    assertThat(span.hasCost()).isTrue();
    assertThat(span.hasError()).isTrue();
  }

  @Test void unsignedValuesRoundTrip() {
    RpcSpan span = new RpcSpan();
    span.spanId((int) 0xfffffffeL);
    span.startTime(Long.MIN_VALUE);

    assertThat(Integer.toUnsignedLong(span.spanId())).isEqualTo(0xfffffffeL);
    assertThat(span.hasSpanId()).isTrue();
    assertThat(span.hasStartTime()).isTrue();
  }

  @Test void copyConstructor() {
    RpcSpan span = fullSpan();
    RpcSpan copy = new RpcSpan(span);

    assertThat(copy).isEqualTo(span).hasSameHashCodeAs(span);

    copy.methodName("other");
    assertThat(span.methodName()).isEqualTo("Echo");
  }

  @Test void equalsConsidersEveryField() {
    RpcSpan span = fullSpan(), other = fullSpan();
    other.compressType(2);

    assertThat(span).isNotEqualTo(other);
  }

  @Test void textCantBeNull() {
    RpcSpan span = new RpcSpan();

    assertThatThrownBy(() -> span.serviceName(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("serviceName == null");
    assertThatThrownBy(() -> span.methodName(null))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> span.remoteIp(null))
      .isInstanceOf(NullPointerException.class);
  }

  @Test void toString_onlyIncludesSetFields() {
    assertThat(new RpcSpan()).hasToString("RpcSpan{}");

    RpcSpan span = new RpcSpan();
    span.spanId(-2);
    span.methodName("Echo");
    assertThat(span).hasToString("RpcSpan{spanId=4294967294, methodName=Echo}");
  }

  static RpcSpan fullSpan() {
    RpcSpan span = new RpcSpan();
    span.traceId(1L);
    span.spanId(2);
    span.parentSpanId(3);
    span.serviceName("Example");
    span.methodName("Echo");
    span.remoteIp("10.0.0.1");
    span.dataType(0);
    span.compressType(1);
    span.status(0);
    span.error(0);
    span.startTime(1000L);
    span.endTime(1005L);
    span.cost(5L);
    return span;
  }
}
