/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.handler;

import rpctrace.RpcSpan;

/**
 * Renders a span as one line:
 * <pre>{@code
 * trace_id:<u64> span_id:<u32> service:<text> method:<text> start:<u64>[ parent_span_id:<u32>][ end_time:<u64>][ cost:<u64> remote_ip:<text>]
 * }</pre>
 *
 * <p>Bracketed segments are only written when set, in that order. Cost and remote IP are written
 * as a pair, keyed on cost. Unset mandatory fields are written as their unsigned sentinel.
 */
public final class SpanLogFormat {

  public static String format(RpcSpan span) {
    if (span == null) throw new NullPointerException("span == null");
    StringBuilder b = new StringBuilder(128);
    write(span, b);
    return b.toString();
  }

  public static void write(RpcSpan span, StringBuilder b) {
    b.append("trace_id:").append(Long.toUnsignedString(span.traceId()))
      .append(" span_id:").append(Integer.toUnsignedString(span.spanId()))
      .append(" service:").append(span.serviceName())
      .append(" method:").append(span.methodName())
      .append(" start:").append(Long.toUnsignedString(span.startTime()));

    if (span.hasParentSpanId()) {
      b.append(" parent_span_id:").append(Integer.toUnsignedString(span.parentSpanId()));
    }
    if (span.hasEndTime()) {
      b.append(" end_time:").append(Long.toUnsignedString(span.endTime()));
    }
    if (span.hasCost()) {
      b.append(" cost:").append(Long.toUnsignedString(span.cost()))
        .append(" remote_ip:").append(span.remoteIp());
    }
  }

  SpanLogFormat() {
  }
}
