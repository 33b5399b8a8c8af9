/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.internal;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import rpctrace.Clock;
import rpctrace.id.IdLayout;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 */
public abstract class Platform {
  private static final Platform PLATFORM = new Jre17();
  private static final Logger LOG = Logger.getLogger(rpctrace.RpcTracing.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)} */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = {param1};
    lr.setParameters(params);
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  public abstract long nanoTime();

  /**
   * Returns milliseconds since {@link IdLayout#EPOCH_MILLIS}, advanced by {@link #nanoTime()}.
   *
   * <p>The wall clock is only read once, so the result never goes backward within a process even
   * when the system time is adjusted. Anchoring to the wall clock keeps a restarted process from
   * reusing timestamps of its predecessor.
   */
  public abstract Clock clock();

  static final class Jre17 extends Platform {
    final long baseTickMillis = System.currentTimeMillis() - IdLayout.EPOCH_MILLIS;
    final long baseTickNanos = System.nanoTime();

    @Override public long nanoTime() {
      return System.nanoTime();
    }

    @Override public Clock clock() {
      return new Clock() {
        @Override public long currentTickMillis() {
          return baseTickMillis + TimeUnit.NANOSECONDS.toMillis(nanoTime() - baseTickNanos);
        }

        @Override public String toString() {
          return "TickClock{"
            + "baseTickMillis=" + baseTickMillis + ", "
            + "baseTickNanos=" + baseTickNanos
            + "}";
        }
      };
    }

    @Override public String toString() {
      return "Jre17{}";
    }
  }
}
