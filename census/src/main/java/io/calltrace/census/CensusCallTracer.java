/*
 * Copyright 2026 The calltrace Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.calltrace.census;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import io.calltrace.census.CensusCallAttemptTracer.AttemptOwnership;
import io.calltrace.census.internal.CallTracerConstants;
import io.opencensus.stats.MeasureMap;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * Traces one logical call across all of its attempts.
 *
 * <p>The call creates an attempt tracer for the first attempt and for every retry, and
 * accumulates what only the call as a whole can know: how many retries and transparent retries
 * happened, and how long the call spent with no attempt in flight. Those aggregates are recorded
 * once, by {@link #finish}, together with the latency of the whole call.
 *
 * <p>Retries may overlap (hedging) and may end on different threads, so the shared counters are
 * only read and written while holding the call's lock, and only from this class.
 */
public final class CensusCallTracer {
  private static final double NANOS_PER_MILLI = TimeUnit.MILLISECONDS.toNanos(1);

  final CensusCallTracing module;
  private final String method;
  private final String attemptSpanName;
  private final CensusContext context;
  private final Object lock = new Object();
  @GuardedBy("lock")
  private final Stopwatch callStopwatch;
  @GuardedBy("lock")
  private long retries;
  @GuardedBy("lock")
  private long transparentRetries;
  @GuardedBy("lock")
  private int activeAttempts;
  @GuardedBy("lock")
  private long lastAttemptEndNanos;
  @GuardedBy("lock")
  private long retryDelayNanos;
  // Reclaimed together with the call, never released on its own.
  @GuardedBy("lock")
  @Nullable
  private CensusCallAttemptTracer firstAttempt;
  @GuardedBy("lock")
  private final Set<CensusCallAttemptTracer> independentAttempts = new HashSet<>();
  @GuardedBy("lock")
  private boolean callEnded;
  @GuardedBy("lock")
  private boolean finishedCallRecorded;

  CensusCallTracer(CensusCallTracing module, String callPath, @Nullable CensusContext parent) {
    this.module = checkNotNull(module, "module");
    this.method = methodFromPath(checkNotNull(callPath, "callPath"));
    this.attemptSpanName = generateTraceSpanName("Attempt", method);
    this.context =
        module.propagator.generateCallContext(generateTraceSpanName("Sent", method), parent);
    this.callStopwatch = Stopwatch.createStarted(module.ticker);
  }

  /**
   * Starts tracing a new attempt of this call.
   *
   * @param isTransparentRetry whether the transport retried the call on its own, without the
   *     attempt counting against the call's retry budget
   * @throws IllegalStateException if {@link #finish} has already been called
   */
  public CensusCallAttemptTracer startNewAttempt(boolean isTransparentRetry) {
    CensusCallAttemptTracer attempt = tryStartNewAttempt(isTransparentRetry);
    checkState(attempt != null, "Call to %s already finished", method);
    return attempt;
  }

  /**
   * Like {@link #startNewAttempt}, but returns {@code null} instead of throwing if the call has
   * already finished. A retry may race with the cancellation of its call.
   */
  @Nullable
  public CensusCallAttemptTracer tryStartNewAttempt(boolean isTransparentRetry) {
    synchronized (lock) {
      if (callEnded) {
        return null;
      }
      boolean isFirstAttempt = retries == 0 && transparentRetries == 0;
      if (!isFirstAttempt && activeAttempts == 0) {
        retryDelayNanos += module.ticker.read() - lastAttemptEndNanos;
      }
      long previousAttempts = retries + transparentRetries;
      if (isTransparentRetry) {
        transparentRetries++;
      } else {
        retries++;
      }
      activeAttempts++;
      CensusCallAttemptTracer attempt;
      if (isFirstAttempt) {
        attempt = new CensusCallAttemptTracer(
            this, AttemptOwnership.CALL_SCOPED, previousAttempts, isTransparentRetry);
        firstAttempt = attempt;
      } else {
        attempt = new CensusCallAttemptTracer(
            this, AttemptOwnership.INDEPENDENT, previousAttempts, isTransparentRetry);
        independentAttempts.add(attempt);
      }
      return attempt;
    }
  }

  // Called by each attempt as the last step of CensusCallAttemptTracer.onEnd().
  void attemptEnded(CensusCallAttemptTracer attempt) {
    boolean shouldRecordFinishedCall = false;
    synchronized (lock) {
      checkState(activeAttempts > 0, "No active attempt of %s to end", method);
      if (--activeAttempts == 0) {
        lastAttemptEndNanos = module.ticker.read();
        if (callEnded && !finishedCallRecorded) {
          shouldRecordFinishedCall = true;
          finishedCallRecorded = true;
        }
      }
      switch (attempt.getOwnership()) {
        case CALL_SCOPED:
          checkState(attempt == firstAttempt, "Attempt does not belong to call %s", method);
          break;
        case INDEPENDENT:
          checkState(
              independentAttempts.remove(attempt), "Attempt does not belong to call %s", method);
          break;
        default:
          throw new AssertionError("Unhandled ownership " + attempt.getOwnership());
      }
    }
    if (shouldRecordFinishedCall) {
      recordFinishedCall();
    }
  }

  /**
   * Marks the call as done and records the per-call retry stats and latency. If attempts are
   * still in flight, recording happens when the last of them ends. No attempt can be started
   * afterwards.
   *
   * @throws IllegalStateException if called more than once
   */
  public void finish() {
    boolean shouldRecordFinishedCall = false;
    synchronized (lock) {
      checkState(!callEnded, "Call to %s already finished", method);
      callEnded = true;
      callStopwatch.stop();
      if (activeAttempts == 0) {
        shouldRecordFinishedCall = true;
        finishedCallRecorded = true;
      }
    }
    if (shouldRecordFinishedCall) {
      recordFinishedCall();
    }
  }

  private void recordFinishedCall() {
    if (module.recordRetryMetrics) {
      long retriesPerCall;
      long transparentRetriesPerCall;
      long delayNanos;
      long callLatencyNanos;
      synchronized (lock) {
        retriesPerCall = retriesPerCall(retries);
        transparentRetriesPerCall = transparentRetries;
        delayNanos = retryDelayNanos;
        callLatencyNanos = callStopwatch.elapsed(TimeUnit.NANOSECONDS);
      }
      CensusStatsSink statsSink = module.statsSink;
      MeasureMap measureMap = statsSink.newMeasureMap()
          .put(CallTracerConstants.RETRIES_PER_CALL, retriesPerCall)
          .put(CallTracerConstants.TRANSPARENT_RETRIES_PER_CALL, transparentRetriesPerCall)
          .put(CallTracerConstants.RETRY_DELAY_PER_CALL, delayNanos / NANOS_PER_MILLI)
          .put(CallTracerConstants.API_LATENCY_PER_CALL, callLatencyNanos / NANOS_PER_MILLI);
      statsSink.record(measureMap, statsSink.clientTags(context.getTags(), method, null));
    }
    context.endSpan();
  }

  /**
   * The first non-transparent attempt is not a retry. Clamped at zero for calls that finished
   * without one.
   */
  @VisibleForTesting
  static long retriesPerCall(long nonTransparentAttempts) {
    return nonTransparentAttempts > 0 ? nonTransparentAttempts - 1 : 0;
  }

  /** Returns the method name, i.e. the call path without its leading {@code '/'}. */
  public String getMethod() {
    return method;
  }

  CensusContext getContext() {
    return context;
  }

  String getAttemptSpanName() {
    return attemptSpanName;
  }

  @VisibleForTesting
  static String methodFromPath(String callPath) {
    return callPath.startsWith("/") ? callPath.substring(1) : callPath;
  }

  /**
   * Converts a method name to a span name, e.g. {@code Sent.pkg.Service.Method} for prefix
   * {@code Sent} and method {@code pkg.Service/Method}.
   */
  @VisibleForTesting
  static String generateTraceSpanName(String prefix, String method) {
    return prefix + "." + method.replace('/', '.');
  }

  @VisibleForTesting
  long getRetryCount() {
    synchronized (lock) {
      return retries;
    }
  }

  @VisibleForTesting
  long getTransparentRetryCount() {
    synchronized (lock) {
      return transparentRetries;
    }
  }

  @VisibleForTesting
  int getActiveAttemptCount() {
    synchronized (lock) {
      return activeAttempts;
    }
  }

  @VisibleForTesting
  long getRetryDelayNanos() {
    synchronized (lock) {
      return retryDelayNanos;
    }
  }

  @VisibleForTesting
  int getIndependentAttemptCount() {
    synchronized (lock) {
      return independentAttempts.size();
    }
  }

  @VisibleForTesting
  @Nullable
  CensusCallAttemptTracer getFirstAttempt() {
    synchronized (lock) {
      return firstAttempt;
    }
  }
}
