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
import io.calltrace.census.internal.CallTracerConstants;
import io.grpc.Metadata;
import io.grpc.Status;
import io.opencensus.contrib.grpc.metrics.RpcMeasureConstants;
import io.opencensus.stats.MeasureMap;
import io.opencensus.tags.TagContext;
import io.opencensus.trace.MessageEvent;
import io.opencensus.trace.Span;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Observes one attempt of a call and reports its per-attempt stats and span.
 *
 * <p>Events of a single attempt arrive one at a time, but not necessarily on the same thread.
 * {@link #onEnd} is the last event and must be called exactly once; it records the attempt,
 * ends the attempt span and hands the attempt back to its {@link CensusCallTracer}.
 */
public final class CensusCallAttemptTracer {
  private static final Logger logger = Logger.getLogger(CensusCallAttemptTracer.class.getName());
  private static final double NANOS_PER_MILLI = TimeUnit.MILLISECONDS.toNanos(1);

  private static final AtomicLongFieldUpdater<CensusCallAttemptTracer> sentMessageCountUpdater =
      AtomicLongFieldUpdater.newUpdater(CensusCallAttemptTracer.class, "sentMessageCount");
  private static final AtomicLongFieldUpdater<CensusCallAttemptTracer>
      receivedMessageCountUpdater =
          AtomicLongFieldUpdater.newUpdater(CensusCallAttemptTracer.class, "receivedMessageCount");

  /** Lifecycle of an attempt. {@code CANCELLED} is informational; only {@code ENDED} is final. */
  enum State {
    CREATED,
    ACTIVE,
    CANCELLED,
    ENDED
  }

  /**
   * Who holds the attempt until its call is done. The first attempt of a call lives in the
   * call's own slot and goes away with the call; every retried attempt is registered with the
   * call on its own and has to be removed from it when it ends.
   */
  enum AttemptOwnership {
    CALL_SCOPED,
    INDEPENDENT
  }

  private final CensusCallTracer parent;
  private final AttemptOwnership ownership;
  private final long previousAttempts;
  private final boolean transparentRetry;
  private final Stopwatch stopwatch;
  private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
  @Nullable
  private volatile CensusContext context;
  private volatile long sentMessageCount;
  private volatile long receivedMessageCount;
  private volatile long elapsedServerTimeNanos;
  private volatile Status.Code statusCode = Status.Code.OK;

  CensusCallAttemptTracer(
      CensusCallTracer parent, AttemptOwnership ownership, long previousAttempts,
      boolean transparentRetry) {
    this.parent = checkNotNull(parent, "parent");
    this.ownership = checkNotNull(ownership, "ownership");
    this.previousAttempts = previousAttempts;
    this.transparentRetry = transparentRetry;
    this.stopwatch = Stopwatch.createStarted(parent.module.ticker);
  }

  /**
   * Starts the attempt span under the call span and returns the binary trace and tag contexts
   * to attach to the outgoing headers. Empty arrays mean there is nothing to attach.
   */
  public PropagatedContext onSendInitialMetadata() {
    CensusContext ctx = context;
    if (ctx == null) {
      ctx = parent.module.propagator.generateAttemptContext(
          parent.getAttemptSpanName(), parent.getContext(), previousAttempts, transparentRetry);
      context = ctx;
      state.compareAndSet(State.CREATED, State.ACTIVE);
    }
    CensusContextPropagator propagator = parent.module.propagator;
    return new PropagatedContext(
        propagator.serializeTraceContext(
            ctx.getSpan(), CallTracerConstants.MAX_TRACE_CONTEXT_LENGTH),
        propagator.serializeTags(ctx.getTags(), CallTracerConstants.MAX_TAGS_LENGTH));
  }

  public void onSendMessage() {
    sentMessageCountUpdater.getAndIncrement(this);
  }

  public void onReceiveMessage() {
    receivedMessageCountUpdater.getAndIncrement(this);
  }

  /**
   * Adds a message event to the attempt span. Sizes of {@code -1} are unknown. Ignored if the
   * attempt has not sent its initial metadata yet.
   */
  public void recordMessageEvent(
      MessageEvent.Type type, int seqNo, long optionalWireSize, long optionalUncompressedSize) {
    CensusContext ctx = context;
    if (ctx == null) {
      return;
    }
    MessageEvent.Builder eventBuilder = MessageEvent.builder(type, seqNo);
    if (optionalUncompressedSize != -1) {
      eventBuilder.setUncompressedMessageSize(optionalUncompressedSize);
    }
    if (optionalWireSize != -1) {
      eventBuilder.setCompressedMessageSize(optionalWireSize);
    }
    ctx.getSpan().addMessageEvent(eventBuilder.build());
  }

  /**
   * Records the byte counts and the server-reported latency of the attempt. The server stats
   * entry is removed from {@code trailers}. This does not end the attempt.
   */
  public void onReceiveTrailingMetadata(
      Status status, Metadata trailers, TransportStreamStats transportStats) {
    checkNotNull(status, "status");
    checkNotNull(trailers, "trailers");
    checkNotNull(transportStats, "transportStats");
    long elapsedServerTime = CensusContextPropagator.parseServerElapsedTime(trailers);
    elapsedServerTimeNanos = elapsedServerTime;
    Status.Code code = status.getCode();
    statusCode = code;
    CensusStatsSink statsSink = parent.module.statsSink;
    MeasureMap measureMap = statsSink.newMeasureMap()
        .put(
            RpcMeasureConstants.GRPC_CLIENT_SENT_BYTES_PER_RPC,
            (double) transportStats.getOutgoingDataBytes())
        .put(
            RpcMeasureConstants.GRPC_CLIENT_RECEIVED_BYTES_PER_RPC,
            (double) transportStats.getIncomingDataBytes())
        .put(
            RpcMeasureConstants.GRPC_CLIENT_SERVER_LATENCY,
            elapsedServerTime / NANOS_PER_MILLI);
    statsSink.record(measureMap, statsSink.clientTags(tags(), parent.getMethod(), code));
  }

  /**
   * Marks the attempt cancelled. The attempt still has to be ended with {@link #onEnd}.
   */
  public void onCancel(@Nullable Throwable reason) {
    statusCode = Status.Code.CANCELLED;
    state.compareAndSet(State.CREATED, State.CANCELLED);
    state.compareAndSet(State.ACTIVE, State.CANCELLED);
    logger.log(Level.FINE, "Attempt of " + parent.getMethod() + " cancelled", reason);
  }

  /**
   * Records the attempt's latency and message counts, ends its span and releases it from the
   * call.
   *
   * @throws IllegalStateException if the attempt has already ended
   */
  public void onEnd() {
    State previous = state.getAndSet(State.ENDED);
    checkState(previous != State.ENDED, "Attempt of %s already ended", parent.getMethod());
    stopwatch.stop();
    long roundtripNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);
    Status.Code code = statusCode;
    CensusStatsSink statsSink = parent.module.statsSink;
    MeasureMap measureMap = statsSink.newMeasureMap()
        .put(RpcMeasureConstants.GRPC_CLIENT_ROUNDTRIP_LATENCY, roundtripNanos / NANOS_PER_MILLI)
        .put(RpcMeasureConstants.GRPC_CLIENT_SENT_MESSAGES_PER_RPC, sentMessageCount)
        .put(RpcMeasureConstants.GRPC_CLIENT_RECEIVED_MESSAGES_PER_RPC, receivedMessageCount);
    statsSink.record(measureMap, statsSink.clientTags(tags(), parent.getMethod(), code));
    CensusContext ctx = context;
    if (ctx != null) {
      Span span = ctx.getSpan();
      if (code != Status.Code.OK) {
        span.setStatus(CensusContextPropagator.convertStatus(code));
      }
      ctx.endSpan();
    }
    parent.attemptEnded(this);
  }

  private TagContext tags() {
    CensusContext ctx = context;
    return ctx != null ? ctx.getTags() : parent.getContext().getTags();
  }

  AttemptOwnership getOwnership() {
    return ownership;
  }

  @VisibleForTesting
  State getState() {
    return state.get();
  }

  @VisibleForTesting
  long getSentMessageCount() {
    return sentMessageCount;
  }

  @VisibleForTesting
  long getReceivedMessageCount() {
    return receivedMessageCount;
  }

  @VisibleForTesting
  long getElapsedServerTimeNanos() {
    return elapsedServerTimeNanos;
  }

  @VisibleForTesting
  Status.Code getStatusCode() {
    return statusCode;
  }
}
