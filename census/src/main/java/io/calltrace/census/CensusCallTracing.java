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

import com.google.common.base.Ticker;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.grpc.ClientInterceptor;
import io.grpc.ManagedChannelBuilder;
import io.opencensus.stats.Stats;
import io.opencensus.stats.StatsRecorder;
import io.opencensus.tags.Tagger;
import io.opencensus.tags.Tags;
import io.opencensus.tags.propagation.TagContextBinarySerializer;
import io.opencensus.trace.Tracer;
import io.opencensus.trace.Tracing;
import io.opencensus.trace.propagation.BinaryFormat;
import javax.annotation.Nullable;

/**
 * The entrypoint for per-call and per-attempt OpenCensus tracing of gRPC clients.
 *
 * <p>Either install {@link #getClientInterceptor()} on a channel, or drive
 * {@link CensusCallTracer}s directly from an RPC engine via {@link #newCallTracer}.
 */
public final class CensusCallTracing {

  final CensusContextPropagator propagator;
  final CensusStatsSink statsSink;
  final Ticker ticker;
  final boolean recordRetryMetrics;
  private final Tracer tracer;
  private final Tagger tagger;

  private CensusCallTracing(Builder builder) {
    this.tracer = builder.tracer != null ? builder.tracer : Tracing.getTracer();
    this.tagger = builder.tagger != null ? builder.tagger : Tags.getTagger();
    BinaryFormat traceFormat = builder.traceFormat != null
        ? builder.traceFormat : Tracing.getPropagationComponent().getBinaryFormat();
    TagContextBinarySerializer tagSerializer = builder.tagSerializer != null
        ? builder.tagSerializer : Tags.getTagPropagationComponent().getBinarySerializer();
    StatsRecorder statsRecorder = builder.statsRecorder != null
        ? builder.statsRecorder : Stats.getStatsRecorder();
    this.ticker = builder.ticker;
    this.recordRetryMetrics = builder.recordRetryMetrics;
    this.propagator = new CensusContextPropagator(
        tracer, traceFormat, tagger, tagSerializer, builder.tracingEnabled,
        builder.tagPropagationEnabled);
    this.statsSink = new CensusStatsSink(tagger, statsRecorder);
  }

  /**
   * Creates a new builder for {@link CensusCallTracing}.
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Starts tracing a call.
   *
   * @param callPath the call path, e.g. {@code /pkg.Service/Method}; a missing leading
   *     {@code '/'} is accepted
   * @param parent the context the call span and tags descend from, or {@code null} to start a
   *     root span without tags
   */
  public CensusCallTracer newCallTracer(String callPath, @Nullable CensusContext parent) {
    return new CensusCallTracer(this, callPath, parent);
  }

  /**
   * Returns the span and tag context of the current {@link io.grpc.Context}.
   */
  public CensusContext currentContext() {
    return new CensusContext(tracer.getCurrentSpan(), tagger.getCurrentTagContext());
  }

  /**
   * Returns a {@link ClientInterceptor} that traces every call made through it.
   */
  public ClientInterceptor getClientInterceptor() {
    return new CensusCallTracingInterceptor(this);
  }

  /**
   * Configures a {@link ManagedChannelBuilder} to trace every call of the channel.
   *
   * @param channelBuilder The channel builder to configure.
   * @return The configured channel builder.
   */
  @CanIgnoreReturnValue
  public <T extends ManagedChannelBuilder<T>> T configureChannelBuilder(T channelBuilder) {
    return channelBuilder.intercept(getClientInterceptor());
  }

  /**
   * Builder for {@link CensusCallTracing}. Components left unset use the globally registered
   * OpenCensus implementation.
   */
  public static final class Builder {
    @Nullable private Tracer tracer;
    @Nullable private BinaryFormat traceFormat;
    @Nullable private Tagger tagger;
    @Nullable private TagContextBinarySerializer tagSerializer;
    @Nullable private StatsRecorder statsRecorder;
    private Ticker ticker = Ticker.systemTicker();
    private boolean tracingEnabled = true;
    private boolean tagPropagationEnabled = true;
    private boolean recordRetryMetrics = true;

    private Builder() {
    }

    @CanIgnoreReturnValue
    public Builder setTracer(Tracer tracer) {
      this.tracer = checkNotNull(tracer, "tracer");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTraceBinaryFormat(BinaryFormat traceFormat) {
      this.traceFormat = checkNotNull(traceFormat, "traceFormat");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTagger(Tagger tagger) {
      this.tagger = checkNotNull(tagger, "tagger");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTagContextBinarySerializer(TagContextBinarySerializer tagSerializer) {
      this.tagSerializer = checkNotNull(tagSerializer, "tagSerializer");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStatsRecorder(StatsRecorder statsRecorder) {
      this.statsRecorder = checkNotNull(statsRecorder, "statsRecorder");
      return this;
    }

    /**
     * Sets the time source for latencies and retry delays. Defaults to
     * {@link Ticker#systemTicker()}.
     */
    @CanIgnoreReturnValue
    public Builder setTicker(Ticker ticker) {
      this.ticker = checkNotNull(ticker, "ticker");
      return this;
    }

    /**
     * Disable or enable spans. Enabled by default. When disabled no trace context is
     * propagated, stats are still recorded.
     */
    @CanIgnoreReturnValue
    public Builder setTracingEnabled(boolean value) {
      this.tracingEnabled = value;
      return this;
    }

    /**
     * Disable or enable sending the call's propagating tags in {@code grpc-tags-bin}. Enabled by
     * default.
     */
    @CanIgnoreReturnValue
    public Builder setTagPropagationEnabled(boolean value) {
      this.tagPropagationEnabled = value;
      return this;
    }

    /**
     * Disable or enable recording retries, transparent retries, retry delay and API latency per
     * call. Enabled by default.
     */
    @CanIgnoreReturnValue
    public Builder setRecordRetryMetrics(boolean value) {
      this.recordRetryMetrics = value;
      return this;
    }

    /**
     * Builds a new {@link CensusCallTracing}.
     */
    public CensusCallTracing build() {
      return new CensusCallTracing(this);
    }
  }
}
