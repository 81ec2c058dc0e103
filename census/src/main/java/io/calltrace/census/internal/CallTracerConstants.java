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

package io.calltrace.census.internal;

import static com.google.common.base.Preconditions.checkNotNull;
import static io.opencensus.contrib.grpc.metrics.RpcMeasureConstants.GRPC_CLIENT_METHOD;

import com.google.common.collect.ImmutableList;
import io.grpc.Metadata;
import io.opencensus.contrib.grpc.metrics.RpcViewConstants;
import io.opencensus.stats.Aggregation;
import io.opencensus.stats.Measure;
import io.opencensus.stats.Measure.MeasureDouble;
import io.opencensus.stats.Measure.MeasureLong;
import io.opencensus.stats.View;
import io.opencensus.stats.ViewManager;
import java.util.Collections;

/**
 * Measures, views, header keys and size limits shared by the call and attempt tracers.
 *
 * <p>Attempt-level measures come from {@code RpcMeasureConstants}; the call-level ones are not
 * part of the OpenCensus gRPC contrib library and are defined here.
 */
public final class CallTracerConstants {

  /** Upper bound for the serialized span context attached as {@code grpc-trace-bin}. */
  public static final int MAX_TRACE_CONTEXT_LENGTH = 64;

  /** Upper bound for the serialized tag context attached as {@code grpc-tags-bin}. */
  public static final int MAX_TAGS_LENGTH = 2048;

  public static final Metadata.Key<byte[]> TRACE_CONTEXT_KEY =
      Metadata.Key.of("grpc-trace-bin", Metadata.BINARY_BYTE_MARSHALLER);

  public static final Metadata.Key<byte[]> TAGS_KEY =
      Metadata.Key.of("grpc-tags-bin", Metadata.BINARY_BYTE_MARSHALLER);

  public static final Metadata.Key<byte[]> SERVER_STATS_KEY =
      Metadata.Key.of("grpc-server-stats-bin", Metadata.BINARY_BYTE_MARSHALLER);

  public static final MeasureLong RETRIES_PER_CALL =
      Measure.MeasureLong.create(
          "grpc.io/client/retries_per_call", "Number of retries per call", "1");

  public static final MeasureLong TRANSPARENT_RETRIES_PER_CALL =
      Measure.MeasureLong.create(
          "grpc.io/client/transparent_retries_per_call", "Transparent retries per call", "1");

  public static final MeasureDouble RETRY_DELAY_PER_CALL =
      Measure.MeasureDouble.create(
          "grpc.io/client/retry_delay_per_call", "Retry delay per call", "ms");

  public static final MeasureDouble API_LATENCY_PER_CALL =
      Measure.MeasureDouble.create(
          "grpc.io/client/api_latency",
          "Time taken by gRPC to complete an RPC from application's perspective",
          "ms");

  static final Aggregation AGGREGATION_WITH_COUNT_HISTOGRAM =
      RpcViewConstants.GRPC_CLIENT_SENT_MESSAGES_PER_RPC_VIEW.getAggregation();

  static final Aggregation AGGREGATION_WITH_MILLIS_HISTOGRAM =
      RpcViewConstants.GRPC_CLIENT_ROUNDTRIP_LATENCY_VIEW.getAggregation();

  public static final View GRPC_CLIENT_RETRIES_PER_CALL_VIEW =
      View.create(
          View.Name.create("grpc.io/client/retries_per_call"),
          "Number of client retries per call",
          RETRIES_PER_CALL,
          AGGREGATION_WITH_COUNT_HISTOGRAM,
          Collections.singletonList(GRPC_CLIENT_METHOD));

  public static final View GRPC_CLIENT_TRANSPARENT_RETRIES_PER_CALL_VIEW =
      View.create(
          View.Name.create("grpc.io/client/transparent_retries_per_call"),
          "Number of client transparent retries per call",
          TRANSPARENT_RETRIES_PER_CALL,
          AGGREGATION_WITH_COUNT_HISTOGRAM,
          Collections.singletonList(GRPC_CLIENT_METHOD));

  public static final View GRPC_CLIENT_RETRY_DELAY_PER_CALL_VIEW =
      View.create(
          View.Name.create("grpc.io/client/retry_delay_per_call"),
          "Total time of delay while there is no active attempt during the client call",
          RETRY_DELAY_PER_CALL,
          AGGREGATION_WITH_MILLIS_HISTOGRAM,
          Collections.singletonList(GRPC_CLIENT_METHOD));

  public static final View GRPC_CLIENT_API_LATENCY_VIEW =
      View.create(
          View.Name.create("grpc.io/client/api_latency"),
          "Time taken by gRPC to complete an RPC from application's perspective",
          API_LATENCY_PER_CALL,
          AGGREGATION_WITH_MILLIS_HISTOGRAM,
          Collections.singletonList(GRPC_CLIENT_METHOD));

  /** Views over the call-level measures defined in this class. */
  public static final ImmutableList<View> CALL_VIEWS =
      ImmutableList.of(
          GRPC_CLIENT_RETRIES_PER_CALL_VIEW,
          GRPC_CLIENT_TRANSPARENT_RETRIES_PER_CALL_VIEW,
          GRPC_CLIENT_RETRY_DELAY_PER_CALL_VIEW,
          GRPC_CLIENT_API_LATENCY_VIEW);

  /** Views over the attempt-level measures the attempt tracer records. */
  public static final ImmutableList<View> ATTEMPT_VIEWS =
      ImmutableList.of(
          RpcViewConstants.GRPC_CLIENT_ROUNDTRIP_LATENCY_VIEW,
          RpcViewConstants.GRPC_CLIENT_SENT_MESSAGES_PER_RPC_VIEW,
          RpcViewConstants.GRPC_CLIENT_RECEIVED_MESSAGES_PER_RPC_VIEW,
          RpcViewConstants.GRPC_CLIENT_SENT_BYTES_PER_RPC_VIEW,
          RpcViewConstants.GRPC_CLIENT_RECEIVED_BYTES_PER_RPC_VIEW,
          RpcViewConstants.GRPC_CLIENT_SERVER_LATENCY_VIEW);

  /**
   * Registers every view in {@link #CALL_VIEWS} and {@link #ATTEMPT_VIEWS}. Registering a view
   * that is already registered with the same definition is a no-op.
   */
  public static void registerAllViews(ViewManager viewManager) {
    checkNotNull(viewManager, "viewManager");
    for (View view : CALL_VIEWS) {
      viewManager.registerView(view);
    }
    for (View view : ATTEMPT_VIEWS) {
      viewManager.registerView(view);
    }
  }

  private CallTracerConstants() {}
}
