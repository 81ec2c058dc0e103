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

import com.google.common.annotations.VisibleForTesting;
import io.calltrace.census.internal.CallTracerConstants;
import io.grpc.Attributes;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ClientStreamTracer;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.ForwardingClientCallListener.SimpleForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.opencensus.trace.MessageEvent;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;

/**
 * Connects {@link CensusCallTracer} and {@link CensusCallAttemptTracer} to gRPC-Java.
 *
 * <p>Each call gets a {@link CensusCallTracer} whose parent is the span and tag context current
 * when the call is created. gRPC asks the call's {@link ClientStreamTracer.Factory} for a stream
 * tracer per attempt, which forwards the stream events to an attempt tracer. The call is
 * finished when its listener is closed.
 */
final class CensusCallTracingInterceptor implements ClientInterceptor {
  private final CensusCallTracing tracing;

  CensusCallTracingInterceptor(CensusCallTracing tracing) {
    this.tracing = checkNotNull(tracing, "tracing");
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    final CensusCallTracer callTracer =
        tracing.newCallTracer(method.getFullMethodName(), tracing.currentContext());
    ClientCall<ReqT, RespT> call =
        next.newCall(method, callOptions.withStreamTracerFactory(new AttemptFactory(callTracer)));
    return new SimpleForwardingClientCall<ReqT, RespT>(call) {
      @Override
      public void start(Listener<RespT> responseListener, Metadata headers) {
        delegate().start(
            new SimpleForwardingClientCallListener<RespT>(responseListener) {
              @Override
              public void onClose(Status status, Metadata trailers) {
                callTracer.finish();
                super.onClose(status, trailers);
              }
            },
            headers);
      }
    };
  }

  @VisibleForTesting
  static final class AttemptFactory extends ClientStreamTracer.Factory {
    final CensusCallTracer callTracer;

    AttemptFactory(CensusCallTracer callTracer) {
      this.callTracer = callTracer;
    }

    @Override
    public ClientStreamTracer newClientStreamTracer(
        ClientStreamTracer.StreamInfo info, Metadata headers) {
      CensusCallAttemptTracer attempt = callTracer.tryStartNewAttempt(info.isTransparentRetry());
      if (attempt == null) {
        // The call was cancelled while a retry was being created.
        return new ClientStreamTracer() {};
      }
      return new AttemptStreamTracer(attempt);
    }
  }

  @VisibleForTesting
  static final class AttemptStreamTracer extends ClientStreamTracer {
    final CensusCallAttemptTracer attempt;
    private final AtomicLong outboundWireSize = new AtomicLong();
    private final AtomicLong inboundWireSize = new AtomicLong();
    @Nullable
    private volatile Metadata trailers;

    AttemptStreamTracer(CensusCallAttemptTracer attempt) {
      this.attempt = attempt;
    }

    @Override
    public void streamCreated(Attributes transportAttrs, Metadata headers) {
      PropagatedContext propagated = attempt.onSendInitialMetadata();
      headers.discardAll(CallTracerConstants.TRACE_CONTEXT_KEY);
      headers.discardAll(CallTracerConstants.TAGS_KEY);
      if (propagated.hasTraceContext()) {
        headers.put(CallTracerConstants.TRACE_CONTEXT_KEY, propagated.getTraceBytes());
      }
      if (propagated.hasTags()) {
        headers.put(CallTracerConstants.TAGS_KEY, propagated.getTagBytes());
      }
    }

    @Override
    public void outboundMessage(int seqNo) {
      attempt.onSendMessage();
    }

    @Override
    public void inboundMessage(int seqNo) {
      attempt.onReceiveMessage();
    }

    @Override
    public void outboundMessageSent(
        int seqNo, long optionalWireSize, long optionalUncompressedSize) {
      attempt.recordMessageEvent(
          MessageEvent.Type.SENT, seqNo, optionalWireSize, optionalUncompressedSize);
    }

    @Override
    public void inboundMessageRead(
        int seqNo, long optionalWireSize, long optionalUncompressedSize) {
      attempt.recordMessageEvent(
          MessageEvent.Type.RECEIVED, seqNo, optionalWireSize, optionalUncompressedSize);
    }

    @Override
    public void outboundWireSize(long bytes) {
      outboundWireSize.addAndGet(bytes);
    }

    @Override
    public void inboundWireSize(long bytes) {
      inboundWireSize.addAndGet(bytes);
    }

    @Override
    public void inboundTrailers(Metadata trailers) {
      this.trailers = trailers;
    }

    @Override
    public void streamClosed(Status status) {
      if (status.getCode() == Status.Code.CANCELLED) {
        attempt.onCancel(status.getCause());
      }
      Metadata received = trailers;
      attempt.onReceiveTrailingMetadata(
          status,
          received != null ? received : new Metadata(),
          TransportStreamStats.create(outboundWireSize.get(), inboundWireSize.get()));
      attempt.onEnd();
    }
  }
}
