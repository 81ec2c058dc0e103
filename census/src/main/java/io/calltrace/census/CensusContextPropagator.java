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
import io.grpc.Metadata;
import io.opencensus.common.ServerStats;
import io.opencensus.common.ServerStatsDeserializationException;
import io.opencensus.common.ServerStatsEncoding;
import io.opencensus.tags.InternalUtils;
import io.opencensus.tags.Tag;
import io.opencensus.tags.TagContext;
import io.opencensus.tags.TagMetadata.TagTtl;
import io.opencensus.tags.Tagger;
import io.opencensus.tags.propagation.TagContextBinarySerializer;
import io.opencensus.tags.propagation.TagContextSerializationException;
import io.opencensus.trace.AttributeValue;
import io.opencensus.trace.BlankSpan;
import io.opencensus.trace.Span;
import io.opencensus.trace.SpanContext;
import io.opencensus.trace.Status;
import io.opencensus.trace.Tracer;
import io.opencensus.trace.propagation.BinaryFormat;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Derives call and attempt contexts and converts them to and from their wire forms.
 *
 * <p>Nothing here fails the RPC: encodings that cannot be produced, or that exceed their size
 * limit, come back as empty arrays and are logged at {@link Level#FINE}.
 */
final class CensusContextPropagator {
  private static final Logger logger = Logger.getLogger(CensusContextPropagator.class.getName());

  private final Tracer tracer;
  private final BinaryFormat traceFormat;
  private final Tagger tagger;
  private final TagContextBinarySerializer tagSerializer;
  private final boolean tracingEnabled;
  private final boolean propagateTags;

  CensusContextPropagator(
      Tracer tracer,
      BinaryFormat traceFormat,
      Tagger tagger,
      TagContextBinarySerializer tagSerializer,
      boolean tracingEnabled,
      boolean propagateTags) {
    this.tracer = checkNotNull(tracer, "tracer");
    this.traceFormat = checkNotNull(traceFormat, "traceFormat");
    this.tagger = checkNotNull(tagger, "tagger");
    this.tagSerializer = checkNotNull(tagSerializer, "tagSerializer");
    this.tracingEnabled = tracingEnabled;
    this.propagateTags = propagateTags;
  }

  /**
   * Starts the span of a call. Without a parent the span is a root span and the call carries no
   * tags. With tracing disabled the span is {@link BlankSpan#INSTANCE}.
   */
  CensusContext generateCallContext(String spanName, @Nullable CensusContext parent) {
    TagContext tags = parent == null ? tagger.empty() : parent.getTags();
    if (!tracingEnabled) {
      return new CensusContext(BlankSpan.INSTANCE, tags);
    }
    Span parentSpan = parent == null ? null : parent.getSpan();
    Span span = tracer.spanBuilderWithExplicitParent(spanName, parentSpan)
        .setRecordEvents(true)
        .startSpan();
    return new CensusContext(span, tags);
  }

  /**
   * Starts the span of an attempt as a child of the call span. The attempt inherits every tag of
   * the call.
   */
  CensusContext generateAttemptContext(
      String spanName, CensusContext callContext, long previousAttempts,
      boolean transparentRetry) {
    if (!tracingEnabled) {
      return new CensusContext(BlankSpan.INSTANCE, callContext.getTags());
    }
    Span span = tracer.spanBuilderWithExplicitParent(spanName, callContext.getSpan())
        .setRecordEvents(true)
        .startSpan();
    span.putAttribute(
        "previous-rpc-attempts", AttributeValue.longAttributeValue(previousAttempts));
    span.putAttribute(
        "transparent-retry", AttributeValue.booleanAttributeValue(transparentRetry));
    return new CensusContext(span, callContext.getTags());
  }

  /** Returns the binary span context, or an empty array if the span is invalid or too large. */
  byte[] serializeTraceContext(Span span, int maxLength) {
    SpanContext spanContext = span.getContext();
    if (!spanContext.isValid()) {
      return PropagatedContext.empty();
    }
    byte[] serialized = traceFormat.toByteArray(spanContext);
    if (serialized.length > maxLength) {
      logger.log(
          Level.FINE, "Dropping trace context of {0} bytes, limit is {1}",
          new Object[] {serialized.length, maxLength});
      return PropagatedContext.empty();
    }
    return serialized;
  }

  /**
   * Returns the binary form of the propagating tags, or an empty array if there are none, tag
   * propagation is disabled, or the encoding is too large.
   */
  byte[] serializeTags(TagContext tags, int maxLength) {
    if (!propagateTags || !hasPropagatingTags(tags)) {
      return PropagatedContext.empty();
    }
    byte[] serialized;
    try {
      serialized = tagSerializer.toByteArray(tags);
    } catch (TagContextSerializationException e) {
      logger.log(Level.FINE, "Failed to serialize tag context", e);
      return PropagatedContext.empty();
    }
    if (serialized.length > maxLength) {
      logger.log(
          Level.FINE, "Dropping tag context of {0} bytes, limit is {1}",
          new Object[] {serialized.length, maxLength});
      return PropagatedContext.empty();
    }
    return serialized;
  }

  /**
   * Removes the server stats entry from {@code trailers} and returns the service latency it
   * carries, in nanoseconds. Returns 0 if the entry is absent or cannot be parsed.
   */
  static long parseServerElapsedTime(Metadata trailers) {
    byte[] serialized = trailers.get(CallTracerConstants.SERVER_STATS_KEY);
    if (serialized == null) {
      return 0;
    }
    trailers.discardAll(CallTracerConstants.SERVER_STATS_KEY);
    try {
      ServerStats stats = ServerStatsEncoding.parseBytes(serialized);
      return stats.getServiceLatencyNs();
    } catch (ServerStatsDeserializationException | RuntimeException e) {
      logger.log(Level.FINE, "Failed to parse server stats", e);
      return 0;
    }
  }

  private static boolean hasPropagatingTags(TagContext tags) {
    for (Iterator<Tag> i = InternalUtils.getTags(tags); i.hasNext(); ) {
      if (i.next().getTagMetadata().getTagTtl() != TagTtl.NO_PROPAGATION) {
        return true;
      }
    }
    return false;
  }

  @VisibleForTesting
  static Status convertStatus(io.grpc.Status.Code code) {
    Status status;
    switch (code) {
      case OK:
        status = Status.OK;
        break;
      case CANCELLED:
        status = Status.CANCELLED;
        break;
      case UNKNOWN:
        status = Status.UNKNOWN;
        break;
      case INVALID_ARGUMENT:
        status = Status.INVALID_ARGUMENT;
        break;
      case DEADLINE_EXCEEDED:
        status = Status.DEADLINE_EXCEEDED;
        break;
      case NOT_FOUND:
        status = Status.NOT_FOUND;
        break;
      case ALREADY_EXISTS:
        status = Status.ALREADY_EXISTS;
        break;
      case PERMISSION_DENIED:
        status = Status.PERMISSION_DENIED;
        break;
      case RESOURCE_EXHAUSTED:
        status = Status.RESOURCE_EXHAUSTED;
        break;
      case FAILED_PRECONDITION:
        status = Status.FAILED_PRECONDITION;
        break;
      case ABORTED:
        status = Status.ABORTED;
        break;
      case OUT_OF_RANGE:
        status = Status.OUT_OF_RANGE;
        break;
      case UNIMPLEMENTED:
        status = Status.UNIMPLEMENTED;
        break;
      case INTERNAL:
        status = Status.INTERNAL;
        break;
      case UNAVAILABLE:
        status = Status.UNAVAILABLE;
        break;
      case DATA_LOSS:
        status = Status.DATA_LOSS;
        break;
      case UNAUTHENTICATED:
        status = Status.UNAUTHENTICATED;
        break;
      default:
        throw new AssertionError("Unhandled status code " + code);
    }
    return status.withDescription(code.toString());
  }
}
