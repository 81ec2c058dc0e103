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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.base.Strings;

import io.calltrace.census.internal.CallTracerConstants;
import io.grpc.Metadata;
import io.grpc.internal.testing.StatsTestUtils.MockableSpan;
import io.opencensus.implcore.tags.TagsComponentImplBase;
import io.opencensus.tags.TagContext;
import io.opencensus.tags.TagContextBuilder;
import io.opencensus.tags.TagKey;
import io.opencensus.tags.TagMetadata;
import io.opencensus.tags.TagMetadata.TagTtl;
import io.opencensus.tags.TagValue;
import io.opencensus.tags.Tagger;
import io.opencensus.trace.BlankSpan;
import io.opencensus.trace.Span;
import io.opencensus.trace.SpanContext;
import io.opencensus.trace.Status;
import io.opencensus.trace.Tracer;
import io.opencensus.trace.propagation.BinaryFormat;
import java.util.Random;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

/**
 * Tests for {@link CensusContextPropagator}.
 */
@RunWith(JUnit4.class)
public class CensusContextPropagatorTest {
  private static final TagMetadata PROPAGATING =
      TagMetadata.create(TagTtl.UNLIMITED_PROPAGATION);

  @Rule
  public final MockitoRule mocks = MockitoJUnit.rule();

  private final TagsComponentImplBase tagsComponent = new TagsComponentImplBase();
  private final Tagger tagger = tagsComponent.getTagger();
  private final Random random = new Random(1234);

  @Mock
  private Tracer tracer;
  @Mock
  private BinaryFormat traceFormat;

  private CensusContextPropagator propagator;

  @Before
  public void setUp() {
    propagator = newPropagator(true, true);
  }

  private CensusContextPropagator newPropagator(boolean tracingEnabled, boolean propagateTags) {
    return new CensusContextPropagator(
        tracer, traceFormat, tagger,
        tagsComponent.getTagPropagationComponent().getBinarySerializer(),
        tracingEnabled, propagateTags);
  }

  @Test
  public void convertStatus_coversEveryCode() {
    for (io.grpc.Status.Code code : io.grpc.Status.Code.values()) {
      Status status = CensusContextPropagator.convertStatus(code);
      assertEquals(code.name(), status.getCanonicalCode().name());
      assertEquals(code.toString(), status.getDescription());
    }
  }

  @Test
  public void callContext_tracingDisabled() {
    propagator = newPropagator(false, true);
    TagContext tags = tagger.emptyBuilder()
        .putLocal(TagKey.create("k"), TagValue.create("v"))
        .build();
    CensusContext parent = CensusContext.create(MockableSpan.generateRandomSpan(random), tags);
    CensusContext context = propagator.generateCallContext("Sent.a.b", parent);
    assertSame(BlankSpan.INSTANCE, context.getSpan());
    assertSame(tags, context.getTags());
    CensusContext attemptContext =
        propagator.generateAttemptContext("Attempt.a.b", context, 0, false);
    assertSame(BlankSpan.INSTANCE, attemptContext.getSpan());
    assertSame(tags, attemptContext.getTags());
    verifyNoInteractions(tracer);
  }

  @Test
  public void callContext_withoutParentHasNoTags() {
    propagator = newPropagator(false, true);
    CensusContext context = propagator.generateCallContext("Sent.a.b", null);
    assertEquals(tagger.empty(), context.getTags());
  }

  @Test
  public void serializeTraceContext_invalidSpan() {
    assertThat(propagator.serializeTraceContext(BlankSpan.INSTANCE, 64)).isEmpty();
    verifyNoInteractions(traceFormat);
  }

  @Test
  public void serializeTraceContext_limit() {
    Span span = MockableSpan.generateRandomSpan(random);
    when(traceFormat.toByteArray(any(SpanContext.class))).thenReturn(new byte[29]);
    assertThat(propagator.serializeTraceContext(span, 29)).hasLength(29);
    assertThat(propagator.serializeTraceContext(span, 28)).isEmpty();
  }

  @Test
  public void serializeTags_onlyPropagatingTags() {
    TagContext local = tagger.emptyBuilder()
        .putLocal(TagKey.create("k"), TagValue.create("v"))
        .build();
    assertThat(propagator.serializeTags(local, CallTracerConstants.MAX_TAGS_LENGTH)).isEmpty();
    assertThat(propagator.serializeTags(tagger.empty(), CallTracerConstants.MAX_TAGS_LENGTH))
        .isEmpty();

    TagContext propagating = tagger.emptyBuilder()
        .put(TagKey.create("k"), TagValue.create("v"), PROPAGATING)
        .build();
    assertThat(propagator.serializeTags(propagating, CallTracerConstants.MAX_TAGS_LENGTH))
        .isNotEmpty();
    assertThat(newPropagator(true, false)
            .serializeTags(propagating, CallTracerConstants.MAX_TAGS_LENGTH))
        .isEmpty();
  }

  @Test
  public void serializeTags_oversizeDropped() {
    TagContextBuilder builder = tagger.emptyBuilder();
    for (int i = 0; i < 10; i++) {
      builder.put(
          TagKey.create("key" + i), TagValue.create(Strings.repeat("v", 250)), PROPAGATING);
    }
    TagContext tags = builder.build();
    assertThat(propagator.serializeTags(tags, 8192)).isNotEmpty();
    assertThat(propagator.serializeTags(tags, CallTracerConstants.MAX_TAGS_LENGTH)).isEmpty();
  }

  @Test
  public void parseServerElapsedTime_absent() {
    assertEquals(0, CensusContextPropagator.parseServerElapsedTime(new Metadata()));
  }
}
