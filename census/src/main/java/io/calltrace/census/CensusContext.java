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

import com.google.common.base.MoreObjects;
import io.opencensus.tags.TagContext;
import io.opencensus.trace.Span;

/**
 * A span together with the tag context that travels with it. Calls and attempts each own one;
 * an attempt's context is a child of its call's context.
 */
public final class CensusContext {
  private final Span span;
  private final TagContext tags;

  CensusContext(Span span, TagContext tags) {
    this.span = checkNotNull(span, "span");
    this.tags = checkNotNull(tags, "tags");
  }

  /**
   * Creates a context that can be handed to
   * {@link CensusCallTracing#newCallTracer(String, CensusContext)} as the parent of a call.
   */
  public static CensusContext create(Span span, TagContext tags) {
    return new CensusContext(span, tags);
  }

  public Span getSpan() {
    return span;
  }

  public TagContext getTags() {
    return tags;
  }

  void endSpan() {
    span.end();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("span", span)
        .add("tags", tags)
        .toString();
  }
}
