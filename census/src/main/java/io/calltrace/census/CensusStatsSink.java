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

import io.grpc.Status;
import io.opencensus.contrib.grpc.metrics.RpcMeasureConstants;
import io.opencensus.stats.MeasureMap;
import io.opencensus.stats.StatsRecorder;
import io.opencensus.tags.TagContext;
import io.opencensus.tags.TagContextBuilder;
import io.opencensus.tags.TagValue;
import io.opencensus.tags.Tagger;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Records measurement batches with the client method and status tags. Recording is
 * fire-and-forget: a failing stats backend is logged and never surfaces to the RPC.
 */
final class CensusStatsSink {
  private static final Logger logger = Logger.getLogger(CensusStatsSink.class.getName());

  private final Tagger tagger;
  private final StatsRecorder statsRecorder;

  CensusStatsSink(Tagger tagger, StatsRecorder statsRecorder) {
    this.tagger = checkNotNull(tagger, "tagger");
    this.statsRecorder = checkNotNull(statsRecorder, "statsRecorder");
  }

  MeasureMap newMeasureMap() {
    return statsRecorder.newMeasureMap();
  }

  /**
   * Returns {@code base} extended with the client method tag and, if {@code statusCode} is not
   * null, the client status tag. Both are local to this process.
   */
  TagContext clientTags(TagContext base, String method, @Nullable Status.Code statusCode) {
    TagContextBuilder builder = tagger.toBuilder(base)
        .putLocal(RpcMeasureConstants.GRPC_CLIENT_METHOD, TagValue.create(method));
    if (statusCode != null) {
      builder.putLocal(
          RpcMeasureConstants.GRPC_CLIENT_STATUS, TagValue.create(statusCode.toString()));
    }
    return builder.build();
  }

  void record(MeasureMap measures, TagContext tags) {
    try {
      measures.record(tags);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record stats", e);
    }
  }
}
