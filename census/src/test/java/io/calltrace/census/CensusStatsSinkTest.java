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

import static io.opencensus.contrib.grpc.metrics.RpcMeasureConstants.GRPC_CLIENT_METHOD;
import static io.opencensus.contrib.grpc.metrics.RpcMeasureConstants.GRPC_CLIENT_STATUS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.common.testing.TestLogHandler;
import io.grpc.Status;
import io.grpc.internal.testing.StatsTestUtils;
import io.grpc.internal.testing.StatsTestUtils.FakeStatsRecorder;
import io.grpc.internal.testing.StatsTestUtils.FakeTagger;
import io.grpc.internal.testing.StatsTestUtils.MetricsRecord;
import io.opencensus.contrib.grpc.metrics.RpcMeasureConstants;
import io.opencensus.stats.MeasureMap;
import io.opencensus.stats.StatsRecorder;
import io.opencensus.tags.TagContext;
import io.opencensus.tags.TagValue;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link CensusStatsSink}.
 */
@RunWith(JUnit4.class)
public class CensusStatsSinkTest {
  private final FakeTagger tagger = new FakeTagger();
  private final FakeStatsRecorder statsRecorder = new FakeStatsRecorder();
  private final CensusStatsSink statsSink = new CensusStatsSink(tagger, statsRecorder);
  private final Logger logger = Logger.getLogger(CensusStatsSink.class.getName());
  private final TestLogHandler logHandler = new TestLogHandler();

  @Before
  public void setUp() {
    logger.addHandler(logHandler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(logHandler);
    assertNull(statsRecorder.pollRecord());
  }

  @Test
  public void clientTags() {
    TagContext base = tagger.emptyBuilder()
        .putLocal(StatsTestUtils.EXTRA_TAG, TagValue.create("extra value"))
        .build();
    statsSink.record(
        statsSink.newMeasureMap().put(RpcMeasureConstants.GRPC_CLIENT_SENT_MESSAGES_PER_RPC, 1),
        statsSink.clientTags(base, "a.B/C", null));
    MetricsRecord record = statsRecorder.pollRecord();
    assertEquals(2, record.tags.size());
    assertEquals("a.B/C", record.tags.get(GRPC_CLIENT_METHOD).asString());
    assertEquals("extra value", record.tags.get(StatsTestUtils.EXTRA_TAG).asString());

    statsSink.record(
        statsSink.newMeasureMap().put(RpcMeasureConstants.GRPC_CLIENT_SENT_MESSAGES_PER_RPC, 1),
        statsSink.clientTags(base, "a.B/C", Status.Code.DEADLINE_EXCEEDED));
    record = statsRecorder.pollRecord();
    assertEquals(3, record.tags.size());
    assertEquals("DEADLINE_EXCEEDED", record.tags.get(GRPC_CLIENT_STATUS).asString());
  }

  @Test
  public void recordFailure_isLogged() {
    MeasureMap failingMeasureMap = mock(MeasureMap.class, RETURNS_SELF);
    doThrow(new IllegalStateException("stats backend is down"))
        .when(failingMeasureMap).record(any(TagContext.class));
    StatsRecorder failingRecorder = mock(StatsRecorder.class);
    when(failingRecorder.newMeasureMap()).thenReturn(failingMeasureMap);
    CensusStatsSink failingSink = new CensusStatsSink(tagger, failingRecorder);

    failingSink.record(
        failingSink.newMeasureMap().put(RpcMeasureConstants.GRPC_CLIENT_SENT_MESSAGES_PER_RPC, 1),
        tagger.empty());

    List<LogRecord> logs = logHandler.getStoredLogRecords();
    assertEquals(1, logs.size());
    assertEquals(Level.WARNING, logs.get(0).getLevel());
    assertEquals("Failed to record stats", logs.get(0).getMessage());
    assertSame(IllegalStateException.class, logs.get(0).getThrown().getClass());
  }
}
