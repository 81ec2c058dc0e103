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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;

/**
 * Data byte counts the transport observed for one attempt, reported with the trailing metadata.
 */
public final class TransportStreamStats {
  public static final TransportStreamStats EMPTY = new TransportStreamStats(0, 0);

  private final long outgoingDataBytes;
  private final long incomingDataBytes;

  private TransportStreamStats(long outgoingDataBytes, long incomingDataBytes) {
    this.outgoingDataBytes = outgoingDataBytes;
    this.incomingDataBytes = incomingDataBytes;
  }

  public static TransportStreamStats create(long outgoingDataBytes, long incomingDataBytes) {
    checkArgument(outgoingDataBytes >= 0, "outgoingDataBytes must not be negative");
    checkArgument(incomingDataBytes >= 0, "incomingDataBytes must not be negative");
    return new TransportStreamStats(outgoingDataBytes, incomingDataBytes);
  }

  public long getOutgoingDataBytes() {
    return outgoingDataBytes;
  }

  public long getIncomingDataBytes() {
    return incomingDataBytes;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("outgoingDataBytes", outgoingDataBytes)
        .add("incomingDataBytes", incomingDataBytes)
        .toString();
  }
}
