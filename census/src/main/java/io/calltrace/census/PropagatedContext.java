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

/**
 * Binary trace and tag contexts produced when an attempt sends its initial metadata. Either
 * array may be empty, meaning there is nothing to propagate for that header.
 */
public final class PropagatedContext {
  private static final byte[] EMPTY = new byte[0];

  private final byte[] traceBytes;
  private final byte[] tagBytes;

  PropagatedContext(byte[] traceBytes, byte[] tagBytes) {
    this.traceBytes = checkNotNull(traceBytes, "traceBytes");
    this.tagBytes = checkNotNull(tagBytes, "tagBytes");
  }

  static byte[] empty() {
    return EMPTY;
  }

  /** Serialized span context for {@code grpc-trace-bin}; the caller must not modify it. */
  public byte[] getTraceBytes() {
    return traceBytes;
  }

  /** Serialized tag context for {@code grpc-tags-bin}; the caller must not modify it. */
  public byte[] getTagBytes() {
    return tagBytes;
  }

  public boolean hasTraceContext() {
    return traceBytes.length > 0;
  }

  public boolean hasTags() {
    return tagBytes.length > 0;
  }
}
