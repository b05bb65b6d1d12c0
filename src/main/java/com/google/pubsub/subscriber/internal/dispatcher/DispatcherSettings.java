/*
 * Copyright 2026 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.pubsub.subscriber.internal.dispatcher;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import java.time.Duration;

/** Batching limits used by the {@link Dispatcher}. */
@AutoValue
public abstract class DispatcherSettings {
  static final int DEFAULT_MAX_BATCH_SIZE = 100;
  static final Duration DEFAULT_MAX_BATCH_LATENCY = Duration.ofMillis(10);

  // The backend limits acknowledge and modifyAckDeadline requests to 512 KiB. Ack ids are at most
  // 164 bytes, so no more than 524288 / 176 ~= 2979 fit in one request; keep some headroom.
  static final int DEFAULT_MAX_ACK_IDS_PER_REQUEST = 2500;

  /** The maximum number of queued requests handled in one dispatch. */
  public abstract int maxBatchSize();

  /** How long to wait for more requests once the first one of a batch has arrived. */
  public abstract Duration maxBatchLatency();

  /** The maximum number of ack ids carried by a single outbound request. */
  public abstract int maxAckIdsPerRequest();

  public static DispatcherSettings getDefaultInstance() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new AutoValue_DispatcherSettings.Builder()
        .setMaxBatchSize(DEFAULT_MAX_BATCH_SIZE)
        .setMaxBatchLatency(DEFAULT_MAX_BATCH_LATENCY)
        .setMaxAckIdsPerRequest(DEFAULT_MAX_ACK_IDS_PER_REQUEST);
  }

  public abstract Builder toBuilder();

  /** Builder to construct {@link DispatcherSettings}. */
  @AutoValue.Builder
  public abstract static class Builder {
    /**
     * Sets the maximum number of queued requests handled in one dispatch.
     *
     * <p>Defaults to 100. Must be greater than 0.
     */
    public abstract Builder setMaxBatchSize(int maxBatchSize);

    /**
     * Sets how long the worker waits for further requests after the first one of a batch.
     *
     * <p>Defaults to 10 milliseconds. Must not be negative.
     */
    public abstract Builder setMaxBatchLatency(Duration maxBatchLatency);

    /**
     * Sets the maximum number of ack ids sent in a single request.
     *
     * <p>Defaults to 2500. Must be greater than 0.
     */
    public abstract Builder setMaxAckIdsPerRequest(int maxAckIdsPerRequest);

    abstract DispatcherSettings autoBuild();

    public final DispatcherSettings build() {
      DispatcherSettings settings = autoBuild();
      Preconditions.checkArgument(
          settings.maxBatchSize() > 0, "maxBatchSize must be a value greater than 0.");
      Preconditions.checkArgument(
          !settings.maxBatchLatency().isNegative(), "maxBatchLatency must not be negative.");
      Preconditions.checkArgument(
          settings.maxAckIdsPerRequest() > 0,
          "maxAckIdsPerRequest must be a value greater than 0.");
      return settings;
    }
  }
}
