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
package com.google.pubsub.subscriber.internal.requests;

import static com.google.pubsub.subscriber.internal.requests.RequestChecks.checkAckId;
import static com.google.pubsub.subscriber.internal.requests.RequestChecks.checkByteSize;
import static com.google.pubsub.subscriber.internal.requests.RequestChecks.orderingKeyOrEmpty;

import com.google.auto.value.AutoValue;

/** A message the receiver declined; it is redelivered as soon as possible. */
@AutoValue
public abstract class NackRequest implements TrackedRequest {
  @Override
  public abstract String ackId();

  @Override
  public abstract int byteSize();

  @Override
  public abstract String orderingKey();

  public static NackRequest create(String ackId, int byteSize, String orderingKey) {
    return new AutoValue_NackRequest(
        checkAckId(ackId), checkByteSize(byteSize), orderingKeyOrEmpty(orderingKey));
  }

  @Override
  public final Kind kind() {
    return Kind.NACK;
  }
}
