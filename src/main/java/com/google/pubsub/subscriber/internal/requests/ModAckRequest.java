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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.pubsub.subscriber.internal.requests.RequestChecks.checkAckId;

import com.google.auto.value.AutoValue;

/**
 * Resets the server-side ack deadline of one message to {@link #seconds()} from now. Zero seconds
 * makes the message immediately eligible for redelivery, which is how nacks go over the wire.
 */
@AutoValue
public abstract class ModAckRequest implements RequestItem {
  @Override
  public abstract String ackId();

  public abstract int seconds();

  public static ModAckRequest create(String ackId, int seconds) {
    checkArgument(seconds >= 0, "seconds must not be negative, got %s.", seconds);
    return new AutoValue_ModAckRequest(checkAckId(ackId), seconds);
  }

  @Override
  public final Kind kind() {
    return Kind.MOD_ACK;
  }
}
