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

/**
 * An acknowledgement-related action queued by a message handle and consumed by the dispatcher.
 *
 * <p>The set of request types is closed; each one reports its {@link Kind} so the dispatcher can
 * route it with a single switch.
 */
public interface RequestItem {
  /** The kinds of request, in the order the dispatcher processes them within a batch. */
  enum Kind {
    LEASE,
    MOD_ACK,
    ACK,
    NACK,
    DROP
  }

  Kind kind();

  String ackId();
}
