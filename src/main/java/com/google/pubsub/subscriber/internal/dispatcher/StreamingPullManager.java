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

import com.google.api.gax.core.Distribution;
import com.google.pubsub.v1.StreamingPullRequest;

/** The parts of the streaming pull manager that the {@link Dispatcher} drives. */
public interface StreamingPullManager {
  /**
   * Sends one request on the stream. Called from the dispatch worker thread; implementations
   * serialize access to the transport themselves.
   */
  void send(StreamingPullRequest request);

  /** Seconds from receipt to ack for each timed ack, used to size lease extensions. */
  Distribution ackHistogram();

  Leaser leaser();

  /** Releases the next queued message, if any, for each of the given ordering keys. */
  void activateOrderingKeys(Iterable<String> orderingKeys);

  /** Pauses the stream if leased messages exceed the flow control limits. Idempotent. */
  void maybePauseConsumer();

  /** Resumes a paused stream once leased messages fall back under the limits. Idempotent. */
  void maybeResumeConsumer();

  /**
   * Called once, on the dispatch worker thread, when the worker dies from an uncaught failure.
   * From then on nothing is acked, nacked or leased until the manager reacts. Implementations may
   * call {@link Dispatcher#stop()} from here.
   */
  void onDispatcherFailure(Throwable cause);
}
