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

import com.google.pubsub.subscriber.internal.requests.LeaseRequest;
import com.google.pubsub.subscriber.internal.requests.TrackedRequest;
import java.util.Collection;

/**
 * Tracks leased messages for flow control and deadline extension. Only the dispatch worker
 * mutates a leaser; implementations must tolerate concurrent reads from the manager's pause and
 * resume checks while that happens.
 */
public interface Leaser {
  /** Starts tracking the given messages. An empty collection is a no-op. */
  void add(Collection<LeaseRequest> items);

  /** Stops tracking the given messages. Unknown ack ids and empty collections are ignored. */
  void remove(Collection<? extends TrackedRequest> items);
}
