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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a queue in batches and hands each batch to a callback.
 *
 * <p>A batch holds at most {@code maxItems} elements. After the first element of a batch arrives
 * the worker waits at most {@code maxLatency} for more, so a trickle is passed on promptly while
 * a burst is coalesced. The callback runs synchronously on the thread executing {@link #run()}.
 *
 * <p>Queueing {@code stopSignal} ends the loop: elements dequeued before it are still passed to
 * the callback, the signal itself never is. {@link #stopAfterCurrentBatch()} ends the loop without
 * a signal once the batch being handled returns. A failure thrown by the callback is not caught
 * and ends the loop as well.
 */
public final class QueueCallbackWorker<T> implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(QueueCallbackWorker.class);

  private final BlockingQueue<T> queue;
  private final Consumer<List<T>> callback;
  private final T stopSignal;
  private final int maxItems;
  private final long maxLatencyNanos;

  private volatile boolean stopRequested;

  public QueueCallbackWorker(
      BlockingQueue<T> queue,
      Consumer<List<T>> callback,
      T stopSignal,
      int maxItems,
      Duration maxLatency) {
    checkArgument(maxItems > 0, "maxItems must be a value greater than 0.");
    checkArgument(!maxLatency.isNegative(), "maxLatency must not be negative.");
    this.queue = checkNotNull(queue);
    this.callback = checkNotNull(callback);
    this.stopSignal = checkNotNull(stopSignal);
    this.maxItems = maxItems;
    this.maxLatencyNanos = maxLatency.toNanos();
  }

  @Override
  public void run() {
    boolean keepRunning = true;
    while (keepRunning && !stopRequested) {
      List<T> items;
      try {
        items = getMany();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for queued items, stopping.");
        return;
      }

      int stopIndex = indexOfStopSignal(items);
      if (stopIndex >= 0) {
        items = items.subList(0, stopIndex);
        keepRunning = false;
      }
      if (!items.isEmpty()) {
        callback.accept(items);
      }
    }
    log.debug("Queue callback worker stopped.");
  }

  /**
   * Ends the loop after the callback in progress returns, leaving later elements queued. Meant to
   * be called from within the callback, where no signal can be waited for.
   */
  public void stopAfterCurrentBatch() {
    stopRequested = true;
  }

  /**
   * Blocks until one element is available, then collects more until the batch is full, the
   * latency budget is spent or the stop signal is seen.
   */
  @VisibleForTesting
  List<T> getMany() throws InterruptedException {
    List<T> items = new ArrayList<>();
    T first = queue.take();
    items.add(first);
    if (first == stopSignal) {
      return items;
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    while (items.size() < maxItems) {
      long remainingNanos = maxLatencyNanos - stopwatch.elapsed(TimeUnit.NANOSECONDS);
      if (remainingNanos <= 0) {
        break;
      }
      T item = queue.poll(remainingNanos, TimeUnit.NANOSECONDS);
      if (item == null) {
        break;
      }
      items.add(item);
      if (item == stopSignal) {
        break;
      }
    }
    return items;
  }

  private int indexOfStopSignal(List<T> items) {
    for (int i = 0; i < items.size(); i++) {
      // By identity; an element equal to the signal is still dispatched.
      if (items.get(i) == stopSignal) {
        return i;
      }
    }
    return -1;
  }
}
