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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.pubsub.subscriber.internal.requests.AckRequest;
import com.google.pubsub.subscriber.internal.requests.DropRequest;
import com.google.pubsub.subscriber.internal.requests.LeaseRequest;
import com.google.pubsub.subscriber.internal.requests.ModAckRequest;
import com.google.pubsub.subscriber.internal.requests.NackRequest;
import com.google.pubsub.subscriber.internal.requests.RequestItem;
import com.google.pubsub.subscriber.internal.requests.TrackedRequest;
import com.google.pubsub.v1.StreamingPullRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the requests queued by message handles into streaming pull requests and lease updates.
 *
 * <p>A single background worker drains the request queue in batches and hands each batch to
 * {@link #dispatchCallback}. Within a batch requests are handled by kind, in the order lease,
 * modify ack deadline, ack, nack, drop: a message may be leased and acked within the same batch,
 * and the lease must be registered before the ack removes it again.
 *
 * <p>Failures from the manager or the leaser are not caught here. They end the worker, which is
 * logged and reported through {@link StreamingPullManager#onDispatcherFailure}; the worker is not
 * restarted.
 */
public class Dispatcher {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  @VisibleForTesting static final String CALLBACK_WORKER_NAME = "Thread-CallbackRequestDispatcher";

  // Queued by stop() to end the worker loop. Never dispatched.
  private static final RequestItem STOP =
      new RequestItem() {
        @Override
        public Kind kind() {
          return null;
        }

        @Override
        public String ackId() {
          return "";
        }

        @Override
        public String toString() {
          return "STOP";
        }
      };

  /** Bounds of a Pub/Sub ack deadline. Ack latencies are recorded within them. */
  public static final int MIN_ACK_DEADLINE_SECONDS = 10;

  public static final int MAX_ACK_DEADLINE_SECONDS = 600;

  /** Size of a distribution that holds every recorded ack latency in its own bucket. */
  public static final int ACK_LATENCY_BUCKETS = MAX_ACK_DEADLINE_SECONDS + 1;

  private final StreamingPullManager manager;
  private final BlockingQueue<RequestItem> queue;
  private final DispatcherSettings settings;

  // Serializes start() and stop() calls made from outside the worker thread.
  private final Lock operationalLock = new ReentrantLock();

  // Set under operationalLock. Cleared without it when the worker stops itself.
  private final AtomicReference<Worker> running = new AtomicReference<>();

  public Dispatcher(StreamingPullManager manager, BlockingQueue<RequestItem> queue) {
    this(manager, queue, DispatcherSettings.getDefaultInstance());
  }

  public Dispatcher(
      StreamingPullManager manager,
      BlockingQueue<RequestItem> queue,
      DispatcherSettings settings) {
    this.manager = checkNotNull(manager);
    this.queue = checkNotNull(queue);
    this.settings = checkNotNull(settings);
  }

  /**
   * Starts the worker thread that dispatches queued requests.
   *
   * @throws IllegalStateException if the dispatcher is already running
   */
  public void start() {
    operationalLock.lock();
    try {
      checkState(running.get() == null, "Dispatcher is already running.");
      QueueCallbackWorker<RequestItem> loop =
          new QueueCallbackWorker<>(
              queue,
              this::dispatchCallback,
              STOP,
              settings.maxBatchSize(),
              settings.maxBatchLatency());
      Thread thread =
          new ThreadFactoryBuilder()
              .setNameFormat(CALLBACK_WORKER_NAME)
              .setDaemon(true)
              .setUncaughtExceptionHandler(this::onWorkerFailure)
              .build()
              .newThread(loop);
      Worker worker = new Worker(thread, loop);
      running.set(worker);
      worker.thread.start();
      log.debug("Started helper thread {}", worker.thread.getName());
    } finally {
      operationalLock.unlock();
    }
  }

  /**
   * Stops the worker thread and waits for it to exit. Requests dequeued before the stop are still
   * dispatched. Does nothing if the dispatcher is not running.
   *
   * <p>When called from the worker thread itself, for example by the manager while it handles a
   * batch or a worker failure, this does not wait: the worker exits once the current batch is
   * dispatched, and requests still queued are left for the next {@link #start()}.
   */
  public void stop() {
    Worker current = running.get();
    if (current != null && current.thread == Thread.currentThread()) {
      stopFromWorker(current);
      return;
    }

    operationalLock.lock();
    try {
      Worker worker = running.get();
      if (worker == null) {
        return;
      }
      queue.add(STOP);
      Uninterruptibles.joinUninterruptibly(worker.thread);
      // Still queued if the worker had already died or stopped itself.
      queue.remove(STOP);
      running.compareAndSet(worker, null);
      log.debug("Stopped helper thread {}", worker.thread.getName());
    } finally {
      operationalLock.unlock();
    }
  }

  private void stopFromWorker(Worker worker) {
    // Joining here would never return.
    if (running.compareAndSet(worker, null)) {
      worker.loop.stopAfterCurrentBatch();
      log.debug("Helper thread {} stopped itself", worker.thread.getName());
    }
  }

  public boolean isRunning() {
    return running.get() != null;
  }

  /** Handles one batch of queued requests. Only the worker thread calls this outside of tests. */
  public void dispatchCallback(List<RequestItem> items) {
    List<LeaseRequest> leaseRequests = new ArrayList<>();
    List<ModAckRequest> modAckRequests = new ArrayList<>();
    List<AckRequest> ackRequests = new ArrayList<>();
    List<NackRequest> nackRequests = new ArrayList<>();
    List<DropRequest> dropRequests = new ArrayList<>();

    for (RequestItem item : items) {
      RequestItem.Kind kind = item == null ? null : item.kind();
      if (kind == null) {
        log.warn("Skipping unknown request item {}", item);
        continue;
      }
      switch (kind) {
        case LEASE:
          leaseRequests.add((LeaseRequest) item);
          break;
        case MOD_ACK:
          modAckRequests.add((ModAckRequest) item);
          break;
        case ACK:
          ackRequests.add((AckRequest) item);
          break;
        case NACK:
          nackRequests.add((NackRequest) item);
          break;
        case DROP:
          dropRequests.add((DropRequest) item);
          break;
        default:
          log.warn("Skipping request item of unknown kind {}: {}", kind, item);
      }
    }

    log.debug("Handling {} batched requests", items.size());

    if (!leaseRequests.isEmpty()) {
      lease(leaseRequests);
    }
    if (!modAckRequests.isEmpty()) {
      modifyAckDeadline(modAckRequests);
    }
    // Acks and drops must come after leases, both may be in the same batch.
    if (!ackRequests.isEmpty()) {
      ack(ackRequests);
    }
    if (!nackRequests.isEmpty()) {
      nack(nackRequests);
    }
    if (!dropRequests.isEmpty()) {
      drop(dropRequests);
    }
  }

  /** Adds the messages to lease management, pausing the stream if that exceeds flow control. */
  public void lease(List<LeaseRequest> items) {
    leaser().add(items);
    manager.maybePauseConsumer();
  }

  /** Sends the deadline modifications, split to respect the request size limit. */
  public void modifyAckDeadline(List<ModAckRequest> items) {
    for (List<ModAckRequest> chunk : Lists.partition(items, settings.maxAckIdsPerRequest())) {
      StreamingPullRequest.Builder request = StreamingPullRequest.newBuilder();
      for (ModAckRequest item : chunk) {
        request.addModifyDeadlineAckIds(item.ackId());
        request.addModifyDeadlineSeconds(item.seconds());
      }
      manager.send(request.build());
    }
  }

  /**
   * Acknowledges the messages and removes them from lease management. Ack latencies are recorded
   * in the manager's distribution first, clamped to the range of valid ack deadlines.
   */
  public void ack(List<AckRequest> items) {
    for (AckRequest item : items) {
      if (item.timeToAck().isPresent()) {
        int seconds = item.timeToAck().get();
        seconds = Math.max(MIN_ACK_DEADLINE_SECONDS, Math.min(seconds, MAX_ACK_DEADLINE_SECONDS));
        manager.ackHistogram().record(seconds);
      }
    }

    for (List<AckRequest> chunk : Lists.partition(items, settings.maxAckIdsPerRequest())) {
      StreamingPullRequest.Builder request = StreamingPullRequest.newBuilder();
      for (AckRequest item : chunk) {
        request.addAckIds(item.ackId());
      }
      manager.send(request.build());
    }

    drop(items);
  }

  /** Nacks the messages by setting their deadline to zero, then drops them. */
  public void nack(List<NackRequest> items) {
    modifyAckDeadline(
        items.stream()
            .map(item -> ModAckRequest.create(item.ackId(), 0))
            .collect(Collectors.toList()));
    drop(items);
  }

  /**
   * Removes the messages from lease management, reactivates their ordering keys and resumes the
   * stream if flow control allows it.
   */
  public void drop(List<? extends TrackedRequest> items) {
    leaser().remove(items);

    ImmutableSet.Builder<String> orderingKeys = ImmutableSet.builder();
    for (TrackedRequest item : items) {
      if (!item.orderingKey().isEmpty()) {
        orderingKeys.add(item.orderingKey());
      }
    }
    manager.activateOrderingKeys(orderingKeys.build());
    manager.maybeResumeConsumer();
  }

  private Leaser leaser() {
    return checkNotNull(manager.leaser(), "The streaming pull manager has no leaser.");
  }

  private void onWorkerFailure(Thread worker, Throwable cause) {
    log.error(
        "Dispatch worker {} failed; acks, nacks and leases are no longer being sent.",
        worker.getName(),
        cause);
    manager.onDispatcherFailure(cause);
  }

  private static final class Worker {
    final Thread thread;
    final QueueCallbackWorker<RequestItem> loop;

    Worker(Thread thread, QueueCallbackWorker<RequestItem> loop) {
      this.thread = thread;
      this.loop = loop;
    }
  }
}
