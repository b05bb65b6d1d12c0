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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.pubsub.subscriber.internal.requests.DropRequest;
import com.google.pubsub.subscriber.internal.requests.LeaseRequest;
import com.google.pubsub.subscriber.internal.requests.RequestItem;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DispatcherLifecycleTest {
  private final StreamingPullManager manager = mock(StreamingPullManager.class);
  private final Leaser leaser = mock(Leaser.class);
  private final BlockingQueue<RequestItem> queue = new LinkedBlockingQueue<>();
  private Dispatcher dispatcher;

  @Before
  public void setUp() {
    when(manager.leaser()).thenReturn(leaser);
    dispatcher = new Dispatcher(manager, queue);
  }

  @After
  public void tearDown() {
    dispatcher.stop();
  }

  @Test
  public void stop_whenNeverStartedIsNoop() {
    dispatcher.stop();
    dispatcher.stop();

    assertThat(dispatcher.isRunning()).isFalse();
    assertThat(queue).isEmpty();
  }

  @Test
  public void start_twiceFails() {
    dispatcher.start();

    IllegalStateException e = assertThrows(IllegalStateException.class, dispatcher::start);
    assertThat(e).hasMessageThat().contains("already running");
    assertThat(dispatcher.isRunning()).isTrue();
  }

  @Test
  public void start_afterStopSucceeds() {
    dispatcher.start();
    dispatcher.stop();
    assertThat(dispatcher.isRunning()).isFalse();

    dispatcher.start();
    assertThat(dispatcher.isRunning()).isTrue();
  }

  @Test
  public void stop_dispatchesRequestsQueuedBeforeIt() {
    dispatcher.start();
    LeaseRequest lease = LeaseRequest.create("a", 10, "");
    DropRequest drop = DropRequest.create("a", 10, "");
    queue.add(lease);
    queue.add(drop);

    dispatcher.stop();

    verify(leaser).add(ImmutableList.of(lease));
    verify(leaser).remove(ImmutableList.of(drop));
    assertThat(queue).isEmpty();
  }

  @Test
  public void workerThreadIsNamedDaemon() {
    AtomicReference<Thread> worker = new AtomicReference<>();
    when(manager.leaser())
        .thenAnswer(
            args -> {
              worker.set(Thread.currentThread());
              return leaser;
            });
    dispatcher.start();
    queue.add(LeaseRequest.create("a", 10, ""));

    verify(leaser, timeout(5000)).add(any());
    assertThat(worker.get().getName()).isEqualTo(Dispatcher.CALLBACK_WORKER_NAME);
    assertThat(worker.get().isDaemon()).isTrue();
  }

  @Test
  public void leaserFailure_endsWorkerAndNotifiesManager() {
    RuntimeException failure = new RuntimeException("leaser broke");
    doThrow(failure).when(leaser).remove(any());
    dispatcher.start();

    queue.add(DropRequest.create("a", 10, ""));

    verify(manager, timeout(5000)).onDispatcherFailure(failure);
    verify(manager, never()).maybeResumeConsumer();

    // Later requests are no longer dispatched.
    queue.add(LeaseRequest.create("b", 10, ""));
    dispatcher.stop();
    verify(leaser, never()).add(any());
    assertThat(queue).containsExactly(LeaseRequest.create("b", 10, ""));
  }

  @Test
  public void stop_fromFailureHandlerDoesNotDeadlock() throws Exception {
    doThrow(new RuntimeException("leaser broke")).when(leaser).remove(any());
    CountDownLatch stopReturned = new CountDownLatch(1);
    doAnswer(
            args -> {
              dispatcher.stop();
              stopReturned.countDown();
              return null;
            })
        .when(manager)
        .onDispatcherFailure(any());
    dispatcher.start();

    queue.add(DropRequest.create("a", 10, ""));

    assertThat(stopReturned.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(isRunningFromAnotherThread()).isFalse();

    dispatcher.start();
    assertThat(dispatcher.isRunning()).isTrue();
  }

  @Test
  public void stop_fromWorkerWhileDispatchingEndsWorkerAfterBatch() throws Exception {
    CountDownLatch stopReturned = new CountDownLatch(1);
    doAnswer(
            args -> {
              dispatcher.stop();
              stopReturned.countDown();
              return null;
            })
        .when(manager)
        .maybePauseConsumer();
    dispatcher.start();

    LeaseRequest first = LeaseRequest.create("a", 10, "");
    queue.add(first);

    assertThat(stopReturned.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(isRunningFromAnotherThread()).isFalse();
    verify(leaser).add(ImmutableList.of(first));

    // The stopped worker leaves later requests for the next start.
    LeaseRequest second = LeaseRequest.create("b", 10, "");
    queue.add(second);
    Thread.sleep(100);
    verify(leaser, never()).add(ImmutableList.of(second));
    assertThat(queue).containsExactly(second);

    dispatcher.start();
    verify(leaser, timeout(5000)).add(ImmutableList.of(second));
  }

  private boolean isRunningFromAnotherThread() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      return executor.submit(dispatcher::isRunning).get(5, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }
}
