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
package com.google.pubsub.subscriber;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.api.gax.core.Distribution;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.pubsub.subscriber.internal.dispatcher.Dispatcher;
import com.google.pubsub.subscriber.internal.dispatcher.Leaser;
import com.google.pubsub.subscriber.internal.dispatcher.StreamingPullManager;
import com.google.pubsub.subscriber.internal.requests.LeaseRequest;
import com.google.pubsub.subscriber.internal.requests.RequestItem;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.StreamingPullRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;

/** Messages acked from application threads reach the stream through a running dispatcher. */
@RunWith(JUnit4.class)
public class MessageDispatchTest {
  private final StreamingPullManager manager = mock(StreamingPullManager.class);
  private final Leaser leaser = mock(Leaser.class);
  private final Distribution ackLatencies = mock(Distribution.class);
  private final BlockingQueue<RequestItem> queue = new LinkedBlockingQueue<>();

  @Test
  public void handlesFromManyThreadsAreAllDispatched() throws Exception {
    when(manager.leaser()).thenReturn(leaser);
    when(manager.ackHistogram()).thenReturn(ackLatencies);
    Dispatcher dispatcher = new Dispatcher(manager, queue);
    dispatcher.start();

    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 300; i++) {
      PubsubMessage pubsubMessage =
          PubsubMessage.newBuilder()
              .setMessageId("id-" + i)
              .setData(ByteString.copyFromUtf8("data-" + i))
              .build();
      Message message = new Message(pubsubMessage, "ack-" + i, 1, queue);
      queue.add(LeaseRequest.create(message.getAckId(), message.getSize(), ""));
      int index = i;
      Thread thread =
          new Thread(
              () -> {
                if (index % 3 == 0) {
                  message.nack();
                } else {
                  message.ack();
                }
              });
      threads.add(thread);
      thread.start();
    }
    for (Thread thread : threads) {
      thread.join();
    }
    dispatcher.stop();

    ArgumentCaptor<StreamingPullRequest> requests =
        ArgumentCaptor.forClass(StreamingPullRequest.class);
    verify(manager, atLeastOnce()).send(requests.capture());
    List<String> acked = new ArrayList<>();
    List<String> nacked = new ArrayList<>();
    for (StreamingPullRequest request : requests.getAllValues()) {
      acked.addAll(request.getAckIdsList());
      nacked.addAll(request.getModifyDeadlineAckIdsList());
      for (int seconds : request.getModifyDeadlineSecondsList()) {
        assertThat(seconds).isEqualTo(0);
      }
    }
    assertThat(acked).hasSize(200);
    assertThat(nacked).hasSize(100);
    assertThat(nacked).contains("ack-0");
    assertThat(acked).contains("ack-1");
    verify(ackLatencies, atLeastOnce()).record(anyInt());
    verify(leaser, atLeastOnce()).add(any());
    verify(manager, atLeastOnce()).maybeResumeConsumer();
    assertThat(queue).isEmpty();
    assertThat(dispatcher.isRunning()).isFalse();
  }

  @Test
  public void handleOperationsOnlyEnqueue() {
    Message message =
        new Message(PubsubMessage.newBuilder().setMessageId("id").build(), "ack", 0, queue);

    message.ack();
    message.drop();

    assertThat(queue).hasSize(2);
    assertThat(ImmutableList.copyOf(queue).get(1).kind()).isEqualTo(RequestItem.Kind.DROP);
    verifyNoInteractions(manager);
  }
}
