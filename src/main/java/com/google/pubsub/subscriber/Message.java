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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.core.ApiClock;
import com.google.api.core.CurrentMillisClock;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.Ints;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.pubsub.subscriber.internal.requests.AckRequest;
import com.google.pubsub.subscriber.internal.requests.DropRequest;
import com.google.pubsub.subscriber.internal.requests.ModAckRequest;
import com.google.pubsub.subscriber.internal.requests.NackRequest;
import com.google.pubsub.subscriber.internal.requests.RequestItem;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.ReceivedMessage;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;

/**
 * A single Pub/Sub message delivered to a subscriber, along with the means to acknowledge it.
 *
 * <p>Messages are created by the subscriber as they arrive on the stream, one per delivery
 * attempt; applications do not normally construct them. {@link #ack()}, {@link #nack()}, {@link
 * #modifyAckDeadline(int)} and {@link #drop()} only queue a request for the subscriber's
 * dispatcher and return immediately. They may be called from any thread.
 *
 * <p>Acks are best effort. Processing should be idempotent, since any message may be delivered
 * more than once. Calling more than one of ack, nack and drop on the same message is not checked
 * here and should be avoided.
 */
public class Message {
  private static final int MAX_DATA_IN_STRING = 50;

  private final PubsubMessage message;
  private final String ackId;
  private final Optional<Integer> deliveryAttempt;
  private final Queue<RequestItem> requestQueue;
  private final ApiClock clock;
  private final long receivedTimeMillis;
  private final Instant publishTime;
  private final int size;

  /**
   * Creates a message handle.
   *
   * @param message the message received from Pub/Sub
   * @param ackId the ack id received with the message
   * @param deliveryAttempt the delivery attempt counter received from Pub/Sub, or 0 if the
   *     subscription has no dead letter policy
   * @param requestQueue the queue drained by the subscriber's dispatcher; must accept concurrent,
   *     non-blocking inserts
   */
  public Message(
      PubsubMessage message, String ackId, int deliveryAttempt, Queue<RequestItem> requestQueue) {
    this(message, ackId, deliveryAttempt, requestQueue, CurrentMillisClock.getDefaultClock());
  }

  @VisibleForTesting
  Message(
      PubsubMessage message,
      String ackId,
      int deliveryAttempt,
      Queue<RequestItem> requestQueue,
      ApiClock clock) {
    this.message = checkNotNull(message);
    checkArgument(!Strings.isNullOrEmpty(ackId), "ackId must be a non-empty string.");
    this.ackId = ackId;
    this.deliveryAttempt = deliveryAttempt > 0 ? Optional.of(deliveryAttempt) : Optional.empty();
    this.requestQueue = checkNotNull(requestQueue);
    this.clock = checkNotNull(clock);
    // Used to measure how long the receiver takes to ack.
    this.receivedTimeMillis = clock.millisTime();
    Timestamp timestamp = message.getPublishTime();
    this.publishTime = Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    this.size = message.getSerializedSize();
  }

  /** Wraps a message pulled off the stream. */
  public static Message fromReceivedMessage(
      ReceivedMessage received, Queue<RequestItem> requestQueue) {
    return fromReceivedMessage(received, requestQueue, CurrentMillisClock.getDefaultClock());
  }

  static Message fromReceivedMessage(
      ReceivedMessage received, Queue<RequestItem> requestQueue, ApiClock clock) {
    return new Message(
        received.getMessage(),
        received.getAckId(),
        received.getDeliveryAttempt(),
        requestQueue,
        clock);
  }

  /** The server-assigned message id. */
  public String getMessageId() {
    return message.getMessageId();
  }

  public String getAckId() {
    return ackId;
  }

  public ByteString getData() {
    return message.getData();
  }

  public Map<String, String> getAttributes() {
    return message.getAttributesMap();
  }

  public Instant getPublishTime() {
    return publishTime;
  }

  /** The key the message was published with, or the empty string. */
  public String getOrderingKey() {
    return message.getOrderingKey();
  }

  /** The size of the serialized message in bytes. */
  public int getSize() {
    return size;
  }

  /**
   * The approximate number of times Pub/Sub has attempted to deliver this message: 1 on first
   * delivery, incremented by every nack and every expired ack deadline. Empty if the subscription
   * has no dead letter policy.
   */
  public Optional<Integer> getDeliveryAttempt() {
    return deliveryAttempt;
  }

  /**
   * Acknowledges the message; it will not be delivered to this subscription again. Only ack once
   * processing has finished, so a failure leads to redelivery.
   */
  public void ack() {
    // Rounded up, so that sub-second acks are recorded as one second.
    int timeToAck =
        Ints.saturatedCast((long) Math.ceil((clock.millisTime() - receivedTimeMillis) / 1000D));
    requestQueue.add(AckRequest.create(ackId, size, timeToAck, getOrderingKey()));
  }

  /** Declines the message, so that Pub/Sub redelivers it. */
  public void nack() {
    requestQueue.add(NackRequest.create(ackId, size, getOrderingKey()));
  }

  /**
   * Sets the ack deadline to the given number of seconds from now.
   *
   * <p>Lease management already extends deadlines as needed; this is rarely called directly.
   *
   * @param seconds the new deadline, between 0 and 600. Values below 10 are advised against
   *     because of network latency.
   */
  public void modifyAckDeadline(int seconds) {
    requestQueue.add(ModAckRequest.create(ackId, seconds));
  }

  /**
   * Releases the message from lease management. Unless it is acked before the current deadline,
   * Pub/Sub redelivers it.
   *
   * <p>{@link #ack()} and {@link #nack()} already drop the message.
   */
  public void drop() {
    requestQueue.add(DropRequest.create(ackId, size, getOrderingKey()));
  }

  @Override
  public String toString() {
    ByteString data = message.getData();
    String abbreviatedData =
        data.size() > MAX_DATA_IN_STRING
            ? data.substring(0, MAX_DATA_IN_STRING).toStringUtf8() + "..."
            : data.toStringUtf8();
    return MoreObjects.toStringHelper(this)
        .add("messageId", getMessageId())
        .add("data", abbreviatedData)
        .add("orderingKey", getOrderingKey())
        .add("attributes", ImmutableSortedMap.copyOf(getAttributes()))
        .toString();
  }
}
