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

import com.google.common.base.Strings;

/** Argument checks shared by the request factories. */
final class RequestChecks {
  private RequestChecks() {}

  static String checkAckId(String ackId) {
    checkArgument(!Strings.isNullOrEmpty(ackId), "ackId must be a non-empty string.");
    return ackId;
  }

  static int checkByteSize(int byteSize) {
    checkArgument(byteSize >= 0, "byteSize must not be negative, got %s.", byteSize);
    return byteSize;
  }

  static String orderingKeyOrEmpty(String orderingKey) {
    return Strings.nullToEmpty(orderingKey);
  }
}
