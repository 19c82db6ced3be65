/*
 * Copyright 2021 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.telemetry.gateway.stream;

import java.util.List;
import reactor.core.publisher.Flux;

/**
 * Source of raw live event payloads.
 */
public interface EventSubscriber {

  /**
   * Opens a private subscription bound to the given topic patterns. Broker resources are held
   * only while the returned flux is subscribed and are released when it terminates or is
   * cancelled.
   */
  Flux<byte[]> subscribe(List<String> topics);
}
