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

package com.rackspace.telemetry.gateway.services;

import com.rackspace.telemetry.gateway.config.StreamProperties;
import com.rackspace.telemetry.gateway.model.Message;
import com.rackspace.telemetry.gateway.stream.EventSubscriber;
import com.rackspace.telemetry.gateway.stream.MessageDecoder;
import com.rackspace.telemetry.gateway.stream.StreamSubscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Relays live events from the message exchange to stream clients.
 */
@Service
@Slf4j
public class StreamRelayService {

  static final String MESSAGE_EVENT = "message";
  static final String HEARTBEAT_COMMENT = "heartbeat";

  private final EventSubscriber eventSubscriber;
  private final MessageDecoder messageDecoder;
  private final Duration heartbeatInterval;
  private final AtomicInteger openStreams;
  private final Counter sentCounter;
  private final Counter filteredCounter;
  private final Counter droppedCounter;

  @Autowired
  public StreamRelayService(EventSubscriber eventSubscriber, MessageDecoder messageDecoder,
      StreamProperties streamProperties, MeterRegistry meterRegistry) {
    this.eventSubscriber = eventSubscriber;
    this.messageDecoder = messageDecoder;
    this.heartbeatInterval = streamProperties.getHeartbeatInterval();
    this.openStreams = meterRegistry.gauge("telemetry.stream.connections", new AtomicInteger());
    sentCounter = meterRegistry.counter("telemetry.stream.messages", "outcome", "sent");
    filteredCounter = meterRegistry.counter("telemetry.stream.messages", "outcome", "filtered");
    droppedCounter = meterRegistry.counter("telemetry.stream.messages", "outcome", "dropped");
  }

  /**
   * @return the decoded messages that pass the subscription matcher, in delivery order. The
   * flux only ends with an error or when the subscriber cancels.
   */
  public Flux<Message> relay(String remoteAddr, StreamSubscription subscription) {
    return Flux.defer(() -> {
          openStreams.incrementAndGet();
          log.info("{} opened stream on topics {}", remoteAddr, subscription.getTopics());
          return eventSubscriber.subscribe(subscription.getTopics());
        })
        .<Message>handle((body, sink) -> {
          final Optional<Message> message = messageDecoder.decode(body);
          if (message.isEmpty()) {
            droppedCounter.increment();
          } else if (!subscription.getMatcher().matches(message.get())) {
            filteredCounter.increment();
          } else {
            sentCounter.increment();
            sink.next(message.get());
          }
        })
        .doOnError(e -> log.warn("{} stream failed: {}", remoteAddr, e.getMessage()))
        .doFinally(signalType -> {
          openStreams.decrementAndGet();
          log.info("{} closed stream ({})", remoteAddr, signalType);
        });
  }

  /**
   * Frames messages as server-sent events and interleaves a heartbeat comment so proxies and
   * clients can tell an idle stream from a dead one. Heartbeats stop when the messages end.
   */
  public Flux<ServerSentEvent<Message>> toEventStream(Flux<Message> messages) {
    return messages.publish(shared -> Flux.merge(
        shared.map(message -> ServerSentEvent.builder(message).event(MESSAGE_EVENT).build()),
        Flux.interval(heartbeatInterval)
            .map(tick -> ServerSentEvent.<Message>builder().comment(HEARTBEAT_COMMENT).build())
            .takeUntilOther(shared.then(Mono.just(Boolean.TRUE)))
    ));
  }

  public int getOpenStreams() {
    return openStreams.get();
  }
}
