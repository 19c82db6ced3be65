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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.telemetry.gateway.config.StreamProperties;
import com.rackspace.telemetry.gateway.exceptions.BrokerUnavailableException;
import com.rackspace.telemetry.gateway.model.Message;
import com.rackspace.telemetry.gateway.model.ScalarValue;
import com.rackspace.telemetry.gateway.stream.EventSubscriber;
import com.rackspace.telemetry.gateway.stream.MessageDecoder;
import com.rackspace.telemetry.gateway.stream.StreamSubscription;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

class StreamRelayServiceTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private EventSubscriber eventSubscriber;
  private StreamRelayService relayService;

  @BeforeEach
  void setUp() {
    eventSubscriber = mock(EventSubscriber.class);
    relayService = new StreamRelayService(eventSubscriber, new MessageDecoder(new ObjectMapper()),
        new StreamProperties(), meterRegistry);
  }

  @Test
  void relaysMatchingMessagesInOrder() {
    when(eventSubscriber.subscribe(List.of("env.temperature"))).thenReturn(Flux.just(
        payload("env.temperature", "W001", 20.5),
        bytes("{broken"),
        payload("env.temperature", "V002", 30.0),
        payload("env.temperature", "W002", 21.5)
    ));

    StepVerifier.create(relayService.relay("test", subscription("env.temperature", "W.*")))
        .assertNext(message -> {
          assertThat(message.getName()).isEqualTo("env.temperature");
          assertThat(message.getValue()).isEqualTo(ScalarValue.ofNumber(20.5));
          assertThat(message.getMeta()).containsEntry("vsn", "W001");
          assertThat(message.getTimestamp()).isEqualTo(Instant.ofEpochSecond(1622505600L));
        })
        .assertNext(message -> assertThat(message.getMeta()).containsEntry("vsn", "W002"))
        .verifyComplete();

    verify(eventSubscriber).subscribe(List.of("env.temperature"));
    assertThat(outcome("sent")).isEqualTo(2);
    assertThat(outcome("filtered")).isEqualTo(1);
    assertThat(outcome("dropped")).isEqualTo(1);
  }

  @Test
  void cancellationClosesSubscriptionAndUpdatesGauge() {
    final AtomicBoolean cancelled = new AtomicBoolean();
    final Sinks.Many<byte[]> events = Sinks.many().unicast().onBackpressureBuffer();
    when(eventSubscriber.subscribe(List.of("#")))
        .thenReturn(events.asFlux().doOnCancel(() -> cancelled.set(true)));

    StepVerifier.create(relayService.relay("test", subscription(null, null)))
        .then(() -> {
          assertThat(relayService.getOpenStreams()).isEqualTo(1);
          assertThat(meterRegistry.get("telemetry.stream.connections").gauge().value())
              .isEqualTo(1.0);
          events.tryEmitNext(payload("sys.uptime", "W001", 1));
        })
        .expectNextCount(1)
        .thenCancel()
        .verify();

    assertThat(cancelled).isTrue();
    assertThat(relayService.getOpenStreams()).isZero();
  }

  @Test
  void brokerFailureEndsStream() {
    when(eventSubscriber.subscribe(List.of("#")))
        .thenReturn(Flux.error(new BrokerUnavailableException(new IOException("refused"))));

    StepVerifier.create(relayService.relay("test", subscription(null, null)))
        .expectErrorMessage("failed to connect to message broker")
        .verify();

    assertThat(relayService.getOpenStreams()).isZero();
  }

  @Test
  void heartbeatsWhileIdle() {
    StepVerifier.withVirtualTime(() -> relayService.toEventStream(Flux.never()))
        .expectSubscription()
        .expectNoEvent(Duration.ofSeconds(14))
        .thenAwait(Duration.ofSeconds(1))
        .assertNext(event -> {
          assertThat(event.comment()).isEqualTo("heartbeat");
          assertThat(event.data()).isNull();
        })
        .thenAwait(Duration.ofSeconds(15))
        .assertNext(event -> assertThat(event.comment()).isEqualTo("heartbeat"))
        .thenCancel()
        .verify();
  }

  @Test
  void messagesAreFramedAsMessageEvents() {
    final Message message = new Message().setName("env.temperature")
        .setValue(ScalarValue.ofNumber(1));

    StepVerifier.withVirtualTime(() -> relayService.toEventStream(Flux.just(message)))
        .assertNext(event -> {
          assertThat(event.event()).isEqualTo("message");
          assertThat(event.data()).isSameAs(message);
        })
        .verifyComplete();
  }

  private double outcome(String outcome) {
    return meterRegistry.get("telemetry.stream.messages").tag("outcome", outcome).counter().count();
  }

  private static StreamSubscription subscription(String name, String vsn) {
    final LinkedMultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    if (name != null) {
      params.add("name", name);
    }
    if (vsn != null) {
      params.add("vsn", vsn);
    }
    return StreamSubscription.fromQueryParams(params, "#");
  }

  private static byte[] payload(String name, String vsn, double value) {
    return bytes(String.format("{\"name\":\"%s\",\"ts\":1622505600000000000,\"val\":%s,"
        + "\"meta\":{\"vsn\":\"%s\"}}", name, value, vsn));
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
