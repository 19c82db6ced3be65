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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.rackspace.telemetry.gateway.config.StreamProperties;
import com.rackspace.telemetry.gateway.exceptions.BrokerUnavailableException;
import com.rackspace.telemetry.gateway.exceptions.QueueSetupException;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

/**
 * Subscribes to the topic exchange through a dedicated connection and a server-named,
 * exclusive, auto-delete queue per stream, so nothing outlives the client connection.
 */
@Component
@Slf4j
public class RabbitEventSubscriber implements EventSubscriber {

  static final String CONNECTION_NAME = "telemetry-gateway-stream";

  private final ConnectionFactory connectionFactory;
  private final String exchange;
  private final int maxBufferedMessages;

  @Autowired
  public RabbitEventSubscriber(ConnectionFactory connectionFactory,
      StreamProperties streamProperties) {
    this.connectionFactory = connectionFactory;
    this.exchange = streamProperties.getExchange();
    this.maxBufferedMessages = streamProperties.getMaxBufferedMessages();
  }

  @Override
  public Flux<byte[]> subscribe(List<String> topics) {
    return Flux.using(this::connect, connection -> consume(connection, topics), this::disconnect)
        // connection and queue setup are blocking calls
        .subscribeOn(Schedulers.boundedElastic());
  }

  private Connection connect() {
    try {
      return connectionFactory.newConnection(CONNECTION_NAME);
    } catch (IOException | TimeoutException e) {
      log.warn("Failed to connect to message broker: {}", e.getMessage());
      throw new BrokerUnavailableException(e);
    }
  }

  private Flux<byte[]> consume(Connection connection, List<String> topics) {
    return Flux.<byte[]>create(sink -> {
      final Channel channel;
      try {
        channel = connection.createChannel();
      } catch (IOException e) {
        sink.error(new QueueSetupException("open broker channel", e));
        return;
      }
      if (channel == null) {
        sink.error(new QueueSetupException("open broker channel", null));
        return;
      }
      sink.onDispose(() -> closeChannel(channel));

      final String queue;
      try {
        queue = channel.queueDeclare("", false, true, true, null).getQueue();
      } catch (IOException e) {
        sink.error(new QueueSetupException("declare stream queue", e));
        return;
      }

      for (String topic : topics) {
        try {
          channel.queueBind(queue, exchange, topic);
        } catch (IOException e) {
          sink.error(new QueueSetupException(
              String.format("bind queue %s to exchange %s", queue, exchange), e));
          return;
        }
      }

      try {
        channel.basicConsume(queue, true,
            (consumerTag, delivery) -> sink.next(delivery.getBody()),
            consumerTag -> sink.complete(),
            (consumerTag, signal) -> onShutdown(sink, signal));
      } catch (IOException e) {
        sink.error(new QueueSetupException("consume queue " + queue, e));
        return;
      }
      log.debug("Consuming {} bound to {} on {}", queue, topics, exchange);
    }, FluxSink.OverflowStrategy.BUFFER)
        // deliveries are auto-acked, so a slow client must not queue them without limit
        .onBackpressureBuffer(maxBufferedMessages, body -> log.warn(
            "Stream client fell {} messages behind on {}, closing its stream",
            maxBufferedMessages, topics));
  }

  private static void onShutdown(FluxSink<byte[]> sink, ShutdownSignalException signal) {
    if (signal.isInitiatedByApplication()) {
      sink.complete();
    } else {
      sink.error(new BrokerUnavailableException(signal));
    }
  }

  private static void closeChannel(Channel channel) {
    try {
      if (channel.isOpen()) {
        channel.close();
      }
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      log.debug("Channel was already closing: {}", e.getMessage());
    }
  }

  private void disconnect(Connection connection) {
    try {
      if (connection.isOpen()) {
        connection.close();
      }
    } catch (IOException | ShutdownSignalException e) {
      log.warn("Failed to close broker connection cleanly: {}", e.getMessage());
    }
  }
}
