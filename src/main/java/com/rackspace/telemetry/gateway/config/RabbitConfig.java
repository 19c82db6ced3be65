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

package com.rackspace.telemetry.gateway.config;

import com.rabbitmq.client.ConnectionFactory;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RabbitConfig {

  /**
   * Each stream opens its own connection from this factory, so automatic recovery is off: a
   * dropped connection simply ends the stream.
   */
  @Bean
  public ConnectionFactory rabbitConnectionFactory(StreamProperties properties)
      throws URISyntaxException, NoSuchAlgorithmException, KeyManagementException {
    final ConnectionFactory connectionFactory = new ConnectionFactory();
    connectionFactory.setUri(properties.getRabbitmqUri());
    connectionFactory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
    connectionFactory.setAutomaticRecoveryEnabled(false);
    connectionFactory.setTopologyRecoveryEnabled(false);
    log.info("Streaming from exchange {} on {}:{}", properties.getExchange(),
        connectionFactory.getHost(), connectionFactory.getPort());
    return connectionFactory;
  }
}
