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

import com.influxdb.client.InfluxDBClientOptions;
import com.influxdb.client.reactive.InfluxDBClientReactive;
import com.influxdb.client.reactive.InfluxDBClientReactiveFactory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@Slf4j
public class InfluxConfig {

  @Bean(destroyMethod = "close")
  public InfluxDBClientReactive influxDBClient(InfluxProperties properties) {
    log.info("Connecting to InfluxDB at {} with org={} bucket={}",
        properties.getUrl(), properties.getOrg(), properties.getBucket());

    final InfluxDBClientOptions.Builder options = InfluxDBClientOptions.builder()
        .url(properties.getUrl())
        .org(properties.getOrg())
        .okHttpClient(new OkHttpClient.Builder()
            .readTimeout(properties.getTimeout())
            .callTimeout(properties.getTimeout()));
    if (StringUtils.hasText(properties.getToken())) {
      options.authenticateToken(properties.getToken().toCharArray());
    }
    return InfluxDBClientReactiveFactory.create(options.build());
  }
}
