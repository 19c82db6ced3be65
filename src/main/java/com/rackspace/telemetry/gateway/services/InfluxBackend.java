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

import com.influxdb.client.reactive.InfluxDBClientReactive;
import com.influxdb.query.FluxRecord;
import com.rackspace.telemetry.gateway.config.InfluxProperties;
import com.rackspace.telemetry.gateway.exceptions.BackendException;
import com.rackspace.telemetry.gateway.model.Query;
import com.rackspace.telemetry.gateway.query.FluxQueryCompiler;
import com.rackspace.telemetry.gateway.query.QueryResults;
import com.rackspace.telemetry.gateway.query.TimeSeriesBackend;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

@Service
@Slf4j
public class InfluxBackend implements TimeSeriesBackend {

  /**
   * Rows buffered ahead of the consumer, which bounds memory per in-flight query.
   */
  static final int ROW_PREFETCH = 256;

  private final InfluxDBClientReactive influxDBClient;
  private final FluxQueryCompiler compiler;
  private final InfluxProperties properties;

  @Autowired
  public InfluxBackend(InfluxDBClientReactive influxDBClient, FluxQueryCompiler compiler,
      InfluxProperties properties) {
    this.influxDBClient = influxDBClient;
    this.compiler = compiler;
    this.properties = properties;
  }

  @Override
  public QueryResults query(Query query) {
    final String fluxQuery = compiler.compile(properties.getBucket(), query);
    log.debug("Submitting flux query: {}", fluxQuery);

    final Stream<FluxRecord> rows;
    try {
      rows = Flux.from(influxDBClient.getQueryReactiveApi().query(fluxQuery, properties.getOrg()))
          .name("influxQuery")
          .toStream(ROW_PREFETCH);
    } catch (RuntimeException e) {
      throw new BackendException(e.getMessage(), e);
    }
    return new InfluxQueryResults(rows, query.getFunc() != null);
  }
}
