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

package com.rackspace.telemetry.gateway.web;

import com.rackspace.telemetry.gateway.config.QueryProperties;
import com.rackspace.telemetry.gateway.model.Record;
import com.rackspace.telemetry.gateway.services.QueryMetrics;
import com.rackspace.telemetry.gateway.services.QueryService;
import com.rackspace.telemetry.gateway.utils.RemoteAddressUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Bulk query API. Results are offered as a newline delimited JSON download.
 */
@RestController
@RequestMapping("/api/v1/query")
@Slf4j
public class QueryController {

  static final DateTimeFormatter DOWNLOAD_TIMESTAMP = DateTimeFormatter
      .ofPattern("yyyyMMddHHmmss")
      .withZone(ZoneOffset.UTC);

  private final QueryService queryService;
  private final QueryMetrics queryMetrics;
  private final QueryProperties queryProperties;
  private final Clock clock;

  @Autowired
  public QueryController(QueryService queryService, QueryMetrics queryMetrics,
      QueryProperties queryProperties) {
    this(queryService, queryMetrics, queryProperties, Clock.systemUTC());
  }

  QueryController(QueryService queryService, QueryMetrics queryMetrics,
      QueryProperties queryProperties, Clock clock) {
    this.queryService = queryService;
    this.queryMetrics = queryMetrics;
    this.queryProperties = queryProperties;
    this.clock = clock;
  }

  @PostMapping(produces = MediaType.APPLICATION_NDJSON_VALUE)
  public Flux<Record> query(ServerHttpRequest request, ServerHttpResponse response) {
    final long received = System.nanoTime();
    final String remoteAddr = RemoteAddressUtils.getRemoteAddr(request);
    log.debug("received request from {}", remoteAddr);

    response.getHeaders().setAccessControlAllowOrigin("*");
    response.getHeaders().setContentDisposition(
        ContentDisposition.attachment().filename(downloadFilename()).build()
    );
    response.beforeCommit(() -> {
      final HttpStatus status = response.getStatusCode();
      if (status == null || status.is2xxSuccessful()) {
        queryMetrics.recordResponseLatency(Duration.ofNanos(System.nanoTime() - received));
      }
      return Mono.empty();
    });

    return queryService.query(remoteAddr, request.getBody());
  }

  String downloadFilename() {
    return queryProperties.getDownloadFilenamePrefix()
        + DOWNLOAD_TIMESTAMP.format(clock.instant())
        + ".ndjson";
  }
}
