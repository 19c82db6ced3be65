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

import com.rackspace.telemetry.gateway.config.QueryProperties;
import com.rackspace.telemetry.gateway.exceptions.AdmissionTimeoutException;
import com.rackspace.telemetry.gateway.exceptions.BackendException;
import com.rackspace.telemetry.gateway.exceptions.EmptyPayloadException;
import com.rackspace.telemetry.gateway.exceptions.GatewayException;
import com.rackspace.telemetry.gateway.exceptions.PayloadTooLargeException;
import com.rackspace.telemetry.gateway.model.Query;
import com.rackspace.telemetry.gateway.model.Record;
import com.rackspace.telemetry.gateway.query.QueryResults;
import com.rackspace.telemetry.gateway.query.TimeSeriesBackend;
import com.rackspace.telemetry.gateway.validation.QueryRequestParser;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Serves bulk queries: admits the request, reads and validates the posted query and streams
 * the backend rows back as they arrive.
 */
@Service
@Slf4j
public class QueryService {

  private final AdmissionController admissionController;
  private final QueryRequestParser parser;
  private final TimeSeriesBackend backend;
  private final QueryMetrics queryMetrics;
  private final int maxBodySize;
  private final Scheduler rowScheduler;

  @Autowired
  public QueryService(AdmissionController admissionController,
                      QueryRequestParser parser,
                      TimeSeriesBackend backend,
                      QueryMetrics queryMetrics,
                      QueryProperties queryProperties) {
    this(admissionController, parser, backend, queryMetrics, queryProperties,
        Schedulers.boundedElastic());
  }

  QueryService(AdmissionController admissionController,
               QueryRequestParser parser,
               TimeSeriesBackend backend,
               QueryMetrics queryMetrics,
               QueryProperties queryProperties,
               Scheduler rowScheduler) {
    this.admissionController = admissionController;
    this.parser = parser;
    this.backend = backend;
    this.queryMetrics = queryMetrics;
    this.maxBodySize = queryProperties.getMaxBodySize();
    this.rowScheduler = rowScheduler;
  }

  /**
   * @param remoteAddr identifies the caller in logs
   * @param body the raw request body
   * @return the query results in backend order. The admission slot is held until this flux
   * terminates or is cancelled.
   */
  public Flux<Record> query(String remoteAddr, Flux<DataBuffer> body) {
    return Flux.usingWhen(
            admissionController.admit(),
            slot -> readQuery(remoteAddr, body)
                .flatMapMany(query -> streamResults(remoteAddr, query)),
            slot -> Mono.fromRunnable(slot::close)
        )
        .doOnError(AdmissionTimeoutException.class, e -> {
          log.info("{} rejected: {}", remoteAddr, e.getMessage());
          queryMetrics.recordRejected();
        });
  }

  Mono<Query> readQuery(String remoteAddr, Flux<DataBuffer> body) {
    return DataBufferUtils.join(body, maxBodySize)
        .onErrorMap(DataBufferLimitException.class,
            e -> new PayloadTooLargeException(maxBodySize, e))
        .map(QueryService::drainBuffer)
        .filter(bytes -> bytes.length > 0)
        .switchIfEmpty(Mono.error(EmptyPayloadException::new))
        .map(bytes -> {
          final Query query = parser.parse(bytes);
          log.info("{} query: {}", remoteAddr, new String(bytes, StandardCharsets.UTF_8));
          return query;
        })
        .doOnError(GatewayException.class,
            e -> log.debug("{} invalid request: {}", remoteAddr, e.getMessage()));
  }

  Flux<Record> streamResults(String remoteAddr, Query query) {
    final AtomicLong served = new AtomicLong();
    final long queryStart = System.nanoTime();

    return Flux.using(() -> backend.query(query), QueryService::drain, QueryResults::close)
        .onErrorMap(e -> !(e instanceof GatewayException),
            e -> new BackendException(String.valueOf(e.getMessage()), e))
        .doOnNext(record -> served.incrementAndGet())
        .doOnError(e -> log.warn("{} error: {}", remoteAddr, e.getMessage()))
        .doFinally(signalType -> {
          final Duration duration = Duration.ofNanos(System.nanoTime() - queryStart);
          queryMetrics.recordServed(served.get(), duration);
          log.info("{} served {} records in {} - {} records/s ({})", remoteAddr, served.get(),
              duration, String.format("%.3f", served.get() / Math.max(duration.toNanos() / 1e9, 1e-9)),
              signalType);
        })
        // pulling rows blocks on the backend response
        .subscribeOn(rowScheduler);
  }

  private static Flux<Record> drain(QueryResults results) {
    return Flux.generate(sink -> {
      if (results.next()) {
        sink.next(results.record());
      } else if (results.error() != null) {
        sink.error(results.error());
      } else {
        sink.complete();
      }
    });
  }

  private static byte[] drainBuffer(DataBuffer buffer) {
    try {
      final byte[] bytes = new byte[buffer.readableByteCount()];
      buffer.read(bytes);
      return bytes;
    } finally {
      DataBufferUtils.release(buffer);
    }
  }
}
