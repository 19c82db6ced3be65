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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Meters of the bulk query endpoint.
 */
@Component
public class QueryMetrics {

  private final Timer responseLatency;
  private final Timer queryDuration;
  private final Counter recordsServed;
  private final DistributionSummary throughput;
  private final Counter rejected;

  @Autowired
  public QueryMetrics(MeterRegistry meterRegistry) {
    responseLatency = Timer.builder("telemetry.query.response.latency")
        .description("Time from receiving a query until the first byte of the response")
        .publishPercentileHistogram()
        .register(meterRegistry);
    queryDuration = Timer.builder("telemetry.query.duration")
        .description("Time spent streaming the results of a query")
        .register(meterRegistry);
    recordsServed = meterRegistry.counter("telemetry.query.records");
    throughput = DistributionSummary.builder("telemetry.query.throughput")
        .description("Records served per second by a query")
        .baseUnit("records/s")
        .register(meterRegistry);
    rejected = meterRegistry.counter("telemetry.query.rejected", "reason", "queue-timeout");
  }

  public void recordResponseLatency(Duration latency) {
    responseLatency.record(latency);
  }

  public void recordServed(long count, Duration duration) {
    queryDuration.record(duration);
    recordsServed.increment(count);
    if (!duration.isZero()) {
      throughput.record(count / (duration.toNanos() / 1e9));
    }
  }

  public void recordRejected() {
    rejected.increment();
  }
}
