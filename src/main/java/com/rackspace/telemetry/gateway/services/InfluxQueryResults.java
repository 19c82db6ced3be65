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

import com.influxdb.query.FluxRecord;
import com.rackspace.telemetry.gateway.model.Record;
import com.rackspace.telemetry.gateway.model.ScalarValue;
import com.rackspace.telemetry.gateway.query.QueryResults;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Adapts the row stream of an InfluxDB query to {@link QueryResults}.
 */
class InfluxQueryResults implements QueryResults {

  static final String MEASUREMENT_COLUMN = "_measurement";

  /**
   * Columns the Flux engine adds that do not follow the underscore convention for internal
   * columns.
   */
  static final Set<String> LEAKY_COLUMNS = Set.of("table", "result");

  private final Stream<FluxRecord> rows;
  private final Iterator<FluxRecord> iterator;
  private final boolean usedAggregateFunction;
  private final AtomicBoolean closed = new AtomicBoolean();
  private Record record;
  private Throwable error;

  InfluxQueryResults(Stream<FluxRecord> rows, boolean usedAggregateFunction) {
    this.rows = rows;
    this.iterator = rows.iterator();
    this.usedAggregateFunction = usedAggregateFunction;
  }

  @Override
  public boolean next() {
    if (closed.get() || error != null) {
      return false;
    }
    try {
      if (!iterator.hasNext()) {
        record = null;
        return false;
      }
      record = convert(iterator.next());
      return true;
    } catch (RuntimeException e) {
      record = null;
      error = e;
      return false;
    }
  }

  @Override
  public Record record() {
    return record;
  }

  @Override
  public Throwable error() {
    return error;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      // cancels the underlying HTTP response if rows are still pending
      rows.close();
    }
  }

  Record convert(FluxRecord row) {
    final Object measurement = row.getValues().get(MEASUREMENT_COLUMN);
    if (!(measurement instanceof String)) {
      throw new IllegalStateException("invalid measurement name type");
    }

    return new Record()
        .setName((String) measurement)
        // aggregation collapses the rows of a window, so its start is the only meaningful time
        .setTimestamp(usedAggregateFunction ? row.getStart() : row.getTime())
        .setValue(ScalarValue.of(row.getValue()))
        .setMeta(buildMeta(row.getValues()));
  }

  static Map<String, String> buildMeta(Map<String, Object> values) {
    final Map<String, String> meta = new TreeMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      final String key = entry.getKey();
      if (key.startsWith("_") || LEAKY_COLUMNS.contains(key)) {
        continue;
      }
      if (entry.getValue() instanceof String) {
        meta.put(key, (String) entry.getValue());
      }
    }
    return meta;
  }
}
