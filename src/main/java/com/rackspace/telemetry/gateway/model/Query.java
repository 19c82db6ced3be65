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

package com.rackspace.telemetry.gateway.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A bulk data query as posted by API clients.
 * <p>
 * <code>start</code> and <code>end</code> are passed through to the Flux <code>range</code>
 * stage, so they may be relative durations such as <code>-4h</code> or RFC3339 timestamps.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Query {

  String start;

  String end;

  /**
   * Keeps only the first N rows of each series.
   */
  Integer head;

  /**
   * Keeps only the last N rows of each series.
   */
  Integer tail;

  /**
   * Name of an aggregation function, see {@link AggregateFunction}.
   */
  String func;

  /**
   * Overrides the configured default bucket.
   */
  String bucket;

  Map<String, String> filter;

  public boolean hasFilter() {
    return filter != null && !filter.isEmpty();
  }
}
