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

package com.rackspace.telemetry.gateway.query;

import com.rackspace.telemetry.gateway.model.Query;

public interface TimeSeriesBackend {

  /**
   * Compiles and submits the query. Compilation failures are thrown immediately; failures of
   * the query itself may also be reported later through {@link QueryResults#error()}.
   */
  QueryResults query(Query query);
}
