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

import com.rackspace.telemetry.gateway.model.Record;

/**
 * Pull-based cursor over the rows of one backend query.
 * <p>
 * Callers loop on {@link #next()} and read {@link #record()} after each <code>true</code>;
 * once <code>next()</code> returns <code>false</code>, {@link #error()} tells exhaustion apart
 * from failure. {@link #close()} must be called exactly once on every path, including when the
 * caller stops early, and is safe to repeat.
 * </p>
 */
public interface QueryResults extends AutoCloseable {

  boolean next();

  /**
   * @return the current row, only valid after {@link #next()} returned true
   */
  Record record();

  /**
   * @return the failure that ended iteration, or null if the results were exhausted normally
   */
  Throwable error();

  @Override
  void close();
}
