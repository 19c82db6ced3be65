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

import com.rackspace.telemetry.gateway.exceptions.UnsupportedFunctionException;
import java.util.Arrays;

public enum AggregateFunction {
  mean,
  min,
  max,
  sum,
  count;

  public static AggregateFunction fromName(String name) {
    return Arrays.stream(values())
        .filter(function -> function.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new UnsupportedFunctionException(name));
  }

  /**
   * @return the Flux pipeline stage that applies this function
   */
  public String toStage() {
    return name() + "()";
  }
}
