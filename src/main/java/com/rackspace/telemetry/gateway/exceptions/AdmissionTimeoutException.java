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

package com.rackspace.telemetry.gateway.exceptions;

import java.time.Duration;
import org.springframework.http.HttpStatus;

/**
 * Raised when a query could not obtain a request queue slot in time. This is the expected way
 * of shedding load and is not logged as a fault.
 */
public class AdmissionTimeoutException extends GatewayException {

  public AdmissionTimeoutException(Duration waited) {
    super(String.format("request queue is full - no slot freed up within %ss, try again later",
        waited.toSeconds()));
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.SERVICE_UNAVAILABLE;
  }
}
