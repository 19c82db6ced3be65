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

import org.springframework.http.HttpStatus;

/**
 * Base of the failures that are reported back to API clients. The message is written verbatim
 * into the <code>error: ...</code> response body, so it must be safe to show to callers.
 */
public abstract class GatewayException extends RuntimeException {

  protected GatewayException(String message) {
    super(message);
  }

  protected GatewayException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract HttpStatus getStatus();
}
