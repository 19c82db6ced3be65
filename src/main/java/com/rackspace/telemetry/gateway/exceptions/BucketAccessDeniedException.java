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
 * Raised by the query compiler for private buckets. It surfaces to the client as a backend
 * query failure.
 */
public class BucketAccessDeniedException extends GatewayException {

  public BucketAccessDeniedException(String bucket) {
    super(String.format("failed to query backend: not authorized to access bucket \"%s\"",
        bucket));
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
