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

package com.rackspace.telemetry.gateway.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("telemetry.query")
@Component
@Data
@Validated
public class QueryProperties {

  /**
   * The number of bulk queries that may be served concurrently.
   */
  @Min(1)
  int requestQueueSize = 10;

  /**
   * How long a bulk query waits for a free slot before it is rejected.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration requestQueueTimeout = Duration.ofSeconds(10);

  /**
   * Maximum accepted size, in bytes, of a query request body.
   */
  @Min(2)
  int maxBodySize = 1024;

  /**
   * Prefix of the attachment filename offered to clients. The current UTC time and an
   * <code>.ndjson</code> extension are appended.
   */
  @NotBlank
  String downloadFilenamePrefix = "sage-download-";

  /**
   * Buckets starting with this prefix are never queryable through the API.
   */
  @NotBlank
  String privateBucketPrefix = "_";
}
