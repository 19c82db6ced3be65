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
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("telemetry.influxdb")
@Component
@Data
@Validated
public class InfluxProperties {

  @NotBlank
  String url = "http://localhost:8086";

  String token = "";

  @NotBlank
  String org = "waggle";

  /**
   * Bucket queried when a request does not name one.
   */
  @NotBlank
  String bucket = "waggle";

  /**
   * Read timeout of the InfluxDB HTTP client. Large result sets can take minutes to stream.
   */
  @NotNull
  Duration timeout = Duration.ofMinutes(15);
}
