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

package com.rackspace.telemetry.gateway.web;

import com.rackspace.telemetry.gateway.config.AppProperties;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SiteController {

  static final String GREETING = "Hello from the telemetry gateway!";

  private final AppProperties appProperties;

  @Autowired
  public SiteController(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @GetMapping("/")
  public ResponseEntity<Void> root() {
    return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
        .location(URI.create(appProperties.getDocsUrl()))
        .build();
  }

  /**
   * Echoes the request headers, which helps debugging what proxies in front of the gateway
   * forward.
   */
  @GetMapping(value = "/whoami", produces = MediaType.TEXT_PLAIN_VALUE)
  public String whoami(ServerHttpRequest request) {
    final StringBuilder body = new StringBuilder(GREETING).append("\n\n");
    final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.putAll(request.getHeaders());
    headers.forEach((name, values) ->
        body.append(name).append(": ").append(String.join(", ", values)).append("\n"));
    return body.toString();
  }
}
