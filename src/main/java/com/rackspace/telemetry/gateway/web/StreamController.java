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

import com.rackspace.telemetry.gateway.config.StreamProperties;
import com.rackspace.telemetry.gateway.model.Message;
import com.rackspace.telemetry.gateway.services.StreamRelayService;
import com.rackspace.telemetry.gateway.stream.StreamSubscription;
import com.rackspace.telemetry.gateway.utils.RemoteAddressUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Live event stream. The <code>name</code> query parameter selects topics separated by
 * <code>|</code>, every other parameter is a regular expression the message meta must match.
 */
@RestController
@RequestMapping("/api/v0/stream")
public class StreamController {

  private final StreamRelayService relayService;
  private final StreamProperties streamProperties;

  @Autowired
  public StreamController(StreamRelayService relayService, StreamProperties streamProperties) {
    this.relayService = relayService;
    this.streamProperties = streamProperties;
  }

  @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<Message>> stream(ServerHttpRequest request,
      ServerHttpResponse response) {
    // an invalid pattern fails here, before any broker resources are opened
    final StreamSubscription subscription = StreamSubscription.fromQueryParams(
        request.getQueryParams(), streamProperties.getDefaultTopic());

    response.getHeaders().setAccessControlAllowOrigin("*");
    response.getHeaders().setCacheControl(CacheControl.noCache());

    return relayService.toEventStream(
        relayService.relay(RemoteAddressUtils.getRemoteAddr(request), subscription));
  }
}
