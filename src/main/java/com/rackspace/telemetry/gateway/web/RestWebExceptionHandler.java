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

import com.rackspace.telemetry.gateway.exceptions.AdmissionTimeoutException;
import com.rackspace.telemetry.gateway.exceptions.GatewayException;
import com.rackspace.telemetry.gateway.utils.RemoteAddressUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Renders every failure that happens before a response is committed as a single
 * <code>error: &lt;message&gt;</code> line of plain text.
 */
@Slf4j
@Component
@Order(-2)//So that our exception handler gets picked before DefaultErrorWebExceptionHandler
public class RestWebExceptionHandler extends
    AbstractErrorWebExceptionHandler {

  static final String UNEXPECTED_ERROR = "service encountered an unexpected "
      + "condition which prevented it from fulfilling the request";

  public RestWebExceptionHandler(
      ErrorAttributes errorAttributes,
      WebProperties webProperties,
      ApplicationContext applicationContext,
      ServerCodecConfigurer serverCodecConfigurer) {
    super(errorAttributes, webProperties.getResources(), applicationContext);
    this.setMessageWriters(serverCodecConfigurer.getWriters());
  }

  @Override
  protected RouterFunction<ServerResponse> getRoutingFunction(
      ErrorAttributes errorAttributes) {
    return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
  }

  private Mono<ServerResponse> renderErrorResponse(ServerRequest serverRequest) {
    final Throwable error = getError(serverRequest);
    final HttpStatus status = statusOf(error);
    final String message = messageOf(error, status);
    logErrorMessage(serverRequest, error, status);

    // headers prepared for a successful download no longer apply
    serverRequest.exchange().getResponse().getHeaders().remove(HttpHeaders.CONTENT_DISPOSITION);

    return ServerResponse.status(status)
        .contentType(MediaType.TEXT_PLAIN)
        .bodyValue(String.format("error: %s%n", message));
  }

  static HttpStatus statusOf(Throwable error) {
    if (error instanceof GatewayException) {
      return ((GatewayException) error).getStatus();
    }
    if (error instanceof ResponseStatusException) {
      return ((ResponseStatusException) error).getStatus();
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  static String messageOf(Throwable error, HttpStatus status) {
    if (error instanceof GatewayException) {
      return error.getMessage();
    }
    if (error instanceof ResponseStatusException) {
      final String reason = ((ResponseStatusException) error).getReason();
      return reason != null ? reason : status.getReasonPhrase();
    }
    return UNEXPECTED_ERROR;
  }

  private void logErrorMessage(ServerRequest serverRequest, Throwable error, HttpStatus status) {
    final String remoteAddr = RemoteAddressUtils.getRemoteAddr(serverRequest.exchange().getRequest());
    if (error instanceof AdmissionTimeoutException || status.is4xxClientError()) {
      // avoid logs cluttering for bad requests
      log.debug("{} request for uri {} failed: {}", remoteAddr, serverRequest.uri(),
          error.getMessage());
      return;
    }
    log.warn("{} request for uri {} failed", remoteAddr, serverRequest.uri(), error);
  }
}
