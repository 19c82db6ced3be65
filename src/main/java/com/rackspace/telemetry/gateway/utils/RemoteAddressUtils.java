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

package com.rackspace.telemetry.gateway.utils;

import java.net.InetSocketAddress;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.StringUtils;

public class RemoteAddressUtils {

  public static final String X_FORWARDED_FOR = "X-Forwarded-For";

  private RemoteAddressUtils() {
  }

  /**
   * Identifies the caller of a request for log correlation. The gateway normally runs behind a
   * proxy, so the forwarded address takes precedence over the socket address.
   */
  public static String getRemoteAddr(ServerHttpRequest request) {
    final String forwarded = request.getHeaders().getFirst(X_FORWARDED_FOR);
    if (StringUtils.hasText(forwarded)) {
      return forwarded;
    }
    final InetSocketAddress address = request.getRemoteAddress();
    if (address == null) {
      return "unknown";
    }
    return address.getAddress() != null ?
        address.getAddress().getHostAddress() + ":" + address.getPort() :
        address.getHostString() + ":" + address.getPort();
  }
}
