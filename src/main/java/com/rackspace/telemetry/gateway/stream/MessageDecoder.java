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

package com.rackspace.telemetry.gateway.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.rackspace.telemetry.gateway.model.BusPayload;
import com.rackspace.telemetry.gateway.model.Message;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class MessageDecoder {

  private final ObjectReader payloadReader;

  public MessageDecoder(ObjectMapper objectMapper) {
    payloadReader = objectMapper.readerFor(BusPayload.class);
  }

  /**
   * @return the decoded message or empty if the payload is not a valid event
   */
  public Optional<Message> decode(byte[] body) {
    final BusPayload payload;
    try {
      payload = payloadReader.readValue(body);
    } catch (IOException e) {
      log.trace("Dropping undecodable message: {}", e.getMessage());
      return Optional.empty();
    }
    if (payload == null) {
      return Optional.empty();
    }

    return Optional.of(new Message()
        .setName(payload.getName())
        .setTimestamp(Instant.ofEpochSecond(0, payload.getTimestamp()))
        .setValue(payload.getValue())
        .setMeta(payload.getMeta() != null ? payload.getMeta() : Map.of()));
  }
}
