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

import com.rackspace.telemetry.gateway.exceptions.InvalidFilterPatternException;
import com.rackspace.telemetry.gateway.model.Message;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Per-connection filter of live messages. Every configured meta key must contain a match of
 * its expression; keys that are not configured are unconstrained.
 */
public class MessageMatcher {

  private final Map<String, Pattern> patterns;

  private MessageMatcher(Map<String, Pattern> patterns) {
    this.patterns = patterns;
  }

  /**
   * @param filter meta key to regular expression
   * @throws InvalidFilterPatternException if any expression does not compile
   */
  public static MessageMatcher compile(Map<String, String> filter) {
    final Map<String, Pattern> patterns = new LinkedHashMap<>();
    filter.forEach((key, expression) -> {
      try {
        patterns.put(key, Pattern.compile(expression));
      } catch (PatternSyntaxException e) {
        throw new InvalidFilterPatternException(key, e);
      }
    });
    return new MessageMatcher(Collections.unmodifiableMap(patterns));
  }

  public boolean matches(Message message) {
    final Map<String, String> meta =
        message.getMeta() != null ? message.getMeta() : Collections.emptyMap();
    for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
      // a missing key is matched as the empty string
      if (!entry.getValue().matcher(meta.getOrDefault(entry.getKey(), "")).find()) {
        return false;
      }
    }
    return true;
  }

  public Map<String, Pattern> getPatterns() {
    return patterns;
  }
}
