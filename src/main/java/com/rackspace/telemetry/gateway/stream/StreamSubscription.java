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

import com.google.common.base.Splitter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;
import org.springframework.util.MultiValueMap;

/**
 * What a stream client asked for: the topics to bind and the matcher applied to each event.
 */
@Value
public class StreamSubscription {

  static final String TOPICS_PARAM = "name";

  private static final Splitter TOPIC_SPLITTER = Splitter.on('|').trimResults().omitEmptyStrings();

  List<String> topics;

  MessageMatcher matcher;

  /**
   * The <code>name</code> parameter holds a <code>|</code> separated list of topic patterns.
   * Every other parameter is a meta key whose first value is compiled as a regular expression.
   */
  public static StreamSubscription fromQueryParams(MultiValueMap<String, String> params,
      String defaultTopic) {
    final Map<String, String> filter = new LinkedHashMap<>();
    params.forEach((key, values) -> {
      if (!values.isEmpty()) {
        filter.put(key, values.get(0) == null ? "" : values.get(0));
      }
    });

    final String names = filter.remove(TOPICS_PARAM);
    List<String> topics = names == null ? List.of() : TOPIC_SPLITTER.splitToList(names);
    if (topics.isEmpty()) {
      topics = List.of(defaultTopic);
    }

    return new StreamSubscription(topics, MessageMatcher.compile(filter));
  }
}
