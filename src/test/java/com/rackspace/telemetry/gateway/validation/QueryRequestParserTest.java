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

package com.rackspace.telemetry.gateway.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.telemetry.gateway.exceptions.QueryValidationException;
import com.rackspace.telemetry.gateway.model.Query;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class QueryRequestParserTest {

  private final QueryRequestParser parser = new QueryRequestParser(new ObjectMapper());

  @Test
  void parsesAllFields() {
    final Query query = parse("{\"start\":\"-4h\",\"end\":\"-2h\",\"tail\":3,\"func\":\"mean\","
        + "\"bucket\":\"downsampled\",\"filter\":{\"vsn\":\"W001|W002\",\"name\":\"env.*\"}}");

    assertThat(query.getStart()).isEqualTo("-4h");
    assertThat(query.getEnd()).isEqualTo("-2h");
    assertThat(query.getHead()).isNull();
    assertThat(query.getTail()).isEqualTo(3);
    assertThat(query.getFunc()).isEqualTo("mean");
    assertThat(query.getBucket()).isEqualTo("downsampled");
    assertThat(query.getFilter()).containsExactlyInAnyOrderEntriesOf(
        Map.of("vsn", "W001|W002", "name", "env.*"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"_meta", "meta_tag", "meta2", "Vsn"})
  void validFilterKeys(String key) {
    final Query query = parse("{\"start\":\"-1h\",\"filter\":{\"" + key + "\":\"x\"}}");

    assertThat(query.getFilter()).containsEntry(key, "x");
  }

  @ParameterizedTest
  @ValueSource(strings = {"meta.vsn", "meta-vsn", "1meta", ""})
  void invalidFilterKeys(String key) {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"filter\":{\"" + key + "\":\"x\"}}"))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("failed to parse query: invalid filter key: \"" + key + "\"");
  }

  @Test
  void missingStart() {
    assertThatThrownBy(() -> parse("{\"end\":\"-1h\"}"))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("failed to parse query: missing start field");
  }

  @Test
  void emptyStart() {
    assertThatThrownBy(() -> parse("{\"start\":\"\"}"))
        .hasMessage("failed to parse query: missing start field");
  }

  @Test
  void headAndTail() {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"head\":1,\"tail\":1}"))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("failed to parse query: head and tail cannot both be specified");
  }

  @Test
  void negativeHead() {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"head\":-5}"))
        .hasMessage("failed to parse query: head must not be negative");
  }

  @Test
  void unknownField() {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"limit\":10}"))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("failed to parse query: unknown field \"limit\"");
  }

  @Test
  void duplicateField() {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"start\":\"-2h\"}"))
        .isInstanceOf(QueryValidationException.class)
        .hasMessageStartingWith("failed to parse query: ");
  }

  @Test
  void duplicateFilterKey() {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"filter\":{\"vsn\":\"a\",\"vsn\":\"b\"}}"))
        .isInstanceOf(QueryValidationException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "{\"start\":\"-1h\",\"head\":\"3\"}",
      "{\"start\":\"-1h\",\"tail\":2.5}",
      "{\"start\":\"-1h\",\"tail\":true}",
      "{\"start\":\"-1h\"} {}",
      "[\"-1h\"]",
      "not json"
  })
  void malformedBodies(String body) {
    assertThatThrownBy(() -> parse(body))
        .isInstanceOf(QueryValidationException.class)
        .hasMessageStartingWith("failed to parse query: ");
  }

  @Test
  void nullFilterValue() {
    assertThatThrownBy(() -> parse("{\"start\":\"-1h\",\"filter\":{\"vsn\":null}}"))
        .isInstanceOf(QueryValidationException.class);
  }

  private Query parse(String body) {
    return parser.parse(body.getBytes(StandardCharsets.UTF_8));
  }
}
