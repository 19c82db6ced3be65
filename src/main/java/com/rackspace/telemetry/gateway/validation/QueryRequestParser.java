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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.rackspace.telemetry.gateway.exceptions.QueryValidationException;
import com.rackspace.telemetry.gateway.model.Query;
import java.io.IOException;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Strictly decodes and validates query request bodies. Unknown fields, duplicate keys and
 * loosely typed values are all rejected so that typos in client requests surface immediately
 * rather than silently widening the query.
 */
@Component
public class QueryRequestParser {

  public static final Pattern FILTER_KEY_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

  private final ObjectReader queryReader;

  public QueryRequestParser(ObjectMapper objectMapper) {
    final ObjectMapper strictMapper = objectMapper.copy();
    strictMapper.coercionConfigFor(LogicalType.Integer)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    strictMapper.coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    queryReader = strictMapper.readerFor(Query.class)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
        .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
  }

  /**
   * @throws QueryValidationException with a <code>failed to parse query: ...</code> message
   */
  public Query parse(byte[] body) {
    final Query query;
    try {
      query = queryReader.readValue(body);
    } catch (UnrecognizedPropertyException e) {
      throw invalid(String.format("unknown field \"%s\"", e.getPropertyName()), e);
    } catch (JsonProcessingException e) {
      throw invalid(e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw invalid(e.getMessage(), e);
    }
    validate(query);
    return query;
  }

  static void validate(Query query) {
    if (query == null || !StringUtils.hasLength(query.getStart())) {
      throw invalid("missing start field", null);
    }
    if (query.getHead() != null && query.getTail() != null) {
      throw invalid("head and tail cannot both be specified", null);
    }
    if (query.getHead() != null && query.getHead() < 0) {
      throw invalid("head must not be negative", null);
    }
    if (query.getTail() != null && query.getTail() < 0) {
      throw invalid("tail must not be negative", null);
    }
    if (query.hasFilter()) {
      for (Map.Entry<String, String> entry : query.getFilter().entrySet()) {
        if (!FILTER_KEY_PATTERN.matcher(entry.getKey()).matches()) {
          throw invalid(String.format("invalid filter key: \"%s\"", entry.getKey()), null);
        }
        if (entry.getValue() == null) {
          throw invalid(String.format("missing filter value for key: \"%s\"", entry.getKey()),
              null);
        }
      }
    }
  }

  private static QueryValidationException invalid(String detail, Throwable cause) {
    return new QueryValidationException("failed to parse query: " + detail, cause);
  }
}
