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

package com.rackspace.telemetry.gateway.query;

import com.rackspace.telemetry.gateway.config.QueryProperties;
import com.rackspace.telemetry.gateway.exceptions.BucketAccessDeniedException;
import com.rackspace.telemetry.gateway.exceptions.QueryValidationException;
import com.rackspace.telemetry.gateway.model.AggregateFunction;
import com.rackspace.telemetry.gateway.model.Query;
import com.rackspace.telemetry.gateway.validation.QueryRequestParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Compiles a {@link Query} into an InfluxDB Flux pipeline such as
 * <pre>
 * from(bucket:"waggle") |&gt; range(start:-4h) |&gt; filter(fn: (r) =&gt; r.vsn == "W001") |&gt; tail(n:3)
 * </pre>
 * <p>
 * Buckets, time bounds and filter patterns are interpolated into the query text as-is, so
 * every one of them has to pass {@link #SAFE_QUERY_STRING} first. That character set leaves
 * out quotes, backslashes, parentheses and braces, which is what keeps a value from closing
 * the string or regex literal it is placed in. Filter patterns may also contain <code>/</code>
 * (see {@link #SAFE_FILTER_PATTERN}), which is escaped inside regex literals.
 * </p>
 */
@Component
public class FluxQueryCompiler {

  public static final Pattern SAFE_QUERY_STRING = Pattern.compile("^[A-Za-z0-9+\\-_.*:| ]*$");

  /**
   * Filter patterns match container image names such as <code>docker.io/waggle/plugin</code>.
   */
  public static final Pattern SAFE_FILTER_PATTERN = Pattern.compile("^[A-Za-z0-9+\\-_.*:| /]*$");

  static final String STAGE_SEPARATOR = " |> ";

  /**
   * API field names that are stored under a different column name in InfluxDB.
   */
  static final Map<String, String> FIELD_RENAMES = Map.of("name", "_measurement");

  private final String privateBucketPrefix;

  @Autowired
  public FluxQueryCompiler(QueryProperties queryProperties) {
    this(queryProperties.getPrivateBucketPrefix());
  }

  public FluxQueryCompiler(String privateBucketPrefix) {
    this.privateBucketPrefix = privateBucketPrefix;
  }

  public String compile(String defaultBucket, Query query) {
    final List<String> stages = new ArrayList<>();

    stages.add(buildFromStage(resolveBucket(defaultBucket, query)));

    final String range = buildRangeStage(query);
    if (!range.isEmpty()) {
      stages.add(range);
    }

    final String filter = buildFilterStage(query);
    if (!filter.isEmpty()) {
      stages.add(filter);
    }

    if (query.getHead() != null && query.getTail() != null) {
      throw new QueryValidationException("head and tail cannot both be specified");
    }
    if (query.getHead() != null) {
      stages.add(String.format("limit(n:%d)", requireCount("head", query.getHead())));
    }
    if (query.getTail() != null) {
      stages.add(String.format("tail(n:%d)", requireCount("tail", query.getTail())));
    }

    if (query.getFunc() != null) {
      stages.add(AggregateFunction.fromName(query.getFunc()).toStage());
    }

    return String.join(STAGE_SEPARATOR, stages);
  }

  private String resolveBucket(String defaultBucket, Query query) {
    final String bucket = query.getBucket() != null ? query.getBucket() : defaultBucket;
    if (!StringUtils.hasLength(bucket)) {
      throw new QueryValidationException("no bucket to query");
    }
    if (bucket.startsWith(privateBucketPrefix)) {
      throw new BucketAccessDeniedException(bucket);
    }
    if (!isSafe(bucket)) {
      throw new QueryValidationException(String.format("invalid bucket name \"%s\"", bucket));
    }
    return bucket;
  }

  private static String buildFromStage(String bucket) {
    return String.format("from(bucket:\"%s\")", bucket);
  }

  private static String buildRangeStage(Query query) {
    final String start = nullToEmpty(query.getStart());
    final String end = nullToEmpty(query.getEnd());
    if (!isSafe(start)) {
      throw new QueryValidationException(String.format("invalid start timestamp \"%s\"", start));
    }
    if (!isSafe(end)) {
      throw new QueryValidationException(String.format("invalid end timestamp \"%s\"", end));
    }

    final List<String> bounds = new ArrayList<>(2);
    if (!start.isEmpty()) {
      bounds.add("start:" + start);
    }
    if (!end.isEmpty()) {
      bounds.add("stop:" + end);
    }
    return bounds.isEmpty() ? "" : String.format("range(%s)", String.join(",", bounds));
  }

  private static String buildFilterStage(Query query) {
    if (!query.hasFilter()) {
      return "";
    }

    final List<String> clauses = new ArrayList<>(query.getFilter().size());
    for (Map.Entry<String, String> entry : query.getFilter().entrySet()) {
      final String field = entry.getKey();
      final String pattern = entry.getValue();
      if (field == null || !isSafe(field)
          || !QueryRequestParser.FILTER_KEY_PATTERN.matcher(field).matches()) {
        throw new QueryValidationException(String.format("invalid filter field name \"%s\"", field));
      }
      if (pattern == null || !SAFE_FILTER_PATTERN.matcher(pattern).matches()) {
        throw new QueryValidationException(
            String.format("invalid filter field pattern \"%s\"", pattern));
      }
      clauses.add(buildClause(FIELD_RENAMES.getOrDefault(field, field), pattern));
    }

    // map iteration order must never leak into the compiled query
    clauses.sort(null);
    return String.format("filter(fn: (r) => %s)", String.join(" and ", clauses));
  }

  static String buildClause(String column, String pattern) {
    if (pattern.contains("|")) {
      return String.format("r.%s =~ /^(%s)$/", column, escapeRegexLiteral(pattern));
    }
    if (pattern.contains("*")) {
      return String.format("r.%s =~ /^%s$/", column, escapeRegexLiteral(pattern));
    }
    return String.format("r.%s == \"%s\"", column, pattern);
  }

  private static String escapeRegexLiteral(String pattern) {
    return pattern.replace("/", "\\/");
  }

  private static int requireCount(String name, int count) {
    if (count < 0) {
      throw new QueryValidationException(name + " must not be negative");
    }
    return count;
  }

  private static boolean isSafe(String s) {
    return SAFE_QUERY_STRING.matcher(s).matches();
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
