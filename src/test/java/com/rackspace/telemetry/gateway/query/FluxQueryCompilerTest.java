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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.telemetry.gateway.exceptions.BucketAccessDeniedException;
import com.rackspace.telemetry.gateway.exceptions.QueryValidationException;
import com.rackspace.telemetry.gateway.exceptions.UnsupportedFunctionException;
import com.rackspace.telemetry.gateway.model.Query;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class FluxQueryCompilerTest {

  private static final String BUCKET = "mybucket";

  private final FluxQueryCompiler compiler = new FluxQueryCompiler("_");

  @Test
  void startOnly() {
    assertThat(compiler.compile(BUCKET, Query.builder().start("-4h").build()))
        .isEqualTo("from(bucket:\"mybucket\") |> range(start:-4h)");
  }

  @Test
  void bucketOverride() {
    final Query query = Query.builder().bucket("downsampled").start("-4h").tail(3).build();

    assertThat(compiler.compile(BUCKET, query))
        .isEqualTo("from(bucket:\"downsampled\") |> range(start:-4h) |> tail(n:3)");
  }

  @Test
  void privateBucketIsDenied() {
    final Query query = Query.builder().bucket("_badbucket").start("-4h").tail(3).build();

    assertThatThrownBy(() -> compiler.compile(BUCKET, query))
        .isInstanceOf(BucketAccessDeniedException.class)
        .hasMessage("failed to query backend: not authorized to access bucket \"_badbucket\"");
  }

  @Test
  void privateDefaultBucketIsDenied() {
    assertThatThrownBy(() -> compiler.compile("_monitoring", Query.builder().start("-1h").build()))
        .isInstanceOf(BucketAccessDeniedException.class);
  }

  @Test
  void unsafeBucketIsRejected() {
    final Query query = Query.builder().bucket("x\") |> drop(").start("-4h").build();

    assertThatThrownBy(() -> compiler.compile(BUCKET, query))
        .isInstanceOf(QueryValidationException.class);
  }

  @Test
  void slashIsOnlyAllowedInFilterPatterns() {
    assertThatThrownBy(() -> compiler.compile(BUCKET,
        Query.builder().bucket("waggle/raw").start("-4h").build()))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("invalid bucket name \"waggle/raw\"");
    assertThatThrownBy(() -> compiler.compile(BUCKET,
        Query.builder().start("2021/06/01").build()))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("invalid start timestamp \"2021/06/01\"");
    assertThatThrownBy(() -> compiler.compile(BUCKET,
        Query.builder().start("-4h").end("-1h/2").build()))
        .isInstanceOf(QueryValidationException.class)
        .hasMessage("invalid end timestamp \"-1h/2\"");

    assertThat(compiler.compile(BUCKET,
        Query.builder().start("-4h").filter(Map.of("plugin", "docker.io/waggle/plugin-iio:0.4.5")).build()))
        .isEqualTo("from(bucket:\"mybucket\") |> range(start:-4h) |> "
            + "filter(fn: (r) => r.plugin == \"docker.io/waggle/plugin-iio:0.4.5\")");
  }

  @Test
  void startEnd() {
    assertThat(compiler.compile(BUCKET, Query.builder().start("-4h").end("-2h").build()))
        .isEqualTo("from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h)");
  }

  @Test
  void startEndTail() {
    assertThat(compiler.compile(BUCKET, Query.builder().start("-4h").end("-2h").tail(3).build()))
        .isEqualTo("from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> tail(n:3)");
  }

  @Test
  void startEndHead() {
    assertThat(compiler.compile(BUCKET, Query.builder().start("-4h").end("-2h").head(3).build()))
        .isEqualTo("from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> limit(n:3)");
  }

  @Test
  void rfc3339Bounds() {
    final Query query = Query.builder()
        .start("2021-06-01T00:00:00Z")
        .end("2021-06-01T00:00:01.5+02:00")
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:2021-06-01T00:00:00Z,stop:2021-06-01T00:00:01.5+02:00)");
  }

  @Test
  void exactFilter() {
    final Query query = Query.builder().start("-4h").end("-2h")
        .filter(Map.of("node", "0000000000000001"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r.node == \"0000000000000001\")");
  }

  @Test
  void exactFilterMultiple() {
    final Query query = Query.builder().start("-4h").end("-2h")
        .filter(Map.of("node", "0000000000000001", "vsn", "W001"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r.node == \"0000000000000001\" and r.vsn == \"W001\")");
  }

  @Test
  void regexpFilterRenamesName() {
    final Query query = Query.builder().start("-4h").end("-2h")
        .filter(Map.of("name", "env.temp.*"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r._measurement =~ /^env.temp.*$/)");
  }

  @Test
  void regexpAlternatives() {
    final Query query = Query.builder().start("-4h").end("-2h")
        .filter(Map.of("name", "env.temp.*", "vsn", "W001|W002"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r._measurement =~ /^env.temp.*$/ and r.vsn =~ /^(W001|W002)$/)");
  }

  @Test
  void regexpEscapesSlashes() {
    final Query query = Query.builder().start("-4h").end("-2h")
        .filter(Map.of("plugin", "docker.io/waggle/plugin-iio.*"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r.plugin =~ /^docker.io\\/waggle\\/plugin-iio.*$/)");
  }

  @Test
  void combinedWithTail() {
    final Query query = Query.builder().start("-4h").end("-2h").tail(123)
        .filter(Map.of("name", "env.temp.*", "vsn", "V001", "sensor", "es.*"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r._measurement =~ /^env.temp.*$/ and r.sensor =~ /^es.*$/ and r.vsn == \"V001\") |> tail(n:123)");
  }

  @Test
  void combinedAlternativesWithTail() {
    final Query query = Query.builder().start("-4h").end("-2h").tail(123)
        .filter(Map.of("name", "env.temp.*", "vsn", "V001|W123", "sensor", "es.*"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-4h,stop:-2h) |> filter(fn: (r) => r._measurement =~ /^env.temp.*$/ and r.sensor =~ /^es.*$/ and r.vsn =~ /^(V001|W123)$/) |> tail(n:123)");
  }

  @Test
  void aggregateFunctionIsLastStage() {
    final Query query = Query.builder().start("-1h").head(10).func("mean")
        .filter(Map.of("vsn", "W001"))
        .build();

    assertThat(compiler.compile(BUCKET, query)).isEqualTo(
        "from(bucket:\"mybucket\") |> range(start:-1h) |> filter(fn: (r) => r.vsn == \"W001\") |> limit(n:10) |> mean()");
  }

  @ParameterizedTest
  @ValueSource(strings = {"mean", "min", "max", "sum", "count"})
  void supportedFunctions(String func) {
    assertThat(compiler.compile(BUCKET, Query.builder().start("-1h").func(func).build()))
        .endsWith(" |> " + func + "()");
  }

  @ParameterizedTest
  @ValueSource(strings = {"median", "MEAN", "mean()", ""})
  void unsupportedFunctions(String func) {
    final Query query = Query.builder().start("-1h").func(func).build();

    assertThatThrownBy(() -> compiler.compile(BUCKET, query))
        .isInstanceOf(UnsupportedFunctionException.class)
        .hasMessage("unsupported function \"" + func + "\"");
  }

  @Test
  void filterOrderDoesNotDependOnMapOrder() {
    final Map<String, String> forward = new LinkedHashMap<>();
    final Map<String, String> backward = new LinkedHashMap<>();
    final String[] keys = {"vsn", "node", "name", "sensor", "plugin", "zone"};
    for (String key : keys) {
      forward.put(key, RandomStringUtils.randomAlphanumeric(6));
    }
    for (int i = keys.length - 1; i >= 0; i--) {
      backward.put(keys[i], forward.get(keys[i]));
    }

    assertThat(compiler.compile(BUCKET, Query.builder().start("-1h").filter(forward).build()))
        .isEqualTo(compiler.compile(BUCKET, Query.builder().start("-1h").filter(backward).build()));
  }

  static Stream<Query> badQueries() {
    return Stream.of(
        Query.builder().start("-4h").filter(Map.of("name", "); drop bucket")).build(),
        Query.builder().start("); danger").build(),
        Query.builder().end("); danger").build(),
        Query.builder().head(3).tail(3).build(),
        Query.builder().start("-4h").head(-1).build(),
        Query.builder().start("-4h").tail(-1).build(),
        Query.builder().start("-4h").filter(Map.of("vsn", "W001\" or true or \"")).build(),
        Query.builder().start("-4h").filter(Map.of("vsn) or (r.x", "W001")).build(),
        Query.builder().start("-4h").filter(Map.of("meta.vsn", "W001")).build(),
        Query.builder().start("-4h").filter(Map.of("plugin", "a\\/b.*")).build()
    );
  }

  @ParameterizedTest
  @MethodSource("badQueries")
  void badQueriesAreRejected(Query query) {
    assertThatThrownBy(() -> compiler.compile(BUCKET, query))
        .isInstanceOf(QueryValidationException.class);
  }
}
