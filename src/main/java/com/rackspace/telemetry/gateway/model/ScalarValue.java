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

package com.rackspace.telemetry.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * The dynamically typed value carried by records and messages. Serializes as the bare JSON
 * number, string or boolean it wraps.
 */
public final class ScalarValue {

  public enum Kind {
    NUMBER,
    STRING,
    BOOLEAN
  }

  private final Kind kind;
  private final Object raw;

  private ScalarValue(Kind kind, Object raw) {
    this.kind = kind;
    this.raw = raw;
  }

  public static ScalarValue ofNumber(Number number) {
    Objects.requireNonNull(number, "number");
    if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
      return new ScalarValue(Kind.NUMBER, number.longValue());
    }
    if (number instanceof Float) {
      return new ScalarValue(Kind.NUMBER, number.doubleValue());
    }
    return new ScalarValue(Kind.NUMBER, number);
  }

  public static ScalarValue ofString(String string) {
    return new ScalarValue(Kind.STRING, Objects.requireNonNull(string, "string"));
  }

  public static ScalarValue ofBoolean(boolean bool) {
    return new ScalarValue(Kind.BOOLEAN, bool);
  }

  /**
   * Wraps a value as decoded by a JSON or backend client library.
   *
   * @return the wrapped value or null when <code>raw</code> is null
   * @throws IllegalArgumentException if the value is not a number, string or boolean
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ScalarValue of(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number) {
      return ofNumber((Number) raw);
    }
    if (raw instanceof String) {
      return ofString((String) raw);
    }
    if (raw instanceof Boolean) {
      return ofBoolean((Boolean) raw);
    }
    throw new IllegalArgumentException("unsupported value type " + raw.getClass().getSimpleName());
  }

  public Kind getKind() {
    return kind;
  }

  @JsonValue
  public Object getRaw() {
    return raw;
  }

  public Number asNumber() {
    return (Number) raw;
  }

  public String asString() {
    return (String) raw;
  }

  public boolean asBoolean() {
    return (Boolean) raw;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ScalarValue that = (ScalarValue) o;
    // 1 and 1.0 are different values on the wire
    return kind == that.kind && raw.equals(that.raw);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, raw);
  }

  @Override
  public String toString() {
    return kind + "(" + raw + ")";
  }
}
