/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.avroudf.headers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Headers embedded ahead of a message body, in the order they appeared on the wire.
 * <p>
 * Values are the JSON-decoded header values: {@link String}, {@link Number}, {@link Boolean},
 * {@code null}, or nested {@link Map} / {@link java.util.List} structures.
 */
public class EmbeddedHeaders {

  private static final EmbeddedHeaders ABSENT = new EmbeddedHeaders(false, Collections.emptyMap());

  private final boolean present;
  private final Map<String, Object> headers;

  private EmbeddedHeaders(boolean present, Map<String, Object> headers) {
    this.present = present;
    this.headers = headers;
  }

  /**
   * Headers of a payload that did not start with the header magic byte.
   */
  public static EmbeddedHeaders absent() {
    return ABSENT;
  }

  public static EmbeddedHeaders of(Map<String, Object> headers) {
    return new EmbeddedHeaders(true, Collections.unmodifiableMap(new LinkedHashMap<>(headers)));
  }

  public boolean isPresent() {
    return present;
  }

  public boolean containsKey(String key) {
    return headers.containsKey(key);
  }

  public Object get(String key) {
    return headers.get(key);
  }

  public int size() {
    return headers.size();
  }

  public Map<String, Object> asMap() {
    return headers;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    EmbeddedHeaders that = (EmbeddedHeaders) o;
    return present == that.present && headers.equals(that.headers);
  }

  @Override
  public int hashCode() {
    return Objects.hash(present, headers);
  }

  @Override
  public String toString() {
    return present ? "EmbeddedHeaders" + headers : "EmbeddedHeaders{absent}";
  }
}
