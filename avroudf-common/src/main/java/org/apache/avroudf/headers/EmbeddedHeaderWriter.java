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

import org.apache.avroudf.common.util.ValidationUtils;
import org.apache.avroudf.exception.AvroUdfException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes the producer side of the framing read by {@link EmbeddedHeaderParser}.
 */
public class EmbeddedHeaderWriter {

  private static final int MAX_ONE_BYTE_VALUE = 0xFF;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /**
   * Frames the body with the given headers. Header values are JSON encoded.
   */
  public byte[] embedHeaders(Map<String, ?> headers, byte[] body) {
    ValidationUtils.checkArgument(headers.size() <= MAX_ONE_BYTE_VALUE,
        "At most " + MAX_ONE_BYTE_VALUE + " headers can be embedded, got " + headers.size());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(EmbeddedHeaderParser.HEADER_MAGIC);
    out.write(headers.size());
    for (Map.Entry<String, ?> header : headers.entrySet()) {
      byte[] key = header.getKey().getBytes(StandardCharsets.UTF_8);
      ValidationUtils.checkArgument(key.length <= MAX_ONE_BYTE_VALUE,
          "Header key '" + header.getKey() + "' exceeds " + MAX_ONE_BYTE_VALUE + " bytes");
      byte[] value = toJson(header.getKey(), header.getValue());
      out.write(key.length);
      out.write(key, 0, key.length);
      out.write(value.length >>> 24);
      out.write(value.length >>> 16);
      out.write(value.length >>> 8);
      out.write(value.length);
      out.write(value, 0, value.length);
    }
    out.write(body, 0, body.length);
    return out.toByteArray();
  }

  private static byte[] toJson(String key, Object value) {
    try {
      return MAPPER.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new AvroUdfException("Cannot JSON encode value of header '" + key + "'", e);
    }
  }
}
