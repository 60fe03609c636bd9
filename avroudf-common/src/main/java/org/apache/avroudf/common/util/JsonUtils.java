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

package org.apache.avroudf.common.util;

import org.apache.avroudf.exception.AvroUdfException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

/**
 * Shared Jackson mapper and the writer used for every JSON text handed back to the warehouse.
 * <p>
 * The writer puts a space after ',' and ':' and escapes every non-ASCII character as a lower-case
 * {@code \\uXXXX} sequence, so results are single-line, ASCII-only JSON.
 */
public class JsonUtils {

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private static final ObjectWriter WRITER = MAPPER.writer(new SpacedPrettyPrinter())
      .with(new AsciiCharacterEscapes());

  public static ObjectMapper getObjectMapper() {
    return MAPPER;
  }

  public static String toJsonString(Object value) {
    try {
      return WRITER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new AvroUdfException("Unable to serialize " + value.getClass().getSimpleName() + " as JSON", e);
    }
  }

  /**
   * Single-line printer with {@code ", "} and {@code ": "} separators.
   */
  static class SpacedPrettyPrinter extends MinimalPrettyPrinter {

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }

    @Override
    public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
      g.writeRaw(", ");
    }

    @Override
    public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(", ");
    }
  }

  /**
   * Escapes non-ASCII characters, DEL and the unnamed control characters as {@code \\uXXXX} with lower-case hex digits.
   */
  static class AsciiCharacterEscapes extends CharacterEscapes {

    private final int[] asciiEscapes;

    AsciiCharacterEscapes() {
      asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
      for (int ch = 0; ch < 0x20; ch++) {
        if (asciiEscapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
          asciiEscapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
        }
      }
      asciiEscapes[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
      return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
      if (ch < 0x20 || ch >= 0x7F) {
        return new SerializedString(String.format("\\u%04x", ch));
      }
      return null;
    }
  }
}
