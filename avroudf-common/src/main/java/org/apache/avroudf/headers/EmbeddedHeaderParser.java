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

import org.apache.avroudf.exception.InvalidHeaderEncodingException;
import org.apache.avroudf.io.ByteCursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads headers embedded in front of a message body using the Spring Cloud Stream
 * embedded-header framing:
 *
 * <pre>
 *   0xFF | header count (1 byte) | { key length (1 byte) | key | value length (4 bytes, big endian) | JSON value }*
 * </pre>
 *
 * The first byte is always consumed. When it is not {@code 0xFF} the payload carries no headers
 * and the returned block is {@link EmbeddedHeaders#absent()}.
 */
public class EmbeddedHeaderParser {

  public static final int HEADER_MAGIC = 0xFF;

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  /**
   * Parses the header block at the cursor and leaves the cursor on the first byte of the body.
   * <p>
   * If parsing fails the cursor is not moved.
   *
   * @param cursor cursor positioned at the start of the framed message
   * @return the parsed headers, absent if the magic byte is missing
   * @throws org.apache.avroudf.exception.TruncatedFrameException if the frame ends early
   * @throws InvalidHeaderEncodingException if a key or value is not UTF-8, or a value is not JSON
   */
  public EmbeddedHeaders parseHeaders(ByteCursor cursor) {
    ByteCursor reader = cursor.duplicate();
    EmbeddedHeaders headers = readHeaders(reader);
    cursor.syncTo(reader);
    return headers;
  }

  private EmbeddedHeaders readHeaders(ByteCursor reader) {
    int magic = reader.readUnsignedByte();
    if (magic != HEADER_MAGIC) {
      return EmbeddedHeaders.absent();
    }
    int headerCount = reader.readUnsignedByte();
    Map<String, Object> headers = new LinkedHashMap<>(headerCount);
    for (int i = 0; i < headerCount; i++) {
      int keyLength = reader.readUnsignedByte();
      String key = decodeUtf8(reader.readBytes(keyLength), "key of header " + i);
      long valueLength = reader.readUnsignedInt();
      String value = decodeUtf8(reader.readBytes(valueLength), "value of header '" + key + "'");
      headers.put(key, parseJson(key, value));
    }
    return EmbeddedHeaders.of(headers);
  }

  private static String decodeUtf8(byte[] bytes, String what) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException e) {
      throw new InvalidHeaderEncodingException("Invalid UTF-8 in " + what, e);
    }
  }

  private static Object parseJson(String key, String value) {
    try {
      return MAPPER.readValue(value, Object.class);
    } catch (JsonProcessingException e) {
      throw new InvalidHeaderEncodingException("Value of header '" + key + "' is not valid JSON: " + value, e);
    }
  }
}
