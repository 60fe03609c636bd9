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

package org.apache.avroudf.avro;

import org.apache.avroudf.exception.DatumDecodeException;
import org.apache.avroudf.io.ByteCursor;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DecoderFactory;

import java.io.IOException;

/**
 * Decodes a single Avro binary encoded datum (no container, no schema prefix) against a known schema.
 */
public class AvroDatumDecoder {

  private static final ThreadLocal<BinaryDecoder> BINARY_DECODER = ThreadLocal.withInitial(() -> null);

  /**
   * Decodes one datum starting at the cursor and advances the cursor past the bytes it consumed.
   * Bytes after the datum are left unread. On failure the cursor does not move. A declared length
   * beyond the end of the input fails the decode instead of being allocated.
   *
   * @param schema the writer schema of the datum
   * @param cursor cursor positioned at the first byte of the datum
   * @return the generic representation of the datum
   * @throws DatumDecodeException on truncated or malformed input
   */
  public Object decode(Schema schema, ByteCursor cursor) {
    BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(
        cursor.array(), cursor.arrayPosition(), cursor.remaining(), BINARY_DECODER.get());
    BINARY_DECODER.set(decoder);
    GenericDatumReader<Object> reader = new GenericDatumReader<>(schema);
    Object datum;
    int consumed;
    try {
      datum = reader.read(null, new LengthCheckingDecoder(decoder));
      consumed = cursor.remaining() - decoder.inputStream().available();
    } catch (IOException | RuntimeException e) {
      throw new DatumDecodeException("Unable to decode datum of schema " + schema.getFullName()
          + " from " + cursor.remaining() + " bytes", e);
    }
    cursor.skip(consumed);
    return datum;
  }
}
