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

import org.apache.avroudf.exception.AvroUdfException;
import org.apache.avroudf.exception.DatumDecodeException;
import org.apache.avroudf.io.ByteCursor;

import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileConstants;
import org.apache.avro.file.DataFileStream;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DatumReader;
import org.apache.avro.io.Decoder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes every datum of an Avro object container file, using the schema embedded in its header.
 */
public class AvroFileDecoder {

  private static final int MAX_VARINT_BYTES = 10;

  /**
   * Reads the container from the cursor position to its end.
   *
   * @throws DatumDecodeException if the bytes are not a readable Avro container
   */
  public List<Object> decodeAll(ByteCursor cursor) {
    try {
      checkLayout(cursor.duplicate());
    } catch (AvroUdfException e) {
      throw new DatumDecodeException("Malformed Avro container of " + cursor.remaining() + " bytes", e);
    }
    List<Object> datums = new ArrayList<>();
    ByteArrayInputStream in = new ByteArrayInputStream(cursor.array(), cursor.arrayPosition(), cursor.remaining());
    try (DataFileStream<Object> stream = new DataFileStream<>(in, new LengthCheckingDatumReader())) {
      while (stream.hasNext()) {
        datums.add(stream.next());
      }
    } catch (IOException | AvroRuntimeException e) {
      throw new DatumDecodeException("Unable to read Avro container of " + cursor.remaining() + " bytes", e);
    }
    cursor.skip(cursor.remaining());
    return datums;
  }

  /**
   * Walks the header metadata and the data blocks, checking that every declared length fits in the
   * input before the container reader allocates buffers for them.
   */
  private static void checkLayout(ByteCursor scan) {
    scan.skip(DataFileConstants.MAGIC.length);
    long count;
    while ((count = readLong(scan)) != 0) {
      if (count < 0) {
        count = -count;
        readLong(scan);
      }
      for (long i = 0; i < count; i++) {
        scan.skip(readLong(scan));
        scan.skip(readLong(scan));
      }
    }
    scan.skip(DataFileConstants.SYNC_SIZE);
    while (scan.hasRemaining()) {
      readLong(scan);
      scan.skip(readLong(scan));
      scan.skip(DataFileConstants.SYNC_SIZE);
    }
  }

  /**
   * Reads a zig-zag encoded variable length long.
   */
  private static long readLong(ByteCursor scan) {
    long value = 0;
    for (int i = 0; i < MAX_VARINT_BYTES; i++) {
      int b = scan.readUnsignedByte();
      value |= (long) (b & 0x7F) << (7 * i);
      if ((b & 0x80) == 0) {
        return (value >>> 1) ^ -(value & 1);
      }
    }
    throw new AvroUdfException("Invalid long encoding at offset " + scan.position());
  }

  private static class LengthCheckingDatumReader implements DatumReader<Object> {

    private final GenericDatumReader<Object> reader = new GenericDatumReader<>();

    @Override
    public void setSchema(Schema schema) {
      reader.setSchema(schema);
    }

    @Override
    public Object read(Object reuse, Decoder in) throws IOException {
      return reader.read(reuse, in instanceof BinaryDecoder ? new LengthCheckingDecoder((BinaryDecoder) in) : in);
    }
  }
}
