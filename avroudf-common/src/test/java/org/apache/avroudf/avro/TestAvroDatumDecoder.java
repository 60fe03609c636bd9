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
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import static org.apache.avroudf.testutils.AvroUdfTestUtils.USER_SCHEMA;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.containerFile;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.encodeDatum;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.moiraine;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TestAvroDatumDecoder {

  // zig-zag varint 0x7FFFFFF0 followed by three bytes of content
  private static final byte[] HUGE_LENGTH = {(byte) 0xE0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x0F, 'a', 'b', 'c'};

  private final AvroDatumDecoder decoder = new AvroDatumDecoder();

  @Test
  public void testDecodeAdvancesPastDatumOnly() {
    byte[] datum = encodeDatum(USER_SCHEMA, moiraine());
    byte[] payload = new byte[datum.length + 3];
    System.arraycopy(datum, 0, payload, 0, datum.length);
    ByteCursor cursor = ByteCursor.wrap(payload);

    GenericRecord record = (GenericRecord) decoder.decode(USER_SCHEMA, cursor);

    assertEquals("Moiraine", record.get("name").toString());
    assertEquals(4, record.get("favorite_number"));
    assertEquals("Blue", record.get("favorite_color").toString());
    assertEquals(datum.length, cursor.position());
    assertEquals(3, cursor.remaining());
  }

  @Test
  public void testConsecutiveDatums() {
    byte[] first = encodeDatum(USER_SCHEMA, user("Rand", null, null));
    byte[] second = encodeDatum(USER_SCHEMA, user("Egwene", 2, "White"));
    byte[] payload = new byte[first.length + second.length];
    System.arraycopy(first, 0, payload, 0, first.length);
    System.arraycopy(second, 0, payload, first.length, second.length);
    ByteCursor cursor = ByteCursor.wrap(payload);

    GenericRecord rand = (GenericRecord) decoder.decode(USER_SCHEMA, cursor);
    GenericRecord egwene = (GenericRecord) decoder.decode(USER_SCHEMA, cursor);

    assertNull(rand.get("favorite_number"));
    assertEquals("Egwene", egwene.get("name").toString());
    assertEquals(0, cursor.remaining());
  }

  @Test
  public void testTruncatedDatumLeavesCursor() {
    byte[] datum = encodeDatum(USER_SCHEMA, moiraine());
    ByteCursor cursor = ByteCursor.wrap(datum, 0, datum.length - 2);
    DatumDecodeException e = assertThrows(DatumDecodeException.class, () -> decoder.decode(USER_SCHEMA, cursor));
    assertEquals(0, cursor.position());
    assertInstanceOf(Exception.class, e.getCause());
  }

  @Test
  public void testMalformedDatum() {
    // string length zig-zag encoded as -1
    ByteCursor cursor = ByteCursor.wrap(new byte[] {0x01});
    assertThrows(DatumDecodeException.class, () -> decoder.decode(Schema.create(Schema.Type.STRING), cursor));
    assertEquals(0, cursor.position());
  }

  @Test
  public void testFileDecoderReadsEmbeddedSchema() {
    byte[] file = containerFile(USER_SCHEMA, moiraine(), user("Nynaeve", null, "Blue"));
    ByteCursor cursor = ByteCursor.wrap(file);

    List<Object> datums = new AvroFileDecoder().decodeAll(cursor);

    assertEquals(2, datums.size());
    assertEquals("Nynaeve", ((GenericRecord) datums.get(1)).get("name").toString());
    assertEquals(0, cursor.remaining());
  }

  @Test
  public void testFileDecoderRejectsBareDatum() {
    ByteCursor cursor = ByteCursor.wrap(encodeDatum(USER_SCHEMA, moiraine()));
    assertThrows(DatumDecodeException.class, () -> new AvroFileDecoder().decodeAll(cursor));
  }

  @Test
  public void testDeclaredLengthBeyondInput() {
    List<Schema> schemas = List.of(
        USER_SCHEMA,
        Schema.create(Schema.Type.STRING),
        Schema.create(Schema.Type.BYTES),
        new Schema.Parser().parse("{\"type\": \"array\", \"items\": \"null\"}"),
        new Schema.Parser().parse("{\"type\": \"map\", \"values\": \"int\"}"));
    for (Schema schema : schemas) {
      ByteCursor cursor = ByteCursor.wrap(HUGE_LENGTH);
      DatumDecodeException e = assertThrows(DatumDecodeException.class, () -> decoder.decode(schema, cursor));
      assertInstanceOf(EOFException.class, e.getCause(), schema.toString());
      assertEquals(0, cursor.position());
    }
  }

  @Test
  public void testCollectionsWithinInputStillDecode() {
    Schema schema = new Schema.Parser().parse("{\"type\": \"map\", \"values\": {\"type\": \"array\", \"items\": \"bytes\"}}");
    // one map entry "k" -> [0x01 0x02], then the end markers of both blocks
    ByteCursor cursor = ByteCursor.wrap(new byte[] {0x02, 0x02, 'k', 0x02, 0x04, 0x01, 0x02, 0x00, 0x00});

    @SuppressWarnings("unchecked")
    Map<Object, List<ByteBuffer>> map = (Map<Object, List<ByteBuffer>>) decoder.decode(schema, cursor);

    assertEquals(1, map.size());
    ByteBuffer value = map.values().iterator().next().get(0);
    assertEquals(2, value.remaining());
    assertEquals(0, cursor.remaining());
  }

  @Test
  public void testFileDecoderRejectsHugeHeaderLength() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(new byte[] {'O', 'b', 'j', 1, 0x02});
    out.writeBytes(HUGE_LENGTH);
    ByteCursor cursor = ByteCursor.wrap(out.toByteArray());
    assertThrows(DatumDecodeException.class, () -> new AvroFileDecoder().decodeAll(cursor));
  }

  @Test
  public void testFileDecoderRejectsHugeBlockSize() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(containerFile(USER_SCHEMA));
    out.writeBytes(new byte[] {0x02});
    out.writeBytes(HUGE_LENGTH);
    ByteCursor cursor = ByteCursor.wrap(out.toByteArray());
    assertThrows(DatumDecodeException.class, () -> new AvroFileDecoder().decodeAll(cursor));
  }

  @Test
  public void testFileDecoderRejectsHugeLengthInsideBlock() {
    byte[] header = containerFile(Schema.create(Schema.Type.STRING));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(header);
    // one datum in a block of eight bytes, closed by the header's sync marker
    out.writeBytes(new byte[] {0x02, 0x10});
    out.writeBytes(HUGE_LENGTH);
    out.write(header, header.length - 16, 16);
    ByteCursor cursor = ByteCursor.wrap(out.toByteArray());
    assertThrows(DatumDecodeException.class, () -> new AvroFileDecoder().decodeAll(cursor));
  }
}
