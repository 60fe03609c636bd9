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

package org.apache.avroudf.batch;

import org.apache.avroudf.aggregation.AggregatedRecordEncoder;
import org.apache.avroudf.exception.InvalidRecordEncodingException;
import org.apache.avroudf.headers.EmbeddedHeaderWriter;
import org.apache.avroudf.pipeline.MultiplexedRecordPipeline;
import org.apache.avroudf.pipeline.PipelineMode;
import org.apache.avroudf.pipeline.RecordPipeline;
import org.apache.avroudf.pipeline.SingleSchemaRecordPipeline;
import org.apache.avroudf.schema.SchemaCache;
import org.apache.avroudf.schema.SchemaRegistryClient;

import org.apache.avro.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

import static org.apache.avroudf.testutils.AvroUdfTestUtils.MOIRAINE_JSON;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.USER_SCHEMA;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.USER_SCHEMA_ID;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.USER_SCHEMA_STR;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.encodeDatum;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.framedUser;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.hex;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.moiraine;
import static org.apache.avroudf.testutils.AvroUdfTestUtils.user;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestBatchOrchestrator {

  private RecordPipeline headerFramed;
  private RecordPipeline aggregated;

  @BeforeEach
  public void setUp() {
    SchemaRegistryClient registryClient = new SchemaRegistryClient(coordinates -> USER_SCHEMA_STR, new SchemaCache());
    headerFramed = new MultiplexedRecordPipeline(PipelineMode.HEADER_FRAMED, registryClient, "contentType", false);
    aggregated = new MultiplexedRecordPipeline(PipelineMode.AGGREGATED_MULTIPLEXED, registryClient, "contentType", false);
  }

  @Test
  public void testMoiraine() {
    BatchResult result = new BatchOrchestrator().run(
        Collections.singletonList(RawRecord.of(hex(framedUser(moiraine())), null)), headerFramed);

    assertTrue(result.isSuccess());
    assertEquals(1, result.getCount());
    assertEquals("[" + MOIRAINE_JSON + "]", result.getResults().get(0));
  }

  @Test
  public void testTruncatedHeaderFailsBatch() {
    List<RawRecord> records = Arrays.asList(
        RawRecord.of(hex(framedUser(moiraine()))),
        RawRecord.of("ff010a616263"));

    BatchResult result = new BatchOrchestrator().run(records, headerFramed);

    assertFalse(result.isSuccess());
    assertEquals(0, result.getCount());
    assertEquals("Error processing record 1. Error: org.apache.avroudf.exception.TruncatedFrameException: "
        + "Cannot read 10 bytes at offset 3, only 3 remaining", result.getErrorMessage());
  }

  @Test
  public void testEmptyEnvelopeSerializesAsEmptyList() {
    BatchResult result = new BatchOrchestrator().run(
        Collections.singletonList(RawRecord.of(hex(new AggregatedRecordEncoder().encode()))), aggregated);
    assertTrue(result.isSuccess());
    assertEquals(Collections.singletonList("[]"), result.getResults());
  }

  @Test
  public void testEmptyBatch() {
    BatchResult result = new BatchOrchestrator().run(Collections.emptyList(), aggregated);
    assertTrue(result.isSuccess());
    assertEquals(0, result.getCount());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 4})
  public void testOutputOrderMatchesInput(int parallelism) {
    List<RawRecord> records = new ArrayList<>();
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      AggregatedRecordEncoder encoder = new AggregatedRecordEncoder();
      for (int j = 0; j <= i % 3; j++) {
        encoder.addRecord("pk", framedUser(user("user-" + i + "-" + j, i, null)));
      }
      records.add(RawRecord.of(hex(encoder.encode())));
      StringBuilder json = new StringBuilder("[");
      for (int j = 0; j <= i % 3; j++) {
        json.append(j == 0 ? "" : ", ")
            .append("{\"name\": \"user-").append(i).append('-').append(j)
            .append("\", \"favorite_number\": ").append(i).append(", \"favorite_color\": null}");
      }
      expected.add(json.append(']').toString());
    }

    BatchResult result = new BatchOrchestrator(parallelism).run(records, aggregated);

    assertTrue(result.isSuccess());
    assertEquals(expected, result.getResults());
  }

  @Test
  public void testParallelReportsLowestFailingIndex() {
    List<RawRecord> records = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      records.add(RawRecord.of(hex(framedUser(moiraine()))));
    }
    records.set(9, RawRecord.of("zz"));
    records.set(5, RawRecord.of("ff01"));
    records.set(7, RawRecord.of("00"));

    BatchResult result = new BatchOrchestrator(4).run(records, headerFramed);

    assertFalse(result.isSuccess());
    assertTrue(result.getErrorMessage().startsWith("Error processing record 5. Error: "),
        result.getErrorMessage());
  }

  @Test
  public void testInvalidHex() {
    BatchResult result = new BatchOrchestrator().run(Arrays.asList(RawRecord.of("abc"), RawRecord.of(null)), headerFramed);
    assertEquals("Error processing record 0. Error: org.apache.avroudf.exception.InvalidRecordEncodingException: "
        + "Record payload is not valid hex", result.getErrorMessage());
    assertThrows(InvalidRecordEncodingException.class, () -> BatchOrchestrator.decodeHex(null));
    assertArrayEquals(new byte[] {(byte) 0xFF, 0x0A}, BatchOrchestrator.decodeHex(" FF0a\n"));
  }

  @Test
  public void testHexWithSpacesBetweenBytes() {
    assertArrayEquals(new byte[] {(byte) 0xFF, 0x02}, BatchOrchestrator.decodeHex("ff 02"));
    assertArrayEquals(new byte[] {0x01, 0x02, 0x03}, BatchOrchestrator.decodeHex("01\t02\n 03"));
    BatchResult result = new BatchOrchestrator().run(
        Collections.singletonList(RawRecord.of(hex(encodeDatum(USER_SCHEMA, moiraine())).replaceAll("(..)", "$1 "))),
        SingleSchemaRecordPipeline.withSchema(USER_SCHEMA));
    assertEquals(Collections.singletonList(MOIRAINE_JSON), result.getResults());
  }

  @Test
  public void testHugeDeclaredLengthFailsBatch() {
    // a string length of 0x7FFFFFF0 followed by three bytes
    String payload = "e0ffffff0f616263";
    List<RecordPipeline> pipelines = Arrays.asList(
        SingleSchemaRecordPipeline.withSchema(USER_SCHEMA),
        SingleSchemaRecordPipeline.withSchema(new Schema.Parser().parse("{\"type\": \"array\", \"items\": \"null\"}")),
        headerFramed);
    for (RecordPipeline pipeline : pipelines) {
      String record = pipeline == headerFramed
          ? hex(new EmbeddedHeaderWriter().embedHeaders(Collections.singletonMap("contentType", USER_SCHEMA_ID),
              HexFormat.of().parseHex(payload)))
          : payload;
      BatchResult result = new BatchOrchestrator().run(Collections.singletonList(RawRecord.of(record)), pipeline);
      assertFalse(result.isSuccess());
      assertTrue(result.getErrorMessage().startsWith(
          "Error processing record 0. Error: org.apache.avroudf.exception.DatumDecodeException"), result.getErrorMessage());
    }
  }

  @Test
  public void testSingleDatumIsNotWrapped() {
    RecordPipeline pipeline = SingleSchemaRecordPipeline.withSchema(USER_SCHEMA);
    BatchResult result = new BatchOrchestrator().run(
        Collections.singletonList(RawRecord.of(hex(encodeDatum(USER_SCHEMA, moiraine())))), pipeline);
    assertEquals(Collections.singletonList(MOIRAINE_JSON), result.getResults());
  }

  @Test
  public void testInvalidParallelism() {
    assertThrows(IllegalArgumentException.class, () -> new BatchOrchestrator(0));
  }
}
