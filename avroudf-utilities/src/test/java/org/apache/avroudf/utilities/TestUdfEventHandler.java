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

package org.apache.avroudf.utilities;

import org.apache.avroudf.aggregation.AggregatedRecordEncoder;
import org.apache.avroudf.batch.BatchOrchestrator;
import org.apache.avroudf.batch.UdfRequest;
import org.apache.avroudf.batch.UdfResponse;
import org.apache.avroudf.common.config.TypedProperties;
import org.apache.avroudf.common.util.JsonUtils;
import org.apache.avroudf.config.PipelineConfig;
import org.apache.avroudf.config.SchemaRegistryConfig;
import org.apache.avroudf.headers.EmbeddedHeaderWriter;
import org.apache.avroudf.pipeline.PipelineMode;
import org.apache.avroudf.pipeline.RecordPipeline;
import org.apache.avroudf.schema.FilebasedSchemaFetcher;
import org.apache.avroudf.schema.SchemaCache;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;

import static org.apache.avroudf.utilities.UdfTestFixtures.MOIRAINE_JSON;
import static org.apache.avroudf.utilities.UdfTestFixtures.USER_SCHEMA_ID;
import static org.apache.avroudf.utilities.UdfTestFixtures.event;
import static org.apache.avroudf.utilities.UdfTestFixtures.framedUser;
import static org.apache.avroudf.utilities.UdfTestFixtures.hex;
import static org.apache.avroudf.utilities.UdfTestFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class TestUdfEventHandler {

  @TempDir
  Path schemaDir;

  private TypedProperties props;
  private SchemaCache cache;

  @BeforeEach
  public void setUp() throws IOException {
    UdfTestFixtures.writeUserSchema(schemaDir);
    props = new TypedProperties();
    props.setProperty(SchemaRegistryConfig.SCHEMA_FETCHER_CLASS.key(), FilebasedSchemaFetcher.class.getName());
    props.setProperty(SchemaRegistryConfig.SCHEMA_FILE_DIR.key(), schemaDir.toString());
    cache = new SchemaCache();
  }

  @Test
  public void testHeaderFramedEvent() throws IOException {
    props.setProperty(PipelineConfig.PIPELINE_MODE.key(), "HEADER_FRAMED");
    UdfEventHandler handler = new UdfEventHandler(props, cache);
    assertEquals(PipelineMode.HEADER_FRAMED, handler.getPipeline().getMode());

    String reply = handler.handle(event(hex(framedUser(user("Moiraine", 4, "Blue"))),
        hex(framedUser(user("Lan", null, null)))));

    JsonNode node = JsonUtils.getObjectMapper().readTree(reply);
    assertTrue(node.get("success").asBoolean());
    assertEquals(2, node.get("num_records").asInt());
    assertEquals("[" + MOIRAINE_JSON + "]", node.get("results").get(0).asText());
    assertEquals("[{\"name\": \"Lan\", \"favorite_number\": null, \"favorite_color\": null}]",
        node.get("results").get(1).asText());
    assertFalse(node.has("error_msg"));
    assertTrue(cache.contains(USER_SCHEMA_ID));
    assertEquals(1, cache.size());
  }

  @Test
  public void testAggregatedEvent() throws IOException {
    byte[] aggregated = new AggregatedRecordEncoder()
        .addRecord("pk-1", framedUser(user("Moiraine", 4, "Blue")))
        .addRecord("pk-2", framedUser(user("Nynaeve", 2, "Green")))
        .encode();
    UdfEventHandler handler = new UdfEventHandler(props, cache);
    assertEquals(PipelineMode.AGGREGATED_MULTIPLEXED, handler.getPipeline().getMode());

    JsonNode node = JsonUtils.getObjectMapper().readTree(handler.handle(event(hex(aggregated))));

    assertTrue(node.get("success").asBoolean());
    assertEquals("[" + MOIRAINE_JSON + ", {\"name\": \"Nynaeve\", \"favorite_number\": 2, \"favorite_color\": \"Green\"}]",
        node.get("results").get(0).asText());
  }

  @Test
  public void testTruncatedRecordFailsEvent() throws IOException {
    props.setProperty(PipelineConfig.PIPELINE_MODE.key(), "HEADER_FRAMED");
    UdfEventHandler handler = new UdfEventHandler(props, cache);

    JsonNode node = JsonUtils.getObjectMapper().readTree(handler.handle(
        event(hex(framedUser(user("Moiraine", 4, "Blue"))), "ff010a616263")));

    assertFalse(node.get("success").asBoolean());
    assertEquals("Error processing record 1. Error: org.apache.avroudf.exception.TruncatedFrameException: "
        + "Cannot read 10 bytes at offset 3, only 3 remaining", node.get("error_msg").asText());
    assertFalse(node.has("results"));
  }

  @Test
  public void testUnknownSchemaFailsEvent() throws IOException {
    props.setProperty(PipelineConfig.PIPELINE_MODE.key(), "HEADER_FRAMED");
    UdfEventHandler handler = new UdfEventHandler(props, cache);
    byte[] framed = new EmbeddedHeaderWriter().embedHeaders(
        Collections.singletonMap("contentType", "application/vnd.order.v2+avro"), new byte[] {0x02});

    JsonNode node = JsonUtils.getObjectMapper().readTree(handler.handle(event(hex(framed))));

    assertFalse(node.get("success").asBoolean());
    assertTrue(node.get("error_msg").asText().startsWith("Error processing record 0. Error: "
        + "org.apache.avroudf.exception.SchemaNotFoundException"));
    assertEquals(0, cache.size());
  }

  @Test
  public void testUnreadableEvent() throws IOException {
    RecordPipeline pipeline = mock(RecordPipeline.class);
    UdfEventHandler handler = new UdfEventHandler(pipeline, new BatchOrchestrator());

    JsonNode node = JsonUtils.getObjectMapper().readTree(handler.handle("{\"arguments\": [[\"00\""));

    assertFalse(node.get("success").asBoolean());
    assertTrue(node.get("error_msg").asText().startsWith("Error reading UDF event. Error: "));
    verify(pipeline, never()).process(any(), any());
  }

  @Test
  public void testNullEvent() throws IOException {
    RecordPipeline pipeline = mock(RecordPipeline.class);
    UdfEventHandler handler = new UdfEventHandler(pipeline, new BatchOrchestrator());

    JsonNode node = JsonUtils.getObjectMapper().readTree(handler.handle("null"));

    assertFalse(node.get("success").asBoolean());
    assertEquals("Error reading UDF event. Error: event is null", node.get("error_msg").asText());
    verify(pipeline, never()).process(any(), any());
  }

  @Test
  public void testNumRecordsIsEchoed() {
    RecordPipeline pipeline = mock(RecordPipeline.class);
    UdfEventHandler handler = new UdfEventHandler(pipeline, new BatchOrchestrator());

    UdfRequest request = new UdfRequest(Collections.emptyList(), 3);
    UdfResponse response = handler.handle(request);

    assertTrue(response.isSuccess());
    assertEquals(3, response.getNumRecords());
    assertTrue(response.getResults().isEmpty());
    assertNull(response.getErrorMessage());
  }
}
