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

package org.apache.avroudf.pipeline;

import org.apache.avroudf.aggregation.AggregatedRecordDecoder;
import org.apache.avroudf.avro.AvroDatumDecoder;
import org.apache.avroudf.batch.RawRecord;
import org.apache.avroudf.exception.MissingSchemaIdException;
import org.apache.avroudf.headers.EmbeddedHeaderParser;
import org.apache.avroudf.headers.EmbeddedHeaders;
import org.apache.avroudf.io.ByteCursor;
import org.apache.avroudf.schema.SchemaRegistryClient;

import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes header framed Avro datums whose schema id travels in an embedded header.
 * <p>
 * In {@link PipelineMode#AGGREGATED_MULTIPLEXED} mode the payload is first unpacked as a KPL
 * aggregated record and each user record is decoded on its own, possibly against a different schema.
 * In {@link PipelineMode#HEADER_FRAMED} mode the payload is a single framed datum.
 */
public class MultiplexedRecordPipeline implements RecordPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(MultiplexedRecordPipeline.class);

  private final PipelineMode mode;
  private final SchemaRegistryClient registryClient;
  private final String schemaIdHeaderKey;
  private final boolean allowUnaggregated;
  private final AggregatedRecordDecoder aggregatedRecordDecoder = new AggregatedRecordDecoder();
  private final EmbeddedHeaderParser headerParser = new EmbeddedHeaderParser();
  private final AvroDatumDecoder datumDecoder = new AvroDatumDecoder();

  public MultiplexedRecordPipeline(PipelineMode mode, SchemaRegistryClient registryClient,
                                   String schemaIdHeaderKey, boolean allowUnaggregated) {
    if (mode != PipelineMode.AGGREGATED_MULTIPLEXED && mode != PipelineMode.HEADER_FRAMED) {
      throw new IllegalArgumentException("Unsupported mode for a multiplexed pipeline: " + mode);
    }
    this.mode = mode;
    this.registryClient = registryClient;
    this.schemaIdHeaderKey = schemaIdHeaderKey;
    this.allowUnaggregated = allowUnaggregated;
  }

  @Override
  public List<Object> process(RawRecord record, byte[] payload) {
    List<byte[]> subRecords = subRecordsOf(payload);
    List<Object> datums = new ArrayList<>(subRecords.size());
    for (byte[] subRecord : subRecords) {
      datums.add(decodeFramed(subRecord));
    }
    return datums;
  }

  private List<byte[]> subRecordsOf(byte[] payload) {
    if (mode == PipelineMode.HEADER_FRAMED) {
      return Collections.singletonList(payload);
    }
    if (allowUnaggregated && !AggregatedRecordDecoder.isAggregated(payload)) {
      LOG.debug("Payload of {} bytes is not aggregated, decoding it as a single framed datum", payload.length);
      return Collections.singletonList(payload);
    }
    return aggregatedRecordDecoder.deaggregate(payload);
  }

  private Object decodeFramed(byte[] subRecord) {
    ByteCursor cursor = ByteCursor.wrap(subRecord);
    EmbeddedHeaders headers = headerParser.parseHeaders(cursor);
    String schemaId = schemaIdOf(headers);
    Schema schema = registryClient.resolve(schemaId);
    Object datum = datumDecoder.decode(schema, cursor);
    if (cursor.hasRemaining()) {
      LOG.debug("Ignoring {} bytes after datum of schema {}", cursor.remaining(), schemaId);
    }
    return datum;
  }

  private String schemaIdOf(EmbeddedHeaders headers) {
    if (!headers.isPresent() || !headers.containsKey(schemaIdHeaderKey)) {
      throw new MissingSchemaIdException(schemaIdHeaderKey);
    }
    Object value = headers.get(schemaIdHeaderKey);
    if (value instanceof String || value instanceof Number || value instanceof Boolean) {
      return String.valueOf(value);
    }
    throw new MissingSchemaIdException(schemaIdHeaderKey, value);
  }

  @Override
  public PipelineMode getMode() {
    return mode;
  }

  public String getSchemaIdHeaderKey() {
    return schemaIdHeaderKey;
  }
}
