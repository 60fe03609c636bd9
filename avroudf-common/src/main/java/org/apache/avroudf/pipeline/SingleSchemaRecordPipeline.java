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

import org.apache.avroudf.avro.AvroDatumDecoder;
import org.apache.avroudf.batch.RawRecord;
import org.apache.avroudf.common.util.StringUtils;
import org.apache.avroudf.common.util.ValidationUtils;
import org.apache.avroudf.exception.AvroUdfException;
import org.apache.avroudf.io.ByteCursor;
import org.apache.avroudf.schema.SchemaRegistryClient;

import org.apache.avro.Schema;

import java.util.Collections;
import java.util.List;

/**
 * Decodes each payload as one bare Avro datum.
 * <p>
 * The schema is either fixed at construction or resolved per record from its routing key,
 * e.g. the name of the stream the record was read from.
 */
public class SingleSchemaRecordPipeline implements RecordPipeline {

  private final Schema staticSchema;
  private final SchemaRegistryClient registryClient;
  private final AvroDatumDecoder datumDecoder;

  private SingleSchemaRecordPipeline(Schema staticSchema, SchemaRegistryClient registryClient, AvroDatumDecoder datumDecoder) {
    this.staticSchema = staticSchema;
    this.registryClient = registryClient;
    this.datumDecoder = datumDecoder;
  }

  public static SingleSchemaRecordPipeline withSchema(Schema schema) {
    ValidationUtils.checkArgument(schema != null, "Schema must not be null");
    return new SingleSchemaRecordPipeline(schema, null, new AvroDatumDecoder());
  }

  public static SingleSchemaRecordPipeline withRoutingKeyLookup(SchemaRegistryClient registryClient) {
    ValidationUtils.checkArgument(registryClient != null, "Schema registry client must not be null");
    return new SingleSchemaRecordPipeline(null, registryClient, new AvroDatumDecoder());
  }

  @Override
  public List<Object> process(RawRecord record, byte[] payload) {
    Schema schema = staticSchema != null ? staticSchema : schemaOf(record);
    return Collections.singletonList(datumDecoder.decode(schema, ByteCursor.wrap(payload)));
  }

  private Schema schemaOf(RawRecord record) {
    if (StringUtils.isNullOrEmpty(record.getRoutingKey())) {
      throw new AvroUdfException("Record has no routing key to resolve its schema from");
    }
    return registryClient.resolve(record.getRoutingKey());
  }

  @Override
  public PipelineMode getMode() {
    return PipelineMode.SINGLE_SCHEMA;
  }

  @Override
  public boolean producesSingleDatum() {
    return true;
  }
}
