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

import org.apache.avroudf.common.util.StringUtils;
import org.apache.avroudf.config.PipelineConfig;
import org.apache.avroudf.exception.AvroUdfException;
import org.apache.avroudf.schema.SchemaRegistryClient;

import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Builds the {@link RecordPipeline} selected by {@link PipelineConfig#PIPELINE_MODE}.
 */
public class RecordPipelineFactory {

  private static final Logger LOG = LoggerFactory.getLogger(RecordPipelineFactory.class);

  /**
   * @param config         pipeline configuration
   * @param registryClient schema lookups, may be null when the mode never consults a registry
   */
  public static RecordPipeline createPipeline(PipelineConfig config, SchemaRegistryClient registryClient) {
    PipelineMode mode = config.getPipelineMode();
    LOG.info("Creating {} record pipeline", mode);
    switch (mode) {
      case FILE_EMBEDDED:
        return new FileEmbeddedRecordPipeline();
      case SINGLE_SCHEMA:
        String schemaFile = config.getSingleSchemaFile();
        if (StringUtils.nonEmpty(schemaFile)) {
          return SingleSchemaRecordPipeline.withSchema(readSchemaFile(schemaFile));
        }
        return SingleSchemaRecordPipeline.withRoutingKeyLookup(requireRegistry(mode, registryClient));
      case AGGREGATED_MULTIPLEXED:
      case HEADER_FRAMED:
        return new MultiplexedRecordPipeline(mode, requireRegistry(mode, registryClient),
            config.getSchemaIdHeaderKey(), config.allowUnaggregated());
      default:
        throw new AvroUdfException("Unsupported pipeline mode " + mode);
    }
  }

  /**
   * Whether pipelines of the given configuration look schemas up in a registry.
   */
  public static boolean needsRegistry(PipelineConfig config) {
    PipelineMode mode = config.getPipelineMode();
    if (mode == PipelineMode.FILE_EMBEDDED) {
      return false;
    }
    return mode != PipelineMode.SINGLE_SCHEMA || StringUtils.isNullOrEmpty(config.getSingleSchemaFile());
  }

  private static SchemaRegistryClient requireRegistry(PipelineMode mode, SchemaRegistryClient registryClient) {
    if (registryClient == null) {
      throw new AvroUdfException("Pipeline mode " + mode + " needs a schema registry client");
    }
    return registryClient;
  }

  private static Schema readSchemaFile(String schemaFile) {
    try {
      return new Schema.Parser().parse(new File(schemaFile));
    } catch (IOException | AvroRuntimeException e) {
      throw new AvroUdfException("Unable to read schema file " + schemaFile, e);
    }
  }
}
