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

import org.apache.avroudf.batch.BatchOrchestrator;
import org.apache.avroudf.batch.BatchResult;
import org.apache.avroudf.batch.RawRecord;
import org.apache.avroudf.batch.UdfRequest;
import org.apache.avroudf.batch.UdfResponse;
import org.apache.avroudf.common.config.TypedProperties;
import org.apache.avroudf.common.util.JsonUtils;
import org.apache.avroudf.config.PipelineConfig;
import org.apache.avroudf.pipeline.RecordPipeline;
import org.apache.avroudf.pipeline.RecordPipelineFactory;
import org.apache.avroudf.schema.SchemaCache;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of a warehouse Lambda UDF: turns one invocation event into one reply.
 * <p>
 * The pipeline is built once from configuration and reused for every event handled by the instance,
 * so schemas resolved for one event stay cached for the next.
 */
public class UdfEventHandler {

  private static final Logger LOG = LoggerFactory.getLogger(UdfEventHandler.class);

  private final RecordPipeline pipeline;
  private final BatchOrchestrator orchestrator;

  public UdfEventHandler(TypedProperties props) {
    this(props, SchemaCache.shared());
  }

  public UdfEventHandler(TypedProperties props, SchemaCache cache) {
    PipelineConfig pipelineConfig = PipelineConfig.newBuilder().fromProperties(props).build();
    this.pipeline = RecordPipelineFactory.createPipeline(pipelineConfig,
        UtilHelpers.createRegistryClient(pipelineConfig, props, cache));
    this.orchestrator = new BatchOrchestrator(pipelineConfig.getBatchParallelism());
  }

  public UdfEventHandler(RecordPipeline pipeline, BatchOrchestrator orchestrator) {
    this.pipeline = pipeline;
    this.orchestrator = orchestrator;
  }

  /**
   * Handles an event given as JSON text and returns the reply as JSON text.
   */
  public String handle(String eventJson) {
    UdfRequest request;
    try {
      request = JsonUtils.getObjectMapper().readValue(eventJson, UdfRequest.class);
    } catch (JsonProcessingException e) {
      LOG.warn("Unreadable UDF event", e);
      return JsonUtils.toJsonString(UdfResponse.failure("Error reading UDF event. Error: " + e.getOriginalMessage()));
    }
    if (request == null) {
      LOG.warn("UDF event is JSON null");
      return JsonUtils.toJsonString(UdfResponse.failure("Error reading UDF event. Error: event is null"));
    }
    return JsonUtils.toJsonString(handle(request));
  }

  public UdfResponse handle(UdfRequest request) {
    List<RawRecord> records = request.toRawRecords();
    if (request.getNumRecords() != null && !Objects.equals(request.getNumRecords(), records.size())) {
      LOG.warn("Event announces {} records but carries {}", request.getNumRecords(), records.size());
    }
    BatchResult result = orchestrator.run(records, pipeline);
    return UdfResponse.of(result, request.getNumRecords());
  }

  public RecordPipeline getPipeline() {
    return pipeline;
  }
}
