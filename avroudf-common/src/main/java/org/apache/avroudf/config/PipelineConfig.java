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

package org.apache.avroudf.config;

import org.apache.avroudf.common.config.AvroUdfConfig;
import org.apache.avroudf.common.config.ConfigProperty;
import org.apache.avroudf.pipeline.PipelineMode;

import java.util.Properties;

/**
 * Configurations of the record decode pipeline and the batch run around it.
 */
public class PipelineConfig extends AvroUdfConfig {

  public static final ConfigProperty<String> PIPELINE_MODE = ConfigProperty
      .key("avroudf.pipeline.mode")
      .defaultValue(PipelineMode.AGGREGATED_MULTIPLEXED.name())
      .withDocumentation("How each input record is laid out: FILE_EMBEDDED (Avro container file with its own schema), "
          + "SINGLE_SCHEMA (one Avro datum of a static or routing-key resolved schema), AGGREGATED_MULTIPLEXED "
          + "(KPL aggregated record of header framed datums) or HEADER_FRAMED (one header framed datum).");

  public static final ConfigProperty<String> SCHEMA_ID_HEADER_KEY = ConfigProperty
      .key("avroudf.pipeline.schema.id.header.key")
      .defaultValue("contentType")
      .withDocumentation("Embedded header holding the schema id of a header framed datum. Spring Cloud Stream "
          + "producers write 'contentType'; some producers use 'schema_id'.");

  public static final ConfigProperty<String> SINGLE_SCHEMA_FILE = ConfigProperty
      .key("avroudf.pipeline.single.schema.file")
      .noDefaultValue()
      .withDocumentation("Avro schema file used for every record in SINGLE_SCHEMA mode. When unset the schema is "
          + "resolved through the registry using the record's routing key.");

  public static final ConfigProperty<Boolean> ALLOW_UNAGGREGATED = ConfigProperty
      .key("avroudf.pipeline.aggregation.allow.unaggregated")
      .defaultValue(false)
      .withDocumentation("In AGGREGATED_MULTIPLEXED mode, treat a payload without the KPL magic prefix as a single "
          + "header framed datum instead of failing the batch.");

  public static final ConfigProperty<Integer> BATCH_PARALLELISM = ConfigProperty
      .key("avroudf.batch.parallelism")
      .defaultValue(1)
      .withDocumentation("Number of threads decoding the records of one batch. Output order and the reported "
          + "failure (lowest failing index) do not depend on it.");

  private PipelineConfig() {
    super();
  }

  public static PipelineConfig.Builder newBuilder() {
    return new PipelineConfig.Builder();
  }

  public PipelineMode getPipelineMode() {
    return PipelineMode.fromValue(getString(PIPELINE_MODE));
  }

  public String getSchemaIdHeaderKey() {
    return getString(SCHEMA_ID_HEADER_KEY);
  }

  public String getSingleSchemaFile() {
    return getString(SINGLE_SCHEMA_FILE);
  }

  public boolean allowUnaggregated() {
    return getBoolean(ALLOW_UNAGGREGATED);
  }

  public int getBatchParallelism() {
    return getInt(BATCH_PARALLELISM);
  }

  public static class Builder {

    private final PipelineConfig pipelineConfig = new PipelineConfig();

    public Builder fromProperties(Properties props) {
      this.pipelineConfig.setAll(props);
      return this;
    }

    public Builder withPipelineMode(PipelineMode mode) {
      pipelineConfig.setValue(PIPELINE_MODE, mode.name());
      return this;
    }

    public Builder withSchemaIdHeaderKey(String headerKey) {
      pipelineConfig.setValue(SCHEMA_ID_HEADER_KEY, headerKey);
      return this;
    }

    public Builder withSingleSchemaFile(String schemaFile) {
      pipelineConfig.setValue(SINGLE_SCHEMA_FILE, schemaFile);
      return this;
    }

    public Builder withAllowUnaggregated(boolean allowUnaggregated) {
      pipelineConfig.setValue(ALLOW_UNAGGREGATED, String.valueOf(allowUnaggregated));
      return this;
    }

    public Builder withBatchParallelism(int parallelism) {
      pipelineConfig.setValue(BATCH_PARALLELISM, String.valueOf(parallelism));
      return this;
    }

    public PipelineConfig build() {
      pipelineConfig.setDefaults(PipelineConfig.class.getName());
      return pipelineConfig;
    }
  }
}
