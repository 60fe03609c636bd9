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

import java.util.Arrays;
import java.util.Locale;

/**
 * Layout of the payload of each input record.
 */
public enum PipelineMode {
  /**
   * An Avro object container file carrying its own writer schema.
   */
  FILE_EMBEDDED,
  /**
   * One bare Avro datum of a statically configured schema, or of the schema named by the record's routing key.
   */
  SINGLE_SCHEMA,
  /**
   * A KPL aggregated record whose user records are each a header framed Avro datum.
   */
  AGGREGATED_MULTIPLEXED,
  /**
   * A single header framed Avro datum, already deaggregated upstream.
   */
  HEADER_FRAMED;

  public static PipelineMode fromValue(String value) {
    try {
      return PipelineMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException("Invalid pipeline mode '" + value + "', expected one of "
          + Arrays.toString(values()), e);
    }
  }
}
