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

import org.apache.avroudf.batch.RawRecord;

import java.util.List;

/**
 * Turns the payload of one input record into the Avro values it carries.
 */
public interface RecordPipeline {

  /**
   * Decodes one record.
   *
   * @param record  the input record, for its routing key
   * @param payload the record's bytes
   * @return the decoded values in payload order
   * @throws org.apache.avroudf.exception.AvroUdfException if any layer of the payload cannot be decoded
   */
  List<Object> process(RawRecord record, byte[] payload);

  PipelineMode getMode();

  /**
   * Whether every record yields exactly one value, reported on its own rather than as a list.
   */
  default boolean producesSingleDatum() {
    return false;
  }
}
