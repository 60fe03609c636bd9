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

import org.apache.avroudf.avro.AvroFileDecoder;
import org.apache.avroudf.batch.RawRecord;
import org.apache.avroudf.io.ByteCursor;

import java.util.List;

/**
 * Reads every datum of an Avro object container file using the schema embedded in the file.
 */
public class FileEmbeddedRecordPipeline implements RecordPipeline {

  private final AvroFileDecoder fileDecoder;

  public FileEmbeddedRecordPipeline() {
    this(new AvroFileDecoder());
  }

  public FileEmbeddedRecordPipeline(AvroFileDecoder fileDecoder) {
    this.fileDecoder = fileDecoder;
  }

  @Override
  public List<Object> process(RawRecord record, byte[] payload) {
    return fileDecoder.decodeAll(ByteCursor.wrap(payload));
  }

  @Override
  public PipelineMode getMode() {
    return PipelineMode.FILE_EMBEDDED;
  }
}
