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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Invocation event of a warehouse Lambda UDF.
 * <p>
 * Each argument row holds the hex payload and, optionally, a routing key:
 * {@code {"arguments": [["ff02...", "orders-stream"]], "num_records": 1}}. Other fields of the event
 * (user, cluster, query id ...) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UdfRequest {

  @JsonProperty("arguments")
  private List<List<String>> arguments;

  @JsonProperty("num_records")
  private Integer numRecords;

  public UdfRequest() {
  }

  public UdfRequest(List<List<String>> arguments, Integer numRecords) {
    this.arguments = arguments;
    this.numRecords = numRecords;
  }

  public List<List<String>> getArguments() {
    return arguments == null ? Collections.emptyList() : arguments;
  }

  public Integer getNumRecords() {
    return numRecords;
  }

  public List<RawRecord> toRawRecords() {
    List<RawRecord> records = new ArrayList<>(getArguments().size());
    for (List<String> row : getArguments()) {
      if (row == null || row.isEmpty()) {
        records.add(RawRecord.of(null));
      } else {
        records.add(RawRecord.of(row.get(0), row.size() > 1 ? row.get(1) : null));
      }
    }
    return records;
  }
}
