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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Reply to a warehouse Lambda UDF invocation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "num_records", "results", "error_msg"})
public class UdfResponse {

  @JsonProperty("success")
  private final boolean success;

  @JsonProperty("num_records")
  private final Integer numRecords;

  @JsonProperty("results")
  private final List<String> results;

  @JsonProperty("error_msg")
  private final String errorMessage;

  private UdfResponse(boolean success, Integer numRecords, List<String> results, String errorMessage) {
    this.success = success;
    this.numRecords = numRecords;
    this.results = results;
    this.errorMessage = errorMessage;
  }

  /**
   * @param result     outcome of the batch
   * @param numRecords record count announced by the request, echoed back; the result count when absent
   */
  public static UdfResponse of(BatchResult result, Integer numRecords) {
    if (!result.isSuccess()) {
      return failure(result.getErrorMessage());
    }
    return new UdfResponse(true, numRecords == null ? result.getCount() : numRecords, result.getResults(), null);
  }

  public static UdfResponse failure(String errorMessage) {
    return new UdfResponse(false, null, null, errorMessage);
  }

  public boolean isSuccess() {
    return success;
  }

  public Integer getNumRecords() {
    return numRecords;
  }

  public List<String> getResults() {
    return results;
  }

  public String getErrorMessage() {
    return errorMessage;
  }
}
