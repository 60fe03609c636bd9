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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch: either one JSON text per input record, or the error that stopped the batch.
 */
public class BatchResult {

  private final boolean success;
  private final List<String> results;
  private final String errorMessage;

  private BatchResult(boolean success, List<String> results, String errorMessage) {
    this.success = success;
    this.results = results;
    this.errorMessage = errorMessage;
  }

  public static BatchResult success(List<String> results) {
    return new BatchResult(true, Collections.unmodifiableList(results), null);
  }

  public static BatchResult failure(String errorMessage) {
    return new BatchResult(false, Collections.emptyList(), errorMessage);
  }

  public boolean isSuccess() {
    return success;
  }

  public int getCount() {
    return results.size();
  }

  public List<String> getResults() {
    return results;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  @Override
  public String toString() {
    return success ? "BatchResult{success, count=" + results.size() + "}" : "BatchResult{failure, " + errorMessage + "}";
  }
}
