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

import java.util.Objects;

/**
 * One input record of a batch: the hex encoded payload and an optional routing key.
 */
public class RawRecord {

  private final String hex;
  private final String routingKey;

  public RawRecord(String hex, String routingKey) {
    this.hex = hex;
    this.routingKey = routingKey;
  }

  public static RawRecord of(String hex) {
    return new RawRecord(hex, null);
  }

  public static RawRecord of(String hex, String routingKey) {
    return new RawRecord(hex, routingKey);
  }

  public String getHex() {
    return hex;
  }

  /**
   * Stream or topic name the record came from, null when the caller did not pass one.
   */
  public String getRoutingKey() {
    return routingKey;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RawRecord rawRecord = (RawRecord) o;
    return Objects.equals(hex, rawRecord.hex) && Objects.equals(routingKey, rawRecord.routingKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hex, routingKey);
  }

  @Override
  public String toString() {
    return "RawRecord{hexLength=" + (hex == null ? 0 : hex.length()) + ", routingKey=" + routingKey + "}";
  }
}
