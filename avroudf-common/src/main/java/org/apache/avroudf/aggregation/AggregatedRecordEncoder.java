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

package org.apache.avroudf.aggregation;

import org.apache.avroudf.exception.AvroUdfException;

import com.google.protobuf.ByteString;
import com.google.protobuf.DynamicMessage;

import java.io.ByteArrayOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds KPL aggregated records, the producer-side counterpart of {@link AggregatedRecordDecoder}.
 */
public class AggregatedRecordEncoder {

  private final Map<String, Long> partitionKeyTable = new LinkedHashMap<>();
  private final List<DynamicMessage> records = new ArrayList<>();

  /**
   * Adds a user record. Partition keys are stored once in the key table and referenced by index.
   */
  public AggregatedRecordEncoder addRecord(String partitionKey, byte[] data) {
    long keyIndex = partitionKeyTable.computeIfAbsent(partitionKey, k -> (long) partitionKeyTable.size());
    records.add(DynamicMessage.newBuilder(AggregatedRecordSchema.RECORD)
        .setField(AggregatedRecordSchema.PARTITION_KEY_INDEX, keyIndex)
        .setField(AggregatedRecordSchema.DATA, ByteString.copyFrom(data))
        .build());
    return this;
  }

  public int size() {
    return records.size();
  }

  /**
   * Serializes the records added so far as {@code MAGIC | protobuf | MD5(protobuf)}.
   */
  public byte[] encode() {
    DynamicMessage.Builder builder = DynamicMessage.newBuilder(AggregatedRecordSchema.AGGREGATED_RECORD);
    partitionKeyTable.keySet().forEach(key -> builder.addRepeatedField(AggregatedRecordSchema.PARTITION_KEY_TABLE, key));
    records.forEach(record -> builder.addRepeatedField(AggregatedRecordSchema.RECORDS, record));
    byte[] message = builder.build().toByteArray();

    ByteArrayOutputStream out = new ByteArrayOutputStream(
        AggregatedRecordSchema.MAGIC.length + message.length + AggregatedRecordSchema.DIGEST_LENGTH);
    out.write(AggregatedRecordSchema.MAGIC, 0, AggregatedRecordSchema.MAGIC.length);
    out.write(message, 0, message.length);
    byte[] digest = newMd5().digest(message);
    out.write(digest, 0, digest.length);
    return out.toByteArray();
  }

  static MessageDigest newMd5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      throw new AvroUdfException("MD5 is not available", e);
    }
  }
}
