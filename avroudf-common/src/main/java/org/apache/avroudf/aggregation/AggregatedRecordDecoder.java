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

import org.apache.avroudf.exception.EnvelopeDecodeException;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.DynamicMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.apache.avroudf.aggregation.AggregatedRecordSchema.DIGEST_LENGTH;
import static org.apache.avroudf.aggregation.AggregatedRecordSchema.MAGIC;

/**
 * Unpacks a KPL aggregated record into the payloads of the user records it carries.
 * <p>
 * The wire layout is {@code MAGIC | AggregatedRecord protobuf | MD5(protobuf)}. Each returned
 * payload is a copy of the corresponding {@code Record.data} bytes, in envelope order.
 */
public class AggregatedRecordDecoder {

  private static final Logger LOG = LoggerFactory.getLogger(AggregatedRecordDecoder.class);

  /**
   * Whether the payload is framed as an aggregated record: magic prefix plus room for the digest.
   * The digest itself is only verified by {@link #deaggregate(byte[])}.
   */
  public static boolean isAggregated(byte[] payload) {
    if (payload.length < MAGIC.length + DIGEST_LENGTH) {
      return false;
    }
    for (int i = 0; i < MAGIC.length; i++) {
      if (payload[i] != MAGIC[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Decodes an aggregated record.
   *
   * @param payload the full aggregated record, magic and digest included
   * @return the user record payloads, possibly empty
   * @throws EnvelopeDecodeException if the magic, digest or protobuf message is invalid
   */
  public List<byte[]> deaggregate(byte[] payload) {
    if (payload.length < MAGIC.length + DIGEST_LENGTH) {
      throw new EnvelopeDecodeException("Aggregated record too short: " + payload.length + " bytes");
    }
    if (!isAggregated(payload)) {
      throw new EnvelopeDecodeException("Aggregated record magic not found, got "
          + toHex(Arrays.copyOf(payload, MAGIC.length)));
    }
    int messageOffset = MAGIC.length;
    int messageLength = payload.length - MAGIC.length - DIGEST_LENGTH;
    verifyDigest(payload, messageOffset, messageLength);

    DynamicMessage aggregated = parse(payload, messageOffset, messageLength);
    int count = aggregated.getRepeatedFieldCount(AggregatedRecordSchema.RECORDS);
    int partitionKeys = aggregated.getRepeatedFieldCount(AggregatedRecordSchema.PARTITION_KEY_TABLE);
    List<byte[]> records = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      DynamicMessage record = (DynamicMessage) aggregated.getRepeatedField(AggregatedRecordSchema.RECORDS, i);
      long keyIndex = (Long) record.getField(AggregatedRecordSchema.PARTITION_KEY_INDEX);
      if (keyIndex < 0 || keyIndex >= partitionKeys) {
        throw new EnvelopeDecodeException("Record " + i + " refers to partition key " + keyIndex
            + " but the table holds " + partitionKeys);
      }
      records.add(((ByteString) record.getField(AggregatedRecordSchema.DATA)).toByteArray());
    }
    LOG.debug("Deaggregated {} records from a {} byte envelope", count, payload.length);
    return records;
  }

  private static void verifyDigest(byte[] payload, int offset, int length) {
    MessageDigest md5 = AggregatedRecordEncoder.newMd5();
    md5.update(payload, offset, length);
    byte[] expected = md5.digest();
    byte[] actual = Arrays.copyOfRange(payload, offset + length, offset + length + DIGEST_LENGTH);
    if (!MessageDigest.isEqual(expected, actual)) {
      throw new EnvelopeDecodeException("Aggregated record digest mismatch, expected " + toHex(expected)
          + " but found " + toHex(actual));
    }
  }

  private static DynamicMessage parse(byte[] payload, int offset, int length) {
    try {
      CodedInputStream input = CodedInputStream.newInstance(payload, offset, length);
      return DynamicMessage.parseFrom(AggregatedRecordSchema.AGGREGATED_RECORD, input);
    } catch (IOException e) {
      throw new EnvelopeDecodeException("Unable to parse aggregated record", e);
    }
  }

  private static String toHex(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      sb.append(String.format("%02x", b));
    }
    return sb.toString();
  }
}
