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

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.Descriptors;

/**
 * Protobuf descriptors of the Kinesis Producer Library aggregated record format:
 *
 * <pre>
 *   message AggregatedRecord {
 *     repeated string partition_key_table     = 1;
 *     repeated string explicit_hash_key_table = 2;
 *     repeated Record records                 = 3;
 *   }
 *   message Tag {
 *     required string key   = 1;
 *     optional string value = 2;
 *   }
 *   message Record {
 *     required uint64 partition_key_index     = 1;
 *     optional uint64 explicit_hash_key_index = 2;
 *     required bytes  data                    = 3;
 *     repeated Tag    tags                    = 4;
 *   }
 * </pre>
 *
 * The descriptors are built at class-load time so no generated message classes are needed.
 */
public final class AggregatedRecordSchema {

  /**
   * Magic prefix of an aggregated record.
   */
  public static final byte[] MAGIC = new byte[] {(byte) 0xF3, (byte) 0x89, (byte) 0x9A, (byte) 0xC2};

  /**
   * Length of the MD5 digest of the protobuf message appended after it.
   */
  public static final int DIGEST_LENGTH = 16;

  public static final Descriptors.Descriptor AGGREGATED_RECORD;
  public static final Descriptors.Descriptor RECORD;

  public static final Descriptors.FieldDescriptor PARTITION_KEY_TABLE;
  public static final Descriptors.FieldDescriptor RECORDS;
  public static final Descriptors.FieldDescriptor PARTITION_KEY_INDEX;
  public static final Descriptors.FieldDescriptor DATA;

  static {
    FileDescriptorProto file = FileDescriptorProto.newBuilder()
        .setName("kpl_aggregated_record.proto")
        .setSyntax("proto2")
        .addMessageType(DescriptorProto.newBuilder()
            .setName("AggregatedRecord")
            .addField(field("partition_key_table", 1, FieldDescriptorProto.Label.LABEL_REPEATED, FieldDescriptorProto.Type.TYPE_STRING))
            .addField(field("explicit_hash_key_table", 2, FieldDescriptorProto.Label.LABEL_REPEATED, FieldDescriptorProto.Type.TYPE_STRING))
            .addField(field("records", 3, FieldDescriptorProto.Label.LABEL_REPEATED, FieldDescriptorProto.Type.TYPE_MESSAGE)
                .setTypeName(".Record")))
        .addMessageType(DescriptorProto.newBuilder()
            .setName("Tag")
            .addField(field("key", 1, FieldDescriptorProto.Label.LABEL_REQUIRED, FieldDescriptorProto.Type.TYPE_STRING))
            .addField(field("value", 2, FieldDescriptorProto.Label.LABEL_OPTIONAL, FieldDescriptorProto.Type.TYPE_STRING)))
        .addMessageType(DescriptorProto.newBuilder()
            .setName("Record")
            .addField(field("partition_key_index", 1, FieldDescriptorProto.Label.LABEL_REQUIRED, FieldDescriptorProto.Type.TYPE_UINT64))
            .addField(field("explicit_hash_key_index", 2, FieldDescriptorProto.Label.LABEL_OPTIONAL, FieldDescriptorProto.Type.TYPE_UINT64))
            .addField(field("data", 3, FieldDescriptorProto.Label.LABEL_REQUIRED, FieldDescriptorProto.Type.TYPE_BYTES))
            .addField(field("tags", 4, FieldDescriptorProto.Label.LABEL_REPEATED, FieldDescriptorProto.Type.TYPE_MESSAGE)
                .setTypeName(".Tag")))
        .build();
    try {
      Descriptors.FileDescriptor fileDescriptor = Descriptors.FileDescriptor.buildFrom(file, new Descriptors.FileDescriptor[0]);
      AGGREGATED_RECORD = fileDescriptor.findMessageTypeByName("AggregatedRecord");
      RECORD = fileDescriptor.findMessageTypeByName("Record");
    } catch (Descriptors.DescriptorValidationException e) {
      throw new AvroUdfException("Invalid aggregated record descriptor", e);
    }
    PARTITION_KEY_TABLE = AGGREGATED_RECORD.findFieldByName("partition_key_table");
    RECORDS = AGGREGATED_RECORD.findFieldByName("records");
    PARTITION_KEY_INDEX = RECORD.findFieldByName("partition_key_index");
    DATA = RECORD.findFieldByName("data");
  }

  private AggregatedRecordSchema() {
  }

  private static FieldDescriptorProto.Builder field(String name, int number,
                                                    FieldDescriptorProto.Label label, FieldDescriptorProto.Type type) {
    return FieldDescriptorProto.newBuilder()
        .setName(name)
        .setNumber(number)
        .setLabel(label)
        .setType(type);
  }
}
