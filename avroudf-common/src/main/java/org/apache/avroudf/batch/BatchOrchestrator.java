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

import org.apache.avroudf.avro.DecodedRecordSerializer;
import org.apache.avroudf.common.util.ValidationUtils;
import org.apache.avroudf.exception.AvroUdfException;
import org.apache.avroudf.exception.InvalidRecordEncodingException;
import org.apache.avroudf.pipeline.RecordPipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * Runs every record of a batch through a {@link RecordPipeline} and collects one JSON text per record.
 * <p>
 * A batch either succeeds as a whole or fails on its first broken record, in which case no partial
 * results are returned. With a parallelism above one, records are decoded concurrently but results
 * keep input order and the reported failure is the one with the lowest index.
 */
public class BatchOrchestrator {

  private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);

  private static final HexFormat HEX = HexFormat.of();
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final DecodedRecordSerializer serializer;
  private final int parallelism;

  public BatchOrchestrator() {
    this(1);
  }

  public BatchOrchestrator(int parallelism) {
    this(new DecodedRecordSerializer(), parallelism);
  }

  public BatchOrchestrator(DecodedRecordSerializer serializer, int parallelism) {
    ValidationUtils.checkArgument(parallelism >= 1, "Batch parallelism must be at least 1, got " + parallelism);
    this.serializer = serializer;
    this.parallelism = parallelism;
  }

  public BatchResult run(List<RawRecord> records, RecordPipeline pipeline) {
    BatchResult result = parallelism > 1 && records.size() > 1
        ? runParallel(records, pipeline)
        : runSequential(records, pipeline);
    if (result.isSuccess()) {
      LOG.info("Decoded batch of {} records in {} mode", result.getCount(), pipeline.getMode());
    }
    return result;
  }

  private BatchResult runSequential(List<RawRecord> records, RecordPipeline pipeline) {
    List<String> results = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      try {
        results.add(processRecord(records.get(i), pipeline));
      } catch (RuntimeException e) {
        return failure(i, e);
      }
    }
    return BatchResult.success(results);
  }

  private BatchResult runParallel(List<RawRecord> records, RecordPipeline pipeline) {
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, records.size()));
    try {
      List<Future<String>> futures = new ArrayList<>(records.size());
      for (RawRecord record : records) {
        futures.add(executor.submit(() -> processRecord(record, pipeline)));
      }
      List<String> results = new ArrayList<>(records.size());
      for (int i = 0; i < futures.size(); i++) {
        try {
          results.add(futures.get(i).get());
        } catch (ExecutionException e) {
          futures.forEach(f -> f.cancel(true));
          Throwable cause = e.getCause();
          if (cause instanceof RuntimeException) {
            return failure(i, (RuntimeException) cause);
          }
          throw new AvroUdfException("Unexpected failure decoding record " + i, cause);
        }
      }
      return BatchResult.success(results);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AvroUdfException("Interrupted while decoding batch", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private String processRecord(RawRecord record, RecordPipeline pipeline) {
    byte[] payload = decodeHex(record.getHex());
    List<Object> datums = pipeline.process(record, payload);
    if (pipeline.producesSingleDatum()) {
      ValidationUtils.checkState(datums.size() == 1, "Expected a single datum, got " + datums.size());
      return serializer.serializeValue(datums.get(0));
    }
    return serializer.serialize(datums);
  }

  /**
   * Decodes hex text, ignoring whitespace between and around the digit pairs.
   */
  static byte[] decodeHex(String hex) {
    if (hex == null) {
      throw new InvalidRecordEncodingException("Record carries no payload", null);
    }
    try {
      return HEX.parseHex(WHITESPACE.matcher(hex).replaceAll(""));
    } catch (IllegalArgumentException e) {
      throw new InvalidRecordEncodingException("Record payload is not valid hex", e);
    }
  }

  private static BatchResult failure(int index, RuntimeException e) {
    LOG.warn("Failed to decode record {} of batch", index, e);
    return BatchResult.failure("Error processing record " + index + ". Error: " + e);
  }
}
