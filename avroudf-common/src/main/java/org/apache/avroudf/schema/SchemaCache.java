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

package org.apache.avroudf.schema;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.avro.Schema;

/**
 * Schemas resolved so far, keyed by the schema id they were resolved for.
 * <p>
 * The cache is unbounded and entries never expire. Concurrent writers for the same id may both
 * store a schema; the last one wins, which is harmless since both parsed the same definition.
 * One instance is normally shared by every pipeline of the process; tests inject a fresh one.
 */
public class SchemaCache {

  private static final SchemaCache SHARED = new SchemaCache();

  private final Cache<String, Schema> schemas;

  public SchemaCache() {
    this.schemas = Caffeine.newBuilder().build();
  }

  public static SchemaCache shared() {
    return SHARED;
  }

  public Schema get(String schemaId) {
    return schemas.getIfPresent(schemaId);
  }

  public void put(String schemaId, Schema schema) {
    schemas.put(schemaId, schema);
  }

  public boolean contains(String schemaId) {
    return schemas.getIfPresent(schemaId) != null;
  }

  public long size() {
    return schemas.estimatedSize();
  }
}
