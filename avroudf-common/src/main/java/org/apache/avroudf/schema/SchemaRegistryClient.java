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

import org.apache.avroudf.exception.SchemaDefinitionParseException;

import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves schema ids to parsed Avro schemas, fetching each id at most once per cache.
 * <p>
 * Two threads missing the cache for the same id may both fetch it; nothing is locked around the
 * fetch. A failed lookup is not cached, so the next record carrying the id tries again.
 */
public class SchemaRegistryClient {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistryClient.class);

  private final SchemaFetcher fetcher;
  private final SchemaCache cache;

  public SchemaRegistryClient(SchemaFetcher fetcher) {
    this(fetcher, SchemaCache.shared());
  }

  public SchemaRegistryClient(SchemaFetcher fetcher, SchemaCache cache) {
    this.fetcher = fetcher;
    this.cache = cache;
  }

  /**
   * Returns the schema registered under the given id.
   *
   * @throws org.apache.avroudf.exception.SchemaNotFoundException if the registry does not know the id
   * @throws SchemaDefinitionParseException if the definition is not a valid Avro schema
   * @throws org.apache.avroudf.exception.RegistryUnavailableException if the registry cannot be reached
   */
  public Schema resolve(String schemaId) {
    Schema cached = cache.get(schemaId);
    if (cached != null) {
      return cached;
    }
    SchemaCoordinates coordinates = SchemaCoordinates.parse(schemaId);
    LOG.debug("Schema cache miss for {}, fetching {}", schemaId, coordinates);
    String definition = fetcher.fetchSchemaDefinition(coordinates);
    Schema schema = parseSchema(schemaId, definition);
    cache.put(schemaId, schema);
    LOG.info("Resolved schema {} to {} ({} schemas cached)", schemaId, schema.getFullName(), cache.size());
    return schema;
  }

  public SchemaCache getCache() {
    return cache;
  }

  static Schema parseSchema(String schemaId, String definition) {
    if (definition == null) {
      throw new SchemaDefinitionParseException("Registry returned no definition for schema " + schemaId);
    }
    try {
      return new Schema.Parser().parse(definition);
    } catch (AvroRuntimeException e) {
      throw new SchemaDefinitionParseException("Invalid Avro schema definition for " + schemaId, e);
    }
  }
}
