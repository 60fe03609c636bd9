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

/**
 * Fetches the text of a schema definition from wherever schemas are kept.
 * <p>
 * Implementations are created reflectively and must expose a public constructor taking a single
 * {@link org.apache.avroudf.common.config.TypedProperties} argument.
 */
public interface SchemaFetcher {

  /**
   * Returns the schema definition text (Avro schema JSON) at the given coordinates.
   *
   * @throws org.apache.avroudf.exception.SchemaNotFoundException if no such schema exists
   * @throws org.apache.avroudf.exception.SchemaDefinitionParseException if the registry reply cannot be read
   * @throws org.apache.avroudf.exception.RegistryUnavailableException on any other transport failure
   */
  String fetchSchemaDefinition(SchemaCoordinates coordinates);
}
