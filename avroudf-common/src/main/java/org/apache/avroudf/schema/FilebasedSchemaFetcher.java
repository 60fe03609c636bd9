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

import org.apache.avroudf.common.config.TypedProperties;
import org.apache.avroudf.common.util.StringUtils;
import org.apache.avroudf.config.SchemaRegistryConfig;
import org.apache.avroudf.exception.RegistryUnavailableException;
import org.apache.avroudf.exception.SchemaNotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads schemas from {@code .avsc} files in a local directory.
 * <p>
 * A subject at its latest version is read from {@code {dir}/{subject}.avsc}, a numbered version from
 * {@code {dir}/{subject}.v{version}.avsc} and a schema version id from {@code {dir}/{id}.avsc}.
 */
public class FilebasedSchemaFetcher implements SchemaFetcher {

  private final Path schemaDir;

  public FilebasedSchemaFetcher(TypedProperties props) {
    SchemaRegistryConfig config = SchemaRegistryConfig.newBuilder().fromProperties(props).build();
    String dir = config.getSchemaFileDir();
    if (StringUtils.isNullOrEmpty(dir)) {
      throw new IllegalArgumentException("Missing required property " + SchemaRegistryConfig.SCHEMA_FILE_DIR.key());
    }
    this.schemaDir = Paths.get(dir);
  }

  @Override
  public String fetchSchemaDefinition(SchemaCoordinates coordinates) {
    Path schemaFile = schemaDir.resolve(fileName(coordinates)).normalize();
    if (!schemaFile.startsWith(schemaDir.normalize()) || !Files.isRegularFile(schemaFile)) {
      throw new SchemaNotFoundException("No schema file " + schemaFile + " for " + coordinates);
    }
    try {
      return new String(Files.readAllBytes(schemaFile), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RegistryUnavailableException("Error reading schema file " + schemaFile, e);
    }
  }

  private static String fileName(SchemaCoordinates coordinates) {
    if (coordinates.hasSchemaVersionId()) {
      return coordinates.getSchemaVersionId() + ".avsc";
    }
    if (coordinates.isLatest()) {
      return coordinates.getSubject() + ".avsc";
    }
    return coordinates.getSubject() + ".v" + coordinates.getVersion() + ".avsc";
  }
}
