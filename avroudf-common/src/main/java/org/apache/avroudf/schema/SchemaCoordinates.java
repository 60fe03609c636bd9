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

import org.apache.avroudf.common.util.StringUtils;
import org.apache.avroudf.common.util.ValidationUtils;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where a schema lives in a registry, derived from the schema id carried by a record.
 * <p>
 * Three id shapes are understood:
 * <ul>
 *   <li>Spring Cloud Stream content types, {@code application/vnd.user.v1+avro}: subject {@code user},
 *   version {@code 1}, format {@code avro}.</li>
 *   <li>A UUID, taken as an AWS Glue schema version id.</li>
 *   <li>Anything else, taken as a subject name at its latest version.</li>
 * </ul>
 */
@Getter
@ToString
@EqualsAndHashCode
public class SchemaCoordinates {

  public static final String DEFAULT_FORMAT = "avro";

  private static final Pattern CONTENT_TYPE =
      Pattern.compile("^application/[\\w\\-]+\\.([\\w$.\\-]+)\\.v(\\d+)\\+(\\w+)$");
  private static final Pattern UUID =
      Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private final String subject;
  /**
   * Null means the latest version.
   */
  private final Integer version;
  private final String format;
  /**
   * Registry assigned id of one schema version, null unless the schema id was a UUID.
   */
  private final String schemaVersionId;

  private SchemaCoordinates(String subject, Integer version, String format, String schemaVersionId) {
    this.subject = subject;
    this.version = version;
    this.format = format;
    this.schemaVersionId = schemaVersionId;
  }

  public static SchemaCoordinates of(String subject, Integer version) {
    return new SchemaCoordinates(subject, version, DEFAULT_FORMAT, null);
  }

  public static SchemaCoordinates ofVersionId(String schemaVersionId) {
    return new SchemaCoordinates(null, null, DEFAULT_FORMAT, schemaVersionId);
  }

  public static SchemaCoordinates parse(String schemaId) {
    ValidationUtils.checkArgument(!StringUtils.isNullOrEmpty(schemaId) && !schemaId.trim().isEmpty(),
        "Schema id must not be empty");
    String id = schemaId.trim();
    Matcher matcher = CONTENT_TYPE.matcher(id);
    if (matcher.matches()) {
      return new SchemaCoordinates(matcher.group(1), Integer.valueOf(matcher.group(2)), matcher.group(3), null);
    }
    if (UUID.matcher(id).matches()) {
      return ofVersionId(id);
    }
    return of(id, null);
  }

  public boolean isLatest() {
    return schemaVersionId == null && version == null;
  }

  public boolean hasSchemaVersionId() {
    return schemaVersionId != null;
  }
}
