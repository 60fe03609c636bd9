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

package org.apache.avroudf.aws.schema;

import org.apache.avroudf.aws.credentials.AvroUdfAWSCredentialsProviderFactory;
import org.apache.avroudf.common.config.TypedProperties;
import org.apache.avroudf.config.AvroUdfAWSConfig;
import org.apache.avroudf.exception.AvroUdfException;
import org.apache.avroudf.exception.RegistryUnavailableException;
import org.apache.avroudf.exception.SchemaDefinitionParseException;
import org.apache.avroudf.exception.SchemaNotFoundException;
import org.apache.avroudf.schema.SchemaCoordinates;
import org.apache.avroudf.schema.SchemaFetcher;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.glue.GlueClient;
import software.amazon.awssdk.services.glue.GlueClientBuilder;
import software.amazon.awssdk.services.glue.model.DataFormat;
import software.amazon.awssdk.services.glue.model.EntityNotFoundException;
import software.amazon.awssdk.services.glue.model.GetSchemaVersionRequest;
import software.amazon.awssdk.services.glue.model.GetSchemaVersionResponse;
import software.amazon.awssdk.services.glue.model.SchemaId;
import software.amazon.awssdk.services.glue.model.SchemaVersionNumber;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Fetches schemas from the AWS Glue Schema Registry.
 * <p>
 * A schema version id is looked up directly. Otherwise the subject is taken as the schema name in
 * the configured registry, at its latest or at a numbered version.
 */
@Slf4j
public class GlueSchemaFetcher implements SchemaFetcher {

  private final GlueClient glueClient;
  private final String registryName;

  public GlueSchemaFetcher(TypedProperties props) {
    this(props, buildClient(AvroUdfAWSConfig.newBuilder().fromProperties(props).build()));
  }

  public GlueSchemaFetcher(TypedProperties props, GlueClient glueClient) {
    this.glueClient = glueClient;
    this.registryName = AvroUdfAWSConfig.newBuilder().fromProperties(props).build().getGlueRegistryName();
  }

  private static GlueClient buildClient(AvroUdfAWSConfig config) {
    try {
      GlueClientBuilder awsGlueBuilder = GlueClient.builder()
          .credentialsProvider(AvroUdfAWSCredentialsProviderFactory.getAwsCredentialsProvider(config.getProps()));
      awsGlueBuilder = config.getGlueEndpoint() == null ? awsGlueBuilder :
          awsGlueBuilder.endpointOverride(new URI(config.getGlueEndpoint()));
      awsGlueBuilder = config.getGlueRegion() == null ? awsGlueBuilder :
          awsGlueBuilder.region(Region.of(config.getGlueRegion()));
      return awsGlueBuilder.build();
    } catch (URISyntaxException e) {
      throw new AvroUdfException("Invalid " + AvroUdfAWSConfig.AWS_GLUE_ENDPOINT.key() + ": " + config.getGlueEndpoint(), e);
    }
  }

  @Override
  public String fetchSchemaDefinition(SchemaCoordinates coordinates) {
    GetSchemaVersionRequest request = toRequest(coordinates);
    GetSchemaVersionResponse response;
    try {
      response = glueClient.getSchemaVersion(request);
    } catch (EntityNotFoundException e) {
      throw new SchemaNotFoundException("Schema " + coordinates + " not found in Glue registry " + registryName, e);
    } catch (SdkException e) {
      throw new RegistryUnavailableException("Error fetching schema " + coordinates + " from Glue", e);
    }
    if (response.dataFormat() != DataFormat.AVRO) {
      throw new SchemaDefinitionParseException("Schema " + coordinates + " has data format "
          + response.dataFormatAsString() + ", expected AVRO");
    }
    log.debug("Fetched Glue schema version {} (version {}) for {}",
        response.schemaVersionId(), response.versionNumber(), coordinates);
    return response.schemaDefinition();
  }

  GetSchemaVersionRequest toRequest(SchemaCoordinates coordinates) {
    if (coordinates.hasSchemaVersionId()) {
      return GetSchemaVersionRequest.builder()
          .schemaVersionId(coordinates.getSchemaVersionId())
          .build();
    }
    SchemaVersionNumber versionNumber = coordinates.isLatest()
        ? SchemaVersionNumber.builder().latestVersion(true).build()
        : SchemaVersionNumber.builder().versionNumber(coordinates.getVersion().longValue()).build();
    return GetSchemaVersionRequest.builder()
        .schemaId(SchemaId.builder().registryName(registryName).schemaName(coordinates.getSubject()).build())
        .schemaVersionNumber(versionNumber)
        .build();
  }
}
