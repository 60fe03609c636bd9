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

package org.apache.avroudf.config;

import org.apache.avroudf.common.config.AvroUdfConfig;
import org.apache.avroudf.common.config.ConfigProperty;

import java.util.Properties;

/**
 * Configurations used to reach AWS, for the AWS Glue Schema Registry.
 */
public class AvroUdfAWSConfig extends AvroUdfConfig {

  public static final ConfigProperty<String> AWS_ACCESS_KEY = ConfigProperty
      .key("avroudf.aws.access.key")
      .noDefaultValue()
      .withDocumentation("AWS access key id");

  public static final ConfigProperty<String> AWS_SECRET_KEY = ConfigProperty
      .key("avroudf.aws.secret.key")
      .noDefaultValue()
      .withDocumentation("AWS secret key");

  public static final ConfigProperty<String> AWS_SESSION_TOKEN = ConfigProperty
      .key("avroudf.aws.session.token")
      .noDefaultValue()
      .withDocumentation("AWS session token");

  public static final ConfigProperty<String> AWS_GLUE_ENDPOINT = ConfigProperty
      .key("avroudf.aws.glue.endpoint")
      .noDefaultValue()
      .withDocumentation("Aws glue endpoint");

  public static final ConfigProperty<String> AWS_GLUE_REGION = ConfigProperty
      .key("avroudf.aws.glue.region")
      .noDefaultValue()
      .withDocumentation("Aws glue region");

  public static final ConfigProperty<String> AWS_GLUE_REGISTRY_NAME = ConfigProperty
      .key("avroudf.aws.glue.registry.name")
      .defaultValue("default-registry")
      .withDocumentation("Name of the AWS Glue Schema Registry holding the schemas looked up by subject name.");

  private AvroUdfAWSConfig() {
    super();
  }

  public static AvroUdfAWSConfig.Builder newBuilder() {
    return new AvroUdfAWSConfig.Builder();
  }

  public String getGlueEndpoint() {
    return getString(AWS_GLUE_ENDPOINT);
  }

  public String getGlueRegion() {
    return getString(AWS_GLUE_REGION);
  }

  public String getGlueRegistryName() {
    return getString(AWS_GLUE_REGISTRY_NAME);
  }

  public static class Builder {

    private final AvroUdfAWSConfig awsConfig = new AvroUdfAWSConfig();

    public Builder fromProperties(Properties props) {
      this.awsConfig.setAll(props);
      return this;
    }

    public Builder withAccessKey(String accessKey) {
      awsConfig.setValue(AWS_ACCESS_KEY, accessKey);
      return this;
    }

    public Builder withSecretKey(String secretKey) {
      awsConfig.setValue(AWS_SECRET_KEY, secretKey);
      return this;
    }

    public Builder withGlueRegion(String region) {
      awsConfig.setValue(AWS_GLUE_REGION, region);
      return this;
    }

    public Builder withGlueRegistryName(String registryName) {
      awsConfig.setValue(AWS_GLUE_REGISTRY_NAME, registryName);
      return this;
    }

    public AvroUdfAWSConfig build() {
      awsConfig.setDefaults(AvroUdfAWSConfig.class.getName());
      return awsConfig;
    }
  }
}
