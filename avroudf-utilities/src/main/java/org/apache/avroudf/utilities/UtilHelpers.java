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

package org.apache.avroudf.utilities;

import org.apache.avroudf.common.config.TypedProperties;
import org.apache.avroudf.common.util.ReflectionUtils;
import org.apache.avroudf.common.util.StringUtils;
import org.apache.avroudf.common.util.ValidationUtils;
import org.apache.avroudf.config.PipelineConfig;
import org.apache.avroudf.config.SchemaRegistryConfig;
import org.apache.avroudf.exception.AvroUdfException;
import org.apache.avroudf.pipeline.RecordPipelineFactory;
import org.apache.avroudf.schema.SchemaCache;
import org.apache.avroudf.schema.SchemaFetcher;
import org.apache.avroudf.schema.SchemaRegistryClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Bunch of helper methods for building configuration and the decode components it selects.
 */
public class UtilHelpers {

  private static final Logger LOG = LoggerFactory.getLogger(UtilHelpers.class);

  public static final String ENV_PREFIX = "AVROUDF_";
  public static final String ENV_PROPS_FILE = ENV_PREFIX + "PROPS";

  /**
   * Builds the effective properties. Later sources override earlier ones: the properties file,
   * then {@code AVROUDF_*} environment variables, then {@code key=value} overrides.
   *
   * @param propsFilePath properties file, falls back to the {@code AVROUDF_PROPS} variable when empty
   * @param env           environment variables
   * @param overrides     {@code key=value} pairs
   */
  public static TypedProperties buildProperties(String propsFilePath, Map<String, String> env, List<String> overrides) {
    TypedProperties properties = new TypedProperties();
    String propsFile = StringUtils.isNullOrEmpty(propsFilePath) ? env.get(ENV_PROPS_FILE) : propsFilePath;
    if (StringUtils.nonEmpty(propsFile)) {
      properties.putAll(readConfig(propsFile));
    }
    properties.putAll(fromEnvironment(env));
    properties.putAll(buildProperties(overrides));
    return properties;
  }

  public static TypedProperties buildProperties(List<String> props) {
    TypedProperties properties = new TypedProperties();
    props.forEach(x -> {
      // Some values may contain '=', such as a registry url with a query string
      String[] kv = x.split("=", 2);
      ValidationUtils.checkArgument(kv.length == 2, "Expected key=value, got " + x);
      properties.setProperty(kv[0].trim(), kv[1]);
    });
    return properties;
  }

  public static TypedProperties readConfig(String propsFilePath) {
    TypedProperties properties = new TypedProperties();
    try (Reader reader = Files.newBufferedReader(Paths.get(propsFilePath), StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException ioe) {
      throw new AvroUdfException("Unable to read properties file " + propsFilePath, ioe);
    }
    LOG.info("Loaded {} properties from {}", properties.size(), propsFilePath);
    return properties;
  }

  /**
   * Maps {@code AVROUDF_SCHEMA_REGISTRY_URL} to {@code avroudf.schema.registry.url}, and so on for every
   * variable carrying the prefix except {@code AVROUDF_PROPS}.
   */
  public static TypedProperties fromEnvironment(Map<String, String> env) {
    TypedProperties properties = new TypedProperties();
    env.forEach((name, value) -> {
      if (name.startsWith(ENV_PREFIX) && !name.equals(ENV_PROPS_FILE)) {
        properties.setProperty(name.toLowerCase(Locale.ROOT).replace('_', '.'), value);
      }
    });
    return properties;
  }

  public static void checkRequiredProperties(TypedProperties props, List<String> checkPropNames) {
    List<String> missing = checkPropNames.stream()
        .filter(prop -> StringUtils.isNullOrEmpty(props.getProperty(prop)))
        .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException("Missing required properties " + missing);
    }
  }

  public static SchemaFetcher createSchemaFetcher(TypedProperties props) {
    String fetcherClass = SchemaRegistryConfig.newBuilder().fromProperties(props).build().getSchemaFetcherClass();
    LOG.info("Creating schema fetcher {}", fetcherClass);
    return (SchemaFetcher) ReflectionUtils.loadClass(fetcherClass, new Class<?>[] {TypedProperties.class}, props);
  }

  /**
   * Creates the registry client used by the configured pipeline, or null when the pipeline does not
   * look schemas up.
   */
  public static SchemaRegistryClient createRegistryClient(PipelineConfig pipelineConfig, TypedProperties props, SchemaCache cache) {
    if (!RecordPipelineFactory.needsRegistry(pipelineConfig)) {
      return null;
    }
    String fetcherClass = SchemaRegistryConfig.newBuilder().fromProperties(props).build().getSchemaFetcherClass();
    if (fetcherClass.endsWith(".HttpSchemaFetcher")) {
      checkRequiredProperties(props, Collections.singletonList(SchemaRegistryConfig.SCHEMA_REGISTRY_URL.key()));
    } else if (fetcherClass.endsWith(".FilebasedSchemaFetcher")) {
      checkRequiredProperties(props, Collections.singletonList(SchemaRegistryConfig.SCHEMA_FILE_DIR.key()));
    }
    return new SchemaRegistryClient(createSchemaFetcher(props), cache);
  }
}
