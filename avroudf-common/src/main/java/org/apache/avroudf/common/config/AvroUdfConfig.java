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

package org.apache.avroudf.common.config;

import org.apache.avroudf.exception.AvroUdfException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Properties;

/**
 * This class deals with {@link ConfigProperty} and provides get/set functionalities.
 */
public class AvroUdfConfig implements Serializable {

  private static final Logger LOG = LoggerFactory.getLogger(AvroUdfConfig.class);

  protected TypedProperties props;

  public AvroUdfConfig() {
    this.props = new TypedProperties();
  }

  public AvroUdfConfig(Properties props) {
    this.props = new TypedProperties(props);
  }

  public <T> void setValue(ConfigProperty<T> cfg, String val) {
    props.setProperty(cfg.key(), val);
  }

  public void setValue(String key, String val) {
    props.setProperty(key, val);
  }

  public void setAll(Properties properties) {
    props.putAll(properties);
  }

  public <T> void setDefaultValue(ConfigProperty<T> configProperty) {
    if (!contains(configProperty) && configProperty.hasDefaultValue()) {
      props.setProperty(configProperty.key(), String.valueOf(configProperty.defaultValue()));
    }
  }

  /**
   * Fills in the defaults of every public static {@link ConfigProperty} declared on the given class.
   */
  public void setDefaults(String configClassName) {
    try {
      Class<?> configClass = Class.forName(configClassName);
      Arrays.stream(configClass.getDeclaredFields())
          .filter(f -> Modifier.isStatic(f.getModifiers()))
          .filter(f -> f.getType().isAssignableFrom(ConfigProperty.class))
          .forEach(f -> {
            try {
              ConfigProperty<?> cfgProp = (ConfigProperty<?>) f.get(null);
              setDefaultValue(cfgProp);
            } catch (IllegalAccessException e) {
              throw new AvroUdfException("Unable to read default of " + f.getName(), e);
            }
          });
    } catch (ClassNotFoundException e) {
      throw new AvroUdfException("Config class not found: " + configClassName, e);
    }
  }

  public <T> boolean contains(ConfigProperty<T> configProperty) {
    if (props.containsKey(configProperty.key())) {
      return true;
    }
    return configProperty.getAlternatives().stream().anyMatch(props::containsKey);
  }

  private <T> String getRawValue(ConfigProperty<T> configProperty) {
    if (props.containsKey(configProperty.key())) {
      return props.getProperty(configProperty.key());
    }
    for (String alternative : configProperty.getAlternatives()) {
      if (props.containsKey(alternative)) {
        LOG.warn("The configuration key '{}' has been deprecated and may be removed in the future. Please use the new key '{}' instead.",
            alternative, configProperty.key());
        return props.getProperty(alternative);
      }
    }
    return null;
  }

  public <T> String getString(ConfigProperty<T> configProperty) {
    String value = getRawValue(configProperty);
    if (value == null && configProperty.hasDefaultValue()) {
      return String.valueOf(configProperty.defaultValue());
    }
    return value;
  }

  public <T> Integer getInt(ConfigProperty<T> configProperty) {
    String value = getString(configProperty);
    return value == null ? null : Integer.parseInt(value);
  }

  public <T> Long getLong(ConfigProperty<T> configProperty) {
    String value = getString(configProperty);
    return value == null ? null : Long.parseLong(value);
  }

  public <T> boolean getBoolean(ConfigProperty<T> configProperty) {
    return Boolean.parseBoolean(getString(configProperty));
  }

  public TypedProperties getProps() {
    return props;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + props;
  }
}
