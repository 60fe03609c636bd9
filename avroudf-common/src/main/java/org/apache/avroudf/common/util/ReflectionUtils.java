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

package org.apache.avroudf.common.util;

import org.apache.avroudf.exception.AvroUdfException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;

/**
 * A utility class for reflection.
 */
public class ReflectionUtils {

  private static final Logger LOG = LoggerFactory.getLogger(ReflectionUtils.class);

  public static Class<?> getClass(String clazzName) {
    try {
      return Class.forName(clazzName);
    } catch (ClassNotFoundException e) {
      throw new AvroUdfException("Unable to load class " + clazzName, e);
    }
  }

  /**
   * Creates an instance of the given class using the constructor matching the given types.
   */
  public static Object loadClass(String clazz, Class<?>[] constructorArgTypes, Object... constructorArgs) {
    try {
      return getClass(clazz).getConstructor(constructorArgTypes).newInstance(constructorArgs);
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof AvroUdfException) {
        throw (AvroUdfException) e.getCause();
      }
      throw new AvroUdfException("Unable to instantiate class " + clazz, e.getCause());
    } catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
      LOG.error("No usable constructor {} on {}", Arrays.toString(constructorArgTypes), clazz);
      throw new AvroUdfException("Unable to instantiate class " + clazz, e);
    }
  }
}
