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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestJsonUtils {

  @Test
  public void testSeparators() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("a", 1);
    value.put("b", Arrays.asList(true, null, "c"));
    assertEquals("{\"a\": 1, \"b\": [true, null, \"c\"]}", JsonUtils.toJsonString(value));
  }

  @Test
  public void testEscapes() {
    assertEquals("\"\\u00fc\"", JsonUtils.toJsonString("ü"));
    assertEquals("\"\\ud83d\\ude00\"", JsonUtils.toJsonString("\uD83D\uDE00"));
    assertEquals("\"\\u001f\\u007f\"", JsonUtils.toJsonString("\u001F\u007F"));
    assertEquals("\"a\\\"b\\\\c\\n\"", JsonUtils.toJsonString("a\"b\\c\n"));
    assertEquals("\"/~\"", JsonUtils.toJsonString("/~"));
  }
}
