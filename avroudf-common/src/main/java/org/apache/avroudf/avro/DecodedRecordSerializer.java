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

package org.apache.avroudf.avro;

import org.apache.avroudf.common.util.JsonUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders Avro generic values as plain JSON.
 * <p>
 * Unlike Avro's own JSON encoding, union values are written without their branch wrapper. Records
 * keep their field order, {@code bytes} and {@code fixed} become ISO-8859-1 strings (one char per
 * byte), {@code float} values are widened to {@code double}, and doubles
 * keep positional notation up to 16 integer digits.
 */
public class DecodedRecordSerializer {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  /**
   * Serializes all values decoded from one input record as a JSON array.
   */
  public String serialize(List<Object> datums) {
    ArrayNode array = NODES.arrayNode();
    datums.forEach(datum -> array.add(toJsonNode(datum)));
    return JsonUtils.toJsonString(array);
  }

  /**
   * Serializes a single decoded value.
   */
  public String serializeValue(Object datum) {
    return JsonUtils.toJsonString(toJsonNode(datum));
  }

  public JsonNode toJsonNode(Object datum) {
    if (datum == null) {
      return NODES.nullNode();
    } else if (datum instanceof GenericRecord) {
      GenericRecord record = (GenericRecord) datum;
      ObjectNode node = NODES.objectNode();
      for (Schema.Field field : record.getSchema().getFields()) {
        node.set(field.name(), toJsonNode(record.get(field.pos())));
      }
      return node;
    } else if (datum instanceof Map) {
      ObjectNode node = NODES.objectNode();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) datum).entrySet()) {
        node.set(String.valueOf(entry.getKey()), toJsonNode(entry.getValue()));
      }
      return node;
    } else if (datum instanceof Collection) {
      ArrayNode node = NODES.arrayNode();
      for (Object element : (Collection<?>) datum) {
        node.add(toJsonNode(element));
      }
      return node;
    } else if (datum instanceof CharSequence || datum instanceof GenericEnumSymbol) {
      return NODES.textNode(datum.toString());
    } else if (datum instanceof ByteBuffer) {
      ByteBuffer buffer = ((ByteBuffer) datum).duplicate();
      byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return NODES.textNode(new String(bytes, StandardCharsets.ISO_8859_1));
    } else if (datum instanceof GenericFixed) {
      return NODES.textNode(new String(((GenericFixed) datum).bytes(), StandardCharsets.ISO_8859_1));
    } else if (datum instanceof Integer) {
      return NODES.numberNode((Integer) datum);
    } else if (datum instanceof Long) {
      return NODES.numberNode((Long) datum);
    } else if (datum instanceof Float || datum instanceof Double) {
      return doubleNode(((Number) datum).doubleValue());
    } else if (datum instanceof Boolean) {
      return NODES.booleanNode((Boolean) datum);
    }
    return NODES.pojoNode(datum);
  }

  private static JsonNode doubleNode(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value == 0.0d) {
      return NODES.numberNode(value);
    }
    return NODES.rawValueNode(new RawValue(formatDouble(value)));
  }

  /**
   * Formats a finite double with the shortest round-trip digits, in positional notation for decimal
   * exponents from -4 to 15 ({@code 10000000.0}, {@code 0.0001}) and in scientific notation with a
   * signed two-digit exponent otherwise ({@code 1e+16}, {@code 2.5e-05}).
   */
  static String formatDouble(double value) {
    BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
    int exponent = decimal.precision() - decimal.scale() - 1;
    if (exponent >= -4 && exponent < 16) {
      String plain = decimal.toPlainString();
      return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
    String digits = decimal.unscaledValue().abs().toString();
    StringBuilder sb = new StringBuilder();
    if (decimal.signum() < 0) {
      sb.append('-');
    }
    sb.append(digits.charAt(0));
    if (digits.length() > 1) {
      sb.append('.').append(digits, 1, digits.length());
    }
    sb.append('e').append(exponent < 0 ? '-' : '+');
    String magnitude = String.valueOf(Math.abs(exponent));
    if (magnitude.length() < 2) {
      sb.append('0');
    }
    return sb.append(magnitude).toString();
  }
}
