/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.arrow.dictionary;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Utilities for dictionary tests.
 */
public final class DictionaryTestUtil {

  private DictionaryTestUtil() {
  }

  public static byte[] bytes(String value) {
    return value == null ? null : value.getBytes(StandardCharsets.UTF_8);
  }

  public static String string(byte[] value) {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  /** Gets the keys of an array, null for null rows. */
  public static List<Long> keysOf(DictionaryArray<?, ?> array) {
    List<Long> keys = new ArrayList<>();
    for (int i = 0; i < array.getValueCount(); i++) {
      keys.add(array.getKey(i));
    }
    return keys;
  }

  /** Gets the dictionary values of an array, in slot order. */
  public static List<String> valuesOf(DictionaryArray<?, ?> array) {
    List<String> values = new ArrayList<>();
    for (int i = 0; i < array.getDictionarySize(); i++) {
      values.add(string(array.getDictionaryValue(i)));
    }
    return values;
  }

  /** Gets the logical rows of an array, with keys resolved to values. */
  public static List<String> rowsOf(DictionaryArray<?, ?> array) {
    List<String> rows = new ArrayList<>();
    for (int i = 0; i < array.getValueCount(); i++) {
      rows.add(string(array.getValue(i)));
    }
    return rows;
  }
}
