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

package org.apache.arrow.dictionary.builder;

import org.apache.arrow.dictionary.DictionaryKeyType;
import org.apache.arrow.dictionary.DictionaryValueType;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Factory methods for the dictionary builders of each value type.
 */
public final class DictionaryBuilders {

  private DictionaryBuilders() {
  }

  /** Creates a builder of dictionaries of UTF-8 strings. */
  public static <K extends BaseFixedWidthVector & BaseIntVector>
      ByteDictionaryBuilder<K, VarCharVector> utf8(
          DictionaryBuilderConfig config, DictionaryKeyType<K> keyType) {
    return new ByteDictionaryBuilder<>(config, keyType, DictionaryValueType.UTF8);
  }

  /** Creates a builder of dictionaries of UTF-8 strings with 64-bit offsets. */
  public static <K extends BaseFixedWidthVector & BaseIntVector>
      ByteDictionaryBuilder<K, LargeVarCharVector> largeUtf8(
          DictionaryBuilderConfig config, DictionaryKeyType<K> keyType) {
    return new ByteDictionaryBuilder<>(config, keyType, DictionaryValueType.LARGE_UTF8);
  }

  /** Creates a builder of dictionaries of binary values. */
  public static <K extends BaseFixedWidthVector & BaseIntVector>
      ByteDictionaryBuilder<K, VarBinaryVector> binary(
          DictionaryBuilderConfig config, DictionaryKeyType<K> keyType) {
    return new ByteDictionaryBuilder<>(config, keyType, DictionaryValueType.BINARY);
  }

  /** Creates a builder of dictionaries of binary values with 64-bit offsets. */
  public static <K extends BaseFixedWidthVector & BaseIntVector>
      ByteDictionaryBuilder<K, LargeVarBinaryVector> largeBinary(
          DictionaryBuilderConfig config, DictionaryKeyType<K> keyType) {
    return new ByteDictionaryBuilder<>(config, keyType, DictionaryValueType.LARGE_BINARY);
  }
}
