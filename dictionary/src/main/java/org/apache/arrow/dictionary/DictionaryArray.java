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

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VariableWidthVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.util.ValueVectorUtility;
import org.apache.arrow.vector.validate.ValidateUtil;

/**
 * An immutable dictionary-encoded array: a vector of keys indexing into a vector of values.
 *
 * <p>The keys vector carries the {@link DictionaryEncoding} in its field, which together with the
 * value type forms the dictionary type of the array. A null key is a null row, whatever the slot
 * it would reference.
 *
 * <p>The array owns both vectors and releases them on {@link #close()}.
 *
 * @param <K> the key vector type.
 * @param <V> the value vector type.
 */
public class DictionaryArray<K extends BaseFixedWidthVector & BaseIntVector,
    V extends FieldVector & VariableWidthVector> implements AutoCloseable {

  private final DictionaryKeyType<K> keyType;
  private final DictionaryValueType<V> valueType;
  private final K keys;
  private final V values;
  private final DictionaryEncoding encoding;

  /**
   * Constructs a dictionary array, taking ownership of the vectors.
   *
   * <p>No validation is done here; see {@link #validate()}.
   *
   * @param keyType the key type.
   * @param valueType the value type.
   * @param keys the keys, whose field must carry the dictionary encoding.
   * @param values the dictionary values.
   */
  public DictionaryArray(
      DictionaryKeyType<K> keyType, DictionaryValueType<V> valueType, K keys, V values) {
    this.keyType = Preconditions.checkNotNull(keyType);
    this.valueType = Preconditions.checkNotNull(valueType);
    this.keys = Preconditions.checkNotNull(keys);
    this.values = Preconditions.checkNotNull(values);
    this.encoding =
        Preconditions.checkNotNull(
            keys.getField().getDictionary(), "keys vector has no dictionary encoding");
  }

  public DictionaryKeyType<K> getKeyType() {
    return keyType;
  }

  public DictionaryValueType<V> getValueType() {
    return valueType;
  }

  public K getKeys() {
    return keys;
  }

  public V getValues() {
    return values;
  }

  public DictionaryEncoding getEncoding() {
    return encoding;
  }

  public ArrowType getValueArrowType() {
    return valueType.getArrowType();
  }

  /** Gets the number of rows, i.e. the number of keys. */
  public int getValueCount() {
    return keys.getValueCount();
  }

  public boolean isNull(int index) {
    return keys.isNull(index);
  }

  /**
   * Gets the key of a row.
   *
   * @param index the row index.
   * @return the key, or null for a null row.
   */
  public Long getKey(int index) {
    if (keys.isNull(index)) {
      return null;
    }
    return keys.getValueAsLong(index);
  }

  /**
   * Gets the value of a row by resolving its key.
   *
   * @param index the row index.
   * @return the bytes of the value, or null if the key is null or references a null slot.
   */
  public byte[] getValue(int index) {
    if (keys.isNull(index)) {
      return null;
    }
    return getDictionaryValue((int) keys.getValueAsLong(index));
  }

  /** Gets the number of value slots in the dictionary. */
  public int getDictionarySize() {
    return values.getValueCount();
  }

  /**
   * Gets a value of the dictionary by its slot.
   *
   * @param slot the slot, i.e. a key.
   * @return the bytes of the value, or null for a null slot.
   */
  public byte[] getDictionaryValue(int slot) {
    return valueType.get(values, slot);
  }

  /**
   * Gets an Arrow {@link Dictionary} over the values, for use with the Arrow dictionary
   * utilities. The dictionary is a view: it does not own the values vector.
   */
  public Dictionary getDictionary() {
    return new Dictionary(values, encoding);
  }

  /**
   * Fully validates the array: both vectors must be internally consistent and every non-null
   * key must reference an existing value slot.
   *
   * @throws ValidateUtil.ValidateException if the array is malformed.
   */
  public void validate() {
    ValueVectorUtility.validateFull(keys);
    ValueVectorUtility.validateFull(values);

    int dictionarySize = getDictionarySize();
    for (int i = 0; i < keys.getValueCount(); i++) {
      if (keys.isNull(i)) {
        continue;
      }
      long key = keys.getValueAsLong(i);
      ValidateUtil.validateOrThrow(
          key >= 0 && key < dictionarySize,
          "Key %s at index %s is out of range [0, %s).",
          key,
          i,
          dictionarySize);
    }
  }

  @Override
  public void close() {
    keys.close();
    values.close();
  }

  @Override
  public String toString() {
    return "DictionaryArray " + encoding + " keys=" + keys + " values=" + values;
  }
}
