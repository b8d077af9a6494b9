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

import org.apache.arrow.dictionary.DictionaryArray;
import org.apache.arrow.dictionary.DictionaryKeyCastException;
import org.apache.arrow.dictionary.DictionaryKeyOverflowException;
import org.apache.arrow.dictionary.DictionaryKeyType;
import org.apache.arrow.dictionary.DictionaryValueType;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VariableWidthVector;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link DictionaryArray} of text or binary values, one value (or null) at a time.
 *
 * <p>Each distinct value is stored once, in the order it is first seen, and every row gets the
 * key (slot) of its value. Lookups go through a {@link DeduplicationIndex}, so each append
 * takes O(1) amortized time.
 *
 * <p>Below gives the sample code for using the builder
 *
 * <pre>{@code
 * try (ByteDictionaryBuilder<TinyIntVector, VarCharVector> builder =
 *          DictionaryBuilders.utf8(new DictionaryBuilderConfig(allocator), DictionaryKeyType.INT8)) {
 *   builder.append("abc".getBytes(StandardCharsets.UTF_8));  // key 0
 *   builder.appendNull();
 *   builder.appendN("def".getBytes(StandardCharsets.UTF_8), 2);  // key 1, twice
 *   builder.append("abc".getBytes(StandardCharsets.UTF_8));  // key 0
 *   try (DictionaryArray<TinyIntVector, VarCharVector> array = builder.finish()) {
 *     // keys [0, null, 1, 1, 0], values ["abc", "def"]
 *   }
 * }
 * }</pre>
 *
 * <p>The fallible appends throw {@link DictionaryKeyOverflowException} when a new value would
 * need a slot the key type cannot represent. The value has been stored at that point and keeps
 * its slot, but no key is appended. The infallible appends turn the overflow into an {@link
 * IllegalStateException}.
 *
 * <p>A builder is not thread safe.
 *
 * @param <K> the key vector type.
 * @param <V> the value vector type.
 */
public class ByteDictionaryBuilder<K extends BaseFixedWidthVector & BaseIntVector,
    V extends FieldVector & VariableWidthVector> implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ByteDictionaryBuilder.class);

  /**
   * Marks a translated dictionary value that is null.
   */
  private static final long NULL_KEY = -1L;

  private final DictionaryBuilderConfig config;

  private final DictionaryKeyType<K> keyType;

  private final DictionaryValueType<V> valueType;

  private final DeduplicationIndex dedup;

  private final ValuesAccumulator<V> values;

  private final KeysAccumulator<K> keys;

  private boolean closed;

  /**
   * Constructs an empty builder.
   *
   * @param config the builder configuration.
   * @param keyType the key type of the arrays to build.
   * @param valueType the value type of the arrays to build.
   */
  public ByteDictionaryBuilder(
      DictionaryBuilderConfig config, DictionaryKeyType<K> keyType,
      DictionaryValueType<V> valueType) {
    this(
        config,
        keyType,
        valueType,
        new DeduplicationIndex(config.createHasher(), config.getValuesCapacity()),
        new ValuesAccumulator<>(
            valueType,
            valuesField(config, valueType),
            config.getAllocator(),
            config.getValuesCapacity(),
            config.getDataCapacity()),
        new KeysAccumulator<>(
            keyType, keysField(config, keyType), config.getAllocator(), config.getKeysCapacity()));
  }

  private ByteDictionaryBuilder(
      DictionaryBuilderConfig config,
      DictionaryKeyType<K> keyType,
      DictionaryValueType<V> valueType,
      DeduplicationIndex dedup,
      ValuesAccumulator<V> values,
      KeysAccumulator<K> keys) {
    this.config = config;
    this.keyType = keyType;
    this.valueType = valueType;
    this.dedup = dedup;
    this.values = values;
    this.keys = keys;
  }

  /**
   * Constructs a builder whose dictionary starts with the given values, in their order and with
   * their nulls. The slots of the given values are used as keys for equal appended values.
   *
   * <p>The given values are not deduplicated against each other: a repeated value occupies
   * several slots, and appends of it resolve to the first one.
   *
   * @param config the builder configuration.
   * @param keyType the key type of the arrays to build.
   * @param valueType the value type of the arrays to build.
   * @param dictionaryValues the initial dictionary values. They are copied, not retained.
   * @return the new builder.
   * @throws DictionaryKeyOverflowException if the key type cannot represent the number of given
   *     values.
   */
  public static <K extends BaseFixedWidthVector & BaseIntVector,
      V extends FieldVector & VariableWidthVector> ByteDictionaryBuilder<K, V> withDictionary(
      DictionaryBuilderConfig config,
      DictionaryKeyType<K> keyType,
      DictionaryValueType<V> valueType,
      V dictionaryValues) throws DictionaryKeyOverflowException {
    int dictionaryLength = dictionaryValues.getValueCount();
    if (!keyType.canRepresent(dictionaryLength)) {
      throw new DictionaryKeyOverflowException(keyType, dictionaryLength);
    }

    ByteDictionaryBuilder<K, V> builder =
        new ByteDictionaryBuilder<>(
            config,
            keyType,
            valueType,
            new DeduplicationIndex(config.createHasher(), dictionaryLength),
            new ValuesAccumulator<>(
                valueType,
                valuesField(config, valueType),
                config.getAllocator(),
                Math.max(dictionaryLength, config.getValuesCapacity()),
                config.getDataCapacity()),
            new KeysAccumulator<>(
                keyType,
                keysField(config, keyType),
                config.getAllocator(),
                config.getKeysCapacity()));
    try {
      for (int i = 0; i < dictionaryLength; i++) {
        if (dictionaryValues.isNull(i)) {
          builder.values.appendNull();
        } else {
          byte[] value = valueType.get(dictionaryValues, i);
          int slot = builder.values.appendValue(value);
          builder.dedup.putIfAbsent(value, slot, builder.values);
        }
      }
    } catch (RuntimeException e) {
      builder.close();
      throw e;
    }
    return builder;
  }

  /**
   * Moves the state of a builder into a new builder with another key type. The dictionary
   * values and the deduplication index are reused as they are; the staged keys are cast exactly
   * to the new key type.
   *
   * <p>The source builder is consumed whatever the outcome: on success its state belongs to the
   * returned builder, on failure it is released. It cannot be used afterwards.
   *
   * @param source the builder to migrate.
   * @param keyType the new key type.
   * @return a builder with the same keys and values, keyed by the new key type.
   * @throws DictionaryKeyCastException if a staged key cannot be represented by the new type.
   */
  public static <S extends BaseFixedWidthVector & BaseIntVector,
      K extends BaseFixedWidthVector & BaseIntVector,
      V extends FieldVector & VariableWidthVector> ByteDictionaryBuilder<K, V> withKeyType(
      ByteDictionaryBuilder<S, V> source, DictionaryKeyType<K> keyType)
      throws DictionaryKeyCastException {
    source.checkOpen();
    source.closed = true;

    DictionaryBuilderConfig config = source.config;
    KeysAccumulator<S> sourceKeys = source.keys;
    int keyCount = sourceKeys.getValueCount();
    KeysAccumulator<K> newKeys =
        new KeysAccumulator<>(
            keyType,
            keysField(config, keyType),
            config.getAllocator(),
            Math.max(keyCount, config.getKeysCapacity()));
    try {
      for (int i = 0; i < keyCount; i++) {
        if (sourceKeys.isNull(i)) {
          newKeys.appendNull();
          continue;
        }
        long key = sourceKeys.get(i);
        if (!keyType.canRepresent(key)) {
          throw new DictionaryKeyCastException(source.keyType, keyType, key);
        }
        newKeys.appendValue(key);
      }
    } catch (DictionaryKeyCastException | RuntimeException e) {
      newKeys.close();
      sourceKeys.close();
      source.values.close();
      throw e;
    }
    sourceKeys.close();

    logger.debug("Migrated {} dictionary keys from {} to {}", keyCount, source.keyType, keyType);
    return new ByteDictionaryBuilder<>(
        config, keyType, source.valueType, source.dedup, source.values, newKeys);
  }

  private static Field keysField(DictionaryBuilderConfig config, DictionaryKeyType<?> keyType) {
    DictionaryEncoding encoding =
        new DictionaryEncoding(config.getDictionaryId(), false, keyType.getArrowType());
    return new Field(
        config.getName(), new FieldType(true, keyType.getArrowType(), encoding), null);
  }

  private static Field valuesField(
      DictionaryBuilderConfig config, DictionaryValueType<?> valueType) {
    return new Field(config.getName(), FieldType.nullable(valueType.getArrowType()), null);
  }

  /**
   * Gets the key of a value, storing the value first if it is new.
   */
  private long getOrInsertKey(byte[] value) throws DictionaryKeyOverflowException {
    Preconditions.checkNotNull(value, "value cannot be null, use appendNull instead");
    int slot = dedup.getOrInsert(value, values);
    if (slot > keyType.getMaxSlot()) {
      throw new DictionaryKeyOverflowException(keyType, slot);
    }
    return slot;
  }

  /**
   * Appends a value. Returns the key of an equal value already in the dictionary, or stores the
   * value under a new key.
   *
   * @param value the value bytes.
   * @return the key of the value.
   * @throws DictionaryKeyOverflowException if the new key would overflow the key type.
   */
  public long append(byte[] value) throws DictionaryKeyOverflowException {
    checkOpen();
    long key = getOrInsertKey(value);
    keys.appendValue(key);
    return key;
  }

  /**
   * Appends a value repeatedly. This is the same as calling {@link #append(byte[])} count times,
   * but with a single lookup.
   *
   * @param value the value bytes.
   * @param count the number of rows to append.
   * @return the key of the value.
   * @throws DictionaryKeyOverflowException if the new key would overflow the key type.
   */
  public long appendN(byte[] value, int count) throws DictionaryKeyOverflowException {
    checkOpen();
    Preconditions.checkArgument(count >= 0, "invalid count: %s", count);
    long key = getOrInsertKey(value);
    keys.appendValueN(key, count);
    return key;
  }

  /**
   * Infallibly appends a value.
   *
   * @param value the value bytes.
   * @throws IllegalStateException if the new key would overflow the key type.
   */
  public void appendValue(byte[] value) {
    try {
      append(value);
    } catch (DictionaryKeyOverflowException e) {
      throw new IllegalStateException("dictionary key overflow", e);
    }
  }

  /**
   * Infallibly appends a value repeatedly, with a single lookup.
   *
   * @param value the value bytes.
   * @param count the number of rows to append.
   * @throws IllegalStateException if the new key would overflow the key type.
   */
  public void appendValues(byte[] value, int count) {
    try {
      appendN(value, count);
    } catch (DictionaryKeyOverflowException e) {
      throw new IllegalStateException("dictionary key overflow", e);
    }
  }

  /** Appends a null row. The dictionary values are not touched. */
  public void appendNull() {
    checkOpen();
    keys.appendNull();
  }

  /**
   * Appends null rows.
   *
   * @param count the number of null rows.
   */
  public void appendNulls(int count) {
    checkOpen();
    Preconditions.checkArgument(count >= 0, "invalid count: %s", count);
    keys.appendNulls(count);
  }

  /**
   * Infallibly appends a value, or a null row if the value is null.
   *
   * @param value the value bytes, may be null.
   * @throws IllegalStateException if the new key would overflow the key type.
   */
  public void appendOption(byte[] value) {
    if (value == null) {
      appendNull();
    } else {
      appendValue(value);
    }
  }

  /**
   * Infallibly appends a value or null repeatedly, with at most a single lookup.
   *
   * @param value the value bytes, may be null.
   * @param count the number of rows to append.
   * @throws IllegalStateException if the new key would overflow the key type.
   */
  public void appendOptions(byte[] value, int count) {
    if (value == null) {
      appendNulls(count);
    } else {
      appendValues(value, count);
    }
  }

  /**
   * Infallibly appends all values, a null element being a null row.
   *
   * @param newValues the values to append.
   * @throws IllegalStateException if a new key would overflow the key type.
   */
  public void extend(Iterable<byte[]> newValues) {
    for (byte[] value : newValues) {
      appendOption(value);
    }
  }

  /**
   * Appends all rows of an existing dictionary array.
   *
   * <p>This gives the same rows as appending the value of each row in turn, but the values of
   * the given dictionary are looked up only once each, however many rows reference them. Values
   * the given dictionary holds but no row references are still added to this dictionary. A row
   * whose key references a null value becomes a null row.
   *
   * <p>A key beyond the given values is clamped to the last value, unless strict key bounds are
   * configured, in which case the array is rejected before anything is appended.
   *
   * @param dictionary the array to append, of any key type.
   * @throws DictionaryKeyOverflowException if a new key would overflow the key type. The values
   *     translated before the overflow stay in the dictionary, but no row is appended.
   * @throws IllegalArgumentException if the array has values but no keys, or, with strict key
   *     bounds, a key out of range.
   */
  public void extendDictionary(DictionaryArray<?, V> dictionary)
      throws DictionaryKeyOverflowException {
    checkOpen();
    BaseIntVector sourceKeys = dictionary.getKeys();
    V sourceValues = dictionary.getValues();
    int valueLength = sourceValues.getValueCount();
    int keyLength = sourceKeys.getValueCount();

    if (valueLength == 0 && keyLength == 0) {
      return;
    }

    // all nulls
    if (valueLength == 0) {
      if (config.isStrictKeyBounds()) {
        checkKeyBounds(sourceKeys, keyLength, valueLength);
      }
      keys.appendNulls(keyLength);
      return;
    }

    Preconditions.checkArgument(
        keyLength != 0, "Dictionary keys should not be empty when values are not empty");
    if (config.isStrictKeyBounds()) {
      checkKeyBounds(sourceKeys, keyLength, valueLength);
    }

    // translate each value once, unreferenced ones included
    long[] translated = new long[valueLength];
    for (int i = 0; i < valueLength; i++) {
      if (sourceValues.isNull(i)) {
        translated[i] = NULL_KEY;
      } else {
        translated[i] = getOrInsertKey(valueType.get(sourceValues, i));
      }
    }

    for (int i = 0; i < keyLength; i++) {
      if (sourceKeys.isNull(i)) {
        keys.appendNull();
        continue;
      }
      long sourceIndex = sourceKeys.getValueAsLong(i);
      int index =
          sourceIndex < 0 || sourceIndex >= valueLength ? valueLength - 1 : (int) sourceIndex;
      long key = translated[index];
      if (key == NULL_KEY) {
        keys.appendNull();
      } else {
        keys.appendValue(key);
      }
    }
  }

  private static void checkKeyBounds(BaseIntVector sourceKeys, int keyLength, int valueLength) {
    for (int i = 0; i < keyLength; i++) {
      if (sourceKeys.isNull(i)) {
        continue;
      }
      long key = sourceKeys.getValueAsLong(i);
      Preconditions.checkArgument(
          key >= 0 && key < valueLength,
          "Dictionary key %s at index %s is out of range [0, %s)",
          key,
          i,
          valueLength);
    }
  }

  /**
   * Builds the dictionary array and resets this builder. The deduplication index is cleared,
   * so the builder starts a new, empty dictionary.
   *
   * @return the dictionary array, owned by the caller.
   */
  public DictionaryArray<K, V> finish() {
    checkOpen();
    dedup.clear();
    V finishedValues = values.finish();
    K finishedKeys = keys.finish();
    logger.debug(
        "Finished dictionary array with {} keys and {} values",
        finishedKeys.getValueCount(),
        finishedValues.getValueCount());
    return new DictionaryArray<>(keyType, valueType, finishedKeys, finishedValues);
  }

  /**
   * Builds the dictionary array from copies of the current state, without resetting this
   * builder. Later appends keep extending the same dictionary.
   *
   * @return the dictionary array, owned by the caller.
   */
  public DictionaryArray<K, V> finishCloned() {
    checkOpen();
    V clonedValues = values.finishCloned();
    K clonedKeys = keys.finishCloned();
    return new DictionaryArray<>(keyType, valueType, clonedKeys, clonedValues);
  }

  /** Gets the number of rows appended since the last {@link #finish()}. */
  public int getValueCount() {
    checkOpen();
    return keys.getValueCount();
  }

  /** Gets the number of value slots, nulls included, in the current dictionary. */
  public int getDictionarySize() {
    checkOpen();
    return values.getValueCount();
  }

  /**
   * Gets the validity buffer of the rows appended so far. Only the first {@link
   * #getValueCount()} bits are meaningful.
   */
  public ArrowBuf getValidityBuffer() {
    checkOpen();
    return keys.getValidityBuffer();
  }

  public DictionaryKeyType<K> getKeyType() {
    return keyType;
  }

  public DictionaryValueType<V> getValueType() {
    return valueType;
  }

  public DictionaryBuilderConfig getConfig() {
    return config;
  }

  DeduplicationIndex getDeduplicationIndex() {
    return dedup;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "Dictionary builder is closed or has been consumed");
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    keys.close();
    values.close();
  }
}
