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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.ObjIntConsumer;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * The integer type used for the keys (indices) of a dictionary-encoded vector.
 *
 * <p>The set of key types is closed: one constant per Arrow integer vector. A key type bounds
 * the number of distinct values a dictionary can address, e.g. {@link #INT8} can address at most
 * 128 values (slots 0 to 127) and {@link #UINT8} at most 256.
 *
 * @param <K> the vector type holding the keys.
 */
public final class DictionaryKeyType<K extends BaseFixedWidthVector & BaseIntVector> {

  public static final DictionaryKeyType<TinyIntVector> INT8 =
      new DictionaryKeyType<>(
          "INT8", 8, true, Byte.MIN_VALUE, Byte.MAX_VALUE, TinyIntVector::new,
          TinyIntVector::setNull);

  public static final DictionaryKeyType<SmallIntVector> INT16 =
      new DictionaryKeyType<>(
          "INT16", 16, true, Short.MIN_VALUE, Short.MAX_VALUE, SmallIntVector::new,
          SmallIntVector::setNull);

  public static final DictionaryKeyType<IntVector> INT32 =
      new DictionaryKeyType<>(
          "INT32", 32, true, Integer.MIN_VALUE, Integer.MAX_VALUE, IntVector::new,
          IntVector::setNull);

  public static final DictionaryKeyType<BigIntVector> INT64 =
      new DictionaryKeyType<>(
          "INT64", 64, true, Long.MIN_VALUE, Long.MAX_VALUE, BigIntVector::new,
          BigIntVector::setNull);

  public static final DictionaryKeyType<UInt1Vector> UINT8 =
      new DictionaryKeyType<>(
          "UINT8", 8, false, 0, 0xFFL, UInt1Vector::new, UInt1Vector::setNull);

  public static final DictionaryKeyType<UInt2Vector> UINT16 =
      new DictionaryKeyType<>(
          "UINT16", 16, false, 0, 0xFFFFL, UInt2Vector::new, UInt2Vector::setNull);

  public static final DictionaryKeyType<UInt4Vector> UINT32 =
      new DictionaryKeyType<>(
          "UINT32", 32, false, 0, 0xFFFFFFFFL, UInt4Vector::new, UInt4Vector::setNull);

  /**
   * Unsigned 64-bit keys. Key values are handled as java longs, so the upper bound is {@link
   * Long#MAX_VALUE}, far beyond what an int-indexed vector can hold anyway.
   */
  public static final DictionaryKeyType<UInt8Vector> UINT64 =
      new DictionaryKeyType<>(
          "UINT64", 64, false, 0, Long.MAX_VALUE, UInt8Vector::new, UInt8Vector::setNull);

  private static final List<DictionaryKeyType<?>> VALUES =
      Collections.unmodifiableList(
          Arrays.asList(INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64));

  private final String name;
  private final ArrowType.Int arrowType;
  private final long minValue;
  private final long maxValue;
  private final BiFunction<Field, BufferAllocator, K> vectorFactory;
  private final ObjIntConsumer<K> nullSetter;

  private DictionaryKeyType(
      String name,
      int bitWidth,
      boolean signed,
      long minValue,
      long maxValue,
      BiFunction<Field, BufferAllocator, K> vectorFactory,
      ObjIntConsumer<K> nullSetter) {
    this.name = name;
    this.arrowType = new ArrowType.Int(bitWidth, signed);
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.vectorFactory = vectorFactory;
    this.nullSetter = nullSetter;
  }

  /** All key types, narrowest first within each signedness. */
  public static List<DictionaryKeyType<?>> values() {
    return VALUES;
  }

  public ArrowType.Int getArrowType() {
    return arrowType;
  }

  public int getBitWidth() {
    return arrowType.getBitWidth();
  }

  public boolean isSigned() {
    return arrowType.getIsSigned();
  }

  public long getMinValue() {
    return minValue;
  }

  public long getMaxValue() {
    return maxValue;
  }

  /**
   * Gets the largest dictionary slot this key type can reference. Vectors are int-indexed, so
   * this never exceeds {@link Integer#MAX_VALUE}.
   */
  public int getMaxSlot() {
    return (int) Math.min(maxValue, Integer.MAX_VALUE);
  }

  /**
   * Checks if the value can be stored in this key type without any loss.
   *
   * @param value the value to check.
   * @return true if the cast to this key type is exact.
   */
  public boolean canRepresent(long value) {
    return value >= minValue && value <= maxValue;
  }

  /**
   * Creates an empty key vector for the given field.
   *
   * @param field the field describing the vector, normally carrying a dictionary encoding.
   * @param allocator the allocator for the vector buffers.
   * @return the new vector, owned by the caller.
   */
  public K createVector(Field field, BufferAllocator allocator) {
    return vectorFactory.apply(field, allocator);
  }

  /**
   * Stores a key that is known to be representable, growing the vector if needed.
   *
   * @param vector the key vector.
   * @param index the position to write.
   * @param key the key, which must satisfy {@link #canRepresent(long)}.
   */
  public void setSafe(K vector, int index, long key) {
    vector.setWithPossibleTruncate(index, key);
  }

  /** Marks the key at the index as null, growing the vector if needed. */
  public void setNull(K vector, int index) {
    nullSetter.accept(vector, index);
  }

  @Override
  public String toString() {
    return name;
  }
}
