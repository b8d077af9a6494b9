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
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VariableWidthVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * The type of the values stored in a dictionary: UTF-8 text or opaque binary, each with 32-bit
 * or 64-bit offsets. Values always enter and leave the dictionary as raw bytes.
 *
 * @param <V> the vector type holding the dictionary values.
 */
public final class DictionaryValueType<V extends FieldVector & VariableWidthVector> {

  public static final DictionaryValueType<VarCharVector> UTF8 =
      new DictionaryValueType<>(
          "UTF8",
          ArrowType.Utf8.INSTANCE,
          VarCharVector::new,
          VarCharVector::setSafe,
          VarCharVector::setNull,
          VarCharVector::get);

  public static final DictionaryValueType<LargeVarCharVector> LARGE_UTF8 =
      new DictionaryValueType<>(
          "LARGE_UTF8",
          ArrowType.LargeUtf8.INSTANCE,
          LargeVarCharVector::new,
          LargeVarCharVector::setSafe,
          LargeVarCharVector::setNull,
          LargeVarCharVector::get);

  public static final DictionaryValueType<VarBinaryVector> BINARY =
      new DictionaryValueType<>(
          "BINARY",
          ArrowType.Binary.INSTANCE,
          VarBinaryVector::new,
          VarBinaryVector::setSafe,
          VarBinaryVector::setNull,
          VarBinaryVector::get);

  public static final DictionaryValueType<LargeVarBinaryVector> LARGE_BINARY =
      new DictionaryValueType<>(
          "LARGE_BINARY",
          ArrowType.LargeBinary.INSTANCE,
          LargeVarBinaryVector::new,
          LargeVarBinaryVector::setSafe,
          LargeVarBinaryVector::setNull,
          LargeVarBinaryVector::get);

  private static final List<DictionaryValueType<?>> VALUES =
      Collections.unmodifiableList(Arrays.asList(UTF8, LARGE_UTF8, BINARY, LARGE_BINARY));

  /** Writes a value at an index, growing the vector if needed. */
  @FunctionalInterface
  private interface ValueWriter<T> {
    void write(T vector, int index, byte[] value);
  }

  /** Reads a value at an index, null for a null slot. */
  @FunctionalInterface
  private interface ValueReader<T> {
    byte[] read(T vector, int index);
  }

  private final String name;
  private final ArrowType arrowType;
  private final BiFunction<Field, BufferAllocator, V> vectorFactory;
  private final ValueWriter<V> writer;
  private final ObjIntConsumer<V> nullSetter;
  private final ValueReader<V> reader;

  private DictionaryValueType(
      String name,
      ArrowType arrowType,
      BiFunction<Field, BufferAllocator, V> vectorFactory,
      ValueWriter<V> writer,
      ObjIntConsumer<V> nullSetter,
      ValueReader<V> reader) {
    this.name = name;
    this.arrowType = arrowType;
    this.vectorFactory = vectorFactory;
    this.writer = writer;
    this.nullSetter = nullSetter;
    this.reader = reader;
  }

  public static List<DictionaryValueType<?>> values() {
    return VALUES;
  }

  public ArrowType getArrowType() {
    return arrowType;
  }

  /**
   * Creates an empty value vector for the given field.
   *
   * @param field the field describing the vector.
   * @param allocator the allocator for the vector buffers.
   * @return the new vector, owned by the caller.
   */
  public V createVector(Field field, BufferAllocator allocator) {
    return vectorFactory.apply(field, allocator);
  }

  public void setSafe(V vector, int index, byte[] value) {
    writer.write(vector, index, value);
  }

  public void setNull(V vector, int index) {
    nullSetter.accept(vector, index);
  }

  /**
   * Gets a copy of the bytes at the index.
   *
   * @param vector the vector to read.
   * @param index the index of the value.
   * @return the bytes, or null if the slot is null.
   */
  public byte[] get(V vector, int index) {
    return reader.read(vector, index);
  }

  @Override
  public String toString() {
    return name;
  }
}
