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

import static org.apache.arrow.dictionary.DictionaryTestUtil.bytes;
import static org.apache.arrow.dictionary.DictionaryTestUtil.string;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;
import org.apache.arrow.dictionary.DictionaryValueType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VariableWidthVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Test cases for {@link ValuesAccumulator}.
 */
public class TestValuesAccumulator {

  private BufferAllocator allocator;

  @BeforeEach
  public void prepare() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void shutdown() {
    allocator.close();
  }

  static Stream<DictionaryValueType<?>> valueTypes() {
    return DictionaryValueType.values().stream();
  }

  private <V extends FieldVector & VariableWidthVector> ValuesAccumulator<V> create(
      DictionaryValueType<V> valueType) {
    Field field = new Field("values", FieldType.nullable(valueType.getArrowType()), null);
    return new ValuesAccumulator<>(valueType, field, allocator, 0, 0L);
  }

  @ParameterizedTest
  @MethodSource("valueTypes")
  public void testAppendAndFinish(DictionaryValueType<?> valueType) {
    checkAppendAndFinish(valueType);
  }

  private <V extends FieldVector & VariableWidthVector> void checkAppendAndFinish(
      DictionaryValueType<V> valueType) {
    try (ValuesAccumulator<V> values = create(valueType)) {
      assertEquals(0, values.appendValue(bytes("abc")));
      assertEquals(1, values.appendNull());
      assertEquals(2, values.appendValue(new byte[0]));
      assertEquals(3, values.getValueCount());

      assertEquals("abc", string(values.get(0)));
      assertTrue(values.isNull(1));
      assertNull(values.get(1));
      assertEquals(0, values.get(2).length);

      try (V vector = values.finish()) {
        assertEquals(3, vector.getValueCount());
        assertEquals("abc", string(valueType.get(vector, 0)));
        assertTrue(vector.isNull(1));
        assertEquals(valueType.getArrowType(), vector.getField().getType());
      }
      assertEquals(0, values.getValueCount());

      // the accumulator is reusable after finishing
      assertEquals(0, values.appendValue(bytes("def")));
      try (V vector = values.finish()) {
        assertEquals(1, vector.getValueCount());
        assertEquals("def", string(valueType.get(vector, 0)));
      }
    }
  }

  @ParameterizedTest
  @MethodSource("valueTypes")
  public void testValueEquals(DictionaryValueType<?> valueType) {
    checkValueEquals(valueType);
  }

  private <V extends FieldVector & VariableWidthVector> void checkValueEquals(
      DictionaryValueType<V> valueType) {
    try (ValuesAccumulator<V> values = create(valueType)) {
      values.appendValue(bytes("abc"));
      values.appendNull();
      values.appendValue(new byte[0]);

      assertTrue(values.valueEquals(0, bytes("abc")));
      assertFalse(values.valueEquals(0, bytes("abd")));
      assertFalse(values.valueEquals(0, bytes("ab")));
      assertFalse(values.valueEquals(1, new byte[0]));
      assertTrue(values.valueEquals(2, new byte[0]));
    }
  }

  @Test
  public void testDataPointer() {
    try (ValuesAccumulator<VarCharVector> values = create(DictionaryValueType.UTF8)) {
      values.appendValue(bytes("abc"));
      values.appendNull();

      ArrowBufPointer pointer = values.getDataPointer(0, new ArrowBufPointer());
      assertEquals(3, pointer.getLength());
      assertNull(values.getDataPointer(1, new ArrowBufPointer()).getBuf());
    }
  }

  @Test
  public void testSlotOutOfRange() {
    try (ValuesAccumulator<VarCharVector> values = create(DictionaryValueType.UTF8)) {
      values.appendValue(bytes("abc"));
      assertThrows(IndexOutOfBoundsException.class, () -> values.get(1));
      assertThrows(IndexOutOfBoundsException.class, () -> values.isNull(-1));
      assertThrows(IndexOutOfBoundsException.class, () -> values.valueEquals(1, bytes("abc")));
    }
  }

  @Test
  public void testFinishCloned() {
    try (ValuesAccumulator<VarCharVector> values = create(DictionaryValueType.UTF8)) {
      values.appendValue(bytes("abc"));
      values.appendNull();

      try (VarCharVector cloned = values.finishCloned()) {
        values.appendValue(bytes("def"));
        assertEquals(2, cloned.getValueCount());
        assertEquals("abc", string(cloned.get(0)));
        assertTrue(cloned.isNull(1));
      }
      assertEquals(3, values.getValueCount());
      assertEquals("def", string(values.get(2)));
    }
  }

  @Test
  public void testPreallocated() {
    Field field = Field.nullable("values", ArrowType.Utf8.INSTANCE);
    try (ValuesAccumulator<VarCharVector> values =
        new ValuesAccumulator<>(DictionaryValueType.UTF8, field, allocator, 4, 16L)) {
      for (int i = 0; i < 100; i++) {
        assertEquals(i, values.appendValue(bytes("value" + i)));
      }
      assertEquals("value99", string(values.get(99)));
    }
  }
}
