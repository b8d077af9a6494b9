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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;
import org.apache.arrow.dictionary.DictionaryKeyType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVectorHelper;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Test cases for {@link KeysAccumulator}.
 */
public class TestKeysAccumulator {

  private BufferAllocator allocator;

  @BeforeEach
  public void prepare() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @AfterEach
  public void shutdown() {
    allocator.close();
  }

  static Stream<DictionaryKeyType<?>> keyTypes() {
    return DictionaryKeyType.values().stream();
  }

  private <K extends BaseFixedWidthVector & BaseIntVector> KeysAccumulator<K> create(
      DictionaryKeyType<K> keyType, int capacity) {
    Field field = new Field("keys", FieldType.nullable(keyType.getArrowType()), null);
    return new KeysAccumulator<>(keyType, field, allocator, capacity);
  }

  @ParameterizedTest
  @MethodSource("keyTypes")
  public void testAppendAndFinish(DictionaryKeyType<?> keyType) {
    checkAppendAndFinish(keyType);
  }

  private <K extends BaseFixedWidthVector & BaseIntVector> void checkAppendAndFinish(
      DictionaryKeyType<K> keyType) {
    long maxKey = keyType.getMaxSlot();
    try (KeysAccumulator<K> keys = create(keyType, 0)) {
      keys.appendValue(0);
      keys.appendNull();
      keys.appendValue(maxKey);
      keys.appendValueN(3, 2);
      keys.appendNulls(2);
      assertEquals(7, keys.getValueCount());

      assertEquals(0L, keys.get(0));
      assertTrue(keys.isNull(1));
      assertEquals(maxKey, keys.get(2));
      assertEquals(3L, keys.get(4));
      assertTrue(keys.isNull(6));

      try (K vector = keys.finish()) {
        assertEquals(7, vector.getValueCount());
        assertEquals(maxKey, vector.getValueAsLong(2));
        assertTrue(vector.isNull(5));
        assertFalse(vector.isNull(3));
        assertEquals(keyType.getArrowType(), vector.getField().getType());
      }
      assertEquals(0, keys.getValueCount());
    }
  }

  @Test
  public void testValidityBuffer() {
    try (KeysAccumulator<UInt1Vector> keys = create(DictionaryKeyType.UINT8, 4)) {
      keys.appendNull();
      keys.appendValue(255);
      assertEquals(0, BitVectorHelper.get(keys.getValidityBuffer(), 0));
      assertEquals(1, BitVectorHelper.get(keys.getValidityBuffer(), 1));
      assertEquals(255L, keys.get(1));
    }
  }

  @Test
  public void testGrowBeyondCapacity() {
    try (KeysAccumulator<UInt1Vector> keys = create(DictionaryKeyType.UINT8, 2)) {
      keys.appendValueN(7, 5000);
      keys.appendNulls(5000);
      assertEquals(10000, keys.getValueCount());
      assertEquals(7L, keys.get(4999));
      assertTrue(keys.isNull(9999));
    }
  }

  @Test
  public void testFinishCloned() {
    try (KeysAccumulator<UInt1Vector> keys = create(DictionaryKeyType.UINT8, 0)) {
      keys.appendValue(1);
      keys.appendNull();
      try (UInt1Vector cloned = keys.finishCloned()) {
        keys.appendValue(2);
        assertEquals(2, cloned.getValueCount());
        assertEquals(1L, cloned.getValueAsLong(0));
        assertTrue(cloned.isNull(1));
      }
      assertEquals(3, keys.getValueCount());
    }
  }

  @Test
  public void testIndexOutOfRange() {
    try (KeysAccumulator<UInt1Vector> keys = create(DictionaryKeyType.UINT8, 0)) {
      assertThrows(IndexOutOfBoundsException.class, () -> keys.get(0));
      assertThrows(IndexOutOfBoundsException.class, () -> keys.isNull(0));
    }
  }
}
