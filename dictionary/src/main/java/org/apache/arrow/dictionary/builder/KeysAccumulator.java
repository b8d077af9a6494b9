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
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.util.TransferPair;

/**
 * Append-only store of dictionary keys, one per logical row, each either a slot or null.
 *
 * @param <K> the key vector type.
 */
public class KeysAccumulator<K extends BaseFixedWidthVector & BaseIntVector>
    implements AutoCloseable {

  private final DictionaryKeyType<K> keyType;

  private final Field field;

  private final BufferAllocator allocator;

  private final K vector;

  private int valueCount;

  /**
   * Constructs an accumulator.
   *
   * @param keyType the key type.
   * @param field the field of the produced key vectors, carrying the dictionary encoding.
   * @param allocator the allocator for the key buffers.
   * @param capacity the expected number of keys, 0 if unknown.
   */
  public KeysAccumulator(
      DictionaryKeyType<K> keyType, Field field, BufferAllocator allocator, int capacity) {
    this.keyType = keyType;
    this.field = field;
    this.allocator = allocator;
    this.vector = keyType.createVector(field, allocator);
    if (capacity > 0) {
      vector.allocateNew(capacity);
    } else {
      vector.allocateNew();
    }
  }

  /**
   * Appends a key.
   *
   * @param key the key, which must be representable by the key type.
   */
  public void appendValue(long key) {
    keyType.setSafe(vector, valueCount, key);
    valueCount += 1;
  }

  /**
   * Appends the same key repeatedly.
   *
   * @param key the key, which must be representable by the key type.
   * @param count the number of times to append it.
   */
  public void appendValueN(long key, int count) {
    for (int i = 0; i < count; i++) {
      keyType.setSafe(vector, valueCount + i, key);
    }
    valueCount += count;
  }

  public void appendNull() {
    keyType.setNull(vector, valueCount);
    valueCount += 1;
  }

  /**
   * Appends null keys.
   *
   * @param count the number of nulls to append.
   */
  public void appendNulls(int count) {
    for (int i = 0; i < count; i++) {
      keyType.setNull(vector, valueCount + i);
    }
    valueCount += count;
  }

  /** Gets the number of keys appended so far. */
  public int getValueCount() {
    return valueCount;
  }

  public boolean isNull(int index) {
    checkIndex(index);
    return vector.isNull(index);
  }

  /**
   * Gets a non-null key.
   *
   * @param index the key index.
   * @return the key value.
   */
  public long get(int index) {
    checkIndex(index);
    return vector.getValueAsLong(index);
  }

  /**
   * Gets the validity buffer of the keys appended so far. Only the first {@link
   * #getValueCount()} bits are meaningful.
   */
  public ArrowBuf getValidityBuffer() {
    return vector.getValidityBuffer();
  }

  /**
   * Moves the accumulated keys into a new vector, leaving this accumulator empty.
   *
   * @return the keys vector, owned by the caller.
   */
  public K finish() {
    vector.setValueCount(valueCount);
    K target = keyType.createVector(field, allocator);
    TransferPair transferPair = vector.makeTransferPair(target);
    transferPair.transfer();
    valueCount = 0;
    vector.allocateNew();
    return target;
  }

  /**
   * Copies the accumulated keys into a new vector. This accumulator is left unchanged.
   *
   * @return the keys vector, owned by the caller.
   */
  public K finishCloned() {
    vector.setValueCount(valueCount);
    K target = keyType.createVector(field, allocator);
    target.allocateNew(Math.max(valueCount, 1));
    for (int i = 0; i < valueCount; i++) {
      target.copyFromSafe(i, i, vector);
    }
    target.setValueCount(valueCount);
    return target;
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= valueCount) {
      throw new IndexOutOfBoundsException(
          "Index " + index + " is out of range [0, " + valueCount + ")");
    }
  }

  @Override
  public void close() {
    vector.close();
  }
}
