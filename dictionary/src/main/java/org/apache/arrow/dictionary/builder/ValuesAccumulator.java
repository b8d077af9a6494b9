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

import org.apache.arrow.dictionary.DictionaryValueType;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VariableWidthVector;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.util.TransferPair;

/**
 * Append-only store of the distinct dictionary values. Each appended value or null occupies the
 * next slot, starting from 0. Slots are never modified or removed.
 *
 * @param <V> the value vector type.
 */
public class ValuesAccumulator<V extends FieldVector & VariableWidthVector>
    implements AutoCloseable {

  private final DictionaryValueType<V> valueType;

  private final Field field;

  private final BufferAllocator allocator;

  private final V vector;

  /**
   * The pointer used to address stored values when comparing them.
   */
  private final ArrowBufPointer reusablePointer = new ArrowBufPointer();

  private int valueCount;

  /**
   * Constructs an accumulator.
   *
   * @param valueType the value type.
   * @param field the field of the produced value vectors.
   * @param allocator the allocator for the value buffers.
   * @param valueCapacity the expected number of distinct values, 0 if unknown.
   * @param dataCapacity the expected total number of value bytes, 0 if unknown.
   */
  public ValuesAccumulator(
      DictionaryValueType<V> valueType,
      Field field,
      BufferAllocator allocator,
      int valueCapacity,
      long dataCapacity) {
    this.valueType = valueType;
    this.field = field;
    this.allocator = allocator;
    this.vector = valueType.createVector(field, allocator);
    if (valueCapacity > 0 || dataCapacity > 0) {
      vector.allocateNew(dataCapacity, valueCapacity);
    } else {
      vector.allocateNew();
    }
  }

  /**
   * Appends a value.
   *
   * @param value the value bytes.
   * @return the slot of the new value.
   */
  public int appendValue(byte[] value) {
    int slot = valueCount;
    valueType.setSafe(vector, slot, value);
    valueCount += 1;
    return slot;
  }

  /**
   * Appends a null slot.
   *
   * @return the slot of the null.
   */
  public int appendNull() {
    int slot = valueCount;
    valueType.setNull(vector, slot);
    valueCount += 1;
    return slot;
  }

  /** Gets the number of slots appended so far. */
  public int getValueCount() {
    return valueCount;
  }

  public boolean isNull(int slot) {
    checkSlot(slot);
    return vector.isNull(slot);
  }

  /**
   * Points at the bytes of a stored value, without copying them.
   *
   * @param slot the slot, which must already be appended.
   * @param reuse the pointer to populate.
   * @return the populated pointer; its buffer is null for a null slot.
   */
  public ArrowBufPointer getDataPointer(int slot, ArrowBufPointer reuse) {
    checkSlot(slot);
    vector.getDataPointer(slot, reuse);
    return reuse;
  }

  /**
   * Gets a copy of a stored value.
   *
   * @param slot the slot, which must already be appended.
   * @return the bytes, or null for a null slot.
   */
  public byte[] get(int slot) {
    checkSlot(slot);
    return valueType.get(vector, slot);
  }

  /**
   * Checks if the value in a slot has exactly the given bytes. A null slot equals nothing.
   *
   * @param slot the slot, which must already be appended.
   * @param value the bytes to compare with.
   * @return true if the stored bytes are equal to the given ones.
   */
  public boolean valueEquals(int slot, byte[] value) {
    getDataPointer(slot, reusablePointer);
    ArrowBuf buf = reusablePointer.getBuf();
    if (buf == null) {
      return false;
    }
    long length = reusablePointer.getLength();
    if (length != value.length) {
      return false;
    }
    long offset = reusablePointer.getOffset();
    for (int i = 0; i < value.length; i++) {
      if (buf.getByte(offset + i) != value[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Moves the accumulated values into a new vector, leaving this accumulator empty.
   *
   * @return the values vector, owned by the caller.
   */
  public V finish() {
    vector.setValueCount(valueCount);
    V target = valueType.createVector(field, allocator);
    TransferPair transferPair = vector.makeTransferPair(target);
    transferPair.transfer();
    valueCount = 0;
    vector.allocateNew();
    return target;
  }

  /**
   * Copies the accumulated values into a new vector. This accumulator is left unchanged.
   *
   * @return the values vector, owned by the caller.
   */
  public V finishCloned() {
    vector.setValueCount(valueCount);
    V target = valueType.createVector(field, allocator);
    target.allocateNew();
    for (int i = 0; i < valueCount; i++) {
      target.copyFromSafe(i, i, vector);
    }
    target.setValueCount(valueCount);
    return target;
  }

  private void checkSlot(int slot) {
    if (slot < 0 || slot >= valueCount) {
      throw new IndexOutOfBoundsException(
          "Slot " + slot + " is out of range [0, " + valueCount + ")");
    }
  }

  @Override
  public void close() {
    vector.close();
  }
}
