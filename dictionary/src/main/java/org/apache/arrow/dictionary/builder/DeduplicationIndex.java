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

import java.util.Arrays;
import org.apache.arrow.util.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hash index from value bytes to the slot holding them in a {@link ValuesAccumulator}.
 *
 * <p>The index keeps only slots and their hash codes, never the bytes themselves: candidates
 * with a matching hash are resolved by comparing against the bytes stored in the accumulator.
 * Collisions are handled by linear probing in a power-of-two table.
 */
public class DeduplicationIndex {

  private static final Logger logger = LoggerFactory.getLogger(DeduplicationIndex.class);

  /**
   * Marks an empty bucket.
   */
  static final int EMPTY = -1;

  /**
   * The default initial capacity - MUST be a power of two.
   */
  static final int DEFAULT_INITIAL_CAPACITY = 1 << 4;

  /**
   * The maximum capacity, bounded by the int-indexed bucket arrays.
   */
  static final int MAXIMUM_CAPACITY = 1 << 30;

  /**
   * Fraction of buckets that may be occupied before the table doubles.
   */
  static final float LOAD_FACTOR = 0.5f;

  private final ValueHasher hasher;

  /**
   * Slot per bucket, or {@link #EMPTY}.
   */
  private int[] slots;

  /**
   * Hash code of the value in each occupied bucket, so that growing never re-reads values.
   */
  private long[] hashes;

  /**
   * The number of occupied buckets.
   */
  private int size;

  /**
   * The size at which the table doubles.
   */
  private int threshold;

  /**
   * Constructs an index.
   *
   * @param hasher the hasher for value bytes, fixed for the lifetime of the index.
   * @param expectedSize the expected number of distinct values, 0 if unknown.
   */
  public DeduplicationIndex(ValueHasher hasher, int expectedSize) {
    Preconditions.checkArgument(expectedSize >= 0, "Illegal expected size: %s", expectedSize);
    this.hasher = Preconditions.checkNotNull(hasher);
    int capacity = roundUpToPowerOf2(Math.max(DEFAULT_INITIAL_CAPACITY,
        (int) Math.min((long) (expectedSize / LOAD_FACTOR) + 1, MAXIMUM_CAPACITY)));
    allocate(capacity);
  }

  /**
   * Gets the slot of a value, appending it to the accumulator and indexing it if it is absent.
   *
   * @param value the value bytes.
   * @param values the accumulator holding the indexed values.
   * @return the slot of the existing or newly appended value.
   */
  public int getOrInsert(byte[] value, ValuesAccumulator<?> values) {
    long hash = hasher.hash(value);
    int bucket = probe(hash, value, values);
    int slot = slots[bucket];
    if (slot != EMPTY) {
      return slot;
    }
    slot = values.appendValue(value);
    insertAt(bucket, hash, slot);
    return slot;
  }

  /**
   * Indexes a slot that was already appended to the accumulator, unless an equal value is
   * indexed already, in which case the earlier slot is kept.
   *
   * @param value the bytes stored in the slot.
   * @param slot the slot.
   * @param values the accumulator holding the indexed values.
   * @return true if the slot was indexed.
   */
  public boolean putIfAbsent(byte[] value, int slot, ValuesAccumulator<?> values) {
    long hash = hasher.hash(value);
    int bucket = probe(hash, value, values);
    if (slots[bucket] != EMPTY) {
      return false;
    }
    insertAt(bucket, hash, slot);
    return true;
  }

  /**
   * Finds the slot of a value.
   *
   * @param value the value bytes.
   * @param values the accumulator holding the indexed values.
   * @return the slot, or -1 if the value is not indexed.
   */
  public int find(byte[] value, ValuesAccumulator<?> values) {
    return slots[probe(hasher.hash(value), value, values)];
  }

  /** Gets the number of indexed values. */
  public int size() {
    return size;
  }

  int capacity() {
    return slots.length;
  }

  /**
   * Removes all entries, keeping the allocated table.
   */
  public void clear() {
    Arrays.fill(slots, EMPTY);
    size = 0;
  }

  /**
   * Finds the bucket holding an equal value, or the empty bucket where it belongs.
   */
  private int probe(long hash, byte[] value, ValuesAccumulator<?> values) {
    int mask = slots.length - 1;
    int bucket = indexFor(hash, slots.length);
    while (true) {
      int slot = slots[bucket];
      if (slot == EMPTY) {
        return bucket;
      }
      if (hashes[bucket] == hash && values.valueEquals(slot, value)) {
        return bucket;
      }
      bucket = (bucket + 1) & mask;
    }
  }

  private void insertAt(int bucket, long hash, int slot) {
    Preconditions.checkState(size < slots.length - 1, "Deduplication index is full");
    slots[bucket] = slot;
    hashes[bucket] = hash;
    size++;
    if (size > threshold) {
      resize(2 * slots.length);
    }
  }

  private void resize(int newCapacity) {
    int oldCapacity = slots.length;
    if (oldCapacity == MAXIMUM_CAPACITY) {
      threshold = Integer.MAX_VALUE;
      return;
    }
    logger.debug("Growing deduplication index from {} to {} buckets", oldCapacity, newCapacity);

    int[] oldSlots = slots;
    long[] oldHashes = hashes;
    allocate(newCapacity);

    int mask = newCapacity - 1;
    for (int i = 0; i < oldCapacity; i++) {
      if (oldSlots[i] == EMPTY) {
        continue;
      }
      int bucket = indexFor(oldHashes[i], newCapacity);
      while (slots[bucket] != EMPTY) {
        bucket = (bucket + 1) & mask;
      }
      slots[bucket] = oldSlots[i];
      hashes[bucket] = oldHashes[i];
    }
  }

  private void allocate(int capacity) {
    slots = new int[capacity];
    Arrays.fill(slots, EMPTY);
    hashes = new long[capacity];
    threshold = (int) (capacity * LOAD_FACTOR);
  }

  /**
   * Computes the bucket in a table of the given power-of-two length.
   */
  static int indexFor(long hash, int length) {
    return (int) (hash ^ (hash >>> 32)) & (length - 1);
  }

  /**
   * Returns a power of two size for the given size.
   */
  static int roundUpToPowerOf2(int size) {
    int n = size - 1;
    n |= n >>> 1;
    n |= n >>> 2;
    n |= n >>> 4;
    n |= n >>> 8;
    n |= n >>> 16;
    return (n < 0) ? 1 : (n >= MAXIMUM_CAPACITY) ? MAXIMUM_CAPACITY : n + 1;
  }
}
