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

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;

/**
 * This class configures a {@link ByteDictionaryBuilder}.
 */
public class DictionaryBuilderConfig {

  public static final String DEFAULT_NAME = "dictionary";

  public static final long DEFAULT_DICTIONARY_ID = 0L;

  private final BufferAllocator allocator;

  /**
   * The name of the fields of the produced vectors.
   */
  private final String name;

  /**
   * The id written to the dictionary encoding of the produced keys.
   */
  private final long dictionaryId;

  /**
   * Expected number of keys, i.e. rows. Only used to pre-allocate.
   */
  private final int keysCapacity;

  /**
   * Expected number of distinct values. Only used to pre-allocate.
   */
  private final int valuesCapacity;

  /**
   * Expected total bytes of the distinct values. Only used to pre-allocate.
   */
  private final long dataCapacity;

  /**
   * Seed of the value hasher. When null, each builder draws a random one.
   */
  private final Integer hashSeed;

  /**
   * If keys beyond the values of a merged dictionary are rejected rather than clamped.
   */
  private final boolean strictKeyBounds;

  public DictionaryBuilderConfig(BufferAllocator allocator) {
    this(allocator, DEFAULT_NAME, DEFAULT_DICTIONARY_ID, 0, 0, 0L, null,
        StrictKeyBoundsOption.STRICT_KEY_BOUNDS_ENABLED);
  }

  /**
   * Instantiate an instance.
   * @param allocator The memory allocator for the accumulated and produced vectors.
   * @param name The name of the fields of the produced vectors.
   * @param dictionaryId The id of the produced dictionary encoding.
   * @param keysCapacity Expected number of keys.
   * @param valuesCapacity Expected number of distinct values.
   * @param dataCapacity Expected total bytes of the distinct values.
   * @param hashSeed Seed of the value hasher, or null to draw a random seed per builder.
   * @param strictKeyBounds If out-of-range keys of merged dictionaries are rejected.
   */
  public DictionaryBuilderConfig(
      BufferAllocator allocator,
      String name,
      long dictionaryId,
      int keysCapacity,
      int valuesCapacity,
      long dataCapacity,
      Integer hashSeed,
      boolean strictKeyBounds) {
    Preconditions.checkNotNull(allocator, "allocator cannot be null");
    Preconditions.checkNotNull(name, "name cannot be null");
    Preconditions.checkArgument(keysCapacity >= 0, "invalid keysCapacity: %s", keysCapacity);
    Preconditions.checkArgument(valuesCapacity >= 0, "invalid valuesCapacity: %s", valuesCapacity);
    Preconditions.checkArgument(dataCapacity >= 0, "invalid dataCapacity: %s", dataCapacity);

    this.allocator = allocator;
    this.name = name;
    this.dictionaryId = dictionaryId;
    this.keysCapacity = keysCapacity;
    this.valuesCapacity = valuesCapacity;
    this.dataCapacity = dataCapacity;
    this.hashSeed = hashSeed;
    this.strictKeyBounds = strictKeyBounds;
  }

  public BufferAllocator getAllocator() {
    return allocator;
  }

  public String getName() {
    return name;
  }

  public long getDictionaryId() {
    return dictionaryId;
  }

  public int getKeysCapacity() {
    return keysCapacity;
  }

  public int getValuesCapacity() {
    return valuesCapacity;
  }

  public long getDataCapacity() {
    return dataCapacity;
  }

  public Integer getHashSeed() {
    return hashSeed;
  }

  public boolean isStrictKeyBounds() {
    return strictKeyBounds;
  }

  /**
   * Creates the value hasher for one builder: seeded with the configured seed, or a random one.
   */
  ValueHasher createHasher() {
    if (hashSeed == null) {
      return MurmurValueHasher.withRandomSeed();
    }
    return new MurmurValueHasher(hashSeed);
  }
}
