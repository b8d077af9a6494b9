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

/**
 * This class builds {@link DictionaryBuilderConfig}s.
 */
public class DictionaryBuilderConfigBuilder {

  private BufferAllocator allocator;

  private String name;

  private long dictionaryId;

  private int keysCapacity;

  private int valuesCapacity;

  private long dataCapacity;

  private Integer hashSeed;

  private boolean strictKeyBounds;

  /**
   * Default constructor for the {@link DictionaryBuilderConfigBuilder}.
   */
  public DictionaryBuilderConfigBuilder(BufferAllocator allocator) {
    this.allocator = allocator;
    this.name = DictionaryBuilderConfig.DEFAULT_NAME;
    this.dictionaryId = DictionaryBuilderConfig.DEFAULT_DICTIONARY_ID;
    this.strictKeyBounds = StrictKeyBoundsOption.STRICT_KEY_BOUNDS_ENABLED;
  }

  public DictionaryBuilderConfigBuilder setAllocator(BufferAllocator allocator) {
    this.allocator = allocator;
    return this;
  }

  public DictionaryBuilderConfigBuilder setName(String name) {
    this.name = name;
    return this;
  }

  public DictionaryBuilderConfigBuilder setDictionaryId(long dictionaryId) {
    this.dictionaryId = dictionaryId;
    return this;
  }

  /**
   * Sets the pre-allocation hints.
   *
   * @param keysCapacity the number of keys, i.e. the length of the array to build.
   * @param valuesCapacity the number of distinct values, i.e. the size of the dictionary.
   * @param dataCapacity the total number of bytes of all distinct values.
   */
  public DictionaryBuilderConfigBuilder setCapacities(
      int keysCapacity, int valuesCapacity, long dataCapacity) {
    this.keysCapacity = keysCapacity;
    this.valuesCapacity = valuesCapacity;
    this.dataCapacity = dataCapacity;
    return this;
  }

  public DictionaryBuilderConfigBuilder setKeysCapacity(int keysCapacity) {
    this.keysCapacity = keysCapacity;
    return this;
  }

  public DictionaryBuilderConfigBuilder setHashSeed(Integer hashSeed) {
    this.hashSeed = hashSeed;
    return this;
  }

  public DictionaryBuilderConfigBuilder setStrictKeyBounds(boolean strictKeyBounds) {
    this.strictKeyBounds = strictKeyBounds;
    return this;
  }

  /**
   * This builds the {@link DictionaryBuilderConfig} from the provided params.
   */
  public DictionaryBuilderConfig build() {
    return new DictionaryBuilderConfig(
        allocator,
        name,
        dictionaryId,
        keysCapacity,
        valuesCapacity,
        dataCapacity,
        hashSeed,
        strictKeyBounds);
  }
}
