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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A {@link ValueHasher} based on the 128-bit Murmur3 hash, truncated to 64 bits.
 *
 * <p>The seed is fixed at construction. Builders draw a random seed each, so that inputs crafted
 * to collide for one builder are unlikely to collide for another.
 */
public class MurmurValueHasher implements ValueHasher {

  private final int seed;

  private final HashFunction hashFunction;

  public MurmurValueHasher(int seed) {
    this.seed = seed;
    this.hashFunction = Hashing.murmur3_128(seed);
  }

  /** Creates a hasher with a randomly drawn seed. */
  public static MurmurValueHasher withRandomSeed() {
    return new MurmurValueHasher(ThreadLocalRandom.current().nextInt());
  }

  public int getSeed() {
    return seed;
  }

  @Override
  public long hash(byte[] value) {
    return hashFunction.hashBytes(value).asLong();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MurmurValueHasher that = (MurmurValueHasher) o;
    return seed == that.seed;
  }

  @Override
  public int hashCode() {
    return seed;
  }
}
