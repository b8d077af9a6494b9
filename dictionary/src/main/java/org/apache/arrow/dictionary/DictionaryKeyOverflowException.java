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

/**
 * Thrown when a dictionary would need more distinct values than its key type can address.
 *
 * <p>This is raised only when a genuinely new value is inserted; values already present in the
 * dictionary never overflow.
 */
public class DictionaryKeyOverflowException extends Exception {

  private static final long serialVersionUID = 1L;

  private final transient DictionaryKeyType<?> keyType;

  public DictionaryKeyOverflowException(DictionaryKeyType<?> keyType, long slot) {
    super("Dictionary key overflow: slot " + slot + " does not fit in key type " + keyType);
    this.keyType = keyType;
  }

  public DictionaryKeyType<?> getKeyType() {
    return keyType;
  }
}
