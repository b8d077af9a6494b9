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

/**
 * Configuration class to determine the default bound checking of keys merged from an existing
 * dictionary.
 *
 * <p>
 * By default, a key beyond the values of the merged dictionary is clamped to its last value.
 * Strict checking rejects such keys instead. It is enabled by setting either the system property
 * "arrow.dictionary.strict_key_bounds" or the environmental variable
 * "ARROW_DICTIONARY_STRICT_KEY_BOUNDS" to "true". When both are set, the system property takes
 * precedence. A {@link DictionaryBuilderConfig} can override the default per builder.
 * </p>
 */
public class StrictKeyBoundsOption {

  public static final String STRICT_KEY_BOUNDS_PROPERTY = "arrow.dictionary.strict_key_bounds";

  public static final String STRICT_KEY_BOUNDS_ENV = "ARROW_DICTIONARY_STRICT_KEY_BOUNDS";

  public static final boolean STRICT_KEY_BOUNDS_ENABLED;

  static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(StrictKeyBoundsOption.class);

  static {
    STRICT_KEY_BOUNDS_ENABLED =
        isEnabled(System.getProperty(STRICT_KEY_BOUNDS_PROPERTY), System.getenv(STRICT_KEY_BOUNDS_ENV));
    LOGGER.info("Set STRICT_KEY_BOUNDS_ENABLED to " + STRICT_KEY_BOUNDS_ENABLED);
  }

  private StrictKeyBoundsOption() {
  }

  /**
   * Resolves the flag from its two sources. The flag is set only if the effective value is
   * explicitly "true".
   *
   * @param sysProperty the system property value, may be null.
   * @param envProperty the environmental variable value, may be null.
   * @return the resolved flag.
   */
  static boolean isEnabled(String sysProperty, String envProperty) {
    // The system property has a higher priority than the environmental variable.
    String flagValue = sysProperty;
    if (flagValue == null) {
      flagValue = envProperty;
    }
    return "true".equals(flagValue);
  }
}
