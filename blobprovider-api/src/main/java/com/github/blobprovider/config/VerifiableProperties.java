/**
 * Copyright 2026 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 */
package com.github.blobprovider.config;

import java.util.Collections;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A {@link Properties} view that parses and range-checks values for the config classes, and remembers which
 * properties were read so that unused (likely misspelled) ones can be reported by {@link #verify()}.
 */
public class VerifiableProperties {

  private static final Logger logger = LoggerFactory.getLogger(VerifiableProperties.class);
  private final Set<String> referencedNames = Collections.newSetFromMap(new ConcurrentHashMap<>());
  private final Properties props;

  public VerifiableProperties(Properties props) {
    this.props = props;
  }

  public boolean containsKey(String name) {
    return props.containsKey(name);
  }

  public String getProperty(String name) {
    referencedNames.add(name);
    return props.getProperty(name);
  }

  /**
   * Get a required string property.
   * @param name the property name.
   * @return the value.
   * @throws IllegalArgumentException if the property is not defined.
   */
  public String getString(String name) {
    if (!containsKey(name)) {
      throw new IllegalArgumentException("Missing required property '" + name + "'");
    }
    return getProperty(name);
  }

  /**
   * Get a string property, or {@code defaultVal} if it is not defined.
   */
  public String getString(String name, String defaultVal) {
    return containsKey(name) ? getProperty(name) : defaultVal;
  }

  /**
   * Read an integer property.
   * @param name the property name.
   * @param defaultVal the value to use if the property is not defined.
   * @return the integer value.
   */
  public int getInt(String name, int defaultVal) {
    return getIntInRange(name, defaultVal, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  /**
   * Read an integer property and check that it falls in {@code [start, end]}.
   * @param name the property name.
   * @param defaultVal the value to use if the property is not defined.
   * @param start the lowest allowed value (inclusive).
   * @param end the highest allowed value (inclusive).
   * @return the integer value.
   * @throws IllegalArgumentException if the value is not a number or is out of range.
   */
  public int getIntInRange(String name, int defaultVal, int start, int end) {
    int v = containsKey(name) ? parse(name, Integer::parseInt) : defaultVal;
    if (v < start || v > end) {
      throw new IllegalArgumentException(
          name + " has value " + v + " which is not in the range " + start + "-" + end + ".");
    }
    return v;
  }

  /**
   * Read a long property and check that it falls in {@code [start, end]}.
   */
  public long getLongInRange(String name, long defaultVal, long start, long end) {
    long v = containsKey(name) ? parse(name, Long::parseLong) : defaultVal;
    if (v < start || v > end) {
      throw new IllegalArgumentException(
          name + " has value " + v + " which is not in the range " + start + "-" + end + ".");
    }
    return v;
  }

  /**
   * Read a boolean property. Only the literals {@code true} and {@code false} are accepted.
   * @param name the property name.
   * @param defaultVal the value to use if the property is not defined.
   * @return the boolean value.
   */
  public boolean getBoolean(String name, boolean defaultVal) {
    if (!containsKey(name)) {
      return defaultVal;
    }
    String v = getProperty(name).trim();
    if (!"true".equals(v) && !"false".equals(v)) {
      throw new IllegalArgumentException(name + " has value " + v + " which is not true or false.");
    }
    return Boolean.parseBoolean(v);
  }

  /**
   * Log every property that no config class has read.
   */
  public void verify() {
    logger.info("Verifying properties");
    for (String name : props.stringPropertyNames()) {
      if (!referencedNames.contains(name)) {
        logger.warn("Property {} is not valid", name);
      } else {
        logger.info("Property {} is overridden to {}", name, props.getProperty(name));
      }
    }
  }

  private <T> T parse(String name, NumberParser<T> parser) {
    String value = getProperty(name);
    try {
      return parser.parse(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " has value " + value + " which is not a number.", e);
    }
  }

  private interface NumberParser<T> {
    T parse(String value);
  }

  @Override
  public String toString() {
    return props.toString();
  }
}
