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
package com.github.blobprovider.utils;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;


/**
 * A set of utility methods
 */
public final class Utils {

  private Utils() {
  }

  /**
   * Instantiate a class from its name, using the first declared constructor whose parameters accept {@code args}.
   * @param className the fully qualified class name.
   * @param args the constructor arguments. A {@code null} argument matches any reference parameter.
   * @param <T> the expected type of the instance.
   * @return the new instance.
   * @throws ClassNotFoundException if the class cannot be loaded.
   * @throws NoSuchMethodException if no constructor accepts {@code args}.
   * @throws InstantiationException if the class is abstract.
   * @throws IllegalAccessException if the matching constructor is not accessible.
   * @throws InvocationTargetException if the constructor throws.
   */
  @SuppressWarnings("unchecked")
  public static <T> T getObj(String className, Object... args)
      throws ClassNotFoundException, NoSuchMethodException, InstantiationException, IllegalAccessException,
             InvocationTargetException {
    for (Constructor<?> ctor : Class.forName(className).getDeclaredConstructors()) {
      Class<?>[] paramTypes = ctor.getParameterTypes();
      if (paramTypes.length != args.length) {
        continue;
      }
      boolean matches = true;
      for (int i = 0; i < args.length && matches; i++) {
        matches = args[i] == null ? !paramTypes[i].isPrimitive() : wrap(paramTypes[i]).isInstance(args[i]);
      }
      if (matches) {
        return (T) ctor.newInstance(args);
      }
    }
    throw new NoSuchMethodException("No constructor of " + className + " accepts " + args.length + " argument(s)");
  }

  /**
   * Load a properties file.
   * @param filename the path of the file.
   * @return the loaded {@link Properties}.
   * @throws IOException if the file cannot be read.
   */
  public static Properties loadProps(String filename) throws IOException {
    Path path = Paths.get(filename);
    Properties props = new Properties();
    try (InputStream propStream = Files.newInputStream(path)) {
      props.load(propStream);
    }
    return props;
  }

  /**
   * @param value the value to check.
   * @param message the message of the exception thrown when the check fails.
   * @return {@code value}, if it is neither {@code null} nor empty.
   * @throws IllegalArgumentException if {@code value} is {@code null} or empty.
   */
  public static String checkNotNullOrEmpty(String value, String message) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(message);
    }
    return value;
  }

  private static Class<?> wrap(Class<?> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    if (type == int.class) {
      return Integer.class;
    } else if (type == long.class) {
      return Long.class;
    } else if (type == boolean.class) {
      return Boolean.class;
    } else if (type == short.class) {
      return Short.class;
    } else if (type == byte.class) {
      return Byte.class;
    } else if (type == char.class) {
      return Character.class;
    } else if (type == float.class) {
      return Float.class;
    }
    return Double.class;
  }
}
