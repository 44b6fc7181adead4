// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

public class SystemPropertyUtils {

  public static String getSystemPropertyOrDefault(String propertyName, String defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    return propertyValue != null ? propertyValue : defaultValue;
  }

  public static boolean parseSystemPropertyOrDefault(String propertyName, boolean defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null) {
      return defaultValue;
    }
    return propertyValue.isEmpty() || Boolean.parseBoolean(propertyValue);
  }

  public static int parseSystemPropertyOrDefault(String propertyName, int defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(propertyValue);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value for system property " + propertyName + ": " + propertyValue, e);
    }
  }
}
