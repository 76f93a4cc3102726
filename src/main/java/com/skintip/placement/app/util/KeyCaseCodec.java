package com.skintip.placement.app.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive snake_case / camelCase key conversion for maps and lists at the API boundary. Values
 * that are neither maps nor lists are returned untouched.
 */
public final class KeyCaseCodec {

  private static final Pattern SNAKE_OR_KEBAB = Pattern.compile("[-_]([a-zA-Z])");
  private static final Pattern UPPER = Pattern.compile("([A-Z])");

  private KeyCaseCodec() {}

  public static String toCamel(String key) {
    if (key == null) return null;
    Matcher m = SNAKE_OR_KEBAB.matcher(key);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      m.appendReplacement(sb, m.group(1).toUpperCase());
    }
    m.appendTail(sb);
    return sb.toString();
  }

  static String toSnake(String key) {
    if (key == null) return null;
    return UPPER.matcher(key).replaceAll(r -> "_" + r.group(1).toLowerCase());
  }

  public static Object toCamelKeys(Object value) {
    return convert(value, true);
  }

  static Object toSnakeKeys(Object value) {
    return convert(value, false);
  }

  private static Object convert(Object value, boolean camel) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : map.entrySet()) {
        String k = String.valueOf(e.getKey());
        out.put(camel ? toCamel(k) : toSnake(k), convert(e.getValue(), camel));
      }
      return out;
    }
    if (value instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object o : list) out.add(convert(o, camel));
      return out;
    }
    return value;
  }
}
