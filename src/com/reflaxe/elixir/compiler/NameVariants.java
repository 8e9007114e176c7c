/*
 * Copyright 2026 The Reflaxe Elixir Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.reflaxe.elixir.compiler;

import org.jspecify.annotations.Nullable;

/**
 * Spelling variants of a variable name.
 *
 * <p>The front end can emit the same variable as {@code userId}, {@code user_id} or {@code
 * _user_id} depending on which lowering produced it. Two names are variants of each other when
 * they share a {@link #canonicalKey}.
 */
public final class NameVariants {

  private NameVariants() {}

  /**
   * Returns the key shared by all variants of {@code name}: leading underscores stripped, camelCase
   * split into snake_case, lower-cased. Returns the empty string for {@code _}.
   */
  public static String canonicalKey(String name) {
    int start = 0;
    while (start < name.length() && name.charAt(start) == '_') {
      start++;
    }
    return toSnakeCase(name.substring(start));
  }

  /** Whether {@code a} and {@code b} name the same variable modulo casing and hygiene prefixes. */
  public static boolean areVariants(@Nullable String a, @Nullable String b) {
    if (a == null || b == null || isIgnored(a) || isIgnored(b)) {
      return false;
    }
    return a.equals(b) || canonicalKey(a).equals(canonicalKey(b));
  }

  /** Whether the name is {@code null} or the bare wildcard, neither of which is ever a use. */
  public static boolean isIgnored(@Nullable String name) {
    return name == null || name.isEmpty() || name.equals("_");
  }

  /** Whether the name contains an upper-case letter after its first character. */
  public static boolean isCamelCase(String name) {
    for (int i = 1; i < name.length(); i++) {
      if (Character.isUpperCase(name.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Converts a camelCase name to snake_case, keeping any leading underscores and trailing
   * {@code ?}/{@code !}. {@code HTTPServer} becomes {@code http_server}.
   */
  public static String toSnakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
          char prev = name.charAt(i - 1);
          boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
          if (Character.isLowerCase(prev)
              || Character.isDigit(prev)
              || (Character.isUpperCase(prev) && nextIsLower)) {
            sb.append('_');
          }
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /** Returns {@code name} with a hygiene underscore prefix, unless it already has one. */
  public static String underscored(String name) {
    return name.startsWith("_") ? name : "_" + name;
  }
}
