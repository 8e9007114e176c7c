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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * A diagnostic raised while scheduling or running rewrite passes.
 *
 * @param type The type of the diagnostic.
 * @param description The formatted message.
 * @param passName The pass the diagnostic concerns, if any.
 * @param defaultLevel The level the diagnostic is reported at unless overridden.
 */
public record RewriteError(
    DiagnosticType type, String description, @Nullable String passName, CheckLevel defaultLevel) {
  public RewriteError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a RewriteError that is not tied to a pass.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RewriteError make(DiagnosticType type, String... arguments) {
    return new RewriteError(type, type.format(arguments), null, type.level);
  }

  /**
   * Creates a RewriteError concerning the named pass.
   *
   * @param passName The pass name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RewriteError forPass(String passName, DiagnosticType type, String... arguments) {
    return new RewriteError(type, type.format(arguments), passName, type.level);
  }

  /** Formats this error as a single line, as the text report and the logger print it. */
  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (passName != null) {
      b.append(passName).append(": ");
    }
    b.append(level == CheckLevel.ERROR ? "ERROR" : "WARNING")
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description);
    return b.toString();
  }

  @Override
  public String toString() {
    return type.key + ". " + description + (passName == null ? "" : " in " + passName);
  }
}
