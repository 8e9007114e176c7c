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

import com.google.common.collect.ImmutableList;

/** The error manager is in charge of storing, organizing and displaying diagnostics. */
public interface ErrorManager {

  /**
   * Reports an error. The level will be taken into account by the manager when it displays the
   * diagnostics.
   */
  void report(CheckLevel level, RewriteError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<RewriteError> getErrors();

  ImmutableList<RewriteError> getWarnings();
}
