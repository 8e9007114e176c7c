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

import java.io.PrintStream;

/** An error report generator that prints errors and warnings to the print stream provided. */
public class PrintStreamErrorReportGenerator implements SortingErrorManager.ErrorReportGenerator {
  private final PrintStream stream;

  /**
   * Creates an error report generator.
   *
   * @param stream the stream on which the errors and warnings should be printed. This class does
   *     not close the stream
   */
  public PrintStreamErrorReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  @Override
  public void generateReport(SortingErrorManager manager) {
    for (SortingErrorManager.ErrorWithLevel e : manager.getSortedDiagnostics()) {
      stream.println(e.error.format(e.level));
    }
    if (manager.getErrorCount() + manager.getWarningCount() > 0) {
      stream.printf(
          "%d error(s), %d warning(s)%n", manager.getErrorCount(), manager.getWarningCount());
    }
  }
}
