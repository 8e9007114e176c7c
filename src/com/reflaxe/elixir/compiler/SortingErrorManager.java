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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A customizable error manager that sorts all errors and warnings reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(CheckLevel level, RewriteError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<RewriteError> getErrors() {
    return collect(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<RewriteError> getWarnings() {
    return collect(CheckLevel.WARNING);
  }

  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<RewriteError> collect(CheckLevel level) {
    ImmutableList.Builder<RewriteError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : this.errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by level (errors first), then pass name (pass-less diagnostics first), then
   * description.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Comparator<String> NULLS_FIRST =
        Comparator.nullsFirst(Comparator.<String>naturalOrder());

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }
      int passCompare = NULLS_FIRST.compare(p1.error.passName(), p2.error.passName());
      if (passCompare != 0) {
        return passCompare;
      }
      int keyCompare = p1.error.type().compareTo(p2.error.type());
      if (keyCompare != 0) {
        return keyCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final RewriteError error;
    final CheckLevel level;

    ErrorWithLevel(RewriteError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error.type(), error.description(), error.passName());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return level == e.level
          && error.type().equals(e.error.type())
          && error.description().equals(e.error.description())
          && Objects.equals(error.passName(), e.error.passName());
    }
  }
}
