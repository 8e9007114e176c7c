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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LoggerErrorManager}. */
@RunWith(JUnit4.class)
public final class LoggerErrorManagerTest {

  private static final DiagnosticType BROKEN =
      DiagnosticType.error("ELIXIR_TEST_BROKEN", "Broken: {0}");
  private static final DiagnosticType ODD = DiagnosticType.warning("ELIXIR_TEST_ODD", "Odd: {0}");

  private final Logger logger = Logger.getLogger(LoggerErrorManagerTest.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  @Before
  public void setUp() {
    logger.setUseParentHandlers(false);
    logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
  }

  @Test
  public void testErrorsBeforeWarnings() {
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(CheckLevel.WARNING, RewriteError.forPass("b", ODD, "x"));
    manager.report(CheckLevel.ERROR, RewriteError.forPass("a", BROKEN, "y"));

    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage()).isEqualTo("a: ERROR - [ELIXIR_TEST_BROKEN] Broken: y");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(1).getMessage()).isEqualTo("b: WARNING - [ELIXIR_TEST_ODD] Odd: x");
    assertThat(records.get(2).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testDuplicateReportsCountOnce() {
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    RewriteError error = RewriteError.make(ODD, "x");
    manager.report(CheckLevel.WARNING, error);
    manager.report(CheckLevel.WARNING, error);

    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getWarnings()).containsExactly(error);
  }

  @Test
  public void testOffLevelIsNotCounted() {
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(CheckLevel.OFF, RewriteError.make(ODD, "x"));
    manager.generateReport();

    assertThat(manager.getWarningCount()).isEqualTo(0);
    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(records).isEmpty();
  }
}
