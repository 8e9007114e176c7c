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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link JsonErrorReportGenerator}. */
@RunWith(JUnit4.class)
public final class JsonErrorReportGeneratorTest {

  private static final DiagnosticType BAD = DiagnosticType.error("ELIXIR_TEST_BAD", "Bad {0}");

  @Test
  public void testReport() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    SortingErrorManager manager =
        new SortingErrorManager(
            ImmutableSet.of(new JsonErrorReportGenerator(new PrintStream(out, true, UTF_8))));
    manager.report(CheckLevel.ERROR, RewriteError.make(BAD, "thing"));
    manager.report(CheckLevel.WARNING, RewriteError.forPass("p", BAD, "other"));

    manager.generateReport();

    JsonArray report = JsonParser.parseString(out.toString(UTF_8)).getAsJsonArray();
    assertThat(report.size()).isEqualTo(3);
    JsonObject error = report.get(0).getAsJsonObject();
    assertThat(error.get("level").getAsString()).isEqualTo("error");
    assertThat(error.get("description").getAsString()).isEqualTo("Bad thing");
    assertThat(error.get("key").getAsString()).isEqualTo("ELIXIR_TEST_BAD");
    assertThat(error.has("pass")).isFalse();
    JsonObject warning = report.get(1).getAsJsonObject();
    assertThat(warning.get("level").getAsString()).isEqualTo("warning");
    assertThat(warning.get("pass").getAsString()).isEqualTo("p");
    JsonObject summary = report.get(2).getAsJsonObject();
    assertThat(summary.get("level").getAsString()).isEqualTo("info");
    assertThat(summary.get("description").getAsString()).isEqualTo("1 error(s), 1 warning(s)");
  }

  @Test
  public void testEmptyReport() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    SortingErrorManager manager =
        new SortingErrorManager(
            ImmutableSet.of(new JsonErrorReportGenerator(new PrintStream(out, true, UTF_8))));

    manager.generateReport();

    JsonArray report = JsonParser.parseString(out.toString(UTF_8)).getAsJsonArray();
    assertThat(report.size()).isEqualTo(1);
    assertThat(report.get(0).getAsJsonObject().get("description").getAsString())
        .isEqualTo("0 error(s), 0 warning(s)");
  }
}
