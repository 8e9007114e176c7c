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
import static com.reflaxe.elixir.ast.IR.binaryOp;
import static com.reflaxe.elixir.ast.IR.block;
import static com.reflaxe.elixir.ast.IR.clause;
import static com.reflaxe.elixir.ast.IR.def;
import static com.reflaxe.elixir.ast.IR.lambda;
import static com.reflaxe.elixir.ast.IR.list;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.module;
import static com.reflaxe.elixir.ast.IR.name;
import static com.reflaxe.elixir.ast.IR.number;
import static com.reflaxe.elixir.ast.IR.remoteCall;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import com.reflaxe.elixir.compiler.loops.FakeExpressionBuilder;
import com.reflaxe.elixir.typed.TypedIR;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Rewriter}. */
@RunWith(JUnit4.class)
public final class RewriterTest {

  private RewriteContext context;

  @Before
  public void setUp() {
    context =
        RewriteContext.builder()
            .setModuleName("Main")
            .setExpressionBuilder(new FakeExpressionBuilder())
            .build();
  }

  /**
   * <pre>
   * def run(items, unusedArg) do
   *   result = []
   *   for x in items, do: result.push(x * 2)
   *   finalValue = result
   *   finalValue
   * end
   * </pre>
   */
  private static Node input() {
    Node loop =
        IR.loop(
            TypedIR.forIn(
                "x",
                TypedIR.local("items"),
                TypedIR.methodCall(
                    TypedIR.local("result"),
                    "push",
                    TypedIR.binop("*", TypedIR.local("x"), TypedIR.intLiteral(2)))));
    return module(
        "Main",
        def(
            "run",
            clause(
                ImmutableList.of(Pattern.bind("items"), Pattern.bind("unusedArg")),
                block(
                    match("result", list()),
                    loop,
                    match("finalValue", name("result")),
                    name("finalValue")))));
  }

  private static Node expectedOutput() {
    Node map =
        remoteCall(
            "Enum",
            "map",
            name("items"),
            lambda(ImmutableList.of(Pattern.bind("x")), binaryOp("*", name("x"), number(2))));
    return module(
        "Main",
        def(
            "run",
            clause(
                ImmutableList.of(Pattern.bind("items"), Pattern.bind("_unused_arg")),
                block(match("final_value", map), name("final_value")))));
  }

  private static Rewriter newRewriter(RewriteOptions options) {
    Rewriter rewriter = new Rewriter();
    rewriter.initOptions(options);
    return rewriter;
  }

  @Test
  public void testRequiresOptions() {
    assertThrows(
        IllegalStateException.class,
        () -> new Rewriter().rewrite(IR.atom("x"), RewriteContext.empty()));
  }

  @Test
  public void testFullPipeline() {
    RewriteResult result = newRewriter(new RewriteOptions()).rewrite(input(), context);

    assertThat(result.root().toStringTree()).isEqualTo(expectedOutput().toStringTree());
    assertThat(result.hasDiagnostics()).isFalse();
    assertThat(result.executedPasses()).hasSize(15);
    assertThat(result.executedPasses().get(0)).isEqualTo(PassNames.LOWER_LOOPS);
  }

  @Test
  public void testPipelineIsIdempotent() {
    Rewriter rewriter = newRewriter(new RewriteOptions());
    Node once = rewriter.rewrite(input(), context).root();
    Node twice = rewriter.rewrite(once, context).root();

    assertThat(twice).isEqualTo(once);
  }

  @Test
  public void testDisabledPassDoesNotRun() {
    RewriteOptions options = new RewriteOptions();
    options.setPassEnabled(PassNames.NORMALIZE_VARIABLE_CASE, false);

    RewriteResult result = newRewriter(options).rewrite(input(), context);

    assertThat(result.executedPasses()).doesNotContain(PassNames.NORMALIZE_VARIABLE_CASE);
    assertThat(result.root().toStringTree()).contains("finalValue");
  }

  @Test
  public void testJsonReport() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Rewriter rewriter = new Rewriter(new PrintStream(out, true, UTF_8));
    RewriteOptions options = new RewriteOptions();
    options.setErrorFormat(RewriteOptions.ErrorFormat.JSON);
    rewriter.initOptions(options);
    rewriter.setPassConfig(new FailingPassConfig());

    RewriteResult result = rewriter.rewrite(IR.atom("ok"), RewriteContext.empty());
    rewriter.generateReport();

    assertThat(result.root()).isEqualTo(IR.atom("ok"));
    assertThat(result.diagnostics()).hasSize(1);
    JsonArray report = JsonParser.parseString(out.toString(UTF_8)).getAsJsonArray();
    assertThat(report.size()).isEqualTo(2);
    JsonObject failure = report.get(0).getAsJsonObject();
    assertThat(failure.get("level").getAsString()).isEqualTo("warning");
    assertThat(failure.get("key").getAsString()).isEqualTo("ELIXIR_PASS_FAILED");
    assertThat(failure.get("pass").getAsString()).isEqualTo("failing");
    assertThat(report.get(1).getAsJsonObject().get("description").getAsString())
        .isEqualTo("0 error(s), 1 warning(s)");
  }

  @Test
  public void testTextReport() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Rewriter rewriter = new Rewriter(new PrintStream(out, true, UTF_8));
    rewriter.initOptions(new RewriteOptions());
    rewriter.setPassConfig(new FailingPassConfig());

    rewriter.rewrite(IR.atom("ok"), RewriteContext.empty());
    rewriter.generateReport();

    assertThat(out.toString(UTF_8))
        .contains("failing: WARNING - [ELIXIR_PASS_FAILED] Pass failing failed");
  }

  /** A pipeline of one pass that always throws. */
  private static final class FailingPassConfig extends PassConfig {
    @Override
    protected PassListBuilder getLoopPasses() {
      return new PassListBuilder();
    }

    @Override
    protected PassListBuilder getNormalizations() {
      PassListBuilder passes = new PassListBuilder();
      passes.add(
          PassDescriptor.builder()
              .setName("failing")
              .setPass(
                  root -> {
                    throw new UnsupportedOperationException("unsupported");
                  })
              .build());
      return passes;
    }

    @Override
    protected PassListBuilder getHygienePasses() {
      return new PassListBuilder();
    }
  }
}
