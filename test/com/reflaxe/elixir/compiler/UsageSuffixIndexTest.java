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
import static com.google.common.truth.Truth.assertWithMessage;
import static com.reflaxe.elixir.ast.IR.call;
import static com.reflaxe.elixir.ast.IR.match;
import static com.reflaxe.elixir.ast.IR.name;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.ast.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link UsageSuffixIndex}. */
@RunWith(JUnit4.class)
public final class UsageSuffixIndexTest {

  private static final ImmutableList<String> NAMES =
      ImmutableList.of("a", "b", "_b", "userId", "user_id", "c");

  @Test
  public void testUsedLater() {
    UsageSuffixIndex index =
        UsageSuffixIndex.buildExact(
            ImmutableList.of(match("x", name("a")), call("f", name("b")), name("c")));

    assertThat(index.size()).isEqualTo(3);
    assertThat(index.usedLater(0, "a")).isTrue();
    assertThat(index.usedLater(1, "a")).isFalse();
    assertThat(index.usedLater(1, "c")).isTrue();
    assertThat(index.usedLater(3, "c")).isFalse();
    assertThat(index.usedLater(0, "x")).isFalse();
  }

  @Test
  public void testFuzzyMatchesVariants() {
    ImmutableList<Node> stmts = ImmutableList.of(call("f", name("userId")));

    assertThat(UsageSuffixIndex.build(stmts).usedLater(0, "user_id")).isTrue();
    assertThat(UsageSuffixIndex.buildExact(stmts).usedLater(0, "user_id")).isFalse();
  }

  @Test
  public void testPositionOutOfRange() {
    UsageSuffixIndex index = UsageSuffixIndex.build(ImmutableList.of(name("a")));

    assertThrows(IndexOutOfBoundsException.class, () -> index.usedLater(2, "a"));
  }

  @Test
  public void testLongListOfDistinctNames() {
    int size = 50_000;
    List<Node> stmts = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      stmts.add(call("f", name("v" + i)));
    }
    UsageSuffixIndex index = UsageSuffixIndex.buildExact(stmts);

    assertThat(index.usedLater(0, "v0")).isTrue();
    assertThat(index.usedLater(1, "v0")).isFalse();
    assertThat(index.usedLater(size - 1, "v" + (size - 1))).isTrue();
    assertThat(index.usedLater(size, "v" + (size - 1))).isFalse();
    assertThat(index.usedLater(size / 2, "v" + (size / 2 + 1))).isTrue();
  }

  @Test
  public void testAgreesWithDirectScan() {
    Random random = new Random(42);
    for (int round = 0; round < 200; round++) {
      List<Node> stmts = new ArrayList<>();
      int size = random.nextInt(8);
      for (int i = 0; i < size; i++) {
        stmts.add(randomStatement(random));
      }
      UsageSuffixIndex exact = UsageSuffixIndex.buildExact(stmts);
      UsageSuffixIndex fuzzy = UsageSuffixIndex.build(stmts);
      for (int start = 0; start <= size; start++) {
        Node suffix = IR.block(stmts.subList(start, size));
        for (String name : NAMES) {
          assertWithMessage("round %s, %s from %s", round, name, start)
              .that(exact.usedLater(start, name))
              .isEqualTo(VariableUsageAnalyzer.isReferenced(suffix, name));
          assertWithMessage("round %s, variant of %s from %s", round, name, start)
              .that(fuzzy.usedLater(start, name))
              .isEqualTo(VariableUsageAnalyzer.isReferencedAnyVariant(suffix, name));
        }
      }
    }
  }

  private static Node randomStatement(Random random) {
    String first = NAMES.get(random.nextInt(NAMES.size()));
    String second = NAMES.get(random.nextInt(NAMES.size()));
    switch (random.nextInt(5)) {
      case 0:
        return match(first, name(second));
      case 1:
        return call("f", name(first));
      case 2:
        return IR.raw(first + " + 1");
      case 3:
        return IR.string("#{" + first + "}");
      default:
        return IR.lambda(ImmutableList.of(Pattern.bind(first)), name(second));
    }
  }
}
