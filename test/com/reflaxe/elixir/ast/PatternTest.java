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
package com.reflaxe.elixir.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Pattern}. */
@RunWith(JUnit4.class)
public final class PatternTest {

  @Test
  public void testBinderNames() {
    assertThat(Pattern.bind("x").getString()).isEqualTo("x");
    assertThat(Pattern.bind("x").isBind()).isTrue();
    assertThrows(IllegalArgumentException.class, () -> Pattern.bind("_"));
    assertThrows(IllegalArgumentException.class, () -> Pattern.bind(""));
  }

  @Test
  public void testLiteralPatterns() {
    assertThat(Pattern.literal(IR.atom("ok")).getToken()).isEqualTo(PatternToken.LITERAL);
    assertThrows(IllegalArgumentException.class, () -> Pattern.literal(IR.name("x")));
  }

  @Test
  public void testMapEntriesOnly() {
    assertThrows(IllegalArgumentException.class, () -> Pattern.map(Pattern.bind("x")));
    assertThrows(
        IllegalArgumentException.class,
        () -> Pattern.mapEntry(IR.name("k"), Pattern.bind("v")));
  }

  @Test
  public void testStructuralEquality() {
    Pattern a = Pattern.tuple(Pattern.literal(IR.atom("ok")), Pattern.bind("v"));
    Pattern b = Pattern.tuple(Pattern.literal(IR.atom("ok")), Pattern.bind("v"));

    assertThat(a).isEqualTo(b);
    assertThat(a).isNotEqualTo(Pattern.tuple(Pattern.literal(IR.atom("ok")), Pattern.bind("w")));
  }

  @Test
  public void testWildcardHasNoName() {
    assertThrows(IllegalStateException.class, () -> Pattern.wildcard().getString());
  }
}
