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

/** Pass descriptors and meta-data for the rewrite pipeline. */
public abstract class PassConfig {

  /**
   * Gets the loop passes to run.
   *
   * <p>Loop passes replace the imperative loops of the input with constructs native to the
   * target. They always run first, since the later passes do not look inside loops.
   */
  protected abstract PassListBuilder getLoopPasses();

  /** Gets the passes that simplify expression shapes left behind by code generation. */
  protected abstract PassListBuilder getNormalizations();

  /**
   * Gets the hygiene passes to run.
   *
   * <p>Hygiene passes tidy variable bindings: they remove redundant ones and bring names in line
   * with the conventions the Elixir compiler warns about.
   */
  protected abstract PassListBuilder getHygienePasses();

  /** Gets every pass, in declaration order: loops, normalizations, then hygiene. */
  public final PassListBuilder getPasses() {
    PassListBuilder passes = new PassListBuilder();
    passes.addAll(getLoopPasses());
    passes.addAll(getNormalizations());
    passes.addAll(getHygienePasses());
    return passes;
  }
}
