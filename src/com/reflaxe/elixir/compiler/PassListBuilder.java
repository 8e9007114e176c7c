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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Funnels the pass list of a pipeline through a central mechanism. Passes are kept in declaration
 * order; duplicate names are allowed here and resolved by the {@link PassScheduler}.
 */
public final class PassListBuilder {
  private final List<PassDescriptor> passes = new ArrayList<>();

  public ImmutableList<PassDescriptor> build() {
    return ImmutableList.copyOf(passes);
  }

  public void add(PassDescriptor pass) {
    passes.add(pass);
  }

  public void addAll(PassListBuilder other) {
    passes.addAll(other.build());
  }

  /**
   * Insert the given pass before the pass of the given name. Throws if the specified pass is not
   * present
   */
  public void addBefore(PassDescriptor pass, String passName) {
    passes.add(findIndexByName(passName), pass);
  }

  /**
   * Insert the given pass after the pass of the given name. Throws if the specified pass is not
   * present
   */
  public void addAfter(PassDescriptor pass, String passName) {
    passes.add(findIndexByName(passName) + 1, pass);
  }

  public PassDescriptor findByName(String name) {
    return passes.get(findIndexByName(name));
  }

  /** Throws an exception if no pass with the given name exists. */
  private int findIndexByName(String name) {
    for (int i = 0; i < passes.size(); i++) {
      if (passes.get(i).getName().equals(name)) {
        return i;
      }
    }

    throw new IllegalArgumentException("No pass named '" + name + "' in the pass list");
  }

  public boolean contains(String passName) {
    for (PassDescriptor pass : passes) {
      if (pass.getName().equals(passName)) {
        return true;
      }
    }
    return false;
  }

  /** Asserts that if both passes are present, pass1 is ordered before pass2. */
  public void assertPassOrder(String pass1, String pass2, String msg) {
    int pass1Index = -1;
    int pass2Index = -1;
    for (int i = 0; i < passes.size(); i++) {
      String name = passes.get(i).getName();
      if (name.equals(pass1) && pass1Index == -1) {
        pass1Index = i;
      } else if (name.equals(pass2) && pass2Index == -1) {
        pass2Index = i;
      }
    }
    if (pass1Index != -1 && pass2Index != -1) {
      checkState(pass1Index < pass2Index, msg);
    }
  }
}
