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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.reflaxe.elixir.ast.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Orders the passes of a pipeline and runs them.
 *
 * <p>Scheduling never fails. Duplicate names, dependencies on unknown passes and dependency
 * cycles are reported as warnings and resolved: the first declaration of a name wins, unknown
 * dependencies are dropped, and the edge that closes a cycle is dropped. The remaining graph is
 * sorted topologically, breaking ties by declaration order, so the same input always yields the
 * same order.
 */
class PassScheduler {

  private static final Logger logger = Logger.getLogger(PassScheduler.class.getName());

  static final DiagnosticType DUPLICATE_PASS =
      DiagnosticType.warning(
          "ELIXIR_DUPLICATE_PASS", "Duplicate pass {0} ignored; the first declaration is kept.");

  static final DiagnosticType MISSING_PASS_DEPENDENCY =
      DiagnosticType.warning(
          "ELIXIR_MISSING_PASS_DEPENDENCY",
          "Pass {0} is declared to run after unknown pass {1}; the dependency is ignored.");

  static final DiagnosticType PASS_DEPENDENCY_CYCLE =
      DiagnosticType.warning(
          "ELIXIR_PASS_DEPENDENCY_CYCLE",
          "Dependency of pass {0} on pass {1} closes a cycle; the dependency is ignored.");

  static final DiagnosticType PASS_FAILED =
      DiagnosticType.warning(
          "ELIXIR_PASS_FAILED", "Pass {0} failed and its changes were discarded: {1}");

  private final ErrorManager errorManager;
  private final RewriteOptions options;
  private final List<String> executedPasses = new ArrayList<>();
  private final List<RewriteError> reportedErrors = new ArrayList<>();
  private @Nullable AstValidator validityCheck;

  PassScheduler(ErrorManager errorManager, RewriteOptions options) {
    this.errorManager = errorManager;
    this.options = options;
    if (options.shouldCheckAstAfterEachPass()) {
      this.validityCheck = new AstValidator();
    }
  }

  /**
   * Returns the passes in the order they must run: deduplicated, with unknown and cyclic
   * dependencies removed, and topologically sorted with ties broken by declaration order.
   */
  ImmutableList<PassDescriptor> schedule(List<PassDescriptor> declared) {
    Map<String, PassDescriptor> passes = deduplicate(declared);
    List<String> names = new ArrayList<>(passes.keySet());
    Map<String, Set<String>> dependencies = resolveDependencies(passes);
    breakCycles(names, dependencies);
    return sortTopologically(names, dependencies, passes);
  }

  private Map<String, PassDescriptor> deduplicate(List<PassDescriptor> declared) {
    Map<String, PassDescriptor> passes = new LinkedHashMap<>();
    for (PassDescriptor pass : declared) {
      if (passes.containsKey(pass.getName())) {
        report(RewriteError.forPass(pass.getName(), DUPLICATE_PASS, pass.getName()));
      } else {
        passes.put(pass.getName(), pass);
      }
    }
    return passes;
  }

  private Map<String, Set<String>> resolveDependencies(Map<String, PassDescriptor> passes) {
    Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    for (PassDescriptor pass : passes.values()) {
      Set<String> deps = new LinkedHashSet<>();
      for (String dep : pass.getRunAfter()) {
        if (passes.containsKey(dep)) {
          deps.add(dep);
        } else {
          report(
              RewriteError.forPass(pass.getName(), MISSING_PASS_DEPENDENCY, pass.getName(), dep));
        }
      }
      dependencies.put(pass.getName(), deps);
    }
    return dependencies;
  }

  /**
   * Depth-first search over the dependency edges in declaration order. Every edge that reaches a
   * pass still on the stack closes a cycle and is removed, which leaves the graph acyclic.
   */
  private void breakCycles(List<String> names, Map<String, Set<String>> dependencies) {
    Set<String> finished = new LinkedHashSet<>();
    Set<String> onStack = new LinkedHashSet<>();
    for (String name : names) {
      if (!finished.contains(name)) {
        visit(name, dependencies, onStack, finished);
      }
    }
  }

  private void visit(
      String name,
      Map<String, Set<String>> dependencies,
      Set<String> onStack,
      Set<String> finished) {
    onStack.add(name);
    Set<String> deps = dependencies.get(name);
    for (String dep : new ArrayList<>(deps)) {
      if (onStack.contains(dep)) {
        report(RewriteError.forPass(name, PASS_DEPENDENCY_CYCLE, name, dep));
        deps.remove(dep);
      } else if (!finished.contains(dep)) {
        visit(dep, dependencies, onStack, finished);
      }
    }
    onStack.remove(name);
    finished.add(name);
  }

  private static ImmutableList<PassDescriptor> sortTopologically(
      List<String> names,
      Map<String, Set<String>> dependencies,
      Map<String, PassDescriptor> passes) {
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      index.put(names.get(i), i);
    }
    int[] remaining = new int[names.size()];
    List<List<Integer>> dependents = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      dependents.add(new ArrayList<>());
    }
    for (int i = 0; i < names.size(); i++) {
      for (String dep : dependencies.get(names.get(i))) {
        remaining[i]++;
        dependents.get(index.get(dep)).add(i);
      }
    }
    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for (int i = 0; i < names.size(); i++) {
      if (remaining[i] == 0) {
        ready.add(i);
      }
    }
    ImmutableList.Builder<PassDescriptor> order = ImmutableList.builder();
    while (!ready.isEmpty()) {
      int next = ready.poll();
      order.add(passes.get(names.get(next)));
      for (int dependent : dependents.get(next)) {
        if (--remaining[dependent] == 0) {
          ready.add(dependent);
        }
      }
    }
    return order.build();
  }

  /**
   * Runs the scheduled passes in order, threading the tree through each enabled pass. A pass that
   * throws is reported and the tree it was given carries on to the next pass.
   */
  Node process(List<PassDescriptor> scheduled, Node root, RewriteContext context) {
    Node current = root;
    for (PassDescriptor pass : scheduled) {
      String name = pass.getName();
      if (!options.isPassEnabled(pass)) {
        logger.fine("Skipping disabled pass " + name);
        continue;
      }
      logger.fine("Running pass " + name);
      Node result;
      try {
        result = checkNotNull(pass.run(current, context), "pass %s returned null", name);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Pass " + name + " failed", e);
        report(RewriteError.forPass(name, PASS_FAILED, name, String.valueOf(e.getMessage())));
        continue;
      }
      current = result;
      executedPasses.add(name);
      maybePrintAstHashcodes(name, current);
      maybeRunValidityCheck(name, current);
    }
    return current;
  }

  /** Returns the names of the passes that ran to completion, in order. */
  ImmutableList<String> getExecutedPasses() {
    return ImmutableList.copyOf(executedPasses);
  }

  /** Returns the diagnostics this scheduler reported, in report order. */
  ImmutableList<RewriteError> getReportedErrors() {
    return ImmutableList.copyOf(reportedErrors);
  }

  @VisibleForTesting
  void setValidityCheck(@Nullable AstValidator validityCheck) {
    this.validityCheck = validityCheck;
  }

  private void maybePrintAstHashcodes(String passName, Node root) {
    if (options.shouldPrintAstHashcodes()) {
      logger.info("AST hashCode after " + passName + ": " + root.toStringTree().hashCode());
    }
  }

  private void maybeRunValidityCheck(String passName, Node root) {
    if (validityCheck == null) {
      return;
    }
    try {
      validityCheck.validate(root);
    } catch (IllegalStateException e) {
      throw new IllegalStateException("Validity check failed for pass: " + passName, e);
    }
  }

  private void report(RewriteError error) {
    reportedErrors.add(error);
    errorManager.report(error.defaultLevel(), error);
  }
}
