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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.compiler.SortingErrorManager.ErrorReportGenerator;
import java.io.PrintStream;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewriter is the entry point of the rewrite pipeline. It schedules the passes of a {@link
 * PassConfig} and runs them over one module tree at a time.
 *
 * <pre>{@code
 * Rewriter rewriter = new Rewriter(System.err);
 * rewriter.initOptions(new RewriteOptions());
 * RewriteResult result = rewriter.rewrite(module, context);
 * rewriter.generateReport();
 * }</pre>
 */
public class Rewriter {

  private static final Logger logger = Logger.getLogger(Rewriter.class.getName());

  private final @Nullable PrintStream outStream;
  private @Nullable ErrorManager errorManager;
  private @Nullable RewriteOptions options;
  private PassConfig passConfig = new DefaultPassConfig();

  /** Creates a Rewriter that reports diagnostics through the logger. */
  public Rewriter() {
    this((PrintStream) null);
  }

  /** Creates a Rewriter that prints its report to {@code outStream}. */
  public Rewriter(@Nullable PrintStream outStream) {
    this.outStream = outStream;
  }

  /** Creates a Rewriter that uses a custom error manager. */
  public Rewriter(ErrorManager errorManager) {
    this((PrintStream) null);
    setErrorManager(errorManager);
  }

  public void setErrorManager(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager, "the error manager cannot be null");
  }

  public void setPassConfig(PassConfig passConfig) {
    this.passConfig = checkNotNull(passConfig);
  }

  /** Initializes the options and, unless one was set, the error manager they call for. */
  public void initOptions(RewriteOptions options) {
    this.options = options;
    if (errorManager == null) {
      if (outStream == null) {
        setErrorManager(new LoggerErrorManager(logger));
      } else {
        setErrorManager(new SortingErrorManager(ImmutableSet.of(createReportGenerator())));
      }
    }
  }

  private ErrorReportGenerator createReportGenerator() {
    switch (options.getErrorFormat()) {
      case JSON:
        return new JsonErrorReportGenerator(outStream);
      case TEXT:
      default:
        return new PrintStreamErrorReportGenerator(outStream);
    }
  }

  public ErrorManager getErrorManager() {
    checkState(errorManager != null, "initOptions has not been called");
    return errorManager;
  }

  /** Returns the passes of the configured pipeline in the order they will run. */
  public ImmutableList<PassDescriptor> getScheduledPasses() {
    return newScheduler().schedule(passConfig.getPasses().build());
  }

  /**
   * Runs every enabled pass over {@code root}. Diagnostics are reported to the error manager as
   * well as returned.
   */
  public RewriteResult rewrite(Node root, RewriteContext context) {
    checkNotNull(root);
    checkNotNull(context);
    PassScheduler scheduler = newScheduler();
    ImmutableList<PassDescriptor> scheduled = scheduler.schedule(passConfig.getPasses().build());
    logger.fine("Rewriting " + context.getModuleName() + " with " + scheduled.size() + " passes");
    Node result = scheduler.process(scheduled, root, context);
    return new RewriteResult(
        result, scheduler.getReportedErrors(), scheduler.getExecutedPasses());
  }

  /** Prints or logs the diagnostics reported so far. */
  public void generateReport() {
    getErrorManager().generateReport();
  }

  private PassScheduler newScheduler() {
    checkState(options != null, "initOptions has not been called");
    return new PassScheduler(getErrorManager(), options);
  }
}
