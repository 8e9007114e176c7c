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

import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Options for the rewrite pipeline. */
public class RewriteOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** How the diagnostics report is printed. */
  public enum ErrorFormat {
    TEXT,
    JSON
  }

  /** Explicit per-pass enablement; overrides the flag of the pass descriptor. */
  private final Map<String, Boolean> passEnablement = new LinkedHashMap<>();

  private ErrorFormat errorFormat = ErrorFormat.TEXT;

  /** Validate the AST after every pass. Intended for development. */
  private boolean checkAstAfterEachPass = false;

  /** Log the hashcode of the AST after every pass. Intended for development. */
  private boolean printAstHashcodes = false;

  public RewriteOptions() {}

  /** Enables or disables the named pass regardless of its default. */
  public void setPassEnabled(String passName, boolean enabled) {
    passEnablement.put(passName, enabled);
  }

  /** Removes an explicit enablement, restoring the default of the pass. */
  public void clearPassEnabled(String passName) {
    passEnablement.remove(passName);
  }

  /** Returns the explicit enablement of the pass, or null if the default applies. */
  public @Nullable Boolean getPassEnabled(String passName) {
    return passEnablement.get(passName);
  }

  public ImmutableMap<String, Boolean> getPassEnablement() {
    return ImmutableMap.copyOf(passEnablement);
  }

  /** Whether the pass runs: the explicit setting if there is one, else the descriptor flag. */
  public boolean isPassEnabled(PassDescriptor pass) {
    Boolean explicit = passEnablement.get(pass.getName());
    return explicit != null ? explicit : pass.isEnabled();
  }

  public ErrorFormat getErrorFormat() {
    return errorFormat;
  }

  public void setErrorFormat(ErrorFormat errorFormat) {
    this.errorFormat = errorFormat;
  }

  public boolean shouldCheckAstAfterEachPass() {
    return checkAstAfterEachPass;
  }

  public void setCheckAstAfterEachPass(boolean checkAstAfterEachPass) {
    this.checkAstAfterEachPass = checkAstAfterEachPass;
  }

  public boolean shouldPrintAstHashcodes() {
    return printAstHashcodes;
  }

  public void setPrintAstHashcodes(boolean printAstHashcodes) {
    this.printAstHashcodes = printAstHashcodes;
  }
}
