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

/**
 * If the name of a pass is used in more than one place in the source, it's good to create a
 * symbolic name here.
 */
public final class PassNames {
  public static final String COLLAPSE_TEMP_ALIASES = "collapseTempAliases";
  public static final String FLATTEN_BLOCKS = "flattenBlocks";
  public static final String INLINE_IMMEDIATE_FUNCTIONS = "inlineImmediateFunctions";
  public static final String LOWER_LOOPS = "lowerLoops";
  public static final String NORMALIZE_VARIABLE_CASE = "normalizeVariableCase";
  public static final String PIPELINE_ENUM_CALLS = "pipelineEnumCalls";
  public static final String REMOVE_DEAD_REBINDING = "removeDeadRebinding";
  public static final String REMOVE_EMPTY_LIST_CONCAT = "removeEmptyListConcat";
  public static final String REMOVE_NIL_ELSE = "removeNilElse";
  public static final String REMOVE_SELF_BINDINGS = "removeSelfBindings";
  public static final String RESTORE_USED_UNDERSCORE_BINDERS = "restoreUsedUnderscoreBinders";
  public static final String SIMPLIFY_BOOLEAN_IF = "simplifyBooleanIf";
  public static final String SIMPLIFY_STRING_CONCAT = "simplifyStringConcat";
  public static final String UNDERSCORE_UNUSED_BINDINGS = "underscoreUnusedBindings";
  public static final String UNDERSCORE_UNUSED_PARAMETERS = "underscoreUnusedParameters";

  private PassNames() {}
}
