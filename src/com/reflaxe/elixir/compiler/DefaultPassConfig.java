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

/** Pass factories and meta-data for the default rewrite pipeline. */
public final class DefaultPassConfig extends PassConfig {

  @Override
  protected PassListBuilder getLoopPasses() {
    PassListBuilder passes = new PassListBuilder();
    passes.add(lowerLoops);
    return passes;
  }

  @Override
  protected PassListBuilder getNormalizations() {
    PassListBuilder passes = new PassListBuilder();
    passes.add(flattenBlocks);
    passes.add(inlineImmediateFunctions);
    passes.add(simplifyStringConcat);
    passes.add(simplifyBooleanIf);
    passes.add(removeNilElse);
    passes.add(removeEmptyListConcat);
    passes.add(pipelineEnumCalls);
    return passes;
  }

  @Override
  protected PassListBuilder getHygienePasses() {
    PassListBuilder passes = new PassListBuilder();
    passes.add(removeSelfBindings);
    passes.add(collapseTempAliases);
    passes.add(removeDeadRebinding);
    passes.add(normalizeVariableCase);
    passes.add(underscoreUnusedBindings);
    passes.add(underscoreUnusedParameters);
    passes.add(restoreUsedUnderscoreBinders);

    passes.assertPassOrder(
        PassNames.NORMALIZE_VARIABLE_CASE,
        PassNames.UNDERSCORE_UNUSED_BINDINGS,
        "Underscored names must be derived from the normalized spelling.");
    return passes;
  }

  /** Lowers imperative loops to Enum calls, comprehensions and recursion. */
  private final PassDescriptor lowerLoops =
      PassDescriptor.builder()
          .setName(PassNames.LOWER_LOOPS)
          .setDescription("Lowers imperative loops by recognizing their intent")
          .setContextualPass(new LoopLoweringPass())
          .build();

  private final PassDescriptor flattenBlocks =
      PassDescriptor.builder()
          .setName(PassNames.FLATTEN_BLOCKS)
          .setDescription("Splices nested blocks and unwraps single-statement blocks")
          .setPass(new FlattenBlocks())
          .addRunAfter(PassNames.LOWER_LOOPS)
          .build();

  private final PassDescriptor inlineImmediateFunctions =
      PassDescriptor.builder()
          .setName(PassNames.INLINE_IMMEDIATE_FUNCTIONS)
          .setDescription("Inlines anonymous functions called on the spot")
          .setPass(new InlineImmediateFunctions())
          .build();

  private final PassDescriptor simplifyStringConcat =
      PassDescriptor.builder()
          .setName(PassNames.SIMPLIFY_STRING_CONCAT)
          .setDescription("Folds string concatenation into literals and interpolation")
          .setPass(new SimplifyStringConcat())
          .build();

  private final PassDescriptor simplifyBooleanIf =
      PassDescriptor.builder()
          .setName(PassNames.SIMPLIFY_BOOLEAN_IF)
          .setDescription("Replaces if expressions that yield true or false by their condition")
          .setPass(new SimplifyBooleanIf())
          .build();

  private final PassDescriptor removeNilElse =
      PassDescriptor.builder()
          .setName(PassNames.REMOVE_NIL_ELSE)
          .setDescription("Drops else branches that yield nil")
          .setPass(new RemoveNilElse())
          .build();

  private final PassDescriptor removeEmptyListConcat =
      PassDescriptor.builder()
          .setName(PassNames.REMOVE_EMPTY_LIST_CONCAT)
          .setDescription("Drops concatenation with the empty list")
          .setPass(new RemoveEmptyListConcat())
          .build();

  private final PassDescriptor pipelineEnumCalls =
      PassDescriptor.builder()
          .setName(PassNames.PIPELINE_ENUM_CALLS)
          .setDescription("Rewrites nested Enum calls as pipelines")
          .setPass(new PipelineEnumCalls())
          .addRunAfter(PassNames.REMOVE_EMPTY_LIST_CONCAT)
          .build();

  private final PassDescriptor removeSelfBindings =
      PassDescriptor.builder()
          .setName(PassNames.REMOVE_SELF_BINDINGS)
          .setDescription("Removes bindings of a variable to itself")
          .setPass(new RemoveSelfBindings())
          .build();

  private final PassDescriptor collapseTempAliases =
      PassDescriptor.builder()
          .setName(PassNames.COLLAPSE_TEMP_ALIASES)
          .setDescription("Collapses temporaries that only feed the next binding")
          .setPass(new CollapseTempAliases())
          .addRunAfter(PassNames.REMOVE_SELF_BINDINGS)
          .build();

  private final PassDescriptor removeDeadRebinding =
      PassDescriptor.builder()
          .setName(PassNames.REMOVE_DEAD_REBINDING)
          .setDescription("Drops literal bindings that are immediately rebound")
          .setPass(new RemoveDeadRebinding())
          .addRunAfter(PassNames.COLLAPSE_TEMP_ALIASES)
          .build();

  private final PassDescriptor normalizeVariableCase =
      PassDescriptor.builder()
          .setName(PassNames.NORMALIZE_VARIABLE_CASE)
          .setDescription("Renames camelCase variables to snake_case")
          .setPass(new NormalizeVariableCase())
          .build();

  private final PassDescriptor underscoreUnusedBindings =
      PassDescriptor.builder()
          .setName(PassNames.UNDERSCORE_UNUSED_BINDINGS)
          .setDescription("Prefixes an underscore to unused match and clause binders")
          .setPass(new UnderscoreUnusedBindings())
          .addRunAfter(PassNames.NORMALIZE_VARIABLE_CASE)
          .build();

  private final PassDescriptor underscoreUnusedParameters =
      PassDescriptor.builder()
          .setName(PassNames.UNDERSCORE_UNUSED_PARAMETERS)
          .setDescription("Prefixes an underscore to unused function parameters")
          .setContextualPass(new UnderscoreUnusedParameters())
          .addRunAfter(PassNames.NORMALIZE_VARIABLE_CASE)
          .build();

  private final PassDescriptor restoreUsedUnderscoreBinders =
      PassDescriptor.builder()
          .setName(PassNames.RESTORE_USED_UNDERSCORE_BINDERS)
          .setDescription("Renames read underscored binders to their plain name")
          .setPass(new RestoreUsedUnderscoreBinders())
          .addRunAfter(PassNames.UNDERSCORE_UNUSED_BINDINGS)
          .addRunAfter(PassNames.UNDERSCORE_UNUSED_PARAMETERS)
          .build();
}
