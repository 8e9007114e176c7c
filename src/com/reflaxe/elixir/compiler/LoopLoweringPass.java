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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.reflaxe.elixir.ast.IR;
import com.reflaxe.elixir.ast.Node;
import com.reflaxe.elixir.compiler.loops.ExpressionBuilder;
import com.reflaxe.elixir.compiler.loops.LoopContext;
import com.reflaxe.elixir.compiler.loops.LoopTranslator;
import com.reflaxe.elixir.typed.TypedIR;
import com.reflaxe.elixir.typed.TypedNode;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Replaces the imperative loops left in the tree by the Elixir constructs that express their
 * intent. Loops whose intent is not recognized stay in place.
 *
 * <p>Each loop is described to the loop analyzer by the bindings that precede it in its block and
 * by the names the rest of the block reads. A literal binding that only fed a lowered loop is
 * dropped along with it.
 */
final class LoopLoweringPass implements ContextualRewritePass {

  private static final Logger logger = Logger.getLogger(LoopLoweringPass.class.getName());

  @Override
  public Node process(Node root, RewriteContext context) {
    ExpressionBuilder builder = context.getExpressionBuilder();
    if (builder == null) {
      logger.fine("No expression builder for " + context.getModuleName() + "; loops kept");
      return root;
    }
    return lower(root, new LoopTranslator(builder));
  }

  private static Node lower(Node root, LoopTranslator translator) {
    return NodeTraversal.traversePostOrder(
        root,
        (t, n, parent) -> {
          if (n.isBlock()) {
            return lowerBlock(n, translator);
          }
          if (n.isLoop() && (parent == null || !parent.isBlock())) {
            Node lowered = translate(n, ImmutableList.of(), null, 0, translator);
            return lowered != null ? lowered : n;
          }
          return n;
        });
  }

  private static Node lowerBlock(Node block, LoopTranslator translator) {
    List<Node> stmts = new ArrayList<>(block.getChildren());
    for (int i = 0; i < stmts.size(); i++) {
      Node stmt = stmts.get(i);
      if (!stmt.isLoop()) {
        continue;
      }
      UsageSuffixIndex index = UsageSuffixIndex.build(stmts);
      Node lowered = translate(stmt, stmts.subList(0, i), index, i + 1, translator);
      if (lowered == null) {
        continue;
      }
      stmts.set(i, lowered);
      i = removeDeadInitializers(stmts, i, VariableUsageAnalyzer.referencedNames(stmt));
    }
    return block.withChildren(stmts);
  }

  private static @Nullable Node translate(
      Node loop,
      List<Node> preceding,
      @Nullable UsageSuffixIndex index,
      int followingIdx,
      LoopTranslator translator) {
    TypedNode typedLoop = loop.getTypedLoop();
    ImmutableSet<String> names = VariableUsageAnalyzer.referencedNames(loop);
    LoopContext.Builder context = LoopContext.builder();
    for (String name : names) {
      context.setInitialValue(name, initialValue(name, preceding));
      if (index != null && index.usedLater(followingIdx, name)) {
        context.addLiveAfterLoop(name);
      }
    }
    Node lowered = translator.translate(typedLoop, context.build());
    if (lowered == null) {
      logger.finer("Loop kept: " + typedLoop);
      return null;
    }
    // The builder may hand back nested loops of the body still wrapped.
    return lower(lowered, translator);
  }

  /**
   * Returns the value {@code name} holds before the loop: the literal bound to it by the last
   * preceding statement that binds it, or else the variable itself.
   */
  private static TypedNode initialValue(String name, List<Node> preceding) {
    int idx = findLastBinding(preceding, preceding.size(), name);
    if (idx < 0 || !NodeUtil.isSimpleBinding(preceding.get(idx))) {
      return TypedIR.local(name);
    }
    Node value = NodeUtil.getMatchValue(preceding.get(idx));
    if (value.isNumber()) {
      try {
        return TypedIR.intLiteral(Long.parseLong(value.getString()));
      } catch (NumberFormatException e) {
        return TypedIR.local(name);
      }
    }
    if (NodeUtil.isEmptyList(value)) {
      return TypedIR.arrayDecl();
    }
    return TypedIR.local(name);
  }

  /**
   * Drops the literal bindings before {@code loopIdx} of names the original loop read and that
   * nothing reads any more, either at all or before the lowered loop rebinds them. Returns the new
   * position of the loop.
   */
  private static int removeDeadInitializers(
      List<Node> stmts, int loopIdx, ImmutableSet<String> loopNames) {
    int current = loopIdx;
    for (String name : loopNames) {
      int bindingIdx = findLiteralBinding(stmts, current, name);
      if (bindingIdx < 0) {
        continue;
      }
      Node rest = IR.block(stmts.subList(bindingIdx + 1, stmts.size()));
      if (!VariableUsageAnalyzer.isReferenced(rest, name)
          || isOverwritten(stmts, bindingIdx, current, name)) {
        stmts.remove(bindingIdx);
        current--;
      }
    }
    return current;
  }

  /**
   * Whether the statement at {@code loopIdx} rebinds {@code name} without reading it and nothing
   * between it and the binding at {@code bindingIdx} reads it.
   */
  private static boolean isOverwritten(List<Node> stmts, int bindingIdx, int loopIdx, String name) {
    Node lowered = stmts.get(loopIdx);
    if (!NodeUtil.isSimpleBinding(lowered)
        || !NodeUtil.getBoundName(lowered).equals(name)
        || VariableUsageAnalyzer.isReferenced(NodeUtil.getMatchValue(lowered), name)) {
      return false;
    }
    Node between = IR.block(stmts.subList(bindingIdx + 1, loopIdx));
    return !VariableUsageAnalyzer.isReferenced(between, name);
  }

  private static int findLiteralBinding(List<Node> stmts, int before, String name) {
    int idx = findLastBinding(stmts, before, name);
    if (idx < 0 || !NodeUtil.isSimpleBinding(stmts.get(idx))) {
      return -1;
    }
    Node value = NodeUtil.getMatchValue(stmts.get(idx));
    return value.isLiteral() || NodeUtil.isEmptyList(value) ? idx : -1;
  }

  /** Returns the position of the last match before {@code before} that binds {@code name}. */
  private static int findLastBinding(List<Node> stmts, int before, String name) {
    for (int i = before - 1; i >= 0; i--) {
      Node stmt = stmts.get(i);
      if (stmt.isMatch() && NodeUtil.getPatternBinders(stmt.getPatterns()).contains(name)) {
        return i;
      }
    }
    return -1;
  }
}
