/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.fnlift.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.fnlift.ast.Node;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Moves every function defined inside another function to module level.
 *
 * <p>A nested function may read and write variables of the functions enclosing it. After lifting,
 * it receives each such variable as an extra {@code ref} parameter instead, and every call of it
 * passes the variable along. So
 *
 * <pre>
 * fn outer(): int {
 *   var x: int = 1;
 *   fn inner() {
 *     x = x + 1;
 *   }
 *   inner();
 *   return x;
 * }
 * </pre>
 *
 * becomes
 *
 * <pre>
 * fn outer(): int {
 *   var x: int = 1;
 *   inner(x);
 *   return x;
 * }
 * fn inner(ref x: int) {
 *   x = x + 1;
 * }
 * </pre>
 *
 * <p>The pass first computes the capture set of every nested function (see {@link
 * CaptureAnalysis}), then rewrites the module in one post-order traversal: each call of a nested
 * function gets its extra actuals, and each nested definition is replaced by a module-level copy.
 * Calls visited before the definition of their target get their target fixed up once the traversal
 * is done (see {@link PendingCallTargets}).
 *
 * <p>Running the pass on its own output changes nothing.
 */
public final class LiftNestedFunctions implements CompilerPass {
  private static final Logger logger = Logger.getLogger(LiftNestedFunctions.class.getName());

  private final AbstractCompiler compiler;

  public LiftNestedFunctions(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  @Override
  public void process(Node root) {
    checkArgument(root.isModule(), root);

    CaptureSets captureSets = new CaptureAnalysis(compiler).analyze(root);
    if (captureSets.isEmpty()) {
      compiler.setLiftedFunctionMap(LiftedFunctionMap.EMPTY);
      return;
    }

    LiftedFunctionMap.Builder liftedFunctionMap = LiftedFunctionMap.builder();
    PendingCallTargets pendingCallTargets = new PendingCallTargets(compiler);
    Rewriter rewriter =
        new Rewriter(
            new FunctionLifter(compiler, captureSets, pendingCallTargets, liftedFunctionMap),
            new CallSiteRewriter(compiler, captureSets, pendingCallTargets));
    NodeTraversal.traverse(compiler, root, rewriter);

    if (pendingCallTargets.hasPendingCalls()) {
      pendingCallTargets.resolve(root);
    }

    LiftedFunctionMap result = liftedFunctionMap.build();
    compiler.setLiftedFunctionMap(result);
    logger.info(
        "Lifted "
            + result.getEntries().size()
            + " nested functions; capture analysis took "
            + captureSets.getRoundCount()
            + " rounds");
  }

  /** Rewrites calls and lifts definitions in one post-order traversal. */
  private static final class Rewriter implements NodeTraversal.Callback {
    private final FunctionLifter lifter;
    private final CallSiteRewriter callSiteRewriter;

    /** Module-level copies appended during the traversal. They are already rewritten. */
    private final Set<Node> liftedDefinitions =
        Collections.newSetFromMap(new IdentityHashMap<>());

    Rewriter(FunctionLifter lifter, CallSiteRewriter callSiteRewriter) {
      this.lifter = lifter;
      this.callSiteRewriter = callSiteRewriter;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return !liftedDefinitions.contains(n);
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case CALL:
          callSiteRewriter.rewrite(n);
          break;
        case FUNCTION:
          if (NodeUtil.isNestedFunctionDefinition(n)) {
            liftedDefinitions.add(lifter.lift(n));
          }
          break;
        default:
          break;
      }
    }
  }
}
