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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.SymbolTable;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) lifts the nested functions of a resolved module
 * to module level.
 */
public class Compiler extends AbstractCompiler {

  /**
   * Logger for the whole com.google.fnlift domain - setting configuration for this logger affects
   * all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("com.google.fnlift");

  private final SymbolTable symbolTable;
  private final CompilerOptions options;
  private LiftedFunctionMap liftedFunctionMap = LiftedFunctionMap.EMPTY;
  private int changeCount = 0;

  public Compiler(SymbolTable symbolTable, CompilerOptions options) {
    this.symbolTable = checkNotNull(symbolTable);
    this.options = checkNotNull(options);
  }

  public Compiler(SymbolTable symbolTable) {
    this(symbolTable, new CompilerOptions());
  }

  /** Sets the logging level for the com.google.fnlift package. */
  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
  }

  /**
   * Lifts the nested functions of {@code module} in place, then checks the result if {@link
   * CompilerOptions#shouldCheckLiftedInvariants} is set.
   */
  public void compile(Node module) {
    checkArgument(module.isModule(), "Expected MODULE but was %s", module.getToken());
    runPass("liftNestedFunctions", new LiftNestedFunctions(this), module);
    if (options.shouldCheckLiftedInvariants()) {
      runPass("liftedFormValidator", new LiftedFormValidator(this), module);
    }
    if (options.shouldPrintLiftedCode()) {
      logger.info("Lifted code:\n" + CodePrinter.print(module));
    }
  }

  private void runPass(String name, CompilerPass pass, Node root) {
    logger.fine("Running pass " + name);
    long start = System.currentTimeMillis();
    pass.process(root);
    logger.fine("Pass " + name + " took " + (System.currentTimeMillis() - start) + " ms");
  }

  @Override
  public SymbolTable getSymbolTable() {
    return symbolTable;
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  @Override
  public void reportCodeChange() {
    changeCount++;
  }

  /** Whether any pass changed the tree. */
  public boolean hasCodeChanged() {
    return changeCount > 0;
  }

  public int getChangeCount() {
    return changeCount;
  }

  @Override
  void setLiftedFunctionMap(LiftedFunctionMap map) {
    this.liftedFunctionMap = checkNotNull(map);
  }

  @Override
  public LiftedFunctionMap getLiftedFunctionMap() {
    return liftedFunctionMap;
  }

  /** Report an internal error. */
  @Override
  void throwInternalError(String message, @Nullable Throwable cause) {
    throw new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }
}
