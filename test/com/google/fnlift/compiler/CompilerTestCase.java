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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.fnlift.ast.Node;
import com.google.fnlift.testing.ParsedModule;
import com.google.fnlift.testing.TestParser;
import org.jspecify.annotations.Nullable;
import org.junit.Before;

/**
 * Base class for testing passes over source written in the test language of {@link TestParser}.
 * Inputs are parsed, processed, checked with {@link LiftedFormValidator} if validation is enabled,
 * and printed with {@link CodePrinter}. Expected outputs are parsed and printed the same way, so
 * they only need to match up to formatting.
 */
public abstract class CompilerTestCase {

  /** Whether the output should be checked with {@link LiftedFormValidator}. */
  private boolean validateLiftedForm;

  private @Nullable Compiler lastCompiler;
  private @Nullable ParsedModule lastModule;

  @Before
  public void setUp() throws Exception {
    validateLiftedForm = true;
    lastCompiler = null;
    lastModule = null;
  }

  /** Gets the pass to be tested. */
  protected abstract CompilerPass getProcessor(Compiler compiler);

  /** Gets the compiler options to be used by the test. Subclasses may override. */
  protected CompilerOptions getOptions() {
    return new CompilerOptions();
  }

  protected final void disableLiftedFormValidation() {
    validateLiftedForm = false;
  }

  protected Compiler getLastCompiler() {
    return lastCompiler;
  }

  protected ParsedModule getLastModule() {
    return lastModule;
  }

  /** Parses {@code source} and runs the pass on it. Returns the processed root. */
  protected Node process(String source) {
    lastModule = TestParser.parse(source);
    lastCompiler = new Compiler(lastModule.getSymbolTable(), getOptions());
    Node root = lastModule.getRoot();
    getProcessor(lastCompiler).process(root);
    if (validateLiftedForm) {
      new LiftedFormValidator(lastCompiler).process(root);
    }
    return root;
  }

  /** Verifies that the pass turns {@code js} into {@code expected}. */
  protected void test(String js, String expected) {
    Node root = process(js);
    String expectedSource = CodePrinter.print(TestParser.parse(expected).getRoot());
    assertWithMessage("Unexpected output for input:\n%s", js)
        .that(CodePrinter.print(root))
        .isEqualTo(expectedSource);
  }

  /** Verifies that the pass leaves {@code js} alone and reports no change. */
  protected void testSame(String js) {
    test(js, js);
    assertThat(lastCompiler.hasCodeChanged()).isFalse();
  }
}
