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
import static org.junit.Assert.assertThrows;

import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Node;
import com.google.fnlift.testing.ParsedModule;
import com.google.fnlift.testing.TestParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LiftedFormValidator}. */
@RunWith(JUnit4.class)
public final class LiftedFormValidatorTest {

  private final List<String> violations = new ArrayList<>();

  @Before
  public void setUp() {
    violations.clear();
  }

  private ParsedModule validate(String source) {
    ParsedModule module = TestParser.parse(source);
    validate(module);
    return module;
  }

  private void validate(ParsedModule module) {
    Compiler compiler = new Compiler(module.getSymbolTable());
    new LiftedFormValidator(compiler, (message, n) -> violations.add(message))
        .process(module.getRoot());
  }

  @Test
  public void testValidModule() {
    validate(
        """
        var g: int = 0;
        fn inc(ref r: int) {
          r = r + 1;
        }
        fn main(): int {
          var x: int = g;
          inc(x);
          return x;
        }
        """);
    assertThat(violations).isEmpty();
  }

  @Test
  public void testOutputOfLiftingIsValid() {
    ParsedModule module =
        TestParser.parse(
            """
            fn f(): int {
              var x: int = 1;
              fn g(): int {
                fn h(): int {
                  return x;
                }
                return h();
              }
              return g();
            }
            """);
    Compiler compiler = new Compiler(module.getSymbolTable());
    new LiftNestedFunctions(compiler).process(module.getRoot());

    validate(module);
    assertThat(violations).isEmpty();
  }

  @Test
  public void testNestedFunction() {
    validate(
        """
        fn f(): int {
          fn g(): int {
            return 1;
          }
          return g();
        }
        """);
    assertThat(violations).hasSize(2);
    assertThat(violations.get(0)).contains("still nested");
    // The call is to a function not defined at module level.
    assertThat(violations.get(1)).contains("not defined at module level");
  }

  @Test
  public void testFreeVariable() {
    validate(
        """
        fn f(): int {
          var x: int = 1;
          fn g(): int {
            return x;
          }
          return 0;
        }
        """);
    assertThat(violations).hasSize(2);
    assertThat(violations.get(0)).contains("is free in");
  }

  @Test
  public void testArgumentCountMismatch() {
    validate(
        """
        fn f(a: int) {}
        fn main() {
          f();
        }
        """);
    assertThat(violations).containsExactly("Call to f#0 passes 0 arguments for 1 parameters");
  }

  @Test
  public void testRefArgumentMustBeVariable() {
    validate(
        """
        fn f(ref a: int) {}
        fn main() {
          f(1);
        }
        """);
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0)).contains("is not a variable");
  }

  @Test
  public void testCallToReplacedFunction() {
    ParsedModule module =
        TestParser.parse(
            """
            fn f(): int {
              var x: int = 1;
              fn g(): int {
                return x;
              }
              return g();
            }
            """);
    Compiler compiler = new Compiler(module.getSymbolTable());
    new LiftNestedFunctions(compiler).process(module.getRoot());

    // Point the call back at the nested function the pass replaced.
    FunctionSymbol g = module.getFunction("f$g");
    Node f = module.getFunction("f").getDefinition();
    Node call = NodeUtil.getFunctionBody(f).getLastChild().getFirstChild();
    call.getFirstChild().setSymbol(g);

    validate(module);
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0)).contains("which was replaced by");
  }

  @Test
  public void testDefaultHandlerThrowsInternalError() {
    ParsedModule module =
        TestParser.parse(
            """
            fn f() {
              fn g() {}
            }
            """);
    Compiler compiler = new Compiler(module.getSymbolTable());
    LiftedFormValidator validator = new LiftedFormValidator(compiler);

    RuntimeException e =
        assertThrows(RuntimeException.class, () -> validator.process(module.getRoot()));
    assertThat(e).hasMessageThat().startsWith("INTERNAL COMPILER ERROR.");
    assertThat(e).hasMessageThat().contains("still nested");
  }
}
