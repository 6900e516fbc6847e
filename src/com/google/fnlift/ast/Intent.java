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

package com.google.fnlift.ast;

/** How an actual argument is bound to a formal parameter. */
public enum Intent {
  /** The formal is a fresh variable initialized with the value of the actual. */
  IN(""),
  /**
   * The formal is an alias of the actual, which must name a variable. Writes through the formal are
   * writes to that variable.
   */
  REF("ref");

  private final String keyword;

  Intent(String keyword) {
    this.keyword = keyword;
  }

  /** The keyword printed before the formal's name, empty for {@link #IN}. */
  public String getKeyword() {
    return keyword;
  }
}
