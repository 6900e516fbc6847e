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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.VarSymbol;
import com.google.gson.stream.JsonWriter;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Stores the mapping from nested functions to the module-level functions that replaced them, and
 * the variables each one now receives as extra parameters.
 */
public final class LiftedFunctionMap {

  public static final LiftedFunctionMap EMPTY = new LiftedFunctionMap(ImmutableList.of());

  /**
   * One lift.
   *
   * @param originalName the qualified name of the nested function, such as {@code outer$inner}
   * @param liftedName the name of the module-level function
   * @param captures the names of the captured variables, in parameter order
   */
  public record Entry(String originalName, String liftedName, ImmutableList<String> captures) {
    public Entry {
      checkNotNull(originalName);
      checkNotNull(liftedName);
      checkNotNull(captures);
    }
  }

  private final ImmutableList<Entry> entries;

  private LiftedFunctionMap(ImmutableList<Entry> entries) {
    this.entries = entries;
  }

  /** The lifts, in the order they were performed. */
  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Given the qualified name of a nested function, returns its lifted name, or null. */
  public @Nullable String lookupLiftedName(String originalName) {
    for (Entry entry : entries) {
      if (entry.originalName().equals(originalName)) {
        return entry.liftedName();
      }
    }
    return null;
  }

  /**
   * Serializes the map as a JSON array of objects with the keys {@code original}, {@code lifted}
   * and {@code captures}.
   */
  public String toJson() {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(out)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginArray();
      for (Entry entry : entries) {
        jsonWriter.beginObject();
        jsonWriter.name("original").value(entry.originalName());
        jsonWriter.name("lifted").value(entry.liftedName());
        jsonWriter.name("captures").beginArray();
        for (String capture : entry.captures()) {
          jsonWriter.value(capture);
        }
        jsonWriter.endArray();
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    } catch (IOException e) {
      // A StringWriter never throws IOException.
      throw new RuntimeException(e);
    }
    return out.toString();
  }

  /** Saves the JSON form of the map to a file. */
  public void save(String filename) throws IOException {
    Files.asCharSink(new File(filename), UTF_8).write(toJson());
  }

  @Override
  public String toString() {
    return entries.toString();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final ImmutableList.Builder<Entry> entries = ImmutableList.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    Builder add(FunctionSymbol original, FunctionSymbol lifted, List<VarSymbol> captures) {
      ImmutableList.Builder<String> names = ImmutableList.builder();
      for (VarSymbol var : captures) {
        names.add(var.getName());
      }
      entries.add(new Entry(original.getQualifiedName(), lifted.getName(), names.build()));
      return this;
    }

    LiftedFunctionMap build() {
      return new LiftedFunctionMap(entries.build());
    }
  }
}
