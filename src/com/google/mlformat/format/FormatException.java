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

package com.google.mlformat.format;

import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.Node;

/** Thrown when a tree cannot be printed. The whole file fails; no partial output is produced. */
@SuppressWarnings("serial")
public final class FormatException extends RuntimeException {
  private final DiagnosticType type;
  private final Node node;
  private final ImmutableList<String> arguments;

  public FormatException(DiagnosticType type, Node node, String... arguments) {
    super(type.format(arguments));
    this.type = type;
    this.node = node;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public DiagnosticType getType() {
    return type;
  }

  public Node getNode() {
    return node;
  }

  FormatError toError(String sourceName) {
    return FormatError.make(type, sourceName, node, arguments.toArray(new String[0]));
  }
}
