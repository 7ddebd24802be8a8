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

package com.google.mlformat.syntax;

/** The closed set of syntax node kinds. */
public enum Token {
  FILE, // root of a source file, children are declarations
  OPEN, // open Some.Module
  LET, // pattern, parameters..., optional return TYPE, body
  SEQUENTIAL, // block of local bindings and expressions

  NAME, // identifier or long identifier, e.g. List.map
  NUMBER,
  STRING, // raw source text including quotes, may span lines
  CHAR,
  UNIT, // ()
  WILDCARD, // _

  TYPE, // type text in an annotation
  TYPED, // expr : type

  PAREN,
  TUPLE,
  LIST,
  ARRAY,
  RECORD,
  RECORD_FIELD, // NAME, expr

  APP, // function, arguments...
  INFIX, // lhs, rhs; the operator is the node's string
  DOT_GET, // expr.Name; the name is the node's string

  IF, // condition, then, optional else
  LAMBDA, // parameters..., body
  MATCH, // expr, clauses...
  MATCH_CLAUSE, // pattern, body

  // Placeholder left by error recovery in external front ends. It has no layout.
  FROM_PARSE_ERROR;

  /** Whether nodes of this kind carry their source text verbatim. */
  public boolean isLiteral() {
    switch (this) {
      case NAME:
      case NUMBER:
      case STRING:
      case CHAR:
      case WILDCARD:
      case TYPE:
        return true;
      default:
        return false;
    }
  }
}
