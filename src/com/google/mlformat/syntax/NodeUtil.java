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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Accessors for the children of multi-part nodes. */
public final class NodeUtil {

  private NodeUtil() {}

  public static Node getLetPattern(Node let) {
    checkArgument(let.isLet(), let);
    return let.getFirstChild();
  }

  public static Node getLetBody(Node let) {
    checkArgument(let.isLet(), let);
    return let.getLastChild();
  }

  public static @Nullable Node getLetReturnType(Node let) {
    checkArgument(let.isLet(), let);
    Node beforeBody = null;
    for (Node n = let.getFirstChild(); n.getNext() != null; n = n.getNext()) {
      beforeBody = n;
    }
    // The head pattern is never a type, so this can't mistake it for one.
    return beforeBody != null && beforeBody.isType() ? beforeBody : null;
  }

  public static ImmutableList<Node> getLetParameters(Node let) {
    checkArgument(let.isLet(), let);
    ImmutableList.Builder<Node> params = ImmutableList.builder();
    for (Node n = let.getSecondChild(); n != null && n.getNext() != null; n = n.getNext()) {
      if (!n.isType()) {
        params.add(n);
      }
    }
    return params.build();
  }

  public static ImmutableList<Node> getLambdaParameters(Node lambda) {
    checkArgument(lambda.isLambda(), lambda);
    ImmutableList.Builder<Node> params = ImmutableList.builder();
    for (Node n = lambda.getFirstChild(); n.getNext() != null; n = n.getNext()) {
      params.add(n);
    }
    return params.build();
  }

  public static Node getLambdaBody(Node lambda) {
    checkArgument(lambda.isLambda(), lambda);
    return lambda.getLastChild();
  }

  public static @Nullable Node getElse(Node ifNode) {
    checkArgument(ifNode.isIf(), ifNode);
    return ifNode.getChildAtIndex(1).getNext();
  }

  /** Whether {@code n} is an {@code if} sitting in the else slot of another {@code if}. */
  public static boolean isElif(Node n) {
    Node parent = n.getParent();
    return n.isIf() && parent != null && parent.isIf() && getElse(parent) == n;
  }

  /** Returns the number of nodes in the subtree rooted at {@code n}. */
  public static int countNodes(Node n) {
    int count = 1;
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      count += countNodes(c);
    }
    return count;
  }
}
