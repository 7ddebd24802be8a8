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

/**
 * A layout decision procedure: given the output so far, produce the output after this document.
 *
 * <p>Docs must be pure functions of their input context. Probes rely on this to cache and replay
 * the effect of a document.
 */
@FunctionalInterface
public interface Doc {
  Context apply(Context ctx);
}
