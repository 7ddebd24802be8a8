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

import static com.google.common.base.Throwables.throwIfUnchecked;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Runs formatting work on threads with a larger stack. */
public final class FormatterExecutor {
  // Parsing and printing recurse once or more per level of nesting in the source.
  static final long FORMATTER_STACK_SIZE = 1 << 26; // About 64MB

  private FormatterExecutor() {}

  /** Returns a factory for daemon threads named {@code prefix-N} with the large stack. */
  static ThreadFactory threadFactory(String prefix) {
    AtomicInteger count = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        String name = prefix + "-" + count.incrementAndGet();
        Thread t = new Thread(null, r, name, FORMATTER_STACK_SIZE);
        t.setDaemon(true); // Do not prevent the JVM from exiting.
        return t;
      }
    };
  }

  /**
   * Calls {@code callable} on a fresh thread with the large stack and waits for it.
   *
   * <p>Unchecked exceptions thrown by {@code callable} are rethrown as they are; anything else is
   * wrapped in a {@link RuntimeException}.
   */
  public static <T> T runWithLargeStack(Callable<T> callable) {
    ExecutorService executor = Executors.newSingleThreadExecutor(threadFactory("mlformat"));
    try {
      Future<T> future = executor.submit(callable);
      return future.get();
    } catch (ExecutionException e) {
      throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } finally {
      executor.shutdown();
    }
  }
}
