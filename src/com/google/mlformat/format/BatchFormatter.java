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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formats many files on a pool of worker threads.
 *
 * <p>Each file is formatted independently. A file that fails, even with an unexpected exception,
 * gets a failed {@link FormatResult} and does not affect the others. Errors and warnings are
 * logged as they are collected, followed by a summary.
 */
public final class BatchFormatter {

  static final DiagnosticType MLF_INTERNAL_ERROR =
      DiagnosticType.error("MLF_INTERNAL_ERROR", "Internal error while formatting: {0}");

  private static final Logger logger = Logger.getLogger(BatchFormatter.class.getName());

  private final FormatOptions options;
  private final int threadCount;
  private final boolean validate;

  /**
   * @param threadCount the number of worker threads
   * @param validate whether to parse each output again and compare it with its input
   */
  public BatchFormatter(FormatOptions options, int threadCount, boolean validate) {
    checkArgument(threadCount > 0, "threadCount must be positive, was %s", threadCount);
    this.options = options;
    this.threadCount = threadCount;
    this.validate = validate;
  }

  /** Formats each source, keyed by its name. Results are in the iteration order of the map. */
  public ImmutableList<FormatResult> formatAll(Map<String, String> sources) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            threadCount, FormatterExecutor.threadFactory("mlformat-batch"));
    ImmutableList.Builder<FormatResult> results = ImmutableList.builder();
    try {
      List<Future<FormatResult>> futures = new ArrayList<>();
      for (Map.Entry<String, String> source : sources.entrySet()) {
        futures.add(executor.submit(() -> formatOne(source.getKey(), source.getValue())));
      }
      int i = 0;
      for (Map.Entry<String, String> source : sources.entrySet()) {
        results.add(await(futures.get(i++), source.getKey(), source.getValue()));
      }
    } finally {
      executor.shutdown();
    }
    ImmutableList<FormatResult> all = results.build();
    report(all);
    return all;
  }

  private FormatResult formatOne(String sourceName, String source) {
    try {
      FormatResult result = CodeFormatter.format(sourceName, source, options);
      if (validate && result.isSuccess()) {
        for (FormatError error :
            FormatValidator.validate(sourceName, source, result.getFormattedSource())) {
          result = result.withError(error);
        }
      }
      return result;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Unexpected failure formatting " + sourceName, e);
      return internalError(sourceName, source, e);
    }
  }

  private static FormatResult await(Future<FormatResult> future, String sourceName, String source) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      // Errors such as a stack overflow escape formatOne.
      logger.log(Level.SEVERE, "Unexpected failure formatting " + sourceName, e.getCause());
      return internalError(sourceName, source, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  private static FormatResult internalError(String sourceName, String source, Throwable t) {
    return FormatResult.failure(
        sourceName, source, FormatError.make(MLF_INTERNAL_ERROR, sourceName, t.toString()));
  }

  private static void report(List<FormatResult> results) {
    int changed = 0;
    int failed = 0;
    for (FormatResult result : results) {
      for (FormatError error : result.getErrors()) {
        logger.severe(error.toString());
      }
      for (FormatError warning : result.getWarnings()) {
        logger.warning(warning.toString());
      }
      if (!result.isSuccess()) {
        failed++;
      } else if (result.isChanged()) {
        changed++;
      }
    }
    Level level = failed == 0 ? Level.INFO : Level.WARNING;
    logger.log(
        level,
        "{0} file(s) formatted, {1} changed, {2} failed",
        new Object[] {results.size(), changed, failed});
  }
}
