package com.vitals.analytics.config;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Runs a task on the submitting thread when the ingest queue is full, and rejects it
 * once the pool is shut down so the caller can account for the lost sample.
 */
public class CallerRunsUnlessShutdownPolicy implements RejectedExecutionHandler {

  private final RejectedExecutionHandler callerRuns = new ThreadPoolExecutor.CallerRunsPolicy();

  @Override
  public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
    if (executor.isShutdown()) {
      throw new RejectedExecutionException("Ingest pool is shut down");
    }
    callerRuns.rejectedExecution(task, executor);
  }
}
