package dev.verity.concurrent;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Task group for external collaborator calls: spawn independent calls, give each its own timeout,
 * substitute a conservative default for any call that fails or times out, and join them all before
 * the next stage starts.
 *
 * <p>A submitted call never completes exceptionally. Callers always observe a {@link CallOutcome},
 * and {@link #joinAll(List)} returns only once every call has either completed or defaulted, so a
 * downstream stage never sees a partial fan-in.
 *
 * <p>A timed-out call is abandoned, not interrupted: its thread finishes in the background and the
 * late result is discarded.
 *
 * <p>A call the executor rejects is defaulted at once. It never runs on the submitting thread,
 * where it would escape its timeout.
 */
@Component
public class FanOut {

  private static final Logger log = LoggerFactory.getLogger(FanOut.class);

  private final Executor executor;

  public FanOut(@Qualifier("pipelineExecutor") Executor executor) {
    this.executor = executor;
  }

  /**
   * Starts an external call.
   *
   * @param name call name for logs, e.g. {@code "keyword-search"}
   * @param call the collaborator invocation
   * @param timeout upper bound on the call's duration
   * @param fallback conservative value used if the call fails or times out
   * @return a future that always completes normally
   */
  public <T> CompletableFuture<CallOutcome<T>> submit(
      String name, Supplier<T> call, Duration timeout, T fallback) {
    CompletableFuture<T> started;
    try {
      started = CompletableFuture.supplyAsync(call, executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(
          substitute(name, fallback, new ExternalCallException(name, "executor saturated", e)));
    }
    return started
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (value, error) -> {
              if (error == null) {
                if (value == null) {
                  return substitute(
                      name, fallback, new ExternalCallException(name, "returned no value"));
                }
                return CallOutcome.ofValue(name, value);
              }
              return substitute(name, fallback, classify(name, timeout, error));
            });
  }

  /**
   * Runs a single call and waits for it. Equivalent to submitting one task and joining it.
   *
   * @return the call's outcome; never throws for collaborator failures
   */
  public <T> CallOutcome<T> call(String name, Supplier<T> call, Duration timeout, T fallback) {
    return submit(name, call, timeout, fallback).join();
  }

  /**
   * Waits for every submitted call. The futures never complete exceptionally, so this returns the
   * outcomes in submission order once all have settled.
   */
  public static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private static <T> CallOutcome<T> substitute(
      String name, T fallback, ExternalCallException failure) {
    log.warn("External call defaulted to conservative value: {}", failure.getMessage());
    return CallOutcome.ofDefault(name, fallback, failure);
  }

  private static ExternalCallException classify(String name, Duration timeout, Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
    if (cause instanceof TimeoutException) {
      return new ExternalCallTimeoutException(name, timeout, cause);
    }
    if (cause instanceof ExternalCallException external) {
      return external;
    }
    return new ExternalCallException(
        name, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
  }
}
