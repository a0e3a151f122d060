package dev.verity.concurrent;

import java.time.Duration;

/** An external collaborator call did not complete within its configured timeout. */
public class ExternalCallTimeoutException extends ExternalCallException {

  private final Duration timeout;

  public ExternalCallTimeoutException(String call, Duration timeout, Throwable cause) {
    super(call, "timed out after " + timeout.toMillis() + " ms", cause);
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
