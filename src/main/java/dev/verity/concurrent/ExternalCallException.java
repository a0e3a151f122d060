package dev.verity.concurrent;

/**
 * A call to an external collaborator (embedding, search, rerank, generation, judgment) failed.
 *
 * <p>Never propagated to pipeline callers: {@link FanOut} catches it, substitutes the call's
 * conservative default and reports the call as {@linkplain CallOutcome#defaulted() defaulted}.
 */
public class ExternalCallException extends RuntimeException {

  private final String call;

  public ExternalCallException(String call, String message, Throwable cause) {
    super(call + ": " + message, cause);
    this.call = call;
  }

  public ExternalCallException(String call, String message) {
    super(call + ": " + message);
    this.call = call;
  }

  /** Name of the collaborator call that failed, e.g. {@code "vector-search"}. */
  public String call() {
    return call;
  }
}
