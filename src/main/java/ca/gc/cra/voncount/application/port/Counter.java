package ca.gc.cra.voncount.application.port;

/**
 * <strong>What:</strong> Port describing anything that keeps a running count.
 * <p><strong>Why:</strong> Lets callers read progress from a decorated stream without knowing which
 * decorator, or which direction, produced it.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code ReadCounter} and {@code WriteCounter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report the number of units processed so far; what a unit is belongs to the implementation.</li>
 *   <li>Never report a value lower than a previously reported one.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not required; implementations document their own guarantees.</p>
 * <p><strong>Performance:</strong> Reading the count must be O(1) and allocation free.</p>
 * <p><strong>Observability:</strong> The count itself is the observation; no metrics or logs are emitted.</p>
 *
 * @since 0.1.0
 */
public interface Counter {
  /**
   * Returns the current count of units processed.
   *
   * @return non-negative count; {@code 0} before the first successful operation
   *
   * <p><strong>Concurrency:</strong> Reads the implementation's current state without synchronization.</p>
   * <p><strong>Performance:</strong> Constant time.</p>
   */
  long count();
}
