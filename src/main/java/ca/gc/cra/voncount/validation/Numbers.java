package ca.gc.cra.voncount.validation;

/**
 * <strong>What:</strong> Numeric helpers used by the counting stream decorators.
 * <p><strong>Why:</strong> A running count that wraps past {@link Long#MAX_VALUE} would silently report
 * a negative total; overflow must fail loudly instead.
 * <p><strong>Role:</strong> Domain support utility invoked by infrastructure adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accumulate counts with overflow detection.</li>
 *   <li>Provide consistent error messaging naming the offending counter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Performance:</strong> Constant-time arithmetic.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link ArithmeticException} on overflow.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Adds {@code delta} to a running total, failing instead of wrapping around.
   *
   * @param name logical counter name included in diagnostics; defaults to {@code "count"} when blank
   * @param total current total
   * @param delta amount to add
   * @return {@code total + delta}
   * @throws IllegalArgumentException if {@code delta} is negative; running counts never decrease
   * @throws ArithmeticException if the sum cannot be represented as a {@code long}
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent use.</p>
   * <p><strong>Performance:</strong> Constant time; allocates only when throwing.</p>
   */
  public static long addExact(String name, long total, long delta) {
    String label = name == null || name.isBlank() ? "count" : name;
    if (delta < 0) {
      throw new IllegalArgumentException(label + " cannot decrease (delta was " + delta + ")");
    }
    try {
      return Math.addExact(total, delta);
    } catch (ArithmeticException ex) {
      throw new ArithmeticException(label + " overflowed adding " + delta + " to " + total);
    }
  }
}
