/**
 * <strong>Purpose:</strong> Arithmetic guards for running counts.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link ArithmeticException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.voncount.validation;
