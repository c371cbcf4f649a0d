/**
 * Counting decorators for {@link java.io.InputStream} and {@link java.io.OutputStream}.
 * <p><strong>Role:</strong> Infrastructure adapters implementing the {@code Counter} port over JDK streams.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; callers own exclusive use of the wrapped stream.</p>
 * <p><strong>Performance:</strong> Pure delegation; no buffering or copying.</p>
 * <p><strong>Observability:</strong> Failed delegated calls are logged at DEBUG before being rethrown.</p>
 */
package ca.gc.cra.voncount.infrastructure.io;
