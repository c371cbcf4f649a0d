/**
 * <strong>Purpose:</strong> Domain ports shared by the counting stream decorators.
 * <p><strong>Pipeline role:</strong> Domain layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Ports impose no locking; implementations document their own contracts.</p>
 * <p><strong>Observability:</strong> Ports expose counts but do not prescribe how they are reported.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.voncount.application.port;
